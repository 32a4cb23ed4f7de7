package com.tessera.security.credential;

import com.tessera.observability.MetricFactory;
import com.tessera.security.apikey.ApiKey;
import com.tessera.security.apikey.ApiKeyLifecycleManager;
import com.tessera.security.apikey.ApiKeyScope;
import com.tessera.security.error.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a raw credential into a {@link Principal}.
 * <p>
 * A credential with exactly two {@code '.'} separators is treated as a signed bearer token;
 * anything else as an API key. Every failure is an {@link AuthenticationException} with its own
 * error code. Attempts are counted per method and outcome.
 */
public final class CredentialValidator {

    private static final Logger log = LoggerFactory.getLogger(CredentialValidator.class);

    static final String METRIC_AUTH = "tessera.auth.attempts";

    private final BearerTokenVerifier tokens;
    private final ApiKeyLifecycleManager apiKeys;
    private final MetricFactory metrics;

    public CredentialValidator(BearerTokenVerifier tokens, ApiKeyLifecycleManager apiKeys, MetricFactory metrics) {
        if (tokens == null || apiKeys == null || metrics == null) {
            throw new IllegalArgumentException("tokens, apiKeys and metrics are required");
        }
        this.tokens = tokens;
        this.apiKeys = apiKeys;
        this.metrics = metrics;
    }

    /**
     * @param credential raw credential, without any scheme prefix
     * @param clientIp   caller address, recorded as API key usage
     * @throws AuthenticationException when the credential is missing or rejected
     */
    public Principal validate(String credential, String clientIp) {
        if (credential == null || credential.isBlank()) {
            metrics.counter(METRIC_AUTH, "Authentication attempts", "method", "none", "outcome", "missing")
                    .increment();
            throw AuthenticationException.credentialRequired();
        }
        String trimmed = credential.strip();
        boolean bearer = isBearerToken(trimmed);
        String method = bearer ? "bearer" : "api_key";
        try {
            Principal principal = bearer ? tokens.verify(trimmed) : fromApiKey(apiKeys.authenticate(trimmed, clientIp));
            metrics.counter(METRIC_AUTH, "Authentication attempts", "method", method, "outcome", "success")
                    .increment();
            log.debug("Authenticated {} {} for tenant {}", principal.type().value(), principal.id(),
                    principal.tenantId());
            return principal;
        } catch (AuthenticationException e) {
            metrics.counter(METRIC_AUTH, "Authentication attempts", "method", method,
                    "outcome", e.errorCode().code()).increment();
            throw e;
        }
    }

    /**
     * Structural check only: a JWS in compact form has three segments.
     */
    static boolean isBearerToken(String credential) {
        return credential.chars().filter(c -> c == '.').count() == 2;
    }

    /**
     * API key principals get one role per scope, see {@link ApiKeyScope#impliedRole()}.
     */
    static Principal fromApiKey(ApiKey key) {
        Set<String> roles = new LinkedHashSet<>();
        for (String scope : new TreeSet<>(key.scopes())) {
            Optional<ApiKeyScope> known = ApiKeyScope.fromString(scope);
            known.ifPresent(s -> roles.add(s.impliedRole()));
        }
        return Principal.apiKey(key.id(), key.tenantId(), List.copyOf(roles), key.scopes(), key.tier());
    }
}
