package com.tessera.controlplane.api;

import com.tessera.security.apikey.ApiKey;
import com.tessera.security.apikey.ApiKeyLifecycleManager;
import com.tessera.security.apikey.GenerateApiKeyCommand;
import com.tessera.security.apikey.IssuedApiKey;
import com.tessera.security.apikey.RotationResult;
import com.tessera.security.error.ValidationException;
import com.tessera.security.permission.Permission;
import com.tessera.security.ratelimit.RateLimitTier;
import com.tessera.security.tenant.TenantScope;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * API keys of the caller's tenant.
 *
 * <p>The plaintext key appears in exactly two responses: the one that creates it and the one that
 * rotates it. Every other response shows the display prefix only.
 */
@RestController
@RequestMapping("/api/v1/api-keys")
public class ApiKeyController {

    static final Permission READ = Permission.of("api_keys", "read");
    static final Permission CREATE = Permission.of("api_keys", "create");
    static final Permission ROTATE = Permission.of("api_keys", "rotate");
    static final Permission REVOKE = Permission.of("api_keys", "revoke");

    private final ApiKeyLifecycleManager apiKeys;
    private final EndpointAccess access;
    private final Clock clock;

    public ApiKeyController(ApiKeyLifecycleManager apiKeys, EndpointAccess access, Clock clock) {
        this.apiKeys = apiKeys;
        this.access = access;
        this.clock = clock;
    }

    @GetMapping
    public List<ApiKeyView> list(
            @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        TenantScope scope = access.require(READ);
        Instant now = clock.instant();
        return apiKeys.list(scope.tenantId(), includeInactive).stream()
                .map(key -> ApiKeyView.of(key, now))
                .toList();
    }

    @GetMapping("/{keyId}")
    public ApiKeyView get(@PathVariable String keyId) {
        TenantScope scope = access.require(READ, keyId);
        return ApiKeyView.of(apiKeys.get(scope.tenantId(), keyId), clock.instant());
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public IssuedApiKeyView create(@Valid @RequestBody CreateApiKeyRequest body, HttpServletRequest request) {
        TenantScope scope = access.requireManagement(CREATE, null);
        RateLimitTier tier = body.rateLimitTier() == null
                ? RateLimitTier.DEFAULT
                : RateLimitTier.fromString(body.rateLimitTier())
                        .orElseThrow(() -> new ValidationException(
                                "unknown rate limit tier: " + body.rateLimitTier(),
                                Map.of("rate_limit_tier", body.rateLimitTier())));
        GenerateApiKeyCommand command = new GenerateApiKeyCommand(
                scope.tenantId(),
                body.name(),
                body.scopes(),
                tier,
                body.expiresInDays() == null ? null : Duration.ofDays(body.expiresInDays()));
        IssuedApiKey issued = apiKeys.generate(command, EndpointAccess.actor(scope, request));
        return IssuedApiKeyView.of(issued, clock.instant());
    }

    @PostMapping("/{keyId}/rotate")
    public RotationView rotate(
            @PathVariable String keyId,
            @Valid @RequestBody(required = false) RotateApiKeyRequest body,
            HttpServletRequest request) {
        TenantScope scope = access.requireManagement(ROTATE, keyId);
        Duration grace = body == null || body.graceSeconds() == null ? null : Duration.ofSeconds(body.graceSeconds());
        RotationResult result = apiKeys.rotate(scope.tenantId(), keyId, grace, EndpointAccess.actor(scope, request));
        Instant now = clock.instant();
        return new RotationView(
                IssuedApiKeyView.of(result.replacement(), now), ApiKeyView.of(result.previous(), now));
    }

    @PostMapping("/{keyId}/revoke")
    public ApiKeyView revoke(
            @PathVariable String keyId,
            @RequestBody(required = false) RevokeApiKeyRequest body,
            HttpServletRequest request) {
        TenantScope scope = access.requireManagement(REVOKE, keyId);
        String reason = body == null ? null : body.reason();
        ApiKey revoked = apiKeys.revoke(scope.tenantId(), keyId, EndpointAccess.actor(scope, request), reason);
        return ApiKeyView.of(revoked, clock.instant());
    }

    public record CreateApiKeyRequest(
            @NotBlank @Size(max = 100) String name,
            Set<String> scopes,
            String rateLimitTier,
            @Positive Long expiresInDays) {}

    public record RotateApiKeyRequest(@PositiveOrZero Long graceSeconds) {}

    public record RevokeApiKeyRequest(@Size(max = 500) String reason) {}

    public record ApiKeyView(
            String id,
            String name,
            String prefix,
            List<String> scopes,
            String rateLimitTier,
            boolean active,
            Instant createdAt,
            String createdBy,
            Instant expiresAt,
            Instant revokedAt,
            Instant lastUsedAt,
            long usageCount) {

        static ApiKeyView of(ApiKey key, Instant now) {
            return new ApiKeyView(
                    key.id(),
                    key.name(),
                    key.prefix(),
                    key.scopes().stream().sorted().toList(),
                    key.tier().value(),
                    key.isActiveAt(now),
                    key.createdAt(),
                    key.createdBy(),
                    key.expiresAt(),
                    key.revokedAt(),
                    key.lastUsedAt(),
                    key.usageCount());
        }
    }

    /**
     * @param key the plaintext key; shown once
     */
    public record IssuedApiKeyView(ApiKeyView apiKey, String key) {

        static IssuedApiKeyView of(IssuedApiKey issued, Instant now) {
            return new IssuedApiKeyView(ApiKeyView.of(issued.key(), now), issued.plaintext());
        }
    }

    public record RotationView(IssuedApiKeyView replacement, ApiKeyView previous) {}
}
