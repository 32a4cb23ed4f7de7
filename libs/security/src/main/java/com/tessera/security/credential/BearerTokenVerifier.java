package com.tessera.security.credential;

import com.tessera.security.error.AuthenticationException;
import com.tessera.security.ratelimit.RateLimitTier;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Verifies signed bearer tokens and maps their claims to a {@link Principal}.
 * <p>
 * Required claims: {@code sub} (principal id) and {@code tenant_id}. Roles are read from a flat
 * {@code roles} array and from {@code realm_access.roles} as issued by Keycloak; the union is kept
 * in claim order. An optional {@code rate_limit_tier} claim selects the caller's tier.
 */
public final class BearerTokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(BearerTokenVerifier.class);

    static final String CLAIM_TENANT_ID = "tenant_id";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_REALM_ACCESS = "realm_access";
    static final String CLAIM_RATE_LIMIT_TIER = "rate_limit_tier";

    private final JwtParser parser;

    /**
     * @param keys      locates the verification key by {@code kid}
     * @param clock     time source for expiry checks
     * @param clockSkew tolerated difference between issuer and local clocks
     * @param issuer    expected {@code iss} claim, or null to accept any issuer
     */
    public BearerTokenVerifier(SigningKeyResolver keys, Clock clock, Duration clockSkew, String issuer) {
        if (keys == null || clock == null) {
            throw new IllegalArgumentException("keys and clock are required");
        }
        JwtParserBuilder builder = Jwts.parser()
                .keyLocator(keys)
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(clockSkew == null ? 0 : clockSkew.toSeconds());
        if (issuer != null && !issuer.isBlank()) {
            builder.requireIssuer(issuer);
        }
        this.parser = builder.build();
    }

    /**
     * @throws AuthenticationException {@code token_expired} or {@code invalid_token}
     */
    public Principal verify(String token) {
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            log.debug("Rejected expired token for subject {}", e.getClaims().getSubject());
            throw AuthenticationException.tokenExpired(e);
        } catch (SigningKeyException e) {
            log.warn("Signing key unavailable: {}", e.getMessage());
            throw AuthenticationException.invalidToken("signing key not available", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw AuthenticationException.invalidToken(e.getClass().getSimpleName(), e);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw AuthenticationException.invalidToken("missing sub claim", null);
        }
        Object tenantId = claims.get(CLAIM_TENANT_ID);
        if (!(tenantId instanceof String tenant) || tenant.isBlank()) {
            throw AuthenticationException.invalidToken("missing tenant_id claim", null);
        }

        RateLimitTier tier = claims.get(CLAIM_RATE_LIMIT_TIER) instanceof String value
                ? RateLimitTier.fromString(value).orElse(RateLimitTier.DEFAULT)
                : RateLimitTier.DEFAULT;
        return new Principal(subject, tenant, PrincipalType.USER, roles(claims), Set.of(), null, tier);
    }

    static List<String> roles(Claims claims) {
        Set<String> roles = new LinkedHashSet<>();
        addStrings(roles, claims.get(CLAIM_ROLES));
        if (claims.get(CLAIM_REALM_ACCESS) instanceof Map<?, ?> realmAccess) {
            addStrings(roles, realmAccess.get(CLAIM_ROLES));
        }
        return new ArrayList<>(roles);
    }

    private static void addStrings(Set<String> target, Object claim) {
        if (claim instanceof Collection<?> values) {
            for (Object value : values) {
                if (value instanceof String s && !s.isBlank()) {
                    target.add(s);
                }
            }
        }
    }
}
