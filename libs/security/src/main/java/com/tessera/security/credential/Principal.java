package com.tessera.security.credential;

import com.tessera.security.ratelimit.RateLimitTier;

import java.util.List;
import java.util.Set;

/**
 * An authenticated caller, bound to exactly one tenant.
 *
 * @param id       user id, or the API key id for {@link PrincipalType#API_KEY}
 * @param tenantId the tenant the credential belongs to; never null
 * @param type     kind of caller
 * @param roles    role claims in claim order; stored role assignments are added later by the
 *                 permission resolver
 * @param scopes   API key scopes (empty for users)
 * @param apiKeyId the API key id, or null for users
 * @param tier     rate-limit tier for this caller
 */
public record Principal(
        String id,
        String tenantId,
        PrincipalType type,
        List<String> roles,
        Set<String> scopes,
        String apiKeyId,
        RateLimitTier tier
) {

    /** Scope that implies every other scope. */
    public static final String ADMIN_SCOPE = "admin";

    /** Role claim of platform administrators, the only callers allowed to act across tenants. */
    public static final String PLATFORM_ADMIN_ROLE = "saas_admin";

    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (type == PrincipalType.API_KEY && (apiKeyId == null || apiKeyId.isBlank())) {
            throw new IllegalArgumentException("apiKeyId is required for API key principals");
        }
        roles = roles == null ? List.of() : List.copyOf(roles);
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        tier = tier == null ? RateLimitTier.DEFAULT : tier;
    }

    public static Principal user(String userId, String tenantId, List<String> roles) {
        return new Principal(userId, tenantId, PrincipalType.USER, roles, Set.of(), null, RateLimitTier.DEFAULT);
    }

    public static Principal apiKey(String keyId, String tenantId, List<String> roles, Set<String> scopes,
                                   RateLimitTier tier) {
        return new Principal(keyId, tenantId, PrincipalType.API_KEY, roles, scopes, keyId, tier);
    }

    public boolean isApiKey() {
        return type == PrincipalType.API_KEY;
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    /**
     * Platform administration comes from the credential's role claims only. Tenants cannot grant
     * it through role assignments or permission overrides.
     */
    public boolean isPlatformAdmin() {
        return roles.contains(PLATFORM_ADMIN_ROLE);
    }

    /**
     * Users are not restricted by scopes; API keys need the scope or {@value #ADMIN_SCOPE}.
     */
    public boolean hasScope(String scope) {
        return !isApiKey() || scopes.contains(ADMIN_SCOPE) || scopes.contains(scope);
    }
}
