package com.tessera.security.ratelimit;

import com.tessera.security.credential.Principal;

/**
 * Who a request is counted against: the API key if the caller used one, otherwise the user,
 * otherwise the client address.
 *
 * @param key  bucket key, namespaced by subject kind
 * @param tier the tier whose policy applies
 */
public record RateLimitSubject(String key, RateLimitTier tier) {

    public RateLimitSubject {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be null or blank");
        }
        tier = tier == null ? RateLimitTier.DEFAULT : tier;
    }

    /**
     * @param principal the authenticated caller, or null for anonymous requests
     * @param clientIp  caller address, used when there is no principal
     */
    public static RateLimitSubject of(Principal principal, String clientIp) {
        if (principal != null && principal.apiKeyId() != null) {
            return new RateLimitSubject("apikey:" + principal.apiKeyId(), principal.tier());
        }
        if (principal != null) {
            return new RateLimitSubject("user:" + principal.tenantId() + ":" + principal.id(), principal.tier());
        }
        return new RateLimitSubject("ip:" + (clientIp == null || clientIp.isBlank() ? "unknown" : clientIp),
                RateLimitTier.DEFAULT);
    }
}
