package com.tessera.security.ratelimit;

import java.util.EnumMap;
import java.util.Map;

/**
 * The policy for every {@link RateLimitTier}. Tiers that are not configured keep their defaults:
 * 60 requests per minute with a burst of 60 for {@link RateLimitTier#DEFAULT}, 120/120 for
 * {@link RateLimitTier#ELEVATED}, no limit for {@link RateLimitTier#UNLIMITED}.
 */
public final class RateLimitPolicies {

    private final Map<RateLimitTier, RateLimitPolicy> policies;

    private RateLimitPolicies(Map<RateLimitTier, RateLimitPolicy> policies) {
        this.policies = policies;
    }

    public static RateLimitPolicies defaults() {
        return of(Map.of());
    }

    public static RateLimitPolicies of(Map<RateLimitTier, RateLimitPolicy> overrides) {
        Map<RateLimitTier, RateLimitPolicy> policies = new EnumMap<>(RateLimitTier.class);
        policies.put(RateLimitTier.DEFAULT, RateLimitPolicy.perMinute(60, 60));
        policies.put(RateLimitTier.ELEVATED, RateLimitPolicy.perMinute(120, 120));
        policies.put(RateLimitTier.UNLIMITED, RateLimitPolicy.unlimited());
        policies.putAll(overrides);
        return new RateLimitPolicies(policies);
    }

    public RateLimitPolicy forTier(RateLimitTier tier) {
        return policies.get(tier == null ? RateLimitTier.DEFAULT : tier);
    }
}
