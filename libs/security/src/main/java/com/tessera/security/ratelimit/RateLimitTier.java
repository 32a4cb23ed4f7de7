package com.tessera.security.ratelimit;

import java.util.Optional;

/**
 * Rate-limit tiers a subject can be assigned to. The actual numbers per tier are configuration,
 * see {@link RateLimitPolicies}.
 */
public enum RateLimitTier {

    DEFAULT("default"),
    ELEVATED("elevated"),
    UNLIMITED("unlimited");

    private final String value;

    RateLimitTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<RateLimitTier> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (RateLimitTier tier : values()) {
            if (tier.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
