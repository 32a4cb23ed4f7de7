package com.tessera.security.tenant;

import java.util.Optional;

/**
 * Subscription tier of a tenant and the quotas that come with it.
 */
public enum TenantTier {

    FREE("free", 3, 1, 5, 100),
    STARTER("starter", 10, 5, 20, 1_000),
    PRO("pro", 50, 20, 100, 10_000),
    ENTERPRISE("enterprise", 500, 100, 500, 100_000);

    private final String value;
    private final int maxUsers;
    private final int maxProjects;
    private final int maxApiKeys;
    private final int maxSessionsPerMonth;

    TenantTier(String value, int maxUsers, int maxProjects, int maxApiKeys, int maxSessionsPerMonth) {
        this.value = value;
        this.maxUsers = maxUsers;
        this.maxProjects = maxProjects;
        this.maxApiKeys = maxApiKeys;
        this.maxSessionsPerMonth = maxSessionsPerMonth;
    }

    public String value() {
        return value;
    }

    public int maxUsers() {
        return maxUsers;
    }

    public int maxProjects() {
        return maxProjects;
    }

    /** Maximum number of simultaneously active (neither revoked nor expired) API keys. */
    public int maxApiKeys() {
        return maxApiKeys;
    }

    public int maxSessionsPerMonth() {
        return maxSessionsPerMonth;
    }

    public static Optional<TenantTier> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TenantTier tier : values()) {
            if (tier.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
