package com.tessera.security.tenant;

import java.util.Optional;

/**
 * Tenant lifecycle status. Only {@link #SUSPENDED} and {@link #DELETED} tenants are refused;
 * a {@link #PENDING} tenant can already be used while onboarding completes.
 */
public enum TenantStatus {

    PENDING("pending"),
    ACTIVE("active"),
    SUSPENDED("suspended"),
    DELETED("deleted");

    private final String value;

    TenantStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean acceptsRequests() {
        return this == PENDING || this == ACTIVE;
    }

    public static Optional<TenantStatus> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TenantStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
