package com.tessera.security.permission;

import java.util.Optional;

/**
 * Roles known to the permission matrix. Role names travel as their lowercase value in token
 * claims, role assignments and overrides.
 */
public enum PlatformRole {

    /** Platform operator; the only role allowed to act across tenants. Granted by token claims only. */
    SAAS_ADMIN("saas_admin"),
    TENANT_ADMIN("tenant_admin"),
    AGENT_ADMIN("agent_admin"),
    SUPERVISOR("supervisor"),
    OPERATOR("operator"),
    AGENT_USER("agent_user"),
    VIEWER("viewer"),
    BILLING_ADMIN("billing_admin");

    private final String value;

    PlatformRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Whether a tenant may grant this role through a role assignment or change its permissions
     * through an override.
     */
    public boolean tenantManaged() {
        return this != SAAS_ADMIN;
    }

    public static Optional<PlatformRole> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PlatformRole role : values()) {
            if (role.value.equals(value.trim().toLowerCase())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }

    /**
     * True for known roles that tenants cannot grant or change; role names outside the enum are
     * tenant-defined and return false.
     */
    public static boolean isPlatformOnly(String value) {
        return fromString(value).map(role -> !role.tenantManaged()).orElse(false);
    }
}
