package com.tessera.security.audit;

import java.util.Optional;

/**
 * What an audit entry records.
 */
public enum AuditAction {

    CREATE("create"),
    UPDATE("update"),
    DELETE("delete"),
    LOGIN("login"),
    API_CALL("api_call"),
    PERMISSION_CHANGE("permission_change"),
    PERMISSION_DENIED("permission_denied"),
    SETTINGS_CHANGE("settings_change"),
    TENANT_SUSPENDED("tenant_suspended"),
    TENANT_ACTIVATED("tenant_activated"),
    KEY_CREATED("key_created"),
    KEY_REVOKED("key_revoked"),
    KEY_ROTATED("key_rotated"),
    CROSS_TENANT_READ("cross_tenant_read"),
    REQUEST_ABANDONED("request_abandoned");

    private final String value;

    AuditAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<AuditAction> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AuditAction action : values()) {
            if (action.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
