package com.tessera.security.apikey;

import java.util.Optional;

/**
 * Scopes an API key can be issued with, and the platform role each scope grants to requests
 * authenticated with the key.
 */
public enum ApiKeyScope {

    REALTIME("realtime", "operator"),
    BILLING("billing", "billing_admin"),
    ADMIN("admin", "tenant_admin");

    private final String value;
    private final String impliedRole;

    ApiKeyScope(String value, String impliedRole) {
        this.value = value;
        this.impliedRole = impliedRole;
    }

    public String value() {
        return value;
    }

    public String impliedRole() {
        return impliedRole;
    }

    public static Optional<ApiKeyScope> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ApiKeyScope scope : values()) {
            if (scope.value.equals(value.trim().toLowerCase())) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
