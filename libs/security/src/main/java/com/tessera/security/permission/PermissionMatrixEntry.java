package com.tessera.security.permission;

import java.util.Map;

/**
 * Platform default for one role and permission.
 *
 * @param conditions extra requirements checked by {@link ConditionEvaluator}; empty for none
 */
public record PermissionMatrixEntry(String role, Permission permission, boolean allowed,
                                    Map<String, Object> conditions) {

    public PermissionMatrixEntry {
        if (role == null || role.isBlank() || permission == null) {
            throw new IllegalArgumentException("role and permission are required");
        }
        conditions = conditions == null ? Map.of() : Map.copyOf(conditions);
    }
}
