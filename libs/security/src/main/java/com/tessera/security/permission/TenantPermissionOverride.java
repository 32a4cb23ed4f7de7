package com.tessera.security.permission;

import java.time.Instant;
import java.util.Map;

/**
 * Tenant-specific replacement of a matrix entry. When present it fully decides the role for that
 * permission, whether it allows or denies.
 */
public record TenantPermissionOverride(
        String tenantId,
        String role,
        Permission permission,
        boolean allowed,
        Map<String, Object> conditions,
        String updatedBy,
        Instant updatedAt
) {

    public TenantPermissionOverride {
        if (tenantId == null || role == null || permission == null) {
            throw new IllegalArgumentException("tenantId, role and permission are required");
        }
        conditions = conditions == null ? Map.of() : Map.copyOf(conditions);
    }
}
