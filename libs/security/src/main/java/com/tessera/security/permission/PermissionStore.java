package com.tessera.security.permission;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for the platform matrix, tenant overrides and role assignments. Overrides and
 * assignments are always read for one tenant.
 */
public interface PermissionStore {

    Optional<PermissionMatrixEntry> findMatrixEntry(String role, Permission permission);

    List<PermissionMatrixEntry> matrixEntries();

    /**
     * Inserts or replaces the entry for its role and permission.
     */
    void saveMatrixEntry(PermissionMatrixEntry entry);

    Optional<TenantPermissionOverride> findOverride(String tenantId, String role, Permission permission);

    List<TenantPermissionOverride> listOverrides(String tenantId);

    /**
     * Inserts or replaces the override for its tenant, role and permission.
     */
    void saveOverride(TenantPermissionOverride override);

    boolean deleteOverride(String tenantId, String role, Permission permission);

    /**
     * Assignments of a principal in a tenant, in the order they were made. Expired assignments
     * are included.
     */
    List<RoleAssignment> roleAssignments(String tenantId, String principalId);

    /**
     * Inserts or replaces the assignment for its tenant, principal and role.
     */
    void saveRoleAssignment(RoleAssignment assignment);

    boolean deleteRoleAssignment(String tenantId, String principalId, String role);
}
