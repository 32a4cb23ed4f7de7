package com.tessera.security.memory;

import com.tessera.security.permission.Permission;
import com.tessera.security.permission.PermissionMatrixEntry;
import com.tessera.security.permission.PermissionStore;
import com.tessera.security.permission.RoleAssignment;
import com.tessera.security.permission.TenantPermissionOverride;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PermissionStore} held in memory. Methods are synchronized; assignments keep the order in
 * which they were first made.
 */
public final class InMemoryPermissionStore implements PermissionStore {

    private final Map<String, PermissionMatrixEntry> matrix = new LinkedHashMap<>();
    private final Map<String, TenantPermissionOverride> overrides = new LinkedHashMap<>();
    private final Map<String, RoleAssignment> assignments = new LinkedHashMap<>();

    private static String key(String... parts) {
        return String.join("|", parts);
    }

    @Override
    public synchronized Optional<PermissionMatrixEntry> findMatrixEntry(String role, Permission permission) {
        return Optional.ofNullable(matrix.get(key(role, permission.toString())));
    }

    @Override
    public synchronized List<PermissionMatrixEntry> matrixEntries() {
        return new ArrayList<>(matrix.values());
    }

    @Override
    public synchronized void saveMatrixEntry(PermissionMatrixEntry entry) {
        matrix.put(key(entry.role(), entry.permission().toString()), entry);
    }

    @Override
    public synchronized Optional<TenantPermissionOverride> findOverride(String tenantId, String role,
                                                                        Permission permission) {
        return Optional.ofNullable(overrides.get(key(tenantId, role, permission.toString())));
    }

    @Override
    public synchronized List<TenantPermissionOverride> listOverrides(String tenantId) {
        return overrides.values().stream().filter(o -> o.tenantId().equals(tenantId)).toList();
    }

    @Override
    public synchronized void saveOverride(TenantPermissionOverride override) {
        overrides.put(key(override.tenantId(), override.role(), override.permission().toString()), override);
    }

    @Override
    public synchronized boolean deleteOverride(String tenantId, String role, Permission permission) {
        return overrides.remove(key(tenantId, role, permission.toString())) != null;
    }

    @Override
    public synchronized List<RoleAssignment> roleAssignments(String tenantId, String principalId) {
        return assignments.values().stream()
                .filter(a -> a.tenantId().equals(tenantId) && a.principalId().equals(principalId))
                .toList();
    }

    @Override
    public synchronized void saveRoleAssignment(RoleAssignment assignment) {
        assignments.put(key(assignment.tenantId(), assignment.principalId(), assignment.role()), assignment);
    }

    @Override
    public synchronized boolean deleteRoleAssignment(String tenantId, String principalId, String role) {
        return assignments.remove(key(tenantId, principalId, role)) != null;
    }
}
