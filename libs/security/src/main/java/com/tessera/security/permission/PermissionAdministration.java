package com.tessera.security.permission;

import com.tessera.security.audit.Actor;
import com.tessera.security.audit.AuditAction;
import com.tessera.security.audit.AuditEvent;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.error.NotFoundException;
import com.tessera.security.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tenant administration of permissions: overrides of the platform matrix and role assignments.
 * Every change is recorded as {@link AuditAction#PERMISSION_CHANGE}.
 */
public final class PermissionAdministration {

    private static final Logger log = LoggerFactory.getLogger(PermissionAdministration.class);

    private final PermissionStore store;
    private final AuditLedger audit;
    private final Clock clock;

    public PermissionAdministration(PermissionStore store, AuditLedger audit, Clock clock) {
        if (store == null || audit == null || clock == null) {
            throw new IllegalArgumentException("store, audit and clock are required");
        }
        this.store = store;
        this.audit = audit;
        this.clock = clock;
    }

    /**
     * Creates or replaces the tenant's override of a role's permission.
     *
     * @throws ValidationException for platform roles and {@code admin:*} permissions, which
     *                             tenants cannot change
     */
    public TenantPermissionOverride overridePermission(String tenantId, String role, Permission permission,
                                                      boolean allowed, Map<String, Object> conditions,
                                                      Actor actor) {
        requireTenantManagedRole(role);
        if (permission.isPlatformScoped()) {
            throw new ValidationException("platform permissions cannot be overridden by a tenant",
                    Map.of("permission", permission.toString()));
        }
        Optional<TenantPermissionOverride> previous = store.findOverride(tenantId, role, permission);
        TenantPermissionOverride override = new TenantPermissionOverride(tenantId, role, permission, allowed,
                conditions, actor.id(), clock.instant());
        store.saveOverride(override);

        audit.append(AuditEvent.builder(AuditAction.PERMISSION_CHANGE, "permission_override")
                .tenant(tenantId)
                .actor(actor)
                .resource(role + "/" + permission)
                .description("%s %s for role %s".formatted(allowed ? "Allowed" : "Denied", permission, role))
                .oldValues(previous.map(PermissionAdministration::snapshot).orElse(null))
                .newValues(snapshot(override))
                .build());
        log.info("{} permission override for tenant {}: role={} {} allowed={}",
                previous.isPresent() ? "Updated" : "Created", tenantId, role, permission, allowed);
        return override;
    }

    /**
     * Removes an override so the platform default applies again.
     *
     * @throws NotFoundException if there is no such override
     */
    public void removeOverride(String tenantId, String role, Permission permission, Actor actor) {
        TenantPermissionOverride existing = store.findOverride(tenantId, role, permission)
                .orElseThrow(() -> new NotFoundException("permission_override", role + "/" + permission));
        store.deleteOverride(tenantId, role, permission);
        audit.append(AuditEvent.builder(AuditAction.PERMISSION_CHANGE, "permission_override")
                .tenant(tenantId)
                .actor(actor)
                .resource(role + "/" + permission)
                .description("Removed override of %s for role %s".formatted(permission, role))
                .oldValues(snapshot(existing))
                .build());
        log.info("Removed permission override for tenant {}: role={} {}", tenantId, role, permission);
    }

    public List<TenantPermissionOverride> listOverrides(String tenantId) {
        return store.listOverrides(tenantId);
    }

    /**
     * Grants a role to a principal within a tenant.
     *
     * @param expiresAt end of the grant, or null for a permanent one
     * @throws ValidationException for unknown roles and for platform roles
     */
    public RoleAssignment assignRole(String tenantId, String principalId, String role, Instant expiresAt,
                                     Actor actor) {
        requireTenantManagedRole(role);
        Instant now = clock.instant();
        if (expiresAt != null && !expiresAt.isAfter(now)) {
            throw new ValidationException("expires_at must be in the future");
        }
        RoleAssignment assignment = new RoleAssignment(tenantId, principalId, role, actor.id(), now, expiresAt);
        store.saveRoleAssignment(assignment);

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("role", role);
        values.put("expires_at", expiresAt == null ? null : expiresAt.toString());
        audit.append(AuditEvent.builder(AuditAction.PERMISSION_CHANGE, "role_assignment")
                .tenant(tenantId)
                .actor(actor)
                .resource(principalId)
                .description("Assigned role %s".formatted(role))
                .newValues(values)
                .build());
        log.info("Assigned role {} to {} in tenant {}", role, principalId, tenantId);
        return assignment;
    }

    /**
     * @throws NotFoundException if the principal does not hold the role in this tenant
     */
    public void revokeRole(String tenantId, String principalId, String role, Actor actor) {
        if (!store.deleteRoleAssignment(tenantId, principalId, role)) {
            throw new NotFoundException("role_assignment", principalId + "/" + role);
        }
        audit.append(AuditEvent.builder(AuditAction.PERMISSION_CHANGE, "role_assignment")
                .tenant(tenantId)
                .actor(actor)
                .resource(principalId)
                .description("Revoked role %s".formatted(role))
                .oldValues(Map.of("role", role))
                .build());
        log.info("Revoked role {} from {} in tenant {}", role, principalId, tenantId);
    }

    public List<RoleAssignment> roleAssignments(String tenantId, String principalId) {
        return store.roleAssignments(tenantId, principalId);
    }

    /**
     * Platform-default permissions of a role, sorted.
     */
    public List<String> rolePermissions(String role) {
        requireKnownRole(role);
        return store.matrixEntries().stream()
                .filter(entry -> entry.role().equals(role) && entry.allowed())
                .map(entry -> entry.permission().toString())
                .sorted()
                .toList();
    }

    private static void requireKnownRole(String role) {
        if (!PlatformRole.isKnown(role)) {
            throw new ValidationException("unknown role: " + role, Map.of("role", String.valueOf(role)));
        }
    }

    private static void requireTenantManagedRole(String role) {
        requireKnownRole(role);
        if (PlatformRole.isPlatformOnly(role)) {
            throw new ValidationException("role %s cannot be granted within a tenant".formatted(role),
                    Map.of("role", role));
        }
    }

    private static Map<String, Object> snapshot(TenantPermissionOverride override) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("role", override.role());
        values.put("permission", override.permission().toString());
        values.put("allowed", override.allowed());
        values.put("conditions", override.conditions());
        return values;
    }
}
