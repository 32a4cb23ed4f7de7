package com.tessera.controlplane.api;

import com.tessera.security.permission.Permission;
import com.tessera.security.permission.PermissionAdministration;
import com.tessera.security.permission.PermissionResolver;
import com.tessera.security.permission.RoleAssignment;
import com.tessera.security.permission.TenantPermissionOverride;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Effective permissions of the caller, tenant overrides of the role matrix and role assignments.
 * Permissions in paths use the {@code resource:action} form.
 */
@RestController
@RequestMapping("/api/v1/permissions")
public class PermissionController {

    static final Permission MANAGE_SETTINGS = Permission.of("tenants", "manage_settings");
    static final Permission READ_USERS = Permission.of("users", "read");
    static final Permission ASSIGN_ROLES = Permission.of("users", "assign_roles");

    private final PermissionResolver resolver;
    private final PermissionAdministration administration;
    private final EndpointAccess access;

    public PermissionController(
            PermissionResolver resolver, PermissionAdministration administration, EndpointAccess access) {
        this.resolver = resolver;
        this.administration = administration;
        this.access = access;
    }

    @GetMapping("/me")
    public EffectivePermissionsView me() {
        TenantScope scope = TenantScopes.require();
        return new EffectivePermissionsView(
                scope.principal().id(),
                scope.tenantId(),
                scope.principal().type().value(),
                resolver.effectiveRoles(scope.principal()),
                resolver.effectivePermissions(scope.principal()));
    }

    @GetMapping("/roles/{role}")
    public RolePermissionsView role(@PathVariable String role) {
        access.require(MANAGE_SETTINGS);
        return new RolePermissionsView(role, administration.rolePermissions(role));
    }

    @GetMapping("/overrides")
    public List<OverrideView> overrides() {
        TenantScope scope = access.require(MANAGE_SETTINGS);
        return administration.listOverrides(scope.tenantId()).stream().map(OverrideView::of).toList();
    }

    @PutMapping("/overrides/{role}/{permission}")
    public OverrideView override(
            @PathVariable String role,
            @PathVariable String permission,
            @Valid @RequestBody OverrideRequest body,
            HttpServletRequest request) {
        TenantScope scope = access.requireManagement(MANAGE_SETTINGS, null);
        TenantPermissionOverride saved = administration.overridePermission(
                scope.tenantId(),
                role,
                Permission.parse(permission),
                body.allowed(),
                body.conditions(),
                EndpointAccess.actor(scope, request));
        return OverrideView.of(saved);
    }

    @DeleteMapping("/overrides/{role}/{permission}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeOverride(
            @PathVariable String role, @PathVariable String permission, HttpServletRequest request) {
        TenantScope scope = access.requireManagement(MANAGE_SETTINGS, null);
        administration.removeOverride(
                scope.tenantId(), role, Permission.parse(permission), EndpointAccess.actor(scope, request));
    }

    @GetMapping("/assignments/{principalId}")
    public List<AssignmentView> assignments(@PathVariable String principalId) {
        TenantScope scope = access.require(READ_USERS, principalId);
        return administration.roleAssignments(scope.tenantId(), principalId).stream()
                .map(AssignmentView::of)
                .toList();
    }

    @PostMapping("/assignments")
    @ResponseStatus(HttpStatus.CREATED)
    public AssignmentView assign(@Valid @RequestBody AssignRoleRequest body, HttpServletRequest request) {
        TenantScope scope = access.requireManagement(ASSIGN_ROLES, body.principalId());
        RoleAssignment assignment = administration.assignRole(
                scope.tenantId(),
                body.principalId(),
                body.role(),
                body.expiresAt(),
                EndpointAccess.actor(scope, request));
        return AssignmentView.of(assignment);
    }

    @DeleteMapping("/assignments/{principalId}/{role}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unassign(@PathVariable String principalId, @PathVariable String role, HttpServletRequest request) {
        TenantScope scope = access.requireManagement(ASSIGN_ROLES, principalId);
        administration.revokeRole(scope.tenantId(), principalId, role, EndpointAccess.actor(scope, request));
    }

    public record OverrideRequest(@NotNull Boolean allowed, Map<String, Object> conditions) {}

    public record AssignRoleRequest(@NotBlank String principalId, @NotBlank String role, Instant expiresAt) {}

    public record EffectivePermissionsView(
            String principalId,
            String tenantId,
            String principalType,
            List<String> roles,
            SortedSet<String> permissions) {}

    public record RolePermissionsView(String role, List<String> permissions) {}

    public record OverrideView(
            String role,
            String permission,
            boolean allowed,
            Map<String, Object> conditions,
            String updatedBy,
            Instant updatedAt) {

        static OverrideView of(TenantPermissionOverride override) {
            return new OverrideView(
                    override.role(),
                    override.permission().toString(),
                    override.allowed(),
                    override.conditions(),
                    override.updatedBy(),
                    override.updatedAt());
        }
    }

    public record AssignmentView(
            String principalId, String role, String assignedBy, Instant assignedAt, Instant expiresAt) {

        static AssignmentView of(RoleAssignment assignment) {
            return new AssignmentView(
                    assignment.principalId(),
                    assignment.role(),
                    assignment.assignedBy(),
                    assignment.assignedAt(),
                    assignment.expiresAt());
        }
    }
}
