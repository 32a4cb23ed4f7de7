package com.tessera.security.permission;

import com.tessera.security.credential.Principal;
import com.tessera.security.error.PermissionDeniedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Decides whether a principal may perform a {@code resource:action}.
 * <p>
 * The principal's effective roles are its claim roles followed by its active role assignments in
 * the principal's tenant. Each role is evaluated in that order: a tenant override for the role
 * and permission decides the role on its own; otherwise the platform matrix entry does. The
 * first role that is allowed and whose conditions hold grants the request. When no role grants
 * it, a target resource id is known and a {@link RelationshipPolicyStore} is configured, the
 * relationship store has the final word; a failing store denies.
 * <p>
 * Platform roles and {@code admin:*} permissions come from claims and the platform matrix only:
 * assignments of platform roles and overrides of platform permissions are ignored.
 */
public final class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    private final PermissionStore store;
    private final ConditionEvaluator conditions;
    private final RelationshipPolicyStore relationships;
    private final Clock clock;

    /**
     * @param relationships optional relationship store, may be null
     */
    public PermissionResolver(PermissionStore store, ConditionEvaluator conditions,
                              RelationshipPolicyStore relationships, Clock clock) {
        if (store == null || conditions == null || clock == null) {
            throw new IllegalArgumentException("store, conditions and clock are required");
        }
        this.store = store;
        this.conditions = conditions;
        this.relationships = relationships;
        this.clock = clock;
    }

    public PermissionDecision check(Principal principal, Permission permission, String targetResourceId) {
        List<String> roles = effectiveRoles(principal);
        for (String role : roles) {
            Optional<TenantPermissionOverride> override = findOverride(principal.tenantId(), role, permission);
            if (override.isPresent()) {
                TenantPermissionOverride o = override.get();
                if (o.allowed() && conditions.evaluate(o.conditions(), principal, targetResourceId)) {
                    log.debug("{} granted to {} via tenant override for role {}", permission, principal.id(), role);
                    return PermissionDecision.allow(permission, DecisionSource.OVERRIDE, role);
                }
                continue;
            }
            Optional<PermissionMatrixEntry> entry = store.findMatrixEntry(role, permission);
            if (entry.isPresent() && entry.get().allowed()
                    && conditions.evaluate(entry.get().conditions(), principal, targetResourceId)) {
                log.debug("{} granted to {} via platform default for role {}", permission, principal.id(), role);
                return PermissionDecision.allow(permission, DecisionSource.MATRIX, role);
            }
        }

        if (targetResourceId != null && relationships != null
                && checkRelationship(principal, permission, targetResourceId)) {
            log.debug("{} on {} granted to {} via relationship", permission, targetResourceId, principal.id());
            return PermissionDecision.allow(permission, DecisionSource.RELATIONSHIP, null);
        }

        log.info("Permission denied: {} {} roles={} {}", principal.type().value(), principal.id(), roles, permission);
        return PermissionDecision.deny(permission);
    }

    /**
     * @throws PermissionDeniedException naming {@code permission} when the check denies
     */
    public PermissionDecision require(Principal principal, Permission permission, String targetResourceId) {
        PermissionDecision decision = check(principal, permission, targetResourceId);
        if (!decision.allowed()) {
            throw new PermissionDeniedException(permission.toString());
        }
        return decision;
    }

    /**
     * Every permission of the matrix that some effective role of the principal holds, after tenant
     * overrides. Conditions are not evaluated since there is no target resource.
     */
    public SortedSet<String> effectivePermissions(Principal principal) {
        Set<Permission> known = new LinkedHashSet<>();
        for (PermissionMatrixEntry entry : store.matrixEntries()) {
            known.add(entry.permission());
        }
        List<String> roles = effectiveRoles(principal);
        SortedSet<String> granted = new TreeSet<>();
        for (Permission permission : known) {
            for (String role : roles) {
                if (allowedIgnoringConditions(principal.tenantId(), role, permission)) {
                    granted.add(permission.toString());
                    break;
                }
            }
        }
        return granted;
    }

    /**
     * Claim roles in claim order, then roles from active assignments in assignment order, without
     * duplicates. Assignments of roles a tenant cannot grant are skipped.
     */
    public List<String> effectiveRoles(Principal principal) {
        Set<String> roles = new LinkedHashSet<>(principal.roles());
        Instant now = clock.instant();
        for (RoleAssignment assignment : store.roleAssignments(principal.tenantId(), principal.id())) {
            if (assignment.isActiveAt(now) && !PlatformRole.isPlatformOnly(assignment.role())) {
                roles.add(assignment.role());
            }
        }
        return new ArrayList<>(roles);
    }

    private boolean allowedIgnoringConditions(String tenantId, String role, Permission permission) {
        Optional<TenantPermissionOverride> override = findOverride(tenantId, role, permission);
        if (override.isPresent()) {
            return override.get().allowed();
        }
        return store.findMatrixEntry(role, permission).map(PermissionMatrixEntry::allowed).orElse(false);
    }

    private Optional<TenantPermissionOverride> findOverride(String tenantId, String role, Permission permission) {
        if (permission.isPlatformScoped() || PlatformRole.isPlatformOnly(role)) {
            return Optional.empty();
        }
        return store.findOverride(tenantId, role, permission);
    }

    private boolean checkRelationship(Principal principal, Permission permission, String targetResourceId) {
        try {
            return relationships.check(permission.resource(), targetResourceId, permission.action(),
                    principal.type().value(), principal.id());
        } catch (RuntimeException e) {
            log.warn("Relationship check failed for {} on {}:{}, denying", principal.id(),
                    permission.resource(), targetResourceId, e);
            return false;
        }
    }
}
