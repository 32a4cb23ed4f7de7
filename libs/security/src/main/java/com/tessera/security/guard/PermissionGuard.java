package com.tessera.security.guard;

import com.tessera.observability.MetricFactory;
import com.tessera.security.audit.Actor;
import com.tessera.security.audit.AuditAction;
import com.tessera.security.audit.AuditEvent;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.error.PermissionDeniedException;
import com.tessera.security.permission.Permission;
import com.tessera.security.permission.PermissionDecision;
import com.tessera.security.permission.PermissionResolver;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;

/**
 * Enforces a permission for a bound request. A denial is written to the audit ledger before the
 * {@link PermissionDeniedException} is thrown.
 */
public final class PermissionGuard {

    static final String METRIC_DENIED = "tessera.permission.denied";

    private final PermissionResolver resolver;
    private final AuditLedger audit;
    private final MetricFactory metrics;

    public PermissionGuard(PermissionResolver resolver, AuditLedger audit, MetricFactory metrics) {
        if (resolver == null || audit == null || metrics == null) {
            throw new IllegalArgumentException("resolver, audit and metrics are required");
        }
        this.resolver = resolver;
        this.audit = audit;
        this.metrics = metrics;
    }

    public PermissionDecision require(TenantScope scope, Permission permission, String targetResourceId) {
        PermissionDecision decision = resolver.check(scope.principal(), permission, targetResourceId);
        if (decision.allowed()) {
            return decision;
        }
        metrics.counter(METRIC_DENIED, "Requests denied by the permission check",
                "tenant", scope.tenantId(), "permission", permission.toString()).increment();
        audit.record(AuditEvent.builder(AuditAction.PERMISSION_DENIED, permission.resource())
                .tenant(scope.tenantId())
                .actor(Actor.of(scope.principal()))
                .resource(targetResourceId)
                .description("Denied " + permission)
                .metadata("permission", permission.toString())
                .requestId(scope.requestId())
                .build());
        throw new PermissionDeniedException(permission.toString());
    }

    /**
     * Same as {@link #require(TenantScope, Permission, String)} for the currently bound scope.
     */
    public PermissionDecision require(Permission permission, String targetResourceId) {
        return require(TenantScopes.require(), permission, targetResourceId);
    }
}
