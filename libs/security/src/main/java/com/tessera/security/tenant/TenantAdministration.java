package com.tessera.security.tenant;

import com.tessera.security.audit.Actor;
import com.tessera.security.audit.AuditAction;
import com.tessera.security.audit.AuditEvent;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.error.ConflictException;
import com.tessera.security.error.TenantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Platform-admin status changes of tenants.
 * <p>
 * Writes go through the directory the resolver reads from, so with a
 * {@link CachingTenantDirectory} the local cache entry is dropped and the next request on this
 * node sees the new status. Other nodes see it within their cache TTL.
 */
public final class TenantAdministration {

    private static final Logger log = LoggerFactory.getLogger(TenantAdministration.class);

    private final TenantDirectory directory;
    private final AuditLedger audit;

    public TenantAdministration(TenantDirectory directory, AuditLedger audit) {
        if (directory == null || audit == null) {
            throw new IllegalArgumentException("directory and audit are required");
        }
        this.directory = directory;
        this.audit = audit;
    }

    /**
     * @throws ConflictException if the tenant is already suspended or deleted
     */
    public Tenant suspend(String tenantId, String reason, Actor actor) {
        Tenant tenant = require(tenantId);
        if (tenant.status() == TenantStatus.SUSPENDED || tenant.status() == TenantStatus.DELETED) {
            throw new ConflictException("Tenant %s is already %s".formatted(tenantId, tenant.status().value()));
        }
        return changeStatus(tenant, TenantStatus.SUSPENDED, AuditAction.TENANT_SUSPENDED, reason, actor);
    }

    /**
     * @throws ConflictException if the tenant is already active or deleted
     */
    public Tenant activate(String tenantId, Actor actor) {
        Tenant tenant = require(tenantId);
        if (tenant.status() == TenantStatus.ACTIVE || tenant.status() == TenantStatus.DELETED) {
            throw new ConflictException("Tenant %s is already %s".formatted(tenantId, tenant.status().value()));
        }
        return changeStatus(tenant, TenantStatus.ACTIVE, AuditAction.TENANT_ACTIVATED, null, actor);
    }

    public Tenant get(String tenantId) {
        return require(tenantId);
    }

    private Tenant changeStatus(Tenant tenant, TenantStatus status, AuditAction action, String reason, Actor actor) {
        Tenant updated = tenant.withStatus(status);
        directory.save(updated);

        Map<String, Object> oldValues = new LinkedHashMap<>();
        oldValues.put("status", tenant.status().value());
        Map<String, Object> newValues = new LinkedHashMap<>();
        newValues.put("status", status.value());
        audit.append(AuditEvent.builder(action, "tenant")
                .tenant(tenant.id())
                .actor(actor)
                .resource(tenant.id())
                .description("Tenant %s %s".formatted(tenant.slug(), status.value()))
                .oldValues(oldValues)
                .newValues(newValues)
                .metadata("reason", reason)
                .build());
        log.info("Tenant {} status {} -> {} by {}", tenant.id(), tenant.status().value(), status.value(), actor.id());
        return updated;
    }

    private Tenant require(String tenantId) {
        return directory.findById(tenantId).orElseThrow(() -> TenantException.notFound(tenantId));
    }
}
