package com.tessera.controlplane.api;

import com.tessera.security.audit.AuditAction;
import com.tessera.security.audit.AuditEvent;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.audit.AuditQuery;
import com.tessera.security.permission.Permission;
import com.tessera.security.tenant.Tenant;
import com.tessera.security.tenant.TenantAdministration;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * The caller's own tenant, plus the platform administration endpoints under {@code /api/v1/admin}.
 *
 * <p>Admin endpoints act on tenants other than the caller's and require
 * {@code admin:tenant_management}, which only platform administrators hold.
 */
@RestController
@RequestMapping("/api/v1")
public class TenantController {

    static final Permission READ = Permission.of("tenants", "read");
    static final Permission MANAGE_TENANTS = Permission.of("admin", "tenant_management");

    private final TenantAdministration tenants;
    private final AuditLedger ledger;
    private final EndpointAccess access;

    public TenantController(TenantAdministration tenants, AuditLedger ledger, EndpointAccess access) {
        this.tenants = tenants;
        this.ledger = ledger;
        this.access = access;
    }

    @GetMapping("/tenant")
    public TenantView current() {
        TenantScope scope = access.require(READ);
        return TenantView.of(scope.tenant());
    }

    /** Reads any tenant; the read is recorded in the caller's audit log. */
    @GetMapping("/admin/tenants/{tenantId}")
    public TenantView get(@PathVariable String tenantId, HttpServletRequest request) {
        TenantScope scope = access.require(MANAGE_TENANTS, tenantId);
        Tenant tenant = tenants.get(tenantId);
        ledger.append(AuditEvent.builder(AuditAction.CROSS_TENANT_READ, "tenant")
                .tenant(scope.tenantId())
                .actor(EndpointAccess.actor(scope, request))
                .resource(tenantId)
                .description("Cross-tenant tenant read")
                .build());
        return TenantView.of(tenant);
    }

    @PostMapping("/admin/tenants/{tenantId}/suspend")
    public TenantView suspend(
            @PathVariable String tenantId,
            @RequestBody(required = false) SuspendRequest body,
            HttpServletRequest request) {
        TenantScope scope = access.requireManagement(MANAGE_TENANTS, tenantId);
        String reason = body == null ? null : body.reason();
        return TenantView.of(tenants.suspend(tenantId, reason, EndpointAccess.actor(scope, request)));
    }

    @PostMapping("/admin/tenants/{tenantId}/activate")
    public TenantView activate(@PathVariable String tenantId, HttpServletRequest request) {
        TenantScope scope = access.requireManagement(MANAGE_TENANTS, tenantId);
        return TenantView.of(tenants.activate(tenantId, EndpointAccess.actor(scope, request)));
    }

    /** Audit search across every tenant; the search is itself audited. */
    @GetMapping("/admin/audit")
    public List<AuditController.AuditEntryView> searchAllTenants(
            @RequestParam(name = "actor_id", required = false) String actorId,
            @RequestParam(required = false) String action,
            @RequestParam(name = "resource_type", required = false) String resourceType,
            @RequestParam(name = "resource_id", required = false) String resourceId,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(defaultValue = "100") int limit) {
        TenantScope scope = TenantScopes.require();
        AuditQuery query = AuditController.query(actorId, action, resourceType, resourceId, from, to, limit);
        return ledger.searchAllTenants(scope.principal(), query).stream()
                .map(AuditController.AuditEntryView::of)
                .toList();
    }

    public record SuspendRequest(@Size(max = 500) String reason) {}

    public record TenantView(String id, String slug, String name, String status, String tier) {

        static TenantView of(Tenant tenant) {
            return new TenantView(
                    tenant.id(),
                    tenant.slug(),
                    tenant.name(),
                    tenant.status().value(),
                    tenant.tier().value());
        }
    }
}
