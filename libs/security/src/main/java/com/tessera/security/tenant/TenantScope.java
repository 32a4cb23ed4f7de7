package com.tessera.security.tenant;

import com.tessera.security.credential.Principal;
import com.tessera.security.error.TenantMismatchException;

/**
 * Everything downstream code needs to know about the request it is serving: the tenant, the
 * authenticated principal and the request id. Immutable; created once per request by the access
 * guard and bound with {@link TenantScopes#bind(TenantScope)}.
 *
 * @param tenant    the resolved, usable tenant
 * @param principal the authenticated caller; belongs to {@code tenant}
 * @param requestId request identifier used in logs, audit entries and error envelopes
 */
public record TenantScope(Tenant tenant, Principal principal, String requestId) {

    public TenantScope {
        if (tenant == null) {
            throw new IllegalArgumentException("tenant must not be null");
        }
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
        if (!tenant.id().equals(principal.tenantId())) {
            throw new TenantMismatchException(tenant.id(), principal.tenantId());
        }
    }

    public String tenantId() {
        return tenant.id();
    }
}
