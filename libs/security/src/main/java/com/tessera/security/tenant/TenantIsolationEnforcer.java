package com.tessera.security.tenant;

import com.tessera.security.error.TenantMismatchException;

/**
 * Checks that a loaded resource belongs to the tenant the request is bound to.
 * <p>
 * Repositories already take the tenant id as an argument; this is the second line of defence for
 * resources reached by id, e.g. through a relationship or a cache.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
    }

    /**
     * @throws TenantMismatchException if the tenants differ
     */
    public static void enforce(TenantScope scope, String resourceTenantId) {
        String scopeTenantId = scope.tenantId();
        if (!scopeTenantId.equals(resourceTenantId)) {
            throw new TenantMismatchException(scopeTenantId, resourceTenantId);
        }
    }

    /**
     * Same as {@link #enforce(TenantScope, String)} against the currently bound scope.
     */
    public static void enforce(String resourceTenantId) {
        enforce(TenantScopes.require(), resourceTenantId);
    }
}
