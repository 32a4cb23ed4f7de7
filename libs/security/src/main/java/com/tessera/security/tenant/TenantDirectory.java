package com.tessera.security.tenant;

import java.util.Optional;

/**
 * Lookup and platform-admin mutation of tenants, backed by the persistent store.
 */
public interface TenantDirectory {

    Optional<Tenant> findById(String tenantId);

    Optional<Tenant> findBySlug(String slug);

    /**
     * Inserts or replaces a tenant.
     */
    void save(Tenant tenant);
}
