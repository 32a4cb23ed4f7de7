package com.tessera.security.memory;

import com.tessera.security.tenant.Tenant;
import com.tessera.security.tenant.TenantDirectory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TenantDirectory} held in memory, for tests and single-node development.
 */
public final class InMemoryTenantDirectory implements TenantDirectory {

    private final Map<String, Tenant> byId = new ConcurrentHashMap<>();

    @Override
    public Optional<Tenant> findById(String tenantId) {
        return tenantId == null ? Optional.empty() : Optional.ofNullable(byId.get(tenantId));
    }

    @Override
    public Optional<Tenant> findBySlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        String normalized = slug.toLowerCase();
        return byId.values().stream().filter(t -> t.slug().equals(normalized)).findFirst();
    }

    @Override
    public void save(Tenant tenant) {
        byId.put(tenant.id(), tenant);
    }
}
