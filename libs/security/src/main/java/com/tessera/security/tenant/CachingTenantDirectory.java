package com.tessera.security.tenant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine cache in front of a {@link TenantDirectory}.
 * <p>
 * Entries expire a fixed time after they were loaded, so a status change made on another node is
 * observed here within one TTL. Changes made through {@link #save(Tenant)} on this node invalidate
 * the entry and are visible to the very next lookup. Missing tenants are not cached.
 */
public final class CachingTenantDirectory implements TenantDirectory {

    /** Default bound on how long a stale tenant status may be served. */
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(30);

    private final TenantDirectory delegate;
    private final Cache<String, Tenant> byId;
    private final Duration ttl;

    public CachingTenantDirectory(TenantDirectory delegate, Duration ttl) {
        this(delegate, ttl, Ticker.systemTicker());
    }

    CachingTenantDirectory(TenantDirectory delegate, Duration ttl, Ticker ticker) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.delegate = delegate;
        this.ttl = ttl;
        this.byId = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(10_000)
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<Tenant> findById(String tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        Tenant cached = byId.getIfPresent(tenantId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Tenant> loaded = delegate.findById(tenantId);
        loaded.ifPresent(tenant -> byId.put(tenantId, tenant));
        return loaded;
    }

    /**
     * Slugs are resolved by the delegate; the status of the resulting tenant goes through the
     * id cache like any other lookup.
     */
    @Override
    public Optional<Tenant> findBySlug(String slug) {
        return delegate.findBySlug(slug).flatMap(tenant -> findById(tenant.id()));
    }

    @Override
    public void save(Tenant tenant) {
        delegate.save(tenant);
        byId.invalidate(tenant.id());
    }

    public void invalidate(String tenantId) {
        byId.invalidate(tenantId);
    }

    public Duration ttl() {
        return ttl;
    }
}
