package com.tessera.security.tenant;

/**
 * A customer organization; the unit of isolation.
 *
 * @param id     opaque tenant id
 * @param slug   URL-safe short name, used for subdomain resolution
 * @param name   display name
 * @param status lifecycle status
 * @param tier   subscription tier
 */
public record Tenant(String id, String slug, String name, TenantStatus status, TenantTier tier) {

    public Tenant {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (tier == null) {
            tier = TenantTier.FREE;
        }
        if (name == null || name.isBlank()) {
            name = slug;
        }
        slug = slug.toLowerCase();
    }

    public Tenant withStatus(TenantStatus newStatus) {
        return new Tenant(id, slug, name, newStatus, tier);
    }
}
