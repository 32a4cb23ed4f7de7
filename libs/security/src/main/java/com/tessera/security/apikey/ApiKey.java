package com.tessera.security.apikey;

import com.tessera.security.ratelimit.RateLimitTier;

import java.time.Instant;
import java.util.Set;

/**
 * Stored API key. Holds the hash of the secret, never the secret.
 *
 * @param prefix    first characters of the plaintext, for display and lookup
 * @param revokedAt when the key stops validating; may lie in the future during a rotation grace
 *                  period
 */
public record ApiKey(
        String id,
        String tenantId,
        String name,
        String prefix,
        String secretHash,
        Set<String> scopes,
        RateLimitTier tier,
        Instant createdAt,
        String createdBy,
        Instant expiresAt,
        Instant revokedAt,
        String revokedBy,
        String revocationReason,
        Instant lastUsedAt,
        String lastUsedIp,
        long usageCount
) {

    public ApiKey {
        if (id == null || tenantId == null || prefix == null || secretHash == null || createdAt == null) {
            throw new IllegalArgumentException("id, tenantId, prefix, secretHash and createdAt are required");
        }
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        tier = tier == null ? RateLimitTier.DEFAULT : tier;
    }

    public boolean isRevokedAt(Instant now) {
        return revokedAt != null && !revokedAt.isAfter(now);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isActiveAt(Instant now) {
        return !isRevokedAt(now) && !isExpiredAt(now);
    }

    public ApiKey withRevocation(Instant at, String by, String reason) {
        return new ApiKey(id, tenantId, name, prefix, secretHash, scopes, tier, createdAt, createdBy,
                expiresAt, at, by, reason, lastUsedAt, lastUsedIp, usageCount);
    }

    public ApiKey withUsage(Instant at, String ip) {
        return new ApiKey(id, tenantId, name, prefix, secretHash, scopes, tier, createdAt, createdBy,
                expiresAt, revokedAt, revokedBy, revocationReason, at, ip, usageCount + 1);
    }
}
