package com.tessera.security.audit;

import java.time.Instant;

/**
 * Filter for audit searches. Null fields do not filter. Results are newest first and capped at
 * {@code limit}.
 *
 * @param from inclusive lower bound on {@code createdAt}
 * @param to   exclusive upper bound on {@code createdAt}
 */
public record AuditQuery(
        String actorId,
        AuditAction action,
        String resourceType,
        String resourceId,
        Instant from,
        Instant to,
        int limit
) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 10_000;

    public AuditQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
        if (from != null && to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("'to' must not be before 'from'");
        }
    }

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null, null, DEFAULT_LIMIT);
    }

    public static AuditQuery forResource(String resourceType, String resourceId) {
        return new AuditQuery(null, null, resourceType, resourceId, null, null, DEFAULT_LIMIT);
    }

    public boolean matches(AuditLogEntry entry) {
        return (actorId == null || actorId.equals(entry.actorId()))
                && (action == null || action == entry.action())
                && (resourceType == null || resourceType.equals(entry.resourceType()))
                && (resourceId == null || resourceId.equals(entry.resourceId()))
                && (from == null || !entry.createdAt().isBefore(from))
                && (to == null || entry.createdAt().isBefore(to));
    }
}
