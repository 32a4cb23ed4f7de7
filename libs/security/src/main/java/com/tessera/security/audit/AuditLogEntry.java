package com.tessera.security.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A persisted audit record. Never modified or deleted after creation.
 *
 * @param tenantId tenant the action concerned; null only for platform-level events
 */
public record AuditLogEntry(
        UUID id,
        String tenantId,
        String actorId,
        ActorType actorType,
        String ipAddress,
        String requestId,
        AuditAction action,
        String resourceType,
        String resourceId,
        String description,
        Map<String, Object> oldValues,
        Map<String, Object> newValues,
        Map<String, Object> metadata,
        Instant createdAt
) {

    public AuditLogEntry {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt must not be null");
        }
        oldValues = oldValues == null ? Map.of() : oldValues;
        newValues = newValues == null ? Map.of() : newValues;
        metadata = metadata == null ? Map.of() : metadata;
    }
}
