package com.tessera.security.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Something worth recording, before it has been assigned an id and a timestamp by the
 * {@link AuditLedger}.
 */
public record AuditEvent(
        String tenantId,
        Actor actor,
        AuditAction action,
        String resourceType,
        String resourceId,
        String description,
        Map<String, Object> oldValues,
        Map<String, Object> newValues,
        Map<String, Object> metadata,
        String requestId
) {

    public AuditEvent {
        if (actor == null) {
            throw new IllegalArgumentException("actor must not be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType must not be null or blank");
        }
        oldValues = copy(oldValues);
        newValues = copy(newValues);
        metadata = copy(metadata);
        description = description == null ? "" : description;
    }

    public static Builder builder(AuditAction action, String resourceType) {
        return new Builder(action, resourceType);
    }

    public AuditEvent withRequestId(String newRequestId) {
        return new AuditEvent(tenantId, actor, action, resourceType, resourceId, description,
                oldValues, newValues, metadata, newRequestId);
    }

    private static Map<String, Object> copy(Map<String, Object> values) {
        return values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static final class Builder {

        private final AuditAction action;
        private final String resourceType;
        private String tenantId;
        private Actor actor;
        private String resourceId;
        private String description;
        private Map<String, Object> oldValues;
        private Map<String, Object> newValues;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private String requestId;

        private Builder(AuditAction action, String resourceType) {
            this.action = action;
            this.resourceType = resourceType;
        }

        public Builder tenant(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder actor(Actor actor) {
            this.actor = actor;
            return this;
        }

        public Builder resource(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder oldValues(Map<String, Object> oldValues) {
            this.oldValues = oldValues;
            return this;
        }

        public Builder newValues(Map<String, Object> newValues) {
            this.newValues = newValues;
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public AuditEvent build() {
            return new AuditEvent(tenantId, actor, action, resourceType, resourceId, description,
                    oldValues, newValues, metadata, requestId);
        }
    }
}
