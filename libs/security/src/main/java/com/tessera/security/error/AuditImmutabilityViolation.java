package com.tessera.security.error;

import java.util.Map;

/**
 * An attempt was made to modify or remove an audit log entry. Always raised, for every caller.
 */
public class AuditImmutabilityViolation extends ControlPlaneException {

    private final String entryId;
    private final String operation;

    public AuditImmutabilityViolation(String entryId, String operation) {
        super(ErrorCode.AUDIT_IMMUTABLE,
                "Audit log entries are immutable; %s of %s rejected".formatted(operation, entryId),
                Map.of("entry_id", String.valueOf(entryId), "operation", operation));
        this.entryId = entryId;
        this.operation = operation;
    }

    public String entryId() {
        return entryId;
    }

    public String operation() {
        return operation;
    }
}
