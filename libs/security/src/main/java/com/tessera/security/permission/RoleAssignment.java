package com.tessera.security.permission;

import java.time.Instant;

/**
 * A role granted to a principal within one tenant, in addition to its claim roles.
 *
 * @param expiresAt end of the grant, or null for a permanent one
 */
public record RoleAssignment(
        String tenantId,
        String principalId,
        String role,
        String assignedBy,
        Instant assignedAt,
        Instant expiresAt
) {

    public RoleAssignment {
        if (tenantId == null || principalId == null || role == null) {
            throw new IllegalArgumentException("tenantId, principalId and role are required");
        }
    }

    public boolean isActiveAt(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
