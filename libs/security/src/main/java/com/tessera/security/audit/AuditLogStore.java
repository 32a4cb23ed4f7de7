package com.tessera.security.audit;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only persistence for audit entries. There is deliberately no update or delete operation.
 */
public interface AuditLogStore {

    /**
     * Persists a new entry.
     *
     * @throws com.tessera.security.error.AuditImmutabilityViolation if an entry with the same id
     *                                                                already exists
     */
    void insert(AuditLogEntry entry);

    Optional<AuditLogEntry> findById(String tenantId, UUID id);

    /**
     * Entries of one tenant matching the query, newest first.
     */
    List<AuditLogEntry> search(String tenantId, AuditQuery query);

    /**
     * Entries of all tenants matching the query, newest first. Platform-admin use only.
     */
    List<AuditLogEntry> searchAllTenants(AuditQuery query);
}
