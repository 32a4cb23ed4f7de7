package com.tessera.security.audit;

import com.tessera.observability.SensitiveDataRedactor;
import com.tessera.security.credential.Principal;
import com.tessera.security.error.AuditImmutabilityViolation;
import com.tessera.security.error.PermissionDeniedException;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Append-only record of security-relevant events.
 * <p>
 * Writes come in two flavours. {@link #append(AuditEvent)} persists synchronously and is used where
 * the caller must know the entry exists (e.g. before returning a freshly issued key).
 * {@link #record(AuditEvent)} is fire-and-continue: the write runs on the ledger's executor, entries
 * of one tenant are persisted in submission order, and a failed write is logged rather than
 * propagated to the request.
 * <p>
 * Entries can never be changed: {@link #update(AuditLogEntry)} and {@link #delete(UUID)} exist only
 * to reject the attempt with {@link AuditImmutabilityViolation}, whoever the caller is.
 * <p>
 * Old/new value snapshots and metadata are passed through {@link SensitiveDataRedactor} before
 * they are stored.
 */
public final class AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    private static final String PLATFORM_KEY = "__platform__";

    private final AuditLogStore store;
    private final Clock clock;
    private final Executor executor;
    private final SensitiveDataRedactor redactor;
    private final ConcurrentMap<String, CompletableFuture<AuditLogEntry>> tails = new ConcurrentHashMap<>();

    public AuditLedger(AuditLogStore store, Clock clock, Executor executor, SensitiveDataRedactor redactor) {
        if (store == null || clock == null || executor == null || redactor == null) {
            throw new IllegalArgumentException("store, clock, executor and redactor are required");
        }
        this.store = store;
        this.clock = clock;
        this.executor = executor;
        this.redactor = redactor;
    }

    /**
     * Persists an entry and returns it. The request id defaults to the one of the bound scope.
     */
    public AuditLogEntry append(AuditEvent event) {
        AuditEvent resolved = withScopeRequestId(event);
        AuditLogEntry entry = new AuditLogEntry(
                UUID.randomUUID(),
                resolved.tenantId(),
                resolved.actor().id(),
                resolved.actor().type(),
                resolved.actor().ipAddress(),
                resolved.requestId(),
                resolved.action(),
                resolved.resourceType(),
                resolved.resourceId(),
                redactor.redactValue(resolved.description()),
                redactor.redact(resolved.oldValues()),
                redactor.redact(resolved.newValues()),
                redactor.redact(resolved.metadata()),
                clock.instant());
        store.insert(entry);
        log.debug("Audit {} on {}:{} by {} {}", entry.action().value(), entry.resourceType(),
                entry.resourceId(), entry.actorType().value(), entry.actorId());
        return entry;
    }

    /**
     * Queues an entry for persistence and returns immediately. Entries of the same tenant are
     * written in the order they were recorded.
     *
     * @return a future completing with the stored entry, or with null if the write failed
     */
    public CompletableFuture<AuditLogEntry> record(AuditEvent event) {
        AuditEvent resolved = withScopeRequestId(event);
        String key = resolved.tenantId() != null ? resolved.tenantId() : PLATFORM_KEY;
        CompletableFuture<AuditLogEntry> next = tails.compute(key, (k, tail) -> {
            CompletableFuture<AuditLogEntry> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            return previous.thenApplyAsync(ignored -> writeQuietly(resolved), executor);
        });
        next.whenComplete((entry, failure) -> tails.remove(key, next));
        return next;
    }

    private AuditLogEntry writeQuietly(AuditEvent event) {
        try {
            return append(event);
        } catch (RuntimeException e) {
            log.error("Failed to write audit entry {} for tenant {}", event.action().value(), event.tenantId(), e);
            return null;
        }
    }

    /**
     * Always fails: audit entries are immutable.
     */
    public void update(AuditLogEntry entry) {
        String id = entry == null ? "null" : String.valueOf(entry.id());
        log.warn("Rejected attempt to update audit entry {}", id);
        throw new AuditImmutabilityViolation(id, "update");
    }

    /**
     * Always fails: audit entries are immutable.
     */
    public void delete(UUID entryId) {
        log.warn("Rejected attempt to delete audit entry {}", entryId);
        throw new AuditImmutabilityViolation(String.valueOf(entryId), "delete");
    }

    public List<AuditLogEntry> search(String tenantId, AuditQuery query) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        return store.search(tenantId, query);
    }

    /**
     * All entries about one resource of a tenant, newest first.
     */
    public List<AuditLogEntry> history(String tenantId, String resourceType, String resourceId) {
        return search(tenantId, AuditQuery.forResource(resourceType, resourceId));
    }

    /**
     * Searches every tenant's entries. Restricted to platform administrators; the search itself is
     * recorded.
     *
     * @throws PermissionDeniedException if {@code admin} is not a platform administrator
     */
    public List<AuditLogEntry> searchAllTenants(Principal admin, AuditQuery query) {
        if (admin == null || !admin.isPlatformAdmin()) {
            throw new PermissionDeniedException("audit:read_all_tenants");
        }
        List<AuditLogEntry> results = store.searchAllTenants(query);
        append(AuditEvent.builder(AuditAction.CROSS_TENANT_READ, "audit_log")
                .tenant(admin.tenantId())
                .actor(Actor.of(admin))
                .description("Cross-tenant audit search")
                .metadata("result_count", results.size())
                .metadata("action_filter", query.action() != null ? query.action().value() : null)
                .metadata("resource_type_filter", query.resourceType())
                .build());
        return results;
    }

    private static AuditEvent withScopeRequestId(AuditEvent event) {
        if (event.requestId() != null) {
            return event;
        }
        return TenantScopes.current()
                .map(TenantScope::requestId)
                .map(event::withRequestId)
                .orElse(event);
    }
}
