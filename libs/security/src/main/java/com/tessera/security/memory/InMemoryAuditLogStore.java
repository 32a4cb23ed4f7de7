package com.tessera.security.memory;

import com.tessera.security.audit.AuditLogEntry;
import com.tessera.security.audit.AuditLogStore;
import com.tessera.security.audit.AuditQuery;
import com.tessera.security.error.AuditImmutabilityViolation;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Append-only {@link AuditLogStore} held in memory. Entries with equal timestamps keep their
 * insertion order in results (newest first).
 */
public final class InMemoryAuditLogStore implements AuditLogStore {

    private record Stored(long sequence, AuditLogEntry entry) {
    }

    private final Map<UUID, Stored> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public void insert(AuditLogEntry entry) {
        Stored stored = new Stored(sequence.incrementAndGet(), entry);
        if (entries.putIfAbsent(entry.id(), stored) != null) {
            throw new AuditImmutabilityViolation(entry.id().toString(), "overwrite");
        }
    }

    @Override
    public Optional<AuditLogEntry> findById(String tenantId, UUID id) {
        return Optional.ofNullable(entries.get(id))
                .map(Stored::entry)
                .filter(e -> Objects.equals(e.tenantId(), tenantId));
    }

    @Override
    public List<AuditLogEntry> search(String tenantId, AuditQuery query) {
        return select(entries.values().stream().filter(s -> tenantId.equals(s.entry().tenantId())), query);
    }

    @Override
    public List<AuditLogEntry> searchAllTenants(AuditQuery query) {
        return select(entries.values().stream(), query);
    }

    public int size() {
        return entries.size();
    }

    private static List<AuditLogEntry> select(Stream<Stored> candidates, AuditQuery query) {
        return candidates
                .filter(s -> query.matches(s.entry()))
                .sorted(Comparator.comparing((Stored s) -> s.entry().createdAt())
                        .thenComparingLong(Stored::sequence)
                        .reversed())
                .limit(query.limit())
                .map(Stored::entry)
                .toList();
    }
}
