package com.tessera.controlplane.api;

import com.tessera.security.audit.AuditAction;
import com.tessera.security.audit.AuditExporter;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.audit.AuditLogEntry;
import com.tessera.security.audit.AuditQuery;
import com.tessera.security.error.ValidationException;
import com.tessera.security.permission.Permission;
import com.tessera.security.tenant.TenantScope;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read access to the caller's tenant audit log. Entries cannot be changed through the API. */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    static final Permission READ = Permission.of("audit", "read");
    static final Permission EXPORT = Permission.of("audit", "export");

    private final AuditLedger ledger;
    private final AuditExporter exporter;
    private final EndpointAccess access;

    public AuditController(AuditLedger ledger, AuditExporter exporter, EndpointAccess access) {
        this.ledger = ledger;
        this.exporter = exporter;
        this.access = access;
    }

    @GetMapping
    public List<AuditEntryView> search(
            @RequestParam(name = "actor_id", required = false) String actorId,
            @RequestParam(required = false) String action,
            @RequestParam(name = "resource_type", required = false) String resourceType,
            @RequestParam(name = "resource_id", required = false) String resourceId,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(defaultValue = "100") int limit) {
        TenantScope scope = access.require(READ);
        AuditQuery query = query(actorId, action, resourceType, resourceId, from, to, limit);
        return ledger.search(scope.tenantId(), query).stream().map(AuditEntryView::of).toList();
    }

    @GetMapping("/resources/{resourceType}/{resourceId}")
    public List<AuditEntryView> history(@PathVariable String resourceType, @PathVariable String resourceId) {
        TenantScope scope = access.require(READ, resourceId);
        return ledger.history(scope.tenantId(), resourceType, resourceId).stream()
                .map(AuditEntryView::of)
                .toList();
    }

    @GetMapping("/export")
    public ResponseEntity<String> export(
            @RequestParam(defaultValue = "csv") String format,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(defaultValue = "10000") int limit) {
        TenantScope scope = access.require(EXPORT);
        List<AuditLogEntry> entries =
                ledger.search(scope.tenantId(), query(null, action, null, null, from, to, limit));
        String filename = "audit-" + scope.tenantId();
        return switch (format) {
            case "csv" -> ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + ".csv\"")
                    .contentType(new MediaType("text", "csv"))
                    .body(exporter.toCsv(entries));
            case "jsonl" -> ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + ".jsonl\"")
                    .contentType(new MediaType("application", "x-ndjson"))
                    .body(exporter.toJsonLines(entries));
            default -> throw new ValidationException(
                    "format must be csv or jsonl", Map.of("format", format));
        };
    }

    /** The action values accepted by the {@code action} filter. */
    @GetMapping("/actions")
    public List<String> actions() {
        return Arrays.stream(AuditAction.values()).map(AuditAction::value).toList();
    }

    static AuditQuery query(
            String actorId,
            String action,
            String resourceType,
            String resourceId,
            Instant from,
            Instant to,
            int limit) {
        AuditAction parsed = action == null
                ? null
                : AuditAction.fromString(action)
                        .orElseThrow(() -> new ValidationException(
                                "unknown audit action: " + action, Map.of("action", action)));
        return new AuditQuery(actorId, parsed, resourceType, resourceId, from, to, limit);
    }

    public record AuditEntryView(
            UUID id,
            String tenantId,
            String actorId,
            String actorType,
            String ipAddress,
            String requestId,
            String action,
            String resourceType,
            String resourceId,
            String description,
            Map<String, Object> oldValues,
            Map<String, Object> newValues,
            Map<String, Object> metadata,
            Instant createdAt) {

        static AuditEntryView of(AuditLogEntry entry) {
            return new AuditEntryView(
                    entry.id(),
                    entry.tenantId(),
                    entry.actorId(),
                    entry.actorType() == null ? null : entry.actorType().value(),
                    entry.ipAddress(),
                    entry.requestId(),
                    entry.action().value(),
                    entry.resourceType(),
                    entry.resourceId(),
                    entry.description(),
                    entry.oldValues(),
                    entry.newValues(),
                    entry.metadata(),
                    entry.createdAt());
        }
    }
}
