package com.tessera.security.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bulk export of audit entries as CSV or as JSON lines.
 * <p>
 * Entries are written in the order given (searches return newest first).
 */
public final class AuditExporter {

    static final String CSV_HEADER =
            "timestamp,actor_id,actor_type,action,resource_type,resource_id,description,ip_address,request_id";

    private final ObjectMapper mapper;

    public AuditExporter() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public AuditExporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String toCsv(List<AuditLogEntry> entries) {
        StringWriter out = new StringWriter();
        writeCsv(entries, out);
        return out.toString();
    }

    public void writeCsv(List<AuditLogEntry> entries, Writer out) {
        try {
            out.write(CSV_HEADER);
            out.write('\n');
            for (AuditLogEntry e : entries) {
                out.write(String.join(",",
                        e.createdAt().toString(),
                        csv(e.actorId()),
                        e.actorType().value(),
                        e.action().value(),
                        csv(e.resourceType()),
                        csv(e.resourceId()),
                        quoted(e.description()),
                        csv(e.ipAddress()),
                        csv(e.requestId())));
                out.write('\n');
            }
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit CSV export", e);
        }
    }

    /**
     * One JSON object per line, with snake_case field names.
     */
    public String toJsonLines(List<AuditLogEntry> entries) {
        StringBuilder out = new StringBuilder();
        for (AuditLogEntry e : entries) {
            try {
                out.append(mapper.writeValueAsString(toJson(e))).append('\n');
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Failed to serialize audit entry " + e.id(), ex);
            }
        }
        return out.toString();
    }

    private static Map<String, Object> toJson(AuditLogEntry e) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", e.id().toString());
        json.put("tenant_id", e.tenantId());
        json.put("actor_id", e.actorId());
        json.put("actor_type", e.actorType().value());
        json.put("ip_address", e.ipAddress());
        json.put("request_id", e.requestId());
        json.put("action", e.action().value());
        json.put("resource_type", e.resourceType());
        json.put("resource_id", e.resourceId());
        json.put("description", e.description());
        json.put("old_values", e.oldValues());
        json.put("new_values", e.newValues());
        json.put("metadata", e.metadata());
        json.put("created_at", e.createdAt());
        return json;
    }

    /** Plain cell; commas, quotes and line breaks force quoting. */
    private static String csv(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            return quoted(value);
        }
        return value;
    }

    private static String quoted(String value) {
        return "\"" + (value == null ? "" : value.replace("\"", "\"\"")) + "\"";
    }
}
