package com.tessera.security.permission;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the platform permission matrix from JSON and writes it to a {@link PermissionStore}.
 * <p>
 * The document is an array of {@code {"permission": "res:action", "allow": [roles...],
 * "conditions": {...}}}. A permission may appear in several rows, e.g. to attach conditions for
 * some roles only. Every known {@link PlatformRole} not allowed by any row gets an explicit deny
 * entry, so the stored matrix is complete.
 */
public final class PermissionMatrixSeed {

    private static final Logger log = LoggerFactory.getLogger(PermissionMatrixSeed.class);

    /** Classpath location of the platform defaults shipped with this library. */
    public static final String DEFAULT_RESOURCE = "/tessera/default-permission-matrix.json";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Row(String permission, List<String> allow, Map<String, Object> conditions) {
    }

    private final ObjectMapper mapper;

    public PermissionMatrixSeed(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<PermissionMatrixEntry> read(InputStream json) {
        List<Row> rows;
        try {
            rows = mapper.readValue(json, new TypeReference<List<Row>>() { });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read permission matrix", e);
        }
        Map<String, PermissionMatrixEntry> entries = new LinkedHashMap<>();
        for (Row row : rows) {
            Permission permission = Permission.parse(row.permission());
            List<String> allowed = row.allow() == null ? List.of() : row.allow();
            for (String role : allowed) {
                if (!PlatformRole.isKnown(role)) {
                    throw new IllegalStateException("Unknown role '%s' in matrix row %s".formatted(role, permission));
                }
                entries.put(role + "/" + permission,
                        new PermissionMatrixEntry(role, permission, true, row.conditions()));
            }
            for (PlatformRole role : PlatformRole.values()) {
                entries.putIfAbsent(role.value() + "/" + permission,
                        new PermissionMatrixEntry(role.value(), permission, false, null));
            }
        }
        return new ArrayList<>(entries.values());
    }

    /**
     * Reads {@link #DEFAULT_RESOURCE} and stores every entry.
     *
     * @return number of entries stored
     */
    public int seedDefaults(PermissionStore store) {
        try (InputStream in = PermissionMatrixSeed.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Permission matrix resource not found: " + DEFAULT_RESOURCE);
            }
            return seed(store, in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read permission matrix", e);
        }
    }

    public int seed(PermissionStore store, InputStream json) {
        List<PermissionMatrixEntry> entries = read(json);
        entries.forEach(store::saveMatrixEntry);
        log.info("Seeded {} permission matrix entries", entries.size());
        return entries.size();
    }
}
