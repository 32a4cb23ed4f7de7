package com.tessera.security.memory;

import com.tessera.security.apikey.ApiKey;
import com.tessera.security.apikey.ApiKeyStore;
import com.tessera.security.error.ConflictException;
import com.tessera.security.error.NotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * {@link ApiKeyStore} held in memory. Keys are stored under their tenant, so a lookup with the
 * wrong tenant finds nothing.
 */
public final class InMemoryApiKeyStore implements ApiKeyStore {

    private final Map<String, ApiKey> keys = new ConcurrentHashMap<>();

    private static String key(String tenantId, String keyId) {
        return tenantId + "/" + keyId;
    }

    @Override
    public void insert(ApiKey apiKey) {
        if (keys.putIfAbsent(key(apiKey.tenantId(), apiKey.id()), apiKey) != null) {
            throw new ConflictException("API key already exists: " + apiKey.id());
        }
    }

    @Override
    public ApiKey update(String tenantId, String keyId, UnaryOperator<ApiKey> change) {
        return keys.compute(key(tenantId, keyId), (id, current) -> {
            if (current == null) {
                throw new NotFoundException("api_key", keyId);
            }
            ApiKey replacement = change.apply(current);
            if (!replacement.id().equals(current.id()) || !replacement.tenantId().equals(current.tenantId())) {
                throw new IllegalArgumentException("an update cannot change the key id or tenant");
            }
            return replacement;
        });
    }

    @Override
    public List<ApiKey> findByPrefix(String prefix) {
        return keys.values().stream().filter(k -> k.prefix().equals(prefix)).toList();
    }

    @Override
    public Optional<ApiKey> findById(String tenantId, String keyId) {
        return Optional.ofNullable(keys.get(key(tenantId, keyId)));
    }

    @Override
    public List<ApiKey> listByTenant(String tenantId) {
        return keys.values().stream().filter(k -> k.tenantId().equals(tenantId)).toList();
    }

    @Override
    public long countActive(String tenantId, Instant now) {
        return keys.values().stream()
                .filter(k -> k.tenantId().equals(tenantId) && k.isActiveAt(now))
                .count();
    }

    @Override
    public void recordUsage(String tenantId, String keyId, Instant at, String ip) {
        keys.computeIfPresent(key(tenantId, keyId), (id, current) -> current.withUsage(at, ip));
    }
}
