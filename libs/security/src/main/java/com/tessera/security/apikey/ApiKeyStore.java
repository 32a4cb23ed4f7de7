package com.tessera.security.apikey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence for API keys. Every read except the prefix lookup used during authentication is
 * scoped by tenant.
 */
public interface ApiKeyStore {

    void insert(ApiKey key);

    /**
     * Atomically replaces a stored key with {@code change} applied to its latest stored value.
     * Concurrent updates and usage recording of the same key are serialized. When {@code change}
     * throws, nothing is written and the exception propagates.
     *
     * @return the stored replacement
     * @throws com.tessera.security.error.NotFoundException if the tenant has no such key
     */
    ApiKey update(String tenantId, String keyId, UnaryOperator<ApiKey> change);

    /**
     * All keys, of any tenant, whose display prefix equals {@code prefix}. Prefixes are not unique,
     * so the caller compares hashes.
     */
    List<ApiKey> findByPrefix(String prefix);

    Optional<ApiKey> findById(String tenantId, String keyId);

    List<ApiKey> listByTenant(String tenantId);

    long countActive(String tenantId, Instant now);

    /**
     * Atomically bumps usage count and sets last-used fields.
     */
    void recordUsage(String tenantId, String keyId, Instant at, String ip);
}
