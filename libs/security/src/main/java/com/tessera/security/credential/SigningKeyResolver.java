package com.tessera.security.credential;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.LocatorAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Key;
import java.security.PublicKey;
import java.time.Duration;

/**
 * Locates the verification key of a JWS by its {@code kid} header.
 * <p>
 * Keys are held in a Caffeine loading cache for a bounded time. Concurrent lookups of a key id
 * that is not cached share a single call to the {@link SigningKeyProvider}; a failed fetch is not
 * cached and is retried by the next lookup.
 * <p>
 * When the provider does not select keys by id, every {@code kid} maps to one cache entry, so
 * tokens with made-up key ids cannot trigger fetches or evict the cached key.
 */
public final class SigningKeyResolver extends LocatorAdapter<Key> {

    private static final Logger log = LoggerFactory.getLogger(SigningKeyResolver.class);

    /** Cache key used for tokens without a {@code kid} header. */
    public static final String DEFAULT_KEY_ID = "default";

    private final LoadingCache<String, PublicKey> keys;
    private final boolean selectsByKeyId;

    public SigningKeyResolver(SigningKeyProvider provider, Duration ttl) {
        this(provider, ttl, Ticker.systemTicker());
    }

    SigningKeyResolver(SigningKeyProvider provider, Duration ttl, Ticker ticker) {
        if (provider == null) {
            throw new IllegalArgumentException("provider must not be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.selectsByKeyId = provider.selectsByKeyId();
        this.keys = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(256)
                .ticker(ticker)
                .build(keyId -> {
                    log.info("Fetching signing key '{}' from identity provider", keyId);
                    return provider.fetch(keyId);
                });
    }

    @Override
    protected Key locate(JwsHeader header) {
        String keyId = header.getKeyId();
        return resolve(keyId == null || keyId.isBlank() ? DEFAULT_KEY_ID : keyId);
    }

    /**
     * @throws SigningKeyException if the provider fails or returns no key
     */
    public PublicKey resolve(String keyId) {
        PublicKey key = keys.get(selectsByKeyId ? keyId : DEFAULT_KEY_ID);
        if (key == null) {
            throw new SigningKeyException("Unknown signing key: " + keyId);
        }
        return key;
    }

    /** Drops every cached key so the next lookup refetches it. */
    public void invalidateAll() {
        keys.invalidateAll();
    }
}
