package com.tessera.security.credential;

import java.security.PublicKey;

/**
 * Source of token signing keys, typically the identity provider.
 */
public interface SigningKeyProvider {

    /**
     * Fetches the public key for a key id. Called at most once per key id and cache period.
     *
     * @param keyId the {@code kid} header of the token, or {@value SigningKeyResolver#DEFAULT_KEY_ID}
     *              when the token carries none
     * @throws SigningKeyException if the key cannot be fetched or is unknown
     */
    PublicKey fetch(String keyId);

    /**
     * Whether {@link #fetch(String)} picks the key by its id. Providers that serve a single key
     * for every id return false, and the resolver then caches that key once instead of per id.
     */
    default boolean selectsByKeyId() {
        return true;
    }
}
