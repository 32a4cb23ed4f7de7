package com.tessera.security.apikey;

/**
 * Result of issuing a key: the stored record plus the plaintext, which is returned exactly once
 * and cannot be recovered afterwards.
 */
public record IssuedApiKey(ApiKey key, String plaintext) {

    @Override
    public String toString() {
        return "IssuedApiKey[id=" + key.id() + ", prefix=" + key.prefix() + ", plaintext=***]";
    }
}
