package com.tessera.security.apikey;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One-way hashing of API key secrets with SHA-256 and constant-time comparison.
 */
public final class ApiKeyHasher {

    private ApiKeyHasher() {
    }

    /**
     * Lowercase hex SHA-256 of the full plaintext key.
     */
    public static String hash(String plaintext) {
        return HexFormat.of().formatHex(digest(plaintext));
    }

    /**
     * Compares the hash of {@code plaintext} with {@code storedHash} in time independent of where
     * they differ.
     */
    public static boolean matches(String plaintext, String storedHash) {
        if (plaintext == null || storedHash == null) {
            return false;
        }
        byte[] expected;
        try {
            expected = HexFormat.of().parseHex(storedHash);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(digest(plaintext), expected);
    }

    private static byte[] digest(String plaintext) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(plaintext.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
