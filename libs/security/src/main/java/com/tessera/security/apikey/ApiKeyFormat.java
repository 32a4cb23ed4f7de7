package com.tessera.security.apikey;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Shape of an API key: {@value #PREFIX} followed by 64 lowercase hex characters (32 random bytes),
 * 68 characters in total. The first {@value #DISPLAY_PREFIX_LENGTH} characters are stored in clear
 * to identify the key in listings and to look it up.
 */
public final class ApiKeyFormat {

    public static final String PREFIX = "tsk_";
    public static final int SECRET_BYTES = 32;
    public static final int LENGTH = PREFIX.length() + SECRET_BYTES * 2;
    public static final int DISPLAY_PREFIX_LENGTH = 12;

    private static final Pattern WELL_FORMED = Pattern.compile(Pattern.quote(PREFIX) + "[0-9a-f]{64}");

    private ApiKeyFormat() {
    }

    public static String newPlaintext(SecureRandom random) {
        byte[] secret = new byte[SECRET_BYTES];
        random.nextBytes(secret);
        return PREFIX + HexFormat.of().formatHex(secret);
    }

    public static boolean isWellFormed(String candidate) {
        return candidate != null && candidate.length() == LENGTH && WELL_FORMED.matcher(candidate).matches();
    }

    public static String displayPrefix(String plaintext) {
        return plaintext.substring(0, DISPLAY_PREFIX_LENGTH);
    }
}
