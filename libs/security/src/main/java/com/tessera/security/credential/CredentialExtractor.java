package com.tessera.security.credential;

import java.util.Locale;
import java.util.Optional;

/**
 * Pulls the raw credential out of transport metadata.
 * <p>
 * An {@code Authorization: Bearer <credential>} header wins over an {@value #API_KEY_HEADER}
 * header. Either may carry a token or an API key; {@link CredentialValidator} tells them apart.
 */
public final class CredentialExtractor {

    /** Header carrying an API key. */
    public static final String API_KEY_HEADER = "X-API-Key";

    /** Query parameter accepted on streaming upgrades, where browsers cannot set headers. */
    public static final String ACCESS_TOKEN_PARAMETER = "access_token";

    private static final String BEARER = "bearer";

    private CredentialExtractor() {
    }

    /**
     * Extracts the credential from an {@code Authorization} header value in the form
     * {@code Bearer <credential>}. The scheme is matched case-insensitively.
     *
     * @return the credential, or empty if the header is missing, uses another scheme or is empty
     */
    public static Optional<String> fromAuthorization(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= BEARER.length()
                || !trimmed.substring(0, BEARER.length()).toLowerCase(Locale.ROOT).equals(BEARER)
                || !Character.isWhitespace(trimmed.charAt(BEARER.length()))) {
            return Optional.empty();
        }
        String credential = trimmed.substring(BEARER.length()).strip();
        return credential.isEmpty() ? Optional.empty() : Optional.of(credential);
    }

    /**
     * Credential from either header, {@code Authorization} first.
     */
    public static Optional<String> extract(String authorizationHeader, String apiKeyHeader) {
        Optional<String> bearer = fromAuthorization(authorizationHeader);
        if (bearer.isPresent()) {
            return bearer;
        }
        if (apiKeyHeader == null || apiKeyHeader.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(apiKeyHeader.strip());
    }
}
