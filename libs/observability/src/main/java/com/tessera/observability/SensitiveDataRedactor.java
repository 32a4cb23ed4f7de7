package com.tessera.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps credentials out of logs and audit snapshots.
 * <p>
 * Two kinds of redaction are applied:
 * <ul>
 *   <li>field names matching a sensitive pattern (password, token, secret, authorization, apiKey,
 *       credential, ...) have their value replaced with {@value #REDACTED}, case-insensitively;</li>
 *   <li>string values that look like an API key ({@code tsk_} and at least 16 hex characters; the
 *       12-character display prefix stays readable) or a compact JWS are replaced
 *       regardless of the field they appear in.</li>
 * </ul>
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization",
            "apikey", "api_key", "credential", "plaintext"
    );

    private static final Pattern API_KEY_VALUE = Pattern.compile("tsk_[0-9a-fA-F]{16,}");
    private static final Pattern JWT_VALUE =
            Pattern.compile("[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]+");

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive field patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (case-insensitive).
     *
     * @param patterns field name patterns to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with sensitive fields and credential-shaped values redacted.
     * Nested maps are redacted recursively. Null input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else if (value instanceof Map<?, ?> nested) {
                result.put(key, redact(asStringKeyed(nested)));
            } else if (value instanceof String text) {
                result.put(key, redactValue(text));
            } else {
                result.put(key, value);
            }
        }
        return result;
    }

    /**
     * Replaces API keys and JWTs embedded in free text.
     */
    public String redactValue(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String masked = API_KEY_VALUE.matcher(text).replaceAll(REDACTED);
        return JWT_VALUE.matcher(masked).replaceAll(REDACTED);
    }

    /**
     * Returns a short, non-reversible label for a presented credential, suitable for a log line:
     * the first eight characters followed by an ellipsis.
     */
    public static String fingerprint(String credential) {
        if (credential == null || credential.isBlank()) {
            return "<none>";
        }
        return credential.length() <= 8 ? "***" : credential.substring(0, 8) + "...";
    }

    /**
     * Checks whether a field name matches any sensitive pattern (case-insensitive).
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    /**
     * Returns the set of sensitive patterns this redactor uses.
     */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    private static Map<String, Object> asStringKeyed(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>(map.size());
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
