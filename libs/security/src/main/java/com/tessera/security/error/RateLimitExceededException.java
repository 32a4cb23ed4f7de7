package com.tessera.security.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admission was refused by the rate limiter.
 * <p>
 * Carries the retry delay and the response headers computed at decision time so the transport
 * can render them without consulting the limiter again.
 */
public class RateLimitExceededException extends ControlPlaneException {

    private final long retryAfterSeconds;
    private final Map<String, String> headers;

    public RateLimitExceededException(long retryAfterSeconds, Map<String, String> headers) {
        super(ErrorCode.RATE_LIMIT_EXCEEDED, "Rate limit exceeded, retry after %d seconds".formatted(retryAfterSeconds),
                Map.of("retry_after", retryAfterSeconds));
        if (retryAfterSeconds <= 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be positive");
        }
        this.retryAfterSeconds = retryAfterSeconds;
        this.headers = Map.copyOf(new LinkedHashMap<>(headers));
    }

    public long retryAfterSeconds() {
        return retryAfterSeconds;
    }

    /** Rate-limit response headers, including {@code Retry-After}. */
    public Map<String, String> headers() {
        return headers;
    }
}
