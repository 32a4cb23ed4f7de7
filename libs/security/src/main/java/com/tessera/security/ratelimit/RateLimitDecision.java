package com.tessera.security.ratelimit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one admission check.
 *
 * @param limit             requests per window of the applicable policy
 * @param remaining         whole tokens left after this request
 * @param resetAt           when the bucket will be full again
 * @param retryAfterSeconds seconds until the next token, set only when the request was refused
 */
public record RateLimitDecision(
        boolean allowed,
        int limit,
        int remaining,
        Instant resetAt,
        long retryAfterSeconds,
        RateLimitTier tier
) {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    public static RateLimitDecision unlimited(RateLimitTier tier, Instant now) {
        return new RateLimitDecision(true, 0, 0, now, 0, tier);
    }

    public boolean isUnlimited() {
        return allowed && limit == 0;
    }

    /**
     * Response headers for this decision; empty for unlimited subjects. The reset time is in epoch
     * seconds.
     */
    public Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (isUnlimited()) {
            return headers;
        }
        headers.put(HEADER_LIMIT, Integer.toString(limit));
        headers.put(HEADER_REMAINING, Integer.toString(remaining));
        headers.put(HEADER_RESET, Long.toString(resetAt.getEpochSecond()));
        if (!allowed) {
            headers.put(HEADER_RETRY_AFTER, Long.toString(retryAfterSeconds));
        }
        return headers;
    }
}
