package com.tessera.security.ratelimit;

import java.time.Duration;

/**
 * Token bucket parameters of a tier: the bucket holds at most {@code burst} tokens and refills
 * continuously at {@code requestsPerWindow} tokens per {@code window}.
 */
public record RateLimitPolicy(int requestsPerWindow, int burst, Duration window) {

    public RateLimitPolicy {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (requestsPerWindow < 0 || burst < 0) {
            throw new IllegalArgumentException("requestsPerWindow and burst must not be negative");
        }
    }

    /** A policy that admits everything. */
    public static RateLimitPolicy unlimited() {
        return new RateLimitPolicy(0, 0, Duration.ofMinutes(1));
    }

    public static RateLimitPolicy perMinute(int requests, int burst) {
        return new RateLimitPolicy(requests, burst, Duration.ofMinutes(1));
    }

    public boolean isUnlimited() {
        return requestsPerWindow == 0 && burst == 0;
    }

    public double refillPerSecond() {
        return requestsPerWindow / (window.toMillis() / 1000.0);
    }
}
