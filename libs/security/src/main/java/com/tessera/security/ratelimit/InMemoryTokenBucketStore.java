package com.tessera.security.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.time.Instant;

/**
 * Single-node bucket store. Buckets idle for longer than the configured time are evicted; an
 * evicted bucket was full again by then anyway as long as the idle time exceeds one window.
 */
public final class InMemoryTokenBucketStore implements TokenBucketStore {

    private record Bucket(double tokens, Instant updatedAt) {
    }

    private final Cache<String, Bucket> buckets;

    public InMemoryTokenBucketStore(Duration idleEviction) {
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(idleEviction)
                .maximumSize(1_000_000)
                .build();
    }

    public InMemoryTokenBucketStore() {
        this(Duration.ofMinutes(10));
    }

    @Override
    public BucketState consume(String key, int capacity, double refillPerSecond, Instant now) {
        boolean[] allowed = new boolean[1];
        Bucket updated = buckets.asMap().compute(key, (k, current) -> {
            double tokens = current == null ? capacity : refill(current, capacity, refillPerSecond, now);
            if (tokens >= 1.0) {
                allowed[0] = true;
                tokens -= 1.0;
            } else {
                allowed[0] = false;
            }
            return new Bucket(tokens, now);
        });
        return new BucketState(allowed[0], updated.tokens());
    }

    private static double refill(Bucket bucket, int capacity, double refillPerSecond, Instant now) {
        long elapsedMillis = Math.max(0, Duration.between(bucket.updatedAt(), now).toMillis());
        return Math.min(capacity, bucket.tokens() + elapsedMillis / 1000.0 * refillPerSecond);
    }

    /** Removes every bucket. */
    public void clear() {
        buckets.invalidateAll();
    }
}
