package com.tessera.security.ratelimit;

import java.time.Instant;

/**
 * Storage of token buckets. {@link #consume} must be atomic per key across every caller that
 * shares the store, including other nodes for distributed implementations.
 */
public interface TokenBucketStore {

    /**
     * Refills the bucket for the time elapsed since its last update, then takes one token if
     * one is available. A bucket seen for the first time starts full.
     *
     * @param key             bucket key
     * @param capacity        maximum number of tokens
     * @param refillPerSecond tokens added per second
     * @param now             current time
     * @return the bucket state after the attempt
     */
    BucketState consume(String key, int capacity, double refillPerSecond, Instant now);

    /**
     * @param allowed whether a token was taken
     * @param tokens  tokens left in the bucket after the attempt
     */
    record BucketState(boolean allowed, double tokens) {
    }
}
