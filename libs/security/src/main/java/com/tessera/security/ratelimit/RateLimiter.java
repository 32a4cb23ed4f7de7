package com.tessera.security.ratelimit;

import com.tessera.observability.MetricFactory;
import com.tessera.security.credential.Principal;
import com.tessera.security.error.RateLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Token bucket admission control per {@link RateLimitSubject}.
 * <p>
 * If the bucket store fails the request is admitted and the failure logged.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    static final String METRIC_ADMITTED = "tessera.ratelimit.admitted";
    static final String METRIC_REJECTED = "tessera.ratelimit.rejected";

    private final TokenBucketStore store;
    private final RateLimitPolicies policies;
    private final Clock clock;
    private final MetricFactory metrics;

    public RateLimiter(TokenBucketStore store, RateLimitPolicies policies, Clock clock, MetricFactory metrics) {
        if (store == null || policies == null || clock == null || metrics == null) {
            throw new IllegalArgumentException("store, policies, clock and metrics are required");
        }
        this.store = store;
        this.policies = policies;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Takes one token for the subject and reports the outcome without throwing.
     */
    public RateLimitDecision evaluate(RateLimitSubject subject) {
        Instant now = clock.instant();
        RateLimitPolicy policy = policies.forTier(subject.tier());
        if (policy.isUnlimited()) {
            return RateLimitDecision.unlimited(subject.tier(), now);
        }

        double rate = policy.refillPerSecond();
        TokenBucketStore.BucketState state;
        try {
            state = store.consume(subject.key(), policy.burst(), rate, now);
        } catch (RuntimeException e) {
            log.warn("Rate limit store unavailable, admitting {}", subject.key(), e);
            return new RateLimitDecision(true, policy.requestsPerWindow(), policy.burst(), now, 0, subject.tier());
        }

        long secondsToFull = rate <= 0 ? 0 : (long) Math.ceil((policy.burst() - state.tokens()) / rate);
        Instant resetAt = now.plusSeconds(secondsToFull);
        long retryAfter = 0;
        if (!state.allowed()) {
            retryAfter = rate <= 0
                    ? policy.window().toSeconds()
                    : Math.max(1, (long) Math.ceil((1.0 - state.tokens()) / rate));
        }
        return new RateLimitDecision(state.allowed(), policy.requestsPerWindow(),
                (int) Math.floor(state.tokens()), resetAt, retryAfter, subject.tier());
    }

    /**
     * @throws RateLimitExceededException when the subject has no token left
     */
    public RateLimitDecision admit(RateLimitSubject subject) {
        RateLimitDecision decision = evaluate(subject);
        String tier = subject.tier().value();
        if (decision.allowed()) {
            metrics.counter(METRIC_ADMITTED, "Requests admitted by the rate limiter", "tier", tier).increment();
            return decision;
        }
        metrics.counter(METRIC_REJECTED, "Requests rejected by the rate limiter", "tier", tier).increment();
        log.info("Rate limit exceeded for {} (tier {}), retry after {}s", subject.key(), tier,
                decision.retryAfterSeconds());
        throw new RateLimitExceededException(decision.retryAfterSeconds(), decision.headers());
    }

    public RateLimitDecision admit(Principal principal, String clientIp) {
        return admit(RateLimitSubject.of(principal, clientIp));
    }
}
