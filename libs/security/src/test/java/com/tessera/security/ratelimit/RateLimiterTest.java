package com.tessera.security.ratelimit;

import com.tessera.observability.MetricFactory;
import com.tessera.security.credential.Principal;
import com.tessera.security.error.ErrorCode;
import com.tessera.security.error.RateLimitExceededException;
import com.tessera.security.testing.MutableClock;
import com.tessera.security.testing.TestPrincipals;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("RateLimiter")
class RateLimiterTest {

    private static final int BURST = 5;

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        registry = new SimpleMeterRegistry();
        RateLimitPolicies policies = RateLimitPolicies.of(
                Map.of(RateLimitTier.DEFAULT, RateLimitPolicy.perMinute(60, BURST)));
        limiter = new RateLimiter(new InMemoryTokenBucketStore(), policies, clock, new MetricFactory(registry, "test"));
    }

    @Nested
    @DisplayName("Token bucket")
    class Bucket {

        @Test
        @DisplayName("admits the burst and refuses the next request with a retry delay")
        void burstThenReject() {
            Principal user = TestPrincipals.user("operator");
            for (int i = 0; i < BURST; i++) {
                limiter.admit(user, null);
            }

            assertThatThrownBy(() -> limiter.admit(user, null))
                    .isInstanceOf(RateLimitExceededException.class)
                    .satisfies(e -> {
                        RateLimitExceededException exceeded = (RateLimitExceededException) e;
                        assertThat(exceeded.errorCode()).isEqualTo(ErrorCode.RATE_LIMIT_EXCEEDED);
                        assertThat(exceeded.retryAfterSeconds()).isPositive();
                        assertThat(exceeded.headers())
                                .containsEntry(RateLimitDecision.HEADER_REMAINING, "0")
                                .containsEntry(RateLimitDecision.HEADER_RETRY_AFTER, "1");
                    });
            assertThat(registry.get("tessera.ratelimit.rejected").tag("tier", "default").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("refills over time")
        void refills() {
            RateLimitSubject subject = RateLimitSubject.of(TestPrincipals.user(), null);
            for (int i = 0; i < BURST; i++) {
                limiter.admit(subject);
            }
            assertThat(limiter.evaluate(subject).allowed()).isFalse();

            clock.advance(Duration.ofSeconds(2));

            assertThat(limiter.evaluate(subject).allowed()).isTrue();
            assertThat(limiter.evaluate(subject).allowed()).isTrue();
            assertThat(limiter.evaluate(subject).allowed()).isFalse();
        }

        @Test
        @DisplayName("reports limit, remaining and reset on admitted requests")
        void headers() {
            RateLimitDecision decision = limiter.admit(TestPrincipals.user(), null);

            assertThat(decision.headers())
                    .containsEntry(RateLimitDecision.HEADER_LIMIT, "60")
                    .containsEntry(RateLimitDecision.HEADER_REMAINING, String.valueOf(BURST - 1))
                    .containsEntry(RateLimitDecision.HEADER_RESET,
                            String.valueOf(clock.instant().plusSeconds(1).getEpochSecond()))
                    .doesNotContainKey(RateLimitDecision.HEADER_RETRY_AFTER);
        }

        @Test
        @DisplayName("counts subjects separately")
        void separateSubjects() {
            for (int i = 0; i < BURST; i++) {
                limiter.admit(TestPrincipals.user(), null);
            }

            Principal key = TestPrincipals.apiKey("key-1", TestPrincipals.TENANT_ID, Set.of("realtime"));
            assertThat(limiter.admit(key, null).allowed()).isTrue();
            assertThat(limiter.admit(null, "198.51.100.4").allowed()).isTrue();
        }
    }

    @Test
    @DisplayName("unlimited subjects are admitted without headers")
    void unlimited() {
        Principal unlimited = Principal.apiKey("key-9", TestPrincipals.TENANT_ID, List.of(), Set.of("admin"),
                RateLimitTier.UNLIMITED);
        for (int i = 0; i < 1_000; i++) {
            limiter.admit(unlimited, null);
        }

        RateLimitDecision decision = limiter.admit(unlimited, null);
        assertThat(decision.isUnlimited()).isTrue();
        assertThat(decision.headers()).isEmpty();
    }

    @Test
    @DisplayName("an unavailable store admits the request")
    void failOpen() {
        TokenBucketStore broken = mock(TokenBucketStore.class);
        when(broken.consume(anyString(), anyInt(), anyDouble(), any()))
                .thenThrow(new IllegalStateException("redis down"));
        RateLimiter failOpen = new RateLimiter(broken, RateLimitPolicies.defaults(), clock,
                new MetricFactory(registry, "test"));

        assertThat(failOpen.admit(TestPrincipals.user(), null).allowed()).isTrue();
    }

    @Test
    @DisplayName("subjects are keyed by API key, then user, then address")
    void subjects() {
        assertThat(RateLimitSubject.of(TestPrincipals.apiKey("key-1", "t", Set.of()), "1.2.3.4").key())
                .isEqualTo("apikey:key-1");
        assertThat(RateLimitSubject.of(TestPrincipals.user(), "1.2.3.4").key())
                .isEqualTo("user:tenant-a:user-1");
        assertThat(RateLimitSubject.of(null, "1.2.3.4").key()).isEqualTo("ip:1.2.3.4");
        assertThat(RateLimitSubject.of(null, null).key()).isEqualTo("ip:unknown");
    }
}
