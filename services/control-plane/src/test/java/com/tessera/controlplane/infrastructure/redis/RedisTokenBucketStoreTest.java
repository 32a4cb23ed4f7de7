package com.tessera.controlplane.infrastructure.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tessera.security.ratelimit.TokenBucketStore.BucketState;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

@DisplayName("RedisTokenBucketStore")
class RedisTokenBucketStoreTest {

    @Test
    @DisplayName("reads an admitted reply")
    void readsAdmittedReply() {
        BucketState state = RedisTokenBucketStore.toBucketState(4_500L * 2 + 1);

        assertThat(state.allowed()).isTrue();
        assertThat(state.tokens()).isEqualTo(4.5);
    }

    @Test
    @DisplayName("reads a refused reply")
    void readsRefusedReply() {
        BucketState state = RedisTokenBucketStore.toBucketState(250L * 2);

        assertThat(state.allowed()).isFalse();
        assertThat(state.tokens()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("rejects a missing or negative reply")
    void rejectsMalformedReply() {
        assertThatThrownBy(() -> RedisTokenBucketStore.toBucketState(-1L))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> RedisTokenBucketStore.toBucketState(null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("runs the script on the namespaced key with capacity, rate and time")
    void passesArguments() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        when(redis.execute(any(RedisScript.class), anyList(), any(Object[].class))).thenReturn(9_000L * 2 + 1);
        var store = new RedisTokenBucketStore(redis);

        BucketState state = store.consume("apikey:k1", 10, 0.5, Instant.ofEpochMilli(1_000));

        assertThat(state.allowed()).isTrue();
        assertThat(state.tokens()).isEqualTo(9.0);
        verify(redis).execute(any(RedisScript.class), eq(List.of("tessera:ratelimit:apikey:k1")),
                eq("10"), eq("0.5"), eq("1000"));
    }
}
