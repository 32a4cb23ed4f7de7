package com.tessera.controlplane.infrastructure.redis;

import com.tessera.security.ratelimit.TokenBucketStore;
import java.time.Instant;
import java.util.List;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Token buckets kept in Redis and shared by every node.
 *
 * <p>Refill and take run in one Lua script, so a bucket is updated atomically on the Redis server.
 * Each bucket is a hash with {@code tokens} and {@code updated_at} (epoch millis) and expires once
 * it would have refilled completely. The script replies with one integer: the remaining tokens in
 * thousandths, shifted left by one bit, with the admission flag in the lowest bit.
 */
public class RedisTokenBucketStore implements TokenBucketStore {

    static final String KEY_PREFIX = "tessera:ratelimit:";

    static final String SCRIPT =
            """
            local capacity = tonumber(ARGV[1])
            local rate = tonumber(ARGV[2])
            local now = tonumber(ARGV[3])
            local state = redis.call('HMGET', KEYS[1], 'tokens', 'updated_at')
            local tokens = tonumber(state[1])
            local updated = tonumber(state[2])
            if tokens == nil or updated == nil then
              tokens = capacity
              updated = now
            end
            if now > updated then
              tokens = math.min(capacity, tokens + (now - updated) / 1000 * rate)
              updated = now
            end
            local allowed = 0
            if tokens >= 1 then
              tokens = tokens - 1
              allowed = 1
            end
            redis.call('HSET', KEYS[1], 'tokens', tostring(tokens), 'updated_at', tostring(updated))
            local ttl = 60000
            if rate > 0 then
              ttl = math.ceil(capacity / rate * 1000) + 1000
            end
            redis.call('PEXPIRE', KEYS[1], ttl)
            return math.floor(tokens * 1000) * 2 + allowed
            """;

    private static final RedisScript<Long> CONSUME = new DefaultRedisScript<>(SCRIPT, Long.class);

    private final StringRedisTemplate redis;

    public RedisTokenBucketStore(StringRedisTemplate redis) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
    }

    @Override
    public BucketState consume(String key, int capacity, double refillPerSecond, Instant now) {
        Long reply = redis.execute(
                CONSUME,
                List.of(KEY_PREFIX + key),
                Integer.toString(capacity),
                Double.toString(refillPerSecond),
                Long.toString(now.toEpochMilli()));
        return toBucketState(reply);
    }

    static BucketState toBucketState(Long reply) {
        if (reply == null || reply < 0) {
            throw new IllegalStateException("Unexpected reply from the rate limit script: " + reply);
        }
        boolean allowed = (reply & 1L) == 1L;
        double tokens = (reply >> 1) / 1000.0;
        return new BucketState(allowed, tokens);
    }
}
