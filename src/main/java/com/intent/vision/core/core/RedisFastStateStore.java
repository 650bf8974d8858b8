package com.intent.vision.core.core;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis implementation using StringRedisTemplate. INCR is atomic on the server,
 * so concurrent forecast requests across instances never lose an increment.
 */
public final class RedisFastStateStore implements FastStateStore {

    // DECR that stops at zero and leaves missing keys alone
    private static final DefaultRedisScript<Long> DECR_FLOOR_ZERO = new DefaultRedisScript<>(
            "local v = redis.call('GET', KEYS[1]) "
                    + "if not v then return 0 end "
                    + "if tonumber(v) <= 0 then return 0 end "
                    + "return redis.call('DECR', KEYS[1])",
            Long.class);

    private final StringRedisTemplate redis;
    private final String prefix;

    public RedisFastStateStore(StringRedisTemplate redis, String prefix) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.prefix = prefix == null ? "" : prefix;
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(k(key)));
    }

    @Override
    public void delete(String key) {
        redis.delete(k(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        final String k = k(key);
        Boolean ok = (ttl == null || ttl.isZero() || ttl.isNegative())
                ? redis.opsForValue().setIfAbsent(k, value)
                : redis.opsForValue().setIfAbsent(k, value, ttl.toMillis(), TimeUnit.MILLISECONDS);
        return Boolean.TRUE.equals(ok);
    }

    @Override
    public long incr(String key, Duration ttlIfNew) {
        final String k = k(key);
        Long val = redis.opsForValue().increment(k);
        if (val != null && val == 1L && ttlIfNew != null && !ttlIfNew.isZero() && !ttlIfNew.isNegative()) {
            // only the creator of the key sets its retention
            redis.expire(k, ttlIfNew.toMillis(), TimeUnit.MILLISECONDS);
        }
        return val == null ? 0L : val;
    }

    @Override
    public long decr(String key) {
        Long val = redis.execute(DECR_FLOOR_ZERO, Collections.singletonList(k(key)));
        return val == null ? 0L : val;
    }
}
