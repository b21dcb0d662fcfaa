package com.medclinic.backend.global.ratelimit;

import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Shared counters in Redis, one key per window. The key expires when its window closes.
 */
@Component
@ConditionalOnProperty(value = "clinic.rate-limit.store", havingValue = "redis")
public class RedisRateLimitStore implements RateLimitStore {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Clock clock;

    public RedisRateLimitStore(
            StringRedisTemplate redisTemplate,
            @Value("${clinic.rate-limit.redis-key-prefix:medclinic:rl:}") String keyPrefix,
            Clock clock
    ) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
        this.clock = clock;
    }

    @Override
    public long incrementAndGet(String key, long windowIndex, long windowEndMillis) {
        String redisKey = keyPrefix + key + ":" + windowIndex;
        Long count = redisTemplate.opsForValue().increment(redisKey);
        if (count == null) {
            throw new IllegalStateException("Redis INCR returned no value for " + redisKey);
        }
        if (count == 1L) {
            long ttlMillis = Math.max(1L, windowEndMillis - clock.millis());
            redisTemplate.expire(redisKey, Duration.ofMillis(ttlMillis));
        }
        return count;
    }
}
