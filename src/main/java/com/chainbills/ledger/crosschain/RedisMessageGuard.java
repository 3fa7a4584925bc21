package com.chainbills.ledger.crosschain;

import com.chainbills.ledger.config.LedgerProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * In-flight guard shared by every ledger node through Redis.
 * Keys expire after {@code ledger.guard.ttl} so a crashed worker cannot block a message forever.
 */
@Service
@ConditionalOnProperty(name = "ledger.guard.store", havingValue = "redis")
public class RedisMessageGuard implements MessageGuard {

    private static final String PREFIX = "ledger:inflight:";

    private final StringRedisTemplate redis;
    private final Duration ttl;

    public RedisMessageGuard(StringRedisTemplate redis, LedgerProperties properties) {
        this.redis = redis;
        this.ttl = properties.getGuard().getTtl();
    }

    @Override
    public boolean tryAcquire(String key) {
        return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(PREFIX + key, "PENDING", ttl));
    }

    @Override
    public void release(String key) {
        redis.delete(PREFIX + key);
    }

    @Override
    public boolean isInFlight(String key) {
        return Boolean.TRUE.equals(redis.hasKey(PREFIX + key));
    }
}
