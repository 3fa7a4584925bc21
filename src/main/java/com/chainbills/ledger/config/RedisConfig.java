package com.chainbills.ledger.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis wiring for the shared in-flight message guard.
 *
 * Only active with {@code ledger.guard.store=redis}; a single node runs fine
 * with the in-memory guard.
 */
@Configuration
@ConditionalOnProperty(name = "ledger.guard.store", havingValue = "redis")
public class RedisConfig {

    @Bean
    public RedisConnectionFactory redisConnectionFactory(LedgerProperties properties) {
        LedgerProperties.Guard guard = properties.getGuard();
        return new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(guard.getRedisHost(), guard.getRedisPort()));
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }
}
