package com.micronote.backend.global.config;

import com.micronote.backend.global.redis.KeyValueStore;
import com.micronote.backend.global.redis.RedisKeyValueStore;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Exposes Redis to the rest of the application only through {@link KeyValueStore}, so the cache
 * and session store can be exercised against an in-memory store in tests.
 * Redis repositories are switched off in application.yml; nothing here is a Spring Data Redis repository.
 */
@Configuration(proxyBeanMethods = false)
public class RedisConfig {

    @Bean
    public KeyValueStore keyValueStore(StringRedisTemplate redisTemplate) {
        return new RedisKeyValueStore(redisTemplate);
    }
}
