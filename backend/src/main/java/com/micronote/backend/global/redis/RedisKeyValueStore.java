package com.micronote.backend.global.redis;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * {@link KeyValueStore} on top of {@link StringRedisTemplate}. Pattern lookups use SCAN so a large
 * keyspace never blocks the server the way KEYS would.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private static final long SCAN_BATCH_SIZE = 500;

    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key));
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(keys);
        return deleted != null ? deleted : 0;
    }

    @Override
    public Set<String> keys(String pattern) {
        Set<String> result = redisTemplate.execute((RedisCallback<Set<String>>) connection -> {
            Set<String> matched = new HashSet<>();
            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH_SIZE).build();
            try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
                while (cursor.hasNext()) {
                    matched.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return matched;
        });
        return result != null ? result : Set.of();
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Long millis = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
        // -2: no such key, -1: no expiry
        if (millis == null || millis < 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(millis));
    }
}
