package com.micronote.backend.global.redis;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Minimal string key-value store with per-key expiry. Implementations throw
 * {@link org.springframework.dao.DataAccessException} subclasses when the backend is unreachable.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    boolean exists(String key);

    long delete(Collection<String> keys);

    /**
     * Keys matching a glob pattern ({@code *} and {@code ?}). Enumeration is incremental and may
     * miss keys written concurrently.
     */
    Set<String> keys(String pattern);

    /**
     * Remaining time to live; empty when the key does not exist or has no expiry.
     */
    Optional<Duration> ttl(String key);

    default long delete(String key) {
        return delete(Set.of(key));
    }

    default long deleteByPattern(String pattern) {
        Set<String> matched = keys(pattern);
        if (matched.isEmpty()) {
            return 0;
        }
        return delete(matched);
    }
}
