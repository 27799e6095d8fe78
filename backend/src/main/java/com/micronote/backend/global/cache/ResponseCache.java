package com.micronote.backend.global.cache;

import java.time.Duration;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.micronote.backend.global.redis.KeyValueStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Best-effort JSON cache of HTTP responses. Every backend failure is logged and reported as a
 * miss (reads) or ignored (writes and evictions); callers never see a cache exception.
 */
@Component
public class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public ResponseCache(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public Optional<CachedResponse> get(String key) {
        try {
            Optional<String> raw = store.get(key);
            if (raw.isEmpty() || raw.get().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(raw.get(), CachedResponse.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry: key={}, err={}", key, e.getOriginalMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Cache read failed: key={}, err={}", key, e.toString());
            return Optional.empty();
        }
    }

    public void put(String key, CachedResponse response, Duration ttl) {
        try {
            store.set(key, objectMapper.writeValueAsString(response), ttl);
        } catch (JsonProcessingException e) {
            log.warn("Cache entry not serializable: key={}, err={}", key, e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("Cache write failed: key={}, err={}", key, e.toString());
        }
    }

    /**
     * @return number of evicted entries, or -1 when the backend failed
     */
    public long evict(String pattern) {
        try {
            long deleted = store.deleteByPattern(pattern);
            log.debug("Evicted {} cache entries for pattern {}", deleted, pattern);
            return deleted;
        } catch (RuntimeException e) {
            log.warn("Cache invalidation failed: pattern={}, err={}", pattern, e.toString());
            return -1;
        }
    }
}
