package com.micronote.backend.global.redis;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Runs against a real Redis; skipped where Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisKeyValueStoreContainerTest {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    private RedisKeyValueStore store;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        redisTemplate.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
        store = new RedisKeyValueStore(redisTemplate);
    }

    @Test
    void valuesExpireWithTtl() {
        store.set("refresh:1", "hash", Duration.ofMinutes(5));

        assertThat(store.get("refresh:1")).contains("hash");
        assertThat(store.exists("refresh:1")).isTrue();
        assertThat(store.ttl("refresh:1")).hasValueSatisfying(ttl ->
                assertThat(ttl).isGreaterThan(Duration.ofMinutes(4)).isLessThanOrEqualTo(Duration.ofMinutes(5)));
        assertThat(store.ttl("missing")).isEmpty();
    }

    @Test
    void patternDeleteOnlyTouchesMatchingKeys() {
        store.set("cache:alice:/api/notes:a", "1", Duration.ofMinutes(5));
        store.set("cache:alice:/api/notes/x:b", "2", Duration.ofMinutes(5));
        store.set("cache:alice:/api/todos:c", "3", Duration.ofMinutes(5));
        store.set("cache:bob:/api/notes:d", "4", Duration.ofMinutes(5));

        long deleted = store.deleteByPattern("cache:alice:/api/notes*");

        assertThat(deleted).isEqualTo(2);
        assertThat(store.keys("cache:*")).containsExactlyInAnyOrder("cache:alice:/api/todos:c", "cache:bob:/api/notes:d");
        assertThat(store.delete(List.of())).isZero();
    }
}
