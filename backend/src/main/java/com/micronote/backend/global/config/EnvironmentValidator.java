package com.micronote.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "spring.data.redis.host",
            "jwt.secret",
            "jwt.expiration",
            "server.port"
    };

    private static final int MIN_SECRET_BYTES = 32;
    private static final long MIN_ACCESS_TTL_MILLIS = 60_000L;
    private static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + ": missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank())
                .filter(secret -> secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES)
                .ifPresent(secret -> problems.add("jwt.secret: must be at least " + MIN_SECRET_BYTES + " bytes"));

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                if (expiration < MIN_ACCESS_TTL_MILLIS || expiration > MAX_ACCESS_TTL_MILLIS) {
                    problems.add("jwt.expiration: must be between "
                            + MIN_ACCESS_TTL_MILLIS + " and " + MAX_ACCESS_TTL_MILLIS + " milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be a number");
            }
        });

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join(", ", problems));
        }
        log.info("Environment validation passed");
    }
}
