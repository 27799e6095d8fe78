package com.micronote.backend.health;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness ({@code /healthz}, {@code /health}) and readiness ({@code /readyz}) probes.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    /**
     * Health indicators that must be UP before the instance takes traffic.
     */
    private static final List<String> READINESS_COMPONENTS = List.of("db", "redis");

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), clock.instant().toString());
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthz();
    }

    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status = resolveReadiness();
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status, clock.instant().toString()));
    }

    private String resolveReadiness() {
        try {
            HealthComponent health = healthEndpoint.health();
            if (!(health instanceof CompositeHealth composite)) {
                return health.getStatus().getCode();
            }
            Map<String, HealthComponent> components = composite.getComponents();
            for (String name : READINESS_COMPONENTS) {
                HealthComponent component = components.get(name);
                // indicators switched off by configuration are not part of readiness
                if (component != null && !Status.UP.equals(component.getStatus())) {
                    return component.getStatus().getCode();
                }
            }
            return Status.UP.getCode();
        } catch (RuntimeException e) {
            log.warn("Readiness check failed: {}", e.toString());
            return Status.DOWN.getCode();
        }
    }

    public record HealthResponse(
            String status,   // "UP" | "DOWN"
            String timestamp // ISO-8601
    ) {
    }
}
