package com.lihtcmate.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes. Readiness follows the database health indicator only; HUD outages
 * degrade AMI lookups and are not reported here.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", Instant.now(clock).toString());
    }

    @GetMapping("/readyz")
    public HealthResponse readyz() {
        String status;
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            status = healthComponent.getStatus().getCode();
            if (healthComponent instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get("db");
                if (db != null) {
                    status = db.getStatus().getCode();
                }
            }
        } catch (RuntimeException ex) {
            status = "DOWN";
        }
        return new HealthResponse(status, Instant.now(clock).toString());
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {}
}
