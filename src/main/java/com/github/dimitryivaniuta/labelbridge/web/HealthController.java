package com.github.dimitryivaniuta.labelbridge.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Liveness only. Touches no collaborator, so it answers even when the database or engine is down.
 */
@RestController
public class HealthController {

    public record HealthResponse(String status, String service, Instant timestamp) {}

    private final Clock clock;

    public HealthController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping("/api/health")
    public HealthResponse health() {
        return new HealthResponse("ok", "label-bridge", clock.instant());
    }
}
