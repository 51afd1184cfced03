/* (C)2026 */
package com.ammann.intervals.health;

import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check. Reports UP whenever the process can answer, with the time since the
 * check was created.
 */
@Liveness
@ApplicationScoped
public class LivenessCheck implements HealthCheck {

    private final Instant startedAt = Instant.now();

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("alive")
                .up()
                .withData("uptime-seconds", Duration.between(startedAt, Instant.now()).toSeconds())
                .build();
    }
}
