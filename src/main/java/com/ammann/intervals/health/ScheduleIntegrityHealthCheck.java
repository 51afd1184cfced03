package com.ammann.intervals.health;

import com.ammann.intervals.dto.ValidationReportDTO;
import com.ammann.intervals.service.IntegrityValidationService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.time.Duration;
import java.time.Instant;

/**
 * Readiness health check that verifies the program and interval stores can be read.
 *
 * <p>Runs a silent integrity validation on every call and exposes its verdict and store
 * sizes as data. Findings do not make the check DOWN; only an unreadable store does.
 */
@Readiness
@ApplicationScoped
public class ScheduleIntegrityHealthCheck implements HealthCheck {

    @Inject IntegrityValidationService validationService;

    @Override
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();
            ValidationReportDTO report = validationService.runSilentValidation();
            Duration validationTime = Duration.between(start, Instant.now());

            return HealthCheckResponse.named("schedule-integrity")
                    .up()
                    .withData("programs", report.summary().programCount())
                    .withData("interval-records", report.summary().intervalRecordCount())
                    .withData("integrity-valid", report.overallValid())
                    .withData("errors", report.summary().totalErrors())
                    .withData("warnings", report.summary().totalWarnings())
                    .withData("validation-time-ms", validationTime.toMillis())
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named("schedule-integrity")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("stores-accessible", false)
                    .build();
        }
    }
}
