package com.healthwatch.health.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.healthwatch.health.HealthStatus;

import java.time.Instant;

/**
 * Payload of the basic health report.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BasicHealthReport(
        HealthStatus status,
        Instant timestamp,
        String service,
        String version
) implements HealthReport {
}
