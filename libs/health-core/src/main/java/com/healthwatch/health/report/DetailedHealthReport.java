package com.healthwatch.health.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.healthwatch.health.HealthStatus;
import com.healthwatch.health.MemoryUsage;
import com.healthwatch.health.ServiceMetrics;

import java.time.Instant;

/**
 * Payload of the detailed health report.
 *
 * @param uptime      whole seconds since the monitor started
 * @param cpu         CPU percentage, or null when it could not be sampled
 * @param environment deployment environment, if configured
 * @param build       build identifier, if configured
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetailedHealthReport(
        HealthStatus status,
        Instant timestamp,
        String service,
        String version,
        long uptime,
        MemoryUsage memory,
        Double cpu,
        ServiceMetrics metrics,
        String environment,
        String build
) implements HealthReport {
}
