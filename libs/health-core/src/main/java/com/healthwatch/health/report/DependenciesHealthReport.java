package com.healthwatch.health.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.healthwatch.health.DependencyHealth;
import com.healthwatch.health.HealthStatus;

import java.time.Instant;
import java.util.List;

/**
 * Payload of the dependencies report. {@code status} reflects the dependencies only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DependenciesHealthReport(
        HealthStatus status,
        Instant timestamp,
        String service,
        String version,
        List<DependencyHealth> dependencies
) implements HealthReport {

    public DependenciesHealthReport {
        dependencies = List.copyOf(dependencies);
    }
}
