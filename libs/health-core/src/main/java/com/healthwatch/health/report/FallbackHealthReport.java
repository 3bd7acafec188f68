package com.healthwatch.health.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.healthwatch.health.DependencyHealth;
import com.healthwatch.health.HealthStatus;
import com.healthwatch.health.IntegrationTestResult;
import com.healthwatch.health.TestSummary;

import java.time.Instant;
import java.util.List;

/**
 * Payload served when assembling a report failed. Always {@link HealthStatus#UNHEALTHY}.
 * <p>
 * The dependencies report adds an empty {@code dependencies} list; the integration test
 * report adds an empty {@code tests} list and a zero summary. Other kinds leave them null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FallbackHealthReport(
        HealthStatus status,
        Instant timestamp,
        String service,
        String error,
        List<DependencyHealth> dependencies,
        List<IntegrationTestResult> tests,
        TestSummary summary
) implements HealthReport {
}
