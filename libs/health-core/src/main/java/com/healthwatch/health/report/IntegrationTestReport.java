package com.healthwatch.health.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.healthwatch.health.HealthStatus;
import com.healthwatch.health.IntegrationTestResult;
import com.healthwatch.health.TestSummary;

import java.time.Instant;
import java.util.List;

/**
 * Payload of the integration test report. {@code status} reflects the test run only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntegrationTestReport(
        HealthStatus status,
        Instant timestamp,
        String service,
        String version,
        List<IntegrationTestResult> tests,
        TestSummary summary
) implements HealthReport {

    public IntegrationTestReport {
        tests = List.copyOf(tests);
    }
}
