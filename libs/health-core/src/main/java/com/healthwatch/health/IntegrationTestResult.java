package com.healthwatch.health;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Result of one integration test run.
 * <p>
 * A {@link HealthStatus#DEGRADED} status means the test did not run to a verdict and is
 * counted as skipped in the {@link TestSummary}.
 *
 * @param name     test name (e.g., "user-login-flow")
 * @param status   outcome of the test
 * @param duration run time in milliseconds
 * @param error    failure message, or null
 * @param details  optional test-specific details (steps, timings, ...)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntegrationTestResult(
        String name,
        HealthStatus status,
        double duration,
        String error,
        Map<String, Object> details
) {

    public IntegrationTestResult {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (duration < 0 || Double.isNaN(duration)) {
            throw new IllegalArgumentException("duration must not be negative");
        }
        details = details == null ? null : Map.copyOf(details);
    }

    /** Creates a passed test result. */
    public static IntegrationTestResult passed(String name, double duration) {
        return new IntegrationTestResult(name, HealthStatus.HEALTHY, duration, null, null);
    }

    /** Creates a failed test result. */
    public static IntegrationTestResult failed(String name, double duration, String error) {
        return new IntegrationTestResult(name, HealthStatus.UNHEALTHY, duration, error, null);
    }

    /** Creates a skipped test result. */
    public static IntegrationTestResult skipped(String name, String reason) {
        return new IntegrationTestResult(name, HealthStatus.DEGRADED, 0, reason, null);
    }

    /** Returns a copy of this result with the given details attached. */
    public IntegrationTestResult withDetails(Map<String, Object> details) {
        return new IntegrationTestResult(name, status, duration, error, details);
    }
}
