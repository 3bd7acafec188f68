package com.healthwatch.health;

import java.util.List;

/**
 * Bucket counts of an integration test run.
 *
 * @param total   number of tests run
 * @param passed  tests that reported {@link HealthStatus#HEALTHY}
 * @param failed  tests that reported {@link HealthStatus#UNHEALTHY} or could not run
 * @param skipped tests that reported {@link HealthStatus#DEGRADED}
 */
public record TestSummary(int total, int passed, int failed, int skipped) {

    /** Summary of a run with no tests. */
    public static final TestSummary EMPTY = new TestSummary(0, 0, 0, 0);

    public TestSummary {
        if (passed < 0 || failed < 0 || skipped < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        if (total != passed + failed + skipped) {
            throw new IllegalArgumentException(
                    "total (" + total + ") must equal passed + failed + skipped");
        }
    }

    /**
     * Classifies each result into exactly one bucket and counts the buckets.
     */
    public static TestSummary of(List<IntegrationTestResult> results) {
        int passed = 0;
        int failed = 0;
        int skipped = 0;
        for (IntegrationTestResult result : results) {
            switch (result.status()) {
                case HEALTHY -> passed++;
                case UNHEALTHY -> failed++;
                default -> skipped++;
            }
        }
        return new TestSummary(results.size(), passed, failed, skipped);
    }
}
