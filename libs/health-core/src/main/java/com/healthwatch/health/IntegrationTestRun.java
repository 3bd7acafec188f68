package com.healthwatch.health;

import java.util.List;

/**
 * Collected results of one integration test batch plus their summary.
 *
 * @param results results in registration order
 * @param summary bucket counts derived from {@code results}
 */
public record IntegrationTestRun(List<IntegrationTestResult> results, TestSummary summary) {

    public IntegrationTestRun {
        results = List.copyOf(results);
    }

    /** Builds a run, deriving the summary from the results. */
    public static IntegrationTestRun of(List<IntegrationTestResult> results) {
        return new IntegrationTestRun(results, TestSummary.of(results));
    }
}
