package com.healthwatch.health;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Combines samples and check results into one status per report kind.
 * <p>
 * Every method is a deterministic function of its arguments and the thresholds the
 * aggregator was built with.
 */
public final class HealthAggregator {

    private final HealthThresholds thresholds;

    public HealthAggregator() {
        this(HealthThresholds.DEFAULTS);
    }

    public HealthAggregator(HealthThresholds thresholds) {
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds must not be null");
        }
        this.thresholds = thresholds;
    }

    /**
     * Overall status of the service itself. Rules are evaluated in order and the first
     * match wins: resource usage (memory, or CPU when sampled) beats error rate, and within
     * each the unhealthy threshold is checked first.
     */
    public HealthStatus basicStatus(MemoryUsage memory, OptionalDouble cpu, ServiceMetrics metrics) {
        if (exceeds(memory, cpu, thresholds.resourceUnhealthyPercent())) {
            return HealthStatus.UNHEALTHY;
        }
        if (exceeds(memory, cpu, thresholds.resourceDegradedPercent())) {
            return HealthStatus.DEGRADED;
        }
        if (metrics.errorRate() > thresholds.errorRateUnhealthy()) {
            return HealthStatus.UNHEALTHY;
        }
        if (metrics.errorRate() > thresholds.errorRateDegraded()) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }

    /**
     * Overall status of the dependencies: any unhealthy dependency makes the result unhealthy,
     * otherwise any degraded one makes it degraded. No dependencies at all is healthy.
     */
    public HealthStatus dependencyStatus(List<DependencyHealth> dependencies) {
        boolean anyUnhealthy = false;
        boolean anyDegraded = false;
        for (DependencyHealth dependency : dependencies) {
            if (dependency.status() == HealthStatus.UNHEALTHY) {
                anyUnhealthy = true;
            } else if (dependency.status() == HealthStatus.DEGRADED) {
                anyDegraded = true;
            }
        }
        if (anyUnhealthy) {
            return HealthStatus.UNHEALTHY;
        }
        if (anyDegraded) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }

    /**
     * Overall status of an integration test run: failures make it unhealthy, otherwise
     * skipped tests make it degraded.
     */
    public HealthStatus testStatus(TestSummary summary) {
        if (summary.failed() > 0) {
            return HealthStatus.UNHEALTHY;
        }
        if (summary.skipped() > 0) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }

    public HealthThresholds thresholds() {
        return thresholds;
    }

    private static boolean exceeds(MemoryUsage memory, OptionalDouble cpu, double threshold) {
        return memory.percentage() > threshold || (cpu.isPresent() && cpu.getAsDouble() > threshold);
    }
}
