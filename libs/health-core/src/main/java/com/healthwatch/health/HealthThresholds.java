package com.healthwatch.health;

/**
 * Thresholds for the basic status rules. A value strictly above a threshold trips it.
 *
 * @param resourceUnhealthyPercent memory or CPU percentage above which the service is unhealthy
 * @param resourceDegradedPercent  memory or CPU percentage above which the service is degraded
 * @param errorRateUnhealthy       error rate above which the service is unhealthy
 * @param errorRateDegraded        error rate above which the service is degraded
 */
public record HealthThresholds(
        double resourceUnhealthyPercent,
        double resourceDegradedPercent,
        double errorRateUnhealthy,
        double errorRateDegraded
) {

    /** 90% / 80% resource usage, 0.5 / 0.1 error rate. */
    public static final HealthThresholds DEFAULTS = new HealthThresholds(90.0, 80.0, 0.5, 0.1);

    public HealthThresholds {
        requireWithin("resourceUnhealthyPercent", resourceUnhealthyPercent, 100.0);
        requireWithin("resourceDegradedPercent", resourceDegradedPercent, 100.0);
        requireWithin("errorRateUnhealthy", errorRateUnhealthy, 1.0);
        requireWithin("errorRateDegraded", errorRateDegraded, 1.0);
        if (resourceDegradedPercent > resourceUnhealthyPercent) {
            throw new IllegalArgumentException("resourceDegradedPercent must not exceed resourceUnhealthyPercent");
        }
        if (errorRateDegraded > errorRateUnhealthy) {
            throw new IllegalArgumentException("errorRateDegraded must not exceed errorRateUnhealthy");
        }
    }

    private static void requireWithin(String field, double value, double max) {
        if (value < 0 || value > max || Double.isNaN(value)) {
            throw new IllegalArgumentException(field + " must be within [0, " + max + "]");
        }
    }
}
