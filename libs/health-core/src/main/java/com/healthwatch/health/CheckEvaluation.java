package com.healthwatch.health;

import java.util.Map;

/**
 * Verdict a custom probe derives from whatever its check returned.
 *
 * @param status   resulting dependency status
 * @param error    message explaining a non-healthy status, or null
 * @param metadata details to attach to the dependency result, or null
 */
public record CheckEvaluation(HealthStatus status, String error, Map<String, Object> metadata) {

    public CheckEvaluation {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    public static CheckEvaluation healthy() {
        return new CheckEvaluation(HealthStatus.HEALTHY, null, null);
    }

    public static CheckEvaluation healthy(Map<String, Object> metadata) {
        return new CheckEvaluation(HealthStatus.HEALTHY, null, metadata);
    }

    public static CheckEvaluation unhealthy(String error) {
        return new CheckEvaluation(HealthStatus.UNHEALTHY, error, null);
    }
}
