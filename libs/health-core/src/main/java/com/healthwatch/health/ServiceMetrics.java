package com.healthwatch.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of the service's request metrics.
 *
 * @param requestCount         requests served
 * @param errorRate            fraction of requests that failed, within [0, 1]
 * @param averageResponseTime  mean response time in milliseconds
 * @param lastRequestTimestamp when the last request was recorded, or null if none yet
 * @param customMetrics        named numeric or textual metrics
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ServiceMetrics(
        long requestCount,
        double errorRate,
        double averageResponseTime,
        Instant lastRequestTimestamp,
        Map<String, Object> customMetrics
) {

    /** Metrics of a service that has not served anything yet. */
    public static final ServiceMetrics INITIAL = new ServiceMetrics(0, 0.0, 0.0, null, Map.of());

    public ServiceMetrics {
        if (requestCount < 0) {
            throw new IllegalArgumentException("requestCount must not be negative");
        }
        if (errorRate < 0 || errorRate > 1 || Double.isNaN(errorRate)) {
            throw new IllegalArgumentException("errorRate must be within [0, 1]");
        }
        if (averageResponseTime < 0 || Double.isNaN(averageResponseTime)) {
            throw new IllegalArgumentException("averageResponseTime must not be negative");
        }
        customMetrics = customMetrics == null ? Map.of() : Map.copyOf(customMetrics);
    }
}
