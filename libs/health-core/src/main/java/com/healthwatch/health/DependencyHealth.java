package com.healthwatch.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

/**
 * Health result for a single external dependency. Created fresh on every probe invocation.
 *
 * @param name         dependency name (e.g., "postgres-db", "redis-cache")
 * @param type         kind of dependency
 * @param status       health status of this dependency
 * @param responseTime time taken by the probe in milliseconds, or null if not measured
 * @param lastChecked  when the probe completed
 * @param error        failure message, or null when the probe succeeded
 * @param metadata     optional dependency-specific details (pool sizes, hit rates, ...)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DependencyHealth(
        String name,
        DependencyType type,
        HealthStatus status,
        Double responseTime,
        Instant lastChecked,
        String error,
        Map<String, Object> metadata
) {

    public DependencyHealth {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (lastChecked == null) {
            throw new IllegalArgumentException("lastChecked must not be null");
        }
        if (responseTime != null && (responseTime < 0 || responseTime.isNaN())) {
            throw new IllegalArgumentException("responseTime must not be negative");
        }
        metadata = metadata == null ? null : Map.copyOf(metadata);
    }

    /** Creates a healthy dependency result. */
    public static DependencyHealth healthy(String name, DependencyType type, double responseTime, Instant lastChecked) {
        return new DependencyHealth(name, type, HealthStatus.HEALTHY, responseTime, lastChecked, null, null);
    }

    /** Creates an unhealthy dependency result with a measured response time. */
    public static DependencyHealth unhealthy(
            String name, DependencyType type, String error, double responseTime, Instant lastChecked) {
        return new DependencyHealth(name, type, HealthStatus.UNHEALTHY, responseTime, lastChecked, error, null);
    }

    /**
     * Creates the result substituted for a probe that failed outright. No response time is
     * reported because none was observed.
     */
    public static DependencyHealth failed(String name, DependencyType type, String error, Instant lastChecked) {
        return new DependencyHealth(name, type, HealthStatus.UNHEALTHY, null, lastChecked, error, null);
    }

    /** Returns a copy of this result with the given metadata attached. */
    public DependencyHealth withMetadata(Map<String, Object> metadata) {
        return new DependencyHealth(name, type, status, responseTime, lastChecked, error, metadata);
    }
}
