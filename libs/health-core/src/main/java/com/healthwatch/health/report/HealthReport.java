package com.healthwatch.health.report;

import com.healthwatch.health.HealthStatus;

import java.time.Instant;

/**
 * Fields shared by every health report payload.
 */
public interface HealthReport {

    HealthStatus status();

    Instant timestamp();

    String service();
}
