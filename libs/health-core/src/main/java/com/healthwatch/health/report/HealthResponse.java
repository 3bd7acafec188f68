package com.healthwatch.health.report;

/**
 * A report payload together with the transport status code it should be served with.
 *
 * @param statusCode HTTP status code (200 or 503)
 * @param body       report payload
 */
public record HealthResponse(int statusCode, HealthReport body) {

    public HealthResponse {
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
    }
}
