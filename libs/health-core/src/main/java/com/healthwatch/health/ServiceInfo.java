package com.healthwatch.health;

/**
 * Static description of the service being monitored.
 *
 * @param name        logical service name (e.g., "user-service")
 * @param version     service version; defaults to {@code 1.0.0}
 * @param environment deployment environment, or null if not configured
 * @param build       build identifier, or null if not configured
 */
public record ServiceInfo(String name, String version, String environment, String build) {

    public static final String DEFAULT_VERSION = "1.0.0";

    public ServiceInfo {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (version == null || version.isBlank()) {
            version = DEFAULT_VERSION;
        }
    }

    public static ServiceInfo of(String name, String version) {
        return new ServiceInfo(name, version, null, null);
    }
}
