package com.healthwatch.health.report;

import java.util.Locale;

/**
 * The four health reports a service exposes.
 */
public enum ReportKind {

    BASIC("/health", "Health check failed"),
    DETAILED("/health/detailed", "Detailed health check failed"),
    DEPENDENCIES("/health/dependencies", "Dependencies health check failed"),
    INTEGRATION_TEST("/health/integration-test", "Integration tests failed");

    private final String path;
    private final String failureMessage;

    ReportKind(String path, String failureMessage) {
        this.path = path;
        this.failureMessage = failureMessage;
    }

    /** HTTP path the report is conventionally served under. */
    public String path() {
        return path;
    }

    /** Error message carried by the fallback payload when assembling this report fails. */
    public String failureMessage() {
        return failureMessage;
    }

    /** Lower-case metric tag value. */
    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
