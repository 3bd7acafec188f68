package com.healthwatch.health.report;

import com.healthwatch.health.DependencyHealth;
import com.healthwatch.health.HealthStatus;
import com.healthwatch.health.IntegrationTestRun;
import com.healthwatch.health.MemoryUsage;
import com.healthwatch.health.ServiceInfo;
import com.healthwatch.health.ServiceMetrics;
import com.healthwatch.health.TestSummary;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Shapes computed statuses into report payloads and transport status codes.
 * <p>
 * Only {@link HealthStatus#UNHEALTHY} maps to 503. A degraded service still answers 200:
 * liveness probes read the code, while severity lives in the payload.
 */
public final class ResponseBuilder {

    public static final int OK = 200;
    public static final int SERVICE_UNAVAILABLE = 503;

    private ResponseBuilder() {
        // utility class
    }

    /**
     * Maps a status to its transport code.
     */
    public static int statusCode(HealthStatus status) {
        return status == HealthStatus.UNHEALTHY ? SERVICE_UNAVAILABLE : OK;
    }

    public static HealthResponse basic(ServiceInfo service, HealthStatus status, Instant now) {
        return respond(new BasicHealthReport(status, now, service.name(), service.version()));
    }

    public static HealthResponse detailed(
            ServiceInfo service,
            HealthStatus status,
            Instant now,
            long uptimeSeconds,
            MemoryUsage memory,
            OptionalDouble cpu,
            ServiceMetrics metrics) {
        return respond(new DetailedHealthReport(
                status,
                now,
                service.name(),
                service.version(),
                uptimeSeconds,
                memory,
                cpu.isPresent() ? cpu.getAsDouble() : null,
                metrics,
                service.environment(),
                service.build()));
    }

    public static HealthResponse dependencies(
            ServiceInfo service, HealthStatus status, Instant now, List<DependencyHealth> dependencies) {
        return respond(new DependenciesHealthReport(status, now, service.name(), service.version(), dependencies));
    }

    public static HealthResponse integrationTest(
            ServiceInfo service, HealthStatus status, Instant now, IntegrationTestRun run) {
        return respond(new IntegrationTestReport(
                status, now, service.name(), service.version(), run.results(), run.summary()));
    }

    /**
     * Builds the payload served when assembling a report of the given kind failed.
     */
    public static HealthResponse fallback(ReportKind kind, String serviceName, Instant now) {
        List<DependencyHealth> dependencies = kind == ReportKind.DEPENDENCIES ? List.of() : null;
        boolean tests = kind == ReportKind.INTEGRATION_TEST;
        return respond(new FallbackHealthReport(
                HealthStatus.UNHEALTHY,
                now,
                serviceName,
                kind.failureMessage(),
                dependencies,
                tests ? List.of() : null,
                tests ? TestSummary.EMPTY : null));
    }

    private static HealthResponse respond(HealthReport report) {
        return new HealthResponse(statusCode(report.status()), report);
    }
}
