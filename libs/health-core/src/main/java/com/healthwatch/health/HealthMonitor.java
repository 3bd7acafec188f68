package com.healthwatch.health;

import com.healthwatch.health.report.HealthResponse;
import com.healthwatch.health.report.ReportKind;
import com.healthwatch.health.report.ResponseBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Assembles the four health reports of one service.
 * <p>
 * Each report samples or runs only what it needs, hands the results to the
 * {@link HealthAggregator} and shapes them with {@link ResponseBuilder}. Report methods never
 * throw: if assembling a report fails, the failure is logged and the kind-specific fallback
 * payload is returned with 503. Failures of individual probes and tests are already absorbed
 * by the runners and show up as unhealthy entries instead.
 */
public final class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final ServiceInfo service;
    private final ResourceSampler sampler;
    private final MetricsStore metrics;
    private final DependencyRunner dependencies;
    private final IntegrationTestRunner tests;
    private final HealthAggregator aggregator;
    private final HealthMeters meters;
    private final Clock clock;
    private final Instant startedAt;

    /**
     * @param service      static service description
     * @param sampler      memory and CPU source
     * @param metrics      request metrics holder
     * @param dependencies runner for registered dependency probes
     * @param tests        runner for registered integration tests
     * @param aggregator   status rules
     * @param meters       report instrumentation, or null
     * @param clock        clock for timestamps and uptime
     */
    public HealthMonitor(
            ServiceInfo service,
            ResourceSampler sampler,
            MetricsStore metrics,
            DependencyRunner dependencies,
            IntegrationTestRunner tests,
            HealthAggregator aggregator,
            HealthMeters meters,
            Clock clock) {
        requireNonNull(service, "service");
        requireNonNull(sampler, "sampler");
        requireNonNull(metrics, "metrics");
        requireNonNull(dependencies, "dependencies");
        requireNonNull(tests, "tests");
        requireNonNull(aggregator, "aggregator");
        requireNonNull(clock, "clock");
        this.service = service;
        this.sampler = sampler;
        this.metrics = metrics;
        this.dependencies = dependencies;
        this.tests = tests;
        this.aggregator = aggregator;
        this.meters = meters;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * Status of the service itself, from resource usage and error rate.
     */
    public HealthResponse basicReport() {
        return report(ReportKind.BASIC, () -> {
            MemoryUsage memory = sampler.sampleMemory();
            OptionalDouble cpu = sampler.sampleCpu();
            HealthStatus status = aggregator.basicStatus(memory, cpu, metrics.snapshot());
            return ResponseBuilder.basic(service, status, now());
        });
    }

    /**
     * Basic status plus the samples and metrics it was computed from.
     */
    public HealthResponse detailedReport() {
        return report(ReportKind.DETAILED, () -> {
            MemoryUsage memory = sampler.sampleMemory();
            OptionalDouble cpu = sampler.sampleCpu();
            ServiceMetrics snapshot = metrics.snapshot();
            HealthStatus status = aggregator.basicStatus(memory, cpu, snapshot);
            return ResponseBuilder.detailed(service, status, now(), uptimeSeconds(), memory, cpu, snapshot);
        });
    }

    /**
     * Runs every registered dependency probe and reports their combined status.
     */
    public HealthResponse dependenciesReport() {
        return report(ReportKind.DEPENDENCIES, () -> {
            List<DependencyHealth> results = dependencies.runAll();
            HealthStatus status = aggregator.dependencyStatus(results);
            return ResponseBuilder.dependencies(service, status, now(), results);
        });
    }

    /**
     * Runs every registered integration test and reports their combined status.
     */
    public HealthResponse integrationTestReport() {
        return report(ReportKind.INTEGRATION_TEST, () -> {
            IntegrationTestRun run = tests.runAll();
            HealthStatus status = aggregator.testStatus(run.summary());
            return ResponseBuilder.integrationTest(service, status, now(), run);
        });
    }

    public ServiceInfo service() {
        return service;
    }

    private HealthResponse report(ReportKind kind, Supplier<HealthResponse> pipeline) {
        long startNanos = System.nanoTime();
        HealthResponse response;
        try {
            response = pipeline.get();
        } catch (RuntimeException | Error e) {
            // includes linkage and internal errors raised by platform beans
            log.error("Assembling the {} report failed", kind.tagValue(), e);
            response = ResponseBuilder.fallback(kind, service.name(), now());
        }
        record(kind, response, Duration.ofNanos(System.nanoTime() - startNanos));
        return response;
    }

    private void record(ReportKind kind, HealthResponse response, Duration elapsed) {
        if (meters == null) {
            return;
        }
        try {
            meters.recordReport(kind, response.body().status(), elapsed);
        } catch (RuntimeException e) {
            log.warn("Could not record meters for the {} report", kind.tagValue(), e);
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private long uptimeSeconds() {
        return Math.max(0, Duration.between(startedAt, clock.instant()).getSeconds());
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
    }
}
