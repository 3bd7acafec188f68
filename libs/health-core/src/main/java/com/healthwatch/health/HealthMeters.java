package com.healthwatch.health;

import com.healthwatch.health.report.ReportKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer instrumentation for health reporting.
 * <p>
 * Every meter carries a {@code service} tag. Per report kind, a gauge holds the severity of
 * the last report (0 healthy, 1 degraded, 2 unhealthy) and a timer records how long the report
 * took to assemble. A counter tracks checks that failed outright and were replaced by a
 * synthesized result.
 */
public final class HealthMeters {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    public static final String REPORT_STATUS = "healthwatch.report.status";
    public static final String REPORT_DURATION = "healthwatch.report.duration";
    public static final String CHECK_FAILURES = "healthwatch.check.failures";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Map<ReportKind, AtomicInteger> lastStatus = new EnumMap<>(ReportKind.class);
    private final Map<ReportKind, Timer> durations = new EnumMap<>(ReportKind.class);

    /**
     * Creates the meters and registers one status gauge and one timer per report kind.
     *
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public HealthMeters(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;

        for (ReportKind kind : ReportKind.values()) {
            AtomicInteger value = new AtomicInteger(0);
            Gauge.builder(REPORT_STATUS, value, AtomicInteger::doubleValue)
                    .description("Severity of the last report (0 healthy, 1 degraded, 2 unhealthy)")
                    .tags(baseTags("kind", kind.tagValue()))
                    .register(registry);
            lastStatus.put(kind, value);
            durations.put(kind, Timer.builder(REPORT_DURATION)
                    .description("Time taken to assemble a health report")
                    .tags(baseTags("kind", kind.tagValue()))
                    .register(registry));
        }
    }

    /**
     * Records the outcome of one report.
     */
    public void recordReport(ReportKind kind, HealthStatus status, Duration elapsed) {
        lastStatus.get(kind).set(status.ordinal());
        durations.get(kind).record(elapsed);
    }

    /**
     * Counts a check that failed outright.
     *
     * @param checkKind "dependency" or "integration_test"
     * @param checkName registered name of the check
     */
    public void recordCheckFailure(String checkKind, String checkName) {
        Counter.builder(CHECK_FAILURES)
                .description("Checks that failed and were replaced by a synthesized result")
                .tags(baseTags("kind", checkKind, "check", checkName))
                .register(registry)
                .increment();
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a default tag.
     */
    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        return Tags.of(TAG_SERVICE, serviceName).and(extraTags);
    }
}
