package com.healthwatch.health;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Executes every probe in a {@link DependencyRegistry} concurrently.
 * <p>
 * A probe that throws, fails its future, returns nothing or exceeds the timeout is reported
 * as {@link HealthStatus#UNHEALTHY} with its registered type, the current time and the
 * failure message. One failing probe never prevents the others from being collected.
 */
public class DependencyRunner extends IsolatedRunner<RegisteredDependency, DependencyHealth> {

    private final DependencyRegistry registry;

    /**
     * Creates a runner on the common pool with the default timeout and no metrics.
     */
    public DependencyRunner(DependencyRegistry registry) {
        this(registry, ForkJoinPool.commonPool(), DEFAULT_TIMEOUT_MS, Clock.systemUTC(), null);
    }

    /**
     * @param registry  probes to run
     * @param executor  executor the probes are started on
     * @param timeoutMs per-probe timeout in milliseconds
     * @param clock     clock for synthesized {@code lastChecked} timestamps
     * @param meters    failure counters, or null
     */
    public DependencyRunner(
            DependencyRegistry registry, Executor executor, long timeoutMs, Clock clock, HealthMeters meters) {
        super(executor, timeoutMs, clock, meters);
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Runs all registered probes and returns their results in registration order.
     */
    public List<DependencyHealth> runAll() {
        return runEntries(registry.entries());
    }

    @Override
    protected String nameOf(RegisteredDependency entry) {
        return entry.name();
    }

    @Override
    protected CompletableFuture<DependencyHealth> invoke(RegisteredDependency entry) {
        return entry.probe().probe();
    }

    @Override
    protected DependencyHealth failureResult(RegisteredDependency entry, String error, Instant now) {
        return DependencyHealth.failed(entry.name(), entry.type(), error, now);
    }

    @Override
    protected String checkKind() {
        return "dependency";
    }
}
