package com.healthwatch.health;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Executes every test in an {@link IntegrationTestRegistry} concurrently and summarizes them.
 * <p>
 * A test that throws, fails its future, returns nothing or exceeds the timeout is reported as
 * failed with a zero duration and the failure message.
 */
public class IntegrationTestRunner extends IsolatedRunner<RegisteredTest, IntegrationTestResult> {

    private final IntegrationTestRegistry registry;

    /**
     * Creates a runner on the common pool with the default timeout and no metrics.
     */
    public IntegrationTestRunner(IntegrationTestRegistry registry) {
        this(registry, ForkJoinPool.commonPool(), DEFAULT_TIMEOUT_MS, Clock.systemUTC(), null);
    }

    public IntegrationTestRunner(
            IntegrationTestRegistry registry, Executor executor, long timeoutMs, Clock clock, HealthMeters meters) {
        super(executor, timeoutMs, clock, meters);
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /**
     * Runs all registered tests and returns the results in registration order with their summary.
     */
    public IntegrationTestRun runAll() {
        List<IntegrationTestResult> results = runEntries(registry.entries());
        return IntegrationTestRun.of(results);
    }

    @Override
    protected String nameOf(RegisteredTest entry) {
        return entry.name();
    }

    @Override
    protected CompletableFuture<IntegrationTestResult> invoke(RegisteredTest entry) {
        return entry.test().run();
    }

    @Override
    protected IntegrationTestResult failureResult(RegisteredTest entry, String error, Instant now) {
        return IntegrationTestResult.failed(entry.name(), 0, error);
    }

    @Override
    protected String checkKind() {
        return "integration_test";
    }
}
