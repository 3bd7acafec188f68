package com.healthwatch.healthservice.infrastructure.checks;

import com.healthwatch.health.IntegrationTest;
import com.healthwatch.health.IntegrationTestResult;
import com.healthwatch.health.MetricsStore;
import com.healthwatch.health.ServiceMetrics;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Built-in integration test: reads a metrics snapshot and checks that it is consistent.
 */
public final class MetricsSnapshotCheck implements IntegrationTest {

    public static final String NAME = "metrics-snapshot";

    private final MetricsStore store;

    public MetricsSnapshotCheck(MetricsStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
    }

    @Override
    public CompletableFuture<IntegrationTestResult> run() {
        long startNanos = System.nanoTime();
        ServiceMetrics metrics = store.snapshot();
        double durationMs = (System.nanoTime() - startNanos) / (double) TimeUnit.MILLISECONDS.toNanos(1);

        if (metrics.requestCount() == 0 && metrics.errorRate() > 0) {
            return CompletableFuture.completedFuture(IntegrationTestResult.failed(
                    NAME, durationMs, "error rate reported without any requests"));
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("request_count", metrics.requestCount());
        details.put("custom_metrics", metrics.customMetrics().size());
        return CompletableFuture.completedFuture(IntegrationTestResult.passed(NAME, durationMs).withDetails(details));
    }
}
