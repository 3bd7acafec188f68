package com.healthwatch.health;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates request statistics and turns them into {@link ServiceMetrics}.
 * <p>
 * Response times are kept in a bounded window of the most recent samples; the request and
 * error counts cover the collector's whole lifetime (until {@link #reset()}).
 */
public final class MetricsCollector {

    /** Default number of response-time samples kept. */
    public static final int DEFAULT_MAX_SAMPLES = 1000;

    private final int maxSamples;
    private final Clock clock;

    private final Deque<Double> responseTimes = new ArrayDeque<>();
    private final Map<String, Object> customMetrics = new LinkedHashMap<>();
    private double responseTimeSum;
    private long requestCount;
    private long errorCount;
    private Instant lastRequestTimestamp;

    public MetricsCollector() {
        this(DEFAULT_MAX_SAMPLES, Clock.systemUTC());
    }

    public MetricsCollector(int maxSamples, Clock clock) {
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.maxSamples = maxSamples;
        this.clock = clock;
    }

    /**
     * Records one served request.
     *
     * @param responseTimeMs time taken to serve the request, in milliseconds
     * @param error          whether the request ended in an error
     */
    public synchronized void recordRequest(double responseTimeMs, boolean error) {
        if (responseTimeMs < 0 || Double.isNaN(responseTimeMs)) {
            throw new IllegalArgumentException("responseTimeMs must not be negative");
        }
        requestCount++;
        if (error) {
            errorCount++;
        }
        responseTimes.addLast(responseTimeMs);
        responseTimeSum += responseTimeMs;
        if (responseTimes.size() > maxSamples) {
            responseTimeSum -= responseTimes.removeFirst();
        }
        lastRequestTimestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Sets a custom metric to a numeric or textual value.
     */
    public synchronized void recordCustomMetric(String name, Object value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (!(value instanceof Number) && !(value instanceof String)) {
            throw new IllegalArgumentException("value must be a number or a string, got: " + value);
        }
        customMetrics.put(name, value);
    }

    /**
     * Adds {@code delta} to a numeric custom metric. A missing or non-numeric metric starts at 0.
     */
    public synchronized void incrementCounter(String name, long delta) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        Object current = customMetrics.get(name);
        long base = current instanceof Number ? ((Number) current).longValue() : 0L;
        customMetrics.put(name, base + delta);
    }

    /**
     * Returns the metrics accumulated so far.
     */
    public synchronized ServiceMetrics snapshot() {
        double errorRate = requestCount > 0 ? (double) errorCount / requestCount : 0.0;
        double average = responseTimes.isEmpty() ? 0.0 : responseTimeSum / responseTimes.size();
        return new ServiceMetrics(
                requestCount,
                errorRate,
                Math.round(average * 100) / 100.0,
                lastRequestTimestamp,
                new HashMap<>(customMetrics));
    }

    /**
     * Pushes the current snapshot into a store, through its allow-listed update.
     *
     * @return the store's snapshot after the update
     */
    public ServiceMetrics publishTo(MetricsStore store) {
        ServiceMetrics metrics = snapshot();
        Map<String, Object> changes = new HashMap<>();
        changes.put(MetricsStore.REQUEST_COUNT, metrics.requestCount());
        changes.put(MetricsStore.ERROR_RATE, metrics.errorRate());
        changes.put(MetricsStore.AVERAGE_RESPONSE_TIME, metrics.averageResponseTime());
        changes.put(MetricsStore.CUSTOM_METRICS, metrics.customMetrics());
        if (metrics.lastRequestTimestamp() != null) {
            changes.put(MetricsStore.LAST_REQUEST_TIMESTAMP, metrics.lastRequestTimestamp());
        }
        return store.update(changes);
    }

    /**
     * Clears all counters, samples and custom metrics.
     */
    public synchronized void reset() {
        responseTimes.clear();
        customMetrics.clear();
        responseTimeSum = 0;
        requestCount = 0;
        errorCount = 0;
        lastRequestTimestamp = null;
    }
}
