package com.healthwatch.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the service's current {@link ServiceMetrics}.
 * <p>
 * Updates are partial: only the recognized fields present in an update change. Each update
 * replaces the immutable snapshot atomically, so concurrent writers never lose each other's
 * changes and readers always see a consistent snapshot. The store is never reset.
 */
public final class MetricsStore {

    private static final Logger log = LoggerFactory.getLogger(MetricsStore.class);

    public static final String REQUEST_COUNT = "request_count";
    public static final String ERROR_RATE = "error_rate";
    public static final String AVERAGE_RESPONSE_TIME = "average_response_time";
    public static final String LAST_REQUEST_TIMESTAMP = "last_request_timestamp";
    public static final String CUSTOM_METRICS = "custom_metrics";

    /** Field names accepted by {@link #update(Map)}. */
    public static final Set<String> FIELDS = Set.of(
            REQUEST_COUNT, ERROR_RATE, AVERAGE_RESPONSE_TIME, LAST_REQUEST_TIMESTAMP, CUSTOM_METRICS);

    private final AtomicReference<ServiceMetrics> current;

    public MetricsStore() {
        this(ServiceMetrics.INITIAL);
    }

    public MetricsStore(ServiceMetrics initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial must not be null");
        }
        this.current = new AtomicReference<>(initial);
    }

    /**
     * Returns the current snapshot.
     */
    public ServiceMetrics snapshot() {
        return current.get();
    }

    /**
     * Applies a partial update.
     * <p>
     * Keys outside {@link #FIELDS} are ignored. A recognized key with a value of the wrong
     * type or out of range rejects the whole update and leaves the store unchanged.
     *
     * @param changes field name to new value
     * @return the snapshot after the update
     * @throws IllegalArgumentException if a recognized field has an invalid value
     */
    public ServiceMetrics update(Map<String, ?> changes) {
        if (changes == null) {
            throw new IllegalArgumentException("changes must not be null");
        }
        for (String key : changes.keySet()) {
            if (!FIELDS.contains(key)) {
                log.debug("Ignoring unknown metrics field '{}'", key);
            }
        }
        return current.updateAndGet(metrics -> apply(metrics, changes));
    }

    private static ServiceMetrics apply(ServiceMetrics metrics, Map<String, ?> changes) {
        long requestCount = metrics.requestCount();
        double errorRate = metrics.errorRate();
        double averageResponseTime = metrics.averageResponseTime();
        Instant lastRequestTimestamp = metrics.lastRequestTimestamp();
        Map<String, Object> customMetrics = metrics.customMetrics();

        if (changes.containsKey(REQUEST_COUNT)) {
            requestCount = wholeNumber(REQUEST_COUNT, changes.get(REQUEST_COUNT));
        }
        if (changes.containsKey(ERROR_RATE)) {
            errorRate = number(ERROR_RATE, changes.get(ERROR_RATE)).doubleValue();
        }
        if (changes.containsKey(AVERAGE_RESPONSE_TIME)) {
            averageResponseTime = number(AVERAGE_RESPONSE_TIME, changes.get(AVERAGE_RESPONSE_TIME)).doubleValue();
        }
        if (changes.containsKey(LAST_REQUEST_TIMESTAMP)) {
            lastRequestTimestamp = timestamp(changes.get(LAST_REQUEST_TIMESTAMP));
        }
        if (changes.containsKey(CUSTOM_METRICS)) {
            customMetrics = customMetrics(changes.get(CUSTOM_METRICS));
        }
        return new ServiceMetrics(requestCount, errorRate, averageResponseTime, lastRequestTimestamp, customMetrics);
    }

    private static Number number(String field, Object value) {
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException(field + " must be a number, got: " + value);
        }
        return (Number) value;
    }

    private static long wholeNumber(String field, Object value) {
        Number number = number(field, value);
        if (number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        try {
            return new BigDecimal(number.toString()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException(field + " must be a whole number within range, got: " + value, e);
        }
    }

    private static Instant timestamp(Object value) {
        if (value == null || value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof String) {
            try {
                return Instant.parse((String) value);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(
                        LAST_REQUEST_TIMESTAMP + " must be an ISO-8601 instant, got: " + value, e);
            }
        }
        throw new IllegalArgumentException(LAST_REQUEST_TIMESTAMP + " must be an instant, got: " + value);
    }

    private static Map<String, Object> customMetrics(Object value) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(CUSTOM_METRICS + " must be a map, got: " + value);
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            if (!(entry.getKey() instanceof String) || entry.getValue() == null) {
                throw new IllegalArgumentException(
                        CUSTOM_METRICS + " must map names to non-null values, got: " + entry);
            }
            copy.put((String) entry.getKey(), entry.getValue());
        }
        return copy;
    }
}
