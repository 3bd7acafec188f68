package com.healthwatch.health;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import javax.sql.DataSource;

/**
 * Ready-made {@link DependencyProbe} implementations for common dependency kinds.
 * <p>
 * Every probe runs its check on the given executor, measures the response time, and reports
 * failures (including its own timeout) as an {@link HealthStatus#UNHEALTHY} result rather
 * than failing the future. A check that outlives its timeout is interrupted.
 */
public final class DependencyCheckers {

    /** Queue depth above which a message queue is degraded. */
    public static final long QUEUE_DEPTH_DEGRADED = 10_000;

    /** Queue depth above which a message queue is unhealthy. */
    public static final long QUEUE_DEPTH_UNHEALTHY = 50_000;

    /** Default timeout for a single check (5 seconds). */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final Executor executor;
    private final Clock clock;

    public DependencyCheckers(Executor executor, Clock clock) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.executor = executor;
        this.clock = clock;
    }

    /** Something that answers a cache ping, expected to reply {@code PONG}. */
    @FunctionalInterface
    public interface CachePing {
        String ping() throws Exception;
    }

    /** Something that reports the number of messages waiting in a queue. */
    @FunctionalInterface
    public interface QueueDepthSource {
        long queueDepth() throws Exception;
    }

    /**
     * Validates a pooled JDBC connection.
     */
    public DependencyProbe database(String name, DataSource dataSource, Duration timeout) {
        int validSeconds = (int) Math.max(1, timeout.toSeconds());
        return timed(name, DependencyType.DATABASE, timeout, "Database check timeout", null, () -> {
            try (Connection connection = dataSource.getConnection()) {
                if (!connection.isValid(validSeconds)) {
                    throw new SQLException("Connection is not valid");
                }
            }
            return CheckEvaluation.healthy();
        });
    }

    /**
     * Pings a cache and expects {@code PONG} back.
     */
    public DependencyProbe cache(String name, CachePing ping, Duration timeout) {
        return timed(name, DependencyType.CACHE, timeout, "Cache check timeout", null, () -> {
            String reply = ping.ping();
            if (!"PONG".equals(reply)) {
                return CheckEvaluation.unhealthy("Cache ping returned unexpected response");
            }
            return CheckEvaluation.healthy();
        });
    }

    /**
     * Calls an HTTP endpoint with GET and compares the response code.
     */
    public DependencyProbe http(String name, HttpClient client, URI url, int expectedStatus, Duration timeout) {
        Map<String, Object> urlOnly = Map.of("url", url.toString());
        return timed(name, DependencyType.EXTERNAL_API, timeout, "HTTP check timeout", urlOnly, () -> {
            HttpRequest request = HttpRequest.newBuilder(url).GET().timeout(timeout).build();
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            Map<String, Object> metadata = Map.of("status_code", response.statusCode(), "url", url.toString());
            if (response.statusCode() != expectedStatus) {
                return new CheckEvaluation(HealthStatus.UNHEALTHY,
                        "Expected status " + expectedStatus + ", got " + response.statusCode(), metadata);
            }
            return CheckEvaluation.healthy(metadata);
        });
    }

    /**
     * Reads a queue's depth: above {@link #QUEUE_DEPTH_DEGRADED} it is degraded, above
     * {@link #QUEUE_DEPTH_UNHEALTHY} unhealthy.
     */
    public DependencyProbe messageQueue(String name, QueueDepthSource source, Duration timeout) {
        return timed(name, DependencyType.MESSAGE_QUEUE, timeout, "Message queue check timeout", null, () -> {
            long depth = source.queueDepth();
            Map<String, Object> metadata = Map.of("queue_depth", depth);
            if (depth > QUEUE_DEPTH_UNHEALTHY) {
                return new CheckEvaluation(HealthStatus.UNHEALTHY, "Queue depth " + depth + " is too high", metadata);
            }
            if (depth > QUEUE_DEPTH_DEGRADED) {
                return new CheckEvaluation(HealthStatus.DEGRADED, "Queue depth " + depth + " is high", metadata);
            }
            return CheckEvaluation.healthy(metadata);
        });
    }

    /**
     * Checks that a path exists and can be read.
     */
    public DependencyProbe fileSystem(String name, Path path, Duration timeout) {
        Map<String, Object> pathOnly = Map.of("path", path.toString());
        return timed(name, DependencyType.STORAGE, timeout, "File system check timeout", pathOnly, () -> {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("path", path.toString());
            metadata.put("is_directory", attributes.isDirectory());
            metadata.put("size", attributes.size());
            metadata.put("last_modified", attributes.lastModifiedTime().toInstant().toString());
            return CheckEvaluation.healthy(metadata);
        });
    }

    /**
     * Wraps an arbitrary check whose result is turned into a verdict by {@code evaluator}.
     */
    public <T> DependencyProbe custom(
            String name, DependencyType type, Duration timeout, Callable<T> check, Function<T, CheckEvaluation> evaluator) {
        return timed(name, type, timeout, "Custom dependency check timeout", null,
                () -> evaluator.apply(check.call()));
    }

    private DependencyProbe timed(
            String name,
            DependencyType type,
            Duration timeout,
            String timeoutMessage,
            Map<String, Object> failureMetadata,
            Callable<CheckEvaluation> work) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        return () -> {
            long startNanos = System.nanoTime();
            CompletableFuture<CheckEvaluation> evaluation = new CompletableFuture<>();
            FutureTask<Void> worker = new FutureTask<>(() -> evaluate(work, evaluation), null);
            executor.execute(worker);
            return evaluation
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .handle((result, throwable) -> {
                        double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
                        if (throwable == null) {
                            return new DependencyHealth(name, type, result.status(), elapsedMs, now(),
                                    result.error(), result.metadata());
                        }
                        // interrupts a check still blocked after the timeout
                        worker.cancel(true);
                        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                                ? throwable.getCause()
                                : throwable;
                        String error = cause instanceof TimeoutException ? timeoutMessage : messageOf(cause);
                        return new DependencyHealth(name, type, HealthStatus.UNHEALTHY, elapsedMs, now(),
                                error, failureMetadata);
                    });
        };
    }

    private static void evaluate(Callable<CheckEvaluation> work, CompletableFuture<CheckEvaluation> target) {
        try {
            CheckEvaluation evaluation = work.call();
            if (evaluation == null) {
                target.completeExceptionally(new IllegalStateException("check produced no evaluation"));
            } else {
                target.complete(evaluation);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            target.completeExceptionally(e);
        } catch (Exception | LinkageError e) {
            target.completeExceptionally(e);
        }
    }

    private static String messageOf(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
