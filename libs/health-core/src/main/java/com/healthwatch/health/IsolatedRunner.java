package com.healthwatch.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a batch of registered checks concurrently and isolates their failures.
 * <p>
 * Every entry is started on the executor (fan-out), bounded by the per-check timeout, and
 * joined before results are returned (fan-in). Each check's completion is first turned into
 * a {@link CheckOutcome}; a failed outcome is then replaced by the subclass's synthesized
 * result. Results are always returned in the order of the entries passed in, whatever order
 * the checks finished in.
 *
 * @param <E> registry entry type
 * @param <R> check result type
 */
public abstract class IsolatedRunner<E, R> {

    private static final Logger log = LoggerFactory.getLogger(IsolatedRunner.class);

    /** Default timeout for individual checks (5 seconds). */
    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final Executor executor;
    private final long timeoutMs;
    private final Clock clock;
    private final HealthMeters meters;

    /**
     * @param executor  executor the checks are started on
     * @param timeoutMs timeout in milliseconds for each individual check
     * @param clock     clock for synthesized timestamps
     * @param meters    failure counters, or null to skip metric recording
     */
    protected IsolatedRunner(Executor executor, long timeoutMs, Clock clock, HealthMeters meters) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.executor = executor;
        this.timeoutMs = timeoutMs;
        this.clock = clock;
        this.meters = meters;
    }

    /** Name of the entry, used in logs, metrics and synthesized results. */
    protected abstract String nameOf(E entry);

    /** Starts the entry's check. May throw or return a future that fails. */
    protected abstract CompletableFuture<R> invoke(E entry);

    /** Builds the result reported in place of a check that failed. */
    protected abstract R failureResult(E entry, String error, Instant now);

    /** Metric tag describing what kind of check this runner executes. */
    protected abstract String checkKind();

    /**
     * Runs every entry and returns one result per entry, in entry order.
     */
    protected final List<R> runEntries(List<E> entries) {
        List<CompletableFuture<CheckOutcome<R>>> pending = new ArrayList<>(entries.size());
        for (E entry : entries) {
            pending.add(start(entry));
        }

        // handle() never completes exceptionally, so this join only waits
        CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).join();

        List<R> results = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            E entry = entries.get(i);
            CheckOutcome<R> outcome = pending.get(i).join();
            if (outcome.isSuccess()) {
                results.add(outcome.value());
            } else {
                log.warn("{} check '{}' failed: {}", checkKind(), nameOf(entry), outcome.error());
                if (meters != null) {
                    meters.recordCheckFailure(checkKind(), nameOf(entry));
                }
                results.add(failureResult(entry, outcome.error(), now()));
            }
        }
        return results;
    }

    private CompletableFuture<CheckOutcome<R>> start(E entry) {
        long startNanos = System.nanoTime();
        CompletableFuture<R> task = new CompletableFuture<>();
        AtomicReference<CompletableFuture<R>> running = new AtomicReference<>();
        FutureTask<Void> starter = new FutureTask<>(() -> invokeInto(entry, task, running), null);
        try {
            executor.execute(starter);
        } catch (RuntimeException e) {
            task.completeExceptionally(e);
        }

        return task.orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((value, throwable) -> {
                    log.debug("{} check '{}' completed in {} ms", checkKind(), nameOf(entry),
                            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
                    if (throwable == null) {
                        return value != null
                                ? CheckOutcome.success(value)
                                : CheckOutcome.<R>failure("check completed without a result");
                    }
                    Throwable cause = unwrap(throwable);
                    if (cause instanceof TimeoutException) {
                        // interrupts a check still blocked inside invoke
                        starter.cancel(true);
                        CompletableFuture<R> stuck = running.get();
                        if (stuck != null) {
                            stuck.cancel(true);
                        }
                        return CheckOutcome.<R>failure("Timed out after " + timeoutMs + " ms");
                    }
                    return CheckOutcome.<R>failure(messageOf(cause));
                });
    }

    /** Current time truncated to milliseconds. */
    protected final Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Returns the configured timeout in milliseconds.
     */
    public final long timeoutMs() {
        return timeoutMs;
    }

    private void invokeInto(E entry, CompletableFuture<R> task, AtomicReference<CompletableFuture<R>> running) {
        try {
            CompletableFuture<R> future = invoke(entry);
            if (future == null) {
                throw new IllegalStateException("check returned no future");
            }
            running.set(future);
            future.whenComplete((value, throwable) -> {
                if (throwable == null) {
                    task.complete(value);
                } else {
                    task.completeExceptionally(throwable);
                }
            });
        } catch (RuntimeException | LinkageError e) {
            task.completeExceptionally(e);
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
