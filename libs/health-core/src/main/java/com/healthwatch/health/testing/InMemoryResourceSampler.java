package com.healthwatch.health.testing;

import com.healthwatch.health.MemoryUsage;
import com.healthwatch.health.ResourceSampler;

import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A resource sampler that reports fixed, settable figures instead of the host's.
 * Starts at 50% memory with no CPU sample.
 */
public final class InMemoryResourceSampler implements ResourceSampler {

    private static final long TOTAL_BYTES = 16L * 1024 * 1024 * 1024;

    private final AtomicReference<MemoryUsage> memory =
            new AtomicReference<>(new MemoryUsage(TOTAL_BYTES / 2, TOTAL_BYTES, 50.0));
    private final AtomicReference<OptionalDouble> cpu = new AtomicReference<>(OptionalDouble.empty());
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();

    @Override
    public MemoryUsage sampleMemory() {
        RuntimeException toThrow = failure.get();
        if (toThrow != null) {
            throw toThrow;
        }
        return memory.get();
    }

    @Override
    public OptionalDouble sampleCpu() {
        return cpu.get();
    }

    /**
     * Sets the memory percentage; used bytes are derived from a fixed 16 GiB total.
     */
    public InMemoryResourceSampler setMemoryPercent(double percentage) {
        long used = (long) (TOTAL_BYTES * percentage / 100.0);
        memory.set(new MemoryUsage(used, TOTAL_BYTES, percentage));
        return this;
    }

    public InMemoryResourceSampler setCpuPercent(double percentage) {
        cpu.set(OptionalDouble.of(percentage));
        return this;
    }

    public InMemoryResourceSampler setCpuUnavailable() {
        cpu.set(OptionalDouble.empty());
        return this;
    }

    /**
     * Makes memory sampling throw the given exception.
     */
    public InMemoryResourceSampler setFailing(RuntimeException exception) {
        failure.set(exception);
        return this;
    }
}
