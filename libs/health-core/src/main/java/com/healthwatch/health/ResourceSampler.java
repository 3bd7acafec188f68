package com.healthwatch.health;

import java.util.OptionalDouble;

/**
 * Source of current resource usage samples.
 */
public interface ResourceSampler {

    /**
     * Samples current memory usage. Never fails for a correctly configured sampler; an
     * unreadable platform is reported as {@link IllegalStateException}.
     */
    MemoryUsage sampleMemory();

    /**
     * Samples current CPU usage as a percentage in [0, 100].
     * <p>
     * Returns empty when CPU usage is not available. Implementations must not throw.
     */
    OptionalDouble sampleCpu();
}
