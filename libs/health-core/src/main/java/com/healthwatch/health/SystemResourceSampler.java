package com.healthwatch.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.OptionalDouble;

/**
 * {@link ResourceSampler} backed by the platform {@code OperatingSystemMXBean}.
 * <p>
 * Memory is physical system memory. CPU is the system load over the JVM's most recent
 * sampling window, which is read without blocking. The JVM reports a negative load until it
 * has a first window, and that is surfaced as "unavailable".
 */
public final class SystemResourceSampler implements ResourceSampler {

    private static final Logger log = LoggerFactory.getLogger(SystemResourceSampler.class);

    private final com.sun.management.OperatingSystemMXBean os;

    /**
     * Creates a sampler over the running JVM's platform bean.
     *
     * @throws IllegalStateException if the JVM does not expose system memory figures
     */
    public SystemResourceSampler() {
        this(ManagementFactory.getOperatingSystemMXBean());
    }

    SystemResourceSampler(OperatingSystemMXBean bean) {
        if (!(bean instanceof com.sun.management.OperatingSystemMXBean)) {
            throw new IllegalStateException(
                    "Platform OperatingSystemMXBean does not expose memory figures: " + bean);
        }
        this.os = (com.sun.management.OperatingSystemMXBean) bean;
    }

    @Override
    public MemoryUsage sampleMemory() {
        long total = os.getTotalMemorySize();
        if (total <= 0) {
            throw new IllegalStateException("System memory size is not available");
        }
        long used = Math.max(0, total - os.getFreeMemorySize());
        return MemoryUsage.of(used, total);
    }

    @Override
    public OptionalDouble sampleCpu() {
        try {
            double load = os.getCpuLoad();
            if (load < 0 || Double.isNaN(load)) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(Math.min(100.0, load * 100.0));
        } catch (RuntimeException | LinkageError | InternalError e) {
            log.debug("CPU sampling unavailable: {}", e.toString());
            return OptionalDouble.empty();
        }
    }
}
