package com.healthwatch.health;

/**
 * Memory usage sample.
 *
 * @param used       bytes in use
 * @param total      total bytes available
 * @param percentage {@code used / total * 100}, within [0, 100]
 */
public record MemoryUsage(long used, long total, double percentage) {

    public MemoryUsage {
        if (used < 0) {
            throw new IllegalArgumentException("used must not be negative");
        }
        if (total <= 0) {
            throw new IllegalArgumentException("total must be positive");
        }
        if (percentage < 0 || percentage > 100 || Double.isNaN(percentage)) {
            throw new IllegalArgumentException("percentage must be within [0, 100]");
        }
    }

    /**
     * Derives the percentage from used and total bytes.
     */
    public static MemoryUsage of(long used, long total) {
        if (total <= 0) {
            throw new IllegalArgumentException("total must be positive");
        }
        double percentage = Math.min(100.0, used * 100.0 / total);
        return new MemoryUsage(used, total, percentage);
    }
}
