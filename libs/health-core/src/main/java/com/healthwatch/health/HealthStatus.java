package com.healthwatch.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;

/**
 * Health status for a single check or for an aggregated report.
 * <p>
 * Constants are declared in severity order, so {@link #ordinal()} doubles as the rank:
 * {@code HEALTHY < DEGRADED < UNHEALTHY}. Combining statuses is "worst wins".
 */
public enum HealthStatus {

    /** The component is functioning normally. */
    HEALTHY,

    /** The component is impaired but can still serve requests. */
    DEGRADED,

    /** The component is down or cannot serve requests. */
    UNHEALTHY;

    /**
     * Returns the more severe of this status and {@code other}.
     *
     * @param other the status to combine with (must not be null)
     * @return the dominant status
     */
    public HealthStatus worst(HealthStatus other) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
        return other.ordinal() > ordinal() ? other : this;
    }

    /**
     * Returns true if this status ranks strictly above {@code other}.
     */
    public boolean isWorseThan(HealthStatus other) {
        return ordinal() > other.ordinal();
    }

    /**
     * Folds a collection of statuses with {@link #worst(HealthStatus)}.
     * An empty collection yields {@link #HEALTHY}.
     */
    public static HealthStatus worstOf(Collection<HealthStatus> statuses) {
        HealthStatus result = HEALTHY;
        for (HealthStatus status : statuses) {
            result = result.worst(status);
        }
        return result;
    }

    /**
     * Lower-case wire form ({@code "healthy"}, {@code "degraded"}, {@code "unhealthy"}).
     */
    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
