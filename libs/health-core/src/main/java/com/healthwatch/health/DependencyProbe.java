package com.healthwatch.health;

import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for a single dependency probe.
 * <p>
 * Implementations perform a lightweight check of an external system (database, cache,
 * message broker, HTTP API) and return the result asynchronously. A probe may also fail
 * by throwing or by completing the future exceptionally; {@link DependencyRunner} turns
 * such failures into an {@link HealthStatus#UNHEALTHY} result.
 * <p>
 * Example usage:
 * <pre>{@code
 * DependencyProbe redis = () -> CompletableFuture.supplyAsync(() -> {
 *     long start = System.nanoTime();
 *     redisClient.ping();
 *     return DependencyHealth.healthy("redis", DependencyType.CACHE,
 *             (System.nanoTime() - start) / 1_000_000.0, Instant.now());
 * });
 * }</pre>
 */
@FunctionalInterface
public interface DependencyProbe {

    /**
     * Checks the dependency and returns the result asynchronously.
     *
     * @return a future that completes with the dependency health
     */
    CompletableFuture<DependencyHealth> probe();
}
