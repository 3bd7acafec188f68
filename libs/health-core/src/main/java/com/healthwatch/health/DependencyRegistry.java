package com.healthwatch.health;

/**
 * Registry of dependency probes, in registration order.
 * <p>
 * Probes are registered by the host service at startup:
 * <pre>{@code
 * DependencyRegistry registry = new DependencyRegistry();
 * registry.register("postgres-db", DependencyType.DATABASE, postgresProbe);
 * registry.register("redis-cache", DependencyType.CACHE, redisProbe);
 * }</pre>
 * {@link DependencyRunner} reads the entries on every dependencies report.
 */
public final class DependencyRegistry extends OrderedRegistry<RegisteredDependency> {

    /**
     * Registers a probe under the given dependency name.
     *
     * @param name  dependency name (e.g., "postgres-db")
     * @param type  kind of dependency, reported when the probe fails outright
     * @param probe the probe to run
     * @throws IllegalArgumentException if any argument is missing or the name is taken
     */
    public void register(String name, DependencyType type, DependencyProbe probe) {
        add(name, new RegisteredDependency(name, type, probe));
    }
}
