package com.healthwatch.health;

/**
 * A dependency probe together with the name and type it was registered under.
 *
 * @param name  unique dependency name
 * @param type  kind of dependency
 * @param probe the probe operation
 */
public record RegisteredDependency(String name, DependencyType type, DependencyProbe probe) {

    public RegisteredDependency {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (probe == null) {
            throw new IllegalArgumentException("probe must not be null");
        }
    }
}
