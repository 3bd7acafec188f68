package com.healthwatch.health;

import java.util.ArrayList;
import java.util.List;

/**
 * Name-keyed registry that remembers registration order.
 * <p>
 * Entries are registered once at startup and read on every report. Names are unique;
 * registering a name twice is rejected rather than silently replacing the first entry,
 * so report ordering never shifts underneath consumers.
 *
 * @param <E> entry type
 */
public abstract class OrderedRegistry<E> {

    private final List<String> names = new ArrayList<>();
    private final List<E> entries = new ArrayList<>();

    /**
     * Appends an entry under the given name.
     *
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    protected final synchronized void add(String name, E entry) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (names.contains(name)) {
            throw new IllegalArgumentException("'" + name + "' is already registered");
        }
        names.add(name);
        entries.add(entry);
    }

    /**
     * Returns an immutable snapshot of the entries in registration order.
     */
    public final synchronized List<E> entries() {
        return List.copyOf(entries);
    }

    /**
     * Returns true if an entry with the given name is registered.
     */
    public final synchronized boolean contains(String name) {
        return names.contains(name);
    }

    /**
     * Returns the number of registered entries.
     */
    public final synchronized int size() {
        return entries.size();
    }
}
