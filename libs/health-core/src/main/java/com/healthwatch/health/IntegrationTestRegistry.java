package com.healthwatch.health;

/**
 * Registry of integration tests, in registration order.
 */
public final class IntegrationTestRegistry extends OrderedRegistry<RegisteredTest> {

    /**
     * Registers a test under the given name.
     *
     * @throws IllegalArgumentException if any argument is missing or the name is taken
     */
    public void register(String name, IntegrationTest test) {
        add(name, new RegisteredTest(name, test));
    }
}
