package com.healthwatch.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of external system a dependency probe checks.
 */
public enum DependencyType {

    DATABASE,
    CACHE,
    MESSAGE_QUEUE,
    EXTERNAL_API,
    STORAGE,
    SEARCH;

    /**
     * Lower snake-case wire form (e.g. {@code "message_queue"}).
     */
    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
