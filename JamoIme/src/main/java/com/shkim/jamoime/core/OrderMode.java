package com.shkim.jamoime.core;

import java.util.Arrays;

/**
 * How the slots of a syllable may be filled.
 */
public enum OrderMode {
    /**
     * Strict lead, vowel, trail progression.
     */
    SEQUENTIAL("sequential"),
    /**
     * Any empty slot may be filled, the most recent one is extended first.
     */
    FREE_ORDER("freeOrder");

    private final String name;

    OrderMode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static OrderMode fromName(String value) throws IllegalArgumentException {
        return Arrays.stream(values()).filter(v -> v.name.equalsIgnoreCase(value))
                .findFirst().orElseThrow(() -> new IllegalArgumentException("Unknown order mode: " + value));
    }
}
