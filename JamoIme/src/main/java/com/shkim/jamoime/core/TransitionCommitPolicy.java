package com.shkim.jamoime.core;

import java.util.Arrays;

/**
 * Whether switching between jamo and non-jamo input commits the composing text.
 */
public enum TransitionCommitPolicy {
    NEVER("never"), ALWAYS("always");

    private final String name;

    TransitionCommitPolicy(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static TransitionCommitPolicy fromName(String value) throws IllegalArgumentException {
        return Arrays.stream(values()).filter(v -> v.name.equalsIgnoreCase(value))
                .findFirst().orElseThrow(() -> new IllegalArgumentException("Unknown transition commit policy: " + value));
    }
}
