package com.shkim.jamoime.core;

import java.util.Arrays;

/**
 * When non-jamo characters (punctuation, digits) leave the session.
 */
public enum NonJamoCommitPolicy {
    CHARACTER("character"),
    EXPLICIT_COMMIT("explicitCommit"),
    /**
     * Commit once the non-jamo automaton has no further transition from the current state.
     */
    ON_COMPLETE("onComplete");

    private final String name;

    NonJamoCommitPolicy(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static NonJamoCommitPolicy fromName(String value) throws IllegalArgumentException {
        return Arrays.stream(values()).filter(v -> v.name.equalsIgnoreCase(value))
                .findFirst().orElseThrow(() -> new IllegalArgumentException("Unknown non-jamo commit policy: " + value));
    }
}
