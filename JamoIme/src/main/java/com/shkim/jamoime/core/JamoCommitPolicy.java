package com.shkim.jamoime.core;

import java.util.Arrays;

/**
 * When composed jamo syllables leave the session.
 */
public enum JamoCommitPolicy {
    /**
     * A syllable is committed as soon as the next one starts.
     */
    SYLLABLE("syllable"),
    /**
     * Syllables pile up until the host forces a commit.
     */
    EXPLICIT_COMMIT("explicitCommit");

    private final String name;

    JamoCommitPolicy(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static JamoCommitPolicy fromName(String value) throws IllegalArgumentException {
        return Arrays.stream(values()).filter(v -> v.name.equalsIgnoreCase(value))
                .findFirst().orElseThrow(() -> new IllegalArgumentException("Unknown jamo commit policy: " + value));
    }
}
