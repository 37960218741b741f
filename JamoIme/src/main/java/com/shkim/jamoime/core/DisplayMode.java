package com.shkim.jamoime.core;

import java.util.Arrays;

/**
 * How a syllable that does not fit into one modern Hangul code point is shown.
 */
public enum DisplayMode {
    /**
     * The composed syllable if everything fits, otherwise the raw jamo display strings.
     */
    ARCHAIC("archaic"),
    /**
     * Split into as many syllables (or compatibility jamo) as needed.
     */
    MODERN_MULTIPLE("modernMultiple"),
    /**
     * Only the part that fits into the first syllable.
     */
    MODERN_PARTIAL("modernPartial");

    private final String name;

    DisplayMode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static DisplayMode fromName(String value) throws IllegalArgumentException {
        return Arrays.stream(values()).filter(v -> v.name.equalsIgnoreCase(value))
                .findFirst().orElseThrow(() -> new IllegalArgumentException("Unknown display mode: " + value));
    }
}
