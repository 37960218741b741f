package com.shkim.jamoime.config;

import java.util.Arrays;

/**
 * IME documents bundled with the library.
 */
public enum Preset {
    STANDARD_DUBEOLSIK("standard-dubeolsik"),
    CHEONJIIN("cheonjiin"),
    CHEONJIIN_PLUS("cheonjiin-plus");

    private final String name;

    Preset(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return classpath location of the document
     */
    public String getResource() {
        return "/ime/" + name + ".json";
    }

    public static Preset fromName(String value) throws IllegalArgumentException {
        return Arrays.stream(values()).filter(v -> v.name.equalsIgnoreCase(value))
                .findFirst().orElseThrow(() -> new IllegalArgumentException("Unknown preset: " + value));
    }
}
