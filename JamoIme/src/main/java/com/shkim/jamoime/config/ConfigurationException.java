package com.shkim.jamoime.config;

import java.util.Objects;

/**
 * Raised when an IME document cannot be turned into a working IME.
 * Thrown at load time only, never while keys are processed.
 */
public class ConfigurationException extends RuntimeException {

    /**
     * The named failure kinds.
     */
    public enum Kind {
        INVALID_ORDER_MODE,
        INVALID_COMMIT_POLICY,
        INVALID_DISPLAY_MODE,
        INVALID_DOCUMENT,
        MISSING_AUTOMATON,
        RESOURCE_NOT_FOUND,
    }

    private final Kind kind;

    public ConfigurationException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Null kind");
    }

    public ConfigurationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Null kind");
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return kind + ": " + super.getMessage();
    }
}
