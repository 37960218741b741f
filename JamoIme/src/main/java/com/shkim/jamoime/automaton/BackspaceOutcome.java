package com.shkim.jamoime.automaton;

import java.util.Objects;

/**
 * The tagged result of a {@link BackspaceAutomaton} lookup.
 */
public final class BackspaceOutcome {
    private static final BackspaceOutcome NOT_FOUND = new BackspaceOutcome(Kind.NOT_FOUND, null);
    private static final BackspaceOutcome FULL_DELETE = new BackspaceOutcome(Kind.FULL_DELETE, null);

    private final Kind kind;
    private final String state;

    private BackspaceOutcome(Kind kind, String state) {
        this.kind = kind;
        this.state = state;
    }

    public static BackspaceOutcome notFound() {
        return NOT_FOUND;
    }

    public static BackspaceOutcome fullDelete() {
        return FULL_DELETE;
    }

    public static BackspaceOutcome decomposesTo(String state) {
        return new BackspaceOutcome(Kind.DECOMPOSES_TO, Objects.requireNonNull(state, "Null state"));
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the predecessor state, {@code null} unless the kind is {@link Kind#DECOMPOSES_TO}
     */
    public String state() {
        return state;
    }

    public boolean isDecomposition() {
        return kind == Kind.DECOMPOSES_TO;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BackspaceOutcome)) return false;
        BackspaceOutcome that = (BackspaceOutcome) o;
        return kind == that.kind && Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, state);
    }

    @Override
    public String toString() {
        return kind == Kind.DECOMPOSES_TO ? kind + "(" + state + ")" : kind.name();
    }

    public enum Kind {
        /**
         * The table has no entry for the state.
         */
        NOT_FOUND,
        /**
         * The state narrows to a predecessor.
         */
        DECOMPOSES_TO,
        /**
         * The table explicitly removes the state.
         */
        FULL_DELETE
    }
}
