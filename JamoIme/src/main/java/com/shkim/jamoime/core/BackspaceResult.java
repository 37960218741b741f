package com.shkim.jamoime.core;

import java.util.Objects;

/**
 * The outcome of one backspace: the (possibly rewritten) previous syllable and the resulting current one.
 * A {@code null} previous after reverse re-segmentation means the previous syllable became the current one.
 */
public final class BackspaceResult {
    private final SyllableState previous;
    private final SyllableState current;

    public BackspaceResult(SyllableState previous, SyllableState current) {
        this.previous = previous;
        this.current = Objects.requireNonNull(current, "Null current syllable");
    }

    public SyllableState previous() {
        return previous;
    }

    public SyllableState current() {
        return current;
    }

    @Override
    public String toString() {
        return String.format("BackspaceResult{previous=%s, current=%s}", previous, current);
    }
}
