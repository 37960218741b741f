package com.shkim.jamoime.ime;

import java.util.Objects;

/**
 * What one call into a {@link KoreanIme} produced.
 * The host appends {@link #committed()} to its own buffer and shows {@link #composing()} as the preedit text.
 */
public final class ImeResult {
    private final String committed;
    private final String composing;
    private final boolean backspaceRequested;

    private ImeResult(String committed, String composing, boolean backspaceRequested) {
        this.committed = Objects.requireNonNull(committed, "Null committed text");
        this.composing = Objects.requireNonNull(composing, "Null composing text");
        this.backspaceRequested = backspaceRequested;
    }

    static ImeResult of(String committed, String composing) {
        return new ImeResult(committed, composing, false);
    }

    static ImeResult backspaceRequested(String composing) {
        return new ImeResult("", composing, true);
    }

    /**
     * @return text which became final by this call, possibly empty
     */
    public String committed() {
        return committed;
    }

    /**
     * @return the full snapshot of the text still being composed
     */
    public String composing() {
        return composing;
    }

    /**
     * @return true if there was nothing to erase inside the engine and the host must delete a character itself
     */
    public boolean isBackspaceRequested() {
        return backspaceRequested;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImeResult)) return false;
        ImeResult that = (ImeResult) o;
        return backspaceRequested == that.backspaceRequested && committed.equals(that.committed) && composing.equals(that.composing);
    }

    @Override
    public int hashCode() {
        return Objects.hash(committed, composing, backspaceRequested);
    }

    @Override
    public String toString() {
        return String.format("ImeResult{committed='%s', composing='%s', backspaceRequested=%s}", committed, composing, backspaceRequested);
    }
}
