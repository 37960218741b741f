package com.shkim.jamoime.core;

import java.util.Objects;

/**
 * The outcome of one key press.
 * <p>
 * {@code previous} is the syllable before the current one (possibly rewritten by re-segmentation),
 * not the state of the current syllable before the key.
 */
public final class ProcessResult {
    private final SyllableState previous;
    private final SyllableState current;
    private final int cursorMovement;
    private final boolean needAutoCommit;

    private ProcessResult(SyllableState previous, SyllableState current, int cursorMovement, boolean needAutoCommit) {
        this.previous = previous;
        this.current = Objects.requireNonNull(current, "Null current syllable");
        this.cursorMovement = cursorMovement;
        this.needAutoCommit = needAutoCommit;
    }

    /**
     * The cursor stays on the current syllable.
     */
    public static ProcessResult stay(SyllableState previous, SyllableState current) {
        return new ProcessResult(previous, current, 0, false);
    }

    /**
     * A new syllable is started, {@code previous} is the one just left.
     */
    public static ProcessResult advance(SyllableState previous, SyllableState current) {
        return new ProcessResult(previous, current, 1, false);
    }

    public ProcessResult withAutoCommit(boolean needAutoCommit) {
        return needAutoCommit == this.needAutoCommit ? this : new ProcessResult(previous, current, cursorMovement, needAutoCommit);
    }

    /**
     * @return {@link SyllableState} or {@code null}
     */
    public SyllableState previous() {
        return previous;
    }

    public SyllableState current() {
        return current;
    }

    /**
     * @return 0 to stay, 1 to advance to a new syllable
     */
    public int cursorMovement() {
        return cursorMovement;
    }

    public boolean needAutoCommit() {
        return needAutoCommit;
    }

    @Override
    public String toString() {
        return String.format("ProcessResult{previous=%s, current=%s, cursor=%d, autoCommit=%s}",
                previous, current, cursorMovement, needAutoCommit);
    }
}
