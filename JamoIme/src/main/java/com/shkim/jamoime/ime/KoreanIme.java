package com.shkim.jamoime.ime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;
import com.shkim.jamoime.core.BackspaceResult;
import com.shkim.jamoime.core.InputProcessor;
import com.shkim.jamoime.core.JamoCommitPolicy;
import com.shkim.jamoime.core.NonJamoCommitPolicy;
import com.shkim.jamoime.core.ProcessResult;
import com.shkim.jamoime.core.ProcessorConfig;
import com.shkim.jamoime.core.SyllableState;
import com.shkim.jamoime.core.VirtualKey;

/**
 * A Korean input session.
 * <p>
 * Owns the list of uncommitted syllables: the last entry is the current syllable, the one before it the previous
 * syllable used for re-segmentation. Under explicit commit policies finished syllables stay in the list until
 * {@link #forceCommit()}. Already committed text is never kept here, the host owns it.
 * <p>
 * Not thread-safe: calls into one session must be serialized by the host.
 * The {@link InputProcessor} may be shared between sessions.
 */
public class KoreanIme {
    private static final Logger LOGGER = LoggerFactory.getLogger(KoreanIme.class);

    private final InputProcessor processor;
    private final Map<String, VirtualKey> layout;
    private final List<SyllableState> syllables = new ArrayList<>();
    private KoreanImeListener listener;

    public KoreanIme(InputProcessor processor, Map<String, VirtualKey> layout) {
        this.processor = Objects.requireNonNull(processor, "Null processor");
        this.layout = ImmutableMap.copyOf(Objects.requireNonNull(layout, "Null layout"));
        reset();
    }

    public InputProcessor getProcessor() {
        return processor;
    }

    /**
     * @return raw key to {@link VirtualKey} map, unmodifiable
     */
    public Map<String, VirtualKey> getLayout() {
        return layout;
    }

    public void setListener(KoreanImeListener listener) {
        this.listener = listener;
    }

    /**
     * Drops all uncommitted syllables.
     * Text committed before is not affected.
     */
    public void reset() {
        syllables.clear();
        syllables.add(SyllableState.empty());
    }

    /**
     * Feeds one raw key.
     * An unknown key is ignored and leaves the composing text unchanged.
     *
     * @param key String, a key of the layout
     * @return {@link ImeResult}
     */
    public ImeResult input(String key) {
        VirtualKey virtualKey = key == null ? null : layout.get(key);
        if (virtualKey == null) {
            LOGGER.warn("Unknown key '{}', ignored", key);
            return publish(ImeResult.of("", getComposingText()));
        }
        ProcessResult result = processor.process(previous(), current(), virtualKey);
        StringBuilder committed = new StringBuilder();
        if (result.needAutoCommit()) {
            // everything composed so far is flushed, the new syllable starts a clean window
            committed.append(getComposingText());
            replaceAll(result.current());
            result = ProcessResult.stay(null, result.current());
        }
        if (result.cursorMovement() > 0) {
            committed.append(applyCursorMovement(result));
        } else if (result.current().hasJamo()) {
            applyJamoUpdate(result);
        } else {
            committed.append(applyNonJamoUpdate(result));
        }
        return publish(ImeResult.of(committed.toString(), getComposingText()));
    }

    /**
     * Undoes one composition step.
     * If nothing is left to undo the listener is asked to delete on the host side
     * and the result carries {@link ImeResult#isBackspaceRequested()}.
     *
     * @return {@link ImeResult} with empty committed text
     */
    public ImeResult backspace() {
        if (!hasComposingText()) {
            LOGGER.debug("Nothing to erase, backspace is passed to the host");
            String composing = getComposingText();
            if (listener != null) {
                listener.onBackspaceRequested(this);
            }
            return ImeResult.backspaceRequested(composing);
        }
        while (syllables.size() > 1 && current().isEmpty()) {
            syllables.remove(syllables.size() - 1);
        }
        BackspaceResult result = processor.processBackspace(previous(), current());
        applyBackspace(result);
        return publish(ImeResult.of("", getComposingText()));
    }

    /**
     * Commits everything still being composed.
     *
     * @return String, the committed text
     */
    public String forceCommit() {
        if (syllables.isEmpty()) {
            return "";
        }
        String res = getComposingText();
        syllables.clear();
        if (listener != null) {
            listener.onResult(this, res, "");
        }
        return res;
    }

    /**
     * @return the rendering of all uncommitted syllables, committed text is not included
     */
    public String getComposingText() {
        StringBuilder res = new StringBuilder();
        for (SyllableState syllable : syllables) {
            if (!syllable.isEmpty()) {
                res.append(processor.buildDisplay(syllable));
            }
        }
        return res.toString();
    }

    public boolean hasComposingText() {
        return syllables.stream().anyMatch(s -> !s.isEmpty());
    }

    public StateInfo getCurrentStateInfo() {
        return new StateInfo(current());
    }

    /**
     * @return copy of the uncommitted syllables, the last one is the current syllable
     */
    public List<SyllableState> getUncommittedSyllables() {
        return new ArrayList<>(syllables);
    }

    private ProcessorConfig config() {
        return processor.config();
    }

    private SyllableState previous() {
        return syllables.size() < 2 ? null : syllables.get(syllables.size() - 2);
    }

    private SyllableState current() {
        return syllables.isEmpty() ? SyllableState.empty() : syllables.get(syllables.size() - 1);
    }

    private void replaceAll(SyllableState... states) {
        syllables.clear();
        for (SyllableState state : states) {
            syllables.add(state);
        }
    }

    private void replaceLast(SyllableState state) {
        if (syllables.isEmpty()) {
            syllables.add(state);
        } else {
            syllables.set(syllables.size() - 1, state);
        }
    }

    private ImeResult publish(ImeResult res) {
        LOGGER.debug("{}", res);
        if (listener != null) {
            listener.onResult(this, res.committed(), res.composing());
        }
        return res;
    }

    private String applyCursorMovement(ProcessResult result) {
        SyllableState current = result.current();
        boolean nonJamoInput;
        if (current.nonJamo() != null) {
            nonJamoInput = true;
        } else if (current.hasJamo()) {
            nonJamoInput = false;
        } else {
            nonJamoInput = result.previous() != null && result.previous().nonJamo() != null;
        }
        boolean explicit = nonJamoInput
                ? config().nonJamoCommitPolicy() == NonJamoCommitPolicy.EXPLICIT_COMMIT
                : config().jamoCommitPolicy() == JamoCommitPolicy.EXPLICIT_COMMIT;
        if (explicit) {
            if (result.previous() != null) {
                replaceLast(result.previous());
            }
            syllables.add(current);
            return "";
        }

        // commit everything except the syllable just left, then that syllable as the processor rewrote it
        StringBuilder res = new StringBuilder();
        for (SyllableState syllable : syllables.subList(0, Math.max(0, syllables.size() - 1))) {
            if (!syllable.isEmpty()) {
                res.append(processor.buildDisplay(syllable));
            }
        }
        if (result.previous() != null && !result.previous().isEmpty()) {
            res.append(processor.buildDisplay(result.previous()));
        }
        if (nonJamoInput && config().nonJamoCommitPolicy() == NonJamoCommitPolicy.ON_COMPLETE
                && !processor.canTransitionFurtherForNonJamo(current.nonJamo())) {
            res.append(processor.buildDisplay(current));
            syllables.clear();
        } else {
            replaceAll(current);
        }
        return res.toString();
    }

    private void applyJamoUpdate(ProcessResult result) {
        SyllableState previous = result.previous();
        SyllableState current = result.current();
        if (config().jamoCommitPolicy() != JamoCommitPolicy.EXPLICIT_COMMIT) {
            if (previous == null) {
                replaceAll(current);
            } else {
                replaceAll(previous, current);
            }
            return;
        }
        if (previous == null) {
            replaceLast(current);
            return;
        }
        if (syllables.size() >= 2) {
            syllables.set(syllables.size() - 2, previous);
            syllables.set(syllables.size() - 1, current);
        } else {
            replaceAll(previous, current);
        }
    }

    private String applyNonJamoUpdate(ProcessResult result) {
        SyllableState current = result.current();
        if (current.isEmpty()) {
            if (!syllables.isEmpty()) {
                syllables.remove(syllables.size() - 1);
            }
            return "";
        }
        replaceLast(current);
        if (config().nonJamoCommitPolicy() == NonJamoCommitPolicy.ON_COMPLETE
                && current.nonJamo() != null
                && !processor.canTransitionFurtherForNonJamo(current.nonJamo())) {
            String res = getComposingText();
            syllables.clear();
            return res;
        }
        return "";
    }

    /**
     * Keeps everything before the last two syllables and appends what the backspace left of them.
     * At least one (empty) syllable always remains.
     */
    private void applyBackspace(BackspaceResult result) {
        int base = syllables.size() >= 2 ? syllables.size() - 2 : 0;
        List<SyllableState> res = new ArrayList<>(syllables.subList(0, base));
        if (result.previous() != null) {
            res.add(result.previous());
        }
        if (!result.current().isEmpty()) {
            res.add(result.current());
        }
        if (res.isEmpty()) {
            res.add(SyllableState.empty());
        }
        replaceAll(res.toArray(new SyllableState[0]));
    }
}
