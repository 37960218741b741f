package com.shkim.jamoime.core;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shkim.jamoime.automaton.Automaton;

/**
 * Handles keys tagged as non-jamo (punctuation, digits and the like).
 * Uses a single automaton and the single non-jamo slot of a syllable; the automaton is optional,
 * without it every key is stored as is.
 */
public final class NonJamoInputProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(NonJamoInputProcessor.class);

    private final Automaton automaton;

    public NonJamoInputProcessor(Automaton automaton) {
        this.automaton = automaton;
    }

    public ProcessResult process(SyllableState previous, SyllableState current, VirtualKey key) {
        Objects.requireNonNull(current, "Null current syllable");
        String input = Objects.requireNonNull(key, "Null key").keyIdentifier();
        String fromEmpty = automaton == null ? null : automaton.next(null, input);

        if (current.hasJamo()) {
            return ProcessResult.advance(current, SyllableState.ofNonJamo(fromEmpty == null ? input : fromEmpty));
        }

        String state = current.nonJamo();
        if (state != null && automaton != null) {
            String next = automaton.next(state, input);
            if (next != null) {
                LOGGER.debug("Non-jamo '{}' + '{}' -> '{}'", state, input, next);
                return ProcessResult.stay(previous, current.withNonJamo(next));
            }
        }

        if (fromEmpty != null) {
            return current.isEmpty()
                    ? ProcessResult.stay(previous, SyllableState.ofNonJamo(fromEmpty))
                    : ProcessResult.advance(current, SyllableState.ofNonJamo(fromEmpty));
        }

        // no automaton or no transition at all: the key is kept raw
        if (state == null) {
            return ProcessResult.stay(previous, SyllableState.ofNonJamo(input));
        }
        return ProcessResult.advance(current, SyllableState.ofNonJamo(input));
    }

    public BackspaceResult processBackspace(SyllableState previous, SyllableState current) {
        Objects.requireNonNull(current, "Null current syllable");
        if (current.nonJamo() == null) {
            return new BackspaceResult(previous, current);
        }
        return new BackspaceResult(previous, current.withNonJamo(null));
    }

    /**
     * @param state non-jamo state
     * @return true if the automaton has an outgoing transition from the state, always false without an automaton
     */
    public boolean canTransitionFurther(String state) {
        return automaton != null && automaton.canTransition(state);
    }

    public Automaton automaton() {
        return automaton;
    }
}
