package com.shkim.jamoime.core;

import java.util.Objects;

import com.shkim.jamoime.automaton.Automaton;
import com.shkim.jamoime.unicode.HangulComposer;

/**
 * Renders a {@link SyllableState} as text according to the {@link DisplayMode}.
 * <p>
 * Jamo slots are first mapped through their automaton's display table (which yields combining jamo,
 * possibly several per slot) and then assembled by {@link HangulComposer}.
 * A non-jamo syllable shows the non-jamo automaton display of its state, or the raw state if there is no such automaton.
 */
public final class DisplayComposer {
    private final Automaton lead;
    private final Automaton vowel;
    private final Automaton trail;
    private final Automaton nonJamo;
    private final DisplayMode mode;

    public DisplayComposer(Automaton lead, Automaton vowel, Automaton trail, Automaton nonJamo, DisplayMode mode) {
        this.lead = Objects.requireNonNull(lead, "Null lead automaton");
        this.vowel = Objects.requireNonNull(vowel, "Null vowel automaton");
        this.trail = Objects.requireNonNull(trail, "Null trail automaton");
        this.nonJamo = nonJamo;
        this.mode = Objects.requireNonNull(mode, "Null display mode");
    }

    public DisplayMode mode() {
        return mode;
    }

    public String build(SyllableState state) {
        Objects.requireNonNull(state, "Null state");
        if (state.nonJamo() != null) {
            return nonJamo == null ? state.nonJamo() : nonJamo.display(state.nonJamo());
        }
        if (!state.hasJamo()) {
            return "";
        }
        switch (mode) {
            case ARCHAIC:
                return archaic(state);
            case MODERN_MULTIPLE:
                return multiple(state);
            case MODERN_PARTIAL:
                return partial(state);
            default:
                throw new IllegalStateException("Unsupported display mode " + mode);
        }
    }

    private String archaic(SyllableState state) {
        HangulComposer.Result res = HangulComposer.tryComposeSyllable(leadDisplay(state), vowelDisplay(state), trailDisplay(state));
        if (res.remainder() == null) {
            return res.composed() == null ? "" : res.composed();
        }
        return leadDisplay(state) + vowelDisplay(state) + trailDisplay(state);
    }

    private String multiple(SyllableState state) {
        StringBuilder res = new StringBuilder();
        String l = leadDisplay(state);
        String v = vowelDisplay(state);
        String t = trailDisplay(state);
        while (!l.isEmpty() || !v.isEmpty() || !t.isEmpty()) {
            HangulComposer.Result step = HangulComposer.tryComposeSyllable(l, v, t);
            if (step.composed() != null) {
                res.append(step.composed());
            }
            HangulComposer.Remainder rest = step.remainder();
            if (rest == null) {
                break;
            }
            l = rest.lead() == null ? "" : rest.lead();
            v = rest.vowel() == null ? "" : rest.vowel();
            t = rest.trail() == null ? "" : rest.trail();
        }
        return res.toString();
    }

    private String partial(SyllableState state) {
        String res = HangulComposer.tryComposeSyllable(leadDisplay(state), vowelDisplay(state), trailDisplay(state)).composed();
        return res == null ? "" : res;
    }

    private String leadDisplay(SyllableState state) {
        return state.lead() == null ? "" : lead.display(state.lead());
    }

    private String vowelDisplay(SyllableState state) {
        return state.vowel() == null ? "" : vowel.display(state.vowel());
    }

    private String trailDisplay(SyllableState state) {
        return state.trail() == null ? "" : trail.display(state.trail());
    }
}
