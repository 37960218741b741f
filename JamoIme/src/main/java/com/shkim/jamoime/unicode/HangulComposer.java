package com.shkim.jamoime.unicode;

import java.util.Objects;

import org.apache.commons.lang.StringUtils;

/**
 * Greedy composer of one precomposed syllable out of three display strings.
 * <p>
 * The inputs are automaton display strings, i.e. sequences of combining jamo which may be longer than one code point.
 * One code point is consumed from the front of each part while it fits into a modern syllable;
 * everything which does not fit is handed back as {@link Remainder}.
 * If there is no lead/vowel pair, the single consumed jamo is returned as compatibility jamo.
 */
public final class HangulComposer {

    private HangulComposer() {
    }

    /**
     * Tries to compose a syllable.
     *
     * @param lead  String, lead display, not null, possibly empty
     * @param vowel String, vowel display, not null, possibly empty
     * @param trail String, trail display, not null, possibly empty
     * @return {@link Result}, never null
     */
    public static Result tryComposeSyllable(String lead, String vowel, String trail) {
        Objects.requireNonNull(lead, "Null lead");
        Objects.requireNonNull(vowel, "Null vowel");
        Objects.requireNonNull(trail, "Null trail");
        if (lead.isEmpty() && vowel.isEmpty() && trail.isEmpty()) {
            return Result.EMPTY;
        }
        Indices indices = new Indices();
        String restLead = lead;
        String restVowel = vowel;
        String restTrail = trail;

        if (!restLead.isEmpty()) {
            int index = restLead.codePointAt(0) - JasoUtil.LEAD_BASE;
            if (index < 0 || index >= JasoUtil.LEAD_COUNT) {
                return compatibilityResult(restLead, restVowel, restTrail);
            }
            indices.lead = index;
            restLead = dropFirst(restLead);
            if (!restLead.isEmpty()) {
                return build(indices, restLead, restVowel, restTrail);
            }
        }

        if (!restVowel.isEmpty()) {
            int index = restVowel.codePointAt(0) - JasoUtil.VOWEL_BASE;
            if (indices.lead == null) {
                indices.vowel = index;
                return build(indices, restLead, dropFirst(restVowel), restTrail);
            }
            if (index < 0 || index >= JasoUtil.VOWEL_COUNT) {
                return build(indices, restLead, restVowel, restTrail);
            }
            indices.vowel = index;
            restVowel = dropFirst(restVowel);
            if (!restVowel.isEmpty()) {
                return build(indices, restLead, restVowel, restTrail);
            }
        }

        if (!restTrail.isEmpty()) {
            if (indices.lead != null && indices.vowel == null) {
                // a lead without vowel can't take a trail, the trail goes to the next round
                return build(indices, restLead, restVowel, restTrail);
            }
            int index = restTrail.codePointAt(0) - JasoUtil.TRAIL_BASE;
            if (indices.lead == null) {
                indices.trail = index;
                return build(indices, restLead, restVowel, dropFirst(restTrail));
            }
            if (index < 1 || index >= JasoUtil.TRAIL_COUNT) {
                return build(indices, restLead, restVowel, restTrail);
            }
            indices.trail = index;
            restTrail = dropFirst(restTrail);
        }
        return build(indices, restLead, restVowel, restTrail);
    }

    private static Result build(Indices indices, String lead, String vowel, String trail) {
        Remainder remainder = Remainder.of(lead, vowel, trail);
        if (indices.lead != null && indices.vowel != null) {
            int trailIndex = indices.trail == null ? 0 : indices.trail;
            return new Result(String.valueOf(JasoUtil.composeSyllable(indices.lead, indices.vowel, trailIndex)), remainder);
        }
        Integer codePoint = null;
        if (indices.lead != null) {
            codePoint = JasoUtil.LEAD_BASE + indices.lead;
        } else if (indices.vowel != null) {
            codePoint = JasoUtil.VOWEL_BASE + indices.vowel;
        } else if (indices.trail != null) {
            codePoint = JasoUtil.TRAIL_BASE + indices.trail;
        }
        if (codePoint == null) {
            return new Result(null, remainder);
        }
        return new Result(new String(Character.toChars(JasoUtil.toCompatibilityJamo(codePoint))), remainder);
    }

    private static Result compatibilityResult(String lead, String vowel, String trail) {
        if (!lead.isEmpty()) {
            return new Result(firstAsCompatibility(lead), Remainder.of(dropFirst(lead), vowel, trail));
        }
        if (!vowel.isEmpty()) {
            return new Result(firstAsCompatibility(vowel), Remainder.of(lead, dropFirst(vowel), trail));
        }
        if (!trail.isEmpty()) {
            return new Result(firstAsCompatibility(trail), Remainder.of(lead, vowel, dropFirst(trail)));
        }
        return Result.EMPTY;
    }

    private static String firstAsCompatibility(String s) {
        return new String(Character.toChars(JasoUtil.toCompatibilityJamo(s.codePointAt(0))));
    }

    private static String dropFirst(String s) {
        return s.substring(Character.charCount(s.codePointAt(0)));
    }

    private static class Indices {
        private Integer lead;
        private Integer vowel;
        private Integer trail;
    }

    /**
     * The outcome of one composition attempt.
     */
    public static final class Result {
        static final Result EMPTY = new Result(null, null);

        private final String composed;
        private final Remainder remainder;

        Result(String composed, Remainder remainder) {
            this.composed = composed;
            this.remainder = remainder;
        }

        /**
         * @return the composed syllable or compatibility jamo, {@code null} if nothing was consumed
         */
        public String composed() {
            return composed;
        }

        /**
         * @return display strings left over, {@code null} if everything was consumed
         */
        public Remainder remainder() {
            return remainder;
        }

        @Override
        public String toString() {
            return String.format("Result{composed='%s', remainder=%s}", composed, remainder);
        }
    }

    /**
     * Leftover display strings, each part is either {@code null} or non-empty.
     */
    public static final class Remainder {
        private final String lead;
        private final String vowel;
        private final String trail;

        private Remainder(String lead, String vowel, String trail) {
            this.lead = lead;
            this.vowel = vowel;
            this.trail = trail;
        }

        static Remainder of(String lead, String vowel, String trail) {
            if (StringUtils.isEmpty(lead) && StringUtils.isEmpty(vowel) && StringUtils.isEmpty(trail)) {
                return null;
            }
            return new Remainder(emptyToNull(lead), emptyToNull(vowel), emptyToNull(trail));
        }

        private static String emptyToNull(String s) {
            return StringUtils.isEmpty(s) ? null : s;
        }

        public String lead() {
            return lead;
        }

        public String vowel() {
            return vowel;
        }

        public String trail() {
            return trail;
        }

        @Override
        public String toString() {
            return String.format("Remainder{lead='%s', vowel='%s', trail='%s'}", lead, vowel, trail);
        }
    }
}
