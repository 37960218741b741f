package com.shkim.jamoime.automaton;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang.Validate;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

/**
 * Re-segmentation (도깨비불) rules.
 * <p>
 * When the key following a trailing consonant cannot extend the syllable, the trailing cluster may move,
 * wholly or partly, to the lead of the next syllable.
 * Two independent tables exist:
 * <ul>
 * <li>vowel-triggered, keyed by the trail state alone (e.g. {@code ㄳ -> ㄱ + ㅅ} when a vowel arrives)</li>
 * <li>consonant-triggered, keyed by (trail state, input key), used by layouts where a consonant key
 * itself forces the split</li>
 * </ul>
 */
public final class DokkaebiAutomaton {
    private final ImmutableMap<String, Split> vowelTriggered;
    private final ImmutableTable<String, String, Split> consonantTriggered;

    private DokkaebiAutomaton(Builder builder) {
        this.vowelTriggered = ImmutableMap.copyOf(builder.vowelTriggered);
        this.consonantTriggered = ImmutableTable.copyOf(builder.consonantTriggered);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean canSplitForVowelTrigger(String trailState) {
        return trailState != null && vowelTriggered.containsKey(trailState);
    }

    /**
     * @param trailState String
     * @return {@link Split} or {@code null} if the trail does not move before a vowel
     */
    public Split processForVowelTrigger(String trailState) {
        return trailState == null ? null : vowelTriggered.get(trailState);
    }

    public boolean canSplitForConsonantTrigger(String trailState, String inputKey) {
        return trailState != null && inputKey != null && consonantTriggered.contains(trailState, inputKey);
    }

    /**
     * @param trailState String
     * @param inputKey   String
     * @return {@link Split} or {@code null} if the pair has no rule
     */
    public Split processForConsonantTrigger(String trailState, String inputKey) {
        if (trailState == null || inputKey == null) return null;
        return consonantTriggered.get(trailState, inputKey);
    }

    public boolean hasConsonantRules() {
        return !consonantTriggered.isEmpty();
    }

    public static class Builder {
        private final Map<String, Split> vowelTriggered = new HashMap<>();
        private final Table<String, String, Split> consonantTriggered = HashBasedTable.create();

        private Builder() {
        }

        public Builder vowelTrigger(String trail, String remaining, String moved) {
            Validate.notEmpty(trail, "Empty trail state");
            vowelTriggered.put(trail, new Split(remaining, moved));
            return this;
        }

        public Builder consonantTrigger(String trail, String inputKey, String remaining, String moved) {
            Validate.notEmpty(trail, "Empty trail state");
            Validate.notEmpty(inputKey, "Empty input key");
            consonantTriggered.put(trail, inputKey, new Split(remaining, moved));
            return this;
        }

        public DokkaebiAutomaton build() {
            return new DokkaebiAutomaton(this);
        }
    }

    /**
     * The pair (remaining trail, moved lead).
     */
    public static final class Split {
        private final String remainingTrail;
        private final String movedLead;

        Split(String remainingTrail, String movedLead) {
            Validate.notEmpty(movedLead, "Empty moved state");
            this.remainingTrail = remainingTrail == null || remainingTrail.isEmpty() ? null : remainingTrail;
            this.movedLead = movedLead;
        }

        /**
         * @return the trail left in the previous syllable, {@code null} if the whole cluster moves
         */
        public String remainingTrail() {
            return remainingTrail;
        }

        public String movedLead() {
            return movedLead;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Split)) return false;
            Split that = (Split) o;
            return Objects.equals(remainingTrail, that.remainingTrail) && movedLead.equals(that.movedLead);
        }

        @Override
        public int hashCode() {
            return Objects.hash(remainingTrail, movedLead);
        }

        @Override
        public String toString() {
            return String.format("Split{remaining=%s, moved=%s}", remainingTrail, movedLead);
        }
    }
}
