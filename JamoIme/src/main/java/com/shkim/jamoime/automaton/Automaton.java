package com.shkim.jamoime.automaton;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.lang.Validate;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

/**
 * A labeled transition table over string states.
 * <p>
 * One class serves lead consonants, vowels, trail consonants and non-jamo characters alike;
 * which of them an instance stands for is decided only by the table it holds.
 * The empty string is the "nothing typed yet" state.
 * Instances are immutable and may be shared between any number of sessions.
 */
public final class Automaton {
    public static final String START = "";

    // row: from-state, column: input key
    private final ImmutableTable<String, String, Transition> transitions;
    private final ImmutableMap<String, String> displays;
    private final ImmutableSet<String> states;

    private Automaton(Builder builder) {
        this.transitions = ImmutableTable.copyOf(builder.transitions);
        this.displays = ImmutableMap.copyOf(builder.displays);
        this.states = ImmutableSet.copyOf(builder.states);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up the transition for the pair (state, input).
     *
     * @param state    String, the current sub-state, {@code null} is treated as {@link #START}
     * @param inputKey String, the key identifier
     * @return {@link Transition} or {@code null} if there is no such transition
     */
    public Transition transition(String state, String inputKey) {
        if (inputKey == null) return null;
        return transitions.get(state == null ? START : state, inputKey);
    }

    /**
     * Shortcut for {@link #transition(String, String)} which returns only the target state.
     *
     * @param state    String or null
     * @param inputKey String
     * @return String, the new state or {@code null}
     */
    public String next(String state, String inputKey) {
        Transition res = transition(state, inputKey);
        return res == null ? null : res.target();
    }

    /**
     * Returns the display string of the state.
     * Unmapped states are shown as their own identifier.
     *
     * @param state String, not null
     * @return String
     */
    public String display(String state) {
        Objects.requireNonNull(state, "Null state");
        return displays.getOrDefault(state, state);
    }

    public boolean hasState(String state) {
        return state != null && states.contains(state);
    }

    /**
     * Answers {@code true} if at least one transition leaves the given state.
     *
     * @param state String
     * @return boolean
     */
    public boolean canTransition(String state) {
        return transitions.containsRow(state == null ? START : state);
    }

    public Set<String> states() {
        return states;
    }

    public int size() {
        return transitions.size();
    }

    @Override
    public String toString() {
        return String.format("Automaton{transitions=%d, states=%d, displays=%d}", transitions.size(), states.size(), displays.size());
    }

    /**
     * The builder, must be the only way to get new {@link Automaton} instance.
     */
    public static class Builder {
        private final Table<String, String, Transition> transitions = HashBasedTable.create();
        private final Map<String, String> displays = new HashMap<>();
        private final Set<String> states = new LinkedHashSet<>();

        private Builder() {
            states.add(START);
        }

        public Builder transition(String from, String input, String to) {
            return transition(from, input, to, null);
        }

        public Builder transition(String from, String input, String to, String switchTo) {
            Objects.requireNonNull(from, "Null from-state");
            Validate.notEmpty(input, "Empty input key");
            Validate.notEmpty(to, "Empty target state");
            transitions.put(from, input, new Transition(to, switchTo));
            states.add(to);
            return this;
        }

        public Builder display(String state, String display) {
            Validate.notEmpty(state, "Empty state");
            Validate.notNull(display, "Null display for " + state);
            displays.put(state, display);
            states.add(state);
            return this;
        }

        public Builder displays(Map<String, String> map) {
            Objects.requireNonNull(map, "Null display map").forEach(this::display);
            return this;
        }

        public Automaton build() {
            return new Automaton(this);
        }
    }
}
