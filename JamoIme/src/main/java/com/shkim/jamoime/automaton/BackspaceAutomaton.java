package com.shkim.jamoime.automaton;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.Validate;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Maps a compound state to the state it decomposes into on one backspace.
 * <p>
 * Three outcomes are distinguished, see {@link BackspaceOutcome}:
 * a state may have a predecessor, may be explicitly marked for deletion, or may be unknown to the table.
 */
public final class BackspaceAutomaton {
    private final ImmutableMap<String, String> decompositions;
    private final ImmutableSet<String> deletions;

    private BackspaceAutomaton(Builder builder) {
        this.decompositions = ImmutableMap.copyOf(builder.decompositions);
        this.deletions = ImmutableSet.copyOf(builder.deletions);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up the backspace step for the state.
     *
     * @param state String
     * @return {@link BackspaceOutcome}, never null
     */
    public BackspaceOutcome process(String state) {
        if (state == null) return BackspaceOutcome.notFound();
        String res = decompositions.get(state);
        if (res != null) {
            return BackspaceOutcome.decomposesTo(res);
        }
        return deletions.contains(state) ? BackspaceOutcome.fullDelete() : BackspaceOutcome.notFound();
    }

    public int size() {
        return decompositions.size() + deletions.size();
    }

    public static class Builder {
        private final Map<String, String> decompositions = new HashMap<>();
        private final Set<String> deletions = new HashSet<>();

        private Builder() {
        }

        /**
         * Adds the step {@code from -> to}.
         * An empty or {@code null} target marks the state to be deleted as a whole.
         *
         * @param from String, not empty
         * @param to   String, the predecessor state
         * @return this builder
         */
        public Builder transition(String from, String to) {
            Validate.notEmpty(from, "Empty from-state");
            if (to == null || to.isEmpty()) {
                decompositions.remove(from);
                deletions.add(from);
            } else {
                deletions.remove(from);
                decompositions.put(from, to);
            }
            return this;
        }

        public BackspaceAutomaton build() {
            return new BackspaceAutomaton(this);
        }
    }
}
