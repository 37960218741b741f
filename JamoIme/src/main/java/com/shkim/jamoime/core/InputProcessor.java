package com.shkim.jamoime.core;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shkim.jamoime.automaton.Automaton;
import com.shkim.jamoime.automaton.BackspaceAutomaton;
import com.shkim.jamoime.automaton.DokkaebiAutomaton;

/**
 * The composition engine: dispatches keys to the jamo or non-jamo processor and renders syllables.
 * <p>
 * Stateless apart from its immutable tables, so one instance may serve many sessions.
 * Use {@link Builder} to assemble it.
 */
public final class InputProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(InputProcessor.class);

    private final ProcessorConfig config;
    private final JamoInputProcessor jamo;
    private final NonJamoInputProcessor nonJamo;
    private final DisplayComposer display;

    private InputProcessor(Builder builder) {
        this.config = builder.config;
        this.jamo = new JamoInputProcessor(builder.lead, builder.vowel, builder.trail, builder.dokkaebi, builder.backspace, config);
        this.nonJamo = new NonJamoInputProcessor(builder.nonJamo);
        this.display = new DisplayComposer(builder.lead, builder.vowel, builder.trail, builder.nonJamo, config.displayMode());
    }

    public static Builder builder() {
        return new Builder();
    }

    public ProcessorConfig config() {
        return config;
    }

    /**
     * Handles one key.
     *
     * @param previous {@link SyllableState}, the syllable before the current one, nullable
     * @param current  {@link SyllableState}, not null
     * @param key      {@link VirtualKey}
     * @return {@link ProcessResult}
     */
    public ProcessResult process(SyllableState previous, SyllableState current, VirtualKey key) {
        Objects.requireNonNull(current, "Null current syllable");
        Objects.requireNonNull(key, "Null key");
        ProcessResult res = key.isNonJamo()
                ? nonJamo.process(previous, current, key)
                : jamo.process(previous, current, key);
        boolean crossing = key.isNonJamo() ? current.hasJamo() : current.nonJamo() != null;
        boolean autoCommit = config.transitionCommitPolicy() == TransitionCommitPolicy.ALWAYS && !current.isEmpty() && crossing;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Key '{}': {} -> {}", key.keyIdentifier(), current, res.withAutoCommit(autoCommit));
        }
        return res.withAutoCommit(autoCommit);
    }

    /**
     * Undoes one composition step of the current syllable.
     *
     * @param previous {@link SyllableState}, nullable
     * @param current  {@link SyllableState}, not null
     * @return {@link BackspaceResult}
     */
    public BackspaceResult processBackspace(SyllableState previous, SyllableState current) {
        Objects.requireNonNull(current, "Null current syllable");
        if (current.nonJamo() != null) {
            return nonJamo.processBackspace(previous, current);
        }
        return jamo.processBackspace(previous, current);
    }

    public String buildDisplay(SyllableState state) {
        return display.build(state);
    }

    public boolean canTransitionFurtherForNonJamo(String state) {
        return nonJamo.canTransitionFurther(state);
    }

    /**
     * The Class-Builder to make new {@link InputProcessor} object.
     * Lead, vowel and trail automata are mandatory, the rest may be left out.
     */
    public static class Builder {
        private Automaton lead;
        private Automaton vowel;
        private Automaton trail;
        private Automaton nonJamo;
        private DokkaebiAutomaton dokkaebi;
        private BackspaceAutomaton backspace;
        private ProcessorConfig config = ProcessorConfig.DEFAULT;

        private Builder() {
        }

        public Builder setLead(Automaton automaton) {
            this.lead = Objects.requireNonNull(automaton, "Null lead automaton");
            return this;
        }

        public Builder setVowel(Automaton automaton) {
            this.vowel = Objects.requireNonNull(automaton, "Null vowel automaton");
            return this;
        }

        public Builder setTrail(Automaton automaton) {
            this.trail = Objects.requireNonNull(automaton, "Null trail automaton");
            return this;
        }

        public Builder setNonJamo(Automaton automaton) {
            this.nonJamo = automaton;
            return this;
        }

        public Builder setDokkaebi(DokkaebiAutomaton automaton) {
            this.dokkaebi = automaton;
            return this;
        }

        public Builder setBackspace(BackspaceAutomaton automaton) {
            this.backspace = automaton;
            return this;
        }

        public Builder setConfig(ProcessorConfig config) {
            this.config = Objects.requireNonNull(config, "Null config");
            return this;
        }

        public InputProcessor build() {
            Objects.requireNonNull(lead, "Lead automaton is not set");
            Objects.requireNonNull(vowel, "Vowel automaton is not set");
            Objects.requireNonNull(trail, "Trail automaton is not set");
            return new InputProcessor(this);
        }
    }
}
