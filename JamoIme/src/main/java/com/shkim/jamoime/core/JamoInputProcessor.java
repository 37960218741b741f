package com.shkim.jamoime.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.shkim.jamoime.automaton.Automaton;
import com.shkim.jamoime.automaton.BackspaceAutomaton;
import com.shkim.jamoime.automaton.BackspaceOutcome;
import com.shkim.jamoime.automaton.DokkaebiAutomaton;

/**
 * Jamo key and backspace handling.
 * <p>
 * The decision order for a key is fixed:
 * <ol>
 * <li>standalone cluster check (lead-only syllable, if enabled)</li>
 * <li>extension of the current syllable within the allowed positions</li>
 * <li>re-segmentation (도깨비불)</li>
 * <li>a new syllable</li>
 * </ol>
 * Runtime "no transition" conditions are plain control flow, nothing here throws on user input.
 */
public final class JamoInputProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(JamoInputProcessor.class);

    private static final List<JamoPosition> ALL_POSITIONS = ImmutableList.copyOf(JamoPosition.values());

    private final Map<JamoPosition, Automaton> automata;
    private final DokkaebiAutomaton dokkaebi;
    private final BackspaceAutomaton backspace;
    private final ProcessorConfig config;

    public JamoInputProcessor(Automaton lead,
                              Automaton vowel,
                              Automaton trail,
                              DokkaebiAutomaton dokkaebi,
                              BackspaceAutomaton backspace,
                              ProcessorConfig config) {
        Map<JamoPosition, Automaton> map = new EnumMap<>(JamoPosition.class);
        map.put(JamoPosition.LEAD, Objects.requireNonNull(lead, "Null lead automaton"));
        map.put(JamoPosition.VOWEL, Objects.requireNonNull(vowel, "Null vowel automaton"));
        map.put(JamoPosition.TRAIL, Objects.requireNonNull(trail, "Null trail automaton"));
        this.automata = Collections.unmodifiableMap(map);
        this.dokkaebi = dokkaebi;
        this.backspace = backspace;
        this.config = Objects.requireNonNull(config, "Null config");
    }

    public ProcessResult process(SyllableState previous, SyllableState current, VirtualKey key) {
        Objects.requireNonNull(current, "Null current syllable");
        String input = Objects.requireNonNull(key, "Null key").keyIdentifier();

        // a syllable holding a non-jamo character never takes jamo
        if (current.nonJamo() == null) {
            if (config.supportStandaloneCluster() && current.hasOnly(JamoPosition.LEAD)) {
                SyllableState res = tryStandaloneCluster(current, input);
                if (res != null) {
                    return ProcessResult.stay(previous, res);
                }
            }
            SyllableState extended = tryAddToCurrent(current, input);
            if (extended != null) {
                return ProcessResult.stay(previous, extended);
            }
            ProcessResult split = tryDokkaebi(current, input);
            if (split != null) {
                return split;
            }
        }

        SyllableState created = createNewSyllable(input);
        if (current.isEmpty()) {
            return ProcessResult.stay(previous, created);
        }
        return ProcessResult.advance(current, created);
    }

    public BackspaceResult processBackspace(SyllableState previous, SyllableState current) {
        Objects.requireNonNull(current, "Null current syllable");
        if (current.isEmpty()) {
            return new BackspaceResult(previous, current);
        }
        SyllableState res = backspaceOnState(current);
        if (config.jamoCommitPolicy() == JamoCommitPolicy.EXPLICIT_COMMIT) {
            BackspaceResult reverse = tryReverseDokkaebi(previous, res);
            if (reverse != null) {
                return reverse;
            }
        }
        return new BackspaceResult(previous, res);
    }

    /**
     * The lead cluster is extended first; if that fails, the lead is re-read as the seed of a trail cluster.
     */
    private SyllableState tryStandaloneCluster(SyllableState current, String input) {
        String lead = automata.get(JamoPosition.LEAD).next(current.lead(), input);
        if (lead != null) {
            return current.withJamo(JamoPosition.LEAD, lead);
        }
        String trail = automata.get(JamoPosition.TRAIL).next(current.lead(), input);
        if (trail != null) {
            LOGGER.debug("Standalone cluster: lead '{}' re-read as trail '{}'", current.lead(), trail);
            return SyllableState.empty().withJamo(JamoPosition.TRAIL, trail);
        }
        return null;
    }

    private SyllableState tryAddToCurrent(SyllableState current, String input) {
        for (JamoPosition position : allowedPositions(current)) {
            String next = automata.get(position).next(current.get(position), input);
            if (next != null) {
                return current.withJamo(position, next);
            }
        }
        return null;
    }

    /**
     * Lists the positions which may take the next key, in the order they are tried.
     *
     * @param state {@link SyllableState}
     * @return List of {@link JamoPosition}s
     */
    List<JamoPosition> allowedPositions(SyllableState state) {
        if (config.orderMode() == OrderMode.FREE_ORDER) {
            return freeOrderPositions(state);
        }
        return sequentialPositions(state);
    }

    private static List<JamoPosition> sequentialPositions(SyllableState state) {
        boolean lead = state.lead() != null;
        boolean vowel = state.vowel() != null;
        boolean trail = state.trail() != null;
        if (state.isEmpty()) {
            return ALL_POSITIONS;
        }
        if (lead && !vowel && !trail) {
            return ImmutableList.of(JamoPosition.LEAD, JamoPosition.VOWEL);
        }
        if (lead && vowel && !trail) {
            return ImmutableList.of(JamoPosition.VOWEL, JamoPosition.TRAIL);
        }
        if (lead && vowel) {
            return ImmutableList.of(JamoPosition.TRAIL);
        }
        if (!lead && vowel && !trail) {
            return ImmutableList.of(JamoPosition.VOWEL);
        }
        if (!lead && !vowel && trail) {
            return ImmutableList.of(JamoPosition.TRAIL);
        }
        return ImmutableList.of();
    }

    private static List<JamoPosition> freeOrderPositions(SyllableState state) {
        List<JamoPosition> res = new ArrayList<>();
        JamoPosition last = state.lastPosition();
        if (last != null) {
            res.add(last);
        }
        for (JamoPosition position : JamoPosition.values()) {
            if (state.get(position) == null && position != last) {
                res.add(position);
            }
        }
        return res;
    }

    private ProcessResult tryDokkaebi(SyllableState current, String input) {
        if (dokkaebi == null || current.trail() == null) {
            return null;
        }
        JamoPosition last = current.lastPosition();
        if (last != null && last != JamoPosition.TRAIL) {
            return null;
        }
        String vowel = automata.get(JamoPosition.VOWEL).next(null, input);
        if (vowel != null) {
            DokkaebiAutomaton.Split split = dokkaebi.processForVowelTrigger(current.trail());
            if (split == null) {
                return null;
            }
            LOGGER.debug("Dokkaebi on vowel '{}': trail '{}' -> {}", input, current.trail(), split);
            SyllableState created = SyllableState.empty()
                    .withJamo(JamoPosition.LEAD, split.movedLead())
                    .withJamo(JamoPosition.VOWEL, vowel);
            return ProcessResult.advance(leaveRemainder(current, split), created);
        }
        if (automata.get(JamoPosition.LEAD).next(null, input) == null) {
            return null;
        }
        DokkaebiAutomaton.Split split = dokkaebi.processForConsonantTrigger(current.trail(), input);
        if (split == null) {
            return null;
        }
        LOGGER.debug("Dokkaebi on consonant '{}': trail '{}' -> {}", input, current.trail(), split);
        SyllableState created = SyllableState.empty().withJamo(JamoPosition.LEAD, split.movedLead());
        return ProcessResult.advance(leaveRemainder(current, split), created);
    }

    private static SyllableState leaveRemainder(SyllableState current, DokkaebiAutomaton.Split split) {
        SyllableState res = current.withSlot(JamoPosition.TRAIL, split.remainingTrail());
        return split.remainingTrail() == null ? res.withoutPosition(JamoPosition.TRAIL) : res;
    }

    /**
     * Seeds exactly one slot, trying lead, vowel and trail in that order.
     * A key no automaton accepts is kept as a raw non-jamo value.
     */
    private SyllableState createNewSyllable(String input) {
        for (JamoPosition position : JamoPosition.values()) {
            String state = automata.get(position).next(null, input);
            if (state != null) {
                return SyllableState.empty().withJamo(position, state);
            }
        }
        LOGGER.debug("No automaton accepts '{}', kept as non-jamo", input);
        return SyllableState.ofNonJamo(input);
    }

    private SyllableState backspaceOnState(SyllableState state) {
        JamoPosition last = state.lastPosition();
        if (last == null || state.get(last) == null) {
            return state;
        }
        BackspaceOutcome outcome = backspace == null ? BackspaceOutcome.notFound() : backspace.process(state.get(last));
        SyllableState res;
        if (outcome.isDecomposition()) {
            res = state.withSlot(last, outcome.state());
        } else {
            res = state.withSlot(last, null).withoutLastPosition();
        }
        // undo of the standalone cluster: a lone trail that is also a valid lead becomes the lead again
        if (config.supportStandaloneCluster()
                && last == JamoPosition.TRAIL
                && res.hasOnly(JamoPosition.TRAIL)
                && automata.get(JamoPosition.LEAD).hasState(res.trail())) {
            res = SyllableState.empty().withJamo(JamoPosition.LEAD, res.trail());
        }
        return res;
    }

    private BackspaceResult tryReverseDokkaebi(SyllableState previous, SyllableState current) {
        if (previous == null || previous.lead() == null || previous.vowel() == null) {
            return null;
        }
        if (!current.hasOnly(JamoPosition.LEAD)) {
            return null;
        }
        if (previous.trail() != null && previous.lastPosition() != JamoPosition.TRAIL) {
            return null;
        }
        Automaton trail = automata.get(JamoPosition.TRAIL);
        String lead = current.lead();
        if (previous.trail() != null) {
            String combined = trail.next(previous.trail(), lead);
            if (combined == null) {
                return null;
            }
            LOGGER.debug("Reverse dokkaebi: trail '{}' + '{}' -> '{}'", previous.trail(), lead, combined);
            return new BackspaceResult(null, previous.withSlot(JamoPosition.TRAIL, combined));
        }
        if (trail.hasState(lead)) {
            LOGGER.debug("Reverse dokkaebi: lead '{}' moved back as trail", lead);
            return new BackspaceResult(null, previous.withJamo(JamoPosition.TRAIL, lead));
        }
        return null;
    }
}
