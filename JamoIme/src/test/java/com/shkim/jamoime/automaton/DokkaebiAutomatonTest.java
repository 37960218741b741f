package com.shkim.jamoime.automaton;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DokkaebiAutomatonTest {

    private final DokkaebiAutomaton automaton = DokkaebiAutomaton.builder()
            .vowelTrigger("ㄳ", "ㄱ", "ㅅ")
            .vowelTrigger("ㄱ", null, "ㄱ")
            .consonantTrigger("ㄳ", "ㅅ", "ㄱ", "ㅆ")
            .build();

    @Test
    void clusterSplitsBeforeVowel() {
        DokkaebiAutomaton.Split split = automaton.processForVowelTrigger("ㄳ");
        assertEquals("ㄱ", split.remainingTrail());
        assertEquals("ㅅ", split.movedLead());
        assertTrue(automaton.canSplitForVowelTrigger("ㄳ"));
    }

    @Test
    void singleConsonantMovesWhole() {
        DokkaebiAutomaton.Split split = automaton.processForVowelTrigger("ㄱ");
        assertNull(split.remainingTrail());
        assertEquals("ㄱ", split.movedLead());
    }

    @Test
    void consonantRulesAreKeyedByInput() {
        assertTrue(automaton.hasConsonantRules());
        assertTrue(automaton.canSplitForConsonantTrigger("ㄳ", "ㅅ"));
        assertFalse(automaton.canSplitForConsonantTrigger("ㄳ", "ㄱ"));
        assertEquals("ㅆ", automaton.processForConsonantTrigger("ㄳ", "ㅅ").movedLead());
        assertNull(automaton.processForConsonantTrigger("ㄳ", null));
    }

    @Test
    void unknownTrailHasNoRule() {
        assertNull(automaton.processForVowelTrigger("ㄵ"));
        assertNull(automaton.processForVowelTrigger(null));
        assertFalse(DokkaebiAutomaton.builder().build().hasConsonantRules());
    }

    @Test
    void movedLeadIsMandatory() {
        assertThrows(IllegalArgumentException.class, () -> DokkaebiAutomaton.builder().vowelTrigger("ㄳ", "ㄱ", ""));
    }
}
