package com.shkim.jamoime.core;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyllableStateTest {

    @Test
    void emptyStateHasNothing() {
        SyllableState empty = SyllableState.empty();
        assertTrue(empty.isEmpty());
        assertFalse(empty.hasJamo());
        assertNull(empty.lastPosition());
        assertTrue(empty.compositionOrder().isEmpty());
    }

    @Test
    void withJamoRecordsFirstFillOnly() {
        SyllableState state = SyllableState.empty()
                .withJamo(JamoPosition.VOWEL, "ㅗ")
                .withJamo(JamoPosition.LEAD, "ㄱ")
                .withJamo(JamoPosition.VOWEL, "ㅘ");
        assertEquals("ㄱ", state.lead());
        assertEquals("ㅘ", state.vowel());
        assertEquals(Arrays.asList(JamoPosition.VOWEL, JamoPosition.LEAD), state.compositionOrder());
        assertEquals(JamoPosition.LEAD, state.lastPosition());
    }

    @Test
    void mutatorsReturnNewInstances() {
        SyllableState lead = SyllableState.empty().withJamo(JamoPosition.LEAD, "ㄱ");
        SyllableState full = lead.withJamo(JamoPosition.VOWEL, "ㅏ");
        assertNull(lead.vowel());
        assertEquals("ㅏ", full.vowel());
        assertSame(SyllableState.empty(), SyllableState.empty());
    }

    @Test
    void hasOnlyChecksEverySlot() {
        SyllableState lead = SyllableState.empty().withJamo(JamoPosition.LEAD, "ㄱ");
        assertTrue(lead.hasOnly(JamoPosition.LEAD));
        assertFalse(lead.hasOnly(JamoPosition.TRAIL));
        assertFalse(lead.withJamo(JamoPosition.VOWEL, "ㅏ").hasOnly(JamoPosition.LEAD));
        assertFalse(SyllableState.ofNonJamo(".").hasOnly(JamoPosition.LEAD));
    }

    @Test
    void removingPositionsKeepsSlots() {
        SyllableState state = Tables.syllable("ㄱ", "ㅏ", "ㄱ");
        SyllableState withoutTrail = state.withSlot(JamoPosition.TRAIL, null).withoutLastPosition();
        assertEquals(Tables.syllable("ㄱ", "ㅏ", null), withoutTrail);

        SyllableState lead = state.withoutPosition(JamoPosition.LEAD);
        assertEquals(Arrays.asList(JamoPosition.VOWEL, JamoPosition.TRAIL), lead.compositionOrder());
        assertEquals("ㄱ", lead.lead());
    }

    @Test
    void equalityIncludesCompositionOrder() {
        SyllableState sequential = Tables.syllable("ㄱ", "ㅏ", null);
        SyllableState reversed = SyllableState.empty()
                .withJamo(JamoPosition.VOWEL, "ㅏ")
                .withJamo(JamoPosition.LEAD, "ㄱ");
        assertNotEquals(sequential, reversed);
        assertEquals(sequential, Tables.syllable("ㄱ", "ㅏ", null));
        assertEquals(sequential.hashCode(), Tables.syllable("ㄱ", "ㅏ", null).hashCode());
    }

    @Test
    void nonJamoSyllable() {
        SyllableState state = SyllableState.ofNonJamo(".");
        assertEquals(".", state.nonJamo());
        assertFalse(state.isEmpty());
        assertFalse(state.hasJamo());
        assertTrue(state.withNonJamo(null).isEmpty());
        assertThrows(NullPointerException.class, () -> SyllableState.ofNonJamo(null));
    }
}
