package com.shkim.jamoime.core;

import org.junit.jupiter.api.Test;

import static com.shkim.jamoime.core.Tables.syllable;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NonJamoInputProcessorTest {
    private static final VirtualKey DOT = VirtualKey.nonJamo(".");

    private final NonJamoInputProcessor processor = new NonJamoInputProcessor(Tables.punctuation());

    @Test
    void repeatedKeyCyclesInPlace() {
        ProcessResult first = processor.process(null, SyllableState.empty(), DOT);
        assertEquals(0, first.cursorMovement());
        assertEquals(SyllableState.ofNonJamo("."), first.current());

        ProcessResult second = processor.process(null, first.current(), DOT);
        assertEquals(0, second.cursorMovement());
        assertEquals(SyllableState.ofNonJamo(","), second.current());
    }

    @Test
    void exhaustedCycleStartsOver() {
        ProcessResult res = processor.process(null, SyllableState.ofNonJamo(","), DOT);
        assertEquals(1, res.cursorMovement());
        assertEquals(SyllableState.ofNonJamo(","), res.previous());
        assertEquals(SyllableState.ofNonJamo("."), res.current());
    }

    @Test
    void jamoSyllableIsLeftBehind() {
        SyllableState ga = syllable("ㄱ", "ㅏ", null);
        ProcessResult res = processor.process(null, ga, DOT);
        assertEquals(1, res.cursorMovement());
        assertEquals(ga, res.previous());
        assertEquals(SyllableState.ofNonJamo("."), res.current());
    }

    @Test
    void withoutAutomatonKeysAreKeptRaw() {
        NonJamoInputProcessor raw = new NonJamoInputProcessor(null);
        ProcessResult first = raw.process(null, SyllableState.empty(), VirtualKey.nonJamo("!"));
        assertEquals(SyllableState.ofNonJamo("!"), first.current());
        ProcessResult second = raw.process(null, first.current(), VirtualKey.nonJamo("?"));
        assertEquals(1, second.cursorMovement());
        assertEquals(SyllableState.ofNonJamo("?"), second.current());
        assertFalse(raw.canTransitionFurther("!"));
    }

    @Test
    void backspaceClearsNonJamo() {
        BackspaceResult res = processor.processBackspace(null, SyllableState.ofNonJamo(","));
        assertTrue(res.current().isEmpty());
    }

    @Test
    void transitionFurther() {
        assertTrue(processor.canTransitionFurther("."));
        assertFalse(processor.canTransitionFurther(","));
    }
}
