package com.shkim.jamoime.core;

import org.junit.jupiter.api.Test;

import com.shkim.jamoime.automaton.Automaton;

import static com.shkim.jamoime.core.Tables.syllable;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DisplayComposerTest {
    private static final Automaton LEAD = Automaton.builder()
            .display("ㅎ", "ᄒ").display("ㄱ", "ᄀ").display("ㄲ", "ᄀᄀ")
            .build();
    private static final Automaton VOWEL = Automaton.builder()
            .display("ㅏ", "ᅡ").display("ㆍ", "ᆞ")
            .build();
    private static final Automaton TRAIL = Automaton.builder()
            .display("ㄴ", "ᆫ").display("ㄹㄷ", "ᆯᆮ")
            .build();

    private static DisplayComposer composer(DisplayMode mode) {
        return new DisplayComposer(LEAD, VOWEL, TRAIL, Tables.punctuation(), mode);
    }

    @Test
    void modernSyllableLooksTheSameInEveryMode() {
        for (DisplayMode mode : DisplayMode.values()) {
            assertEquals("한", composer(mode).build(syllable("ㅎ", "ㅏ", "ㄴ")));
        }
    }

    @Test
    void multipleModeShowsLeftoverJamo() {
        DisplayComposer composer = composer(DisplayMode.MODERN_MULTIPLE);
        assertEquals("할ㄷ", composer.build(syllable("ㅎ", "ㅏ", "ㄹㄷ")));
        assertEquals("ㄱㆍ", composer.build(syllable("ㄱ", "ㆍ", null)));
        assertEquals("ㄱ가", composer.build(syllable("ㄲ", "ㅏ", null)));
    }

    @Test
    void partialModeDropsLeftoverJamo() {
        DisplayComposer composer = composer(DisplayMode.MODERN_PARTIAL);
        assertEquals("할", composer.build(syllable("ㅎ", "ㅏ", "ㄹㄷ")));
        assertEquals("ㄱ", composer.build(syllable("ㄱ", "ㆍ", null)));
    }

    @Test
    void archaicModeKeepsCombiningSequence() {
        DisplayComposer composer = composer(DisplayMode.ARCHAIC);
        assertEquals("할ᆮ", composer.build(syllable("ㅎ", "ㅏ", "ㄹㄷ")));
        assertEquals("ᄀᆞ", composer.build(syllable("ㄱ", "ㆍ", null)));
    }

    @Test
    void singleJamoIsCompatibilityJamo() {
        DisplayComposer composer = composer(DisplayMode.MODERN_MULTIPLE);
        assertEquals("ㄱ", composer.build(syllable("ㄱ", null, null)));
        assertEquals("ㅏ", composer.build(syllable(null, "ㅏ", null)));
        assertEquals("ㄴ", composer.build(syllable(null, null, "ㄴ")));
    }

    @Test
    void trailWithoutVowelIsKept() {
        SyllableState state = syllable("ㄱ", null, "ㄴ");
        assertEquals("ㄱㄴ", composer(DisplayMode.MODERN_MULTIPLE).build(state));
        assertEquals("ᄀᆫ", composer(DisplayMode.ARCHAIC).build(state));
        assertEquals("ㄱ", composer(DisplayMode.MODERN_PARTIAL).build(state));
    }

    @Test
    void nonJamoAndEmpty() {
        assertEquals(",", composer(DisplayMode.MODERN_MULTIPLE).build(SyllableState.ofNonJamo(",")));
        assertEquals("", composer(DisplayMode.MODERN_MULTIPLE).build(SyllableState.empty()));
        DisplayComposer raw = new DisplayComposer(LEAD, VOWEL, TRAIL, null, DisplayMode.MODERN_MULTIPLE);
        assertEquals("#", raw.build(SyllableState.ofNonJamo("#")));
    }
}
