package com.shkim.jamoime.core;

/**
 * The three slots of a Hangul syllable, in canonical order.
 */
public enum JamoPosition {
    /**
     * 초성
     */
    LEAD,
    /**
     * 중성
     */
    VOWEL,
    /**
     * 종성
     */
    TRAIL
}
