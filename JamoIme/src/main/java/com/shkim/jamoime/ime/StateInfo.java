package com.shkim.jamoime.ime;

import com.shkim.jamoime.core.SyllableState;

/**
 * Read-only snapshot of the syllable being composed, for host-side conditions (e.g. key label switching).
 */
public final class StateInfo {
    private final String lead;
    private final String vowel;
    private final String trail;
    private final String nonJamo;

    StateInfo(SyllableState state) {
        this.lead = state.lead();
        this.vowel = state.vowel();
        this.trail = state.trail();
        this.nonJamo = state.nonJamo();
    }

    public boolean hasLead() {
        return lead != null;
    }

    public boolean hasVowel() {
        return vowel != null;
    }

    public boolean hasTrail() {
        return trail != null;
    }

    public boolean hasNonJamo() {
        return nonJamo != null;
    }

    public String getLead() {
        return lead;
    }

    public String getVowel() {
        return vowel;
    }

    public String getTrail() {
        return trail;
    }

    public String getNonJamo() {
        return nonJamo;
    }

    @Override
    public String toString() {
        return String.format("StateInfo{lead=%s, vowel=%s, trail=%s, nonJamo=%s}", lead, vowel, trail, nonJamo);
    }
}
