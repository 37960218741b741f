package com.shkim.jamoime.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * Immutable composition record of one syllable.
 * <p>
 * Holds the automaton sub-state of each jamo slot, an optional non-jamo state (never together with jamo
 * in a well-formed state) and the order in which the jamo slots were first filled.
 * Every mutator returns a new instance.
 */
public final class SyllableState {
    private static final SyllableState EMPTY = new SyllableState(null, null, null, null, ImmutableList.of());

    private final String lead;
    private final String vowel;
    private final String trail;
    private final String nonJamo;
    private final ImmutableList<JamoPosition> compositionOrder;

    private SyllableState(String lead, String vowel, String trail, String nonJamo, ImmutableList<JamoPosition> order) {
        this.lead = lead;
        this.vowel = vowel;
        this.trail = trail;
        this.nonJamo = nonJamo;
        this.compositionOrder = order;
    }

    public static SyllableState empty() {
        return EMPTY;
    }

    public static SyllableState ofNonJamo(String state) {
        return new SyllableState(null, null, null, Objects.requireNonNull(state, "Null non-jamo state"), ImmutableList.of());
    }

    public String lead() {
        return lead;
    }

    public String vowel() {
        return vowel;
    }

    public String trail() {
        return trail;
    }

    public String nonJamo() {
        return nonJamo;
    }

    /**
     * @param position {@link JamoPosition}
     * @return the sub-state of the slot or {@code null}
     */
    public String get(JamoPosition position) {
        switch (Objects.requireNonNull(position, "Null position")) {
            case LEAD:
                return lead;
            case VOWEL:
                return vowel;
            case TRAIL:
                return trail;
            default:
                throw new IllegalArgumentException("Unknown position " + position);
        }
    }

    public List<JamoPosition> compositionOrder() {
        return compositionOrder;
    }

    /**
     * @return the most recently filled position or {@code null} if the order is empty
     */
    public JamoPosition lastPosition() {
        return compositionOrder.isEmpty() ? null : compositionOrder.get(compositionOrder.size() - 1);
    }

    public boolean isEmpty() {
        return lead == null && vowel == null && trail == null && nonJamo == null;
    }

    public boolean hasJamo() {
        return lead != null || vowel != null || trail != null;
    }

    public boolean hasOnly(JamoPosition position) {
        return get(position) != null && nonJamo == null
                && (position == JamoPosition.LEAD || lead == null)
                && (position == JamoPosition.VOWEL || vowel == null)
                && (position == JamoPosition.TRAIL || trail == null);
    }

    /**
     * Sets the slot and appends the position to the composition order if the slot was empty before.
     *
     * @param position {@link JamoPosition}
     * @param state    String, not null
     * @return new {@link SyllableState}
     */
    public SyllableState withJamo(JamoPosition position, String state) {
        Objects.requireNonNull(state, "Null jamo state");
        SyllableState res = withSlot(position, state);
        if (get(position) != null) {
            return res;
        }
        return res.withOrder(ImmutableList.<JamoPosition>builder().addAll(compositionOrder).add(position).build());
    }

    /**
     * Sets or clears the slot without touching the composition order.
     *
     * @param position {@link JamoPosition}
     * @param state    String or {@code null} to clear
     * @return new {@link SyllableState}
     */
    public SyllableState withSlot(JamoPosition position, String state) {
        switch (Objects.requireNonNull(position, "Null position")) {
            case LEAD:
                return new SyllableState(state, vowel, trail, nonJamo, compositionOrder);
            case VOWEL:
                return new SyllableState(lead, state, trail, nonJamo, compositionOrder);
            case TRAIL:
                return new SyllableState(lead, vowel, state, nonJamo, compositionOrder);
            default:
                throw new IllegalArgumentException("Unknown position " + position);
        }
    }

    public SyllableState withNonJamo(String state) {
        return new SyllableState(lead, vowel, trail, state, compositionOrder);
    }

    public SyllableState withOrder(List<JamoPosition> order) {
        return new SyllableState(lead, vowel, trail, nonJamo, ImmutableList.copyOf(order));
    }

    /**
     * @return copy with the last entry of the composition order removed
     */
    public SyllableState withoutLastPosition() {
        if (compositionOrder.isEmpty()) return this;
        return withOrder(compositionOrder.subList(0, compositionOrder.size() - 1));
    }

    /**
     * @param position {@link JamoPosition}
     * @return copy with the last occurrence of the position removed from the composition order
     */
    public SyllableState withoutPosition(JamoPosition position) {
        int index = compositionOrder.lastIndexOf(position);
        if (index < 0) return this;
        List<JamoPosition> order = new ArrayList<>(compositionOrder);
        order.remove(index);
        return withOrder(order);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyllableState)) return false;
        SyllableState that = (SyllableState) o;
        return Objects.equals(lead, that.lead)
                && Objects.equals(vowel, that.vowel)
                && Objects.equals(trail, that.trail)
                && Objects.equals(nonJamo, that.nonJamo)
                && compositionOrder.equals(that.compositionOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lead, vowel, trail, nonJamo, compositionOrder);
    }

    @Override
    public String toString() {
        if (nonJamo != null) {
            return String.format("Syllable{nonJamo=%s}", nonJamo);
        }
        return String.format("Syllable{lead=%s, vowel=%s, trail=%s, order=%s}", lead, vowel, trail, compositionOrder);
    }
}
