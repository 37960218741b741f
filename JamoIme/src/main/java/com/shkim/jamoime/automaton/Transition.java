package com.shkim.jamoime.automaton;

import java.util.Objects;

/**
 * The right-hand side of an automaton transition: the target state and an optional switch tag.
 * A switch tag names the jamo category a layout wants subsequent input to continue in;
 * it is carried as data and never interpreted by the automaton itself.
 */
public final class Transition {
    private final String target;
    private final String switchTo;

    Transition(String target, String switchTo) {
        this.target = Objects.requireNonNull(target, "Null target");
        this.switchTo = switchTo;
    }

    public String target() {
        return target;
    }

    /**
     * @return String or {@code null} if the transition has no switch tag
     */
    public String switchTo() {
        return switchTo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transition)) return false;
        Transition that = (Transition) o;
        return target.equals(that.target) && Objects.equals(switchTo, that.switchTo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, switchTo);
    }

    @Override
    public String toString() {
        return switchTo == null ? target : target + "->" + switchTo;
    }
}
