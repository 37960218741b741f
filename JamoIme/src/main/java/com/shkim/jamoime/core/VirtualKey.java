package com.shkim.jamoime.core;

import java.util.Objects;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

/**
 * A key of a layout: the identifier fed into the automata, a label for the host UI
 * and whether the key bypasses jamo composition.
 */
public final class VirtualKey {
    private final String keyIdentifier;
    private final String label;
    private final boolean nonJamo;

    public VirtualKey(String keyIdentifier) {
        this(keyIdentifier, null, false);
    }

    public VirtualKey(String keyIdentifier, String label, boolean nonJamo) {
        Validate.notEmpty(keyIdentifier, "Empty key identifier");
        this.keyIdentifier = keyIdentifier;
        this.label = StringUtils.isEmpty(label) ? keyIdentifier : label;
        this.nonJamo = nonJamo;
    }

    public static VirtualKey nonJamo(String keyIdentifier) {
        return new VirtualKey(keyIdentifier, null, true);
    }

    public String keyIdentifier() {
        return keyIdentifier;
    }

    public String label() {
        return label;
    }

    public boolean isNonJamo() {
        return nonJamo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VirtualKey)) return false;
        VirtualKey that = (VirtualKey) o;
        return nonJamo == that.nonJamo && keyIdentifier.equals(that.keyIdentifier) && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyIdentifier, label, nonJamo);
    }

    @Override
    public String toString() {
        return nonJamo ? "VirtualKey{" + keyIdentifier + ", non-jamo}" : "VirtualKey{" + keyIdentifier + "}";
    }
}
