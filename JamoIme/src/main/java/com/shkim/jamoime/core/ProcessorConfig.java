package com.shkim.jamoime.core;

import java.util.Objects;

/**
 * Immutable processor configuration.
 * Defaults: sequential order, syllable and character commit, no commit on category switch,
 * multi-syllable display and no standalone cluster support.
 */
public final class ProcessorConfig {
    private OrderMode orderMode = OrderMode.SEQUENTIAL;
    private JamoCommitPolicy jamoCommitPolicy = JamoCommitPolicy.SYLLABLE;
    private NonJamoCommitPolicy nonJamoCommitPolicy = NonJamoCommitPolicy.CHARACTER;
    private TransitionCommitPolicy transitionCommitPolicy = TransitionCommitPolicy.NEVER;
    private DisplayMode displayMode = DisplayMode.MODERN_MULTIPLE;
    private boolean supportStandaloneCluster;

    public static final ProcessorConfig DEFAULT = new Builder().build();

    public OrderMode orderMode() {
        return orderMode;
    }

    public JamoCommitPolicy jamoCommitPolicy() {
        return jamoCommitPolicy;
    }

    public NonJamoCommitPolicy nonJamoCommitPolicy() {
        return nonJamoCommitPolicy;
    }

    public TransitionCommitPolicy transitionCommitPolicy() {
        return transitionCommitPolicy;
    }

    public DisplayMode displayMode() {
        return displayMode;
    }

    public boolean supportStandaloneCluster() {
        return supportStandaloneCluster;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProcessorConfig)) return false;
        ProcessorConfig that = (ProcessorConfig) o;
        return supportStandaloneCluster == that.supportStandaloneCluster
                && orderMode == that.orderMode
                && jamoCommitPolicy == that.jamoCommitPolicy
                && nonJamoCommitPolicy == that.nonJamoCommitPolicy
                && transitionCommitPolicy == that.transitionCommitPolicy
                && displayMode == that.displayMode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderMode, jamoCommitPolicy, nonJamoCommitPolicy, transitionCommitPolicy, displayMode, supportStandaloneCluster);
    }

    @Override
    public String toString() {
        return String.format("{orderMode=%s, jamoCommitPolicy=%s, nonJamoCommitPolicy=%s, transitionCommitPolicy=%s" +
                        ", displayMode=%s, supportStandaloneCluster=%s}",
                orderMode.getName(), jamoCommitPolicy.getName(), nonJamoCommitPolicy.getName(), transitionCommitPolicy.getName(),
                displayMode.getName(), supportStandaloneCluster);
    }

    /**
     * The Class-Builder to make new {@link ProcessorConfig} object.
     * Must be the only way to achieve new instance.
     */
    public static class Builder {
        private final ProcessorConfig _config = new ProcessorConfig();

        public Builder copy(ProcessorConfig other) {
            return setOrderMode(other.orderMode)
                    .setJamoCommitPolicy(other.jamoCommitPolicy)
                    .setNonJamoCommitPolicy(other.nonJamoCommitPolicy)
                    .setTransitionCommitPolicy(other.transitionCommitPolicy)
                    .setDisplayMode(other.displayMode)
                    .setSupportStandaloneCluster(other.supportStandaloneCluster);
        }

        public Builder setOrderMode(OrderMode mode) {
            _config.orderMode = Objects.requireNonNull(mode, "Null order mode");
            return this;
        }

        public Builder setJamoCommitPolicy(JamoCommitPolicy policy) {
            _config.jamoCommitPolicy = Objects.requireNonNull(policy, "Null jamo commit policy");
            return this;
        }

        public Builder setNonJamoCommitPolicy(NonJamoCommitPolicy policy) {
            _config.nonJamoCommitPolicy = Objects.requireNonNull(policy, "Null non-jamo commit policy");
            return this;
        }

        public Builder setTransitionCommitPolicy(TransitionCommitPolicy policy) {
            _config.transitionCommitPolicy = Objects.requireNonNull(policy, "Null transition commit policy");
            return this;
        }

        public Builder setDisplayMode(DisplayMode mode) {
            _config.displayMode = Objects.requireNonNull(mode, "Null display mode");
            return this;
        }

        public Builder setSupportStandaloneCluster(boolean support) {
            _config.supportStandaloneCluster = support;
            return this;
        }

        public ProcessorConfig build() {
            ProcessorConfig res = new ProcessorConfig();
            res.orderMode = _config.orderMode;
            res.jamoCommitPolicy = _config.jamoCommitPolicy;
            res.nonJamoCommitPolicy = _config.nonJamoCommitPolicy;
            res.transitionCommitPolicy = _config.transitionCommitPolicy;
            res.displayMode = _config.displayMode;
            res.supportStandaloneCluster = _config.supportStandaloneCluster;
            return res;
        }
    }
}
