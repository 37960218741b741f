package com.shkim.jamoime.config;

import java.util.List;
import java.util.Map;

import com.shkim.jamoime.core.DisplayMode;
import com.shkim.jamoime.core.JamoCommitPolicy;
import com.shkim.jamoime.core.NonJamoCommitPolicy;
import com.shkim.jamoime.core.OrderMode;
import com.shkim.jamoime.core.ProcessorConfig;
import com.shkim.jamoime.core.TransitionCommitPolicy;

/**
 * JSON model of an IME document, filled by Gson.
 * <pre>{@code
 * {
 *   "name": "...", "identifier": "...",
 *   "config": {"orderMode": "sequential", "jamoCommitPolicy": "syllable", ...},
 *   "layout": {"r": {"identifier": "ㄱ", "label": "ㄱ", "isNonJamo": false}, ...},
 *   "automata": {
 *     "choseong": {"transitions": [{"from": "", "input": "ㄱ", "to": "ㄱ"}], "display": {"ㄱ": "ᄀ"}},
 *     "jungseong": {...}, "jongseong": {...},
 *     "dokkaebibul": {"vowelTriggered": [...], "consonantTriggered": [...]},
 *     "backspace": {"transitions": [{"from": "ㄳ", "to": "ㄱ"}]},
 *     "nonJamo": {...}
 *   }
 * }
 * }</pre>
 */
public class ImeDocument {
    public String name;
    public String identifier;
    public Config config;
    public Map<String, Key> layout;
    public Automata automata;

    public static class Config {
        public String orderMode;
        public String jamoCommitPolicy;
        public String nonJamoCommitPolicy;
        public String transitionCommitPolicy;
        public String displayMode;
        public boolean supportStandaloneCluster;

        /**
         * Converts the string values into a {@link ProcessorConfig}.
         * Missing values keep the defaults of {@link ProcessorConfig.Builder}.
         *
         * @return {@link ProcessorConfig}
         * @throws ConfigurationException if any value is not a known name
         */
        public ProcessorConfig toProcessorConfig() throws ConfigurationException {
            ProcessorConfig.Builder res = new ProcessorConfig.Builder();
            try {
                if (orderMode != null) res.setOrderMode(OrderMode.fromName(orderMode));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(ConfigurationException.Kind.INVALID_ORDER_MODE,
                        "Expected sequential or freeOrder, got '" + orderMode + "'", e);
            }
            try {
                if (jamoCommitPolicy != null) res.setJamoCommitPolicy(JamoCommitPolicy.fromName(jamoCommitPolicy));
                if (nonJamoCommitPolicy != null) res.setNonJamoCommitPolicy(NonJamoCommitPolicy.fromName(nonJamoCommitPolicy));
                if (transitionCommitPolicy != null) res.setTransitionCommitPolicy(TransitionCommitPolicy.fromName(transitionCommitPolicy));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(ConfigurationException.Kind.INVALID_COMMIT_POLICY, e.getMessage(), e);
            }
            try {
                if (displayMode != null) res.setDisplayMode(DisplayMode.fromName(displayMode));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(ConfigurationException.Kind.INVALID_DISPLAY_MODE,
                        "Expected archaic, modernMultiple or modernPartial, got '" + displayMode + "'", e);
            }
            return res.setSupportStandaloneCluster(supportStandaloneCluster).build();
        }
    }

    public static class Key {
        public String identifier;
        public String label;
        public boolean isNonJamo;
    }

    public static class Automata {
        public AutomatonSection choseong;
        public AutomatonSection jungseong;
        public AutomatonSection jongseong;
        public DokkaebiSection dokkaebibul;
        public BackspaceSection backspace;
        public AutomatonSection nonJamo;
    }

    public static class AutomatonSection {
        public List<TransitionEntry> transitions;
        public Map<String, String> display;
    }

    public static class TransitionEntry {
        public String from;
        public String input;
        public String to;
        public String switchTo;
    }

    public static class DokkaebiSection {
        public List<DokkaebiEntry> vowelTriggered;
        public List<DokkaebiEntry> consonantTriggered;
    }

    public static class DokkaebiEntry {
        public String jongseong;
        /**
         * The key that forces the split, consonant-triggered rules only.
         */
        public String input;
        public String remaining;
        public String moved;
    }

    public static class BackspaceSection {
        public List<BackspaceEntry> transitions;
    }

    public static class BackspaceEntry {
        public String from;
        public String to;
    }
}
