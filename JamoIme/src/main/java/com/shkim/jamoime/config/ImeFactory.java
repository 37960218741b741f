package com.shkim.jamoime.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shkim.jamoime.automaton.Automaton;
import com.shkim.jamoime.automaton.BackspaceAutomaton;
import com.shkim.jamoime.automaton.DokkaebiAutomaton;
import com.shkim.jamoime.core.InputProcessor;
import com.shkim.jamoime.core.ProcessorConfig;
import com.shkim.jamoime.core.VirtualKey;
import com.shkim.jamoime.ime.ConfigurableKoreanIme;

/**
 * Builds {@link ConfigurableKoreanIme}s from {@link ImeDocument}s.
 * The choseong, jungseong and jongseong sections are mandatory, the others optional.
 */
public final class ImeFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImeFactory.class);

    private ImeFactory() {
    }

    public static ConfigurableKoreanIme create(ImeDocument document) throws ConfigurationException {
        Objects.requireNonNull(document, "Null document");
        if (document.config == null || document.layout == null || document.automata == null) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT,
                    "Document '" + document.identifier + "' lacks config, layout or automata");
        }
        ProcessorConfig config = document.config.toProcessorConfig();
        ImeDocument.Automata automata = document.automata;
        InputProcessor processor;
        try {
            processor = InputProcessor.builder()
                    .setLead(buildAutomaton(automata.choseong, "choseong", true))
                    .setVowel(buildAutomaton(automata.jungseong, "jungseong", true))
                    .setTrail(buildAutomaton(automata.jongseong, "jongseong", true))
                    .setNonJamo(buildAutomaton(automata.nonJamo, "nonJamo", false))
                    .setDokkaebi(buildDokkaebi(automata.dokkaebibul))
                    .setBackspace(buildBackspace(automata.backspace))
                    .setConfig(config)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT,
                    "Broken automata in '" + document.identifier + "': " + e.getMessage(), e);
        }
        ConfigurableKoreanIme res = new ConfigurableKoreanIme(document.name, document.identifier, processor, buildLayout(document.layout));
        LOGGER.info("Created IME '{}' ({}) with {} keys, config {}", res.getName(), res.getIdentifier(), res.getLayout().size(), config);
        return res;
    }

    public static ConfigurableKoreanIme createFromFile(Path file) throws ConfigurationException {
        return create(ConfigurationLoader.load(file));
    }

    public static ConfigurableKoreanIme createFromResource(String resource) throws ConfigurationException {
        return create(ConfigurationLoader.loadResource(resource));
    }

    public static ConfigurableKoreanIme createFromPreset(Preset preset) throws ConfigurationException {
        return create(ConfigurationLoader.loadPreset(preset));
    }

    private static Automaton buildAutomaton(ImeDocument.AutomatonSection section, String name, boolean required) {
        if (section == null) {
            if (required) {
                throw new ConfigurationException(ConfigurationException.Kind.MISSING_AUTOMATON, "No '" + name + "' automaton");
            }
            return null;
        }
        Automaton.Builder res = Automaton.builder();
        if (section.transitions != null) {
            for (ImeDocument.TransitionEntry t : section.transitions) {
                requireEntry(t, name);
                res.transition(StringUtils.defaultString(t.from), t.input, t.to, t.switchTo);
            }
        }
        if (section.display != null) {
            res.displays(section.display);
        }
        return res.build();
    }

    private static DokkaebiAutomaton buildDokkaebi(ImeDocument.DokkaebiSection section) {
        if (section == null) return null;
        DokkaebiAutomaton.Builder res = DokkaebiAutomaton.builder();
        if (section.vowelTriggered != null) {
            for (ImeDocument.DokkaebiEntry e : section.vowelTriggered) {
                requireEntry(e, "dokkaebibul.vowelTriggered");
                res.vowelTrigger(e.jongseong, e.remaining, e.moved);
            }
        }
        if (section.consonantTriggered != null) {
            for (ImeDocument.DokkaebiEntry e : section.consonantTriggered) {
                requireEntry(e, "dokkaebibul.consonantTriggered");
                res.consonantTrigger(e.jongseong, e.input, e.remaining, e.moved);
            }
        }
        return res.build();
    }

    private static BackspaceAutomaton buildBackspace(ImeDocument.BackspaceSection section) {
        if (section == null) return null;
        BackspaceAutomaton.Builder res = BackspaceAutomaton.builder();
        if (section.transitions != null) {
            for (ImeDocument.BackspaceEntry e : section.transitions) {
                requireEntry(e, "backspace");
                res.transition(e.from, e.to);
            }
        }
        return res.build();
    }

    private static void requireEntry(Object entry, String section) {
        if (entry == null) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, "Null entry in '" + section + "'");
        }
    }

    private static Map<String, VirtualKey> buildLayout(Map<String, ImeDocument.Key> layout) {
        Map<String, VirtualKey> res = new LinkedHashMap<>();
        layout.forEach((key, def) -> {
            if (def == null || StringUtils.isEmpty(def.identifier)) {
                throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, "Key '" + key + "' has no identifier");
            }
            res.put(key, new VirtualKey(def.identifier, def.label, def.isNonJamo));
        });
        return res;
    }
}
