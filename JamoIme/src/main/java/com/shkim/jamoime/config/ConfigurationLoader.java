package com.shkim.jamoime.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Reads {@link ImeDocument}s from JSON text, files, classpath resources and bundled {@link Preset}s.
 * Every failure is reported as {@link ConfigurationException}.
 */
public final class ConfigurationLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private ConfigurationLoader() {
    }

    public static ImeDocument load(String json) throws ConfigurationException {
        Objects.requireNonNull(json, "Null json");
        return load(new StringReader(json));
    }

    /**
     * Parses a document and checks that the mandatory top-level fields are present.
     *
     * @param reader {@link Reader}, not closed by this method
     * @return {@link ImeDocument}
     * @throws ConfigurationException {@link ConfigurationException.Kind#INVALID_DOCUMENT} on malformed input
     */
    public static ImeDocument load(Reader reader) throws ConfigurationException {
        Objects.requireNonNull(reader, "Null reader");
        ImeDocument res;
        try {
            res = GSON.fromJson(reader, ImeDocument.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, "Malformed IME document", e);
        }
        if (res == null) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, "Empty IME document");
        }
        requireField(res.name, "name");
        requireField(res.identifier, "identifier");
        requireField(res.config, "config");
        requireField(res.layout, "layout");
        requireField(res.automata, "automata");
        return res;
    }

    public static ImeDocument load(Path file) throws ConfigurationException {
        Objects.requireNonNull(file, "Null file");
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException(ConfigurationException.Kind.RESOURCE_NOT_FOUND, "No such file " + file);
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            ImeDocument res = load(reader);
            LOGGER.info("Loaded IME document '{}' from {}", res.identifier, file);
            return res;
        } catch (IOException e) {
            throw new ConfigurationException(ConfigurationException.Kind.RESOURCE_NOT_FOUND, "Can't read " + file, e);
        }
    }

    /**
     * @param resource String, absolute classpath location, e.g. {@code /ime/cheonjiin.json}
     * @return {@link ImeDocument}
     * @throws ConfigurationException {@link ConfigurationException.Kind#RESOURCE_NOT_FOUND} if there is no such resource
     */
    public static ImeDocument loadResource(String resource) throws ConfigurationException {
        Objects.requireNonNull(resource, "Null resource");
        InputStream in = ConfigurationLoader.class.getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigurationException(ConfigurationException.Kind.RESOURCE_NOT_FOUND, "No such resource " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            ImeDocument res = load(reader);
            LOGGER.info("Loaded IME document '{}' from resource {}", res.identifier, resource);
            return res;
        } catch (IOException e) {
            throw new ConfigurationException(ConfigurationException.Kind.RESOURCE_NOT_FOUND, "Can't read resource " + resource, e);
        }
    }

    public static ImeDocument loadPreset(Preset preset) throws ConfigurationException {
        return loadResource(Objects.requireNonNull(preset, "Null preset").getResource());
    }

    /**
     * Checks a document without building anything.
     *
     * @param document {@link ImeDocument}
     * @return true if name and identifier are set, the layout is not empty, every config value is known
     * and at least one automaton section exists
     */
    public static boolean validate(ImeDocument document) {
        if (document == null) return false;
        if (StringUtils.isEmpty(document.name) || StringUtils.isEmpty(document.identifier)) return false;
        if (document.layout == null || document.layout.isEmpty()) return false;
        if (document.config == null || document.automata == null) return false;
        try {
            document.config.toProcessorConfig();
        } catch (ConfigurationException e) {
            LOGGER.debug("Invalid config in '{}': {}", document.identifier, e.getMessage());
            return false;
        }
        ImeDocument.Automata automata = document.automata;
        return automata.choseong != null || automata.jungseong != null || automata.jongseong != null
                || automata.nonJamo != null || automata.dokkaebibul != null || automata.backspace != null;
    }

    private static void requireField(Object value, String field) {
        if (value == null || (value instanceof String && ((String) value).isEmpty())) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, "Missing field '" + field + "'");
        }
    }
}
