package com.shkim.jamoime.ime;

import java.util.Map;

import org.apache.commons.lang.Validate;

import com.shkim.jamoime.core.InputProcessor;
import com.shkim.jamoime.core.VirtualKey;

/**
 * A {@link KoreanIme} built from a document, carrying the document's display name and identifier.
 */
public class ConfigurableKoreanIme extends KoreanIme {
    private final String name;
    private final String identifier;

    public ConfigurableKoreanIme(String name, String identifier, InputProcessor processor, Map<String, VirtualKey> layout) {
        super(processor, layout);
        Validate.notEmpty(name, "Empty name");
        Validate.notEmpty(identifier, "Empty identifier");
        this.name = name;
        this.identifier = identifier;
    }

    public String getName() {
        return name;
    }

    public String getIdentifier() {
        return identifier;
    }

    @Override
    public String toString() {
        return String.format("%s[%s]", name, identifier);
    }
}
