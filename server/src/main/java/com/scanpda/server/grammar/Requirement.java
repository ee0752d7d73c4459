package com.scanpda.server.grammar;

import java.util.Locale;

/**
 * How strictly an occurrence inside an alternative has to be performed.
 */
public enum Requirement {
    /** Must be seen for the grammar to accept. */
    REQUIRED,
    /** May be passed over without affecting acceptance, but passing over it is reported. */
    EXPECTED,
    /** May be passed over silently. */
    OPTIONAL;

    public boolean isSkippable() {
        return this != REQUIRED;
    }

    public boolean isMandatory() {
        return this != OPTIONAL;
    }

    public static Requirement parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return REQUIRED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedGrammarException("Unknown requirement '" + value + "'", e);
        }
    }
}
