package com.scanpda.server.grammar;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A grammar symbol. Either a {@link Terminal} (an AOI label) or a
 * {@link Nonterminal} (a clinical task). Two symbols are equal when they have
 * the same kind and the same label.
 */
public abstract class Symbol {

    private final String label;

    Symbol(String label) {
        if (label == null || label.trim().isEmpty()) {
            throw new IllegalArgumentException("Symbol label must not be empty");
        }
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public abstract boolean isTerminal();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return label.equals(((Symbol) o).label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), label);
    }

    @Override
    public String toString() {
        return label;
    }
}
