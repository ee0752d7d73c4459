package com.scanpda.server.grammar;

import java.util.Objects;

/**
 * One occurrence of a symbol inside an alternative, with its requirement tag.
 */
public final class SymbolRef {

    private final Symbol symbol;
    private final Requirement requirement;

    public SymbolRef(Symbol symbol, Requirement requirement) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.requirement = Objects.requireNonNull(requirement, "requirement");
    }

    public static SymbolRef required(Symbol symbol) {
        return new SymbolRef(symbol, Requirement.REQUIRED);
    }

    public static SymbolRef expected(Nonterminal symbol) {
        return new SymbolRef(symbol, Requirement.EXPECTED);
    }

    public static SymbolRef optional(Nonterminal symbol) {
        return new SymbolRef(symbol, Requirement.OPTIONAL);
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public Requirement getRequirement() {
        return requirement;
    }

    public boolean isTerminal() {
        return symbol.isTerminal();
    }

    public boolean isSkippable() {
        return requirement.isSkippable();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolRef)) {
            return false;
        }
        SymbolRef other = (SymbolRef) o;
        return symbol.equals(other.symbol) && requirement == other.requirement;
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, requirement);
    }

    @Override
    public String toString() {
        switch (requirement) {
            case OPTIONAL:
                return "[" + symbol + "]";
            case EXPECTED:
                return symbol + "!";
            default:
                return symbol.toString();
        }
    }
}
