package com.scanpda.server.grammar;

public class UnknownSymbolException extends IllegalArgumentException {

    private final String label;

    public UnknownSymbolException(String label, String grammarName) {
        super("Symbol '" + label + "' is not part of the alphabet of grammar '" + grammarName + "'");
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
