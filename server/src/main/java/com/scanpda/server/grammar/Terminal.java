package com.scanpda.server.grammar;

/**
 * Region-of-interest label, one per fixation.
 */
public final class Terminal extends Symbol {

    public Terminal(String label) {
        super(label);
    }

    @Override
    public boolean isTerminal() {
        return true;
    }
}
