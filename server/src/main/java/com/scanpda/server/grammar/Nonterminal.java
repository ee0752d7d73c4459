package com.scanpda.server.grammar;

/**
 * Named clinical task category, e.g. RhythmCheck or Morphology.
 */
public final class Nonterminal extends Symbol {

    public Nonterminal(String label) {
        super(label);
    }

    @Override
    public boolean isTerminal() {
        return false;
    }
}
