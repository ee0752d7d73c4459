package com.scanpda.server.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * All alternatives of one nonterminal, in declaration order.
 */
public final class Production {

    private final Nonterminal nonterminal;
    private final String label;
    private final List<Alternative> alternatives;

    public Production(Nonterminal nonterminal, String label, List<Alternative> alternatives) {
        this.nonterminal = nonterminal;
        this.label = label;
        this.alternatives = Collections.unmodifiableList(new ArrayList<>(alternatives));
    }

    public Nonterminal getNonterminal() {
        return nonterminal;
    }

    /**
     * Human readable task name, e.g. "repolarization check". Falls back to the
     * nonterminal label.
     */
    public String getLabel() {
        return label != null ? label : nonterminal.getLabel();
    }

    public List<Alternative> getAlternatives() {
        return alternatives;
    }

    public Alternative getAlternative(int index) {
        return alternatives.get(index);
    }

    public Alternative getCanonicalAlternative() {
        return alternatives.get(0);
    }

    @Override
    public String toString() {
        return nonterminal + " -> "
                + alternatives.stream().map(Alternative::toString).collect(Collectors.joining(" | "));
    }
}
