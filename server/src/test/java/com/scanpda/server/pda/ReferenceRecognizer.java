package com.scanpda.server.pda;

import com.scanpda.server.grammar.Alternative;
import com.scanpda.server.grammar.Grammar;
import com.scanpda.server.grammar.Nonterminal;
import com.scanpda.server.grammar.SymbolRef;
import com.scanpda.server.grammar.Terminal;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exhaustive backtracking recognizer used as an oracle in tests. Only for
 * small, non left-recursive grammars and short inputs.
 */
class ReferenceRecognizer {

    private final Grammar grammar;

    ReferenceRecognizer(Grammar grammar) {
        this.grammar = grammar;
    }

    boolean accepts(List<Terminal> input) {
        return derive(grammar.getStart(), 0, input).contains(input.size());
    }

    private Set<Integer> derive(Nonterminal nt, int pos, List<Terminal> input) {
        Set<Integer> ends = new HashSet<>();
        for (Alternative alt : grammar.getProduction(nt).getAlternatives()) {
            ends.addAll(sequence(alt.getElements(), 0, pos, input));
        }
        return ends;
    }

    private Set<Integer> sequence(List<SymbolRef> elements, int k, int pos, List<Terminal> input) {
        Set<Integer> ends = new HashSet<>();
        if (k == elements.size()) {
            ends.add(pos);
            return ends;
        }
        SymbolRef ref = elements.get(k);
        if (ref.isSkippable()) {
            ends.addAll(sequence(elements, k + 1, pos, input));
        }
        if (ref.isTerminal()) {
            if (pos < input.size() && input.get(pos).equals(ref.getSymbol())) {
                ends.addAll(sequence(elements, k + 1, pos + 1, input));
            }
        } else if (pos < input.size()) {
            for (int end : derive((Nonterminal) ref.getSymbol(), pos, input)) {
                ends.addAll(sequence(elements, k + 1, end, input));
            }
        }
        return ends;
    }
}
