package com.scanpda.server.pda;

import com.scanpda.server.grammar.Alternative;
import com.scanpda.server.grammar.Grammar;
import com.scanpda.server.grammar.Nonterminal;
import com.scanpda.server.grammar.SymbolRef;

import java.util.BitSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One open, not yet completed nonterminal instance. Owned by a single run.
 */
public class StackFrame {

    public static final int UNRESOLVED = -1;

    private final Nonterminal nonterminal;
    private Alternative alternative;
    private int position;
    private final BitSet satisfied;

    public StackFrame(Nonterminal nonterminal) {
        this.nonterminal = nonterminal;
        this.satisfied = new BitSet();
    }

    private StackFrame(StackFrame other) {
        this.nonterminal = other.nonterminal;
        this.alternative = other.alternative;
        this.position = other.position;
        this.satisfied = (BitSet) other.satisfied.clone();
    }

    public Nonterminal getNonterminal() {
        return nonterminal;
    }

    public boolean isResolved() {
        return alternative != null;
    }

    public int getAlternativeIndex() {
        return alternative != null ? alternative.getIndex() : UNRESOLVED;
    }

    public Alternative getAlternative() {
        return alternative;
    }

    /**
     * The chosen alternative, or the canonical one while unresolved.
     */
    public Alternative effectiveAlternative(Grammar grammar) {
        return alternative != null ? alternative : grammar.getProduction(nonterminal).getCanonicalAlternative();
    }

    public int getPosition() {
        return position;
    }

    public boolean isSatisfied(int index) {
        return satisfied.get(index);
    }

    public List<Integer> getSatisfiedPositions() {
        return satisfied.stream().boxed().collect(Collectors.toList());
    }

    public boolean isComplete() {
        return alternative != null && position >= alternative.size();
    }

    public SymbolRef expected() {
        return alternative.get(position);
    }

    void resolve(Alternative chosen) {
        if (alternative != null) {
            throw new IllegalStateException("Frame for " + nonterminal + " already resolved");
        }
        this.alternative = chosen;
    }

    void advanceSatisfied() {
        satisfied.set(position);
        position++;
    }

    void advanceSkipped() {
        position++;
    }

    StackFrame copy() {
        return new StackFrame(this);
    }

    @Override
    public String toString() {
        if (alternative == null) {
            return nonterminal + "[?]";
        }
        StringBuilder sb = new StringBuilder(nonterminal.getLabel()).append(" -> ");
        for (int i = 0; i < alternative.size(); i++) {
            if (i == position) {
                sb.append(". ");
            }
            sb.append(alternative.get(i)).append(' ');
        }
        if (position >= alternative.size()) {
            sb.append('.');
        }
        return sb.toString().trim();
    }
}
