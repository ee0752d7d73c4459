package com.scanpda.server.pda;

import com.scanpda.server.grammar.Nonterminal;
import com.scanpda.server.grammar.Terminal;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Why a run stopped: the terminal at {@code position} cannot continue the
 * open task {@code nonterminal}. A null nonterminal means the start task had
 * already closed and the input kept going.
 */
public class Rejection {

    private final int position;
    private final Terminal symbol;
    private final Nonterminal nonterminal;
    private final Set<Terminal> expected;

    public Rejection(int position, Terminal symbol, Nonterminal nonterminal, Set<Terminal> expected) {
        this.position = position;
        this.symbol = symbol;
        this.nonterminal = nonterminal;
        this.expected = Collections.unmodifiableSet(new LinkedHashSet<>(expected));
    }

    public int getPosition() {
        return position;
    }

    public Terminal getSymbol() {
        return symbol;
    }

    public Nonterminal getNonterminal() {
        return nonterminal;
    }

    public Set<Terminal> getExpected() {
        return expected;
    }

    public String getMessage() {
        if (nonterminal == null) {
            return "Unexpected symbol '" + symbol + "' at position " + position + ": examination already complete";
        }
        return "Unexpected symbol '" + symbol + "' at position " + position + " in " + nonterminal
                + ", expected one of " + expected;
    }

    @Override
    public String toString() {
        return "UnexpectedSymbol{" + getMessage() + "}";
    }
}
