package com.scanpda.server.pda;

import com.scanpda.server.grammar.Alternative;
import com.scanpda.server.grammar.Grammar;
import com.scanpda.server.grammar.Nonterminal;
import com.scanpda.server.grammar.Requirement;
import com.scanpda.server.grammar.SymbolRef;
import com.scanpda.server.grammar.Terminal;
import com.scanpda.server.grammar.UnknownSymbolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic pushdown recognizer driven by a one-token-lookahead grammar.
 * Each input terminal triggers a bounded series of PUSH / SKIP / POP steps
 * followed by exactly one SHIFT, or a rejection. The automaton holds no run
 * state of its own, so one instance may serve concurrent runs.
 */
public class StackAutomaton {

    private static final Logger logger = LoggerFactory.getLogger(StackAutomaton.class);

    private final Grammar grammar;

    public StackAutomaton(Grammar grammar) {
        this.grammar = grammar;
    }

    public Grammar getGrammar() {
        return grammar;
    }

    /**
     * @throws UnknownSymbolException if a terminal is outside the grammar's
     *                                alphabet; nothing is run in that case
     */
    public RecognitionResult run(List<Terminal> input) {
        for (Terminal t : input) {
            if (!grammar.isTerminal(t.getLabel())) {
                throw new UnknownSymbolException(t.getLabel(), grammar.getName());
            }
        }
        RecognitionResult result = new Run(input).execute();
        logger.debug("Run over {} symbols: {}", input.size(), result.getVerdict());
        if (logger.isTraceEnabled()) {
            logger.trace("Derivation trace:{}{}", System.lineSeparator(), result.getTrace().render());
        }
        return result;
    }

    public RecognitionResult run(String... labels) {
        return run(grammar.scanpath(labels));
    }

    /**
     * Mutable configuration of a single run: the frame stack (bottom first)
     * and the trace being built.
     */
    private final class Run {
        private final List<Terminal> input;
        private final List<StackFrame> stack = new ArrayList<>();
        private final DerivationTrace trace = new DerivationTrace();

        Run(List<Terminal> input) {
            this.input = input;
        }

        RecognitionResult execute() {
            stack.add(new StackFrame(grammar.getStart()));

            for (int i = 0; i < input.size(); i++) {
                Rejection rejection = consume(i, input.get(i));
                if (rejection != null) {
                    trace.seal();
                    logger.debug("{}", rejection.getMessage());
                    return new RecognitionResult(input, Verdict.REJECTED, trace, snapshot(), rejection);
                }
            }

            closeSkippableFrames(input.size());
            trace.seal();
            Verdict verdict = stack.isEmpty() ? Verdict.ACCEPTED : Verdict.INCOMPLETE;
            return new RecognitionResult(input, verdict, trace, snapshot(), null);
        }

        private Rejection consume(int position, Terminal symbol) {
            while (true) {
                if (stack.isEmpty()) {
                    return new Rejection(position, symbol, null, Collections.emptySet());
                }
                StackFrame top = top();
                if (!top.isResolved()) {
                    int alternative = grammar.select(top.getNonterminal(), symbol);
                    if (alternative < 0) {
                        return reject(position, symbol);
                    }
                    top.resolve(grammar.getProduction(top.getNonterminal()).getAlternative(alternative));
                }
                if (top.isComplete()) {
                    pop(position);
                    continue;
                }

                SymbolRef expected = top.expected();
                if (expected.isTerminal()) {
                    if (!expected.getSymbol().equals(symbol)) {
                        return reject(position, symbol);
                    }
                    top.advanceSatisfied();
                    trace.record(position, symbol, Action.SHIFT, top.getNonterminal(), parentNonterminal(),
                            null, stack.size());
                    while (!stack.isEmpty() && top().isComplete()) {
                        pop(position);
                    }
                    return null;
                }

                Nonterminal child = (Nonterminal) expected.getSymbol();
                if (grammar.first(child).contains(symbol)) {
                    push(position, child, expected.getRequirement());
                } else if (expected.isSkippable()) {
                    skip(position, top);
                } else {
                    return reject(position, symbol);
                }
            }
        }

        /**
         * At end of input, close every frame that only has skippable
         * occurrences left. Unresolved frames stay open: no alternative
         * derives the empty sequence.
         */
        private void closeSkippableFrames(int end) {
            while (!stack.isEmpty()) {
                StackFrame top = top();
                if (!top.isResolved()) {
                    return;
                }
                if (top.isComplete()) {
                    pop(end);
                } else if (top.getAlternative().isSkippableFrom(top.getPosition())) {
                    skip(end, top);
                } else {
                    return;
                }
            }
        }

        private void push(int position, Nonterminal child, Requirement requirement) {
            Nonterminal parent = top().getNonterminal();
            stack.add(new StackFrame(child));
            trace.record(position, null, Action.PUSH, child, parent, requirement, stack.size());
        }

        private void pop(int position) {
            StackFrame closed = stack.remove(stack.size() - 1);
            Nonterminal parent = null;
            if (!stack.isEmpty()) {
                StackFrame below = top();
                below.advanceSatisfied();
                parent = below.getNonterminal();
            }
            trace.record(position, null, Action.POP, closed.getNonterminal(), parent, null, stack.size());
        }

        private void skip(int position, StackFrame frame) {
            SymbolRef skipped = frame.expected();
            frame.advanceSkipped();
            trace.record(position, null, Action.SKIP, (Nonterminal) skipped.getSymbol(), frame.getNonterminal(),
                    skipped.getRequirement(), stack.size());
        }

        private Rejection reject(int position, Terminal symbol) {
            return new Rejection(position, symbol, top().getNonterminal(), expectedTerminals());
        }

        /**
         * Terminals that could be shifted next from the current configuration.
         */
        private Set<Terminal> expectedTerminals() {
            Set<Terminal> out = new LinkedHashSet<>();
            for (int d = stack.size() - 1; d >= 0; d--) {
                StackFrame frame = stack.get(d);
                if (!frame.isResolved()) {
                    out.addAll(grammar.first(frame.getNonterminal()));
                    return out;
                }
                Alternative alt = frame.getAlternative();
                // below the top, the current position is the child still open above
                int from = d == stack.size() - 1 ? frame.getPosition() : frame.getPosition() + 1;
                for (int k = from; k < alt.size(); k++) {
                    out.addAll(grammar.first(alt.get(k)));
                    if (!alt.get(k).isSkippable()) {
                        return out;
                    }
                }
            }
            return out;
        }

        private StackFrame top() {
            return stack.get(stack.size() - 1);
        }

        private Nonterminal parentNonterminal() {
            return stack.size() > 1 ? stack.get(stack.size() - 2).getNonterminal() : null;
        }

        private List<StackFrame> snapshot() {
            List<StackFrame> copy = new ArrayList<>(stack.size());
            for (StackFrame frame : stack) {
                copy.add(frame.copy());
            }
            return copy;
        }
    }
}
