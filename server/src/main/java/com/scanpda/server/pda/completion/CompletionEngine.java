package com.scanpda.server.pda.completion;

import com.scanpda.server.grammar.Alternative;
import com.scanpda.server.grammar.Grammar;
import com.scanpda.server.grammar.Nonterminal;
import com.scanpda.server.grammar.SymbolRef;
import com.scanpda.server.grammar.Terminal;
import com.scanpda.server.pda.RecognitionResult;
import com.scanpda.server.pda.StackAutomaton;
import com.scanpda.server.pda.StackFrame;
import com.scanpda.server.pda.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Synthesizes the continuation that closes every open frame of an incomplete
 * run.
 * <p>
 * Policy: each open frame is finished along the alternative it already chose
 * (the first-declared one if still unresolved); every nonterminal still to be
 * produced is expanded along its first-declared alternative; skippable
 * occurrences (EXPECTED and OPTIONAL) are left out. The result is therefore
 * the shortest continuation under first-alternative expansion. Missed
 * EXPECTED steps are reported by the diagnoser instead.
 */
public class CompletionEngine {

    private static final Logger logger = LoggerFactory.getLogger(CompletionEngine.class);

    private final StackAutomaton automaton;
    private final Grammar grammar;

    public CompletionEngine(StackAutomaton automaton) {
        this.automaton = automaton;
        this.grammar = automaton.getGrammar();
    }

    /**
     * @param residualStack open frames, bottom first, as returned by
     *                      {@link RecognitionResult#getResidualStack()}
     * @return terminals to append, empty when the stack is empty
     */
    public List<Terminal> complete(List<StackFrame> residualStack) {
        List<Terminal> out = new ArrayList<>();
        int top = residualStack.size() - 1;
        for (int d = top; d >= 0; d--) {
            StackFrame frame = residualStack.get(d);
            Alternative alt = frame.effectiveAlternative(grammar);
            int from = frame.isResolved() ? frame.getPosition() : 0;
            if (d < top && frame.isResolved()) {
                // the element at the current position is the frame closed just above
                from++;
            }
            for (int k = from; k < alt.size(); k++) {
                SymbolRef ref = alt.get(k);
                if (ref.isSkippable()) {
                    continue;
                }
                if (ref.isTerminal()) {
                    out.add((Terminal) ref.getSymbol());
                } else {
                    out.addAll(grammar.canonicalYield((Nonterminal) ref.getSymbol()));
                }
            }
        }
        return Collections.unmodifiableList(out);
    }

    public List<Terminal> complete(RecognitionResult result) {
        if (result.getVerdict() == Verdict.REJECTED) {
            throw new IllegalArgumentException("A rejected scanpath cannot be completed: "
                    + result.getRejection().getMessage());
        }
        return complete(result.getResidualStack());
    }

    /**
     * Completes the run and re-runs {@code input ++ completion} from scratch
     * to confirm it is accepted.
     */
    public Completion completeAndVerify(RecognitionResult result) {
        List<Terminal> suffix = complete(result);
        List<Terminal> full = new ArrayList<>(result.getInput());
        full.addAll(suffix);
        boolean verified = suffix.isEmpty() ? result.isAccepted() : automaton.run(full).isAccepted();
        if (!verified) {
            logger.warn("Completion {} of {} was not accepted on re-run", suffix, result.getInput());
        } else {
            logger.debug("Completion {} verified for input of {} symbols", suffix, result.getInput().size());
        }
        return new Completion(suffix, full, verified);
    }
}
