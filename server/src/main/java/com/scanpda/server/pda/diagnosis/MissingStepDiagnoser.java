package com.scanpda.server.pda.diagnosis;

import com.scanpda.server.grammar.Alternative;
import com.scanpda.server.grammar.Grammar;
import com.scanpda.server.grammar.Nonterminal;
import com.scanpda.server.grammar.Requirement;
import com.scanpda.server.grammar.SymbolRef;
import com.scanpda.server.pda.DerivationTrace;
import com.scanpda.server.pda.RecognitionResult;
import com.scanpda.server.pda.StackFrame;
import com.scanpda.server.pda.TraceEntry;
import com.scanpda.server.pda.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Names the mandatory sub-tasks a scanpath left out. Read-only over the run
 * result.
 * <ul>
 * <li>An EXPECTED occurrence passed over (SKIP) is reported where its parent
 * closed (POP).</li>
 * <li>For an incomplete run, EXPECTED occurrences passed over in frames that
 * are still open, and every mandatory nonterminal occurrence a residual frame
 * has not started yet, are reported at end of input, innermost frame
 * first.</li>
 * </ul>
 */
public class MissingStepDiagnoser {

    private static final Logger logger = LoggerFactory.getLogger(MissingStepDiagnoser.class);

    private final Grammar grammar;

    public MissingStepDiagnoser(Grammar grammar) {
        this.grammar = grammar;
    }

    public List<MissingStep> diagnose(RecognitionResult result) {
        List<MissingStep> out = new ArrayList<>();
        DerivationTrace trace = result.getTrace();

        // EXPECTED skips per owning frame depth
        Map<Integer, List<TraceEntry>> pending = new HashMap<>();
        for (TraceEntry entry : trace.getEntries()) {
            switch (entry.getAction()) {
                case SKIP:
                    if (entry.getRequirement() == Requirement.EXPECTED) {
                        pending.computeIfAbsent(entry.getDepth(), d -> new ArrayList<>()).add(entry);
                    }
                    break;
                case PUSH:
                    pending.remove(entry.getDepth());
                    break;
                case POP:
                    List<TraceEntry> skipped = pending.remove(entry.getDepth() + 1);
                    if (skipped != null) {
                        for (TraceEntry s : skipped) {
                            out.add(missing(s.getParent(), s.getNonterminal(), entry.getInputPosition(),
                                    entry.getIndex(), entry.getDepth() + 1, false));
                        }
                    }
                    break;
                default:
                    break;
            }
        }

        if (result.getVerdict() == Verdict.INCOMPLETE) {
            int end = result.getInput().size();
            List<StackFrame> stack = result.getResidualStack();
            int top = stack.size() - 1;
            for (int d = top; d >= 0; d--) {
                StackFrame frame = stack.get(d);
                List<TraceEntry> skipped = pending.remove(d + 1);
                if (skipped != null) {
                    for (TraceEntry s : skipped) {
                        out.add(missing(s.getParent(), s.getNonterminal(), end, trace.size(), d + 1, true));
                    }
                }
                Alternative alt = frame.effectiveAlternative(grammar);
                int from = frame.isResolved() ? frame.getPosition() : 0;
                if (d < top && frame.isResolved()) {
                    from++;
                }
                for (int k = from; k < alt.size(); k++) {
                    SymbolRef ref = alt.get(k);
                    if (!ref.isTerminal() && ref.getRequirement().isMandatory()) {
                        out.add(missing(frame.getNonterminal(), (Nonterminal) ref.getSymbol(), end, trace.size(),
                                d + 1, true));
                    }
                }
            }
        }

        if (!out.isEmpty()) {
            logger.debug("Diagnosed {} missing steps: {}", out.size(), out);
        }
        return out;
    }

    private MissingStep missing(Nonterminal parent, Nonterminal child, int inputPosition, int traceIndex, int depth,
            boolean openAtEnd) {
        String label = grammar.getProduction(child).getLabel();
        return new MissingStep(parent, child, label, inputPosition, traceIndex, depth, openAtEnd);
    }
}
