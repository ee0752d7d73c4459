package com.scanpda.server.pda;

import com.scanpda.server.grammar.Terminal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one automaton run. Callers inspect {@link #getVerdict()}:
 * <ul>
 * <li>ACCEPTED: empty residual stack, no rejection.</li>
 * <li>INCOMPLETE: {@link #getResidualStack()} holds the open frames, bottom first.</li>
 * <li>REJECTED: {@link #getRejection()} says where and why.</li>
 * </ul>
 */
public class RecognitionResult {

    private final List<Terminal> input;
    private final Verdict verdict;
    private final DerivationTrace trace;
    private final List<StackFrame> residualStack;
    private final Rejection rejection;

    RecognitionResult(List<Terminal> input, Verdict verdict, DerivationTrace trace, List<StackFrame> residualStack,
            Rejection rejection) {
        this.input = Collections.unmodifiableList(new ArrayList<>(input));
        this.verdict = verdict;
        this.trace = trace;
        this.residualStack = Collections.unmodifiableList(residualStack);
        this.rejection = rejection;
    }

    public List<Terminal> getInput() {
        return input;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public DerivationTrace getTrace() {
        return trace;
    }

    public List<StackFrame> getResidualStack() {
        return residualStack;
    }

    public Rejection getRejection() {
        return rejection;
    }

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPTED;
    }

    @Override
    public String toString() {
        return "RecognitionResult{" +
                "verdict=" + verdict +
                ", inputLength=" + input.size() +
                ", traceSize=" + trace.size() +
                ", residualStack=" + residualStack +
                (rejection != null ? ", rejection=" + rejection : "") +
                '}';
    }
}
