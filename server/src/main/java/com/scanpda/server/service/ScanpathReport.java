package com.scanpda.server.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scanpda.server.grammar.Terminal;
import com.scanpda.server.pda.DerivationTrace;
import com.scanpda.server.pda.Rejection;
import com.scanpda.server.pda.StackFrame;
import com.scanpda.server.pda.Verdict;
import com.scanpda.server.pda.diagnosis.MissingStep;

import java.util.List;

/**
 * Everything the reporting side needs about one scanpath.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanpathReport {
    private final String grammar;
    private final List<Terminal> input;
    private final Verdict verdict;
    private final Rejection rejection;
    private final DerivationTrace trace;
    private final List<StackFrame> residualStack;
    private final List<Terminal> completion;
    private final List<Terminal> completedSequence;
    private final Boolean completionVerified;
    private final List<MissingStep> missingSteps;

    public ScanpathReport(String grammar, List<Terminal> input, Verdict verdict, Rejection rejection, DerivationTrace trace,
            List<StackFrame> residualStack, List<Terminal> completion, List<Terminal> completedSequence,
            Boolean completionVerified, List<MissingStep> missingSteps) {
        this.grammar = grammar;
        this.input = input;
        this.verdict = verdict;
        this.rejection = rejection;
        this.trace = trace;
        this.residualStack = residualStack;
        this.completion = completion;
        this.completedSequence = completedSequence;
        this.completionVerified = completionVerified;
        this.missingSteps = missingSteps;
    }

    /** Name of the grammar the scanpath was checked against. */
    public String getGrammar() {
        return grammar;
    }

    public List<Terminal> getInput() {
        return input;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public Rejection getRejection() {
        return rejection;
    }

    public DerivationTrace getTrace() {
        return trace;
    }

    public List<StackFrame> getResidualStack() {
        return residualStack;
    }

    public List<Terminal> getCompletion() {
        return completion;
    }

    public List<Terminal> getCompletedSequence() {
        return completedSequence;
    }

    public Boolean getCompletionVerified() {
        return completionVerified;
    }

    public List<MissingStep> getMissingSteps() {
        return missingSteps;
    }

    @Override
    public String toString() {
        return "ScanpathReport{" +
                "verdict=" + verdict +
                ", input=" + input +
                (completion != null ? ", completion=" + completion : "") +
                ", missingSteps=" + missingSteps +
                '}';
    }
}
