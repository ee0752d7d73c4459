package com.scanpda.server.pda.diagnosis;

import com.scanpda.server.grammar.Nonterminal;

/**
 * A mandatory sub-task that was not performed.
 */
public class MissingStep {

    private final Nonterminal parent;
    private final Nonterminal child;
    private final String childLabel;
    private final int inputPosition;
    private final int traceIndex;
    private final int depth;
    private final boolean openAtEnd;

    public MissingStep(Nonterminal parent, Nonterminal child, String childLabel, int inputPosition, int traceIndex,
            int depth, boolean openAtEnd) {
        this.parent = parent;
        this.child = child;
        this.childLabel = childLabel;
        this.inputPosition = inputPosition;
        this.traceIndex = traceIndex;
        this.depth = depth;
        this.openAtEnd = openAtEnd;
    }

    public Nonterminal getParent() {
        return parent;
    }

    public Nonterminal getChild() {
        return child;
    }

    public String getChildLabel() {
        return childLabel;
    }

    /** Input position where the omission was detected. */
    public int getInputPosition() {
        return inputPosition;
    }

    /**
     * Trace index of the POP that closed the parent, or the trace size when the
     * parent was still open at end of input.
     */
    public int getTraceIndex() {
        return traceIndex;
    }

    /** Stack depth of the parent frame. */
    public int getDepth() {
        return depth;
    }

    public boolean isOpenAtEnd() {
        return openAtEnd;
    }

    public String getMessage() {
        return "missing " + childLabel + " in " + parent;
    }

    @Override
    public String toString() {
        return "MissingMandatoryStep{" + parent + " -> " + child + " @" + inputPosition
                + (openAtEnd ? " (open at end)" : "") + "}";
    }
}
