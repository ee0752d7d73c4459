package com.scanpda.server.pda;

import com.fasterxml.jackson.annotation.JsonValue;
import com.scanpda.server.grammar.Nonterminal;
import com.scanpda.server.grammar.Requirement;
import com.scanpda.server.grammar.Terminal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered record of every step of one run. Appended to only by the automaton
 * while the run is in progress; sealed when the run ends.
 */
public class DerivationTrace {

    private final List<TraceEntry> entries = new ArrayList<>();
    private boolean sealed = false;

    void record(int inputPosition, Terminal consumed, Action action, Nonterminal nonterminal, Nonterminal parent,
            Requirement requirement, int depth) {
        if (sealed) {
            throw new IllegalStateException("Trace is sealed");
        }
        entries.add(new TraceEntry(entries.size(), inputPosition, consumed, action, nonterminal, parent,
                requirement, depth));
    }

    void seal() {
        sealed = true;
    }

    @JsonValue
    public List<TraceEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public TraceEntry get(int index) {
        return entries.get(index);
    }

    public long count(Action action) {
        return entries.stream().filter(e -> e.getAction() == action).count();
    }

    /**
     * Multi-line listing of the trace, one entry per line.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (TraceEntry e : entries) {
            sb.append(e).append(System.lineSeparator());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DerivationTrace)) {
            return false;
        }
        return render().equals(((DerivationTrace) o).render());
    }

    @Override
    public int hashCode() {
        return render().hashCode();
    }
}
