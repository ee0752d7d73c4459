package com.scanpda.server.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One right-hand side of a production. The index is its declaration order;
 * index 0 is the canonical alternative used for completion.
 */
public final class Alternative {

    private final int index;
    private final List<SymbolRef> elements;

    public Alternative(int index, List<SymbolRef> elements) {
        this.index = index;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public int getIndex() {
        return index;
    }

    public List<SymbolRef> getElements() {
        return elements;
    }

    public SymbolRef get(int position) {
        return elements.get(position);
    }

    public int size() {
        return elements.size();
    }

    /**
     * True when every element from {@code position} on may be passed over.
     */
    public boolean isSkippableFrom(int position) {
        for (int i = position; i < elements.size(); i++) {
            if (!elements.get(i).isSkippable()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return elements.stream().map(SymbolRef::toString).collect(Collectors.joining(" "));
    }
}
