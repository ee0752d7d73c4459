package com.scanpda.server.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FIRST/FOLLOW computation and the one-token-lookahead checks run once when a
 * grammar is built. No alternative derives the empty string (every one has a
 * REQUIRED element), so FIRST of a sequence is the union over its leading
 * skippable elements plus the first required one.
 */
final class LookaheadAnalysis {

    private final Map<Nonterminal, Production> productions;
    private final Map<Nonterminal, Set<Terminal>> first = new LinkedHashMap<>();
    private final Map<Nonterminal, List<Set<Terminal>>> alternativeFirst = new LinkedHashMap<>();
    private final Map<Nonterminal, Set<Terminal>> follow = new LinkedHashMap<>();
    private final Map<Nonterminal, Map<Terminal, Integer>> selection = new LinkedHashMap<>();

    LookaheadAnalysis(Map<Nonterminal, Production> productions) {
        this.productions = productions;
    }

    void analyze() {
        checkProductive();
        computeFirst();
        computeFollow();
        checkAlternativesDisjoint();
        checkSkippableOccurrences();
    }

    Map<Nonterminal, Set<Terminal>> getFirst() {
        return freeze(first);
    }

    Map<Nonterminal, List<Set<Terminal>>> getAlternativeFirst() {
        Map<Nonterminal, List<Set<Terminal>>> out = new LinkedHashMap<>();
        for (Map.Entry<Nonterminal, List<Set<Terminal>>> e : alternativeFirst.entrySet()) {
            List<Set<Terminal>> sets = new ArrayList<>();
            for (Set<Terminal> s : e.getValue()) {
                sets.add(Collections.unmodifiableSet(new LinkedHashSet<>(s)));
            }
            out.put(e.getKey(), Collections.unmodifiableList(sets));
        }
        return Collections.unmodifiableMap(out);
    }

    Map<Nonterminal, Set<Terminal>> getFollow() {
        return freeze(follow);
    }

    Map<Nonterminal, Map<Terminal, Integer>> getSelection() {
        Map<Nonterminal, Map<Terminal, Integer>> out = new LinkedHashMap<>();
        for (Map.Entry<Nonterminal, Map<Terminal, Integer>> e : selection.entrySet()) {
            out.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * A nonterminal is productive when one of its alternatives has only
     * terminals or productive nonterminals in its REQUIRED positions.
     */
    private void checkProductive() {
        Set<Nonterminal> productive = new HashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production p : productions.values()) {
                if (productive.contains(p.getNonterminal())) {
                    continue;
                }
                for (Alternative alt : p.getAlternatives()) {
                    if (isProductive(alt, productive)) {
                        productive.add(p.getNonterminal());
                        changed = true;
                        break;
                    }
                }
            }
        }
        for (Nonterminal nt : productions.keySet()) {
            if (!productive.contains(nt)) {
                throw new MalformedGrammarException(
                        "Nonterminal '" + nt + "' never derives a terminal sequence");
            }
        }
    }

    private static boolean isProductive(Alternative alt, Set<Nonterminal> productive) {
        for (SymbolRef ref : alt.getElements()) {
            if (ref.isSkippable() || ref.isTerminal()) {
                continue;
            }
            if (!productive.contains((Nonterminal) ref.getSymbol())) {
                return false;
            }
        }
        return true;
    }

    private void computeFirst() {
        for (Production p : productions.values()) {
            first.put(p.getNonterminal(), new LinkedHashSet<>());
            List<Set<Terminal>> sets = new ArrayList<>();
            for (int i = 0; i < p.getAlternatives().size(); i++) {
                sets.add(new LinkedHashSet<>());
            }
            alternativeFirst.put(p.getNonterminal(), sets);
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production p : productions.values()) {
                Set<Terminal> ntFirst = first.get(p.getNonterminal());
                List<Set<Terminal>> altSets = alternativeFirst.get(p.getNonterminal());
                for (Alternative alt : p.getAlternatives()) {
                    Set<Terminal> altFirst = altSets.get(alt.getIndex());
                    if (altFirst.addAll(firstOfRest(alt, 0)) | ntFirst.addAll(altFirst)) {
                        changed = true;
                    }
                }
            }
        }
    }

    /**
     * FIRST of the elements from {@code position} on, stopping after the first
     * REQUIRED element.
     */
    private Set<Terminal> firstOfRest(Alternative alt, int position) {
        Set<Terminal> out = new LinkedHashSet<>();
        for (int i = position; i < alt.size(); i++) {
            SymbolRef ref = alt.get(i);
            out.addAll(firstOf(ref));
            if (!ref.isSkippable()) {
                break;
            }
        }
        return out;
    }

    private Set<Terminal> firstOf(SymbolRef ref) {
        if (ref.isTerminal()) {
            return Collections.singleton((Terminal) ref.getSymbol());
        }
        return first.get((Nonterminal) ref.getSymbol());
    }

    private void computeFollow() {
        for (Nonterminal nt : productions.keySet()) {
            follow.put(nt, new LinkedHashSet<>());
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production p : productions.values()) {
                for (Alternative alt : p.getAlternatives()) {
                    for (int k = 0; k < alt.size(); k++) {
                        SymbolRef ref = alt.get(k);
                        if (ref.isTerminal()) {
                            continue;
                        }
                        Set<Terminal> target = follow.get((Nonterminal) ref.getSymbol());
                        if (target.addAll(firstOfRest(alt, k + 1))) {
                            changed = true;
                        }
                        if (alt.isSkippableFrom(k + 1) && target.addAll(follow.get(p.getNonterminal()))) {
                            changed = true;
                        }
                    }
                }
            }
        }
    }

    private void checkAlternativesDisjoint() {
        for (Production p : productions.values()) {
            Map<Terminal, Integer> table = new LinkedHashMap<>();
            List<Set<Terminal>> altSets = alternativeFirst.get(p.getNonterminal());
            for (int i = 0; i < altSets.size(); i++) {
                for (Terminal t : altSets.get(i)) {
                    Integer previous = table.put(t, i);
                    if (previous != null) {
                        throw new MalformedGrammarException("Alternatives " + previous + " and " + i + " of '"
                                + p.getNonterminal() + "' can both start with '" + t + "'");
                    }
                }
            }
            selection.put(p.getNonterminal(), table);
        }
    }

    /**
     * Entering a skippable occurrence must be decidable from the next symbol,
     * so its FIRST set may not overlap with whatever can follow it there.
     */
    private void checkSkippableOccurrences() {
        for (Production p : productions.values()) {
            for (Alternative alt : p.getAlternatives()) {
                for (int k = 0; k < alt.size(); k++) {
                    SymbolRef ref = alt.get(k);
                    if (!ref.isSkippable()) {
                        continue;
                    }
                    Set<Terminal> after = new LinkedHashSet<>(firstOfRest(alt, k + 1));
                    if (alt.isSkippableFrom(k + 1)) {
                        after.addAll(follow.get(p.getNonterminal()));
                    }
                    for (Terminal t : firstOf(ref)) {
                        if (after.contains(t)) {
                            throw new MalformedGrammarException("Skippable '" + ref.getSymbol() + "' in '"
                                    + p.getNonterminal() + " -> " + alt + "' and what follows it can both start with '"
                                    + t + "'");
                        }
                    }
                }
            }
        }
    }

    private static Map<Nonterminal, Set<Terminal>> freeze(Map<Nonterminal, Set<Terminal>> sets) {
        Map<Nonterminal, Set<Terminal>> out = new LinkedHashMap<>();
        for (Map.Entry<Nonterminal, Set<Terminal>> e : sets.entrySet()) {
            out.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
        }
        return Collections.unmodifiableMap(out);
    }
}
