package com.scanpda.server.grammar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable context-free grammar over AOI labels, checked for one-token
 * lookahead when built. A single instance is safely shared by any number of
 * concurrent automaton runs.
 */
public final class Grammar {

    private static final Logger logger = LoggerFactory.getLogger(Grammar.class);

    private final String name;
    private final Nonterminal start;
    private final Map<String, Terminal> terminals;
    private final Map<Nonterminal, Production> productions;
    private final Map<Nonterminal, Set<Terminal>> first;
    private final Map<Nonterminal, List<Set<Terminal>>> alternativeFirst;
    private final Map<Nonterminal, Set<Terminal>> follow;
    private final Map<Nonterminal, Map<Terminal, Integer>> selection;
    private final Map<Nonterminal, List<Terminal>> canonicalYields;

    private Grammar(String name, Nonterminal start, Map<String, Terminal> terminals,
            Map<Nonterminal, Production> productions, LookaheadAnalysis analysis,
            Map<Nonterminal, List<Terminal>> canonicalYields) {
        this.name = name;
        this.start = start;
        this.terminals = Collections.unmodifiableMap(terminals);
        this.productions = Collections.unmodifiableMap(productions);
        this.first = analysis.getFirst();
        this.alternativeFirst = analysis.getAlternativeFirst();
        this.follow = analysis.getFollow();
        this.selection = analysis.getSelection();
        this.canonicalYields = Collections.unmodifiableMap(canonicalYields);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Nonterminal getStart() {
        return start;
    }

    public Collection<Terminal> getAlphabet() {
        return terminals.values();
    }

    public Collection<Production> getProductions() {
        return productions.values();
    }

    public Production getProduction(Nonterminal nonterminal) {
        Production p = productions.get(nonterminal);
        if (p == null) {
            throw new UnknownSymbolException(nonterminal.getLabel(), name);
        }
        return p;
    }

    public boolean isTerminal(String label) {
        return terminals.containsKey(label);
    }

    public Terminal terminal(String label) {
        Terminal t = terminals.get(label);
        if (t == null) {
            throw new UnknownSymbolException(label, name);
        }
        return t;
    }

    /**
     * Converts AOI labels to terminals, rejecting any label outside the
     * alphabet.
     */
    public List<Terminal> scanpath(List<String> labels) {
        List<Terminal> out = new ArrayList<>(labels.size());
        for (String label : labels) {
            out.add(terminal(label));
        }
        return out;
    }

    public List<Terminal> scanpath(String... labels) {
        return scanpath(Arrays.asList(labels));
    }

    /**
     * Index of the unique alternative of {@code nonterminal} that can start
     * with {@code lookahead}, or -1 when none can.
     */
    public int select(Nonterminal nonterminal, Terminal lookahead) {
        Integer index = selection.getOrDefault(nonterminal, Collections.emptyMap()).get(lookahead);
        return index != null ? index : -1;
    }

    public Set<Terminal> first(Nonterminal nonterminal) {
        return first.getOrDefault(nonterminal, Collections.emptySet());
    }

    public Set<Terminal> first(Nonterminal nonterminal, int alternative) {
        return alternativeFirst.get(nonterminal).get(alternative);
    }

    public Set<Terminal> first(SymbolRef ref) {
        if (ref.isTerminal()) {
            return Collections.singleton((Terminal) ref.getSymbol());
        }
        return first((Nonterminal) ref.getSymbol());
    }

    public Set<Terminal> follow(Nonterminal nonterminal) {
        return follow.getOrDefault(nonterminal, Collections.emptySet());
    }

    /**
     * Terminal yield of the canonical expansion of {@code nonterminal}: the
     * first-declared alternative at every level, skippable occurrences left
     * out.
     */
    public List<Terminal> canonicalYield(Nonterminal nonterminal) {
        List<Terminal> yield = canonicalYields.get(nonterminal);
        if (yield == null) {
            throw new UnknownSymbolException(nonterminal.getLabel(), name);
        }
        return yield;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Grammar '").append(name).append("' start=").append(start);
        for (Production p : productions.values()) {
            sb.append(System.lineSeparator()).append("  ").append(p);
        }
        return sb.toString();
    }

    /**
     * Authoring surface. Alternative elements are symbol names; a trailing
     * {@code ?} marks an OPTIONAL occurrence and a trailing {@code !} an
     * EXPECTED one.
     */
    public static final class Builder {
        private final String name;
        private final Set<String> terminalLabels = new LinkedHashSet<>();
        private final Map<String, String> labels = new LinkedHashMap<>();
        private final Map<String, List<List<String>>> rules = new LinkedHashMap<>();
        private String start;

        private Builder(String name) {
            this.name = name != null ? name : "grammar";
        }

        public Builder terminals(String... labels) {
            return terminals(Arrays.asList(labels));
        }

        public Builder terminals(Collection<String> labels) {
            for (String label : labels) {
                if (isBlank(label)) {
                    throw new MalformedGrammarException("Grammar '" + name + "' declares a blank terminal");
                }
                if (!terminalLabels.add(label)) {
                    throw new MalformedGrammarException("Terminal '" + label + "' declared twice");
                }
            }
            return this;
        }

        public Builder start(String nonterminal) {
            this.start = nonterminal;
            return this;
        }

        public Builder production(String nonterminal, String... alternatives) {
            List<List<String>> alts = new ArrayList<>();
            for (String alt : alternatives) {
                alts.add(splitAlternative(alt));
            }
            return production(nonterminal, null, alts);
        }

        public Builder production(String nonterminal, String label, List<List<String>> alternatives) {
            if (isBlank(nonterminal)) {
                throw new MalformedGrammarException("Grammar '" + name + "' has a production without nonterminal");
            }
            if (rules.containsKey(nonterminal)) {
                throw new MalformedGrammarException("Production for '" + nonterminal + "' declared twice");
            }
            if (alternatives == null || alternatives.isEmpty()) {
                throw new MalformedGrammarException("Production for '" + nonterminal + "' has no alternatives");
            }
            rules.put(nonterminal, alternatives);
            if (label != null) {
                labels.put(nonterminal, label);
            }
            return this;
        }

        public Builder label(String nonterminal, String label) {
            labels.put(nonterminal, label);
            return this;
        }

        public Grammar build() {
            if (isBlank(start)) {
                throw new MalformedGrammarException("Grammar '" + name + "' has no start symbol");
            }
            if (terminalLabels.isEmpty()) {
                throw new MalformedGrammarException("Grammar '" + name + "' declares no terminals");
            }

            Map<String, Terminal> terminals = new LinkedHashMap<>();
            for (String label : terminalLabels) {
                terminals.put(label, new Terminal(label));
            }
            Map<String, Nonterminal> nonterminals = new LinkedHashMap<>();
            for (String label : rules.keySet()) {
                if (terminals.containsKey(label)) {
                    throw new MalformedGrammarException("'" + label + "' is declared both terminal and nonterminal");
                }
                nonterminals.put(label, new Nonterminal(label));
            }
            if (!nonterminals.containsKey(start)) {
                throw new MalformedGrammarException("Start symbol '" + start + "' has no production");
            }

            Map<Nonterminal, Production> productions = new LinkedHashMap<>();
            for (Map.Entry<String, List<List<String>>> rule : rules.entrySet()) {
                Nonterminal lhs = nonterminals.get(rule.getKey());
                List<Alternative> alternatives = new ArrayList<>();
                for (List<String> rawAlt : rule.getValue()) {
                    alternatives.add(resolveAlternative(lhs, alternatives.size(), rawAlt, terminals, nonterminals));
                }
                productions.put(lhs, new Production(lhs, labels.get(rule.getKey()), alternatives));
            }

            LookaheadAnalysis analysis = new LookaheadAnalysis(productions);
            analysis.analyze();

            Map<Nonterminal, List<Terminal>> yields = new LinkedHashMap<>();
            for (Nonterminal nt : productions.keySet()) {
                expandCanonical(nt, productions, yields, new HashSet<>());
            }

            logger.info("Built grammar '{}' with {} terminals and {} nonterminals, start={}", name,
                    terminals.size(), productions.size(), start);
            return new Grammar(name, nonterminals.get(start), terminals, productions, analysis, yields);
        }

        private static boolean isBlank(String label) {
            return label == null || label.trim().isEmpty();
        }

        private static List<String> splitAlternative(String alt) {
            String trimmed = alt == null ? "" : alt.trim();
            if (trimmed.isEmpty()) {
                return Collections.emptyList();
            }
            return Arrays.asList(trimmed.split("\\s+"));
        }

        private static Alternative resolveAlternative(Nonterminal lhs, int index, List<String> rawAlt,
                Map<String, Terminal> terminals, Map<String, Nonterminal> nonterminals) {
            List<SymbolRef> elements = new ArrayList<>();
            boolean hasRequired = false;
            for (String raw : rawAlt) {
                if (raw == null) {
                    throw new MalformedGrammarException("Alternative " + index + " of '" + lhs + "' has a null element");
                }
                Requirement requirement = Requirement.REQUIRED;
                String symbolName = raw.trim();
                if (symbolName.endsWith("?")) {
                    requirement = Requirement.OPTIONAL;
                    symbolName = symbolName.substring(0, symbolName.length() - 1);
                } else if (symbolName.endsWith("!")) {
                    requirement = Requirement.EXPECTED;
                    symbolName = symbolName.substring(0, symbolName.length() - 1);
                }

                Symbol symbol = terminals.get(symbolName);
                if (symbol == null) {
                    symbol = nonterminals.get(symbolName);
                }
                if (symbol == null) {
                    throw new MalformedGrammarException(
                            "Alternative " + index + " of '" + lhs + "' references undeclared symbol '" + symbolName + "'");
                }
                if (symbol.isTerminal() && requirement != Requirement.REQUIRED) {
                    throw new MalformedGrammarException("Terminal '" + symbolName + "' in alternative " + index
                            + " of '" + lhs + "' cannot be " + requirement);
                }
                hasRequired |= requirement == Requirement.REQUIRED;
                elements.add(new SymbolRef(symbol, requirement));
            }
            if (elements.isEmpty()) {
                throw new MalformedGrammarException("Alternative " + index + " of '" + lhs + "' is empty");
            }
            if (!hasRequired) {
                throw new MalformedGrammarException(
                        "Alternative " + index + " of '" + lhs + "' has no required element");
            }
            return new Alternative(index, elements);
        }

        private static List<Terminal> expandCanonical(Nonterminal nt, Map<Nonterminal, Production> productions,
                Map<Nonterminal, List<Terminal>> yields, Set<Nonterminal> inProgress) {
            List<Terminal> done = yields.get(nt);
            if (done != null) {
                return done;
            }
            if (!inProgress.add(nt)) {
                throw new MalformedGrammarException(
                        "Canonical expansion of '" + nt + "' does not terminate; reorder its alternatives");
            }
            List<Terminal> out = new ArrayList<>();
            for (SymbolRef ref : productions.get(nt).getCanonicalAlternative().getElements()) {
                if (ref.isSkippable()) {
                    continue;
                }
                if (ref.isTerminal()) {
                    out.add((Terminal) ref.getSymbol());
                } else {
                    out.addAll(expandCanonical((Nonterminal) ref.getSymbol(), productions, yields, inProgress));
                }
            }
            inProgress.remove(nt);
            List<Terminal> frozen = Collections.unmodifiableList(out);
            yields.put(nt, frozen);
            return frozen;
        }
    }
}
