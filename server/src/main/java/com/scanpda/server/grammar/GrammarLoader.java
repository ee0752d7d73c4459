package com.scanpda.server.grammar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a grammar declaration from JSON.
 *
 * <pre>
 * {
 *   "name": "ecg-expert-scan",
 *   "start": "Exam",
 *   "terminals": ["II", "V1", ...],
 *   "productions": [
 *     { "nonterminal": "Exam", "label": "full examination",
 *       "alternatives": [["RhythmCheck", "LeadInspection", "Verification"]] },
 *     ...
 *   ]
 * }
 * </pre>
 *
 * An alternative element is either a symbol name ({@code "P?"} for an optional
 * occurrence) or an object {@code {"symbol": "Repolarization", "requirement": "expected"}}.
 */
public class GrammarLoader {

    private static final Logger logger = LoggerFactory.getLogger(GrammarLoader.class);

    public static class ProductionNode {
        public String nonterminal;
        public String label;
        public List<List<JsonNode>> alternatives;
    }

    public static class GrammarRoot {
        public String name;
        public String start;
        public List<String> terminals;
        public List<ProductionNode> productions;
    }

    private final ObjectMapper mapper;

    public GrammarLoader() {
        this(new ObjectMapper());
    }

    public GrammarLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Grammar loadResource(String resource) {
        try (InputStream is = GrammarLoader.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new MalformedGrammarException("Grammar resource not found: " + resource);
            }
            logger.info("Loading grammar from classpath resource {}", resource);
            return load(is);
        } catch (IOException e) {
            throw new MalformedGrammarException("Failed to read grammar resource " + resource, e);
        }
    }

    public Grammar load(InputStream jsonStream) {
        GrammarRoot root;
        try {
            root = mapper.readValue(jsonStream, GrammarRoot.class);
        } catch (IOException e) {
            throw new MalformedGrammarException("Failed to parse grammar JSON", e);
        }
        return fromRoot(root);
    }

    public Grammar fromRoot(GrammarRoot root) {
        if (root == null) {
            throw new MalformedGrammarException("Grammar JSON is empty");
        }
        if (root.terminals == null || root.productions == null) {
            throw new MalformedGrammarException("Grammar JSON needs both 'terminals' and 'productions'");
        }
        Grammar.Builder builder = Grammar.builder(root.name).terminals(root.terminals).start(root.start);

        for (ProductionNode pn : root.productions) {
            if (pn == null || pn.nonterminal == null) {
                throw new MalformedGrammarException("Production without 'nonterminal' in grammar " + root.name);
            }
            List<List<String>> alternatives = new ArrayList<>();
            if (pn.alternatives != null) {
                for (List<JsonNode> rawAlt : pn.alternatives) {
                    if (rawAlt == null) {
                        throw new MalformedGrammarException("Null alternative in production of '" + pn.nonterminal + "'");
                    }
                    List<String> alt = new ArrayList<>();
                    for (JsonNode element : rawAlt) {
                        alt.add(toElement(pn.nonterminal, element));
                    }
                    alternatives.add(alt);
                }
            }
            builder.production(pn.nonterminal, pn.label, alternatives);
        }
        return builder.build();
    }

    private static String toElement(String owner, JsonNode element) {
        if (element != null && element.isTextual()) {
            return element.asText();
        }
        if (element != null && element.isObject() && element.hasNonNull("symbol")) {
            String symbol = element.get("symbol").asText();
            Requirement requirement = Requirement.parse(
                    element.hasNonNull("requirement") ? element.get("requirement").asText() : null);
            switch (requirement) {
                case OPTIONAL:
                    return symbol + "?";
                case EXPECTED:
                    return symbol + "!";
                default:
                    return symbol;
            }
        }
        throw new MalformedGrammarException("Unreadable alternative element " + element + " in production of '"
                + owner + "'");
    }
}
