package com.scanpda.server.grammar;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarLoaderTest {

    private final GrammarLoader loader = new GrammarLoader();

    @Test
    public void testLoadsRequirementsFromBothElementForms() {
        Grammar g = loader.loadResource("/grammar_small.json");

        assertEquals("small", g.getName());
        assertEquals("whole task", g.getProduction(g.getStart()).getLabel());
        assertEquals("B", g.getProduction(new Nonterminal("B")).getLabel(),
                "unlabelled production falls back to its nonterminal");

        Alternative first = g.getProduction(g.getStart()).getAlternative(0);
        assertEquals(3, first.size());
        assertEquals(Requirement.REQUIRED, first.get(0).getRequirement());
        assertEquals(Requirement.EXPECTED, first.get(1).getRequirement());
        assertEquals(Requirement.OPTIONAL, first.get(2).getRequirement());
        assertTrue(first.isSkippableFrom(1));
        assertFalse(first.isSkippableFrom(0));
    }

    @Test
    public void testConflictingGrammarFailsToLoad() {
        MalformedGrammarException e = assertThrows(MalformedGrammarException.class,
                () -> loader.loadResource("/grammar_conflict.json"));
        assertTrue(e.getMessage().contains("can both start with"), e.getMessage());
    }

    @Test
    public void testBrokenJsonFailsToLoad() {
        MalformedGrammarException e = assertThrows(MalformedGrammarException.class,
                () -> loader.loadResource("/grammar_broken.json"));
        assertNotNull(e.getCause());
    }

    @Test
    public void testMissingResource() {
        assertThrows(MalformedGrammarException.class, () -> loader.loadResource("/no_such_grammar.json"));
    }

    @Test
    public void testUnknownRequirementValue() {
        String json = "{\"name\":\"x\",\"start\":\"S\",\"terminals\":[\"a\"],"
                + "\"productions\":[{\"nonterminal\":\"S\",\"alternatives\":[[{\"symbol\":\"a\",\"requirement\":\"maybe\"}]]}]}";
        assertThrows(MalformedGrammarException.class,
                () -> loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    public void testMissingSections() {
        String json = "{\"name\":\"x\",\"start\":\"S\"}";
        MalformedGrammarException e = assertThrows(MalformedGrammarException.class,
                () -> loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
        assertTrue(e.getMessage().contains("terminals"));
    }

    @Test
    public void testNullDocumentFailsToLoad() {
        MalformedGrammarException e = assertThrows(MalformedGrammarException.class,
                () -> loader.load(new ByteArrayInputStream("null".getBytes(StandardCharsets.UTF_8))));
        assertTrue(e.getMessage().contains("empty"), e.getMessage());
    }

    @Test
    public void testNullTerminalFailsToLoad() {
        String json = "{\"name\":\"x\",\"start\":\"S\",\"terminals\":[\"a\",null],"
                + "\"productions\":[{\"nonterminal\":\"S\",\"alternatives\":[[\"a\"]]}]}";
        assertThrows(MalformedGrammarException.class,
                () -> loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    public void testNullEntriesInProductionsFailToLoad() {
        String nullProduction = "{\"name\":\"x\",\"start\":\"S\",\"terminals\":[\"a\"],"
                + "\"productions\":[null]}";
        String nullAlternative = "{\"name\":\"x\",\"start\":\"S\",\"terminals\":[\"a\"],"
                + "\"productions\":[{\"nonterminal\":\"S\",\"alternatives\":[null]}]}";
        String nullElement = "{\"name\":\"x\",\"start\":\"S\",\"terminals\":[\"a\"],"
                + "\"productions\":[{\"nonterminal\":\"S\",\"alternatives\":[[\"a\",null]]}]}";
        for (String json : new String[] {nullProduction, nullAlternative, nullElement}) {
            assertThrows(MalformedGrammarException.class,
                    () -> loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))), json);
        }
    }
}
