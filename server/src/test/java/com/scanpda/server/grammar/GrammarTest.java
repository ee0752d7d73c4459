package com.scanpda.server.grammar;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

    @Test
    public void testEcgGrammarShape() {
        Grammar g = TestGrammars.ecg();

        assertEquals("ecg-expert-scan", g.getName());
        assertEquals("Exam", g.getStart().getLabel());
        assertEquals(12, g.getAlphabet().size());
        assertEquals(8, g.getProductions().size());
        assertTrue(g.isTerminal("QRS"));
        assertFalse(g.isTerminal("Morphology"));
        assertEquals("repolarization check", g.getProduction(new Nonterminal("Repolarization")).getLabel());
    }

    @Test
    public void testFirstAndFollowSets() {
        Grammar g = TestGrammars.ecg();
        Nonterminal exam = new Nonterminal("Exam");
        Nonterminal leadInspection = new Nonterminal("LeadInspection");
        Nonterminal morphology = new Nonterminal("Morphology");

        assertEquals(Set.of(g.terminal("II")), g.first(exam));
        assertEquals(6, g.first(leadInspection).size());
        assertEquals(Set.of(g.terminal("QT")), g.follow(leadInspection));

        Set<Terminal> morphologyFollow = g.follow(morphology);
        assertEquals(7, morphologyFollow.size());
        assertTrue(morphologyFollow.contains(g.terminal("V6")));
        assertTrue(morphologyFollow.contains(g.terminal("QT")));
        assertTrue(g.follow(exam).isEmpty());
    }

    @Test
    public void testSelectPicksTheOnlyViableAlternative() {
        Grammar g = TestGrammars.ecg();
        Nonterminal lead = new Nonterminal("Lead");

        assertEquals(2, g.select(lead, g.terminal("V3")));
        assertEquals(0, g.select(lead, g.terminal("V1")));
        assertEquals(-1, g.select(lead, g.terminal("QRS")));

        Grammar nested = TestGrammars.nested();
        Nonterminal s = nested.getStart();
        assertEquals(0, nested.select(s, nested.terminal("a")));
        assertEquals(1, nested.select(s, nested.terminal("c")));
        assertEquals(-1, nested.select(s, nested.terminal("b")));
    }

    @Test
    public void testCanonicalYieldLeavesOutSkippableOccurrences() {
        Grammar g = TestGrammars.ecg();
        assertEquals(g.scanpath("II", "V1", "QRS", "QT"), g.canonicalYield(g.getStart()));
        assertEquals(g.scanpath("V1", "QRS"), g.canonicalYield(new Nonterminal("LeadInspection")));

        Grammar mixed = TestGrammars.mixed();
        assertEquals(mixed.scanpath("x", "w"), mixed.canonicalYield(mixed.getStart()));
    }

    @Test
    public void testScanpathRejectsUnknownLabel() {
        Grammar g = TestGrammars.ecg();
        UnknownSymbolException e = assertThrows(UnknownSymbolException.class,
                () -> g.scanpath(List.of("II", "aVR")));
        assertEquals("aVR", e.getLabel());
        assertTrue(e.getMessage().contains("ecg-expert-scan"));
    }

    @Test
    public void testUnknownNonterminalLookup() {
        Grammar g = TestGrammars.exam();
        assertThrows(UnknownSymbolException.class, () -> g.getProduction(new Nonterminal("Morphology")));
    }

    @Test
    public void testAlternativesSharingFirstTerminalAreRejected() {
        MalformedGrammarException e = assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("conflict")
                        .terminals("a", "b", "c")
                        .production("S", "a b", "a c")
                        .start("S")
                        .build());
        assertTrue(e.getMessage().contains("'a'"), e.getMessage());
    }

    @Test
    public void testSkippableOccurrenceClashingWithFollowIsRejected() {
        MalformedGrammarException e = assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("follow-conflict")
                        .terminals("a", "b")
                        .production("S", "A b")
                        .production("A", "a B?")
                        .production("B", "b")
                        .start("S")
                        .build());
        assertTrue(e.getMessage().contains("Skippable"), e.getMessage());
    }

    @Test
    public void testSkippableOccurrenceClashingWithNextElementIsRejected() {
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("next-conflict")
                        .terminals("a", "b")
                        .production("S", "a B! b")
                        .production("B", "b")
                        .start("S")
                        .build());
    }

    @Test
    public void testUndeclaredSymbolIsRejected() {
        MalformedGrammarException e = assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("undeclared")
                        .terminals("a")
                        .production("S", "a X")
                        .start("S")
                        .build());
        assertTrue(e.getMessage().contains("'X'"));
    }

    @Test
    public void testUnproductiveNonterminalIsRejected() {
        MalformedGrammarException e = assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("unproductive")
                        .terminals("a")
                        .production("S", "a S")
                        .start("S")
                        .build());
        assertTrue(e.getMessage().contains("never derives"));
    }

    @Test
    public void testNonTerminatingCanonicalAlternativeIsRejected() {
        MalformedGrammarException e = assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("loop")
                        .terminals("a", "b")
                        .production("S", "a S", "b")
                        .start("S")
                        .build());
        assertTrue(e.getMessage().contains("does not terminate"));

        // same language with the terminating alternative declared first is fine
        Grammar reordered = Grammar.builder("loop")
                .terminals("a", "b")
                .production("S", "b", "a S")
                .start("S")
                .build();
        assertEquals(reordered.scanpath("b"), reordered.canonicalYield(reordered.getStart()));
    }

    @Test
    public void testStructuralErrors() {
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("optional-terminal").terminals("a").production("S", "a?").start("S").build());
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("all-skippable").terminals("a")
                        .production("S", "A?", "a").production("A", "a").start("S").build());
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("no-start").terminals("a").production("S", "a").build());
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("missing-start").terminals("a").production("S", "a").start("T").build());
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("overlap").terminals("a", "S").production("S", "a").start("S").build());
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("empty").terminals("a").production("S", "").start("S").build());
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("twice").terminals("a", "a"));
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("blank-terminal").terminals("a", " "));
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("null-terminal").terminals(Arrays.asList("a", null)));
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("blank-nonterminal").terminals("a").production("", "a"));
        assertThrows(MalformedGrammarException.class,
                () -> Grammar.builder("null-element").terminals("a")
                        .production("S", null, List.of(Arrays.asList("a", null))).start("S").build());
    }

    @Test
    public void testRequirementParsing() {
        assertEquals(Requirement.REQUIRED, Requirement.parse(null));
        assertEquals(Requirement.EXPECTED, Requirement.parse("expected"));
        assertEquals(Requirement.OPTIONAL, Requirement.parse(" Optional "));
        assertThrows(MalformedGrammarException.class, () -> Requirement.parse("sometimes"));
        assertTrue(Requirement.EXPECTED.isSkippable());
        assertTrue(Requirement.EXPECTED.isMandatory());
        assertFalse(Requirement.OPTIONAL.isMandatory());
    }
}
