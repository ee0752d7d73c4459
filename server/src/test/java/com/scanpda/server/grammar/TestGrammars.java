package com.scanpda.server.grammar;

/**
 * Grammars shared by the tests.
 */
public final class TestGrammars {

    private TestGrammars() {
    }

    /** The bundled clinical grammar. */
    public static Grammar ecg() {
        return new GrammarLoader().loadResource("/ecg_grammar.json");
    }

    /** Exam -> RhythmCheck LeadInspection Verification, everything required. */
    public static Grammar exam() {
        return Grammar.builder("exam")
                .terminals("II", "V1", "V2", "QRS", "QT")
                .production("Exam", "RhythmCheck LeadInspection Verification")
                .production("RhythmCheck", "II")
                .production("LeadInspection", "V1 QRS", "V2 QRS")
                .production("Verification", "QT")
                .label("Verification", "verification")
                .start("Exam")
                .build();
    }

    /** Nested brackets: S -> a [S] b | c. */
    public static Grammar nested() {
        return Grammar.builder("nested")
                .terminals("a", "b", "c")
                .production("S", "a S? b", "c")
                .start("S")
                .build();
    }

    /**
     * Mixed requirements and right recursion:
     * S -> A B! C | d, A -> x | y A, B -> z, C -> w [C].
     */
    public static Grammar mixed() {
        return Grammar.builder("mixed")
                .terminals("d", "x", "y", "z", "w")
                .production("S", "A B! C", "d")
                .production("A", "x", "y A")
                .production("B", "z")
                .production("C", "w C?")
                .start("S")
                .build();
    }
}
