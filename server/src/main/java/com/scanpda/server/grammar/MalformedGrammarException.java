package com.scanpda.server.grammar;

/**
 * Raised while building a grammar that is not usable by the automaton:
 * undeclared symbols, lookahead conflicts, unproductive or non-terminating
 * nonterminals. Never raised during a run.
 */
public class MalformedGrammarException extends RuntimeException {

    public MalformedGrammarException(String message) {
        super(message);
    }

    public MalformedGrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
