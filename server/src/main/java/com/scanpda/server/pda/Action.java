package com.scanpda.server.pda;

public enum Action {
    /** Open a frame for a nonterminal without consuming input. */
    PUSH,
    /** Close a completed frame. */
    POP,
    /** Consume the input terminal inside the current frame. */
    SHIFT,
    /** Pass over a skippable occurrence. */
    SKIP
}
