package com.scanpda.server.pda;

public enum Verdict {
    ACCEPTED,
    /** Input is a valid prefix; the residual stack still holds open tasks. */
    INCOMPLETE,
    REJECTED
}
