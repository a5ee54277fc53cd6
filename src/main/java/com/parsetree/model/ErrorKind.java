package com.parsetree.model;

public enum ErrorKind {
    /** Malformed grammar line. Such lines are skipped, so this is never reported. */
    GRAMMAR_SYNTAX,
    INVALID_GRAMMAR,
    UNDEFINED_START_SYMBOL,
    UNDEFINED_NON_TERMINAL,
    UNMATCHED_TERMINAL,
    EXHAUSTED_ALTERNATIVES,
    /** A non-terminal re-entered at the same token; fails only the attempt that recursed. */
    LEFT_RECURSION,
    /** Non-terminals nested deeper than the parser allows; aborts the whole parse. */
    RECURSION_LIMIT,
    TRAILING_INPUT
}
