package com.parsetree.parser;

/**
 * Parser state to restore when an alternative fails: the token cursor and the
 * length of the step log.
 */
record Checkpoint(int cursor, int stepCount) {
}
