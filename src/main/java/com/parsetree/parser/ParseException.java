package com.parsetree.parser;

import com.parsetree.model.ErrorKind;

/**
 * Failure of one expansion attempt. Thrown once per failed alternative while
 * backtracking, so no stack trace is captured.
 */
public class ParseException extends RuntimeException {
    private final ErrorKind kind;
    private final int position;

    public ParseException(ErrorKind kind, String message, int position) {
        super(message, null, false, false);
        this.kind = kind;
        this.position = position;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * UTF-8 byte offset of the token the failure refers to.
     */
    public int position() {
        return position;
    }
}
