package com.parsetree.lexer;

import java.util.Objects;

public record Token(TokenKind kind, String text, int position) {
    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static Token eof(int position) {
        return new Token(TokenKind.EOF, "", position);
    }

    public boolean isEof() {
        return kind == TokenKind.EOF;
    }

    /**
     * {@code NUMBER 3}, {@code IDENT x}, {@code UNKNOWN $}; fixed-text kinds print as the bare kind.
     */
    @Override
    public String toString() {
        return switch (kind) {
            case NUMBER, IDENT, UNKNOWN -> kind + " " + text;
            default -> kind.name();
        };
    }
}
