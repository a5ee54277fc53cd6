package com.parsetree.lexer;

public enum TokenKind {
    NUMBER("number"),
    PLUS("+"),
    MINUS("-"),
    MULT("*"),
    DIV("/"),
    LPAREN("("),
    RPAREN(")"),
    EOF("EOF"),
    EPSILON("ε"),  // reserved, never produced by the lexer
    IDENT("IDENT"),
    UNKNOWN("UNKNOWN");

    private final String displayName;

    TokenKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Human-readable name, the grammar symbol for punctuation and numbers.
     */
    public String displayName() {
        return displayName;
    }

    static TokenKind forOperator(char c) {
        return switch (c) {
            case '+' -> PLUS;
            case '-' -> MINUS;
            case '*' -> MULT;
            case '/' -> DIV;
            case '(' -> LPAREN;
            case ')' -> RPAREN;
            default -> UNKNOWN;
        };
    }
}
