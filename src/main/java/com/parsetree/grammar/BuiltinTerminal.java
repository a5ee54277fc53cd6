package com.parsetree.grammar;

import com.parsetree.lexer.Token;
import com.parsetree.lexer.TokenKind;

import java.util.Optional;

/**
 * Terminal symbols every grammar understands without declaring them. They
 * match by token kind; any other terminal matches by exact token text.
 */
public enum BuiltinTerminal {
    NUMBER("number", TokenKind.NUMBER),
    PLUS("+", TokenKind.PLUS),
    MINUS("-", TokenKind.MINUS),
    MULT("*", TokenKind.MULT),
    DIV("/", TokenKind.DIV),
    LPAREN("(", TokenKind.LPAREN),
    RPAREN(")", TokenKind.RPAREN);

    private final String symbol;
    private final TokenKind kind;

    BuiltinTerminal(String symbol, TokenKind kind) {
        this.symbol = symbol;
        this.kind = kind;
    }

    public String symbol() {
        return symbol;
    }

    public TokenKind kind() {
        return kind;
    }

    public boolean matches(Token token) {
        return token.kind() == kind;
    }

    public static Optional<BuiltinTerminal> forSymbol(String symbol) {
        for (BuiltinTerminal terminal : values()) {
            if (terminal.symbol.equals(symbol)) {
                return Optional.of(terminal);
            }
        }
        return Optional.empty();
    }

    /**
     * True if {@code token} satisfies the grammar symbol {@code symbol}.
     */
    public static boolean matches(String symbol, Token token) {
        return forSymbol(symbol)
            .map(terminal -> terminal.matches(token))
            .orElseGet(() -> symbol.equals(token.text()));
    }
}
