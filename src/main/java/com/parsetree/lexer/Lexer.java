package com.parsetree.lexer;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Locale;

/**
 * Splits expression input into tokens. Never fails: characters it does not
 * recognize come out as single-character {@link TokenKind#UNKNOWN} tokens and
 * the parser decides what to do with them. The result always ends with an
 * {@link TokenKind#EOF} token.
 * <p>
 * Token positions are UTF-8 byte offsets into the input, so they agree with
 * character offsets only for ASCII text.
 */
public class Lexer {
    public ImmutableList<Token> tokenize(String input) {
        MutableList<Token> tokens = Lists.mutable.empty();
        int[] offsets = byteOffsets(input);
        int pos = 0;

        while (pos < input.length()) {
            char c = input.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
            } else if (Character.isDigit(c)) {
                pos = readNumber(input, pos, offsets, tokens);
            } else if (Character.isLetter(c)) {
                pos = readIdentifier(input, pos, offsets, tokens);
            } else {
                int end = pos + Character.charCount(input.codePointAt(pos));
                tokens.add(new Token(TokenKind.forOperator(c), input.substring(pos, end), offsets[pos]));
                pos = end;
            }
        }

        tokens.add(Token.eof(offsets[pos]));
        return tokens.toImmutable();
    }

    /**
     * UTF-8 byte offset of every char index, plus one entry for the end of input.
     */
    static int[] byteOffsets(String input) {
        int[] offsets = new int[input.length() + 1];
        int bytes = 0;
        for (int i = 0; i < input.length(); i++) {
            offsets[i] = bytes;
            char c = input.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < input.length()
                       && Character.isLowSurrogate(input.charAt(i + 1))) {
                // the pair encodes as four bytes, all counted on the high half
                bytes += 4;
                offsets[++i] = bytes - 4;
            } else {
                bytes += 3;
            }
        }
        offsets[input.length()] = bytes;
        return offsets;
    }

    private int readNumber(String input, int start, int[] offsets, MutableList<Token> tokens) {
        int pos = start;
        boolean seenDot = false;

        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isDigit(c)) {
                pos++;
            } else if (c == '.' && !seenDot) {
                seenDot = true;
                pos++;
            } else {
                break;
            }
        }

        tokens.add(new Token(TokenKind.NUMBER, input.substring(start, pos), offsets[start]));
        return pos;
    }

    private int readIdentifier(String input, int start, int[] offsets, MutableList<Token> tokens) {
        int pos = start;
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            pos++;
        }

        String text = input.substring(start, pos);
        // The word "number" doubles as the lexical class so grammars can be fed their own terminal names
        TokenKind kind = text.toLowerCase(Locale.ROOT).equals("number") ? TokenKind.NUMBER : TokenKind.IDENT;
        tokens.add(new Token(kind, text, offsets[start]));
        return pos;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
    }
}
