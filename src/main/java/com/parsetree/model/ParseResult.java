package com.parsetree.model;

import com.parsetree.lexer.Token;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Outcome of one parse. On failure {@code tree} and the step log are empty and
 * {@code error} holds a message meant to be shown verbatim. {@code tokens} is
 * populated even on failure, unless the grammar itself was rejected.
 *
 * @param tree      root node, {@code null} on failure
 * @param error     failure message, {@code null} on success
 * @param errorKind failure category, {@code null} on success
 */
public record ParseResult(boolean success,
                          TreeNode tree,
                          ImmutableList<Step> steps,
                          String error,
                          ErrorKind errorKind,
                          ImmutableList<Token> tokens) {

    public static ParseResult success(TreeNode tree, ImmutableList<Step> steps, ImmutableList<Token> tokens) {
        return new ParseResult(true, tree, steps, null, null, tokens);
    }

    public static ParseResult failure(ErrorKind kind, String error, ImmutableList<Token> tokens) {
        return new ParseResult(false, null, Lists.immutable.empty(), error, kind, tokens);
    }
}
