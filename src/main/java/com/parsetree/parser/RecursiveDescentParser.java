package com.parsetree.parser;

import com.parsetree.grammar.BuiltinTerminal;
import com.parsetree.grammar.Grammar;
import com.parsetree.grammar.GrammarCompiler;
import com.parsetree.grammar.Production;
import com.parsetree.lexer.Lexer;
import com.parsetree.lexer.Token;
import com.parsetree.model.ErrorKind;
import com.parsetree.model.ParseResult;
import com.parsetree.model.Step;
import com.parsetree.model.TreeNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Backtracking recursive-descent parser driven by a {@link Grammar}.
 * <p>
 * Alternatives are tried in declaration order and the first one that
 * succeeds wins. A failed alternative rolls back the token cursor and any
 * steps it recorded before the next one is tried. Node ids are never reused,
 * so ids along a successful parse increase but may have gaps.
 * <p>
 * Re-entering a non-terminal at the token where it is already being
 * expanded fails that attempt instead of recursing forever, so left-recursive
 * alternatives are skipped rather than fatal.
 * <p>
 * Non-terminals may nest at most {@code maxDepth} levels deep. Input that
 * needs more, such as a very long chain of right-recursive sums, fails the
 * whole parse with {@link ErrorKind#RECURSION_LIMIT}.
 * <p>
 * Instances are immutable and may be shared between threads; every call to
 * {@link #parse(String, boolean)} works on its own cursor, id counter and
 * step log.
 */
public class RecursiveDescentParser {
    private static final Logger LOG = Logger.getLogger(RecursiveDescentParser.class.getName());

    public static final int DEFAULT_MAX_DEPTH = 1000;

    private final Grammar grammar;
    private final Lexer lexer;
    private final int maxDepth;

    public RecursiveDescentParser(Grammar grammar) {
        this(grammar, new Lexer());
    }

    public RecursiveDescentParser(Grammar grammar, Lexer lexer) {
        this(grammar, lexer, DEFAULT_MAX_DEPTH);
    }

    public RecursiveDescentParser(Grammar grammar, Lexer lexer, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        this.maxDepth = maxDepth;
    }

    public static RecursiveDescentParser withDefaultGrammar() {
        return new RecursiveDescentParser(new GrammarCompiler().parse(GrammarCompiler.defaultGrammar()));
    }

    public Grammar grammar() {
        return grammar;
    }

    /**
     * Parses {@code input} from the grammar's start symbol. Never throws for
     * bad input; every failure is reported through the result.
     *
     * @param recordSteps whether to keep the node-creation log for replay
     */
    public ParseResult parse(String input, boolean recordSteps) {
        Objects.requireNonNull(input, "input");
        ImmutableList<Token> tokens = lexer.tokenize(input);

        if (grammar.startSymbol() == null) {
            return ParseResult.failure(ErrorKind.UNDEFINED_START_SYMBOL, "Grammar has no start symbol", tokens);
        }

        Session session = new Session(tokens, recordSteps);
        try {
            TreeNode tree = session.expandNonTerminal(grammar.startSymbol(), Step.NO_PARENT);
            session.expectEnd();
            LOG.fine(() -> String.format("Parsed %d tokens into %d nodes (%d steps)",
                tokens.size(), tree.size(), session.steps.size()));
            return ParseResult.success(tree, session.steps.toImmutable(), tokens);
        } catch (ParseException e) {
            LOG.fine(() -> "Parse failed: " + e.getMessage());
            return ParseResult.failure(e.kind(), e.getMessage(), tokens);
        } catch (StackOverflowError e) {
            // the thread stack ran out before maxDepth was reached
            String message = String.format("expansion too deep at depth %d (position %d)",
                session.deepest, session.current().position());
            LOG.fine(() -> "Parse failed: " + message);
            return ParseResult.failure(ErrorKind.RECURSION_LIMIT, message, tokens);
        }
    }

    private final class Session {
        private final ImmutableList<Token> tokens;
        private final boolean recordSteps;
        private final MutableList<Step> steps = Lists.mutable.empty();
        private final MutableSet<Expansion> active = Sets.mutable.empty();
        private int cursor;
        private int nodeId;
        private int depth;
        private int deepest;

        // Terminal mismatches at the furthest token index reached, for trailing-input hints
        private int furthestCursor = -1;
        private final MutableList<String> furthestExpected = Lists.mutable.empty();

        Session(ImmutableList<Token> tokens, boolean recordSteps) {
            this.tokens = tokens;
            this.recordSteps = recordSteps;
        }

        TreeNode expandNonTerminal(String symbol, int parentId) {
            Production production = grammar.production(symbol);
            if (production == null) {
                throw new ParseException(ErrorKind.UNDEFINED_NON_TERMINAL,
                    "undefined non-terminal: " + symbol, current().position());
            }

            if (depth >= maxDepth) {
                throw new ParseException(ErrorKind.RECURSION_LIMIT,
                    String.format("expansion of %s exceeds depth %d at position %d",
                        symbol, maxDepth, current().position()),
                    current().position());
            }

            Expansion expansion = new Expansion(symbol, cursor);
            if (!active.add(expansion)) {
                throw new ParseException(ErrorKind.LEFT_RECURSION,
                    String.format("left recursion on %s at position %d", symbol, cursor), current().position());
            }
            depth++;
            deepest = Math.max(deepest, depth);
            try {
                return expandAlternatives(production, parentId);
            } finally {
                depth--;
                active.remove(expansion);
            }
        }

        private TreeNode expandAlternatives(Production production, int parentId) {
            String symbol = production.head();
            int id = nextId();
            addStep(Step.expand(id, parentId, symbol));

            ImmutableList<ImmutableList<String>> alternatives = production.alternatives();
            for (int i = 0; i < alternatives.size(); i++) {
                Checkpoint checkpoint = checkpoint();
                try {
                    return TreeNode.nonTerminal(id, symbol, expandAlternative(alternatives.get(i), id));
                } catch (ParseException e) {
                    if (e.kind() == ErrorKind.UNDEFINED_NON_TERMINAL || e.kind() == ErrorKind.RECURSION_LIMIT) {
                        throw e;
                    }
                    rollback(checkpoint);
                    int alternative = i;
                    LOG.finer(() -> String.format("Backtracking %s alternative %d to token %d: %s",
                        symbol, alternative, checkpoint.cursor(), e.getMessage()));
                }
            }

            throw new ParseException(ErrorKind.EXHAUSTED_ALTERNATIVES,
                String.format("no matching production for %s at position %d (found '%s')",
                    symbol, cursor, current().text()),
                current().position());
        }

        private ImmutableList<TreeNode> expandAlternative(ImmutableList<String> symbols, int parentId) {
            MutableList<TreeNode> children = Lists.mutable.empty();

            for (String symbol : symbols) {
                if (Grammar.isEpsilon(symbol)) {
                    int id = nextId();
                    addStep(Step.epsilon(id, parentId));
                    children.add(TreeNode.terminal(id, Grammar.EPSILON));
                } else if (grammar.isTerminal(symbol)) {
                    children.add(matchTerminal(symbol, parentId));
                } else {
                    children.add(expandNonTerminal(symbol, parentId));
                }
            }

            return children.toImmutable();
        }

        private TreeNode matchTerminal(String symbol, int parentId) {
            Token token = current();
            if (!BuiltinTerminal.matches(symbol, token)) {
                noteMismatch(symbol);
                throw new ParseException(ErrorKind.UNMATCHED_TERMINAL,
                    String.format("expected '%s', got '%s' at position %d", symbol, token.text(), token.position()),
                    token.position());
            }

            int id = nextId();
            addStep(Step.match(id, parentId, token.text()));
            advance();
            return TreeNode.terminal(id, token.text());
        }

        void expectEnd() {
            Token token = current();
            if (token.isEof()) {
                return;
            }

            String message = String.format("Unexpected token '%s' at position %d", token.text(), token.position());
            if (furthestCursor > cursor) {
                Token furthest = tokens.get(furthestCursor);
                message += String.format("; furthest failure: expected %s, got '%s' at position %d",
                    furthestExpected.collect(expected -> "'" + expected + "'").makeString(" or "),
                    furthest.text(), furthest.position());
            }
            throw new ParseException(ErrorKind.TRAILING_INPUT, message, token.position());
        }

        private void noteMismatch(String symbol) {
            if (cursor > furthestCursor) {
                furthestCursor = cursor;
                furthestExpected.clear();
            }
            if (cursor == furthestCursor && !furthestExpected.contains(symbol)) {
                furthestExpected.add(symbol);
            }
        }

        private Token current() {
            return cursor < tokens.size() ? tokens.get(cursor) : tokens.getLast();
        }

        private void advance() {
            if (cursor < tokens.size()) {
                cursor++;
            }
        }

        private int nextId() {
            return ++nodeId;
        }

        private void addStep(Step step) {
            if (recordSteps) {
                steps.add(step);
            }
        }

        private Checkpoint checkpoint() {
            return new Checkpoint(cursor, steps.size());
        }

        private void rollback(Checkpoint checkpoint) {
            cursor = checkpoint.cursor();
            while (steps.size() > checkpoint.stepCount()) {
                steps.remove(steps.size() - 1);
            }
        }
    }

    private record Expansion(String symbol, int cursor) {
    }
}
