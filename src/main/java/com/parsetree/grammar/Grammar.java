package com.parsetree.grammar;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

/**
 * A compiled context-free grammar. Immutable, so one instance can back any
 * number of concurrent parses.
 *
 * @see GrammarCompiler#parse(String)
 */
public final class Grammar {
    public static final String EPSILON = "ε";
    public static final String EPSILON_WORD = "epsilon";

    private static final ImmutableSet<String> IMPLICIT_TERMINALS =
        Sets.immutable.of("+", "-", "*", "/", "(", ")", "number", EPSILON, EPSILON_WORD);

    private final ImmutableList<Production> productions;
    private final ImmutableMap<String, Production> byHead;
    private final String startSymbol;
    private final ImmutableSet<String> terminals;
    private final ImmutableSet<String> nonTerminals;

    Grammar(ImmutableList<Production> productions, String startSymbol, ImmutableSet<String> terminals) {
        this.productions = productions;
        this.byHead = productions.groupByUniqueKey(Production::head);
        this.startSymbol = startSymbol;
        this.terminals = terminals;
        this.nonTerminals = productions.collect(Production::head).toSet().toImmutable();
    }

    /**
     * Productions in the order their heads were first declared.
     */
    public ImmutableList<Production> productions() {
        return productions;
    }

    /**
     * @return the production for {@code head}, or {@code null} if none was declared
     */
    public Production production(String head) {
        return byHead.get(head);
    }

    /**
     * @return the first declared head, or {@code null} for a grammar with no productions
     */
    public String startSymbol() {
        return startSymbol;
    }

    public ImmutableSet<String> terminals() {
        return terminals;
    }

    public ImmutableSet<String> nonTerminals() {
        return nonTerminals;
    }

    public boolean isTerminal(String symbol) {
        return terminals.contains(symbol) || IMPLICIT_TERMINALS.contains(symbol);
    }

    public boolean isNonTerminal(String symbol) {
        return nonTerminals.contains(symbol);
    }

    public static boolean isEpsilon(String symbol) {
        return EPSILON.equals(symbol) || EPSILON_WORD.equals(symbol);
    }

    @Override
    public String toString() {
        return productions.makeString("\n");
    }
}
