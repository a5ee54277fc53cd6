package com.parsetree.grammar;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Compiles line-oriented BNF text into a {@link Grammar}:
 *
 * <pre>
 * // comment
 * E  -&gt; T E'
 * E' -&gt; + T E' | ε
 * </pre>
 *
 * Lines without a {@code ->} (or {@code →}) separator are skipped rather than
 * rejected; {@link #validate(Grammar)} reports what is actually wrong.
 */
public class GrammarCompiler {
    private static final Logger LOG = Logger.getLogger(GrammarCompiler.class.getName());

    private static final Pattern SEPARATOR = Pattern.compile("->|→");
    private static final Pattern ALTERNATIVE = Pattern.compile("\\|");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String DEFAULT_GRAMMAR = String.join("\n",
        "E  -> T E'",
        "E' -> + T E' | - T E' | ε",
        "T  -> F T'",
        "T' -> * F T' | / F T' | ε",
        "F  -> ( E ) | number");

    /**
     * The bundled LL(1) arithmetic grammar, left recursion already removed.
     */
    public static String defaultGrammar() {
        return DEFAULT_GRAMMAR;
    }

    public Grammar parse(String text) {
        Objects.requireNonNull(text, "text");

        MutableList<String> heads = Lists.mutable.empty();
        MutableMap<String, MutableList<ImmutableList<String>>> bodies = Maps.mutable.empty();

        String[] lines = text.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("//") || line.startsWith("#")) {
                continue;
            }

            String[] parts = SEPARATOR.split(line, 2);
            if (parts.length != 2 || parts[0].isBlank()) {
                int lineNumber = i + 1;
                LOG.finer(() -> "Skipping grammar line " + lineNumber + ": " + line);
                continue;
            }

            String head = parts[0].trim();
            MutableList<ImmutableList<String>> alternatives = bodies.getIfAbsentPut(head, () -> {
                heads.add(head);
                return Lists.mutable.empty();
            });

            for (String alternative : ALTERNATIVE.split(parts[1], -1)) {
                ImmutableList<String> symbols = splitSymbols(alternative);
                if (symbols.notEmpty()) {
                    alternatives.add(symbols);
                }
            }
        }

        ImmutableList<Production> productions =
            heads.collect(head -> new Production(head, bodies.get(head).toImmutable())).toImmutable();

        MutableSet<String> terminals = Sets.mutable.empty();
        for (Production production : productions) {
            for (ImmutableList<String> alternative : production.alternatives()) {
                terminals.addAllIterable(
                    alternative.reject(symbol -> bodies.containsKey(symbol) || Grammar.isEpsilon(symbol)));
            }
        }

        Grammar grammar = new Grammar(productions, heads.getFirst(), terminals.toImmutable());
        LOG.fine(() -> String.format("Compiled grammar: %d non-terminals, %d terminals, %d alternatives",
            productions.size(), terminals.size(),
            productions.sumOfInt(production -> production.alternatives().size())));
        return grammar;
    }

    // ε and the word epsilon become standalone symbols even when glued to neighbours
    private static ImmutableList<String> splitSymbols(String alternative) {
        String normalized = alternative
            .replace(Grammar.EPSILON, " " + Grammar.EPSILON + " ")
            .replace(Grammar.EPSILON_WORD, " " + Grammar.EPSILON + " ")
            .trim();
        if (normalized.isEmpty()) {
            return Lists.immutable.empty();
        }
        return Lists.immutable.of(WHITESPACE.split(normalized));
    }

    /**
     * Checks the grammar for problems that would make parsing meaningless.
     * A missing start symbol or an empty start production stops the check
     * early; otherwise every referenced non-terminal without alternatives is
     * reported once, and direct left recursion produces a warning.
     */
    public ValidationResult validate(Grammar grammar) {
        Objects.requireNonNull(grammar, "grammar");

        String start = grammar.startSymbol();
        if (start == null) {
            return ValidationResult.invalid("No start symbol defined");
        }
        Production startProduction = grammar.production(start);
        if (startProduction == null || startProduction.isEmpty()) {
            return ValidationResult.invalid("Start symbol has no productions: " + start);
        }

        MutableList<String> errors = Lists.mutable.empty();
        MutableList<String> warnings = Lists.mutable.empty();
        MutableSet<String> reported = Sets.mutable.empty();

        for (Production production : grammar.productions()) {
            for (ImmutableList<String> alternative : production.alternatives()) {
                for (String symbol : alternative) {
                    if (grammar.isNonTerminal(symbol) && grammar.production(symbol).isEmpty() && reported.add(symbol)) {
                        errors.add("Undefined non-terminal: " + symbol);
                    }
                }
                if (production.isLeftRecursive(alternative)) {
                    warnings.add("Potential left recursion in production: "
                        + production.head() + " -> " + alternative.makeString(" "));
                }
            }
        }

        return new ValidationResult(errors.isEmpty(), errors.toImmutable(), warnings.toImmutable());
    }
}
