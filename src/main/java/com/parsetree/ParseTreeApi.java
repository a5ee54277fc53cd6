package com.parsetree;

import com.parsetree.grammar.Grammar;
import com.parsetree.grammar.GrammarCompiler;
import com.parsetree.grammar.ValidationResult;
import com.parsetree.lexer.Lexer;
import com.parsetree.lexer.Token;
import com.parsetree.model.ErrorKind;
import com.parsetree.model.ParseResult;
import com.parsetree.parser.RecursiveDescentParser;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.logging.Logger;

/**
 * Entry points for front ends: grammar validation while typing, one-shot and
 * step-recording parses, and token previews. Grammar text is compiled on every
 * call, so the API holds no state between calls.
 */
public class ParseTreeApi {
    private static final Logger LOG = Logger.getLogger(ParseTreeApi.class.getName());

    private final GrammarCompiler compiler = new GrammarCompiler();
    private final Lexer lexer = new Lexer();

    public ValidationResult compileAndValidateGrammar(String grammarText) {
        return compiler.validate(compiler.parse(grammarText));
    }

    public ParseResult parse(String grammarText, String input) {
        return parse(grammarText, input, false);
    }

    public ParseResult parseWithSteps(String grammarText, String input) {
        return parse(grammarText, input, true);
    }

    /**
     * Parses against the bundled arithmetic grammar.
     */
    public ParseResult parseDefault(String input, boolean recordSteps) {
        return parse(defaultGrammar(), input, recordSteps);
    }

    public ImmutableList<Token> tokenize(String input) {
        return lexer.tokenize(input);
    }

    public String defaultGrammar() {
        return GrammarCompiler.defaultGrammar();
    }

    // A rejected grammar fails before the input is tokenized, so the result has no tokens
    private ParseResult parse(String grammarText, String input, boolean recordSteps) {
        Grammar grammar = compiler.parse(grammarText);
        ValidationResult validation = compiler.validate(grammar);
        if (!validation.valid()) {
            String error = "Grammar validation failed: " + validation.errors().makeString("; ");
            LOG.fine(error);
            return ParseResult.failure(ErrorKind.INVALID_GRAMMAR, error, Lists.immutable.empty());
        }
        validation.warnings().each(warning -> LOG.fine(() -> "Grammar warning: " + warning));

        return new RecursiveDescentParser(grammar, lexer).parse(input, recordSteps);
    }
}
