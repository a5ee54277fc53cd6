package com.parsetree;

import com.parsetree.grammar.ValidationResult;
import com.parsetree.lexer.Token;
import com.parsetree.model.ParseResult;
import com.parsetree.output.OutputFormatter;
import org.eclipse.collections.api.list.ImmutableList;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import java.util.logging.Level;

@Command(name = "ptv", mixinStandardHelpOptions = true, version = "1.0",
         description = "Parse input with a BNF grammar and show the parse tree, its construction steps or tokens")
public class PTV implements Callable<Integer> {
    @Option(names = {"-g", "--grammar"}, description = "Grammar file (default: bundled arithmetic grammar)")
    private File grammarFile;

    @Option(names = {"-e", "--grammar-text"}, description = "Grammar given inline; takes precedence over --grammar")
    private String grammarText;

    @Option(names = {"-j", "--json"}, description = "Print results as JSON")
    private boolean jsonOutput = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-C", "--color-output"}, description = "Colorize text output")
    private boolean colorOutput = false;

    @Option(names = {"-v", "--verbose"}, description = "Log parser activity to stderr")
    private boolean verbose = false;

    @Spec
    private CommandSpec spec;

    private final ParseTreeApi api = new ParseTreeApi();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PTV()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(out());
        return 0;
    }

    @Command(name = "parse", description = "Parse INPUT and print its parse tree")
    int parse(@Parameters(paramLabel = "INPUT", description = "Text to parse") String input) {
        return runParse(input, false);
    }

    @Command(name = "steps", description = "Parse INPUT and print the tree construction steps")
    int steps(@Parameters(paramLabel = "INPUT", description = "Text to parse") String input) {
        return runParse(input, true);
    }

    @Command(name = "tokens", description = "Print the tokens of INPUT")
    int tokens(@Parameters(paramLabel = "INPUT", description = "Text to tokenize") String input) {
        setUp();
        ImmutableList<Token> tokens = api.tokenize(input);
        OutputFormatter formatter = formatter();
        out().print(jsonOutput ? formatter.tokensToJson(tokens) + "\n" : formatter.formatTokens(tokens));
        out().flush();
        return 0;
    }

    @Command(name = "validate", description = "Check the grammar for errors and warnings")
    int validate() {
        setUp();
        try {
            ValidationResult validation = api.compileAndValidateGrammar(readGrammar());
            OutputFormatter formatter = formatter();
            out().print(jsonOutput ? formatter.toJson(validation) + "\n" : formatter.formatValidation(validation));
            out().flush();
            return validation.valid() ? 0 : 1;
        } catch (IOException e) {
            return fail(e.getMessage());
        }
    }

    @Command(name = "grammar", description = "Print the bundled default grammar")
    int grammar() {
        out().println(api.defaultGrammar());
        out().flush();
        return 0;
    }

    private int runParse(String input, boolean recordSteps) {
        setUp();
        try {
            String grammar = readGrammar();
            ParseResult result = recordSteps ? api.parseWithSteps(grammar, input) : api.parse(grammar, input);
            OutputFormatter formatter = formatter();

            if (jsonOutput) {
                out().println(formatter.toJson(result));
                out().flush();
                return result.success() ? 0 : 1;
            }
            if (!result.success()) {
                return fail(result.error());
            }

            out().print(recordSteps ? formatter.formatSteps(result.steps()) : formatter.format(result.tree()));
            out().flush();
            return 0;
        } catch (IOException e) {
            return fail(e.getMessage());
        }
    }

    private String readGrammar() throws IOException {
        if (grammarText != null) {
            return grammarText;
        }
        if (grammarFile != null) {
            try {
                return Files.readString(grammarFile.toPath(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IOException("Cannot read grammar file " + grammarFile, e);
            }
        }
        return api.defaultGrammar();
    }

    private void setUp() {
        if (verbose) {
            Logging.enable(Level.FINE, spec.commandLine().getErr());
        }
    }

    private OutputFormatter formatter() {
        return new OutputFormatter(!compactOutput, colorOutput);
    }

    private int fail(String message) {
        PrintWriter err = spec.commandLine().getErr();
        err.println(formatter().formatError(message));
        err.flush();
        return 1;
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }
}
