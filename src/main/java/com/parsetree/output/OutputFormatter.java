package com.parsetree.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.parsetree.grammar.ValidationResult;
import com.parsetree.lexer.Token;
import com.parsetree.model.ParseResult;
import com.parsetree.model.Step;
import com.parsetree.model.TreeNode;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.stack.MutableStack;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Stacks;
import org.eclipse.collections.impl.tuple.Tuples;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Renders parse output either as console text or as JSON in the shape
 * external renderers consume.
 */
public class OutputFormatter {
    private static final String RESET = "\u001B[0m";
    private static final String BLUE = "\u001B[34m";
    private static final String GREEN = "\u001B[32m";
    private static final String GRAY = "\u001B[90m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";

    private final boolean prettyPrint;
    private final boolean colorOutput;
    // Tree nesting is bounded by the parser, not by the generator's default limit
    private final JsonFactory jsonFactory = new JsonFactoryBuilder()
        .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
        .build();

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter(boolean prettyPrint, boolean colorOutput) {
        this.prettyPrint = prettyPrint;
        this.colorOutput = colorOutput;
    }

    // ============================================================
    // Text
    // ============================================================

    /**
     * One node per line, indented two spaces per level: non-terminals as
     * {@code <E>}, terminals as {@code '3'}.
     */
    public String format(TreeNode tree) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0); // Clear the builder

        MutableStack<Pair<TreeNode, Integer>> pending = Stacks.mutable.with(Tuples.pair(tree, 0));
        while (pending.notEmpty()) {
            Pair<TreeNode, Integer> next = pending.pop();
            TreeNode node = next.getOne();
            int depth = next.getTwo();

            sb.append("  ".repeat(depth));
            if (node.isEpsilon()) {
                sb.append(colorize("'ε'", GRAY));
            } else if (node.terminal()) {
                sb.append(colorize("'" + node.label() + "'", GREEN));
            } else {
                sb.append(colorize("<" + node.label() + ">", BLUE));
            }
            sb.append('\n');

            node.children().reverseForEach(child -> pending.push(Tuples.pair(child, depth + 1)));
        }
        return sb.toString();
    }

    public String formatTokens(ListIterable<Token> tokens) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        for (Token token : tokens) {
            sb.append(String.format("%-8s", token.kind()));
            if (!token.isEof()) {
                sb.append(' ').append(colorize("'" + token.text() + "'", GREEN));
            }
            sb.append(colorize(" @" + token.position(), GRAY)).append('\n');
        }
        return sb.toString();
    }

    public String formatSteps(ListIterable<Step> steps) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            sb.append(i + 1).append(". ").append(step.description())
              .append(colorize(String.format(" [node %d, parent %s]",
                  step.nodeId(), step.isRoot() ? "-" : String.valueOf(step.parentId())), GRAY))
              .append('\n');
        }
        return sb.toString();
    }

    public String formatValidation(ValidationResult validation) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        sb.append(validation.valid() ? colorize("Grammar is valid", GREEN) : colorize("Grammar is invalid", RED))
          .append('\n');
        validation.errors().each(error -> sb.append(colorize("error: ", RED)).append(error).append('\n'));
        validation.warnings().each(warning -> sb.append(colorize("warning: ", YELLOW)).append(warning).append('\n'));
        return sb.toString();
    }

    public String formatError(String message) {
        return colorize("Error: ", RED) + message;
    }

    private String colorize(String text, String color) {
        return colorOutput ? color + text + RESET : text;
    }

    // ============================================================
    // JSON
    // ============================================================

    public String toJson(ParseResult result) {
        return writeJson(gen -> {
            gen.writeStartObject();
            gen.writeBooleanField("success", result.success());
            gen.writeFieldName("tree");
            if (result.tree() != null) {
                writeNode(gen, result.tree());
            } else {
                gen.writeNull();
            }
            gen.writeArrayFieldStart("steps");
            for (Step step : result.steps()) {
                writeStep(gen, step);
            }
            gen.writeEndArray();
            if (result.error() != null) {
                gen.writeStringField("error", result.error());
                gen.writeStringField("errorKind", result.errorKind().name());
            }
            gen.writeFieldName("tokens");
            writeTokens(gen, result.tokens());
            gen.writeEndObject();
        });
    }

    public String toJson(ValidationResult validation) {
        return writeJson(gen -> {
            gen.writeStartObject();
            gen.writeBooleanField("valid", validation.valid());
            gen.writeArrayFieldStart("errors");
            for (String error : validation.errors()) {
                gen.writeString(error);
            }
            gen.writeEndArray();
            gen.writeArrayFieldStart("warnings");
            for (String warning : validation.warnings()) {
                gen.writeString(warning);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        });
    }

    public String tokensToJson(ListIterable<Token> tokens) {
        return writeJson(gen -> writeTokens(gen, tokens));
    }

    private void writeNode(JsonGenerator gen, TreeNode root) throws IOException {
        MutableStack<OpenNode> open = Stacks.mutable.empty();
        open.push(startNode(gen, root));

        while (open.notEmpty()) {
            OpenNode current = open.peek();
            if (current.next < current.node.children().size()) {
                open.push(startNode(gen, current.node.children().get(current.next++)));
            } else {
                open.pop();
                gen.writeEndArray();
                gen.writeBooleanField("isTerminal", current.node.terminal());
                gen.writeEndObject();
            }
        }
    }

    private static OpenNode startNode(JsonGenerator gen, TreeNode node) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("id", node.id());
        gen.writeStringField("label", node.label());
        gen.writeArrayFieldStart("children");
        return new OpenNode(node);
    }

    // A node whose children array is still being written
    private static final class OpenNode {
        private final TreeNode node;
        private int next;

        OpenNode(TreeNode node) {
            this.node = node;
        }
    }

    private void writeStep(JsonGenerator gen, Step step) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("action", step.action().wireName());
        gen.writeStringField("description", step.description());
        gen.writeNumberField("nodeId", step.nodeId());
        gen.writeNumberField("parentId", step.parentId());
        gen.writeEndObject();
    }

    private void writeTokens(JsonGenerator gen, Iterable<Token> tokens) throws IOException {
        gen.writeStartArray();
        for (Token token : tokens) {
            gen.writeStartObject();
            gen.writeStringField("type", token.kind().name());
            gen.writeStringField("value", token.text());
            gen.writeNumberField("position", token.position());
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }

    private String writeJson(JsonWriter writer) {
        StringWriter out = new StringWriter();
        try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
            if (prettyPrint) {
                gen.useDefaultPrettyPrinter();
            }
            writer.write(gen);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON", e);
        }
        return out.toString();
    }

    @FunctionalInterface
    private interface JsonWriter {
        void write(JsonGenerator gen) throws IOException;
    }
}
