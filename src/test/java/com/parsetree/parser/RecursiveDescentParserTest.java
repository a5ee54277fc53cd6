package com.parsetree.parser;

import com.parsetree.grammar.Grammar;
import com.parsetree.grammar.GrammarCompiler;
import com.parsetree.lexer.Lexer;
import com.parsetree.lexer.Token;
import com.parsetree.model.ErrorKind;
import com.parsetree.model.ParseResult;
import com.parsetree.model.Step;
import com.parsetree.model.StepAction;
import com.parsetree.model.TreeNode;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class RecursiveDescentParserTest {

    // ============================================================
    // Test Infrastructure
    // ============================================================

    private RecursiveDescentParser parser(String grammarText) {
        return new RecursiveDescentParser(new GrammarCompiler().parse(grammarText));
    }

    private ParseResult parseDefault(String input) {
        return RecursiveDescentParser.withDefaultGrammar().parse(input, false);
    }

    private void assertFailure(ParseResult result, ErrorKind kind, String message) {
        assertFalse(result.success(), "Expected failure but parse succeeded");
        assertNull(result.tree());
        assertTrue(result.steps().isEmpty());
        assertEquals(kind, result.errorKind());
        assertEquals(message, result.error());
    }

    private long countLabel(TreeNode node, String label) {
        long own = node.label().equals(label) ? 1 : 0;
        return own + node.children().sumOfLong(child -> countLabel(child, label));
    }

    // ============================================================
    // Default arithmetic grammar
    // ============================================================

    @Test
    public void testSimpleExpression() {
        ParseResult result = parseDefault("3 + 5 * 2");

        assertTrue(result.success(), result.error());
        assertNull(result.error());
        assertEquals("E", result.tree().label());
        assertFalse(result.tree().terminal());
        assertEquals(Lists.immutable.of("3", "+", "5", "*", "2"), result.tree().frontier());
        assertEquals("NUMBER 3, PLUS, NUMBER 5, MULT, NUMBER 2, EOF",
            result.tokens().collect(Token::toString).makeString(", "));
        assertTrue(result.steps().isEmpty());
    }

    @Test
    public void testTreeShapeForSingleNumber() {
        TreeNode tree = parseDefault("5").tree();

        // E[T[F[5], T'[ε]], E'[ε]]
        assertEquals("E", tree.label());
        assertEquals(2, tree.children().size());
        TreeNode t = tree.children().get(0);
        TreeNode ePrime = tree.children().get(1);
        assertEquals("T", t.label());
        assertEquals("E'", ePrime.label());
        assertEquals("F", t.children().get(0).label());
        assertEquals("5", t.children().get(0).children().get(0).label());
        assertTrue(t.children().get(0).children().get(0).terminal());
        assertTrue(t.children().get(1).children().get(0).isEpsilon());
        assertTrue(ePrime.children().get(0).isEpsilon());
        assertEquals(2, countLabel(tree, "ε"));
        assertEquals(8, tree.size());
    }

    @Test
    public void testNumberTerminalShowsMatchedText() {
        TreeNode tree = parseDefault("42").tree();
        assertEquals(Lists.immutable.of("42"), tree.frontier());
        assertEquals(0, countLabel(tree, "number"));
    }

    @ParameterizedTest
    @CsvSource({
        "'(1 + 2) * 3', 7",
        "'((4))', 5",
        "'1 - 2 - 3', 5",
        "'8 / 4 / 2', 5",
        "'3.5 * (2 - 0.5)', 7",
        "'number + 1', 3"
    })
    public void testAcceptedExpressions(String input, int frontierSize) {
        ParseResult result = parseDefault(input);
        assertTrue(result.success(), result.error());
        assertEquals(frontierSize, result.tree().frontier().size());
    }

    @Test
    public void testNodeIdsAreUniqueAndIncreaseDownTheTree() {
        TreeNode tree = parseDefault("(1 + 2) * 3").tree();
        assertIdsIncrease(tree);
    }

    private void assertIdsIncrease(TreeNode node) {
        int previous = node.id();
        for (TreeNode child : node.children()) {
            assertTrue(child.id() > previous, "child " + child.id() + " not after " + previous);
            previous = child.id();
            assertIdsIncrease(child);
        }
    }

    // ============================================================
    // Failures
    // ============================================================

    @Test
    public void testMissingOperandAfterPlus() {
        ParseResult result = parseDefault("3 +");

        assertFailure(result, ErrorKind.TRAILING_INPUT,
            "Unexpected token '+' at position 2; furthest failure: expected '(' or 'number', got '' at position 3");
        assertEquals(3, result.tokens().size());
    }

    @Test
    public void testTrailingInput() {
        ParseResult result = parseDefault("3 3");

        assertFailure(result, ErrorKind.TRAILING_INPUT, "Unexpected token '3' at position 2");
        assertEquals("NUMBER 3, NUMBER 3, EOF", result.tokens().collect(Token::toString).makeString(", "));
    }

    @Test
    public void testEmptyInput() {
        ParseResult result = parseDefault("");
        assertFailure(result, ErrorKind.EXHAUSTED_ALTERNATIVES, "no matching production for E at position 0 (found '')");
        assertEquals(1, result.tokens().size());
    }

    @Test
    public void testUnknownCharacter() {
        ParseResult result = parseDefault("3 $ 4");
        assertFailure(result, ErrorKind.TRAILING_INPUT, "Unexpected token '$' at position 2");
    }

    @Test
    public void testUnclosedParenthesis() {
        ParseResult result = parseDefault("(1 + 2");
        assertFailure(result, ErrorKind.EXHAUSTED_ALTERNATIVES, "no matching production for E at position 0 (found '(')");
    }

    @Test
    public void testGrammarWithoutStartSymbol() {
        ParseResult result = parser("# empty").parse("3", true);

        assertFailure(result, ErrorKind.UNDEFINED_START_SYMBOL, "Grammar has no start symbol");
        assertEquals(2, result.tokens().size());
    }

    @Test
    public void testProductionWithoutAlternatives() {
        ParseResult result = parser("S -> a X\nX ->").parse("a", false);
        assertFailure(result, ErrorKind.EXHAUSTED_ALTERNATIVES, "no matching production for S at position 0 (found 'a')");
    }

    // ============================================================
    // Backtracking
    // ============================================================

    @Test
    public void testBacktrackingRestoresConsumedTokens() {
        ParseResult result = parser("S -> a b | a c").parse("a c", true);

        assertTrue(result.success(), result.error());
        assertEquals(Lists.immutable.of("a", "c"), result.tree().frontier());

        // the 'a' matched by the failed first alternative burned id 2 and left no step
        assertEquals(Lists.immutable.of(
            Step.expand(1, Step.NO_PARENT, "S"),
            Step.match(3, 1, "a"),
            Step.match(4, 1, "c")), result.steps());
        assertEquals(Lists.immutable.of(3, 4), result.tree().children().collect(TreeNode::id));
    }

    @Test
    public void testFirstMatchingAlternativeWins() {
        // "a" alone satisfies the first alternative, so the longer one is never tried
        ParseResult result = parser("S -> A | A b\nA -> a").parse("a b", false);
        assertFailure(result, ErrorKind.TRAILING_INPUT, "Unexpected token 'b' at position 2");

        result = parser("S -> A b | A\nA -> a").parse("a b", false);
        assertTrue(result.success(), result.error());
    }

    @Test
    public void testBacktrackingAcrossNestedNonTerminals() {
        Grammar grammar = new GrammarCompiler().parse(String.join("\n",
            "S -> X y | X z",
            "X -> x X | x"));
        ParseResult result = new RecursiveDescentParser(grammar).parse("x x x z", true);

        assertTrue(result.success(), result.error());
        assertEquals(Lists.immutable.of("x", "x", "x", "z"), result.tree().frontier());
    }

    @Test
    public void testLeftRecursionDoesNotRecurseForever() {
        RecursiveDescentParser parser = parser("S -> S a | b");

        ParseResult result = parser.parse("b", false);
        assertTrue(result.success(), result.error());
        assertEquals(TreeNode.nonTerminal(1, "S", Lists.immutable.of(TreeNode.terminal(2, "b"))), result.tree());

        result = parser.parse("b a", false);
        assertFailure(result, ErrorKind.TRAILING_INPUT, "Unexpected token 'a' at position 2");
    }

    @Test
    public void testPurelyLeftRecursiveGrammarFails() {
        ParseResult result = parser("S -> S a").parse("a", false);
        assertFailure(result, ErrorKind.EXHAUSTED_ALTERNATIVES, "no matching production for S at position 0 (found 'a')");
    }

    // ============================================================
    // Terminal matching
    // ============================================================

    @Test
    public void testCustomTerminalsMatchExactText() {
        RecursiveDescentParser parser = parser("S -> if x then y");

        assertTrue(parser.parse("if x then y", false).success());

        ParseResult result = parser.parse("IF x then y", false);
        assertFailure(result, ErrorKind.EXHAUSTED_ALTERNATIVES, "no matching production for S at position 0 (found 'IF')");
    }

    @Test
    public void testBuiltinNumberWinsOverHeadOfSameName() {
        ParseResult result = parser("S -> number\nnumber -> x").parse("7", false);

        assertTrue(result.success(), result.error());
        assertEquals(Lists.immutable.of("7"), result.tree().frontier());
    }

    @Test
    public void testUnmatchedTerminalMessage() {
        ParseResult result = parser("S -> ( a )").parse("( b )", false);
        // the mismatch on 'b' rolls the cursor back before S reports running out of alternatives
        assertFailure(result, ErrorKind.EXHAUSTED_ALTERNATIVES, "no matching production for S at position 0 (found '(')");
    }

    // ============================================================
    // Steps
    // ============================================================

    @Test
    public void testStepsForSingleTerminal() {
        ParseResult result = parser("F -> number").parse("2", true);

        assertTrue(result.success(), result.error());
        assertEquals(2, result.steps().size());

        Step first = result.steps().get(0);
        assertEquals(StepAction.ADD, first.action());
        assertEquals("Expand non-terminal <F>", first.description());
        assertEquals(Step.NO_PARENT, first.parentId());
        assertTrue(first.isRoot());

        Step second = result.steps().get(1);
        assertEquals("Match terminal '2'", second.description());
        assertEquals(result.tree().id(), second.parentId());
        assertEquals(first.nodeId(), second.parentId());
    }

    @Test
    public void testEpsilonStep() {
        ParseResult result = parser("S -> a R\nR -> b | ε").parse("a", true);

        assertTrue(result.success(), result.error());
        assertEquals(Lists.immutable.of(
            "Expand non-terminal <S>",
            "Match terminal 'a'",
            "Expand non-terminal <R>",
            "Match epsilon (empty string)"), result.steps().collect(Step::description));
    }

    @Test
    public void testStepNodeIdsStrictlyIncrease() {
        ParseResult result = RecursiveDescentParser.withDefaultGrammar().parse("(1 + 2) * 3 - 4", true);

        assertTrue(result.success(), result.error());
        assertEquals(result.tree().size(), result.steps().size());
        for (int i = 1; i < result.steps().size(); i++) {
            assertTrue(result.steps().get(i).nodeId() > result.steps().get(i - 1).nodeId());
        }
    }

    @Test
    public void testParsingIsDeterministic() {
        RecursiveDescentParser parser = RecursiveDescentParser.withDefaultGrammar();
        assertEquals(parser.parse("3 + 5 * (2 - 1)", true), parser.parse("3 + 5 * (2 - 1)", true));
    }

    @Test
    public void testRecordingDoesNotChangeTree() {
        RecursiveDescentParser parser = RecursiveDescentParser.withDefaultGrammar();
        assertEquals(parser.parse("1 * 2 + 3", false).tree(), parser.parse("1 * 2 + 3", true).tree());
    }

    // ============================================================
    // Nesting depth
    // ============================================================

    private static String sumOf(int terms) {
        return "1" + " + 1".repeat(terms - 1);
    }

    @Test
    public void testLongSumWithinDepthParses() {
        ParseResult result = parseDefault(sumOf(300));

        assertTrue(result.success(), result.error());
        assertEquals(599, result.tree().frontier().size());
    }

    @Test
    public void testVeryLongSumFailsWithRecursionLimit() {
        ParseResult result = RecursiveDescentParser.withDefaultGrammar().parse(sumOf(5000), true);

        assertFalse(result.success());
        assertNull(result.tree());
        assertTrue(result.steps().isEmpty());
        assertEquals(ErrorKind.RECURSION_LIMIT, result.errorKind());
        assertEquals(10000, result.tokens().size());
    }

    @Test
    public void testRecursionLimitIsNotBacktracked() {
        Grammar grammar = new GrammarCompiler().parse(GrammarCompiler.defaultGrammar());
        RecursiveDescentParser shallow = new RecursiveDescentParser(grammar, new Lexer(), 3);

        assertTrue(shallow.parse("1", false).success());

        // E' -> + T E' needs F at depth 4; the ε alternative of E' must not be tried instead
        ParseResult result = shallow.parse("1 + 1 + 1", false);
        assertFailure(result, ErrorKind.RECURSION_LIMIT, "expansion of F exceeds depth 3 at position 4");
    }

    @Test
    public void testMaxDepthMustBePositive() {
        Grammar grammar = new GrammarCompiler().parse("S -> a");
        assertThrows(IllegalArgumentException.class, () -> new RecursiveDescentParser(grammar, new Lexer(), 0));
    }

    // ============================================================
    // Positions
    // ============================================================

    @Test
    public void testErrorPositionsAreByteOffsets() {
        ParseResult result = parser("S -> ü").parse("ü 3", false);
        assertFailure(result, ErrorKind.TRAILING_INPUT, "Unexpected token '3' at position 3");

        // é is two bytes, so 'a' starts at 3 and ü at 5
        result = parser("S -> é a b | é a").parse("é a ü", false);
        assertFailure(result, ErrorKind.TRAILING_INPUT, "Unexpected token 'ü' at position 5");
    }
}
