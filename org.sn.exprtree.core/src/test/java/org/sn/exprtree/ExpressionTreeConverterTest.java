package org.sn.exprtree;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.sn.exprtree.testutils.TestUtil.tokens;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.sn.exprtree.testutils.TestBase;


public class ExpressionTreeConverterTest extends TestBase {
    @Test
    void testConvert() throws ExpressionTreeException {
        ExpressionTree tree = ExpressionTreeBuilder.fromPostfix(tokens("7 8 * 2 4 / -"));
        assertEquals("((7 * 8) - (2 / 4))", ExpressionTreeConverter.toInfix(tree));
        assertThat(ExpressionTreeConverter.toPostfix(tree), contains("7", "8", "*", "2", "4", "/", "-"));
        assertThat(ExpressionTreeConverter.toPrefix(tree), contains("-", "*", "7", "8", "/", "2", "4"));
    }

    @Test
    void testConvertLeaf() throws ExpressionTreeException {
        ExpressionTree tree = ExpressionTreeBuilder.fromPostfix(tokens("abc"));
        assertEquals("abc", ExpressionTreeConverter.toInfix(tree));
        assertThat(ExpressionTreeConverter.toPostfix(tree), contains("abc"));
        assertThat(ExpressionTreeConverter.toPrefix(tree), contains("abc"));
    }

    @Test
    void testConvertNull() {
        assertEquals("", ExpressionTreeConverter.toInfix(null));
        assertThat(ExpressionTreeConverter.toPostfix(null), empty());
        assertThat(ExpressionTreeConverter.toPrefix(null), empty());
    }

    /**
     * Infix output is fully parenthesized, so converting it back gives the same tree whatever the precedence.
     */
    @Test
    void testInfixOutputParsesBackToSameTree() throws ExpressionTreeException {
        ExpressionTree tree = ExpressionTreeBuilder.fromPostfix(tokens("1 2 3 - - 4 5 ^ 6 ^ /"));
        String infix = ExpressionTreeConverter.toInfix(tree);
        assertEquals("((1 - (2 - 3)) / ((4 ^ 5) ^ 6))", infix);

        // the infix text has no spaces next to parentheses, so pad them before splitting
        List<String> infixTokens = tokens(infix.replace("(", "( ").replace(")", " )"));
        assertEquals(tree, ExpressionTreeBuilder.fromPostfix(InfixToPostfixConverter.infixToPostfix(infixTokens)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "7 8 * 2 4 / -",
        "x",
        "a b +",
        "1 2 3 4 5 + - * /",
        "2 3 2 ^ ^",
        "x x * y y * +",
    })
    void testPostfixRoundTrip(String postfix) throws ExpressionTreeException {
        ExpressionTree tree = ExpressionTreeBuilder.fromPostfix(tokens(postfix));
        List<String> output = ExpressionTreeConverter.toPostfix(tree);
        assertEquals(tokens(postfix), output);
        assertEquals(tree, ExpressionTreeBuilder.fromPostfix(output));
        assertEquals(tree, ExpressionTreeBuilder.fromPrefix(ExpressionTreeConverter.toPrefix(tree)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "- * 7 8 / 2 4",
        "y",
        "^ 2 ^ 3 2",
        "+ + + 1 2 3 4",
        "* - a b + a b",
    })
    void testPrefixRoundTrip(String prefix) throws ExpressionTreeException {
        ExpressionTree tree = ExpressionTreeBuilder.fromPrefix(tokens(prefix));
        List<String> output = ExpressionTreeConverter.toPrefix(tree);
        assertEquals(tokens(prefix), output);
        assertEquals(tree, ExpressionTreeBuilder.fromPrefix(output));
        assertEquals(tree, ExpressionTreeBuilder.fromPostfix(ExpressionTreeConverter.toPostfix(tree)));
    }
}
