package org.sn.exprtree;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.sn.exprtree.testutils.TestBase;


public class TokensTest extends TestBase {
    @ParameterizedTest
    @ValueSource(strings = {"+", "-", "*", "/", "^"})
    void testOperators(String token) {
        assertTrue(Tokens.isOperator(token));
        assertFalse(Tokens.isOperand(token));
    }

    @ParameterizedTest
    @ValueSource(strings = {"7", "42", "x", "abc", "x1", "1e3"})
    void testOperands(String token) {
        assertTrue(Tokens.isOperand(token));
        assertFalse(Tokens.isOperator(token));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "(", ")", "**", "3.5", "-3", "a_b", "%"})
    void testNeitherOperandNorOperator(String token) {
        assertFalse(Tokens.isOperand(token));
        assertFalse(Tokens.isOperator(token));
    }

    @Test
    void testOperatorProperties() {
        assertEquals(Operator.TIMES, Operator.fromToken("*"));
        assertNull(Operator.fromToken("%"));
        assertNull(Operator.fromToken(null));

        assertEquals(1, Operator.PLUS.getPrecedence());
        assertEquals(1, Operator.MINUS.getPrecedence());
        assertEquals(2, Operator.TIMES.getPrecedence());
        assertEquals(2, Operator.DIVIDE.getPrecedence());
        assertEquals(3, Operator.POWER.getPrecedence());
        assertEquals(Operator.Associativity.LEFT, Operator.DIVIDE.getAssociativity());
        assertEquals(Operator.Associativity.RIGHT, Operator.POWER.getAssociativity());

        assertEquals(8.0, Operator.POWER.apply(2, 3));
        assertEquals(-1.0, Operator.MINUS.apply(2, 3));
        assertEquals("^", Operator.POWER.toString());
    }

    @Test
    void testSplit() {
        assertThat(Tokens.split("  7 *\t8  - 2 / 4 "), contains("7", "*", "8", "-", "2", "/", "4"));
        assertThat(Tokens.split("3+4"), contains("3+4"));
        assertThat(Tokens.split("   "), empty());
        assertThat(Tokens.split(""), empty());
    }
}
