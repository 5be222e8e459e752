package org.sn.exprtree;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import org.sn.exprtree.annotations.NotNull;


/**
 * Classify tokens as operands or operators.
 */
public final class Tokens {
    public static final String OPEN_PARENTHESIS = "(";
    public static final String CLOSE_PARENTHESIS = ")";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Tokens() {
    }

    /**
     * Tell if the token is one of + - * / ^.
     */
    public static boolean isOperator(String token) {
        return Operator.fromToken(token) != null;
    }

    /**
     * Tell if the token is an operand, meaning that it is not empty and every character is a letter or digit.
     * Variable names like x are operands too, though they cannot be evaluated.
     */
    public static boolean isOperand(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        return token.codePoints().allMatch(Character::isLetterOrDigit);
    }

    /**
     * Split one line of input on whitespace.
     * Tokens must already be separated, so "3+4" is a single (invalid) token.
     *
     * @return the tokens, an empty list if the line is blank
     */
    public static @NotNull List<String> split(@NotNull String line) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(WHITESPACE.split(trimmed));
    }
}
