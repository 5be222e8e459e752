package org.sn.exprtree;

import java.util.List;
import java.util.Locale;
import org.sn.exprtree.annotations.NotNull;


/**
 * The order of operators relative to their operands.
 */
public enum Notation {
    /**
     * Operator between operands, as in 3 + 4.
     */
    INFIX("Infix"),

    /**
     * Operator before operands, as in + 3 4.
     */
    PREFIX("Prefix"),

    /**
     * Operator after operands, as in 3 4 +.
     */
    POSTFIX("Postfix");

    private final String displayName;

    Notation(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Guess the notation of an expression.
     * If the first token is an operator the expression is prefix, otherwise if the last token is an operator
     * the expression is postfix, otherwise it is infix.
     * A single operand is infix.
     *
     * <p>Tokens are not otherwise validated, so "+ 3 )" is reported as prefix and fails later.
     *
     * @throws ExpressionTreeException with kind EMPTY_EXPRESSION if there are no tokens
     */
    public static @NotNull Notation detect(@NotNull List<String> tokens) throws ExpressionTreeException {
        if (tokens.isEmpty()) {
            throw new ExpressionTreeException(ErrorKind.EMPTY_EXPRESSION, "Empty expression");
        }
        if (Tokens.isOperator(tokens.get(0))) {
            return PREFIX;
        } else if (Tokens.isOperator(tokens.get(tokens.size() - 1))) {
            return POSTFIX;
        } else {
            return INFIX;
        }
    }

    String lowerCaseName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
