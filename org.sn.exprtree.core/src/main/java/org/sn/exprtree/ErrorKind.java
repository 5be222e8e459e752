package org.sn.exprtree;


/**
 * The reason an expression could not be parsed, built or evaluated.
 */
public enum ErrorKind {
    /**
     * There are no tokens at all.
     */
    EMPTY_EXPRESSION,

    /**
     * A token is neither an operand nor an operator (nor a parenthesis, in infix).
     */
    INVALID_TOKEN,

    /**
     * A close parenthesis has no matching open parenthesis, or the other way around.
     */
    UNBALANCED_PARENTHESES,

    /**
     * An operator was read when fewer than two operands were pending.
     */
    INSUFFICIENT_OPERANDS,

    /**
     * The expression did not reduce to exactly one tree.
     */
    MALFORMED_EXPRESSION,

    /**
     * A leaf being evaluated is a variable name rather than a number.
     */
    NON_NUMERIC_OPERAND,

    /**
     * A node is neither an operand leaf nor a complete operator node.
     */
    CORRUPT_TREE,

    /**
     * The right side of a division evaluated to zero, or zero was raised to a negative power, under {@link ArithmeticPolicy#STRICT}.
     */
    DIVISION_BY_ZERO,

    /**
     * An exponentiation has no real result, for example a negative base with a fractional exponent,
     * under {@link ArithmeticPolicy#STRICT}.
     */
    INVALID_POWER,

    /**
     * An operation other than exponentiation gives NaN from operands that are not NaN,
     * as in an overflowed Infinity minus itself, under {@link ArithmeticPolicy#STRICT}.
     */
    UNDEFINED_RESULT
}
