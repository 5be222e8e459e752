package org.sn.exprtree;

import java.util.HashMap;
import java.util.Map;
import org.sn.exprtree.annotations.NotNull;
import org.sn.exprtree.annotations.Nullable;


/**
 * The fixed set of binary operators.
 */
public enum Operator {
    PLUS("+", 1, Associativity.LEFT) {
        @Override
        public double apply(double left, double right) {
            return left + right;
        }
    },

    MINUS("-", 1, Associativity.LEFT) {
        @Override
        public double apply(double left, double right) {
            return left - right;
        }
    },

    TIMES("*", 2, Associativity.LEFT) {
        @Override
        public double apply(double left, double right) {
            return left * right;
        }
    },

    DIVIDE("/", 2, Associativity.LEFT) {
        @Override
        public double apply(double left, double right) {
            return left / right;
        }
    },

    /**
     * Exponentiation, where the left operand is the base.
     * 2 ^ 3 ^ 2 is 2 ^ (3 ^ 2).
     */
    POWER("^", 3, Associativity.RIGHT) {
        @Override
        public double apply(double left, double right) {
            return Math.pow(left, right);
        }
    };

    public enum Associativity {
        LEFT,
        RIGHT
    }

    private static final Map<String, Operator> BY_TOKEN = new HashMap<>();

    static {
        for (Operator operator : values()) {
            BY_TOKEN.put(operator.token, operator);
        }
    }

    private final @NotNull String token;
    private final int precedence;
    private final @NotNull Associativity associativity;

    Operator(String token, int precedence, Associativity associativity) {
        this.token = token;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    /**
     * Find the operator whose token is the given string.
     *
     * @return the operator, or null if token is not one of + - * / ^
     */
    public static @Nullable Operator fromToken(@Nullable String token) {
        return token == null ? null : BY_TOKEN.get(token);
    }

    public @NotNull String getToken() {
        return token;
    }

    /**
     * Return the precedence of this operator.
     *
     * @return the precedence, higher number means higher precedence (so TIMES has a higher number than PLUS)
     */
    public int getPrecedence() {
        return precedence;
    }

    public @NotNull Associativity getAssociativity() {
        return associativity;
    }

    /**
     * Combine two values using Java floating point arithmetic.
     * Division by zero gives an infinity or NaN, it is up to the caller to reject these.
     */
    public abstract double apply(double left, double right);

    @Override
    public String toString() {
        return token;
    }
}
