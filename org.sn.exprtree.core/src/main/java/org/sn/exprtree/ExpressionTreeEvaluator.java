package org.sn.exprtree;

import java.lang.System.Logger.Level;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.regex.Pattern;
import org.sn.exprtree.ExpressionTree.Listener;
import org.sn.exprtree.ExpressionTree.OperatorPosition;
import org.sn.exprtree.annotations.NotNull;
import org.sn.exprtree.annotations.Nullable;


/**
 * Evaluate an expression tree to a double.
 * Instances are immutable and may be shared between threads.
 */
public final class ExpressionTreeEvaluator {
    private static final System.Logger LOGGER = System.getLogger(ExpressionTreeEvaluator.class.getName());

    /**
     * Digits, optionally followed by an exponent, as in 12 or 1e3.
     */
    private static final Pattern NUMBER = Pattern.compile("[0-9]+([eE][0-9]+)?");

    static final ExpressionTreeEvaluator DEFAULT_EVALUATOR = builder().build();

    public static Builder builder() {
        return new Builder();
    }

    private final @NotNull ArithmeticPolicy arithmeticPolicy;

    private ExpressionTreeEvaluator(ArithmeticPolicy arithmeticPolicy) {
        this.arithmeticPolicy = arithmeticPolicy;
    }

    public @NotNull ArithmeticPolicy getArithmeticPolicy() {
        return arithmeticPolicy;
    }

    /**
     * Evaluate a tree.
     *
     * @param tree the tree, or null
     * @return the value, or 0 if tree is null
     * @throws ExpressionTreeException with kind NON_NUMERIC_OPERAND if a leaf is a variable,
     *                                 CORRUPT_TREE if a node is neither an operand leaf nor an operator with two children,
     *                                 DIVISION_BY_ZERO, INVALID_POWER or UNDEFINED_RESULT under ArithmeticPolicy.STRICT
     */
    public double evaluate(@Nullable ExpressionTree tree) throws ExpressionTreeException {
        if (tree == null) {
            return 0;
        }

        Deque<Double> values = new ArrayDeque<>();
        tree.reduce(new Listener<ExpressionTreeException>() {
            @Override
            public OperatorPosition operatorPosition() {
                return OperatorPosition.OPERATOR_LAST;
            }

            @Override
            public void acceptOperator(int nodeId, Operator operator) throws ExpressionTreeException {
                double right = values.pop();
                double left = values.pop();
                double result = apply(operator, left, right);
                LOGGER.log(Level.TRACE, () -> left + " " + operator + " " + right + " = " + result);
                values.push(result);
            }

            @Override
            public void acceptOperand(int nodeId, String value) throws ExpressionTreeException {
                if (!tree.isLeaf(nodeId) || !Tokens.isOperand(value)) {
                    throw new ExpressionTreeException(ErrorKind.CORRUPT_TREE, "Invalid node in expression tree: " + value, value, null);
                }
                values.push(parseOperand(value));
            }
        });

        double result = values.pop();
        LOGGER.log(Level.DEBUG, () -> "Evaluated " + tree + " to " + result);
        return result;
    }

    private double apply(Operator operator, double left, double right) throws ExpressionTreeException {
        if (arithmeticPolicy == ArithmeticPolicy.STRICT && isDivisionByZero(operator, left, right)) {
            throw new ExpressionTreeException(ErrorKind.DIVISION_BY_ZERO, "Division by zero", operator.getToken(), null);
        }
        double result = operator.apply(left, right);
        if (arithmeticPolicy == ArithmeticPolicy.STRICT
                && Double.isNaN(result) && !Double.isNaN(left) && !Double.isNaN(right)) {
            ErrorKind kind = operator == Operator.POWER ? ErrorKind.INVALID_POWER : ErrorKind.UNDEFINED_RESULT;
            throw new ExpressionTreeException(kind,
                                              "No real result for " + left + " " + operator + " " + right,
                                              operator.getToken(),
                                              null);
        }
        return result;
    }

    /**
     * True for x / 0, and for 0 ^ y where y is negative, which is 1 / (0 ^ -y).
     */
    private static boolean isDivisionByZero(Operator operator, double left, double right) {
        return switch (operator) {
            case DIVIDE -> right == 0;
            case POWER -> left == 0 && right < 0;
            default -> false;
        };
    }

    private static double parseOperand(String value) throws ExpressionTreeException {
        if (!NUMBER.matcher(value).matches()) {
            throw new ExpressionTreeException(ErrorKind.NON_NUMERIC_OPERAND,
                                              "Cannot evaluate expression with variables: " + value,
                                              value,
                                              null);
        }
        return Double.parseDouble(value);
    }

    public static class Builder {
        private @NotNull ArithmeticPolicy arithmeticPolicy = ArithmeticPolicy.STRICT;

        private Builder() {
        }

        /**
         * Set what happens on division by zero or an exponentiation without a real result.
         * The default is STRICT.
         */
        public Builder setArithmeticPolicy(@NotNull ArithmeticPolicy arithmeticPolicy) {
            this.arithmeticPolicy = Objects.requireNonNull(arithmeticPolicy);
            return this;
        }

        public ExpressionTreeEvaluator build() {
            return new ExpressionTreeEvaluator(arithmeticPolicy);
        }
    }
}
