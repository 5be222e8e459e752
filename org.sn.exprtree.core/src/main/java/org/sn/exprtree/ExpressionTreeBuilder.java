package org.sn.exprtree;

import java.lang.System.Logger.Level;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import org.sn.exprtree.annotations.NotNull;


/**
 * Build an expression tree from postfix or prefix tokens, using a stack of subtrees.
 */
public final class ExpressionTreeBuilder {
    private static final System.Logger LOGGER = System.getLogger(ExpressionTreeBuilder.class.getName());

    private ExpressionTreeBuilder() {
    }

    /**
     * Build a tree from postfix tokens like [7, 8, *, 2, 4, /, -].
     * When an operator is read, the operand pushed last becomes its right child.
     *
     * @throws ExpressionTreeException with kind INVALID_TOKEN if a token is not an operand or operator,
     *                                 INSUFFICIENT_OPERANDS if an operator has fewer than two operands before it,
     *                                 MALFORMED_EXPRESSION if the tokens do not form exactly one tree
     */
    public static @NotNull ExpressionTree fromPostfix(@NotNull List<String> tokens) throws ExpressionTreeException {
        var helper = new Helper(Notation.POSTFIX);
        for (String token : tokens) {
            helper.accept(token);
        }
        return helper.finish();
    }

    /**
     * Build a tree from prefix tokens like [-, *, 7, 8, /, 2, 4].
     * Tokens are read from last to first, so when an operator is read the operand pushed last becomes its left child.
     *
     * @throws ExpressionTreeException with kind INVALID_TOKEN if a token is not an operand or operator,
     *                                 INSUFFICIENT_OPERANDS if an operator has fewer than two operands after it,
     *                                 MALFORMED_EXPRESSION if the tokens do not form exactly one tree
     */
    public static @NotNull ExpressionTree fromPrefix(@NotNull List<String> tokens) throws ExpressionTreeException {
        var helper = new Helper(Notation.PREFIX);
        for (ListIterator<String> iter = tokens.listIterator(tokens.size()); iter.hasPrevious(); ) {
            helper.accept(iter.previous());
        }
        return helper.finish();
    }

    private static class Helper {
        private final Notation notation;
        private final ExpressionTree.Builder builder = ExpressionTree.builder();
        private final Deque<Integer> stack = new ArrayDeque<>();

        private Helper(Notation notation) {
            this.notation = notation;
        }

        void accept(String token) throws ExpressionTreeException {
            Operator operator = Operator.fromToken(token);
            if (Tokens.isOperand(token)) {
                stack.push(builder.addLeaf(token));
            } else if (operator != null) {
                if (stack.size() < 2) {
                    throw new ExpressionTreeException(ErrorKind.INSUFFICIENT_OPERANDS,
                                                      "Invalid " + notation.lowerCaseName() + " expression. Not enough operands.",
                                                      token,
                                                      notation);
                }
                int first = stack.pop();
                int second = stack.pop();
                if (notation == Notation.POSTFIX) {
                    stack.push(builder.addOperator(operator, second, first));
                } else {
                    stack.push(builder.addOperator(operator, first, second));
                }
            } else {
                throw new ExpressionTreeException(ErrorKind.INVALID_TOKEN,
                                                  "Invalid token in " + notation.lowerCaseName() + " expression: " + token,
                                                  token,
                                                  notation);
            }
        }

        ExpressionTree finish() throws ExpressionTreeException {
            if (stack.size() != 1) {
                throw new ExpressionTreeException(ErrorKind.MALFORMED_EXPRESSION,
                                                  "Invalid " + notation.lowerCaseName() + " expression. Incorrect number of operands/operators.",
                                                  null,
                                                  notation);
            }
            ExpressionTree tree = builder.build(stack.pop());
            LOGGER.log(Level.DEBUG, () -> "Built tree of " + tree.size() + " nodes from " + notation.lowerCaseName() + " expression");
            return tree;
        }
    }
}
