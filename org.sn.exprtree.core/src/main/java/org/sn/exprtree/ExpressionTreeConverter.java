package org.sn.exprtree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.sn.exprtree.ExpressionTree.Listener;
import org.sn.exprtree.ExpressionTree.OperatorPosition;
import org.sn.exprtree.annotations.NotNull;
import org.sn.exprtree.annotations.Nullable;


/**
 * Write a tree in infix, postfix or prefix notation.
 */
public final class ExpressionTreeConverter {
    private ExpressionTreeConverter() {
    }

    /**
     * Fully parenthesized infix, for example ((7 * 8) - (2 / 4)).
     * A single operand has no parentheses.
     *
     * @param tree the tree, or null
     * @return the infix string, or "" if tree is null
     */
    public static @NotNull String toInfix(@Nullable ExpressionTree tree) {
        if (tree == null) {
            return "";
        }
        var str = new StringBuilder();
        tree.reduce(new Listener<RuntimeException>() {
            @Override
            public OperatorPosition operatorPosition() {
                return OperatorPosition.OPERATOR_MIDDLE;
            }

            @Override
            public void startOperator(int nodeId, Operator operator) {
                str.append('(');
            }

            @Override
            public void acceptOperator(int nodeId, Operator operator) {
                str.append(' ').append(operator.getToken()).append(' ');
            }

            @Override
            public void endOperator(int nodeId, Operator operator) {
                str.append(')');
            }

            @Override
            public void acceptOperand(int nodeId, String value) {
                str.append(value);
            }
        });
        return str.toString();
    }

    /**
     * Postfix tokens, for example [7, 8, *, 2, 4, /, -].
     *
     * @param tree the tree, or null
     * @return the tokens, or an empty list if tree is null
     */
    public static @NotNull List<String> toPostfix(@Nullable ExpressionTree tree) {
        return collect(tree, OperatorPosition.OPERATOR_LAST);
    }

    /**
     * Prefix tokens, for example [-, *, 7, 8, /, 2, 4].
     *
     * @param tree the tree, or null
     * @return the tokens, or an empty list if tree is null
     */
    public static @NotNull List<String> toPrefix(@Nullable ExpressionTree tree) {
        return collect(tree, OperatorPosition.OPERATOR_FIRST);
    }

    private static List<String> collect(@Nullable ExpressionTree tree, OperatorPosition position) {
        if (tree == null) {
            return Collections.emptyList();
        }
        List<String> tokens = new ArrayList<>(tree.size());
        tree.reduce(new Listener<RuntimeException>() {
            @Override
            public OperatorPosition operatorPosition() {
                return position;
            }

            @Override
            public void acceptOperator(int nodeId, Operator operator) {
                tokens.add(operator.getToken());
            }

            @Override
            public void acceptOperand(int nodeId, String value) {
                tokens.add(value);
            }
        });
        return Collections.unmodifiableList(tokens);
    }
}
