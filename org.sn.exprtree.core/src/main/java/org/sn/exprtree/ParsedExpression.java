package org.sn.exprtree;

import java.util.List;
import org.sn.exprtree.annotations.NotNull;


/**
 * A tree together with the notation it was written in.
 */
public final class ParsedExpression {
    private final @NotNull Notation notation;
    private final @NotNull ExpressionTree tree;

    ParsedExpression(@NotNull Notation notation, @NotNull ExpressionTree tree) {
        this.notation = notation;
        this.tree = tree;
    }

    public @NotNull Notation getNotation() {
        return notation;
    }

    public @NotNull ExpressionTree getTree() {
        return tree;
    }

    public @NotNull String toInfix() {
        return ExpressionTreeConverter.toInfix(tree);
    }

    public @NotNull List<String> toPostfix() {
        return ExpressionTreeConverter.toPostfix(tree);
    }

    public @NotNull List<String> toPrefix() {
        return ExpressionTreeConverter.toPrefix(tree);
    }

    /**
     * Evaluate with the default STRICT arithmetic policy.
     */
    public double evaluate() throws ExpressionTreeException {
        return ExpressionTreeEvaluator.DEFAULT_EVALUATOR.evaluate(tree);
    }

    @Override
    public String toString() {
        return notation.getDisplayName() + ": " + tree;
    }
}
