package org.sn.exprtree;

import java.lang.System.Logger.Level;
import java.util.List;
import org.sn.exprtree.annotations.NotNull;


/**
 * Detect the notation of a token sequence and build its tree.
 * Infix input goes through the shunting-yard conversion first.
 */
public final class ExpressionPipeline {
    private static final System.Logger LOGGER = System.getLogger(ExpressionPipeline.class.getName());

    private ExpressionPipeline() {
    }

    /**
     * Parse one line of whitespace separated tokens.
     *
     * @see #parse(List)
     */
    public static @NotNull ParsedExpression parse(@NotNull String line) throws ExpressionTreeException {
        return parse(Tokens.split(line));
    }

    /**
     * Parse tokens in infix, prefix or postfix notation.
     *
     * @throws ExpressionTreeException if the tokens are empty or do not form a valid expression in the detected notation
     */
    public static @NotNull ParsedExpression parse(@NotNull List<String> tokens) throws ExpressionTreeException {
        Notation notation = Notation.detect(tokens);
        LOGGER.log(Level.DEBUG, "Detected {0} notation for {1}", notation, tokens);
        ExpressionTree tree = switch (notation) {
            case INFIX -> ExpressionTreeBuilder.fromPostfix(InfixToPostfixConverter.infixToPostfix(tokens));
            case PREFIX -> ExpressionTreeBuilder.fromPrefix(tokens);
            case POSTFIX -> ExpressionTreeBuilder.fromPostfix(tokens);
        };
        return new ParsedExpression(notation, tree);
    }
}
