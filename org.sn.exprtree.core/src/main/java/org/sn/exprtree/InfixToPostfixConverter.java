package org.sn.exprtree;

import java.lang.System.Logger.Level;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.sn.exprtree.annotations.NotNull;


/**
 * Convert an infix token sequence to postfix with the shunting-yard algorithm.
 * The postfix output rebuilds into a tree with the same precedence and associativity as the infix input.
 */
public final class InfixToPostfixConverter {
    private static final System.Logger LOGGER = System.getLogger(InfixToPostfixConverter.class.getName());

    private InfixToPostfixConverter() {
    }

    /**
     * Convert infix tokens like [7, *, 8, -, 2, /, 4] to postfix tokens like [7, 8, *, 2, 4, /, -].
     *
     * @param tokens the infix tokens, which may include ( and )
     * @return the postfix tokens, which never contain parentheses
     * @throws ExpressionTreeException with kind EMPTY_EXPRESSION if there are no tokens,
     *                                 UNBALANCED_PARENTHESES if parentheses do not match,
     *                                 INVALID_TOKEN if a token is not an operand, operator or parenthesis
     */
    public static @NotNull List<String> infixToPostfix(@NotNull List<String> tokens) throws ExpressionTreeException {
        if (tokens.isEmpty()) {
            throw new ExpressionTreeException(ErrorKind.EMPTY_EXPRESSION, "Empty expression", null, Notation.INFIX);
        }

        List<String> output = new ArrayList<>(tokens.size());
        Deque<String> stack = new ArrayDeque<>();
        for (String token : tokens) {
            Operator operator = Operator.fromToken(token);
            if (Tokens.isOperand(token)) {
                output.add(token);
            } else if (operator != null) {
                while (!stack.isEmpty() && !stack.peek().equals(Tokens.OPEN_PARENTHESIS)
                        && shouldPopBefore(operator, Operator.fromToken(stack.peek()))) {
                    output.add(stack.pop());
                }
                stack.push(token);
            } else if (token.equals(Tokens.OPEN_PARENTHESIS)) {
                stack.push(token);
            } else if (token.equals(Tokens.CLOSE_PARENTHESIS)) {
                while (!stack.isEmpty() && !stack.peek().equals(Tokens.OPEN_PARENTHESIS)) {
                    output.add(stack.pop());
                }
                if (stack.isEmpty()) {
                    throw unbalanced(token); // handles case: 3 + 4 )
                }
                stack.pop();
            } else {
                throw new ExpressionTreeException(ErrorKind.INVALID_TOKEN,
                                                  "Invalid token in infix expression: " + token,
                                                  token,
                                                  Notation.INFIX);
            }
        }

        while (!stack.isEmpty()) {
            String token = stack.pop();
            if (token.equals(Tokens.OPEN_PARENTHESIS)) {
                throw unbalanced(token); // handles case: ( 3 + 4
            }
            output.add(token);
        }

        LOGGER.log(Level.TRACE, () -> "Converted infix " + tokens + " to postfix " + output);
        return output;
    }

    /**
     * Tell if the operator on top of the stack should be output before pushing the operator just read.
     * This is the case if the one on top binds tighter, or binds the same and the new one is left associative,
     * so that 1 - 2 - 3 becomes 1 2 - 3 - but 2 ^ 3 ^ 2 becomes 2 3 2 ^ ^.
     */
    private static boolean shouldPopBefore(Operator operator, Operator top) {
        return operator.getPrecedence() < top.getPrecedence()
                || (operator.getPrecedence() == top.getPrecedence() && operator.getAssociativity() == Operator.Associativity.LEFT);
    }

    private static ExpressionTreeException unbalanced(String token) {
        return new ExpressionTreeException(ErrorKind.UNBALANCED_PARENTHESES,
                                           "Unbalanced parentheses in infix expression",
                                           token,
                                           Notation.INFIX);
    }
}
