package org.sn.exprtree;

import java.io.Serial;
import org.sn.exprtree.annotations.NotNull;
import org.sn.exprtree.annotations.Nullable;


/**
 * Thrown when a token sequence cannot be turned into a tree, or a tree cannot be evaluated.
 * The whole operation is abandoned, there are no partial results.
 */
public class ExpressionTreeException extends Exception {
    @Serial
    private static final long serialVersionUID = 1L;

    private final @NotNull ErrorKind kind;
    private final @Nullable String token;
    private final @Nullable Notation notation;

    ExpressionTreeException(@NotNull ErrorKind kind, String message, @Nullable String token, @Nullable Notation notation) {
        super(message);
        this.kind = kind;
        this.token = token;
        this.notation = notation;
    }

    ExpressionTreeException(@NotNull ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public @NotNull ErrorKind getKind() {
        return kind;
    }

    /**
     * The token that triggered the error, or null if the error is not about one token,
     * for example the expression had too many operands.
     */
    public @Nullable String getToken() {
        return token;
    }

    /**
     * The notation being parsed when the error happened, or null if the error happened during evaluation.
     */
    public @Nullable Notation getNotation() {
        return notation;
    }
}
