package org.loxcore.runtime;

import org.loxcore.frontend.lexer.Token;

/**
 * An error raised when an operator is applied to operands of the wrong type.
 * It carries the operator token so the diagnostic can name the source line.
 */
public class LoxRuntimeError extends RuntimeException {

    private final transient Token token;

    /**
     * Constructs a new runtime error.
     * @param token The operator token that failed.
     * @param message The detail message.
     */
    public LoxRuntimeError(Token token, String message) {
        super(message);
        this.token = token;
    }

    /**
     * Gets the operator token that failed.
     * @return The token.
     */
    public Token getToken() {
        return token;
    }
}
