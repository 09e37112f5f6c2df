package org.loxcore.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., NUMBER, PLUS, IDENTIFIER).
 * @param text The exact text of the token from the source code (the lexeme).
 * @param value The literal payload of the token, {@link LiteralValue#NONE} for tokens without one.
 * @param line The 1-based line on which the token starts.
 */
public record Token(
        TokenType type,
        String text,
        LiteralValue value,
        int line
) {

    @Override
    public String toString() {
        return type + " " + text + " " + value;
    }
}
