package org.loxcore.frontend.lexer;

/**
 * The literal payload a {@link Token} carries. Only {@link TokenType#STRING},
 * {@link TokenType#NUMBER}, {@link TokenType#TRUE} and {@link TokenType#FALSE}
 * tokens have a payload other than {@link None}.
 */
public sealed interface LiteralValue permits LiteralValue.Str, LiteralValue.Num, LiteralValue.Bool, LiteralValue.None {

    /** The shared instance for tokens without a literal. */
    LiteralValue NONE = new None();

    /**
     * A string literal.
     * @param value The text between the quotes.
     */
    record Str(String value) implements LiteralValue {
        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * A numeric literal.
     * @param value The parsed 64-bit float.
     */
    record Num(double value) implements LiteralValue {
        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * A boolean literal, produced by the {@code true} and {@code false} keywords.
     * @param value The boolean value.
     */
    record Bool(boolean value) implements LiteralValue {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * The absence of a literal. Also the value of the {@code nil} keyword in a literal expression.
     */
    record None() implements LiteralValue {
        @Override
        public String toString() {
            return "None";
        }
    }
}
