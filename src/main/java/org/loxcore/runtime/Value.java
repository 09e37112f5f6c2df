package org.loxcore.runtime;

import java.math.BigDecimal;

/**
 * A dynamically-typed runtime value produced by the {@link Evaluator}.
 * Values have no identity; two values are the same when their variant and content match.
 */
public sealed interface Value permits Value.Str, Value.Num, Value.Bool, Value.Nil {

    /** The single {@code nil} value. */
    Value NIL = new Nil();

    /**
     * Returns the truthiness of this value. Only {@code nil} and {@code false} are falsy.
     *
     * @return {@code false} for {@code nil} and {@code false}, {@code true} for everything else.
     */
    default boolean isTruthy() {
        return true;
    }

    /**
     * Returns the name of this value's type as shown in diagnostics.
     *
     * @return The type name.
     */
    String typeName();

    /**
     * Returns the canonical text form of this value.
     *
     * @return The rendered value.
     */
    String render();

    /**
     * A string value.
     * @param value The text.
     */
    record Str(String value) implements Value {
        @Override public String typeName() { return "string"; }
        @Override public String render() { return value; }
        @Override public String toString() { return render(); }
    }

    /**
     * A 64-bit floating point number.
     * @param value The number.
     */
    record Num(double value) implements Value {
        @Override public String typeName() { return "number"; }
        @Override public String render() { return formatNumber(value); }
        @Override public String toString() { return render(); }
    }

    /**
     * A boolean value.
     * @param value The boolean.
     */
    record Bool(boolean value) implements Value {
        @Override public boolean isTruthy() { return value; }
        @Override public String typeName() { return "boolean"; }
        @Override public String render() { return Boolean.toString(value); }
        @Override public String toString() { return render(); }
    }

    /**
     * The absence of a value.
     */
    record Nil() implements Value {
        @Override public boolean isTruthy() { return false; }
        @Override public String typeName() { return "nil"; }
        @Override public String render() { return "nil"; }
        @Override public String toString() { return render(); }
    }

    /**
     * Formats a number as plain decimal text. Integral values have no fractional
     * part ({@code 3}, not {@code 3.0}); non-finite values use Java's names.
     *
     * @param number The number to format.
     * @return The decimal text.
     */
    static String formatNumber(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return Double.toString(number);
        }
        if (number == 0.0) {
            return (1.0 / number) < 0 ? "-0" : "0";
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }
}
