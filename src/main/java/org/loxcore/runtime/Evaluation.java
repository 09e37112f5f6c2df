package org.loxcore.runtime;

/**
 * The outcome of evaluating one expression tree: either a value or a runtime error.
 *
 * @param value The resulting value, {@code null} on failure.
 * @param error The runtime error, {@code null} on success.
 */
public record Evaluation(Value value, LoxRuntimeError error) {

    public Evaluation {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value and error must be set.");
        }
    }

    static Evaluation success(Value value) {
        return new Evaluation(value, null);
    }

    static Evaluation failure(LoxRuntimeError error) {
        return new Evaluation(null, error);
    }

    /**
     * @return {@code true} if evaluation produced a value.
     */
    public boolean isSuccess() {
        return error == null;
    }
}
