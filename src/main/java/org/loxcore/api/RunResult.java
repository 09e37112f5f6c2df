package org.loxcore.api;

import org.loxcore.diagnostics.Diagnostic;
import org.loxcore.runtime.Value;

import java.util.List;

/**
 * The outcome of running one input unit through the interpreter.
 *
 * @param status How far the input got through the pipeline.
 * @param value The resulting value when {@code status} is {@link Status#OK}, otherwise {@code null}.
 * @param diagnostics The diagnostics reported while running this input unit.
 */
public record RunResult(Status status, Value value, List<Diagnostic> diagnostics) {

    /**
     * The status of a run.
     */
    public enum Status {
        /** The expression was evaluated. */
        OK,
        /** Scanning or parsing failed; nothing was evaluated. */
        SYNTAX_ERROR,
        /** Evaluation stopped on an operand type mismatch. */
        RUNTIME_ERROR
    }

    public RunResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if the input was evaluated to a value.
     */
    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * Returns the canonical text of the value, as the caller should print it.
     *
     * @return The rendered value.
     * @throws IllegalStateException if the run did not produce a value.
     */
    public String render() {
        if (value == null) {
            throw new IllegalStateException("Run finished with " + status + ", there is no value to render.");
        }
        return value.render();
    }
}
