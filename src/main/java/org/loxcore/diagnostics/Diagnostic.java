package org.loxcore.diagnostics;

/**
 * Represents a single diagnostic message reported while scanning, parsing
 * or evaluating one input unit.
 *
 * @param type The kind of error (syntax or runtime).
 * @param message The diagnostic message.
 * @param lineNumber The source line of the issue.
 * @param location An optional location qualifier such as {@code at '+'}, or {@code null}.
 */
public record Diagnostic(
        Type type,
        String message,
        int lineNumber,
        String location
) {
    /**
     * The kind of a diagnostic. The two kinds are disjoint.
     */
    public enum Type {
        /** The input could not be scanned or parsed. */
        SYNTAX,
        /** A well-formed expression could not be evaluated. */
        RUNTIME
    }

    @Override
    public String toString() {
        if (location == null) {
            return String.format("[line: %d] Error: %s", lineNumber, message);
        }
        return String.format("[line: %d] Error %s: %s", lineNumber, location, message);
    }
}
