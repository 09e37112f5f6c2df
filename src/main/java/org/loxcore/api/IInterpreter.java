package org.loxcore.api;

/**
 * Defines the interface a driver (file runner or REPL) uses to run source text.
 * <p>
 * A driver runs each input unit with {@link #run(String)}, calls {@link #endInputUnit()}
 * between independent REPL lines, and reads {@link #hasRuntimeErrors()} once at the end
 * of a file run to pick an exit status.
 */
public interface IInterpreter {

    /**
     * Scans, parses and, if no syntax error was reported, evaluates one input unit.
     *
     * @param source The source text of one file or one REPL line.
     * @return The outcome of the run.
     */
    RunResult run(String source);

    /**
     * Marks the end of an independent input unit. Clears the syntax error state so the
     * next unit is not blocked by an earlier one.
     */
    void endInputUnit();

    /**
     * @return {@code true} if a syntax error is pending for the current input unit.
     */
    boolean hasSyntaxErrors();

    /**
     * @return {@code true} if any runtime error was reported during this run.
     */
    boolean hasRuntimeErrors();
}
