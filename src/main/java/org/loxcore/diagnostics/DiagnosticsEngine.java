package org.loxcore.diagnostics;

import org.loxcore.frontend.lexer.Token;
import org.loxcore.frontend.lexer.TokenType;
import org.loxcore.runtime.LoxRuntimeError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the diagnostics of one top-level run (one file run,
 * or one REPL session).
 * <p>
 * This decouples error reporting from the lexer, parser and evaluator. Each engine
 * is independent, so separate runs never see each other's errors. Every report is
 * echoed to the error channel as soon as it is made. It is not thread-safe.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final PrintStream errorChannel;
    private boolean syntaxError = false;
    private boolean runtimeError = false;

    /**
     * Creates an engine that prints diagnostics to {@link System#err}.
     */
    public DiagnosticsEngine() {
        this(System.err);
    }

    /**
     * Creates an engine with an explicit error channel.
     *
     * @param errorChannel Where reports are printed, or {@code null} to only collect them.
     */
    public DiagnosticsEngine(PrintStream errorChannel) {
        this.errorChannel = errorChannel;
    }

    /**
     * Reports a syntax error without a location qualifier. Used by the lexer.
     *
     * @param lineNumber The line number of the error.
     * @param message    The error message.
     */
    public void reportSyntaxError(int lineNumber, String message) {
        reportSyntaxError(lineNumber, null, message);
    }

    /**
     * Reports a syntax error.
     *
     * @param lineNumber The line number of the error.
     * @param location   A location qualifier such as {@code at 'x'}, or {@code null}.
     * @param message    The error message.
     */
    public void reportSyntaxError(int lineNumber, String location, String message) {
        syntaxError = true;
        add(new Diagnostic(Diagnostic.Type.SYNTAX, message, lineNumber, location));
    }

    /**
     * Reports a syntax error at the given token. The location reads
     * {@code at end of input} for {@link TokenType#EOF}, otherwise {@code at '<lexeme>'}.
     *
     * @param token   The offending token.
     * @param message The error message.
     */
    public void reportSyntaxError(Token token, String message) {
        if (token.type() == TokenType.EOF) {
            reportSyntaxError(token.line(), "at end of input", message);
        } else {
            reportSyntaxError(token.line(), "at '" + token.text() + "'", message);
        }
    }

    /**
     * Reports a runtime error raised while evaluating an expression.
     *
     * @param error The runtime error, carrying the operator token.
     */
    public void reportRuntimeError(LoxRuntimeError error) {
        runtimeError = true;
        add(new Diagnostic(Diagnostic.Type.RUNTIME, error.getMessage(), error.getToken().line(), null));
    }

    private void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        LOG.debug("Reported {} diagnostic: {}", diagnostic.type(), diagnostic);
        if (errorChannel != null) {
            errorChannel.println(diagnostic);
        }
    }

    /**
     * Checks if a syntax error has been reported since the last {@link #clearSyntaxErrors()}.
     *
     * @return {@code true} if evaluation of the current input unit must be skipped.
     */
    public boolean hasSyntaxErrors() {
        return syntaxError;
    }

    /**
     * Checks if a runtime error has been reported during this run.
     *
     * @return {@code true} if at least one runtime error was reported.
     */
    public boolean hasRuntimeErrors() {
        return runtimeError;
    }

    /**
     * Clears the syntax error state before the next independent input unit.
     * The runtime error state and the collected diagnostics are kept.
     */
    public void clearSyntaxErrors() {
        syntaxError = false;
    }

    /**
     * Discards the collected diagnostics so a long REPL session does not retain
     * every report. The syntax and runtime error states are kept.
     */
    public void clearHistory() {
        diagnostics.clear();
    }

    /**
     * Returns an unmodifiable view of the diagnostics collected since the last {@link #clearHistory()}.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
