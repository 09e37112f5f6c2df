package org.loxcore;

import com.typesafe.config.Config;
import org.loxcore.api.IInterpreter;
import org.loxcore.api.RunResult;
import org.loxcore.config.InterpreterOptions;
import org.loxcore.config.LoggingConfigurator;
import org.loxcore.diagnostics.Diagnostic;
import org.loxcore.diagnostics.DiagnosticsEngine;
import org.loxcore.frontend.lexer.Lexer;
import org.loxcore.frontend.lexer.Token;
import org.loxcore.frontend.parser.Parser;
import org.loxcore.frontend.parser.ast.AstNode;
import org.loxcore.runtime.Evaluation;
import org.loxcore.runtime.Evaluator;
import org.loxcore.util.AstPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * The main interpreter implementation. This class orchestrates the pipeline
 * from source text to a runtime value for one run (one file, or one REPL session).
 * <p>
 * All error state lives in the instance's {@link DiagnosticsEngine}, so separate
 * interpreters never interfere. An instance is not thread-safe.
 */
public class Interpreter implements IInterpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final DiagnosticsEngine diagnostics;
    private final InterpreterOptions options;
    private final Evaluator evaluator = new Evaluator();

    /**
     * Creates an interpreter with default options, printing diagnostics to {@code System.err}.
     */
    public Interpreter() {
        this(InterpreterOptions.defaults());
    }

    /**
     * Creates an interpreter with the given options.
     * @param options The interpreter options.
     */
    public Interpreter(InterpreterOptions options) {
        this(options, options.printDiagnostics() ? new DiagnosticsEngine() : new DiagnosticsEngine(null));
    }

    /**
     * Creates an interpreter reporting to an explicit diagnostics engine.
     * @param options The interpreter options.
     * @param diagnostics The run context that collects and prints diagnostics.
     */
    public Interpreter(InterpreterOptions options, DiagnosticsEngine diagnostics) {
        this.options = options;
        this.diagnostics = diagnostics;
    }

    /**
     * Creates an interpreter from configuration and applies its logging settings.
     * @param config The configuration, typically from {@link org.loxcore.config.ConfigLoader#load()}.
     * @return A new interpreter.
     */
    public static Interpreter create(Config config) {
        LoggingConfigurator.configure(config);
        return new Interpreter(InterpreterOptions.fromConfig(config));
    }

    @Override
    public RunResult run(String source) {
        int reportedBefore = diagnostics.getDiagnostics().size();

        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();

        // Phase 2: Parsing
        Optional<AstNode> expression = new Parser(tokens, diagnostics, options.maxNestingDepth()).parse();
        if (diagnostics.hasSyntaxErrors() || expression.isEmpty()) {
            LOG.debug("Skipping evaluation, syntax errors were reported.");
            return new RunResult(RunResult.Status.SYNTAX_ERROR, null, reportedSince(reportedBefore));
        }
        if (LOG.isTraceEnabled()) {
            LOG.trace("AST: {}", AstPrinter.print(expression.get()));
        }

        // Phase 3: Evaluation
        Evaluation evaluation = evaluator.evaluate(expression.get());
        if (!evaluation.isSuccess()) {
            diagnostics.reportRuntimeError(evaluation.error());
            return new RunResult(RunResult.Status.RUNTIME_ERROR, null, reportedSince(reportedBefore));
        }
        return new RunResult(RunResult.Status.OK, evaluation.value(), reportedSince(reportedBefore));
    }

    private List<Diagnostic> reportedSince(int index) {
        List<Diagnostic> all = diagnostics.getDiagnostics();
        return all.subList(index, all.size());
    }

    /**
     * {@inheritDoc}
     * <p>
     * The diagnostics of the finished unit were already handed out in its {@link RunResult}
     * and are dropped from the engine. The runtime error state is kept.
     */
    @Override
    public void endInputUnit() {
        diagnostics.clearSyntaxErrors();
        diagnostics.clearHistory();
    }

    @Override
    public boolean hasSyntaxErrors() {
        return diagnostics.hasSyntaxErrors();
    }

    @Override
    public boolean hasRuntimeErrors() {
        return diagnostics.hasRuntimeErrors();
    }

    /**
     * @return The diagnostics engine of this run.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
