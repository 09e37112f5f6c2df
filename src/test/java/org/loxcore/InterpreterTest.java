package org.loxcore;

import com.typesafe.config.ConfigFactory;
import org.loxcore.api.RunResult;
import org.loxcore.config.InterpreterOptions;
import org.loxcore.config.LoggingConfigurator;
import org.loxcore.diagnostics.Diagnostic;
import org.loxcore.diagnostics.DiagnosticsEngine;
import org.loxcore.runtime.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the full pipeline through the {@link Interpreter} facade: text in,
 * rendered value or diagnostics out, with REPL-style resets between input units.
 */
@Tag("unit")
class InterpreterTest {

    private final ByteArrayOutputStream errors = new ByteArrayOutputStream();
    private final Interpreter interpreter = new Interpreter(InterpreterOptions.defaults(),
            new DiagnosticsEngine(new PrintStream(errors, true, StandardCharsets.UTF_8)));

    @Test
    void run_evaluatesAndRenders() {
        // When
        RunResult result = interpreter.run("(1 + 2) * 3");

        // Then
        assertThat(result.status()).isEqualTo(RunResult.Status.OK);
        assertThat(result.value()).isEqualTo(new Value.Num(9));
        assertThat(result.render()).isEqualTo("9");
        assertThat(result.diagnostics()).isEmpty();
        assertThat(errors.size()).isZero();
    }

    @Test
    void run_rendersEveryValueType() {
        assertThat(interpreter.run("\"a\" + \"b\"").render()).isEqualTo("ab");
        assertThat(interpreter.run("1 == 1.0").render()).isEqualTo("true");
        assertThat(interpreter.run("nil").render()).isEqualTo("nil");
        assertThat(interpreter.run("10 / 4").render()).isEqualTo("2.5");
    }

    /**
     * Verifies that a syntax error skips evaluation and is printed to the error channel.
     */
    @Test
    void run_syntaxErrorSkipsEvaluation() {
        RunResult result = interpreter.run("1 + ");

        assertThat(result.status()).isEqualTo(RunResult.Status.SYNTAX_ERROR);
        assertThat(result.value()).isNull();
        assertThat(result.diagnostics()).singleElement()
                .extracting(Diagnostic::type).isEqualTo(Diagnostic.Type.SYNTAX);
        assertThat(interpreter.hasSyntaxErrors()).isTrue();
        assertThat(interpreter.hasRuntimeErrors()).isFalse();
        assertThat(errors.toString(StandardCharsets.UTF_8))
                .isEqualTo("[line: 1] Error at end of input: Expect expression." + System.lineSeparator());
        assertThatThrownBy(result::render).isInstanceOf(IllegalStateException.class);
    }

    /**
     * Verifies that a scan error alone is enough to skip evaluation, even though parsing succeeds.
     */
    @Test
    void run_scanErrorSkipsEvaluation() {
        RunResult result = interpreter.run("1 @ + 2");

        assertThat(result.status()).isEqualTo(RunResult.Status.SYNTAX_ERROR);
        assertThat(result.diagnostics()).extracting(Diagnostic::message).containsExactly("Unexpected character '@'.");
    }

    @Test
    void run_unterminatedStringReportsOnce() {
        RunResult result = interpreter.run("\"abc");

        assertThat(result.status()).isEqualTo(RunResult.Status.SYNTAX_ERROR);
        assertThat(result.diagnostics()).hasSize(1);
    }

    @Test
    void run_runtimeErrorIsReported() {
        RunResult result = interpreter.run("-\"abc\"");

        assertThat(result.status()).isEqualTo(RunResult.Status.RUNTIME_ERROR);
        assertThat(interpreter.hasRuntimeErrors()).isTrue();
        assertThat(errors.toString(StandardCharsets.UTF_8))
                .isEqualTo("[line: 1] Error: Operand 'abc' must be a number to apply '-' operator." + System.lineSeparator());
    }

    /**
     * Verifies that after a syntax error on one REPL line, the next line is evaluated normally.
     */
    @Test
    void run_nextInputUnitDoesNotSeeStaleSyntaxError() {
        RunResult first = interpreter.run("(1");
        interpreter.endInputUnit();
        RunResult second = interpreter.run("1 + 1");

        assertThat(first.status()).isEqualTo(RunResult.Status.SYNTAX_ERROR);
        assertThat(second.status()).isEqualTo(RunResult.Status.OK);
        assertThat(second.render()).isEqualTo("2");
        assertThat(second.diagnostics()).isEmpty();
        assertThat(interpreter.hasSyntaxErrors()).isFalse();
    }

    /**
     * Verifies that the runtime error state survives input-unit resets for the rest of the run.
     */
    @Test
    void run_runtimeErrorPersistsAcrossInputUnits() {
        interpreter.run("true * 2");
        interpreter.endInputUnit();
        RunResult next = interpreter.run("2 * 2");

        assertThat(next.isOk()).isTrue();
        assertThat(interpreter.hasRuntimeErrors()).isTrue();
    }

    @Test
    void run_separateInterpretersAreIsolated() {
        Interpreter other = new Interpreter(InterpreterOptions.defaults(), new DiagnosticsEngine(null));

        interpreter.run(")");

        assertThat(other.run("1").isOk()).isTrue();
        assertThat(other.hasSyntaxErrors()).isFalse();
    }

    @Test
    void run_honorsNestingLimit() {
        Interpreter shallow = new Interpreter(new InterpreterOptions(2, false));

        assertThat(shallow.run("((1))").isOk()).isTrue();
        RunResult tooDeep = shallow.run("(((1)))");
        assertThat(tooDeep.status()).isEqualTo(RunResult.Status.SYNTAX_ERROR);
        assertThat(tooDeep.diagnostics()).extracting(Diagnostic::message).containsExactly("Expression nested too deeply.");
    }

    @Test
    void create_readsOptionsFromConfig() {
        LoggingConfigurator.reset();
        try {
            Interpreter configured = Interpreter.create(ConfigFactory.parseString("""
                    loxcore {
                      parser.max-nesting-depth = 1
                      diagnostics.print-to-stderr = false
                    }
                    """));

            assertThat(configured.run("(1)").isOk()).isTrue();
            assertThat(configured.run("((1))").status()).isEqualTo(RunResult.Status.SYNTAX_ERROR);
        } finally {
            LoggingConfigurator.reset();
        }
    }

    /**
     * Verifies that a long left-associative chain is evaluated without exhausting the stack.
     */
    @Test
    void run_longOperatorChainEvaluates() {
        RunResult result = interpreter.run("1" + " + 1".repeat(20_000));

        assertThat(result.status()).isEqualTo(RunResult.Status.OK);
        assertThat(result.render()).isEqualTo("20001");
    }

    @Test
    void run_longOperatorChainReportsRuntimeError() {
        RunResult result = interpreter.run("1" + " * 1".repeat(20_000) + " - nil");

        assertThat(result.status()).isEqualTo(RunResult.Status.RUNTIME_ERROR);
        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .containsExactly("Operands '1' and 'nil' must both be numbers to apply '-' operator.");
    }

    /**
     * Verifies that ending an input unit drops its diagnostics from the engine but keeps the runtime state.
     */
    @Test
    void endInputUnit_discardsFinishedDiagnostics() {
        interpreter.run("-nil");
        interpreter.run("(");
        assertThat(interpreter.getDiagnostics().getDiagnostics()).hasSize(2);

        interpreter.endInputUnit();

        assertThat(interpreter.getDiagnostics().getDiagnostics()).isEmpty();
        assertThat(interpreter.hasRuntimeErrors()).isTrue();
        assertThat(interpreter.run("1 +").diagnostics()).hasSize(1);
    }
}
