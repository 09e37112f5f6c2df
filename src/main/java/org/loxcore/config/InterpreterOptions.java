package org.loxcore.config;

import com.typesafe.config.Config;
import org.loxcore.frontend.parser.Parser;

/**
 * Settings of an {@link org.loxcore.Interpreter}, read from the {@code loxcore} block:
 * <pre>
 * loxcore {
 *   parser.max-nesting-depth = 200
 *   diagnostics.print-to-stderr = true
 * }
 * </pre>
 *
 * @param maxNestingDepth How deep groupings and unary operators may nest before parsing fails.
 * @param printDiagnostics Whether diagnostics are printed to {@code System.err} as they are reported.
 */
public record InterpreterOptions(int maxNestingDepth, boolean printDiagnostics) {

    private static final String ROOT = "loxcore";
    private static final String MAX_NESTING_DEPTH_KEY = "parser.max-nesting-depth";
    private static final String PRINT_DIAGNOSTICS_KEY = "diagnostics.print-to-stderr";

    public InterpreterOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("max-nesting-depth must be at least 1, got " + maxNestingDepth);
        }
    }

    /**
     * @return The built-in defaults, matching {@code reference.conf}.
     */
    public static InterpreterOptions defaults() {
        return new InterpreterOptions(Parser.DEFAULT_MAX_NESTING_DEPTH, true);
    }

    /**
     * Reads the options from a configuration. Missing keys fall back to {@link #defaults()}.
     *
     * @param config The configuration, typically from {@link ConfigLoader#load()}.
     * @return The options.
     * @throws IllegalArgumentException if a value is out of range.
     */
    public static InterpreterOptions fromConfig(final Config config) {
        final InterpreterOptions defaults = defaults();
        if (!config.hasPath(ROOT)) {
            return defaults;
        }
        final Config options = config.getConfig(ROOT);
        final int depth = options.hasPath(MAX_NESTING_DEPTH_KEY)
            ? options.getInt(MAX_NESTING_DEPTH_KEY)
            : defaults.maxNestingDepth();
        final boolean print = options.hasPath(PRINT_DIAGNOSTICS_KEY)
            ? options.getBoolean(PRINT_DIAGNOSTICS_KEY)
            : defaults.printDiagnostics();
        return new InterpreterOptions(depth, print);
    }
}
