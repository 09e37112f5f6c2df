package org.loxcore.frontend.parser.ast;

import org.loxcore.frontend.lexer.LiteralValue;

/**
 * An AST node that represents a literal: a number, a string, {@code true},
 * {@code false} or {@code nil} ({@link LiteralValue.None}).
 *
 * @param value The literal value.
 */
public record LiteralNode(LiteralValue value) implements AstNode {
    // This node has no children and inherits the empty list from getChildren().
}
