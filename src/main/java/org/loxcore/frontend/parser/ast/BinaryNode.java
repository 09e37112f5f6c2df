package org.loxcore.frontend.parser.ast;

import org.loxcore.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node that represents an infix operation such as {@code a + b}.
 *
 * @param left The left operand.
 * @param operator The operator token.
 * @param right The right operand.
 */
public record BinaryNode(
        AstNode left,
        Token operator,
        AstNode right
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
