package org.loxcore.frontend.parser.ast;

import org.loxcore.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node for a prefix operation, {@code !x} or {@code -x}.
 *
 * @param operator The operator token.
 * @param right The operand.
 */
public record UnaryNode(
        Token operator,
        AstNode right
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(right);
    }
}
