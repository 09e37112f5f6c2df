package org.loxcore.frontend.parser.ast;

import java.util.List;

/**
 * An AST node for a parenthesized expression.
 *
 * @param inner The expression between the parentheses.
 */
public record GroupingNode(AstNode inner) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(inner);
    }
}
