package org.loxcore.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Every node exclusively owns its children; trees are immutable once built.
 */
public sealed interface AstNode permits BinaryNode, GroupingNode, LiteralNode, UnaryNode {
    /**
     * Returns a list of the direct child nodes, left to right.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
