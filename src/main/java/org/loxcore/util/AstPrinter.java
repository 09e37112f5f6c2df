package org.loxcore.util;

import org.loxcore.frontend.lexer.LiteralValue;
import org.loxcore.frontend.parser.ast.AstNode;
import org.loxcore.frontend.parser.ast.BinaryNode;
import org.loxcore.frontend.parser.ast.GroupingNode;
import org.loxcore.frontend.parser.ast.LiteralNode;
import org.loxcore.frontend.parser.ast.UnaryNode;
import org.loxcore.runtime.Value;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Utility class for rendering an expression tree in a parenthesized prefix form,
 * e.g. {@code (* (- 123) (group 45.67))}. Used for debugging and in tests.
 */
public final class AstPrinter {

	private AstPrinter() {}

	/**
	 * Renders a tree.
	 * @param node The root of the tree.
	 * @return The prefix form of the tree.
	 */
	public static String print(AstNode node) {
		StringBuilder sb = new StringBuilder();
		append(sb, node);
		return sb.toString();
	}

	private static void append(StringBuilder sb, AstNode node) {
		if (node instanceof BinaryNode binary) {
			binary(sb, binary);
		} else if (node instanceof UnaryNode unary) {
			parenthesize(sb, unary.operator().text(), unary);
		} else if (node instanceof GroupingNode grouping) {
			parenthesize(sb, "group", grouping);
		} else if (node instanceof LiteralNode literal) {
			sb.append(literalText(literal.value()));
		} else {
			throw new IllegalStateException("Unknown AST node: " + node);
		}
	}

	/**
	 * Prints the left spine of a binary chain in a loop; left-deep trees can be far deeper than the stack.
	 */
	private static void binary(StringBuilder sb, BinaryNode node) {
		Deque<BinaryNode> spine = new ArrayDeque<>();
		AstNode leftmost = node;
		while (leftmost instanceof BinaryNode binary) {
			sb.append('(').append(binary.operator().text()).append(' ');
			spine.push(binary);
			leftmost = binary.left();
		}
		append(sb, leftmost);
		while (!spine.isEmpty()) {
			sb.append(' ');
			append(sb, spine.pop().right());
			sb.append(')');
		}
	}

	private static void parenthesize(StringBuilder sb, String name, AstNode node) {
		sb.append('(').append(name);
		for (AstNode child : node.getChildren()) {
			sb.append(' ');
			append(sb, child);
		}
		sb.append(')');
	}

	private static String literalText(LiteralValue value) {
		if (value instanceof LiteralValue.Str str) return str.value();
		if (value instanceof LiteralValue.Num num) return new Value.Num(num.value()).render();
		if (value instanceof LiteralValue.Bool bool) return Boolean.toString(bool.value());
		return "nil";
	}
}
