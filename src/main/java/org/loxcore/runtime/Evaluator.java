package org.loxcore.runtime;

import org.loxcore.frontend.lexer.LiteralValue;
import org.loxcore.frontend.lexer.Token;
import org.loxcore.frontend.parser.ast.AstNode;
import org.loxcore.frontend.parser.ast.BinaryNode;
import org.loxcore.frontend.parser.ast.GroupingNode;
import org.loxcore.frontend.parser.ast.LiteralNode;
import org.loxcore.frontend.parser.ast.UnaryNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A tree-walking evaluator that reduces an expression tree to a {@link Value}.
 * <p>
 * Operators are strictly typed: arithmetic and comparison need numbers, {@code +}
 * also accepts two strings, and equality never coerces. A type mismatch stops the
 * evaluation with a {@link LoxRuntimeError}. The evaluator holds no state and can be
 * shared between threads.
 */
public class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    /**
     * Evaluates an expression tree.
     *
     * @param expression The root of the tree.
     * @return The resulting value, or the runtime error that stopped evaluation.
     */
    public Evaluation evaluate(AstNode expression) {
        try {
            Value value = evaluateNode(expression);
            LOG.debug("Evaluated to {} '{}'", value.typeName(), value);
            return Evaluation.success(value);
        } catch (LoxRuntimeError error) {
            LOG.debug("Evaluation failed at line {}: {}", error.getToken().line(), error.getMessage());
            return Evaluation.failure(error);
        }
    }

    private Value evaluateNode(AstNode node) {
        if (node instanceof LiteralNode literal) {
            return literal(literal.value());
        }
        if (node instanceof GroupingNode grouping) {
            return evaluateNode(grouping.inner());
        }
        if (node instanceof UnaryNode unary) {
            return unary(unary);
        }
        if (node instanceof BinaryNode binary) {
            return binary(binary);
        }
        throw new IllegalStateException("Unknown AST node: " + node);
    }

    private Value literal(LiteralValue value) {
        if (value instanceof LiteralValue.Str str) return new Value.Str(str.value());
        if (value instanceof LiteralValue.Num num) return new Value.Num(num.value());
        if (value instanceof LiteralValue.Bool bool) return new Value.Bool(bool.value());
        return Value.NIL;
    }

    private Value unary(UnaryNode node) {
        Value right = evaluateNode(node.right());
        Token operator = node.operator();

        switch (operator.type()) {
            case BANG:
                return new Value.Bool(!right.isTruthy());
            case MINUS:
                if (right instanceof Value.Num num) {
                    return new Value.Num(-num.value());
                }
                throw new LoxRuntimeError(operator, String.format(
                        "Operand '%s' must be a number to apply '%s' operator.", right, operator.text()));
            default:
                throw new IllegalStateException("Operator '" + operator.text() + "' is not a unary operator.");
        }
    }

    /**
     * Left-associative chains such as {@code 1 + 2 + 3} parse into left-deep trees of
     * unbounded depth. The left spine is walked in a loop so the Java stack only grows
     * with groupings and unary operators, which the parser bounds.
     */
    private Value binary(BinaryNode node) {
        Deque<BinaryNode> spine = new ArrayDeque<>();
        AstNode leftmost = node;
        while (leftmost instanceof BinaryNode binary) {
            spine.push(binary);
            leftmost = binary.left();
        }

        Value left = evaluateNode(leftmost);
        while (!spine.isEmpty()) {
            BinaryNode current = spine.pop();
            Value right = evaluateNode(current.right());
            left = apply(current.operator(), left, right);
        }
        return left;
    }

    private Value apply(Token operator, Value left, Value right) {
        switch (operator.type()) {
            // Arithmetic
            case MINUS: {
                Operands n = numberOperands(operator, left, right);
                return new Value.Num(n.left() - n.right());
            }
            case SLASH: {
                Operands n = numberOperands(operator, left, right);
                return new Value.Num(n.left() / n.right());
            }
            case STAR: {
                Operands n = numberOperands(operator, left, right);
                return new Value.Num(n.left() * n.right());
            }
            case PLUS:
                if (left instanceof Value.Num l && right instanceof Value.Num r) {
                    return new Value.Num(l.value() + r.value());
                }
                if (left instanceof Value.Str l && right instanceof Value.Str r) {
                    return new Value.Str(l.value() + r.value());
                }
                throw new LoxRuntimeError(operator, String.format(
                        "Operands '%s' and '%s' must both be numbers or strings.", left, right));

            // Comparison
            case GREATER: {
                Operands n = numberOperands(operator, left, right);
                return new Value.Bool(n.left() > n.right());
            }
            case GREATER_EQUAL: {
                Operands n = numberOperands(operator, left, right);
                return new Value.Bool(n.left() >= n.right());
            }
            case LESS: {
                Operands n = numberOperands(operator, left, right);
                return new Value.Bool(n.left() < n.right());
            }
            case LESS_EQUAL: {
                Operands n = numberOperands(operator, left, right);
                return new Value.Bool(n.left() <= n.right());
            }

            // Equality
            case EQUAL_EQUAL:
                return new Value.Bool(isEqual(left, right));
            case BANG_EQUAL:
                return new Value.Bool(!isEqual(left, right));

            default:
                throw new IllegalStateException("Operator '" + operator.text() + "' is not a binary operator.");
        }
    }

    private Operands numberOperands(Token operator, Value left, Value right) {
        if (left instanceof Value.Num l && right instanceof Value.Num r) {
            return new Operands(l.value(), r.value());
        }
        throw new LoxRuntimeError(operator, String.format(
                "Operands '%s' and '%s' must both be numbers to apply '%s' operator.", left, right, operator.text()));
    }

    private boolean isEqual(Value left, Value right) {
        // IEEE semantics: NaN is unequal to itself, 0 equals -0.
        if (left instanceof Value.Num l && right instanceof Value.Num r) {
            return l.value() == r.value();
        }
        return left.equals(right);
    }

    private record Operands(double left, double right) {}
}
