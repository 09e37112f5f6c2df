package org.loxcore.util;

import org.loxcore.frontend.lexer.LiteralValue;
import org.loxcore.frontend.lexer.Token;
import org.loxcore.frontend.lexer.TokenType;
import org.loxcore.frontend.parser.ast.AstNode;
import org.loxcore.frontend.parser.ast.BinaryNode;
import org.loxcore.frontend.parser.ast.GroupingNode;
import org.loxcore.frontend.parser.ast.LiteralNode;
import org.loxcore.frontend.parser.ast.UnaryNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link AstPrinter}, built from hand-made trees.
 */
@Tag("unit")
class AstPrinterTest {

    @Test
    void print_nestedTree() {
        BinaryNode tree = new BinaryNode(
                new UnaryNode(new Token(TokenType.MINUS, "-", LiteralValue.NONE, 1),
                        new LiteralNode(new LiteralValue.Num(123))),
                new Token(TokenType.STAR, "*", LiteralValue.NONE, 1),
                new GroupingNode(new LiteralNode(new LiteralValue.Num(45.67))));

        assertThat(AstPrinter.print(tree)).isEqualTo("(* (- 123) (group 45.67))");
    }

    @Test
    void print_literals() {
        assertThat(AstPrinter.print(new LiteralNode(LiteralValue.NONE))).isEqualTo("nil");
        assertThat(AstPrinter.print(new LiteralNode(new LiteralValue.Bool(false)))).isEqualTo("false");
        assertThat(AstPrinter.print(new LiteralNode(new LiteralValue.Str("hello world")))).isEqualTo("hello world");
    }

    @Test
    void print_deepLeftChain() {
        Token plus = new Token(TokenType.PLUS, "+", LiteralValue.NONE, 1);
        LiteralNode one = new LiteralNode(new LiteralValue.Num(1));
        AstNode tree = one;
        for (int i = 0; i < 50_000; i++) {
            tree = new BinaryNode(tree, plus, one);
        }

        String printed = AstPrinter.print(tree);

        assertThat(printed).startsWith("(+ (+ ")
                .endsWith(" 1) 1) 1)")
                .hasSize(50_000 * "(+  1)".length() + 1);
        assertThat(AstPrinter.print(new BinaryNode(new BinaryNode(one, plus, one), plus, one)))
                .isEqualTo("(+ (+ 1 1) 1)");
    }
}
