package org.loxcore.frontend.parser;

import org.loxcore.diagnostics.DiagnosticsEngine;
import org.loxcore.frontend.lexer.LiteralValue;
import org.loxcore.frontend.lexer.Token;
import org.loxcore.frontend.lexer.TokenType;
import org.loxcore.frontend.parser.ast.AstNode;
import org.loxcore.frontend.parser.ast.BinaryNode;
import org.loxcore.frontend.parser.ast.GroupingNode;
import org.loxcore.frontend.parser.ast.LiteralNode;
import org.loxcore.frontend.parser.ast.UnaryNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A recursive-descent parser for expressions. It consumes a list of tokens
 * from the {@link org.loxcore.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Grammar, lowest to highest precedence:
 * <pre>
 * expression  := equality
 * equality    := comparison ( ( "!=" | "==" ) comparison )*
 * comparison  := term ( ( "&gt;" | "&gt;=" | "&lt;" | "&lt;=" ) term )*
 * term        := factor ( ( "+" | "-" ) factor )*
 * factor      := unary ( ( "/" | "*" ) unary )*
 * unary       := ( "!" | "-" ) unary | primary
 * primary     := NUMBER | STRING | "true" | "false" | "nil" | "(" expression ")"
 * </pre>
 * On the first syntax error the parser reports a diagnostic, synchronizes and
 * returns an empty result.
 */
public class Parser {

    /** The nesting depth used when no explicit limit is given. */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 200;

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenType> STATEMENT_STARTS = EnumSet.of(
            TokenType.CLASS, TokenType.FUN, TokenType.VAR, TokenType.FOR,
            TokenType.IF, TokenType.WHILE, TokenType.PRINT, TokenType.RETURN);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final int maxNestingDepth;
    private int current = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser with the default nesting limit.
     * @param tokens The list of tokens to parse, terminated by an EOF token.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by an EOF token.
     * @param diagnostics The engine for reporting errors.
     * @param maxNestingDepth How deep groupings and unary operators may nest.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, int maxNestingDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with an EOF token.");
        }
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses a single expression from the token stream.
     * @return The root of the expression tree, or empty if a syntax error was reported.
     */
    public Optional<AstNode> parse() {
        try {
            AstNode expression = expression();
            LOG.debug("Parsed expression ending before token {}", current);
            return Optional.of(expression);
        } catch (ParseError error) {
            synchronize();
            LOG.debug("Parse failed, resynchronized at token {} ({})", current, peek().type());
            return Optional.empty();
        }
    }

    /**
     * Returns the token the parser stopped at: the first token after the expression,
     * or the recovery point after a syntax error.
     */
    Token currentToken() {
        return peek();
    }

    private AstNode expression() {
        return equality();
    }

    private AstNode equality() {
        AstNode expr = comparison();
        while (match(TokenType.BANG_EQUAL, TokenType.EQUAL_EQUAL)) {
            Token operator = previous();
            AstNode right = comparison();
            expr = new BinaryNode(expr, operator, right);
        }
        return expr;
    }

    private AstNode comparison() {
        AstNode expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token operator = previous();
            AstNode right = term();
            expr = new BinaryNode(expr, operator, right);
        }
        return expr;
    }

    private AstNode term() {
        AstNode expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            AstNode right = factor();
            expr = new BinaryNode(expr, operator, right);
        }
        return expr;
    }

    private AstNode factor() {
        AstNode expr = unary();
        while (match(TokenType.SLASH, TokenType.STAR)) {
            Token operator = previous();
            AstNode right = unary();
            expr = new BinaryNode(expr, operator, right);
        }
        return expr;
    }

    private AstNode unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token operator = previous();
            enterNested(operator);
            AstNode right = unary();
            depth--;
            return new UnaryNode(operator, right);
        }
        return primary();
    }

    private AstNode primary() {
        if (match(TokenType.FALSE, TokenType.TRUE)) {
            return new LiteralNode(literalOf(previous(), LiteralValue.Bool.class));
        }
        if (match(TokenType.NIL)) {
            return new LiteralNode(LiteralValue.NONE);
        }
        if (match(TokenType.NUMBER)) {
            return new LiteralNode(literalOf(previous(), LiteralValue.Num.class));
        }
        if (match(TokenType.STRING)) {
            return new LiteralNode(literalOf(previous(), LiteralValue.Str.class));
        }
        if (match(TokenType.LEFT_PAREN)) {
            enterNested(previous());
            AstNode inner = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            depth--;
            return new GroupingNode(inner);
        }
        throw error(peek(), "Expect expression.");
    }

    private LiteralValue literalOf(Token token, Class<? extends LiteralValue> expected) {
        if (!expected.isInstance(token.value())) {
            throw new IllegalStateException("Token " + token + " does not carry a "
                    + expected.getSimpleName() + " literal.");
        }
        return token.value();
    }

    private void enterNested(Token token) {
        if (++depth > maxNestingDepth) {
            throw error(token, "Expression nested too deeply.");
        }
    }

    /**
     * Discards tokens until a plausible statement boundary: just after a ';',
     * before a statement keyword, or at the end of input.
     */
    private void synchronize() {
        advance();
        while (!isAtEnd()) {
            if (previous().type() == TokenType.SEMICOLON) return;
            if (STATEMENT_STARTS.contains(peek().type())) return;
            advance();
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        if (current == 0) {
            throw new IllegalStateException("No token has been consumed yet.");
        }
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseError error(Token token, String message) {
        diagnostics.reportSyntaxError(token, message);
        return new ParseError(message);
    }

    /**
     * Unwinds the recursive descent to {@link #parse()} after a reported error.
     */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message, null, false, false);
        }
    }
}
