package com.lispjs;

import com.lispjs.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser producing the s-expression {@link Program} tree.
 *
 * Grammar:
 * <pre>
 *   program    := expression*
 *   expression := NUMBER | STRING | call
 *   call       := '(' NAME expression* ')'
 * </pre>
 */
public class Parser {

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Program parse(String source) {
        return new Parser(Lexer.tokenize(source)).parse();
    }

    public static Program parse(List<Token> tokens) {
        return new Parser(tokens).parse();
    }

    public Program parse() {
        List<Expression> body = new ArrayList<>();
        while (!isAtEnd()) {
            body.add(parseExpression());
        }
        return new Program(body);
    }

    private Expression parseExpression() {
        Token token = peek();

        return switch (token.type()) {
            case NUMBER -> {
                advance();
                yield new NumberLiteral(token.text());
            }
            case STRING -> {
                advance();
                yield new StringLiteral(token.text());
            }
            case PAREN -> {
                if (token.isOpenParen()) {
                    yield parseCallExpression();
                }
                throw new ParseException(ErrorKind.UNEXPECTED_TOKEN, token, null, "expression",
                    "Unexpected ')'");
            }
            case NAME -> throw new ParseException(ErrorKind.UNEXPECTED_TOKEN, token, null, "expression",
                "Unexpected NAME '" + token.text() + "' outside of call position");
        };
    }

    private CallExpression parseCallExpression() {
        Token open = advance();

        if (isAtEnd()) {
            throw new ExpectedTokenException("Unexpected end of input after '('", open, TokenType.NAME,
                "call expression");
        }
        if (!check(TokenType.NAME)) {
            Token found = peek();
            throw new ParseException(ErrorKind.MALFORMED_CALL, found, TokenType.NAME, "call expression",
                "Expected a name after '(' but found " + found.type() + " '" + found.text() + "'");
        }
        String name = advance().text();

        List<Expression> params = new ArrayList<>();
        while (!checkCloseParen()) {
            if (isAtEnd()) {
                // Report at the opening paren of the unclosed call
                throw new ExpectedTokenException("Unexpected end of input, expected ')' to close '" + name + "'",
                    open, TokenType.PAREN, "call expression");
            }
            params.add(parseExpression());
        }
        advance();

        return new CallExpression(name, params);
    }

    // Helper methods

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkCloseParen() {
        return !isAtEnd() && peek().isCloseParen();
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
