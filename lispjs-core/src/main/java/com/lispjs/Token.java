package com.lispjs;

/**
 * A lexical unit. {@code start} is the character offset of the first character
 * (the opening quote for strings), {@code line} is 1-based and {@code column} 0-based.
 */
public record Token(TokenType type, String text, int start, int line, int column) {

    public Token(TokenType type, String text) {
        this(type, text, 0, 0, 0);
    }

    public boolean isOpenParen() {
        return type == TokenType.PAREN && "(".equals(text);
    }

    public boolean isCloseParen() {
        return type == TokenType.PAREN && ")".equals(text);
    }
}
