package com.lispjs;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass scanner turning source text into {@link Token}s.
 *
 * Recognized forms:
 * - ( and ) as PAREN
 * - runs of ASCII digits as NUMBER
 * - "..." as STRING (quotes stripped, no escape sequences)
 * - runs of ASCII letters as NAME
 *
 * Whitespace is skipped; anything else is a {@link LexerException}.
 */
public class Lexer {

    private final char[] buf;
    private final int length;
    private int position = 0;
    private int line = 1;
    private int column = 0;

    public Lexer(String source) {
        this.buf = source.toCharArray();
        this.length = buf.length;
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (position < length) {
            char ch = buf[position];

            if (Character.isWhitespace(ch)) {
                advance();
                continue;
            }

            int startPos = position;
            int startLine = line;
            int startCol = column;

            if (ch == '(' || ch == ')') {
                advance();
                tokens.add(new Token(TokenType.PAREN, String.valueOf(ch), startPos, startLine, startCol));
            } else if (isDigit(ch)) {
                while (position < length && isDigit(buf[position])) {
                    advance();
                }
                tokens.add(new Token(TokenType.NUMBER, new String(buf, startPos, position - startPos),
                                     startPos, startLine, startCol));
            } else if (ch == '"') {
                tokens.add(scanString(startPos, startLine, startCol));
            } else if (isLetter(ch)) {
                while (position < length && isLetter(buf[position])) {
                    advance();
                }
                tokens.add(new Token(TokenType.NAME, new String(buf, startPos, position - startPos),
                                     startPos, startLine, startCol));
            } else {
                throw new LexerException(ErrorKind.UNRECOGNIZED_CHARACTER,
                    "Unrecognized character '" + ch + "'", startPos, startLine, startCol);
            }
        }

        return tokens;
    }

    private Token scanString(int startPos, int startLine, int startCol) {
        advance(); // opening quote
        int contentStart = position;
        while (position < length && buf[position] != '"') {
            advance();
        }
        if (position >= length) {
            throw new LexerException(ErrorKind.UNTERMINATED_STRING,
                "Unterminated string literal", startPos, startLine, startCol);
        }
        String text = new String(buf, contentStart, position - contentStart);
        advance(); // closing quote
        return new Token(TokenType.STRING, text, startPos, startLine, startCol);
    }

    private void advance() {
        if (buf[position] == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        position++;
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }
}
