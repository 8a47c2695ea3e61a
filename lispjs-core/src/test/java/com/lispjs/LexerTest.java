package com.lispjs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    @Test
    void testNestedCall() {
        List<Token> tokens = Lexer.tokenize("(add 2 (subtract 4 2))");

        List<Token> expected = List.of(
            new Token(TokenType.PAREN, "(", 0, 1, 0),
            new Token(TokenType.NAME, "add", 1, 1, 1),
            new Token(TokenType.NUMBER, "2", 5, 1, 5),
            new Token(TokenType.PAREN, "(", 7, 1, 7),
            new Token(TokenType.NAME, "subtract", 8, 1, 8),
            new Token(TokenType.NUMBER, "4", 17, 1, 17),
            new Token(TokenType.NUMBER, "2", 19, 1, 19),
            new Token(TokenType.PAREN, ")", 20, 1, 20),
            new Token(TokenType.PAREN, ")", 21, 1, 21)
        );
        assertEquals(expected, tokens);
    }

    @Test
    void testEmptyAndBlankInput() {
        assertTrue(Lexer.tokenize("").isEmpty());
        assertTrue(Lexer.tokenize("  \t\r\n  ").isEmpty());
    }

    @Test
    void testMaximalRuns() {
        List<Token> tokens = Lexer.tokenize("12345 fooBAR");

        assertEquals(2, tokens.size());
        assertEquals(TokenType.NUMBER, tokens.get(0).type());
        assertEquals("12345", tokens.get(0).text());
        assertEquals(TokenType.NAME, tokens.get(1).type());
        assertEquals("fooBAR", tokens.get(1).text());
    }

    @Test
    @DisplayName("Adjacent letters and digits split into separate tokens")
    void testLettersThenDigits() {
        List<Token> tokens = Lexer.tokenize("abc123def");

        assertEquals(List.of(TokenType.NAME, TokenType.NUMBER, TokenType.NAME),
            tokens.stream().map(Token::type).toList());
        assertEquals(List.of("abc", "123", "def"),
            tokens.stream().map(Token::text).toList());
    }

    @Test
    void testNumbersKeepLeadingZeros() {
        assertEquals("007", Lexer.tokenize("007").get(0).text());
    }

    @Test
    void testStringContentIsVerbatim() {
        List<Token> tokens = Lexer.tokenize("(concat \"a b\" \"(1)\" \"\")");

        assertEquals(new Token(TokenType.STRING, "a b", 8, 1, 8), tokens.get(2));
        assertEquals("(1)", tokens.get(3).text());
        assertEquals(TokenType.STRING, tokens.get(4).type());
        assertEquals("", tokens.get(4).text());
        assertTrue(tokens.get(5).isCloseParen());
    }

    @Test
    void testPositionsAcrossLines() {
        List<Token> tokens = Lexer.tokenize("(print\n  \"two\nlines\"\n  42)");

        Token string = tokens.get(2);
        assertEquals("two\nlines", string.text());
        assertEquals(2, string.line());
        assertEquals(2, string.column());

        Token number = tokens.get(3);
        assertEquals("42", number.text());
        assertEquals(4, number.line());
        assertEquals(2, number.column());
    }

    @Test
    void testUnterminatedString() {
        LexerException e = assertThrows(LexerException.class, () -> Lexer.tokenize("(add \"ab)"));

        assertEquals(ErrorKind.UNTERMINATED_STRING, e.kind());
        assertEquals(5, e.offset());
        assertEquals(1, e.line());
        assertEquals(5, e.column());
    }

    @Test
    void testLoneQuoteAtEndOfInput() {
        LexerException e = assertThrows(LexerException.class, () -> Lexer.tokenize("\""));
        assertEquals(ErrorKind.UNTERMINATED_STRING, e.kind());
    }

    @Test
    void testUnrecognizedCharacter() {
        LexerException e = assertThrows(LexerException.class, () -> Lexer.tokenize("(add 1\n  +2)"));

        assertEquals(ErrorKind.UNRECOGNIZED_CHARACTER, e.kind());
        assertEquals(2, e.line());
        assertEquals(2, e.column());
        assertTrue(e.getMessage().contains("'+'"), e.getMessage());
    }

    @Test
    void testNonAsciiLettersAreRejected() {
        LexerException e = assertThrows(LexerException.class, () -> Lexer.tokenize("(café)"));
        assertEquals(ErrorKind.UNRECOGNIZED_CHARACTER, e.kind());
        assertEquals(4, e.offset());
    }
}
