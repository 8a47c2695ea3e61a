package com.lispjs;

/**
 * Raised when the parser needs a particular token and finds something else,
 * including running out of tokens.
 */
public class ExpectedTokenException extends ParseException {

    public ExpectedTokenException(String message, Token token, TokenType expected, String context) {
        super(ErrorKind.UNEXPECTED_TOKEN, token, expected, context, message);
    }
}
