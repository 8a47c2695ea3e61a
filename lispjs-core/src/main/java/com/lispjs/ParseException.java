package com.lispjs;

/**
 * Structural error found while building the source tree.
 *
 * @see ExpectedTokenException
 */
public class ParseException extends CompileException {

    private final Token token;
    private final TokenType expected;
    private final String context;

    /**
     * @param kind     error classification
     * @param token    offending token; the opening paren when a call runs into end of input
     * @param expected token type that would have been accepted, may be null
     * @param context  the construct being parsed, e.g. "call expression"
     * @param message  human readable description
     */
    public ParseException(ErrorKind kind, Token token, TokenType expected, String context, String message) {
        super(kind, message,
              token != null ? token.line() : -1,
              token != null ? token.column() : -1);
        this.token = token;
        this.expected = expected;
        this.context = context;
    }

    public Token token() {
        return token;
    }

    public TokenType expected() {
        return expected;
    }

    public String context() {
        return context;
    }
}
