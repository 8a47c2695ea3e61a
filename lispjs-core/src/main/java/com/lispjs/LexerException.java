package com.lispjs;

public class LexerException extends CompileException {

    private final int offset;

    public LexerException(ErrorKind kind, String message, int offset, int line, int column) {
        super(kind, message, line, column);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
