package com.lispjs;

/**
 * Base class for failures raised by any stage of the compiler.
 * Line and column are -1 when no source position is known.
 */
public class CompileException extends RuntimeException {

    private final ErrorKind kind;
    private final int line;
    private final int column;

    public CompileException(ErrorKind kind, String message, int line, int column) {
        super(formatMessage(message, line, column));
        this.kind = kind;
        this.line = line;
        this.column = column;
    }

    public CompileException(ErrorKind kind, String message) {
        this(kind, message, -1, -1);
    }

    private static String formatMessage(String message, int line, int column) {
        if (line < 0) {
            return message;
        }
        return message + " (line " + line + ", column " + column + ")";
    }

    public ErrorKind kind() {
        return kind;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
