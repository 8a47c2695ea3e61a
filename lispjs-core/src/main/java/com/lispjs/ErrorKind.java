package com.lispjs;

/**
 * Classification of every fatal condition the pipeline can raise.
 */
public enum ErrorKind {
    UNTERMINATED_STRING,
    UNRECOGNIZED_CHARACTER,
    UNEXPECTED_TOKEN,
    MALFORMED_CALL,
    UNKNOWN_NODE_VARIANT
}
