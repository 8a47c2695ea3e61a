package com.lispjs;

public enum TokenType {
    PAREN,
    NUMBER,
    STRING,
    NAME
}
