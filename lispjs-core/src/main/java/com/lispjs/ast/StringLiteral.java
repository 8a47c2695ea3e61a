package com.lispjs.ast;

public record StringLiteral(String value) implements Expression {

    @Override
    public String type() {
        return "StringLiteral";
    }
}
