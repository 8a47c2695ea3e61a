package com.lispjs.estree;

public record StringLiteral(String value) implements Expression {

    @Override
    public String type() {
        return "StringLiteral";
    }
}
