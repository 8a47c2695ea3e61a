package com.lispjs.estree;

public record Identifier(String name) implements Expression {

    @Override
    public String type() {
        return "Identifier";
    }
}
