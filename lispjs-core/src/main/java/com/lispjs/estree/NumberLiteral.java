package com.lispjs.estree;

public record NumberLiteral(String value) implements Expression {

    @Override
    public String type() {
        return "NumberLiteral";
    }
}
