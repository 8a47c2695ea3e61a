package com.lispjs.estree;

public record ExpressionStatement(Expression expression) implements Statement {

    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
