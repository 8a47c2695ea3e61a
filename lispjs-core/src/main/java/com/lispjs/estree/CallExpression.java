package com.lispjs.estree;

import java.util.List;

public record CallExpression(Identifier callee, List<Expression> arguments) implements Expression {

    @Override
    public String type() {
        return "CallExpression";
    }
}
