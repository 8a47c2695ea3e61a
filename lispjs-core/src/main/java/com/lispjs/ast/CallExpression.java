package com.lispjs.ast;

import java.util.List;

/**
 * A parenthesized call {@code (name param...)}.
 */
public record CallExpression(String name, List<Expression> params) implements Expression {

    @Override
    public String type() {
        return "CallExpression";
    }
}
