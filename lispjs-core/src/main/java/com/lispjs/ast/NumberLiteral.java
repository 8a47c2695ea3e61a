package com.lispjs.ast;

/**
 * A run of decimal digits. The value is kept as source text.
 */
public record NumberLiteral(String value) implements Expression {

    @Override
    public String type() {
        return "NumberLiteral";
    }
}
