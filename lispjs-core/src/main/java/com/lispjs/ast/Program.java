package com.lispjs.ast;

import java.util.List;

public record Program(List<Expression> body) implements Node {

    @Override
    public String type() {
        return "Program";
    }
}
