package com.lispjs.estree;

import java.util.List;

/**
 * Root of the generated tree. Top-level calls appear as {@link ExpressionStatement}s;
 * top-level literals are kept as bare expressions.
 */
public record Program(List<Node> body) implements Node {

    @Override
    public String type() {
        return "Program";
    }
}
