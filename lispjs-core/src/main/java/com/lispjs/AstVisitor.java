package com.lispjs;

import com.lispjs.ast.*;

/**
 * Callbacks invoked by {@link TreeWalker}. Every method defaults to a no-op, so a
 * visitor only overrides the variants it cares about.
 *
 * {@code parent} is null only when the node is the root of the walk. The program
 * callbacks take no parent since a program is always a root.
 */
public interface AstVisitor {

    default void enterProgram(Program node) {}

    default void exitProgram(Program node) {}

    default void enterCallExpression(CallExpression node, Node parent) {}

    default void exitCallExpression(CallExpression node, Node parent) {}

    default void enterNumberLiteral(NumberLiteral node, Node parent) {}

    default void exitNumberLiteral(NumberLiteral node, Node parent) {}

    default void enterStringLiteral(StringLiteral node, Node parent) {}

    default void exitStringLiteral(StringLiteral node, Node parent) {}
}
