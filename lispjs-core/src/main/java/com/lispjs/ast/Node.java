package com.lispjs.ast;

/**
 * Base interface for all nodes of the parsed s-expression tree.
 */
public sealed interface Node permits Program, Expression {

    String type();
}
