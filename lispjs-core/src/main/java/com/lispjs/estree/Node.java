package com.lispjs.estree;

/**
 * Base interface for the ESTree-shaped nodes produced by the transformer.
 */
public sealed interface Node permits Program, Statement, Expression {

    String type();
}
