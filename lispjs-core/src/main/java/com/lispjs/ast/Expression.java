package com.lispjs.ast;

/**
 * A node that can appear in a program body or as a call parameter.
 */
public sealed interface Expression extends Node permits CallExpression, NumberLiteral, StringLiteral {
}
