package com.lispjs.estree;

public sealed interface Expression extends Node permits CallExpression, Identifier, NumberLiteral, StringLiteral {
}
