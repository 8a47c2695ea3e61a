package com.lispjs.estree;

public sealed interface Statement extends Node permits ExpressionStatement {
}
