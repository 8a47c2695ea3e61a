package com.lispjs;

import com.lispjs.estree.*;

import java.util.stream.Collectors;

/**
 * Renders the target tree as JavaScript call syntax.
 */
public final class CodeGenerator {

    private CodeGenerator() {
    }

    public static String generate(Node node) {
        if (node instanceof Program program) {
            return program.body().stream()
                .map(CodeGenerator::generate)
                .collect(Collectors.joining("\n"));
        } else if (node instanceof ExpressionStatement statement) {
            return generate(statement.expression()) + ";";
        } else if (node instanceof CallExpression call) {
            return generate(call.callee())
                + "("
                + call.arguments().stream()
                    .map(CodeGenerator::generate)
                    .collect(Collectors.joining(", "))
                + ")";
        } else if (node instanceof Identifier identifier) {
            return identifier.name();
        } else if (node instanceof NumberLiteral number) {
            return number.value();
        } else if (node instanceof StringLiteral string) {
            // Not escaped. Lexed strings never hold a quote, but one read from JSON renders unbalanced
            return '"' + string.value() + '"';
        }
        throw new UnknownNodeException(node == null ? "null" : node.type());
    }
}
