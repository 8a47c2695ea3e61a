package com.lispjs.jackson;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.lispjs.estree.*;

/**
 * Jackson module that configures serialization/deserialization of the target tree.
 *
 * This module handles:
 * - Polymorphic node types through a "type" property carrying the variant name
 * - NumberLiteral values written as JSON numbers when that keeps the digits intact
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.lispjs", "lispjs-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Subtypes inherit the type handling from their sealed parents
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);

        context.setMixInAnnotations(NumberLiteral.class, NumberLiteralMixin.class);
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Program.class, name = "Program"),
        @JsonSubTypes.Type(value = ExpressionStatement.class, name = "ExpressionStatement"),
        @JsonSubTypes.Type(value = CallExpression.class, name = "CallExpression"),
        @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
        @JsonSubTypes.Type(value = NumberLiteral.class, name = "NumberLiteral"),
        @JsonSubTypes.Type(value = StringLiteral.class, name = "StringLiteral")
    })
    private abstract static class NodeMixin {
    }

    private abstract static class NumberLiteralMixin {
        @JsonSerialize(using = NumericTextSerializer.class)
        abstract String value();
    }
}
