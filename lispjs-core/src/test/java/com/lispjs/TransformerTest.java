package com.lispjs;

import com.lispjs.estree.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransformerTest {

    private static Program transform(String source) {
        return Transformer.transform(Parser.parse(source));
    }

    @Test
    void testNestedCall() {
        Program program = transform("(add 2 (subtract 4 2))");

        Program expected = new Program(List.of(
            new ExpressionStatement(
                new CallExpression(new Identifier("add"), List.of(
                    new NumberLiteral("2"),
                    new CallExpression(new Identifier("subtract"), List.of(
                        new NumberLiteral("4"),
                        new NumberLiteral("2")
                    ))
                ))
            )
        ));
        assertEquals(expected, program);
    }

    @Test
    void testStringArguments() {
        Program program = transform("(concat \"a\" \"b\")");

        ExpressionStatement statement = assertInstanceOf(ExpressionStatement.class, program.body().get(0));
        CallExpression call = assertInstanceOf(CallExpression.class, statement.expression());
        assertEquals(List.of(new StringLiteral("a"), new StringLiteral("b")), call.arguments());
    }

    @Test
    @DisplayName("Only direct children of the program are wrapped in statements")
    void testStatementCountMatchesTopLevelCalls() {
        String source = "(a (b (c)) (d)) (e) (f (g (h (i))))";
        com.lispjs.ast.Program sourceTree = Parser.parse(source);

        Program program = Transformer.transform(sourceTree);

        assertEquals(sourceTree.body().size(), program.body().size());
        assertEquals(3, countStatements(program));
        for (Node node : program.body()) {
            assertInstanceOf(ExpressionStatement.class, node);
        }
    }

    @Test
    void testTopLevelLiteralsStayBare() {
        Program program = transform("1 \"two\" (three)");

        assertEquals(new NumberLiteral("1"), program.body().get(0));
        assertEquals(new StringLiteral("two"), program.body().get(1));
        assertInstanceOf(ExpressionStatement.class, program.body().get(2));
    }

    @Test
    @DisplayName("Structurally equal calls each receive their own arguments")
    void testEqualSiblingCallsDoNotShareContext() {
        Program program = transform("(f (g 1) (g 1))");

        CallExpression f = (CallExpression) ((ExpressionStatement) program.body().get(0)).expression();
        assertEquals(2, f.arguments().size());
        for (Expression argument : f.arguments()) {
            CallExpression g = assertInstanceOf(CallExpression.class, argument);
            assertEquals(List.of(new NumberLiteral("1")), g.arguments());
        }
    }

    @Test
    void testEmptyProgram() {
        assertTrue(transform("").body().isEmpty());
    }

    @Test
    void testSourceTreeIsUnchanged() {
        com.lispjs.ast.Program sourceTree = Parser.parse("(add 1 (mul 2 3))");
        com.lispjs.ast.Program copy = Parser.parse("(add 1 (mul 2 3))");

        Transformer.transform(sourceTree);

        assertEquals(copy, sourceTree);
    }

    @Test
    void testRepeatedTransformsAreIndependent() {
        com.lispjs.ast.Program sourceTree = Parser.parse("(add 1 2)");

        Program first = Transformer.transform(sourceTree);
        Program second = Transformer.transform(sourceTree);

        assertEquals(first, second);
        assertNotSame(first.body(), second.body());
    }

    private static int countStatements(Node node) {
        if (node instanceof Program program) {
            return program.body().stream().mapToInt(TransformerTest::countStatements).sum();
        } else if (node instanceof ExpressionStatement statement) {
            return 1 + countStatements(statement.expression());
        } else if (node instanceof CallExpression call) {
            return call.arguments().stream().mapToInt(TransformerTest::countStatements).sum();
        }
        return 0;
    }
}
