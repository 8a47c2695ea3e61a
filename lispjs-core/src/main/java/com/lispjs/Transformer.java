package com.lispjs;

import com.lispjs.ast.CallExpression;
import com.lispjs.ast.Node;
import com.lispjs.ast.NumberLiteral;
import com.lispjs.ast.Program;
import com.lispjs.ast.StringLiteral;
import com.lispjs.estree.ExpressionStatement;
import com.lispjs.estree.Identifier;
import com.lispjs.estree.Statement;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites the s-expression tree into the ESTree-shaped target tree.
 *
 * Calls become {@code CallExpression(Identifier, arguments)}. A call whose
 * immediate parent is not another call is wrapped in an {@link ExpressionStatement}.
 */
public final class Transformer {

    private Transformer() {
    }

    public static com.lispjs.estree.Program transform(Program program) {
        List<com.lispjs.estree.Node> body = new ArrayList<>();
        BuildingVisitor visitor = new BuildingVisitor(program, body);
        TreeWalker.walk(program, visitor);
        return new com.lispjs.estree.Program(body);
    }

    /**
     * Target-side list that children of a source node append into.
     * Statements are only accepted by the program body.
     */
    private static final class BuildContext {
        private final List<? super com.lispjs.estree.Expression> expressions;
        private final List<? super Statement> statements;

        private BuildContext(List<? super com.lispjs.estree.Expression> expressions,
                             List<? super Statement> statements) {
            this.expressions = expressions;
            this.statements = statements;
        }

        static BuildContext forBody(List<com.lispjs.estree.Node> body) {
            return new BuildContext(body, body);
        }

        static BuildContext forArguments(List<com.lispjs.estree.Expression> arguments) {
            return new BuildContext(arguments, null);
        }

        void append(com.lispjs.estree.Expression expression) {
            expressions.add(expression);
        }

        void appendStatement(Statement statement) {
            if (statements == null) {
                throw new IllegalStateException("Statements can only be appended to a program body");
            }
            statements.add(statement);
        }
    }

    private static final class BuildingVisitor implements AstVisitor {
        // Keyed by identity: structurally equal calls must get separate contexts
        private final Map<Node, BuildContext> contexts = new IdentityHashMap<>();

        BuildingVisitor(Program root, List<com.lispjs.estree.Node> body) {
            contexts.put(root, BuildContext.forBody(body));
        }

        @Override
        public void enterNumberLiteral(NumberLiteral node, Node parent) {
            contextOf(parent).append(new com.lispjs.estree.NumberLiteral(node.value()));
        }

        @Override
        public void enterStringLiteral(StringLiteral node, Node parent) {
            contextOf(parent).append(new com.lispjs.estree.StringLiteral(node.value()));
        }

        @Override
        public void enterCallExpression(CallExpression node, Node parent) {
            List<com.lispjs.estree.Expression> arguments = new ArrayList<>();
            com.lispjs.estree.CallExpression expression =
                new com.lispjs.estree.CallExpression(new Identifier(node.name()), arguments);

            contexts.put(node, BuildContext.forArguments(arguments));

            BuildContext parentContext = contextOf(parent);
            if (parent instanceof CallExpression) {
                parentContext.append(expression);
            } else {
                parentContext.appendStatement(new ExpressionStatement(expression));
            }
        }

        private BuildContext contextOf(Node parent) {
            BuildContext context = parent == null ? null : contexts.get(parent);
            if (context == null) {
                throw new IllegalStateException("No build context for parent "
                    + (parent == null ? "<root>" : parent.type()));
            }
            return context;
        }
    }
}
