package com.lispjs;

import com.lispjs.ast.*;

import java.util.List;

/**
 * Depth-first traversal of the source tree. For each node the visitor's enter
 * callback runs before the children are walked left to right, and the exit
 * callback runs after.
 */
public final class TreeWalker {

    private TreeWalker() {
    }

    public static void walk(Node root, AstVisitor visitor) {
        walkNode(root, null, visitor);
    }

    private static void walkNode(Node node, Node parent, AstVisitor visitor) {
        if (node instanceof Program program) {
            visitor.enterProgram(program);
            walkAll(program.body(), program, visitor);
            visitor.exitProgram(program);
        } else if (node instanceof CallExpression call) {
            visitor.enterCallExpression(call, parent);
            walkAll(call.params(), call, visitor);
            visitor.exitCallExpression(call, parent);
        } else if (node instanceof NumberLiteral number) {
            visitor.enterNumberLiteral(number, parent);
            visitor.exitNumberLiteral(number, parent);
        } else if (node instanceof StringLiteral string) {
            visitor.enterStringLiteral(string, parent);
            visitor.exitStringLiteral(string, parent);
        } else {
            throw new UnknownNodeException(node == null ? "null" : node.type());
        }
    }

    private static void walkAll(List<? extends Node> children, Node parent, AstVisitor visitor) {
        for (Node child : children) {
            walkNode(child, parent, visitor);
        }
    }
}
