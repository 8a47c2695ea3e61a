package com.lispjs;

import com.lispjs.ast.Program;

import java.util.List;

/**
 * Entry point chaining the four stages:
 * {@link Lexer} -> {@link Parser} -> {@link Transformer} -> {@link CodeGenerator}.
 *
 * <pre>{@code
 * Compiler.compile("(add 2 (subtract 4 2))");  // "add(2, subtract(4, 2));"
 * }</pre>
 *
 * Any malformed input surfaces as a {@link CompileException}; no partial output is returned.
 */
public final class Compiler {

    private Compiler() {
    }

    public static String compile(String source) {
        List<Token> tokens = Lexer.tokenize(source);
        Program ast = Parser.parse(tokens);
        com.lispjs.estree.Program target = Transformer.transform(ast);
        return CodeGenerator.generate(target);
    }

    /**
     * Runs the front half of the pipeline and returns the target tree, for callers
     * that want to inspect or serialize it before generating code.
     */
    public static com.lispjs.estree.Program toEstree(String source) {
        return Transformer.transform(Parser.parse(source));
    }
}
