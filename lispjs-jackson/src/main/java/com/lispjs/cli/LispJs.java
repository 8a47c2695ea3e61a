package com.lispjs.cli;

import com.lispjs.CodeGenerator;
import com.lispjs.CompileException;
import com.lispjs.Lexer;
import com.lispjs.Parser;
import com.lispjs.Token;
import com.lispjs.Transformer;
import com.lispjs.ast.Program;
import com.lispjs.json.AstJsonException;
import com.lispjs.json.AstJsonProvider;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/**
 * Command-line front end for the compiler.
 *
 * Usage:
 *   java -cp ... com.lispjs.cli.LispJs [options] [files...]
 *
 * Options:
 *   --emit=js|tokens|estree   What to print (default: js)
 *   --from=lisp|estree        Input language (default: lisp); estree reads a JSON target tree
 *   --eval=SOURCE, -e SOURCE  Compile SOURCE instead of reading files
 *   --pretty                  Pretty-print JSON output
 *   --provider=NAME           JSON provider to use (default: first on the classpath)
 *   --verbose, -v             Print stage diagnostics to stderr
 *
 * With no files and no --eval the source is read from standard input.
 */
public class LispJs {

    public static final int EXIT_OK = 0;
    public static final int EXIT_COMPILE_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    private final Config config;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private AstJsonProvider jsonProvider;

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Parses {@code args} and runs the tool against the given streams.
     *
     * @return the process exit status
     */
    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Config config = Config.parse(args, err);
        if (config == null) {
            printUsage(err);
            return EXIT_USAGE;
        }
        if (config.help) {
            printUsage(out);
            return EXIT_OK;
        }
        return new LispJs(config, in, out, err).run();
    }

    public LispJs(Config config, InputStream in, PrintStream out, PrintStream err) {
        this.config = config;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public int run() {
        if (config.emit == Emit.ESTREE || config.from == Language.ESTREE) {
            try {
                jsonProvider = config.provider == null
                    ? AstJsonProvider.getProvider()
                    : AstJsonProvider.getProvider(config.provider);
            } catch (IllegalStateException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_USAGE;
            }
        }

        List<Input> inputs;
        try {
            inputs = readInputs();
        } catch (IOException e) {
            err.println("Error: cannot read " + e.getMessage());
            return EXIT_USAGE;
        }

        int status = EXIT_OK;
        for (Input input : inputs) {
            try {
                processInput(input);
            } catch (CompileException e) {
                err.println(input.name + ": " + e.kind() + ": " + e.getMessage());
                status = EXIT_COMPILE_ERROR;
            } catch (AstJsonException e) {
                err.println(input.name + ": " + e.getMessage());
                status = EXIT_COMPILE_ERROR;
            }
        }
        return status;
    }

    private void processInput(Input input) {
        long startNanos = System.nanoTime();

        if (config.from == Language.ESTREE) {
            com.lispjs.estree.Program target = jsonProvider.getDeserializer().deserializeProgram(input.text);
            verbose(input, "read " + target.body().size() + " top-level nodes from JSON");
            emitTarget(target);
            verbose(input, "done in " + elapsedMillis(startNanos) + " ms");
            return;
        }

        List<Token> tokens = Lexer.tokenize(input.text);
        verbose(input, "lexed " + tokens.size() + " tokens");
        if (config.emit == Emit.TOKENS) {
            for (Token token : tokens) {
                out.println(token.type() + " " + token.text() + " @" + token.line() + ":" + token.column());
            }
            return;
        }

        Program ast = Parser.parse(tokens);
        verbose(input, "parsed " + ast.body().size() + " top-level forms");

        com.lispjs.estree.Program target = Transformer.transform(ast);
        emitTarget(target);
        verbose(input, "done in " + elapsedMillis(startNanos) + " ms");
    }

    private void emitTarget(com.lispjs.estree.Program target) {
        if (config.emit == Emit.ESTREE) {
            out.println(config.pretty
                ? jsonProvider.getSerializer().serializePretty(target)
                : jsonProvider.getSerializer().serialize(target));
        } else {
            out.println(CodeGenerator.generate(target));
        }
    }

    private List<Input> readInputs() throws IOException {
        List<Input> inputs = new ArrayList<>();
        if (config.eval != null) {
            inputs.add(new Input("<eval>", config.eval));
        }
        for (Path file : config.files) {
            inputs.add(new Input(file.toString(), Files.readString(file, StandardCharsets.UTF_8)));
        }
        if (inputs.isEmpty()) {
            inputs.add(new Input("<stdin>", new String(in.readAllBytes(), StandardCharsets.UTF_8)));
        }
        return inputs;
    }

    private void verbose(Input input, String message) {
        if (config.verbose) {
            err.println("[" + input.name + "] " + message);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: lispjs [options] [files...]");
        stream.println();
        stream.println("Options:");
        stream.println("  --emit=js|tokens|estree   What to print (default: js)");
        stream.println("  --from=lisp|estree        Input language (default: lisp)");
        stream.println("  --eval=SOURCE, -e SOURCE  Compile SOURCE instead of reading files");
        stream.println("  --pretty                  Pretty-print JSON output");
        stream.println("  --provider=NAME           JSON provider (default: first on the classpath)");
        stream.println("  --verbose, -v             Print stage diagnostics to stderr");
        stream.println("  --help, -h                Show this help");
        stream.println();
        stream.println("Reads standard input when no files and no --eval are given.");
    }

    private record Input(String name, String text) {}

    public enum Emit {
        JS, TOKENS, ESTREE
    }

    public enum Language {
        LISP, ESTREE
    }

    public static class Config {
        Emit emit = Emit.JS;
        Language from = Language.LISP;
        String eval = null;
        boolean pretty = false;
        String provider = null;
        boolean verbose = false;
        boolean help = false;
        List<Path> files = new ArrayList<>();

        /**
         * @return the parsed configuration, or null after reporting the problem to {@code err}
         */
        public static Config parse(String[] args, PrintStream err) {
            Config config = new Config();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.equals("--help") || arg.equals("-h")) {
                    config.help = true;
                } else if (arg.startsWith("--emit=")) {
                    String emit = arg.substring(7).toUpperCase(Locale.ROOT);
                    try {
                        config.emit = Emit.valueOf(emit);
                    } catch (IllegalArgumentException e) {
                        err.println("Invalid emit target: " + arg.substring(7));
                        return null;
                    }
                } else if (arg.startsWith("--from=")) {
                    String from = arg.substring(7).toUpperCase(Locale.ROOT);
                    try {
                        config.from = Language.valueOf(from);
                    } catch (IllegalArgumentException e) {
                        err.println("Invalid input language: " + arg.substring(7));
                        return null;
                    }
                } else if (arg.startsWith("--eval=")) {
                    config.eval = arg.substring(7);
                } else if (arg.equals("-e")) {
                    if (i + 1 >= args.length) {
                        err.println("Missing source after -e");
                        return null;
                    }
                    config.eval = args[++i];
                } else if (arg.equals("--pretty")) {
                    config.pretty = true;
                } else if (arg.startsWith("--provider=")) {
                    config.provider = arg.substring(11);
                } else if (arg.equals("--verbose") || arg.equals("-v")) {
                    config.verbose = true;
                } else if (!arg.startsWith("-")) {
                    config.files.add(Path.of(arg));
                } else {
                    err.println("Unknown option: " + arg);
                    return null;
                }
            }

            if (config.from == Language.ESTREE && config.emit == Emit.TOKENS) {
                err.println("Error: --emit=tokens needs lisp input");
                return null;
            }

            return config;
        }
    }
}
