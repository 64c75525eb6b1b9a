package io.github.eutro.peval.api;

import io.github.eutro.peval.core.parse.ParseException;
import io.github.eutro.peval.core.parse.Parser;
import io.github.eutro.peval.core.print.TreePrinter;
import io.github.eutro.peval.core.runtime.Frame;
import io.github.eutro.peval.core.runtime.Interpreter;
import io.github.eutro.peval.core.runtime.ScriptException;
import io.github.eutro.peval.core.runtime.UserFunction;
import io.github.eutro.peval.core.tree.ModuleNode;
import io.github.eutro.peval.core.tree.Stmt;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

public class Cli {
    public static void main(String[] args) {
        String path = null;
        String fnName = null;
        Map<String, String> defines = new LinkedHashMap<>();
        boolean suppressFlags = false;
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp();
                        return;
                    case "-f":
                    case "--function":
                        if (i == args.length) fail("%s: expected function name", arg);
                        if (fnName != null) fail("%s: function already specified", arg);
                        fnName = args[i++];
                        break;
                    case "-D":
                    case "--define":
                        if (i == args.length) fail("%s: expected name=value", arg);
                        String define = args[i++];
                        int eq = define.indexOf('=');
                        if (eq <= 0) fail("%s: expected name=value, got \"%s\"", arg, define);
                        defines.put(define.substring(0, eq), define.substring(eq + 1));
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        fail("%s: unknown flag", arg);
                }
                continue;
            }
            if (path != null) fail("%s: file already specified", arg);
            path = arg;
        }
        if (path == null) {
            printHelp();
            System.exit(1);
        }

        String source;
        try {
            source = new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            fail("could not read file %s: %s", path, e);
            return;
        }
        try {
            System.out.print(run(source, fnName, defines));
        } catch (ParseException | ScriptException | IllegalArgumentException e) {
            fail("%s: %s", path, e.getMessage());
        }
    }

    /**
     * Run a module, and partially apply one of its functions.
     *
     * @param source  The source of the module.
     * @param fnName  The name of the function, or null for the last function the module defines.
     * @param defines The arguments to apply, as source expressions.
     * @return The source of the specialized function.
     */
    static String run(String source, @Nullable String fnName, Map<String, String> defines) {
        ModuleNode module = Parser.parseModule(source);
        if (fnName == null) {
            for (Stmt stmt : module.body) {
                if (stmt instanceof Stmt.FunctionDef) fnName = ((Stmt.FunctionDef) stmt).name;
            }
            if (fnName == null) throw new IllegalArgumentException("no function defined");
        }
        Map<String, Object> globals = new HashMap<>();
        Interpreter.runModule(module, globals);
        Object fn = globals.get(fnName);
        if (!(fn instanceof UserFunction)) {
            throw new IllegalArgumentException("'" + fnName + "' is not a function");
        }

        Frame frame = Frame.module(globals);
        Map<String, Object> kwargs = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : defines.entrySet()) {
            kwargs.put(entry.getKey(), Interpreter.evaluate(Parser.parseExpression(entry.getValue()), frame));
        }
        UserFunction result = new PartialEvaluator().partialApply((UserFunction) fn, Collections.emptyList(), kwargs);
        return TreePrinter.print(result.def);
    }

    private static void fail(String format, Object... args) {
        System.err.printf(format + "%n", args);
        System.exit(1);
    }

    private static void printHelp() {
        System.out.println(
                "usage: peval [-h|--help] [-f|--function <name>] [-D|--define <name>=<value>]... <file>\n" +
                        "\n" +
                        "  <file> : the module to load\n" +
                        "  -f|--function <name> : the function to specialize, by default the last one defined\n" +
                        "  -D|--define <name>=<value> : bind parameter <name> to the value of expression <value>\n" +
                        "  -h|--help : show this help"
        );
    }
}
