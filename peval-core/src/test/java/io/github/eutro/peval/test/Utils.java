package io.github.eutro.peval.test;

import io.github.eutro.peval.core.function.FunctionSource;
import io.github.eutro.peval.core.parse.Parser;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.print.TreePrinter;
import io.github.eutro.peval.core.runtime.Interpreter;
import io.github.eutro.peval.core.runtime.UserFunction;
import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.Trees;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertTrue;

public class Utils {
    @NotNull
    public static String source(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @NotNull
    public static Map<String, Object> loadModule(String... lines) {
        Map<String, Object> globals = new HashMap<>();
        Interpreter.runModule(Parser.parseModule(source(lines)), globals);
        return globals;
    }

    @NotNull
    public static UserFunction getFunction(Map<String, Object> globals, String name) {
        Object fn = globals.get(name);
        if (!(fn instanceof UserFunction)) {
            throw new IllegalArgumentException(name + " is not a function");
        }
        return (UserFunction) fn;
    }

    @NotNull
    public static Specimen specimenOf(UserFunction fn) {
        FunctionSource source = FunctionSource.of(fn);
        return new Specimen(source.tree, source.bindings);
    }

    public static void assertTree(Stmt.FunctionDef actual, String... expected) {
        Stmt.FunctionDef tree = Parser.parseFunction(source(expected));
        assertTrue(Trees.equal(tree, actual), () -> "expected:\n" + TreePrinter.print(tree)
                + "but got:\n" + TreePrinter.print(actual));
    }
}
