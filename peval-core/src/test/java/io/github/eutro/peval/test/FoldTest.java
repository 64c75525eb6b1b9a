package io.github.eutro.peval.test;

import io.github.eutro.peval.core.parse.Parser;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.fold.Fold;
import io.github.eutro.peval.core.runtime.Builtins;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.github.eutro.peval.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class FoldTest {
    @Test
    void testFold() {
        Specimen specimen = new Specimen(Parser.parseFunction(source(
                "def dummy(x):",
                "    a = 1",
                "    if a > 2:",
                "        b = 3",
                "        c = 4 + 6",
                "    else:",
                "        b = 2",
                "        c = 3 + a",
                "    return a + b + c + x"
        )), Collections.emptyMap());
        assertTree(Fold.INSTANCE.run(specimen).tree,
                "def dummy(x):",
                "    a = 1",
                "    if False:",
                "        b = 3",
                "        c = 10",
                "    else:",
                "        b = 2",
                "        c = 4",
                "    return 1 + b + c + x");
    }

    @Test
    void testVariableAnnotations() {
        Map<String, Object> globals = loadModule(
                "@pure",
                "def int32():",
                "    return int",
                "",
                "def func_annotations():",
                "    x = int",
                "    a: x",
                "    x = float",
                "    b: x",
                "    c: int32()"
        );
        Specimen result = Fold.INSTANCE.run(specimenOf(getFunction(globals, "func_annotations")));
        assertTree(result.tree,
                "def func_annotations():",
                "    x = int",
                "    a: __peval_temp_1",
                "    x = float",
                "    b: __peval_temp_2",
                "    c: __peval_temp_3");
        assertSame(Builtins.get("int"), result.bindings.get("__peval_temp_1"));
        assertSame(Builtins.get("float"), result.bindings.get("__peval_temp_2"));
        assertSame(Builtins.get("int"), result.bindings.get("__peval_temp_3"));
    }

    @Test
    void testLoopMayNotRun() {
        Specimen specimen = new Specimen(Parser.parseFunction(source(
                "def f(xs):",
                "    found = False",
                "    for x in xs:",
                "        found = True",
                "    return found"
        )), Collections.emptyMap());
        assertTree(Fold.INSTANCE.run(specimen).tree,
                "def f(xs):",
                "    found = False",
                "    for x in xs:",
                "        found = True",
                "    return found");
    }

    @Test
    void testLoopInvariant() {
        Specimen specimen = new Specimen(Parser.parseFunction(source(
                "def f(n):",
                "    k = 2",
                "    total = 0",
                "    while total < n:",
                "        total += k * 3",
                "    return total"
        )), Collections.emptyMap());
        assertTree(Fold.INSTANCE.run(specimen).tree,
                "def f(n):",
                "    k = 2",
                "    total = 0",
                "    while total < n:",
                "        total += 6",
                "    return total");
    }

    @Test
    void testExternalBindings() {
        Map<String, Object> bindings = new HashMap<>();
        bindings.put("scale", 10L);
        bindings.put("len", Builtins.get("len"));
        Specimen specimen = new Specimen(Parser.parseFunction(source(
                "def f(x):",
                "    return x * scale + len('abc')"
        )), bindings);
        assertTree(Fold.INSTANCE.run(specimen).tree,
                "def f(x):",
                "    return x * 10 + 3");
    }

    @Test
    void testLocalsShadowBindings() {
        Map<String, Object> bindings = new HashMap<>();
        bindings.put("x", 1L);
        bindings.put("a", 2L);
        Specimen specimen = new Specimen(Parser.parseFunction(source(
                "def f(x):",
                "    b = a",
                "    a = x",
                "    return a + b"
        )), bindings);
        assertTree(Fold.INSTANCE.run(specimen).tree,
                "def f(x):",
                "    b = a",
                "    a = x",
                "    return a + b");
    }

    @Test
    void testImpureCallNotEvaluated() {
        Map<String, Object> globals = loadModule(
                "counter = []",
                "def bump():",
                "    counter.append(1)",
                "    return 1",
                "",
                "def f():",
                "    return bump()"
        );
        Specimen result = Fold.INSTANCE.run(specimenOf(getFunction(globals, "f")));
        assertTree(result.tree,
                "def f():",
                "    return bump()");
        assertTrue(((List<?>) globals.get("counter")).isEmpty());
    }
}
