package io.github.eutro.peval.test;

import io.github.eutro.peval.core.function.FunctionSource;
import io.github.eutro.peval.core.parse.Parser;
import io.github.eutro.peval.core.passes.Passes;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.TreePass;
import io.github.eutro.peval.core.passes.header.FunctionHeader;
import io.github.eutro.peval.core.passes.misc.ChainedPass;
import io.github.eutro.peval.core.passes.misc.FixpointPass;
import io.github.eutro.peval.core.print.TreePrinter;
import io.github.eutro.peval.core.runtime.Builtins;
import io.github.eutro.peval.core.runtime.UserFunction;
import io.github.eutro.peval.core.tree.Trees;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static io.github.eutro.peval.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    private static Specimen specimen(String... lines) {
        return new Specimen(Parser.parseFunction(source(lines)), Collections.emptyMap());
    }

    @Test
    void testPipeline() {
        Specimen result = Passes.pipeline().run(specimen(
                "def f():",
                "    a = 1",
                "    if a > 2:",
                "        b = 3",
                "    else:",
                "        b = 2",
                "    return b"));
        assertTree(result.tree,
                "def f():",
                "    return 2");
    }

    @Test
    void testPipelineRemovesOverwrittenStores() {
        Specimen result = Passes.pipeline().run(specimen(
                "def f():",
                "    a = 1",
                "    a = 2",
                "    return a"));
        assertTree(result.tree,
                "def f():",
                "    return 2");
    }

    @Test
    void testPipelineInlinesAndFolds() {
        Map<String, Object> globals = loadModule(
                "@inline",
                "def square(v):",
                "    return v * v",
                "",
                "def f(x):",
                "    k = 3",
                "    return square(k) + x"
        );
        Specimen result = Passes.pipeline().run(specimenOf(getFunction(globals, "f")));
        assertTree(result.tree,
                "def f(x):",
                "    return 9 + x");
    }

    private static UserFunction compile(UserFunction original, Specimen specimen) {
        return FunctionSource.of(original).replace(specimen.tree, specimen.bindings).toFunction();
    }

    @Test
    void testLocalsShadowBindings() {
        UserFunction fn = getFunction(loadModule(
                "def f(x):",
                "    a = x",
                "    x = len",
                "    return a is x"
        ), "f");
        Specimen result = Passes.pipeline().run(specimenOf(fn));
        UserFunction specialized = compile(fn, result);
        assertEquals(false, fn.call(Collections.singletonList(5L), Collections.emptyMap()));
        assertEquals(false, specialized.call(Collections.singletonList(5L), Collections.emptyMap()));
        assertEquals(true, specialized.call(Collections.singletonList(Builtins.get("len")), Collections.emptyMap()));
    }

    private static final String[] FIND = {
            "hit = [1, 3, 5]",
            "miss = [2, 4]",
            "",
            "@inline",
            "def find(xs, t):",
            "    for v in xs:",
            "        if v == t:",
            "            return True",
            "    return False",
            "",
            "def f(xs):",
            "    return find(xs, 3)"
    };

    @Test
    void testPipelineIsIdempotent() {
        Map<String, Object> globals = loadModule(FIND);
        UserFunction fn = getFunction(globals, "f");
        Specimen once = Passes.pipeline().run(specimenOf(fn));
        assertTrue(TreePrinter.print(once.tree).contains("__peval_"), () -> TreePrinter.print(once.tree));

        Specimen twice = Passes.pipeline().run(once);
        assertTrue(Trees.equal(once.tree, twice.tree), () -> TreePrinter.print(twice.tree));
        assertEquals(once.bindings.keySet(), twice.bindings.keySet());

        UserFunction specialized = compile(fn, twice);
        for (String name : new String[]{"hit", "miss"}) {
            List<Object> args = Collections.singletonList(globals.get(name));
            assertEquals(fn.call(args, Collections.emptyMap()), specialized.call(args, Collections.emptyMap()));
        }
    }

    @Test
    void testPipelineIsDeterministic() {
        UserFunction fn = getFunction(loadModule(FIND), "f");
        Specimen first = Passes.pipeline().run(specimenOf(fn));
        Specimen second = Passes.pipeline().run(specimenOf(fn));
        assertEquals(TreePrinter.print(first.tree), TreePrinter.print(second.tree));
        assertEquals(first.bindings.keySet(), second.bindings.keySet());
    }

    @Test
    void testFixpointListener() {
        List<Boolean> changes = new ArrayList<>();
        TreePass<Specimen, Specimen> pipeline = Passes.pipeline(Passes.STANDARD, 64,
                (iteration, result, changed) -> {
                    assertEquals(changes.size(), iteration);
                    changes.add(changed);
                });
        pipeline.run(specimen(
                "def f():",
                "    a = 1",
                "    a = 2",
                "    return a"));
        assertFalse(changes.isEmpty());
        assertFalse(changes.get(changes.size() - 1));
        for (int i = 0; i < changes.size() - 1; i++) {
            assertTrue(changes.get(i));
        }
    }

    @Test
    void testFixpointLimit() {
        int[] runs = {0};
        TreePass<Specimen, Specimen> renaming = specimen -> {
            runs[0]++;
            return specimen.withTree(specimen.tree.withName(specimen.tree.name + "_"));
        };
        Specimen result = new FixpointPass(renaming, 5, null).run(specimen(
                "def f():",
                "    pass"));
        assertEquals(5, runs[0]);
        assertEquals("f_____", result.tree.name);
        assertThrows(IllegalArgumentException.class, () -> new FixpointPass(renaming, 0, null));
    }

    @Test
    void testChainedPass() {
        TreePass<Specimen, Specimen> failing = specimen -> {
            throw new IllegalStateException("failed");
        };
        TreePass<Specimen, Specimen> chain = FunctionHeader.INSTANCE.then(Passes.STANDARD).then(failing);
        assertEquals(3, ((ChainedPass<?, ?, ?>) chain).listPasses().size());
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> chain.run(specimen(
                "def f():",
                "    pass")));
        assertEquals(1, e.getSuppressed().length);
        assertEquals("running pass 2 in chain", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testFunctionHeader() {
        Map<String, Object> globals = loadModule(
                "types = {'tp1': int}",
                "",
                "@pure",
                "def get_type():",
                "    return str",
                "",
                "def dummy(x: int, y: types['tp1'] = 'aaa') -> get_type():",
                "    pass"
        );
        Specimen result = FunctionHeader.INSTANCE.run(specimenOf(getFunction(globals, "dummy")));
        assertTree(result.tree,
                "def dummy(x: int, y: __peval_temp_1 = 'aaa') -> __peval_temp_2:",
                "    pass");
        assertSame(Builtins.get("int"), result.bindings.get("__peval_temp_1"));
        assertSame(Builtins.get("str"), result.bindings.get("__peval_temp_2"));
    }
}
