package io.github.eutro.peval.test;

import io.github.eutro.peval.core.parse.Parser;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.prune.PruneAssignments;
import io.github.eutro.peval.core.passes.prune.PruneCfg;
import io.github.eutro.peval.core.runtime.Builtins;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.peval.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class PruneTest {
    private static Specimen specimen(Map<String, ?> bindings, String... lines) {
        return new Specimen(Parser.parseFunction(source(lines)), bindings);
    }

    private static Specimen specimen(String... lines) {
        return specimen(Collections.emptyMap(), lines);
    }

    @Test
    void testIfTrue() {
        for (Object x : Arrays.asList(true, 1L, 2.0, "foo", Builtins.get("int"))) {
            Specimen specimen = specimen(Collections.singletonMap("x", x),
                    "def f_if():",
                    "    if x:",
                    "        print('x is True')");
            assertTree(PruneCfg.INSTANCE.run(specimen).tree,
                    "def f_if():",
                    "    print('x is True')");
        }

        Specimen specimen = specimen(Collections.singletonMap("x", 2L),
                "def f_if_else():",
                "    if x:",
                "        print('x is True')",
                "    else:",
                "        print('x is False')");
        assertTree(PruneCfg.INSTANCE.run(specimen).tree,
                "def f_if_else():",
                "    print('x is True')");
    }

    @Test
    void testIfFalse() {
        List<Object> falseValues = Arrays.asList(0L, "", new ArrayList<>(), new LinkedHashMap<>(),
                new LinkedHashSet<>(), false, null);
        for (Object x : falseValues) {
            Specimen specimen = specimen(Collections.singletonMap("x", x),
                    "def f_if():",
                    "    if x:",
                    "        print('x is True')");
            assertTree(PruneCfg.INSTANCE.run(specimen).tree,
                    "def f_if():",
                    "    pass");
        }

        Specimen specimen = specimen(Collections.singletonMap("x", false),
                "def f_if_else():",
                "    if x:",
                "        print('x is True')",
                "    else:",
                "        print('x is False')");
        assertTree(PruneCfg.INSTANCE.run(specimen).tree,
                "def f_if_else():",
                "    print('x is False')");
    }

    @Test
    void testIfNotEliminated() {
        Specimen specimen = specimen(Collections.singletonMap("y", 2L),
                "def f(x):",
                "    if x:",
                "        a = 1",
                "    else:",
                "        a = 2");
        assertSame(specimen, PruneCfg.INSTANCE.run(specimen));
    }

    @Test
    void testLocalShadowsBinding() {
        Specimen specimen = specimen(Collections.singletonMap("x", true),
                "def f(x):",
                "    if x:",
                "        a = 1",
                "    return a");
        assertSame(specimen, PruneCfg.INSTANCE.run(specimen));
    }

    @Test
    void testVisitAllBranches() {
        Specimen specimen = specimen(
                "def f():",
                "    if x > 0:",
                "        if True:",
                "            x += 1",
                "    else:",
                "        if False:",
                "            return 0");
        assertTree(PruneCfg.INSTANCE.run(specimen).tree,
                "def f():",
                "    if x > 0:",
                "        x += 1",
                "    else:",
                "        pass");
    }

    @Test
    void testRemovePass() {
        Specimen specimen = specimen(
                "def f(x):",
                "    x += 1",
                "    pass",
                "    x += 1");
        assertTree(PruneCfg.INSTANCE.run(specimen).tree,
                "def f(x):",
                "    x += 1",
                "    x += 1");
    }

    @Test
    void testKeepOnlyPass() {
        Specimen specimen = specimen(
                "def f(x):",
                "    pass");
        assertSame(specimen, PruneCfg.INSTANCE.run(specimen));
    }

    @Test
    void testRemoveCodeAfterJump() {
        Specimen specimen = specimen(
                "def f(x):",
                "    x += 1",
                "    return x",
                "    x += 1");
        assertTree(PruneCfg.INSTANCE.run(specimen).tree,
                "def f(x):",
                "    x += 1",
                "    return x");
    }

    @Test
    void testWhileNotSimplified() {
        Specimen specimen = specimen(
                "def f(x):",
                "    while x > 1:",
                "        x += 1",
                "    else:",
                "        x = 10");
        assertSame(specimen, PruneCfg.INSTANCE.run(specimen));
    }

    @Test
    void testSimplifyWhile() {
        Specimen specimen = specimen(
                "def f(x):",
                "    while x > 1:",
                "        x += 1",
                "        raise Exception",
                "    else:",
                "        x = 10");
        assertTree(PruneCfg.INSTANCE.run(specimen).tree,
                "def f(x):",
                "    if x > 1:",
                "        x += 1",
                "        raise Exception",
                "    else:",
                "        x = 10");
    }

    @Test
    void testSimplifyWhileWithBreak() {
        Specimen specimen = specimen(
                "def f(x):",
                "    while x > 1:",
                "        x += 1",
                "        break",
                "    else:",
                "        x = 10");
        assertTree(PruneCfg.INSTANCE.run(specimen).tree,
                "def f(x):",
                "    if x > 1:",
                "        x += 1",
                "    else:",
                "        x = 10");
    }

    @Test
    void testWhileFalse() {
        Specimen specimen = specimen(
                "def f(x):",
                "    while False:",
                "        x += 1",
                "    return x");
        assertTree(PruneCfg.INSTANCE.run(specimen).tree,
                "def f(x):",
                "    return x");
    }

    @Test
    void testRemoveDeadStores() {
        Specimen specimen = specimen(
                "def f(x):",
                "    a = 1",
                "    b = g(x)",
                "    c = x",
                "    return x");
        assertTree(PruneAssignments.INSTANCE.run(specimen).tree,
                "def f(x):",
                "    g(x)",
                "    return x");
    }

    @Test
    void testKeepLiveStores() {
        Specimen specimen = specimen(
                "def f(x):",
                "    a = 1",
                "    if x:",
                "        a = 2",
                "    return a");
        assertSame(specimen, PruneAssignments.INSTANCE.run(specimen));
    }

    @Test
    void testKeepStoresInLoops() {
        Specimen specimen = specimen(
                "def f(n):",
                "    total = 0",
                "    i = 0",
                "    while i < n:",
                "        total += i",
                "        i += 1",
                "    return total");
        assertSame(specimen, PruneAssignments.INSTANCE.run(specimen));
    }

    @Test
    void testKeepStoresBeforeHandlers() {
        Specimen specimen = specimen(
                "def f(x):",
                "    a = 1",
                "    try:",
                "        a = 2",
                "        g(x)",
                "        a = 3",
                "    except Exception:",
                "        return a",
                "    return a");
        assertSame(specimen, PruneAssignments.INSTANCE.run(specimen));
    }

    @Test
    void testPropagateCopies() {
        Specimen specimen = specimen(
                "def f(x):",
                "    y = x",
                "    return y + 1");
        assertTree(PruneAssignments.INSTANCE.run(specimen).tree,
                "def f(x):",
                "    return x + 1");
    }

    @Test
    void testNoCopyPropagationAcrossStores() {
        Specimen specimen = specimen(
                "def f(x):",
                "    y = x",
                "    x = 2",
                "    return x + y");
        assertSame(specimen, PruneAssignments.INSTANCE.run(specimen));
    }
}
