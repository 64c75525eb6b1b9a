package io.github.eutro.peval.test;

import io.github.eutro.peval.core.function.Tags;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.inline.InlineFunctions;
import io.github.eutro.peval.core.runtime.UserFunction;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

import static io.github.eutro.peval.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class InlineTest {
    @Test
    void testInlineFunctions() {
        Map<String, Object> globals = loadModule(
                "@inline",
                "def inlined(y):",
                "    l = []",
                "    for _ in range(y):",
                "        l.append(y.do_stuff())",
                "    return l",
                "",
                "def outer(x):",
                "    a = x.foo()",
                "    if a:",
                "        b = a * 10",
                "    a = b + inlined(x)",
                "    return a"
        );
        Specimen result = InlineFunctions.INSTANCE.run(specimenOf(getFunction(globals, "outer")));
        assertTree(result.tree,
                "def outer(x):",
                "    a = x.foo()",
                "    if a:",
                "        b = a * 10",
                "    __peval_mangled_1 = x",
                "    __peval_mangled_2 = []",
                "    for __peval_mangled_3 in range(__peval_mangled_1):",
                "        __peval_mangled_2.append(__peval_mangled_1.do_stuff())",
                "    __peval_return_1 = __peval_mangled_2",
                "    a = b + __peval_return_1",
                "    return a");
    }

    @Test
    void testSeveralReturns() {
        Map<String, Object> globals = loadModule(
                "@inline",
                "def sign(n):",
                "    if n > 0:",
                "        return 1",
                "    return -1",
                "",
                "def f(x):",
                "    return sign(x)"
        );
        Specimen result = InlineFunctions.INSTANCE.run(specimenOf(getFunction(globals, "f")));
        assertTree(result.tree,
                "def f(x):",
                "    __peval_mangled_1 = x",
                "    while True:",
                "        if __peval_mangled_1 > 0:",
                "            __peval_return_1 = 1",
                "            break",
                "        __peval_return_1 = -1",
                "        break",
                "    return __peval_return_1");
    }

    @Test
    void testReturnsInLoops() {
        Map<String, Object> globals = loadModule(
                "@inline",
                "def find(xs, t):",
                "    for v in xs:",
                "        if v == t:",
                "            return True",
                "    return False",
                "",
                "def f(xs):",
                "    return find(xs, 3)"
        );
        Specimen result = InlineFunctions.INSTANCE.run(specimenOf(getFunction(globals, "f")));
        assertTree(result.tree,
                "def f(xs):",
                "    __peval_mangled_1 = xs",
                "    __peval_mangled_2 = 3",
                "    __peval_return_flag_1 = False",
                "    while True:",
                "        for __peval_mangled_3 in __peval_mangled_1:",
                "            if __peval_mangled_3 == __peval_mangled_2:",
                "                __peval_return_1 = True",
                "                __peval_return_flag_1 = True",
                "                break",
                "        if __peval_return_flag_1:",
                "            break",
                "        __peval_return_1 = False",
                "        break",
                "    return __peval_return_1");
    }

    @Test
    void testDefaultsAndKeywords() {
        Map<String, Object> globals = loadModule(
                "@inline",
                "def scale(v, factor=2):",
                "    return v * factor",
                "",
                "def f(x):",
                "    return scale(factor=x, v=1) + scale(x)"
        );
        Specimen result = InlineFunctions.INSTANCE.run(specimenOf(getFunction(globals, "f")));
        assertTree(result.tree,
                "def f(x):",
                "    __peval_mangled_2 = x",
                "    __peval_mangled_1 = 1",
                "    __peval_return_1 = __peval_mangled_1 * __peval_mangled_2",
                "    __peval_mangled_3 = x",
                "    __peval_mangled_4 = 2",
                "    __peval_return_2 = __peval_mangled_3 * __peval_mangled_4",
                "    return __peval_return_1 + __peval_return_2");
    }

    @Test
    void testConditionalCallsNotInlined() {
        Map<String, Object> globals = loadModule(
                "@inline",
                "def double(v):",
                "    return v * 2",
                "",
                "def f(x, y):",
                "    return x and double(y)"
        );
        Specimen specimen = specimenOf(getFunction(globals, "f"));
        Specimen result = InlineFunctions.INSTANCE.run(specimen);
        assertSame(specimen, result);
    }

    @Test
    void testNotInlined() {
        Map<String, Object> globals = loadModule(
                "def plain(v):",
                "    return v",
                "",
                "def f(x):",
                "    return plain(x)"
        );
        Specimen specimen = specimenOf(getFunction(globals, "f"));
        assertSame(specimen, InlineFunctions.INSTANCE.run(specimen));
    }

    @Test
    void testStarArgsRejected() {
        Map<String, Object> globals = loadModule(
                "@inline",
                "def first(v):",
                "    return v",
                "",
                "def f(xs):",
                "    return first(*xs)"
        );
        Specimen specimen = specimenOf(getFunction(globals, "f"));
        assertThrows(IllegalStateException.class, () -> InlineFunctions.INSTANCE.run(specimen));
    }

    @Test
    void testInlineTagRejectsClosures() {
        Map<String, Object> globals = loadModule(
                "def make():",
                "    k = 1",
                "    def g(v):",
                "        return v + k",
                "    return g"
        );
        UserFunction make = getFunction(globals, "make");
        Object g = make.call(Collections.emptyList(), Collections.emptyMap());
        assertThrows(IllegalArgumentException.class, () -> Tags.inline(g));
    }
}
