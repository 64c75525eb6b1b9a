package io.github.eutro.peval.test;

import io.github.eutro.peval.core.runtime.ScriptException;
import io.github.eutro.peval.core.runtime.ScriptType;
import io.github.eutro.peval.core.runtime.Tuple;
import io.github.eutro.peval.core.runtime.UserFunction;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static io.github.eutro.peval.test.Utils.getFunction;
import static io.github.eutro.peval.test.Utils.loadModule;
import static org.junit.jupiter.api.Assertions.*;

public class InterpreterTest {
    private static Object call(Map<String, Object> globals, String name, Object... args) {
        return getFunction(globals, name).call(Arrays.asList(args), Collections.emptyMap());
    }

    @Test
    void testLoops() {
        Map<String, Object> globals = loadModule(
                "def power(x, n):",
                "    result = 1",
                "    for _ in range(n):",
                "        result = result * x",
                "    return result",
                "",
                "def collatz(n):",
                "    steps = 0",
                "    while n != 1:",
                "        if n % 2 == 0:",
                "            n //= 2",
                "        else:",
                "            n = 3 * n + 1",
                "        steps += 1",
                "    return steps"
        );
        assertEquals(1024L, call(globals, "power", 2L, 10L));
        assertEquals(1L, call(globals, "power", 7L, 0L));
        assertEquals(111L, call(globals, "collatz", 27L));
    }

    @Test
    void testClosures() {
        Map<String, Object> globals = loadModule(
                "def adder(k):",
                "    def add(v):",
                "        return v + k",
                "    return add",
                "",
                "def counter():",
                "    counts = {}",
                "    for word in ['a', 'b', 'a']:",
                "        counts[word] = counts.get(word, 0) + 1",
                "    return counts"
        );
        UserFunction add = (UserFunction) call(globals, "adder", 5L);
        assertEquals(8L, add.call(Collections.singletonList(3L), Collections.emptyMap()));
        Map<?, ?> counts = (Map<?, ?>) call(globals, "counter");
        assertEquals(2L, counts.get("a"));
        assertEquals(1L, counts.get("b"));
    }

    @Test
    void testExceptions() {
        Map<String, Object> globals = loadModule(
                "def safe_div(a, b):",
                "    try:",
                "        return a // b",
                "    except ZeroDivisionError:",
                "        return None",
                "    finally:",
                "        pass",
                "",
                "def fail():",
                "    raise ValueError('bad')"
        );
        assertEquals(3L, call(globals, "safe_div", 7L, 2L));
        assertNull(call(globals, "safe_div", 7L, 0L));
        ScriptException e = assertThrows(ScriptException.class, () -> call(globals, "fail"));
        assertTrue(e.is(ScriptType.VALUE_ERROR));
    }

    @Test
    void testComprehensionsAndUnpacking() {
        Map<String, Object> globals = loadModule(
                "def squares(n):",
                "    return [i * i for i in range(n) if i % 2 == 1]",
                "",
                "def swap(pair):",
                "    a, b = pair",
                "    return b, a"
        );
        assertEquals(Arrays.asList(1L, 9L, 25L), call(globals, "squares", 6L));
        assertEquals(Tuple.of(2L, 1L), call(globals, "swap", Tuple.of(1L, 2L)));
    }

    @Test
    void testGenerators() {
        Map<String, Object> globals = loadModule(
                "def gen(n):",
                "    for i in range(n):",
                "        yield i * 10",
                "",
                "def collect(n):",
                "    return list(gen(n))"
        );
        assertEquals(Arrays.asList(0L, 10L, 20L), call(globals, "collect", 3L));
    }

    @Test
    void testUnboundLocal() {
        Map<String, Object> globals = loadModule(
                "def f(c):",
                "    if c:",
                "        x = 1",
                "    return x"
        );
        assertEquals(1L, call(globals, "f", true));
        ScriptException e = assertThrows(ScriptException.class, () -> call(globals, "f", false));
        assertTrue(e.is(ScriptType.NAME_ERROR));
    }

    @Test
    void testModuleLevelCode() {
        Map<String, Object> globals = loadModule(
                "x = 2",
                "y = [x, x * 2]",
                "z = sum(y) + len('abc')"
        );
        assertEquals(9L, globals.get("z"));
        assertEquals(Arrays.asList(2L, 4L), (List<?>) globals.get("y"));
    }
}
