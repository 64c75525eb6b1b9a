package io.github.eutro.peval.api;

import io.github.eutro.peval.api.events.IterationEvent;
import io.github.eutro.peval.api.events.ModifyPassesEvent;
import io.github.eutro.peval.api.events.RunSpecializationEvent;
import io.github.eutro.peval.api.events.SpecializedEvent;
import io.github.eutro.peval.core.parse.Parser;
import io.github.eutro.peval.core.print.TreePrinter;
import io.github.eutro.peval.core.runtime.Interpreter;
import io.github.eutro.peval.core.runtime.UserFunction;
import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.Trees;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class PartialEvaluatorTest {
    static UserFunction define(String name, String... lines) {
        Map<String, Object> globals = new HashMap<>();
        Interpreter.runModule(Parser.parseModule(String.join("\n", lines) + "\n"), globals);
        return (UserFunction) globals.get(name);
    }

    static void assertTree(Stmt.FunctionDef actual, String... expected) {
        Stmt.FunctionDef tree = Parser.parseFunction(String.join("\n", expected) + "\n");
        assertTrue(Trees.equal(tree, actual), () -> "expected:\n" + TreePrinter.print(tree)
                + "but got:\n" + TreePrinter.print(actual));
    }

    static final String[] SCALE = {
            "def scale(x, factor, offset):",
            "    if factor == 0:",
            "        return offset",
            "    return x * factor + offset"
    };

    static final String[] POWER = {
            "def power(x, n):",
            "    result = 1",
            "    while n > 0:",
            "        result = result * x",
            "        n = n - 1",
            "    return result"
    };

    @Test
    void testPartialApply() {
        UserFunction scale = define("scale", SCALE);
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("factor", 2L);
        kwargs.put("offset", 1L);
        UserFunction specialized = new PartialEvaluator().partialApply(scale, Collections.emptyList(), kwargs);
        assertTree(specialized.def,
                "def scale(x):",
                "    return x * 2 + 1");
        assertEquals(7L, specialized.call(Collections.singletonList(3L), Collections.emptyMap()));
    }

    @Test
    void testPartialApplyKeepsBehaviour() {
        UserFunction power = define("power", POWER);
        PartialEvaluator evaluator = new PartialEvaluator();
        for (long n = 0; n < 5; n++) {
            UserFunction specialized = evaluator.partialApply(power, Collections.emptyList(),
                    Collections.singletonMap("n", n));
            assertEquals(1, specialized.def.args.params.size());
            for (long x = -2; x <= 2; x++) {
                assertEquals(power.call(Arrays.asList(x, n), Collections.emptyMap()),
                        specialized.call(Collections.singletonList(x), Collections.emptyMap()));
            }
        }
    }

    @Test
    void testPartialEvalUsesGlobals() {
        UserFunction fn = define("f",
                "factor = 5",
                "def f(x):",
                "    return x * factor");
        UserFunction specialized = new PartialEvaluator().partialEval(fn);
        assertTree(specialized.def,
                "def f(x):",
                "    return x * 5");
    }

    @Test
    void testEvents() {
        UserFunction scale = define("scale", SCALE);
        PartialEvaluator evaluator = new PartialEvaluator();
        List<String> fired = new ArrayList<>();
        List<IterationEvent> iterations = new ArrayList<>();
        evaluator.listen(RunSpecializationEvent.class, evt -> fired.add("run"));
        evaluator.lift().listen(ModifyPassesEvent.class, evt -> {
            fired.add("passes");
            assertEquals(evaluator.getMaxIterations(), evt.maxIterations);
        });
        evaluator.lift().listen(IterationEvent.class, iterations::add);
        evaluator.lift().listen(SpecializedEvent.class, evt -> fired.add("specialized"));

        evaluator.partialApply(scale, Collections.emptyList(), Collections.singletonMap("factor", 0L));
        assertEquals(Arrays.asList("run", "passes", "specialized"), fired);
        assertFalse(iterations.isEmpty());
        for (int i = 0; i < iterations.size(); i++) {
            assertEquals(i, iterations.get(i).iteration);
            assertEquals(i != iterations.size() - 1, iterations.get(i).changed);
        }
    }

    @Test
    void testModifyPasses() {
        UserFunction scale = define("scale", SCALE);
        PartialEvaluator evaluator = new PartialEvaluator();
        int[] iterations = {0};
        evaluator.lift().listen(ModifyPassesEvent.class, evt -> evt.maxIterations = 1);
        evaluator.lift().listen(IterationEvent.class, evt -> iterations[0]++);
        evaluator.partialApply(scale, Collections.emptyList(), Collections.singletonMap("factor", 0L));
        assertEquals(1, iterations[0]);
    }

    @Test
    void testSpecializedEventReplacesResult() {
        UserFunction scale = define("scale", SCALE);
        PartialEvaluator evaluator = new PartialEvaluator();
        evaluator.lift().listen(SpecializedEvent.class, evt ->
                evt.specimen = evt.specimen.withTree(evt.specimen.tree.withName("scaled")));
        UserFunction specialized = evaluator.partialEval(scale);
        assertEquals("scaled", specialized.getName());
    }

    @Test
    void testRejected() {
        PartialEvaluator evaluator = new PartialEvaluator();
        UserFunction nested = define("f",
                "def f(x):",
                "    g = lambda y: y + 1",
                "    return g(x)");
        assertThrows(IllegalArgumentException.class, () -> evaluator.partialEval(nested));

        UserFunction async = define("f",
                "async def f(x):",
                "    return x");
        assertThrows(IllegalArgumentException.class, () -> evaluator.partialEval(async));

        UserFunction scale = define("scale", SCALE);
        assertThrows(IllegalArgumentException.class, () -> evaluator.partialApply(scale,
                Arrays.asList(1L, 2L, 3L, 4L), Collections.emptyMap()));
        assertThrows(IllegalArgumentException.class, () -> evaluator.partialApply(scale,
                Collections.emptyList(), Collections.singletonMap("scale", 1L)));
        assertThrows(IllegalArgumentException.class, () -> evaluator.partialApply(scale,
                Collections.singletonList(1L), Collections.singletonMap("x", 1L)));

        assertThrows(IllegalArgumentException.class, () -> evaluator.setMaxIterations(0));
    }
}
