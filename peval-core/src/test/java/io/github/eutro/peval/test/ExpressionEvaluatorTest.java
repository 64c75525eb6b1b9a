package io.github.eutro.peval.test;

import io.github.eutro.peval.core.analysis.GenSym;
import io.github.eutro.peval.core.eval.EvalState;
import io.github.eutro.peval.core.eval.Evaluation;
import io.github.eutro.peval.core.eval.ExpressionEvaluator;
import io.github.eutro.peval.core.parse.Parser;
import io.github.eutro.peval.core.print.TreePrinter;
import io.github.eutro.peval.core.runtime.Builtins;
import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.tree.Trees;
import io.github.eutro.peval.core.value.AbstractValue;
import io.github.eutro.peval.core.value.Environment;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.peval.test.Utils.loadModule;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionEvaluatorTest {
    private static Map<String, Object> bindings(Object... kvs) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < kvs.length; i += 2) {
            map.put((String) kvs[i], kvs[i + 1]);
        }
        return map;
    }

    private static Evaluation eval(String src, Map<String, ?> bindings) {
        return ExpressionEvaluator.evaluate(EvalState.of(GenSym.empty()), Parser.parseExpression(src), bindings);
    }

    private static void assertKnown(Object expected, Evaluation evaluation) {
        assertTrue(evaluation.isKnown(), () -> "not known: " + TreePrinter.print(evaluation.node));
        assertEquals(expected, evaluation.value.value);
    }

    private static void assertResidual(String expected, Evaluation evaluation) {
        assertFalse(evaluation.isKnown());
        assertExpr(expected, evaluation.node);
    }

    private static void assertExpr(String expected, Expr actual) {
        Expr tree = Parser.parseExpression(expected);
        assertTrue(Trees.equal(tree, actual), () -> "expected " + TreePrinter.print(tree)
                + " but got " + TreePrinter.print(actual));
    }

    @Test
    void testArithmetic() {
        assertKnown(7L, eval("1 + 2 * 3", Collections.emptyMap()));
        assertKnown(2.5, eval("a / 2", bindings("a", 5L)));
        assertResidual("1 + b * 2", eval("a + b * 2", bindings("a", 1L)));
    }

    @Test
    void testFailedOperationIsResidual() {
        assertResidual("1 // 0", eval("a // 0", bindings("a", 1L)));
        assertResidual("'x' + 1", eval("s + 1", bindings("s", "x")));
    }

    @Test
    void testBoolOp() {
        assertKnown(0L, eval("x and y", bindings("x", 0L)));
        assertResidual("y", eval("x and y", bindings("x", 1L)));
        assertResidual("y", eval("x or y", bindings("x", 0L)));
        assertResidual("y or 0", eval("y or x", bindings("x", 0L)));
        assertResidual("y and z", eval("y and x and z", bindings("x", true)));
    }

    @Test
    void testShortCircuitSkipsPureCalls() {
        Map<String, Object> globals = loadModule(
                "calls = []",
                "@pure",
                "def record():",
                "    calls.append(1)",
                "    return True"
        );
        Map<String, Object> bindings = bindings("record", globals.get("record"));
        assertKnown(false, eval("False and record()", bindings));
        assertKnown(true, eval("True or record()", bindings));
        assertKnown(1L, eval("1 if True else record()", bindings));
        assertTrue(((List<?>) globals.get("calls")).isEmpty());

        assertKnown(true, eval("record()", bindings));
        assertEquals(1, ((List<?>) globals.get("calls")).size());
    }

    @Test
    void testIfExp() {
        assertKnown(1L, eval("a if t else b", bindings("t", true, "a", 1L)));
        assertResidual("b", eval("a if t else b", bindings("t", "")));
        assertResidual("1 if t else b", eval("a if t else b", bindings("a", 1L)));
    }

    @Test
    void testCompareChains() {
        assertKnown(true, eval("1 < x < 3", bindings("x", 2L)));
        assertKnown(false, eval("3 < x < y", bindings("x", 2L)));
        assertResidual("a < 2", eval("a < x < 3", bindings("x", 2L)));
        assertResidual("a < 2 < b", eval("a < x < b", bindings("x", 2L)));
        assertResidual("a < 2 and False", eval("a < x < 1", bindings("x", 2L)));
    }

    @Test
    void testCalls() {
        Map<String, Object> bindings = bindings("len", Builtins.get("len"), "s", "abc");
        assertKnown(3L, eval("len(s)", bindings));
        assertResidual("len(t)", eval("len(t)", bindings));
        assertResidual("print('abc')", eval("print(s)", bindings("print", Builtins.get("print"), "s", "abc")));
    }

    @Test
    void testCollections() {
        assertKnown(Arrays.asList(1L, 2L), eval("[a, 2]", bindings("a", 1L)));
        assertResidual("[1, b]", eval("[a, b]", bindings("a", 1L)));
        assertKnown(Arrays.asList(0L, 2L, 4L), eval("[i * k for i in range(3)]",
                bindings("k", 2L, "range", Builtins.get("range"))));
        Evaluation residual = eval("[i * k for i in range(n)]",
                bindings("n", 3L, "range", Builtins.get("range")));
        assertResidual("[i * k for i in __peval_temp_1]", residual);
        assertTrue(residual.state.tempBindings.containsKey("__peval_temp_1"));
    }

    @Test
    void testReify() {
        Object len = Builtins.get("len");
        Evaluation named = eval("f", bindings("f", len));
        assertExpr("f", named.node);
        assertSame(len, named.state.tempBindings.get("f"));

        Evaluation fresh = ExpressionEvaluator.evaluate(EvalState.of(GenSym.empty()),
                Parser.parseExpression("f"), bindings("f", len), true);
        assertExpr("__peval_temp_1", fresh.node);
        assertSame(len, fresh.state.tempBindings.get("__peval_temp_1"));

        Evaluation literal = ExpressionEvaluator.evaluate(EvalState.of(GenSym.empty()),
                Parser.parseExpression("x"), bindings("x", "s"), true);
        assertExpr("'s'", literal.node);
        assertTrue(literal.state.tempBindings.isEmpty());
    }

    @Test
    void testTryEvaluate() {
        assertNotNull(ExpressionEvaluator.tryEvaluate(Parser.parseExpression("x + 1"), bindings("x", 1L)));
        assertNull(ExpressionEvaluator.tryEvaluate(Parser.parseExpression("x + y"), bindings("x", 1L)));
    }

    @Test
    void testMeet() {
        Environment a = Environment.from(bindings("x", 1L, "y", 2L, "z", 3L));
        Environment b = Environment.from(bindings("x", 1L, "y", 5L));
        Environment met = Environment.meet(a, b);
        assertEquals(AbstractValue.known(1L), met.get("x"));
        assertFalse(met.get("y").isKnown());
        assertEquals(AbstractValue.known(3L), met.get("z"));
        assertFalse(met.get("w").isKnown());
    }
}
