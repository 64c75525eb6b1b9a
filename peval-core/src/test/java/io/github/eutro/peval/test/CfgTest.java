package io.github.eutro.peval.test;

import io.github.eutro.peval.core.cfg.CfgBuilder;
import io.github.eutro.peval.core.cfg.ControlFlowGraph;
import io.github.eutro.peval.core.parse.Parser;
import io.github.eutro.peval.core.print.TreePrinter;
import io.github.eutro.peval.core.tree.ExceptHandler;
import io.github.eutro.peval.core.tree.Node;
import io.github.eutro.peval.core.tree.Stmt;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.peval.test.Utils.source;
import static org.junit.jupiter.api.Assertions.*;

public class CfgTest {
    private static ControlFlowGraph cfgOf(String... lines) {
        return CfgBuilder.build(Parser.parseFunction(source(lines)).body);
    }

    private static String label(ControlFlowGraph cfg, int handle) {
        Node node = cfg.graph.node(handle).node;
        if (node instanceof ExceptHandler) {
            ExceptHandler handler = (ExceptHandler) node;
            return handler.type == null ? "except:" : "except " + TreePrinter.print(handler.type) + ":";
        }
        String text = TreePrinter.print((Stmt) node);
        return text.substring(0, text.indexOf('\n'));
    }

    private static Set<String> edges(ControlFlowGraph cfg) {
        Set<String> edges = new TreeSet<>();
        for (int handle : cfg.graph.handles()) {
            for (int child : cfg.graph.childrenOf(handle)) {
                edges.add(label(cfg, handle) + " --> " + label(cfg, child));
            }
        }
        return edges;
    }

    private static Set<String> labels(ControlFlowGraph cfg, List<Integer> handles) {
        Set<String> labels = new TreeSet<>();
        for (int handle : handles) labels.add(label(cfg, handle));
        return labels;
    }

    private static void assertCfg(ControlFlowGraph cfg,
                                  List<String> expectedEdges,
                                  List<String> expectedExits,
                                  List<String> expectedRaises) {
        assertEquals(new TreeSet<>(expectedEdges), edges(cfg));
        assertEquals(new TreeSet<>(expectedExits), labels(cfg, cfg.exits));
        assertEquals(new TreeSet<>(expectedRaises), labels(cfg, cfg.raises));
    }

    @Test
    void testIf() {
        ControlFlowGraph cfg = cfgOf(
                "def func_if():",
                "    a = 1",
                "    b = 2",
                "    if a > 2:",
                "        do_stuff()",
                "        do_smth_else()",
                "        return 3",
                "    elif a > 4:",
                "        foo()",
                "    else:",
                "        bar()",
                "    return b"
        );
        assertEquals(0, cfg.enter);
        assertCfg(cfg,
                Arrays.asList(
                        "a = 1 --> b = 2",
                        "b = 2 --> if a > 2:",
                        "if a > 2: --> do_stuff()",
                        "if a > 2: --> if a > 4:",
                        "if a > 4: --> bar()",
                        "if a > 4: --> foo()",
                        "foo() --> return b",
                        "bar() --> return b",
                        "do_stuff() --> do_smth_else()",
                        "do_smth_else() --> return 3"
                ),
                Arrays.asList("return 3", "return b"),
                Collections.emptyList());
    }

    @Test
    void testIfWithoutElseFallsThrough() {
        ControlFlowGraph cfg = cfgOf(
                "def f(x):",
                "    if x:",
                "        x = 1",
                "    return x"
        );
        assertCfg(cfg,
                Arrays.asList(
                        "if x: --> x = 1",
                        "if x: --> return x",
                        "x = 1 --> return x"
                ),
                Collections.singletonList("return x"),
                Collections.emptyList());
    }

    @Test
    void testFor() {
        ControlFlowGraph cfg = cfgOf(
                "def func_for():",
                "    a = 1",
                "    for i in range(5):",
                "        b = 2",
                "        if i > 4:",
                "            break",
                "        elif i > 2:",
                "            continue",
                "        else:",
                "            foo()",
                "    else:",
                "        c = 3",
                "    return b"
        );
        assertCfg(cfg,
                Arrays.asList(
                        "a = 1 --> for i in range(5):",
                        "for i in range(5): --> b = 2",
                        "for i in range(5): --> c = 3",
                        "b = 2 --> if i > 4:",
                        "if i > 4: --> break",
                        "if i > 4: --> if i > 2:",
                        "if i > 2: --> continue",
                        "if i > 2: --> foo()",
                        "foo() --> c = 3",
                        "foo() --> for i in range(5):",
                        "c = 3 --> return b",
                        "continue --> for i in range(5):",
                        "break --> return b"
                ),
                Collections.singletonList("return b"),
                Collections.emptyList());
    }

    @Test
    void testLoopMayNotRun() {
        ControlFlowGraph cfg = cfgOf(
                "def f(c):",
                "    x = 1",
                "    while c:",
                "        x = 2",
                "    return x"
        );
        // 0: x = 1, 1: while, 2: x = 2, 3: return
        assertEquals(new TreeSet<>(Arrays.asList(1, 2)), cfg.graph.parentsOf(3));
        assertEquals(new TreeSet<>(Arrays.asList(0, 2)), cfg.graph.parentsOf(1));
    }

    @Test
    void testTryExcept() {
        ControlFlowGraph cfg = cfgOf(
                "def func_try_except():",
                "    a = 1",
                "    for i in range(5):",
                "        try:",
                "            do()",
                "            if i > 3:",
                "                break",
                "            stuff()",
                "        except Exception:",
                "            foo()",
                "        except ValueError:",
                "            bar()",
                "        else:",
                "            do_else()",
                "    return b"
        );
        assertCfg(cfg,
                Arrays.asList(
                        "a = 1 --> for i in range(5):",
                        "for i in range(5): --> try:",
                        "for i in range(5): --> return b",
                        "try: --> do()",
                        "do() --> except Exception:",
                        "do() --> except ValueError:",
                        "do() --> if i > 3:",
                        "if i > 3: --> break",
                        "if i > 3: --> except Exception:",
                        "if i > 3: --> except ValueError:",
                        "if i > 3: --> stuff()",
                        "stuff() --> do_else()",
                        "stuff() --> except Exception:",
                        "stuff() --> except ValueError:",
                        "except ValueError: --> bar()",
                        "bar() --> for i in range(5):",
                        "bar() --> return b",
                        "except Exception: --> foo()",
                        "foo() --> for i in range(5):",
                        "foo() --> return b",
                        "do_else() --> for i in range(5):",
                        "do_else() --> return b",
                        "break --> return b"
                ),
                Collections.singletonList("return b"),
                Collections.emptyList());
    }

    @Test
    void testTryFinally() {
        ControlFlowGraph cfg = cfgOf(
                "def func_try_finally():",
                "    a = 1",
                "    try:",
                "        do()",
                "        stuff()",
                "        return c",
                "    finally:",
                "        do_finally()",
                "    return b"
        );
        assertCfg(cfg,
                Arrays.asList(
                        "a = 1 --> try:",
                        "try: --> do()",
                        "do() --> do_finally()",
                        "do() --> stuff()",
                        "stuff() --> do_finally()",
                        "stuff() --> return c",
                        "return c --> do_finally()",
                        "do_finally() --> return b"
                ),
                Arrays.asList("do_finally()", "return b"),
                Collections.singletonList("do_finally()"));
    }

    @Test
    void testTryExceptFinally() {
        ControlFlowGraph cfg = cfgOf(
                "def func_try_except_finally():",
                "    a = 1",
                "    try:",
                "        do()",
                "        stuff()",
                "        return c",
                "    except Exception:",
                "        foo()",
                "    finally:",
                "        do_finally()",
                "    return b"
        );
        assertCfg(cfg,
                Arrays.asList(
                        "a = 1 --> try:",
                        "try: --> do()",
                        "do() --> except Exception:",
                        "do() --> stuff()",
                        "stuff() --> except Exception:",
                        "stuff() --> return c",
                        "return c --> do_finally()",
                        "return c --> except Exception:",
                        "except Exception: --> foo()",
                        "foo() --> do_finally()",
                        "do_finally() --> return b"
                ),
                Arrays.asList("do_finally()", "return b"),
                Collections.emptyList());
    }

    @Test
    void testTryExceptElseFinally() {
        ControlFlowGraph cfg = cfgOf(
                "def func_try_except_else_finally():",
                "    a = 1",
                "    try:",
                "        do()",
                "        stuff()",
                "    except Exception:",
                "        foo()",
                "    else:",
                "        do_else()",
                "    finally:",
                "        do_finally()",
                "    return b"
        );
        assertCfg(cfg,
                Arrays.asList(
                        "a = 1 --> try:",
                        "try: --> do()",
                        "do() --> except Exception:",
                        "do() --> stuff()",
                        "stuff() --> do_else()",
                        "stuff() --> except Exception:",
                        "except Exception: --> foo()",
                        "foo() --> do_finally()",
                        "do_finally() --> return b",
                        "do_else() --> do_finally()"
                ),
                Collections.singletonList("return b"),
                Collections.emptyList());
    }

    @Test
    void testBreakOutsideLoop() {
        assertThrows(IllegalStateException.class, () -> CfgBuilder.build(
                Collections.singletonList(new Stmt.Break())));
    }
}
