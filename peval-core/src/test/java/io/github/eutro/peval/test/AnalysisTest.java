package io.github.eutro.peval.test;

import io.github.eutro.peval.core.analysis.GenSym;
import io.github.eutro.peval.core.analysis.Mangler;
import io.github.eutro.peval.core.analysis.Scope;
import io.github.eutro.peval.core.parse.Parser;
import io.github.eutro.peval.core.tree.Stmt;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import static io.github.eutro.peval.test.Utils.assertTree;
import static io.github.eutro.peval.test.Utils.source;
import static org.junit.jupiter.api.Assertions.*;

public class AnalysisTest {
    @Test
    void testGenSym() {
        GenSym genSym = GenSym.avoiding(Collections.singleton("__peval_temp_1"));
        GenSym.Fresh first = genSym.next("temp");
        assertEquals("__peval_temp_2", first.name);
        assertEquals("__peval_temp_2", genSym.next("temp").name);
        assertEquals("__peval_temp_3", first.genSym.next("temp").name);
        assertEquals("__peval_mangled_1", first.genSym.next("mangled").name);
    }

    @Test
    void testScope() {
        Stmt.FunctionDef def = Parser.parseFunction(source(
                "def f(a, b=c):",
                "    x = a + y",
                "    for i in x:",
                "        z = [j for j in i]",
                "    return x"
        ));
        Scope scope = Scope.analyze(def);
        assertEquals(Arrays.asList("a", "b"), Arrays.asList(scope.locals.toArray()).subList(0, 2));
        assertTrue(scope.locals.containsAll(Arrays.asList("x", "i", "z")));
        assertEquals(new HashSet<>(Arrays.asList("c", "y")), scope.free);
        assertTrue(scope.localsUsed.containsAll(Arrays.asList("a", "x", "i")));
        assertFalse(scope.localsUsed.contains("b"));
    }

    @Test
    void testMangler() {
        Stmt.FunctionDef def = Parser.parseFunction(source(
                "def f(a):",
                "    b = a + g",
                "    try:",
                "        h(b)",
                "    except Exception as e:",
                "        return e",
                "    return b"
        ));
        Mangler.Mangled mangled = Mangler.mangle(GenSym.empty(), def);
        assertTree(mangled.tree,
                "def f(__peval_mangled_1):",
                "    __peval_mangled_2 = __peval_mangled_1 + g",
                "    try:",
                "        h(__peval_mangled_2)",
                "    except Exception as __peval_mangled_3:",
                "        return __peval_mangled_3",
                "    return __peval_mangled_2");
        assertEquals("__peval_mangled_4", mangled.genSym.next("mangled").name);
    }
}
