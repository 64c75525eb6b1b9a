package io.github.eutro.peval.test;

import io.github.eutro.peval.core.parse.ParseException;
import io.github.eutro.peval.core.parse.Parser;
import io.github.eutro.peval.core.print.TreePrinter;
import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.Trees;
import org.junit.jupiter.api.Test;

import static io.github.eutro.peval.test.Utils.source;
import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {
    @Test
    void testReprint() {
        Stmt.FunctionDef tree = Parser.parseFunction(source(
                "def f(a, b=2, *args, **kw) -> int:",
                "    for i in range(a):",
                "        if i % 2 == 0:",
                "            b += i",
                "        elif i > 10:",
                "            break",
                "        else:",
                "            continue",
                "    else:",
                "        b = -b",
                "    try:",
                "        x = {k: v for k, v in kw.items() if v}",
                "    except (KeyError, ValueError) as e:",
                "        raise",
                "    finally:",
                "        pass",
                "    return [b, args], lambda y: y + a"
        ));
        Stmt.FunctionDef reparsed = Parser.parseFunction(TreePrinter.print(tree));
        assertTrue(Trees.equal(tree, reparsed), TreePrinter.print(reparsed));
    }

    @Test
    void testParentheses() {
        assertEquals("(a + b) * c", TreePrinter.print(Parser.parseExpression("(a + b) * c")));
        assertEquals("a - (b - c)", TreePrinter.print(Parser.parseExpression("a - (b - c)")));
        assertEquals("a - b - c", TreePrinter.print(Parser.parseExpression("(a - b) - c")));
        assertEquals("not (a and b)", TreePrinter.print(Parser.parseExpression("not (a and b)")));
    }

    @Test
    void testLiterals() {
        assertEquals("1.0", TreePrinter.literal(1.0));
        assertEquals("0.1", TreePrinter.literal(0.1));
        assertEquals("1e+16", TreePrinter.literal(1e16));
        assertEquals("1e-05", TreePrinter.literal(1e-5));
        assertEquals("\"it's\"", TreePrinter.literal("it's"));
        assertEquals("'a\\nb'", TreePrinter.literal("a\nb"));
        assertEquals("None", TreePrinter.literal(null));
    }

    @Test
    void testErrors() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parseModule(source(
                "x = 1",
                "y = $"
        )));
        assertEquals(2, e.line);
        assertEquals(5, e.column);

        assertThrows(ParseException.class, () -> Parser.parseModule(source("import os")));
        assertThrows(ParseException.class, () -> Parser.parseFunction(source("x = 1")));
    }
}
