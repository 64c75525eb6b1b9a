package io.github.eutro.peval.api;

import io.github.eutro.peval.core.parse.ParseException;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CliTest {
    static final String MODULE = String.join("\n",
            "OFFSET = 1",
            "def helper(x):",
            "    return x",
            "def scale(x, factor):",
            "    if factor == 0:",
            "        return OFFSET",
            "    return x * factor + OFFSET",
            "");

    @Test
    void testRun() {
        Map<String, String> defines = new LinkedHashMap<>();
        defines.put("factor", "OFFSET + 1");
        assertEquals("def scale(x):\n    return x * 2 + 1\n", Cli.run(MODULE, null, defines));
        assertEquals("def helper(x):\n    return x\n", Cli.run(MODULE, "helper", Collections.emptyMap()));
    }

    @Test
    void testErrors() {
        assertThrows(IllegalArgumentException.class, () -> Cli.run(MODULE, "OFFSET", Collections.emptyMap()));
        assertThrows(IllegalArgumentException.class, () -> Cli.run("x = 1\n", null, Collections.emptyMap()));
        assertThrows(ParseException.class, () -> Cli.run(MODULE, null, Collections.singletonMap("factor", "1 +")));
    }
}
