package io.github.eutro.peval.api;

import io.github.eutro.peval.api.events.RunSpecializationEvent;
import io.github.eutro.peval.core.runtime.ScriptException;
import io.github.eutro.peval.core.runtime.ScriptType;
import io.github.eutro.peval.core.runtime.UserFunction;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.peval.api.PartialEvaluatorTest.define;
import static org.junit.jupiter.api.Assertions.*;

public class SpecializeOnTest {
    static final String[] SHIFT = {
            "def shift(x, k):",
            "    return x + k"
    };

    static Object callWithK(SpecializeOn fn, long x, long k) {
        return fn.call(Collections.singletonList(x), Collections.singletonMap("k", k));
    }

    @Test
    void testCalls() {
        SpecializeOn shift = new PartialEvaluator().specializeOn(define("shift", SHIFT),
                Collections.singleton("k"), 4);
        assertEquals(3L, shift.call(Arrays.asList(1L, 2L), Collections.emptyMap()));
        assertEquals(7L, callWithK(shift, 5, 2));
        Map<String, Object> kwargs = new HashMap<>();
        kwargs.put("x", 10L);
        kwargs.put("k", 2L);
        assertEquals(12L, shift.call(Collections.emptyList(), kwargs));
        assertEquals(1, shift.cacheSize());
        assertEquals("shift", shift.getName());
    }

    @Test
    void testLeastRecentlyUsedEvicted() {
        PartialEvaluator evaluator = new PartialEvaluator();
        int[] runs = {0};
        evaluator.listen(RunSpecializationEvent.class, evt -> runs[0]++);
        SpecializeOn shift = evaluator.specializeOn(define("shift", SHIFT), Collections.singleton("k"), 2);

        callWithK(shift, 0, 2);
        callWithK(shift, 0, 2);
        assertEquals(1, runs[0]);
        callWithK(shift, 0, 3);
        callWithK(shift, 0, 2);
        assertEquals(2, runs[0]);
        // evicts k=3, which was used least recently
        callWithK(shift, 0, 4);
        assertEquals(3, runs[0]);
        assertEquals(2, shift.cacheSize());
        assertEquals(2L, callWithK(shift, 0, 2));
        assertEquals(3, runs[0]);
        assertEquals(3L, callWithK(shift, 0, 3));
        assertEquals(4, runs[0]);
        assertEquals(2, shift.cacheSize());
    }

    @Test
    void testBadArguments() {
        PartialEvaluator evaluator = new PartialEvaluator();
        UserFunction fn = define("shift", SHIFT);
        assertThrows(IllegalArgumentException.class,
                () -> evaluator.specializeOn(fn, Arrays.asList("k", "z"), 4));
        assertThrows(IllegalArgumentException.class,
                () -> evaluator.specializeOn(fn, Collections.singleton("k"), 0));

        SpecializeOn shift = evaluator.specializeOn(fn, Collections.singleton("k"), 4);
        ScriptException duplicate = assertThrows(ScriptException.class,
                () -> shift.call(Arrays.asList(1L, 2L), Collections.singletonMap("k", 3L)));
        assertEquals(ScriptType.TYPE_ERROR, duplicate.getType());

        ScriptException unhashable = assertThrows(ScriptException.class,
                () -> shift.call(Collections.singletonList(1L), Collections.singletonMap("k", new ArrayList<>())));
        assertEquals(ScriptType.TYPE_ERROR, unhashable.getType());
        assertEquals(0, shift.cacheSize());
    }
}
