package io.github.eutro.peval.api.events;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EventSupplierTest {
    static class Counter {
        int count;
    }

    static class Started {
        final EventSupplier<Object> child = new EventSupplier<>();
    }

    @Test
    void testDispatchExactType() {
        EventSupplier<Object> supplier = new EventSupplier<>();
        List<String> seen = new ArrayList<>();
        assertFalse(supplier.hasListeners(Counter.class));
        supplier.listen(Counter.class, evt -> seen.add("first " + evt.count++));
        supplier.listen(Counter.class, evt -> seen.add("second " + evt.count++));
        supplier.listen(Object.class, evt -> seen.add("object"));
        assertTrue(supplier.hasListeners(Counter.class));

        Counter counter = supplier.dispatch(Counter.class, new Counter());
        assertEquals(2, counter.count);
        assertEquals(Arrays.asList("first 0", "second 1"), seen);
    }

    @Test
    void testListenerFailure() {
        EventSupplier<Object> supplier = new EventSupplier<>();
        int[] runs = {0};
        supplier.listen(Counter.class, evt -> runs[0]++);
        supplier.listen(Counter.class, evt -> {
            throw new IllegalStateException("bad listener");
        });
        supplier.listen(Counter.class, evt -> runs[0]++);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> supplier.dispatch(Counter.class, new Counter()));
        assertEquals(1, runs[0]);
        assertEquals(1, e.getSuppressed().length);
        assertEquals("in listener 1 of Counter", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testChildren() {
        EventSupplier<Object> parent = new EventSupplier<>();
        Started before = parent.dispatch(Started.class, new Started());

        EventDispatcher<Object> children = parent.children(Started.class, evt -> evt.child);
        int[] seen = {0};
        children.listen(Counter.class, evt -> seen[0]++);

        Started first = parent.dispatch(Started.class, new Started());
        Started second = parent.dispatch(Started.class, new Started());
        first.child.dispatch(Counter.class, new Counter());
        second.child.dispatch(Counter.class, new Counter());
        before.child.dispatch(Counter.class, new Counter());
        assertEquals(2, seen[0]);
        assertFalse(before.child.hasListeners(Counter.class));
    }
}
