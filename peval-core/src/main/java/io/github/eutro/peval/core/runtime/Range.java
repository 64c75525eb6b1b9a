package io.github.eutro.peval.core.runtime;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * An arithmetic progression of integers.
 * <p>
 * A range can be iterated any number of times, each time from the start.
 */
public final class Range implements Iterable<Object> {
    public final long start;
    public final long stop;
    public final long step;

    public Range(long start, long stop, long step) {
        if (step == 0) throw new ScriptException(ScriptType.VALUE_ERROR, "range() arg 3 must not be zero");
        this.start = start;
        this.stop = stop;
        this.step = step;
    }

    public long length() {
        if (step > 0) {
            return start >= stop ? 0 : (stop - start - 1) / step + 1;
        }
        return start <= stop ? 0 : (start - stop - 1) / -step + 1;
    }

    public long get(long index) {
        long length = length();
        if (index < 0) index += length;
        if (index < 0 || index >= length) {
            throw new ScriptException(ScriptType.INDEX_ERROR, "range object index out of range");
        }
        return start + index * step;
    }

    public boolean contains(long value) {
        if (step > 0 ? value < start || value >= stop : value > start || value <= stop) return false;
        return (value - start) % step == 0;
    }

    @Override
    public Iterator<Object> iterator() {
        return new Iterator<Object>() {
            private long next = start;

            @Override
            public boolean hasNext() {
                return step > 0 ? next < stop : next > stop;
            }

            @Override
            public Object next() {
                if (!hasNext()) throw new NoSuchElementException();
                long value = next;
                next += step;
                return value;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Range)) return false;
        Range range = (Range) o;
        long length = length();
        if (length != range.length()) return false;
        if (length == 0) return true;
        if (start != range.start) return false;
        return length == 1 || step == range.step;
    }

    @Override
    public int hashCode() {
        long length = length();
        if (length == 0) return 0;
        return Long.hashCode(start) * 31 + (length == 1 ? 0 : Long.hashCode(step));
    }

    @Override
    public String toString() {
        return Operators.repr(this);
    }
}
