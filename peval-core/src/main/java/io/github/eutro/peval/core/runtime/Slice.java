package io.github.eutro.peval.core.runtime;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A slice value, {@code lower:upper:step}, where any part may be {@code None}.
 */
public final class Slice {
    @Nullable
    public final Object lower;
    @Nullable
    public final Object upper;
    @Nullable
    public final Object step;

    public Slice(@Nullable Object lower, @Nullable Object upper, @Nullable Object step) {
        this.lower = lower;
        this.upper = upper;
        this.step = step;
    }

    /**
     * Resolve this slice against a sequence of the given length, as {@code slice.indices} does.
     *
     * @param length The length of the sequence.
     * @return The start, stop and step.
     * @throws ScriptException If the step is zero, or a bound is not an integer.
     */
    public long[] indices(long length) {
        long step = this.step == null ? 1 : Operators.toIndex(this.step);
        if (step == 0) throw new ScriptException(ScriptType.VALUE_ERROR, "slice step cannot be zero");
        long lowerBound = step < 0 ? -1 : 0;
        long upperBound = step < 0 ? length - 1 : length;
        long start = step < 0 ? upperBound : lowerBound;
        long stop = step < 0 ? lowerBound : upperBound;
        if (lower != null) start = clamp(Operators.toIndex(lower), length, lowerBound, upperBound);
        if (upper != null) stop = clamp(Operators.toIndex(upper), length, lowerBound, upperBound);
        return new long[]{start, stop, step};
    }

    private static long clamp(long index, long length, long lowerBound, long upperBound) {
        if (index < 0) {
            index += length;
            return Math.max(index, lowerBound);
        }
        return Math.min(index, upperBound);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slice)) return false;
        Slice slice = (Slice) o;
        return Operators.eq(lower, slice.lower) && Operators.eq(upper, slice.upper) && Operators.eq(step, slice.step);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper, step);
    }

    @Override
    public String toString() {
        return Operators.repr(this);
    }
}
