package io.github.eutro.peval.core.value;

import io.github.eutro.peval.core.runtime.Operators;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * An element of the two-point value lattice: a statically {@link Known known} value, or {@link #UNKNOWN}.
 */
public abstract class AbstractValue {
    public static final AbstractValue UNKNOWN = new AbstractValue() {
        @Override
        public boolean isKnown() {
            return false;
        }

        @Override
        public Object getValue() {
            throw new IllegalStateException("value is unknown");
        }

        @Override
        public String toString() {
            return "<unknown>";
        }
    };

    AbstractValue() {
    }

    public static AbstractValue known(@Nullable Object value) {
        return new Known(value);
    }

    public abstract boolean isKnown();

    /**
     * Get the value, if known.
     *
     * @return The value.
     * @throws IllegalStateException If the value is not known.
     */
    @Nullable
    public abstract Object getValue();

    /**
     * Combine the values arriving at a point from two predecessors.
     * <p>
     * Two known values meet to the first if they are identical or compare equal, and to {@link #UNKNOWN} otherwise,
     * including when comparing them fails.
     *
     * @param a The first value.
     * @param b The second value.
     * @return The combined value.
     */
    public static AbstractValue meet(AbstractValue a, AbstractValue b) {
        if (!a.isKnown() || !b.isKnown()) return UNKNOWN;
        Object l = a.getValue();
        Object r = b.getValue();
        if (l == r || Operators.identity(l, r)) return a;
        return safeEq(l, r) ? a : UNKNOWN;
    }

    static boolean safeEq(@Nullable Object a, @Nullable Object b) {
        try {
            return Operators.eq(a, b);
        } catch (RuntimeException | StackOverflowError e) {
            return false;
        }
    }

    /**
     * A known value.
     */
    public static final class Known extends AbstractValue {
        @Nullable
        private final Object value;

        Known(@Nullable Object value) {
            this.value = value;
        }

        @Override
        public boolean isKnown() {
            return true;
        }

        @Override
        @Nullable
        public Object getValue() {
            return value;
        }

        /**
         * Known values are equal if their values are identical or compare equal, and a value that
         * is not equal to itself is still equal to an identical copy of itself.
         */
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Known)) return false;
            Object other = ((Known) o).value;
            return value == other
                    || Operators.identity(value, other)
                    || (value instanceof Double && Objects.equals(value, other))
                    || safeEq(value, other);
        }

        @Override
        public int hashCode() {
            // equal values may be of different types
            return Known.class.hashCode();
        }

        @Override
        public String toString() {
            return "<" + Operators.repr(value) + ">";
        }
    }
}
