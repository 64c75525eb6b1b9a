package io.github.eutro.peval.core.runtime;

import java.util.*;

/**
 * An immutable sequence.
 */
public final class Tuple implements Iterable<Object> {
    public static final Tuple EMPTY = new Tuple(Collections.emptyList());

    private final List<Object> items;

    private Tuple(List<Object> items) {
        this.items = items;
    }

    public static Tuple of(Object... items) {
        return items.length == 0 ? EMPTY : new Tuple(Collections.unmodifiableList(Arrays.asList(items.clone())));
    }

    public static Tuple copyOf(Collection<?> items) {
        return items.isEmpty() ? EMPTY : new Tuple(Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public int size() {
        return items.size();
    }

    public Object get(int index) {
        return items.get(index);
    }

    /**
     * Get a read-only view of the elements of this tuple.
     *
     * @return The elements.
     */
    public List<Object> asList() {
        return items;
    }

    @Override
    public Iterator<Object> iterator() {
        return items.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tuple)) return false;
        return items.equals(((Tuple) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode() * 31 + 7;
    }

    @Override
    public String toString() {
        return Operators.repr(this);
    }
}
