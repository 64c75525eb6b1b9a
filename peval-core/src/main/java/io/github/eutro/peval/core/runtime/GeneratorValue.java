package io.github.eutro.peval.core.runtime;

import java.util.Iterator;

/**
 * A one-shot iterator, such as the result of a generator expression or of {@code iter()}.
 * <p>
 * Iterating a generator value yields the generator itself, so its elements can be consumed only once.
 */
public final class GeneratorValue implements Iterator<Object>, Iterable<Object> {
    private final Iterator<?> source;

    public GeneratorValue(Iterator<?> source) {
        this.source = source;
    }

    @Override
    public boolean hasNext() {
        return source.hasNext();
    }

    @Override
    public Object next() {
        return source.next();
    }

    @Override
    public Iterator<Object> iterator() {
        return this;
    }

    @Override
    public String toString() {
        return Operators.repr(this);
    }
}
