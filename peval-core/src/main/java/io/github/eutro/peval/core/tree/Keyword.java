package io.github.eutro.peval.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * A keyword argument to a {@link Expr.Call}, {@code arg=value}, or {@code **value} if {@link #arg} is null.
 */
public final class Keyword extends Node {
    @Nullable
    public final String arg;
    public final Expr value;

    public Keyword(@Nullable String arg, Expr value) {
        this.arg = arg;
        this.value = value;
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(arg, value);
    }

    @Override
    public Keyword withFields(List<Object> fields) {
        return new Keyword((String) fields.get(0), (Expr) fields.get(1));
    }
}
