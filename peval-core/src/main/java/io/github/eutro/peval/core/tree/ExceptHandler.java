package io.github.eutro.peval.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * An {@code except type as name:} clause of a {@link Stmt.Try}.
 * <p>
 * This is not a statement, but it is a node of the control-flow graph.
 */
public final class ExceptHandler extends Node {
    @Nullable
    public final Expr type;
    @Nullable
    public final String name;
    public final List<Stmt> body;

    public ExceptHandler(@Nullable Expr type, @Nullable String name, List<? extends Stmt> body) {
        if (body.isEmpty()) throw new IllegalArgumentException("empty except block");
        this.type = type;
        this.name = name;
        this.body = copy(body);
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(type, name, body);
    }

    @Override
    public ExceptHandler withFields(List<Object> fields) {
        return new ExceptHandler((Expr) fields.get(0), (String) fields.get(1), listField(fields.get(2)));
    }
}
