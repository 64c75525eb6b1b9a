package io.github.eutro.peval.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * A single formal parameter, with an optional annotation and default value.
 */
public final class Param extends Node {
    public final String name;
    @Nullable
    public final Expr annotation;
    @Nullable
    public final Expr defaultValue;

    public Param(String name, @Nullable Expr annotation, @Nullable Expr defaultValue) {
        this.name = name;
        this.annotation = annotation;
        this.defaultValue = defaultValue;
    }

    public Param(String name) {
        this(name, null, null);
    }

    public Param withName(String name) {
        return new Param(name, annotation, defaultValue);
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(name, annotation, defaultValue);
    }

    @Override
    public Param withFields(List<Object> fields) {
        return new Param((String) fields.get(0), (Expr) fields.get(1), (Expr) fields.get(2));
    }
}
