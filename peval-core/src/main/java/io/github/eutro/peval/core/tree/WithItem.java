package io.github.eutro.peval.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * One {@code contextExpr as optionalVars} item of a {@link Stmt.With}.
 */
public final class WithItem extends Node {
    public final Expr contextExpr;
    @Nullable
    public final Expr optionalVars;

    public WithItem(Expr contextExpr, @Nullable Expr optionalVars) {
        this.contextExpr = contextExpr;
        this.optionalVars = optionalVars;
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(contextExpr, optionalVars);
    }

    @Override
    public WithItem withFields(List<Object> fields) {
        return new WithItem((Expr) fields.get(0), (Expr) fields.get(1));
    }
}
