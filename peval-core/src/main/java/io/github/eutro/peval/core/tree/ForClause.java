package io.github.eutro.peval.core.tree;

import java.util.Arrays;
import java.util.List;

/**
 * A {@code for target in iter if ifs...} clause of a {@link Expr.Comprehension}.
 */
public final class ForClause extends Node {
    public final Expr target;
    public final Expr iter;
    public final List<Expr> ifs;

    public ForClause(Expr target, Expr iter, List<? extends Expr> ifs) {
        this.target = target;
        this.iter = iter;
        this.ifs = copy(ifs);
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(target, iter, ifs);
    }

    @Override
    public ForClause withFields(List<Object> fields) {
        return new ForClause((Expr) fields.get(0), (Expr) fields.get(1), listField(fields.get(2)));
    }
}
