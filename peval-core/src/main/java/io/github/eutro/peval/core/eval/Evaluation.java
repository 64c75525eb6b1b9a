package io.github.eutro.peval.core.eval;

import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.value.KnownValue;
import org.jetbrains.annotations.Nullable;

/**
 * The complete result of evaluating an expression: the rewritten expression, its value if it
 * was fully evaluated, and the state afterwards.
 */
public final class Evaluation {
    public final EvalState state;
    @Nullable
    public final KnownValue value;
    public final Expr node;

    Evaluation(EvalState state, @Nullable KnownValue value, Expr node) {
        this.state = state;
        this.value = value;
        this.node = node;
    }

    public boolean isKnown() {
        return value != null;
    }
}
