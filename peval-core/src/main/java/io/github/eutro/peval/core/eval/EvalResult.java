package io.github.eutro.peval.core.eval;

import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.value.KnownValue;

/**
 * The outcome of evaluating an expression: either its value, or a simplified residual expression.
 */
public abstract class EvalResult {
    EvalResult() {
    }

    public static EvalResult evaluated(KnownValue value) {
        return new Evaluated(value);
    }

    public static EvalResult residual(Expr node) {
        return new Residual(node);
    }

    public abstract boolean isKnown();

    /**
     * Get the value.
     *
     * @return The value.
     * @throws IllegalStateException If the result is residual.
     */
    public abstract KnownValue known();

    /**
     * Get the residual expression.
     *
     * @return The expression.
     * @throws IllegalStateException If the result is evaluated.
     */
    public abstract Expr residual();

    public static final class Evaluated extends EvalResult {
        public final KnownValue value;

        Evaluated(KnownValue value) {
            this.value = value;
        }

        @Override
        public boolean isKnown() {
            return true;
        }

        @Override
        public KnownValue known() {
            return value;
        }

        @Override
        public Expr residual() {
            throw new IllegalStateException("result is evaluated");
        }

        @Override
        public String toString() {
            return "Evaluated" + value;
        }
    }

    public static final class Residual extends EvalResult {
        public final Expr node;

        Residual(Expr node) {
            this.node = node;
        }

        @Override
        public boolean isKnown() {
            return false;
        }

        @Override
        public KnownValue known() {
            throw new IllegalStateException("result is residual");
        }

        @Override
        public Expr residual() {
            return node;
        }

        @Override
        public String toString() {
            return "Residual[" + node + "]";
        }
    }
}
