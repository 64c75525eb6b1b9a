package io.github.eutro.peval.core.runtime;

import io.github.eutro.peval.core.tree.BinOperator;
import io.github.eutro.peval.core.tree.CmpOperator;
import io.github.eutro.peval.core.tree.UnOperator;

/**
 * A value that defines its own operators.
 * <p>
 * Every method returns {@link Operators#NOT_IMPLEMENTED} when the operation does not apply to the given
 * operand, in which case the other operand, or the builtin behaviour, is tried next.
 */
public interface OperatorOverloads {
    /**
     * Apply a binary operator with this value on the left.
     *
     * @param op    The operator.
     * @param right The right operand.
     * @return The result, or {@link Operators#NOT_IMPLEMENTED}.
     */
    default Object binaryOp(BinOperator op, Object right) {
        return Operators.NOT_IMPLEMENTED;
    }

    /**
     * Apply a binary operator with this value on the right, after the left operand did not implement it.
     *
     * @param op   The operator.
     * @param left The left operand.
     * @return The result, or {@link Operators#NOT_IMPLEMENTED}.
     */
    default Object reflectedBinaryOp(BinOperator op, Object left) {
        return Operators.NOT_IMPLEMENTED;
    }

    default Object unaryOp(UnOperator op) {
        return Operators.NOT_IMPLEMENTED;
    }

    /**
     * Apply a rich comparison, one of {@code == != < <= > >=}, with this value on the left.
     *
     * @param op    The comparison.
     * @param other The right operand.
     * @return The result, or {@link Operators#NOT_IMPLEMENTED}.
     */
    default Object compare(CmpOperator op, Object other) {
        return Operators.NOT_IMPLEMENTED;
    }
}
