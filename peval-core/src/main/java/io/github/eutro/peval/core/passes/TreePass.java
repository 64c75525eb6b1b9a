package io.github.eutro.peval.core.passes;

import io.github.eutro.peval.core.passes.misc.ChainedPass;

/**
 * A pass over a syntax tree, or something containing one, such as a {@link Specimen}.
 * <p>
 * Trees are immutable, so a pass returns a new tree rather than modifying its input.
 * A pass that changes nothing should return its input.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface TreePass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The result.
     */
    B run(A a);

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> TreePass<A, C> then(TreePass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
