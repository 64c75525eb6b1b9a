package io.github.eutro.peval.core.passes;

import io.github.eutro.peval.core.passes.fold.Fold;
import io.github.eutro.peval.core.passes.header.FunctionHeader;
import io.github.eutro.peval.core.passes.inline.InlineFunctions;
import io.github.eutro.peval.core.passes.misc.FixpointPass;
import io.github.eutro.peval.core.passes.prune.PruneAssignments;
import io.github.eutro.peval.core.passes.prune.PruneCfg;
import org.jetbrains.annotations.Nullable;

/**
 * The standard partial evaluation pipelines.
 */
public final class Passes {
    private Passes() {
    }

    /**
     * One round of optimization: inlining, folding, then pruning.
     */
    public static final TreePass<Specimen, Specimen> STANDARD = InlineFunctions.INSTANCE
            .then(Fold.INSTANCE)
            .then(PruneCfg.INSTANCE)
            .then(PruneAssignments.INSTANCE);

    /**
     * Build the full pipeline: the function header is folded once, then a round of passes is repeated until
     * the specimen stops changing.
     *
     * @param round         The round of passes to repeat.
     * @param maxIterations The most times to repeat it.
     * @param listener      A listener for each iteration, or null.
     * @return The pipeline.
     */
    public static TreePass<Specimen, Specimen> pipeline(TreePass<Specimen, Specimen> round,
                                                        int maxIterations,
                                                        @Nullable FixpointPass.Listener listener) {
        return FunctionHeader.INSTANCE.then(new FixpointPass(round, maxIterations, listener));
    }

    /**
     * Build the full pipeline with the {@link #STANDARD} round and default limits.
     *
     * @return The pipeline.
     */
    public static TreePass<Specimen, Specimen> pipeline() {
        return pipeline(STANDARD, FixpointPass.DEFAULT_MAX_ITERATIONS, null);
    }
}
