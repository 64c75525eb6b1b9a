package io.github.eutro.peval.api.events;

import io.github.eutro.peval.core.passes.Passes;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.TreePass;
import org.jetbrains.annotations.NotNull;

/**
 * Fired before any passes are run, to configure the round of passes that will be repeated
 * until the function stops changing.
 * <p>
 * Listeners may replace the round, for example to {@link TreePass#then(TreePass) append} passes to it,
 * or change the iteration limit.
 */
public class ModifyPassesEvent implements SpecializationEvent {
    /**
     * The round of passes, initially {@link Passes#STANDARD}.
     */
    @NotNull
    public TreePass<Specimen, Specimen> passes;
    /**
     * The most times the round will be run.
     */
    public int maxIterations;

    /**
     * Construct a new modify passes event.
     *
     * @param passes        The round of passes.
     * @param maxIterations The iteration limit.
     */
    public ModifyPassesEvent(@NotNull TreePass<Specimen, Specimen> passes, int maxIterations) {
        this.passes = passes;
        this.maxIterations = maxIterations;
    }
}
