package io.github.eutro.peval.api.events;

import io.github.eutro.peval.core.passes.Specimen;
import org.jetbrains.annotations.NotNull;

/**
 * Fired after each run of the round of passes.
 */
public class IterationEvent implements SpecializationEvent {
    /**
     * The number of the run, from 0.
     */
    public final int iteration;
    /**
     * The function and bindings after the run.
     */
    @NotNull
    public final Specimen specimen;
    /**
     * Whether the run changed anything. If not, this is the last run.
     */
    public final boolean changed;

    public IterationEvent(int iteration, @NotNull Specimen specimen, boolean changed) {
        this.iteration = iteration;
        this.specimen = specimen;
        this.changed = changed;
    }
}
