package io.github.eutro.peval.api.events;

import io.github.eutro.peval.api.PartialEvaluator;
import io.github.eutro.peval.api.Specialization;
import org.jetbrains.annotations.NotNull;

/**
 * Fired on the {@link PartialEvaluator} when a specialization is started,
 * before any of its own events.
 *
 * @see Specialization
 */
public class RunSpecializationEvent implements PevalEvent {
    /**
     * The specialization.
     */
    @NotNull
    public Specialization specialization;

    /**
     * Construct a new run specialization event.
     *
     * @param specialization The specialization.
     */
    public RunSpecializationEvent(@NotNull Specialization specialization) {
        this.specialization = specialization;
    }
}
