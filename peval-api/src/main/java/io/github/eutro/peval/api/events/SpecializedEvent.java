package io.github.eutro.peval.api.events;

import io.github.eutro.peval.core.passes.Specimen;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when all passes have been run, before the function is put back together.
 */
public class SpecializedEvent implements SpecializationEvent {
    /**
     * The final function and bindings, which listeners may replace.
     */
    @NotNull
    public Specimen specimen;

    /**
     * Construct a new specialized event.
     *
     * @param specimen The final function and bindings.
     */
    public SpecializedEvent(@NotNull Specimen specimen) {
        this.specimen = specimen;
    }
}
