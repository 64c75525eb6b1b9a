package io.github.eutro.peval.api.events;

import io.github.eutro.peval.api.Specialization;

/**
 * An event fired during a single {@link Specialization}.
 */
public interface SpecializationEvent {
}
