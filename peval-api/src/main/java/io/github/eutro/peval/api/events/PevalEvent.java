package io.github.eutro.peval.api.events;

import io.github.eutro.peval.api.PartialEvaluator;

/**
 * An event fired on a {@link PartialEvaluator}.
 */
public interface PevalEvent {
}
