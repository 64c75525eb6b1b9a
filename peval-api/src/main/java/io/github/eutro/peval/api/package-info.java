/**
 * A configurable API over the partial evaluation passes of the core module.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.peval.api.PartialEvaluator},
 * which specializes functions to the values they read.
 * <p>
 * The evaluator can be configured using the {@link io.github.eutro.peval.api.events events API}.
 */
package io.github.eutro.peval.api;
