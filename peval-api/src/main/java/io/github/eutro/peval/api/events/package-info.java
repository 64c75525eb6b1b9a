/**
 * Events that occur during partial evaluation.
 * <p>
 * These can be used to change the passes that are run, and to observe the function as it is specialized.
 * Events are fired on {@link io.github.eutro.peval.api.events.EventSupplier}s,
 * which dispatch events of a specific type.
 */
package io.github.eutro.peval.api.events;
