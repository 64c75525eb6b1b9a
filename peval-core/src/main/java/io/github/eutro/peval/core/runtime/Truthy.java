package io.github.eutro.peval.core.runtime;

/**
 * A value with its own truthiness.
 */
public interface Truthy {
    boolean isTruthy();
}
