package io.github.eutro.peval.core.ext;

/**
 * A tag that can be put on a runtime callable, telling the partial evaluator what it may do with it.
 */
public enum Tag {
    /**
     * The callable may be called speculatively, at partial-evaluation time, when all of its arguments are known.
     */
    PURE,
    /**
     * Calls to the function may be replaced with its body.
     */
    INLINE,
}
