package io.github.eutro.peval.core.runtime;

import org.jetbrains.annotations.Nullable;

/**
 * A value usable in a {@code with} statement.
 */
public interface ContextManager {
    /**
     * Enter the context.
     *
     * @return The value bound by {@code as}.
     */
    Object enter();

    /**
     * Exit the context.
     *
     * @param exception The exception leaving the block, or null if it completed normally.
     * @return Whether to suppress the exception.
     */
    boolean exit(@Nullable ScriptException exception);
}
