package io.github.eutro.peval.core.value;

import io.github.eutro.peval.core.runtime.Operators;
import org.jetbrains.annotations.Nullable;

/**
 * The result of fully evaluating an expression: a value, and the name it was read from, if any.
 * <p>
 * The preferred name is used when the value has to be referenced from the rewritten tree.
 */
public final class KnownValue {
    @Nullable
    public final Object value;
    @Nullable
    public final String preferredName;

    public KnownValue(@Nullable Object value, @Nullable String preferredName) {
        this.value = value;
        this.preferredName = preferredName;
    }

    public KnownValue(@Nullable Object value) {
        this(value, null);
    }

    @Override
    public String toString() {
        return "<" + Operators.repr(value) + (preferredName == null ? "" : " (" + preferredName + ")") + ">";
    }
}
