package io.github.eutro.peval.core.function;

import io.github.eutro.peval.core.ext.Tag;
import io.github.eutro.peval.core.ext.Taggable;
import io.github.eutro.peval.core.runtime.Operators;
import io.github.eutro.peval.core.runtime.UserFunction;
import org.jetbrains.annotations.Nullable;

/**
 * The {@code pure} and {@code inline} decorators.
 */
public final class Tags {
    private Tags() {
    }

    /**
     * Mark a callable as pure: free of side effects, except maybe mutating its arguments.
     *
     * @param fn The callable.
     * @return The callable.
     * @throws IllegalArgumentException If the value cannot be tagged.
     */
    public static Object pure(@Nullable Object fn) {
        if (!(fn instanceof Taggable)) {
            throw new IllegalArgumentException("cannot mark a '" + Operators.typeName(fn) + "' object as pure");
        }
        return Taggable.tagged((Taggable) fn, Tag.PURE);
    }

    /**
     * Mark a function for inlining.
     *
     * @param fn The function.
     * @return The function.
     * @throws IllegalArgumentException If the function cannot be inlined.
     */
    public static Object inline(@Nullable Object fn) {
        if (!(fn instanceof UserFunction)) {
            throw new IllegalArgumentException("cannot inline a '" + Operators.typeName(fn) + "' object");
        }
        UserFunction function = (UserFunction) fn;
        FunctionSource source = FunctionSource.of(function);
        if (source.hasNestedDefinitions()) {
            throw new IllegalArgumentException("An inlined function cannot have nested function definitions");
        }
        if (source.isGenerator()) {
            throw new IllegalArgumentException("An inlined function cannot be a generator");
        }
        if (source.isAsync()) {
            throw new IllegalArgumentException("An inlined function cannot be an async coroutine");
        }
        if (!source.closureNames.isEmpty()) {
            throw new IllegalArgumentException("An inlined function cannot have a closure");
        }
        return Taggable.tagged(function, Tag.INLINE);
    }
}
