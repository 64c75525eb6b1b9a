package io.github.eutro.peval.core.function;

import io.github.eutro.peval.core.ext.Tag;
import io.github.eutro.peval.core.ext.Taggable;
import io.github.eutro.peval.core.runtime.BoundMethod;
import io.github.eutro.peval.core.runtime.ScriptCallable;
import io.github.eutro.peval.core.runtime.Signature;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;

/**
 * Decides which callables may be called speculatively, while partially evaluating.
 * <p>
 * A callable is pure if it is {@link Tag#PURE tagged} pure. The builtin functions and methods
 * that have no side effects, and the builtin types, are tagged when they are created;
 * user functions are tagged with {@link Tags#pure(Object)}. A bound method is pure if its function is.
 */
public final class Purity {
    private Purity() {
    }

    /**
     * Get whether a value may be called speculatively.
     *
     * @param callable The value.
     * @return Whether it is a pure callable.
     */
    public static boolean isPure(@Nullable Object callable) {
        if (callable instanceof BoundMethod) {
            return isPure(((BoundMethod) callable).function);
        }
        return callable instanceof ScriptCallable
                && callable instanceof Taggable
                && ((Taggable) callable).hasTag(Tag.PURE);
    }

    /**
     * Get whether a callable would accept arguments of the given shape.
     * <p>
     * Callables without a known signature are assumed to accept anything.
     *
     * @param callable   The callable.
     * @param positional The number of positional arguments.
     * @param keywords   The names of the keyword arguments.
     * @return Whether the arguments would bind.
     */
    public static boolean acceptsArguments(ScriptCallable callable, int positional, Collection<String> keywords) {
        if (callable instanceof BoundMethod) {
            return acceptsArguments(((BoundMethod) callable).function, positional + 1, keywords);
        }
        Signature signature = callable.getSignature();
        return signature == null || signature.accepts(positional, keywords);
    }

    /**
     * Get whether a call may be made speculatively: the callee is pure, and accepts the arguments.
     *
     * @param callable   The callee.
     * @param positional The number of positional arguments.
     * @param keywords   The names of the keyword arguments.
     * @return Whether the call may be made.
     */
    public static boolean mayCall(@Nullable Object callable, int positional, Collection<String> keywords) {
        return isPure(callable) && acceptsArguments((ScriptCallable) callable, positional, keywords);
    }
}
