package io.github.eutro.peval.api;

import io.github.eutro.peval.api.events.*;
import io.github.eutro.peval.core.function.FunctionSource;
import io.github.eutro.peval.core.passes.misc.FixpointPass;
import io.github.eutro.peval.core.runtime.UserFunction;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Specializes functions to the values of the names they read, and optionally some of their arguments.
 * <p>
 * Each call to {@link #partialEval(UserFunction)} or {@link #partialApply(UserFunction, List, Map)}
 * runs a new {@link Specialization}, whose events can be listened to through {@link #lift()}.
 */
public class PartialEvaluator extends EventSupplier<PevalEvent> {
    private int maxIterations = FixpointPass.DEFAULT_MAX_ITERATIONS;

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Set the most times the passes are repeated for each function.
     *
     * @param maxIterations The limit.
     * @return This, for convenience.
     * @throws IllegalArgumentException If the limit is not positive.
     */
    public PartialEvaluator setMaxIterations(int maxIterations) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        this.maxIterations = maxIterations;
        return this;
    }

    /**
     * Partially evaluate a function, using the values of the global and closure variables it reads.
     *
     * @param fn The function.
     * @return The specialized function.
     * @throws IllegalArgumentException If the function cannot be partially evaluated.
     */
    public UserFunction partialEval(UserFunction fn) {
        return partialApply(fn, Collections.emptyList(), Collections.emptyMap());
    }

    /**
     * Partially evaluate a function, also using the values of some of its arguments.
     * The arguments are removed from the signature of the result.
     *
     * @param fn     The function.
     * @param args   The leading positional arguments.
     * @param kwargs The keyword arguments.
     * @return The specialized function.
     * @throws IllegalArgumentException If the function cannot be partially evaluated,
     *                                  or the arguments do not fit it.
     */
    public UserFunction partialApply(UserFunction fn, List<?> args, Map<String, ?> kwargs) {
        return specialize(fn, args, kwargs).run();
    }

    /**
     * Prepare a specialization of a function, without running it.
     *
     * @param fn     The function.
     * @param args   The leading positional arguments.
     * @param kwargs The keyword arguments.
     * @return The specialization.
     * @throws IllegalArgumentException If the function cannot be partially evaluated.
     */
    @Contract(pure = true)
    @NotNull
    public Specialization specialize(UserFunction fn, List<?> args, Map<String, ?> kwargs) {
        FunctionSource source = FunctionSource.of(fn);
        if (source.hasNestedDefinitions()) {
            throw new IllegalArgumentException("A partially evaluated function cannot have nested function definitions");
        }
        if (source.isAsync()) {
            throw new IllegalArgumentException("A partially evaluated function cannot be an async coroutine");
        }
        if (!args.isEmpty() || !kwargs.isEmpty()) {
            source = source.bindPartial(args, kwargs);
        }
        return new Specialization(this, source);
    }

    /**
     * Wrap a function so that every call is served by a specialization on the values of some of its
     * parameters, cached by those values.
     *
     * @param fn      The function.
     * @param names   The names of the parameters to specialize on.
     * @param maxSize The most specializations to keep.
     * @return The wrapped function.
     * @throws IllegalArgumentException If the function does not have all the parameters.
     */
    public SpecializeOn specializeOn(UserFunction fn, Collection<String> names, int maxSize) {
        return new SpecializeOn(this, fn, names, maxSize);
    }

    /**
     * Get a dispatcher for the events of every specialization run by this evaluator.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<SpecializationEvent> lift() {
        return children(RunSpecializationEvent.class, evt -> evt.specialization);
    }
}
