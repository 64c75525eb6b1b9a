package io.github.eutro.peval.core.eval;

import io.github.eutro.peval.core.function.Purity;
import io.github.eutro.peval.core.runtime.Operators;
import io.github.eutro.peval.core.runtime.ScriptCallable;
import io.github.eutro.peval.core.value.KnownValue;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * The boundary at which the evaluator runs script code speculatively.
 * <p>
 * Any failure of a speculative operation means the expression cannot be evaluated; it is never
 * propagated, and never retried.
 */
public final class SpeculativeCall {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpeculativeCall.class);

    private SpeculativeCall() {
    }

    /**
     * A concrete operation on known values.
     */
    @FunctionalInterface
    public interface Operation {
        @Nullable
        Object run();
    }

    /**
     * Run an operation, catching any failure.
     *
     * @param what A description of the operation, for logging.
     * @param op   The operation.
     * @return The result, or null if the operation failed.
     */
    @Nullable
    public static KnownValue attempt(String what, Operation op) {
        try {
            return new KnownValue(op.run());
        } catch (RuntimeException | StackOverflowError e) {
            LOGGER.trace("cannot evaluate {}: {}", what, e.toString());
            return null;
        }
    }

    /**
     * Get the truth value of a value, if that can be done safely.
     *
     * @param value The value.
     * @return The truth value, or null if it could not be determined.
     */
    @Nullable
    public static Boolean truth(@Nullable Object value) {
        KnownValue result = attempt("truth value", () -> Operators.truth(value));
        return result == null ? null : (Boolean) result.value;
    }

    /**
     * Call a function speculatively, if it is pure and accepts the arguments.
     * <p>
     * A call that returns a one-shot iterator is not evaluated, since the iterator could not
     * be shared by every execution of the expression.
     *
     * @param fn     The function.
     * @param args   The positional arguments.
     * @param kwargs The keyword arguments.
     * @return The result, or null if the call may not be made or failed.
     */
    @Nullable
    public static KnownValue call(@Nullable Object fn, List<Object> args, Map<String, Object> kwargs) {
        if (!Purity.mayCall(fn, args.size(), kwargs.keySet())) return null;
        KnownValue result = attempt(((ScriptCallable) fn).getName() + "()",
                () -> ((ScriptCallable) fn).call(args, kwargs));
        if (result != null && Operators.isSelfIterator(result.value)) return null;
        return result;
    }
}
