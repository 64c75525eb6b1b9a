package io.github.eutro.peval.core.runtime;

import java.util.List;
import java.util.Map;

/**
 * A value that can be called from a script.
 */
public interface ScriptCallable {
    /**
     * Call this value.
     *
     * @param args   The positional arguments.
     * @param kwargs The keyword arguments, in the order they were given.
     * @return The result of the call.
     * @throws ScriptException If the call raised a script exception.
     */
    Object call(List<Object> args, Map<String, Object> kwargs);

    /**
     * Get the name of this callable, for error messages.
     *
     * @return The name.
     */
    String getName();

    /**
     * Get the signature of this callable, if it is known statically.
     *
     * @return The signature, or null if any arguments may be accepted.
     */
    default Signature getSignature() {
        return null;
    }
}
