package io.github.eutro.peval.core.runtime;

/**
 * A script-level exception, raised by running code or by a runtime operation.
 * <p>
 * Script exceptions are frequent during speculative evaluation, so they do not capture a stack trace.
 */
public class ScriptException extends RuntimeException {
    public final ExceptionValue value;

    public ScriptException(ExceptionValue value) {
        super(value.toString(), null, false, false);
        this.value = value;
    }

    public ScriptException(ScriptType type, String message) {
        this(new ExceptionValue(type, Tuple.of(message)));
    }

    public ScriptType getType() {
        return value.type;
    }

    /**
     * Get whether this exception is an instance of the given type.
     *
     * @param type The type.
     * @return Whether it is.
     */
    public boolean is(ScriptType type) {
        return value.type.isSubtypeOf(type);
    }
}
