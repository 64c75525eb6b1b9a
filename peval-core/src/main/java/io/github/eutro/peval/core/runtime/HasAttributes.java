package io.github.eutro.peval.core.runtime;

/**
 * A value with its own attributes.
 */
public interface HasAttributes {
    /**
     * Get an attribute of this value.
     *
     * @param name The name of the attribute.
     * @return The value of the attribute.
     * @throws ScriptException An {@code AttributeError}, if there is no such attribute.
     */
    Object getAttribute(String name);

    default void setAttribute(String name, Object value) {
        throw new ScriptException(ScriptType.ATTRIBUTE_ERROR,
                "'" + Operators.typeName(this) + "' object attribute '" + name + "' is read-only");
    }
}
