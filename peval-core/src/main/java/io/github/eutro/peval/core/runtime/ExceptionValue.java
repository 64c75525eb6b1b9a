package io.github.eutro.peval.core.runtime;

/**
 * An exception object.
 */
public final class ExceptionValue implements HasAttributes {
    public final ScriptType type;
    public final Tuple args;

    public ExceptionValue(ScriptType type, Tuple args) {
        if (!type.isSubtypeOf(ScriptType.BASE_EXCEPTION)) {
            throw new IllegalArgumentException(type.name + " is not an exception type");
        }
        this.type = type;
        this.args = args;
    }

    @Override
    public Object getAttribute(String name) {
        if (name.equals("args")) return args;
        throw new ScriptException(ScriptType.ATTRIBUTE_ERROR,
                "'" + type.name + "' object has no attribute '" + name + "'");
    }

    /**
     * Get the message of this exception, as {@code str()} gives it.
     *
     * @return The message.
     */
    public String getMessage() {
        switch (args.size()) {
            case 0:
                return "";
            case 1:
                return Operators.str(args.get(0));
            default:
                return Operators.str(args);
        }
    }

    @Override
    public String toString() {
        String message = getMessage();
        return message.isEmpty() ? type.name : type.name + ": " + message;
    }
}
