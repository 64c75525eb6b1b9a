package io.github.eutro.peval.core.runtime;

import io.github.eutro.peval.core.ext.TagHolder;
import io.github.eutro.peval.core.ext.Tag;

import java.util.List;
import java.util.Map;

/**
 * A callable implemented in Java.
 */
public final class BuiltinFunction extends TagHolder implements ScriptCallable {
    /**
     * The implementation of a builtin function, called only with arguments its signature accepts.
     */
    @FunctionalInterface
    public interface Body {
        Object call(List<Object> args, Map<String, Object> kwargs);
    }

    private final String name;
    private final Signature signature;
    private final Body body;

    /**
     * Create a builtin function.
     *
     * @param name      The name of the function.
     * @param signature The arguments it accepts.
     * @param pure      Whether calling it has no side effects, see {@link Tag#PURE}.
     * @param body      The implementation.
     */
    public BuiltinFunction(String name, Signature signature, boolean pure, Body body) {
        this.name = name;
        this.signature = signature;
        this.body = body;
        if (pure) addTag(Tag.PURE);
    }

    @Override
    public Object call(List<Object> args, Map<String, Object> kwargs) {
        if (!signature.accepts(args.size(), kwargs.keySet())) {
            throw new ScriptException(ScriptType.TYPE_ERROR, name + "() got invalid arguments: "
                    + args.size() + " positional" + (kwargs.isEmpty() ? "" : ", keywords " + kwargs.keySet()));
        }
        return body.call(args, kwargs);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Signature getSignature() {
        return signature;
    }

    @Override
    public String toString() {
        return Operators.repr(this);
    }
}
