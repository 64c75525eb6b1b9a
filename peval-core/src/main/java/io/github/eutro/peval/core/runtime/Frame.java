package io.github.eutro.peval.core.runtime;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A scope of variables during execution: a module, a function call or a comprehension.
 * <p>
 * Names are resolved in the frame's locals, then the locals of enclosing frames, then the module globals,
 * then the {@link Builtins}.
 */
public final class Frame {
    public final Map<String, Object> globals;
    /**
     * The names local to this frame, or null for a module frame, whose variables are the globals.
     */
    @Nullable
    private final Set<String> localNames;
    private final Map<String, Object> locals = new HashMap<>();
    @Nullable
    private final Frame parent;

    @Nullable
    Object returnValue;
    final Deque<ScriptException> handling = new ArrayDeque<>();

    private Frame(Map<String, Object> globals, @Nullable Set<String> localNames, @Nullable Frame parent) {
        this.globals = globals;
        this.localNames = localNames;
        this.parent = parent;
    }

    public static Frame module(Map<String, Object> globals) {
        return new Frame(globals, null, null);
    }

    /**
     * Create a frame nested in another.
     *
     * @param globals    The module globals.
     * @param localNames The names local to the new frame.
     * @param parent     The lexically enclosing frame, or null if it is at module level.
     * @return The frame.
     */
    public static Frame nested(Map<String, Object> globals, Set<String> localNames, @Nullable Frame parent) {
        return new Frame(globals, localNames, parent != null && parent.isModule() ? null : parent);
    }

    public boolean isModule() {
        return localNames == null;
    }

    /**
     * Look up a name.
     *
     * @param name The name.
     * @return Its value.
     * @throws ScriptException A {@code NameError} or {@code UnboundLocalError} if it is not bound.
     */
    public Object lookup(String name) {
        for (Frame frame = this; frame != null; frame = frame.parent) {
            if (frame.localNames != null && frame.localNames.contains(name)) {
                if (frame.locals.containsKey(name)) return frame.locals.get(name);
                if (frame == this) {
                    throw new ScriptException(ScriptType.UNBOUND_LOCAL_ERROR,
                            "cannot access local variable '" + name + "' where it is not associated with a value");
                }
                throw new ScriptException(ScriptType.NAME_ERROR,
                        "cannot access free variable '" + name + "' where it is not associated with a value in enclosing scope");
            }
        }
        if (globals.containsKey(name)) return globals.get(name);
        if (Builtins.has(name)) return Builtins.get(name);
        throw new ScriptException(ScriptType.NAME_ERROR, "name '" + name + "' is not defined");
    }

    public void store(String name, @Nullable Object value) {
        if (localNames == null) {
            globals.put(name, value);
        } else {
            locals.put(name, value);
        }
    }

    /**
     * Get the value a closure variable has in this frame or the frames enclosing it.
     *
     * @param name The name.
     * @return The value, or null if no frame binds it, see {@link #hasCell(String)}.
     */
    @Nullable
    public Object cell(String name) {
        for (Frame frame = this; frame != null; frame = frame.parent) {
            if (frame.localNames != null && frame.locals.containsKey(name)) return frame.locals.get(name);
        }
        return null;
    }

    /**
     * Get whether some frame, this or an enclosing one, declares the name local.
     *
     * @param name The name.
     * @return Whether it is a cell of this frame chain.
     */
    public boolean hasCell(String name) {
        for (Frame frame = this; frame != null; frame = frame.parent) {
            if (frame.localNames != null && frame.locals.containsKey(name)) return true;
        }
        return false;
    }
}
