package io.github.eutro.peval.core.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A method bound to its receiver, as {@code obj.method} evaluates to.
 */
public final class BoundMethod implements ScriptCallable {
    public final Object self;
    public final ScriptCallable function;

    public BoundMethod(Object self, ScriptCallable function) {
        this.self = self;
        this.function = function;
    }

    @Override
    public Object call(List<Object> args, Map<String, Object> kwargs) {
        List<Object> withSelf = new ArrayList<>(args.size() + 1);
        withSelf.add(self);
        withSelf.addAll(args);
        return function.call(withSelf, kwargs);
    }

    @Override
    public String getName() {
        return function.getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundMethod)) return false;
        BoundMethod that = (BoundMethod) o;
        return self == that.self && function.equals(that.function);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(self), function);
    }

    @Override
    public String toString() {
        return Operators.repr(this);
    }
}
