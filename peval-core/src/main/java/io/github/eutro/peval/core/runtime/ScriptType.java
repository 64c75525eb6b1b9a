package io.github.eutro.peval.core.runtime;

import io.github.eutro.peval.core.ext.TagHolder;
import io.github.eutro.peval.core.ext.Tag;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A type of script values, which is also the callable that constructs its instances.
 * <p>
 * Builtin types are marked {@link Tag#PURE pure}: constructing them has no side effects.
 */
public final class ScriptType extends TagHolder implements ScriptCallable, HasAttributes {
    /**
     * Constructs an instance of a type from call arguments.
     */
    @FunctionalInterface
    public interface Constructor {
        Object construct(List<Object> args, Map<String, Object> kwargs);
    }

    private static final List<ScriptType> BUILTIN_TYPES = new ArrayList<>();

    public final String name;
    @Nullable
    public final ScriptType base;
    @Nullable
    private final Signature signature;
    @Nullable
    private final Constructor constructor;

    /**
     * Create a type.
     *
     * @param name        The name of the type.
     * @param base        The supertype, or null for the root type.
     * @param signature   The signature of the constructor.
     * @param constructor The constructor, or null if instances cannot be created by calling the type.
     */
    public ScriptType(String name, @Nullable ScriptType base, @Nullable Signature signature, @Nullable Constructor constructor) {
        this.name = name;
        this.base = base;
        this.signature = signature;
        this.constructor = constructor;
    }

    private static ScriptType builtin(String name, @Nullable ScriptType base, @Nullable Signature signature, @Nullable Constructor constructor) {
        ScriptType type = new ScriptType(name, base, signature, constructor);
        if (constructor != null) type.addTag(Tag.PURE);
        BUILTIN_TYPES.add(type);
        return type;
    }

    private static ScriptType exception(String name, ScriptType base) {
        ScriptType[] self = new ScriptType[1];
        self[0] = builtin(name, base, Signature.positional(0, -1),
                (args, kwargs) -> new ExceptionValue(self[0], Tuple.copyOf(args)));
        return self[0];
    }

    private static Object optionalArg(List<Object> args, Object otherwise) {
        return args.isEmpty() ? otherwise : args.get(0);
    }

    public static final ScriptType OBJECT = builtin("object", null, Signature.exactly(0), (args, kwargs) -> new Object());
    public static final ScriptType TYPE = builtin("type", OBJECT, Signature.exactly(1), (args, kwargs) -> of(args.get(0)));
    public static final ScriptType NONE_TYPE = builtin("NoneType", OBJECT, null, null);
    public static final ScriptType INT = builtin("int", OBJECT, Signature.positional(0, 1),
            (args, kwargs) -> Operators.toInt(optionalArg(args, 0L)));
    public static final ScriptType BOOL = builtin("bool", INT, Signature.positional(0, 1),
            (args, kwargs) -> !args.isEmpty() && Operators.truth(args.get(0)));
    public static final ScriptType FLOAT = builtin("float", OBJECT, Signature.positional(0, 1),
            (args, kwargs) -> Operators.toFloat(optionalArg(args, 0.0)));
    public static final ScriptType STR = builtin("str", OBJECT, Signature.positional(0, 1),
            (args, kwargs) -> Operators.str(optionalArg(args, "")));
    public static final ScriptType LIST = builtin("list", OBJECT, Signature.positional(0, 1),
            (args, kwargs) -> Operators.toList(optionalArg(args, Tuple.EMPTY)));
    public static final ScriptType TUPLE = builtin("tuple", OBJECT, Signature.positional(0, 1),
            (args, kwargs) -> Tuple.copyOf(Operators.toList(optionalArg(args, Tuple.EMPTY))));
    public static final ScriptType DICT = builtin("dict", OBJECT, Signature.positional(0, 1).withVarKeywords(),
            (args, kwargs) -> Operators.toDict(optionalArg(args, Collections.emptyMap()), kwargs));
    public static final ScriptType SET = builtin("set", OBJECT, Signature.positional(0, 1),
            (args, kwargs) -> Operators.toSet(optionalArg(args, Tuple.EMPTY)));
    public static final ScriptType RANGE = builtin("range", OBJECT, Signature.positional(1, 3),
            (args, kwargs) -> {
                if (args.size() == 1) return new Range(0, Operators.toIndex(args.get(0)), 1);
                return new Range(Operators.toIndex(args.get(0)), Operators.toIndex(args.get(1)),
                        args.size() == 3 ? Operators.toIndex(args.get(2)) : 1);
            });
    public static final ScriptType SLICE = builtin("slice", OBJECT, Signature.positional(1, 3),
            (args, kwargs) -> {
                if (args.size() == 1) return new Slice(null, args.get(0), null);
                return new Slice(args.get(0), args.get(1), args.size() == 3 ? args.get(2) : null);
            });
    public static final ScriptType FUNCTION = builtin("function", OBJECT, null, null);
    public static final ScriptType BUILTIN_FUNCTION = builtin("builtin_function_or_method", OBJECT, null, null);
    public static final ScriptType METHOD = builtin("method", OBJECT, null, null);
    public static final ScriptType GENERATOR = builtin("generator", OBJECT, null, null);

    public static final ScriptType BASE_EXCEPTION = exception("BaseException", OBJECT);
    public static final ScriptType EXCEPTION = exception("Exception", BASE_EXCEPTION);
    public static final ScriptType ARITHMETIC_ERROR = exception("ArithmeticError", EXCEPTION);
    public static final ScriptType ZERO_DIVISION_ERROR = exception("ZeroDivisionError", ARITHMETIC_ERROR);
    public static final ScriptType OVERFLOW_ERROR = exception("OverflowError", ARITHMETIC_ERROR);
    public static final ScriptType LOOKUP_ERROR = exception("LookupError", EXCEPTION);
    public static final ScriptType INDEX_ERROR = exception("IndexError", LOOKUP_ERROR);
    public static final ScriptType KEY_ERROR = exception("KeyError", LOOKUP_ERROR);
    public static final ScriptType NAME_ERROR = exception("NameError", EXCEPTION);
    public static final ScriptType UNBOUND_LOCAL_ERROR = exception("UnboundLocalError", NAME_ERROR);
    public static final ScriptType TYPE_ERROR = exception("TypeError", EXCEPTION);
    public static final ScriptType VALUE_ERROR = exception("ValueError", EXCEPTION);
    public static final ScriptType ATTRIBUTE_ERROR = exception("AttributeError", EXCEPTION);
    public static final ScriptType ASSERTION_ERROR = exception("AssertionError", EXCEPTION);
    public static final ScriptType STOP_ITERATION = exception("StopIteration", EXCEPTION);
    public static final ScriptType RUNTIME_ERROR = exception("RuntimeError", EXCEPTION);
    public static final ScriptType RECURSION_ERROR = exception("RecursionError", RUNTIME_ERROR);
    public static final ScriptType NOT_IMPLEMENTED_ERROR = exception("NotImplementedError", RUNTIME_ERROR);

    /**
     * Get every builtin type, in the order they were defined.
     *
     * @return The types.
     */
    public static List<ScriptType> builtinTypes() {
        return Collections.unmodifiableList(BUILTIN_TYPES);
    }

    /**
     * Get the type of a value.
     *
     * @param value The value.
     * @return Its type.
     */
    public static ScriptType of(@Nullable Object value) {
        if (value == null) return NONE_TYPE;
        if (value instanceof Boolean) return BOOL;
        if (value instanceof Long) return INT;
        if (value instanceof Double) return FLOAT;
        if (value instanceof String) return STR;
        if (value instanceof List) return LIST;
        if (value instanceof Tuple) return TUPLE;
        if (value instanceof Map) return DICT;
        if (value instanceof Set) return SET;
        if (value instanceof Range) return RANGE;
        if (value instanceof Slice) return SLICE;
        if (value instanceof GeneratorValue) return GENERATOR;
        if (value instanceof ExceptionValue) return ((ExceptionValue) value).type;
        if (value instanceof ScriptType) return TYPE;
        if (value instanceof UserFunction) return FUNCTION;
        if (value instanceof BoundMethod) return METHOD;
        if (value instanceof BuiltinFunction) return BUILTIN_FUNCTION;
        return OBJECT;
    }

    public boolean isSubtypeOf(ScriptType other) {
        for (ScriptType type = this; type != null; type = type.base) {
            if (type == other) return true;
        }
        return false;
    }

    /**
     * Get whether a value is an instance of this type.
     *
     * @param value The value.
     * @return Whether it is.
     */
    public boolean isInstance(@Nullable Object value) {
        return of(value).isSubtypeOf(this);
    }

    @Override
    public Object call(List<Object> args, Map<String, Object> kwargs) {
        if (constructor == null) {
            throw new ScriptException(ScriptType.TYPE_ERROR, "cannot create '" + name + "' instances");
        }
        if (signature != null && !signature.accepts(args.size(), kwargs.keySet())) {
            throw new ScriptException(ScriptType.TYPE_ERROR, name + "() got invalid arguments");
        }
        return constructor.construct(args, kwargs);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public @Nullable Signature getSignature() {
        return signature;
    }

    @Override
    public Object getAttribute(String name) {
        if (name.equals("__name__")) return this.name;
        throw new ScriptException(ScriptType.ATTRIBUTE_ERROR,
                "type object '" + this.name + "' has no attribute '" + name + "'");
    }

    @Override
    public String toString() {
        return "<class '" + name + "'>";
    }
}
