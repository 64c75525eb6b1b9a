package io.github.eutro.peval.core.runtime;

import io.github.eutro.peval.core.function.Tags;
import io.github.eutro.peval.core.tree.BinOperator;
import io.github.eutro.peval.core.tree.CmpOperator;
import io.github.eutro.peval.core.tree.UnOperator;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The builtin names, visible from every module unless shadowed.
 */
public final class Builtins {
    private static final Map<String, Object> TABLE = new LinkedHashMap<>();

    private Builtins() {
    }

    /**
     * Get whether a name is a builtin.
     *
     * @param name The name.
     * @return Whether it is.
     */
    public static boolean has(String name) {
        return TABLE.containsKey(name);
    }

    /**
     * Get the value of a builtin.
     *
     * @param name The name.
     * @return The value, or null if there is no such builtin.
     */
    @Nullable
    public static Object get(String name) {
        return TABLE.get(name);
    }

    public static Map<String, Object> all() {
        return Collections.unmodifiableMap(TABLE);
    }

    private static void def(String name, Signature signature, boolean pure, BuiltinFunction.Body body) {
        TABLE.put(name, new BuiltinFunction(name, signature, pure, body));
    }

    static {
        for (ScriptType type : ScriptType.builtinTypes()) {
            TABLE.put(type.name, type);
        }
        TABLE.remove(ScriptType.NONE_TYPE.name);
        TABLE.remove(ScriptType.FUNCTION.name);
        TABLE.remove(ScriptType.BUILTIN_FUNCTION.name);
        TABLE.remove(ScriptType.METHOD.name);
        TABLE.remove(ScriptType.GENERATOR.name);

        def("len", Signature.exactly(1), true, (a, k) -> Operators.len(a.get(0)));
        def("abs", Signature.exactly(1), true, (a, k) -> {
            Object v = a.get(0);
            if (v instanceof Double) return Math.abs((Double) v);
            return Operators.truth(Operators.compare(CmpOperator.LT, v, 0L))
                    ? Operators.unary(UnOperator.NEG, v)
                    : Operators.unary(UnOperator.POS, v);
        });
        def("min", Signature.positional(1, -1), true, (a, k) -> extreme("min", a, -1));
        def("max", Signature.positional(1, -1), true, (a, k) -> extreme("max", a, 1));
        def("sum", Signature.positional(1, 2), true, (a, k) -> {
            Object total = a.size() > 1 ? a.get(1) : (Object) 0L;
            Iterator<Object> it = Operators.iter(a.get(0));
            while (it.hasNext()) total = Operators.binary(BinOperator.ADD, total, it.next());
            return total;
        });
        def("isinstance", Signature.exactly(2), true, (a, k) -> {
            Object types = a.get(1);
            if (types instanceof Tuple) {
                for (Object type : (Tuple) types) {
                    if (checkType(type).isInstance(a.get(0))) return true;
                }
                return false;
            }
            return checkType(types).isInstance(a.get(0));
        });
        def("repr", Signature.exactly(1), true, (a, k) -> Operators.repr(a.get(0)));
        def("sorted", Signature.positional(1, 1, "reverse"), true, (a, k) -> {
            List<Object> list = Operators.toList(a.get(0));
            list.sort(Operators::order);
            if (Operators.truth(k.get("reverse"))) Collections.reverse(list);
            return list;
        });
        def("reversed", Signature.exactly(1), true, (a, k) -> {
            List<Object> list = Operators.toList(a.get(0));
            Collections.reverse(list);
            return new GeneratorValue(list.iterator());
        });
        def("enumerate", Signature.positional(1, 2), true, (a, k) -> {
            List<Object> out = new ArrayList<>();
            long i = a.size() > 1 ? Operators.toIndex(a.get(1)) : 0;
            Iterator<Object> it = Operators.iter(a.get(0));
            while (it.hasNext()) out.add(Tuple.of(i++, it.next()));
            return new GeneratorValue(out.iterator());
        });
        def("zip", Signature.positional(0, -1), true, (a, k) -> {
            List<Iterator<Object>> its = new ArrayList<>();
            for (Object arg : a) its.add(Operators.iter(arg));
            List<Object> out = new ArrayList<>();
            outer:
            while (!its.isEmpty()) {
                Object[] row = new Object[its.size()];
                for (int i = 0; i < row.length; i++) {
                    if (!its.get(i).hasNext()) break outer;
                    row[i] = its.get(i).next();
                }
                out.add(Tuple.of(row));
            }
            return new GeneratorValue(out.iterator());
        });
        def("any", Signature.exactly(1), true, (a, k) -> {
            Iterator<Object> it = Operators.iter(a.get(0));
            while (it.hasNext()) if (Operators.truth(it.next())) return true;
            return false;
        });
        def("all", Signature.exactly(1), true, (a, k) -> {
            Iterator<Object> it = Operators.iter(a.get(0));
            while (it.hasNext()) if (!Operators.truth(it.next())) return false;
            return true;
        });
        def("round", Signature.positional(1, 2), true, (a, k) -> round(a.get(0), a.size() > 1 ? a.get(1) : null));
        def("divmod", Signature.exactly(2), true, (a, k) -> Tuple.of(
                Operators.binary(BinOperator.FLOOR_DIV, a.get(0), a.get(1)),
                Operators.binary(BinOperator.MOD, a.get(0), a.get(1))));
        def("pow", Signature.exactly(2), true, (a, k) -> Operators.binary(BinOperator.POW, a.get(0), a.get(1)));
        def("hash", Signature.exactly(1), true, (a, k) -> Operators.hash(a.get(0)));
        def("iter", Signature.exactly(1), false, (a, k) -> {
            Object v = a.get(0);
            return v instanceof GeneratorValue ? v : new GeneratorValue(Operators.iter(v));
        });
        def("next", Signature.positional(1, 2), false, (a, k) -> {
            Object v = a.get(0);
            if (!(v instanceof Iterator)) {
                throw new ScriptException(ScriptType.TYPE_ERROR, "'" + Operators.typeName(v) + "' object is not an iterator");
            }
            Iterator<?> it = (Iterator<?>) v;
            if (it.hasNext()) return it.next();
            if (a.size() > 1) return a.get(1);
            throw new ScriptException(new ExceptionValue(ScriptType.STOP_ITERATION, Tuple.EMPTY));
        });
        def("print", Signature.positional(0, -1, "sep", "end"), false, (a, k) -> {
            StringJoiner sj = new StringJoiner(k.containsKey("sep") ? Operators.str(k.get("sep")) : " ");
            for (Object o : a) sj.add(Operators.str(o));
            System.out.print(sj + (k.containsKey("end") ? Operators.str(k.get("end")) : "\n"));
            return null;
        });
        def("pure", Signature.exactly(1), false, (a, k) -> Tags.pure(a.get(0)));
        def("inline", Signature.exactly(1), false, (a, k) -> Tags.inline(a.get(0)));
    }

    private static ScriptType checkType(Object type) {
        if (type instanceof ScriptType) return (ScriptType) type;
        throw new ScriptException(ScriptType.TYPE_ERROR, "isinstance() arg 2 must be a type or tuple of types");
    }

    private static Object extreme(String name, List<Object> args, int sign) {
        List<Object> items = args.size() == 1 ? Operators.toList(args.get(0)) : args;
        if (items.isEmpty()) throw new ScriptException(ScriptType.VALUE_ERROR, name + "() arg is an empty sequence");
        Object best = items.get(0);
        for (Object item : items.subList(1, items.size())) {
            if (Operators.order(item, best) * sign > 0) best = item;
        }
        return best;
    }

    private static Object round(Object number, @Nullable Object digits) {
        if (Operators.isInt(number)) {
            if (digits == null) return Operators.toInt(number);
            long d = Operators.toIndex(digits);
            if (d >= 0) return Operators.toInt(number);
            long factor = 1;
            for (long i = 0; i < -d && factor < Long.MAX_VALUE / 10; i++) factor *= 10;
            long n = Operators.toInt(number);
            long q = Math.floorDiv(n, factor), r = Math.floorMod(n, factor);
            if (2 * r > factor || (2 * r == factor && (q & 1) != 0)) q++;
            return q * factor;
        }
        if (!(number instanceof Double)) {
            throw new ScriptException(ScriptType.TYPE_ERROR,
                    "type " + Operators.typeName(number) + " doesn't define __round__ method");
        }
        double value = (Double) number;
        if (digits == null) return Operators.toInt(Math.rint(value));
        double scale = Math.pow(10, Operators.toIndex(digits));
        return Math.rint(value * scale) / scale;
    }
}
