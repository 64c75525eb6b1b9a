package io.github.eutro.peval.core.runtime;

import io.github.eutro.peval.core.print.TreePrinter;
import io.github.eutro.peval.core.tree.BinOperator;
import io.github.eutro.peval.core.tree.CmpOperator;
import io.github.eutro.peval.core.tree.UnOperator;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The semantics of every operator on script values.
 * <p>
 * Both the interpreter and the speculative evaluator go through here, so the two can never disagree
 * about what an operation computes. Failures are raised as {@link ScriptException}s.
 */
public final class Operators {
    /**
     * Returned from {@link OperatorOverloads} methods when an operation does not apply.
     */
    public static final Object NOT_IMPLEMENTED = new Object() {
        @Override
        public String toString() {
            return "NotImplemented";
        }
    };

    private Operators() {
    }

    public static boolean isInt(@Nullable Object v) {
        return v instanceof Long || v instanceof Boolean;
    }

    public static boolean isNumber(@Nullable Object v) {
        return isInt(v) || v instanceof Double;
    }

    private static long asLong(Object v) {
        if (v instanceof Boolean) return (Boolean) v ? 1 : 0;
        return (Long) v;
    }

    private static double asDouble(Object v) {
        if (v instanceof Double) return (Double) v;
        return asLong(v);
    }

    /**
     * Get the truthiness of a value, as {@code bool()} does.
     *
     * @param v The value.
     * @return Whether it is truthy.
     */
    public static boolean truth(@Nullable Object v) {
        if (v == null) return false;
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof Long) return (Long) v != 0;
        if (v instanceof Double) return (Double) v != 0;
        if (v instanceof String) return !((String) v).isEmpty();
        if (v instanceof Collection) return !((Collection<?>) v).isEmpty();
        if (v instanceof Map) return !((Map<?, ?>) v).isEmpty();
        if (v instanceof Tuple) return ((Tuple) v).size() != 0;
        if (v instanceof Range) return ((Range) v).length() != 0;
        if (v instanceof Truthy) return ((Truthy) v).isTruthy();
        return true;
    }

    // region Arithmetic

    /**
     * Apply a binary operator.
     * <p>
     * The left operand's {@link OperatorOverloads#binaryOp(BinOperator, Object) overload} is tried first,
     * then the builtin behaviour, then the right operand's
     * {@link OperatorOverloads#reflectedBinaryOp(BinOperator, Object) reflected overload}.
     *
     * @param op    The operator.
     * @param left  The left operand.
     * @param right The right operand.
     * @return The result.
     * @throws ScriptException A {@code TypeError} if no implementation applies, or whatever the operation raised.
     */
    public static Object binary(BinOperator op, @Nullable Object left, @Nullable Object right) {
        Object res;
        if (left instanceof OperatorOverloads) {
            res = ((OperatorOverloads) left).binaryOp(op, right);
            if (res != NOT_IMPLEMENTED) return res;
        }
        res = builtinBinary(op, left, right);
        if (res != NOT_IMPLEMENTED) return res;
        if (right instanceof OperatorOverloads) {
            res = ((OperatorOverloads) right).reflectedBinaryOp(op, left);
            if (res != NOT_IMPLEMENTED) return res;
        }
        throw new ScriptException(ScriptType.TYPE_ERROR, "unsupported operand type(s) for " + op.symbol
                + ": '" + typeName(left) + "' and '" + typeName(right) + "'");
    }

    /**
     * Apply an augmented assignment operator, which mutates lists in place for {@code +=}.
     *
     * @param op    The operator.
     * @param left  The current value of the target.
     * @param right The right operand.
     * @return The new value of the target.
     */
    public static Object inPlace(BinOperator op, @Nullable Object left, @Nullable Object right) {
        if (op == BinOperator.ADD && left instanceof List) {
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) left;
            list.addAll(toList(right));
            return list;
        }
        return binary(op, left, right);
    }

    private static Object builtinBinary(BinOperator op, @Nullable Object left, @Nullable Object right) {
        if (isInt(left) && isInt(right)) {
            if (left instanceof Boolean && right instanceof Boolean) {
                boolean l = (Boolean) left, r = (Boolean) right;
                switch (op) {
                    case BIT_AND:
                        return l & r;
                    case BIT_OR:
                        return l | r;
                    case BIT_XOR:
                        return l ^ r;
                    default:
                        break;
                }
            }
            return intBinary(op, asLong(left), asLong(right));
        }
        if (isNumber(left) && isNumber(right)) {
            return floatBinary(op, asDouble(left), asDouble(right));
        }
        switch (op) {
            case ADD:
                if (left instanceof String && right instanceof String) return (String) left + right;
                if (left instanceof List && right instanceof List) {
                    List<Object> out = new ArrayList<>((List<?>) left);
                    out.addAll((List<?>) right);
                    return out;
                }
                if (left instanceof Tuple && right instanceof Tuple) {
                    List<Object> out = new ArrayList<>(((Tuple) left).asList());
                    out.addAll(((Tuple) right).asList());
                    return Tuple.copyOf(out);
                }
                break;
            case MULT:
                if (isInt(right) && (left instanceof String || left instanceof List || left instanceof Tuple)) {
                    return repeat(left, asLong(right));
                }
                if (isInt(left) && (right instanceof String || right instanceof List || right instanceof Tuple)) {
                    return repeat(right, asLong(left));
                }
                break;
            case SUB:
                if (left instanceof Set && right instanceof Set) {
                    Set<Object> out = new LinkedHashSet<>((Set<?>) left);
                    out.removeAll((Set<?>) right);
                    return out;
                }
                break;
            case BIT_OR:
                if (left instanceof Set && right instanceof Set) {
                    Set<Object> out = new LinkedHashSet<>((Set<?>) left);
                    out.addAll((Set<?>) right);
                    return out;
                }
                if (left instanceof Map && right instanceof Map) {
                    Map<Object, Object> out = new LinkedHashMap<>((Map<?, ?>) left);
                    out.putAll((Map<?, ?>) right);
                    return out;
                }
                break;
            case BIT_AND:
                if (left instanceof Set && right instanceof Set) {
                    Set<Object> out = new LinkedHashSet<>((Set<?>) left);
                    out.retainAll((Set<?>) right);
                    return out;
                }
                break;
            case BIT_XOR:
                if (left instanceof Set && right instanceof Set) {
                    Set<Object> out = new LinkedHashSet<>((Set<?>) left);
                    for (Object o : (Set<?>) right) {
                        if (!out.remove(o)) out.add(o);
                    }
                    return out;
                }
                break;
            default:
                break;
        }
        return NOT_IMPLEMENTED;
    }

    private static Object repeat(Object seq, long times) {
        long n = Math.max(times, 0);
        long size = seq instanceof String ? ((String) seq).length() : len(seq);
        if (size * n > Integer.MAX_VALUE - 8 || (size != 0 && n > Integer.MAX_VALUE)) {
            throw new ScriptException(ScriptType.OVERFLOW_ERROR, "repeated sequence is too long");
        }
        if (seq instanceof String) {
            StringBuilder sb = new StringBuilder();
            for (long i = 0; i < n; i++) sb.append((String) seq);
            return sb.toString();
        }
        List<Object> source = seq instanceof Tuple ? ((Tuple) seq).asList() : castList(seq);
        List<Object> out = new ArrayList<>();
        for (long i = 0; i < n; i++) out.addAll(source);
        return seq instanceof Tuple ? Tuple.copyOf(out) : out;
    }

    private static ScriptException intOverflow() {
        return new ScriptException(ScriptType.OVERFLOW_ERROR, "integer overflow");
    }

    private static Object intBinary(BinOperator op, long l, long r) {
        try {
            switch (op) {
                case ADD:
                    return Math.addExact(l, r);
                case SUB:
                    return Math.subtractExact(l, r);
                case MULT:
                    return Math.multiplyExact(l, r);
                case DIV:
                    if (r == 0) throw new ScriptException(ScriptType.ZERO_DIVISION_ERROR, "division by zero");
                    return (double) l / (double) r;
                case FLOOR_DIV:
                    if (r == 0) {
                        throw new ScriptException(ScriptType.ZERO_DIVISION_ERROR, "integer division or modulo by zero");
                    }
                    if (l == Long.MIN_VALUE && r == -1) throw intOverflow();
                    return Math.floorDiv(l, r);
                case MOD:
                    if (r == 0) {
                        throw new ScriptException(ScriptType.ZERO_DIVISION_ERROR, "integer division or modulo by zero");
                    }
                    return Math.floorMod(l, r);
                case POW:
                    if (r < 0) return floatBinary(op, l, r);
                    return intPow(l, r);
                case LSHIFT:
                    if (r < 0) throw new ScriptException(ScriptType.VALUE_ERROR, "negative shift count");
                    if (l == 0) return 0L;
                    if (r >= 63) throw intOverflow();
                    long shifted = l << r;
                    if (shifted >> r != l) throw intOverflow();
                    return shifted;
                case RSHIFT:
                    if (r < 0) throw new ScriptException(ScriptType.VALUE_ERROR, "negative shift count");
                    if (r >= 63) return l < 0 ? -1L : 0L;
                    return l >> r;
                case BIT_OR:
                    return l | r;
                case BIT_XOR:
                    return l ^ r;
                case BIT_AND:
                    return l & r;
                default:
                    throw new IllegalArgumentException(op.toString());
            }
        } catch (ArithmeticException e) {
            throw intOverflow();
        }
    }

    private static long intPow(long base, long exp) {
        long result = 1;
        while (exp > 0) {
            if ((exp & 1) != 0) result = Math.multiplyExact(result, base);
            exp >>= 1;
            if (exp > 0) base = Math.multiplyExact(base, base);
        }
        return result;
    }

    private static Object floatBinary(BinOperator op, double l, double r) {
        double res;
        switch (op) {
            case ADD:
                res = l + r;
                break;
            case SUB:
                res = l - r;
                break;
            case MULT:
                res = l * r;
                break;
            case DIV:
                if (r == 0) throw new ScriptException(ScriptType.ZERO_DIVISION_ERROR, "float division by zero");
                res = l / r;
                break;
            case FLOOR_DIV:
                if (r == 0) throw new ScriptException(ScriptType.ZERO_DIVISION_ERROR, "float floor division by zero");
                res = Math.floor(l / r);
                break;
            case MOD:
                if (r == 0) throw new ScriptException(ScriptType.ZERO_DIVISION_ERROR, "float modulo");
                res = l % r;
                if (res != 0 && (res < 0) != (r < 0)) res += r;
                break;
            case POW:
                if (l == 0 && r < 0) {
                    throw new ScriptException(ScriptType.ZERO_DIVISION_ERROR, "0.0 cannot be raised to a negative power");
                }
                if (l < 0 && r != Math.rint(r) && !Double.isInfinite(r)) {
                    throw new ScriptException(ScriptType.VALUE_ERROR, "math domain error");
                }
                res = Math.pow(l, r);
                if (Double.isInfinite(res) && !Double.isInfinite(l) && !Double.isInfinite(r)) {
                    throw new ScriptException(ScriptType.OVERFLOW_ERROR, "Numerical result out of range");
                }
                return res;
            default:
                return NOT_IMPLEMENTED;
        }
        return res;
    }

    /**
     * Apply a unary operator.
     *
     * @param op      The operator.
     * @param operand The operand.
     * @return The result.
     */
    public static Object unary(UnOperator op, @Nullable Object operand) {
        if (op == UnOperator.NOT) return !truth(operand);
        if (operand instanceof OperatorOverloads) {
            Object res = ((OperatorOverloads) operand).unaryOp(op);
            if (res != NOT_IMPLEMENTED) return res;
        }
        if (isInt(operand)) {
            long v = asLong(operand);
            switch (op) {
                case NEG:
                    if (v == Long.MIN_VALUE) throw intOverflow();
                    return -v;
                case POS:
                    return v;
                case INVERT:
                    return ~v;
                default:
                    break;
            }
        } else if (operand instanceof Double) {
            double v = (Double) operand;
            if (op == UnOperator.NEG) return -v;
            if (op == UnOperator.POS) return v;
        }
        throw new ScriptException(ScriptType.TYPE_ERROR,
                "bad operand type for unary " + op.symbol + ": '" + typeName(operand) + "'");
    }

    // endregion

    // region Comparison

    /**
     * Apply a single comparison operator.
     *
     * @param op    The operator.
     * @param left  The left operand.
     * @param right The right operand.
     * @return The result, usually a {@link Boolean}, though overloads may return anything.
     */
    public static Object compare(CmpOperator op, @Nullable Object left, @Nullable Object right) {
        switch (op) {
            case IS:
                return identity(left, right);
            case IS_NOT:
                return !identity(left, right);
            case IN:
                return contains(right, left);
            case NOT_IN:
                return !contains(right, left);
            default:
                break;
        }
        if (left instanceof OperatorOverloads) {
            Object res = ((OperatorOverloads) left).compare(op, right);
            if (res != NOT_IMPLEMENTED) return res;
        }
        if (right instanceof OperatorOverloads) {
            Object res = ((OperatorOverloads) right).compare(swapped(op), left);
            if (res != NOT_IMPLEMENTED) return res;
        }
        switch (op) {
            case EQ:
                return eq(left, right);
            case NOT_EQ:
                return !eq(left, right);
            default:
                break;
        }
        Integer order = builtinOrder(left, right);
        if (order == null) {
            throw new ScriptException(ScriptType.TYPE_ERROR, "'" + op.symbol + "' not supported between instances of '"
                    + typeName(left) + "' and '" + typeName(right) + "'");
        }
        if (order == Integer.MIN_VALUE) return false;
        switch (op) {
            case LT:
                return order < 0;
            case LT_E:
                return order <= 0;
            case GT:
                return order > 0;
            case GT_E:
                return order >= 0;
            default:
                throw new IllegalArgumentException(op.toString());
        }
    }

    private static CmpOperator swapped(CmpOperator op) {
        switch (op) {
            case LT:
                return CmpOperator.GT;
            case LT_E:
                return CmpOperator.GT_E;
            case GT:
                return CmpOperator.LT;
            case GT_E:
                return CmpOperator.LT_E;
            default:
                return op;
        }
    }

    /**
     * Order two values of builtin types.
     *
     * @return Negative, zero or positive; {@link Integer#MIN_VALUE} if the values are unordered (NaN, sets);
     * null if they cannot be compared at all.
     */
    @Nullable
    private static Integer builtinOrder(@Nullable Object left, @Nullable Object right) {
        if (isInt(left) && isInt(right)) return Long.compare(asLong(left), asLong(right));
        if (isNumber(left) && isNumber(right)) {
            double l = asDouble(left), r = asDouble(right);
            if (Double.isNaN(l) || Double.isNaN(r)) return Integer.MIN_VALUE;
            return l < r ? -1 : l > r ? 1 : 0;
        }
        if (left instanceof String && right instanceof String) {
            return Integer.signum(((String) left).compareTo((String) right));
        }
        if (left instanceof List && right instanceof List) {
            return sequenceOrder(castList(left), castList(right));
        }
        if (left instanceof Tuple && right instanceof Tuple) {
            return sequenceOrder(((Tuple) left).asList(), ((Tuple) right).asList());
        }
        if (left instanceof Set && right instanceof Set) {
            Set<?> l = (Set<?>) left, r = (Set<?>) right;
            if (l.equals(r)) return 0;
            if (r.containsAll(l)) return -1;
            if (l.containsAll(r)) return 1;
            return Integer.MIN_VALUE;
        }
        return null;
    }

    private static Integer sequenceOrder(List<Object> l, List<Object> r) {
        int n = Math.min(l.size(), r.size());
        for (int i = 0; i < n; i++) {
            if (!eq(l.get(i), r.get(i))) {
                return truth(compare(CmpOperator.LT, l.get(i), r.get(i))) ? -1 : 1;
            }
        }
        return Integer.compare(l.size(), r.size());
    }

    /**
     * Order two values for sorting, raising a {@code TypeError} if they cannot be ordered.
     *
     * @param a The first value.
     * @param b The second value.
     * @return Negative, zero or positive.
     */
    public static int order(@Nullable Object a, @Nullable Object b) {
        if (truth(compare(CmpOperator.LT, a, b))) return -1;
        if (truth(compare(CmpOperator.LT, b, a))) return 1;
        return 0;
    }

    /**
     * Get whether two values are the same object, as {@code is} does.
     * <p>
     * Immutable values of builtin types have no identity of their own, so they are identical when equal
     * and of the same type.
     *
     * @param a The first value.
     * @param b The second value.
     * @return Whether they are identical.
     */
    public static boolean identity(@Nullable Object a, @Nullable Object b) {
        if (a == b) return true;
        if (a == null || b == null || a.getClass() != b.getClass()) return false;
        if (a instanceof Long || a instanceof Boolean || a instanceof String) return a.equals(b);
        if (a instanceof Double) return ((Double) a).doubleValue() == (Double) b;
        return false;
    }

    /**
     * Compare two values for equality, as {@code ==} does on builtin types.
     * <p>
     * Numbers compare by value across types ({@code 1 == 1.0 == True}), containers compare element-wise.
     *
     * @param a The first value.
     * @param b The second value.
     * @return Whether they are equal.
     */
    public static boolean eq(@Nullable Object a, @Nullable Object b) {
        if (a == b) {
            return !(a instanceof Double && Double.isNaN((Double) a));
        }
        if (a == null || b == null) return false;
        if (a instanceof OperatorOverloads) {
            Object res = ((OperatorOverloads) a).compare(CmpOperator.EQ, b);
            if (res != NOT_IMPLEMENTED) return truth(res);
        }
        if (b instanceof OperatorOverloads) {
            Object res = ((OperatorOverloads) b).compare(CmpOperator.EQ, a);
            if (res != NOT_IMPLEMENTED) return truth(res);
        }
        if (isNumber(a) && isNumber(b)) {
            if (isInt(a) && isInt(b)) return asLong(a) == asLong(b);
            return asDouble(a) == asDouble(b);
        }
        if (a instanceof List && b instanceof List) {
            return sequenceEq(castList(a), castList(b));
        }
        if (a instanceof Tuple && b instanceof Tuple) {
            return sequenceEq(((Tuple) a).asList(), ((Tuple) b).asList());
        }
        if (a instanceof Map && b instanceof Map) {
            Map<?, ?> l = (Map<?, ?>) a, r = (Map<?, ?>) b;
            if (l.size() != r.size()) return false;
            for (Map.Entry<?, ?> entry : l.entrySet()) {
                if (!r.containsKey(entry.getKey())) return false;
                if (!eq(entry.getValue(), r.get(entry.getKey()))) return false;
            }
            return true;
        }
        return a.equals(b);
    }

    private static boolean sequenceEq(List<Object> l, List<Object> r) {
        if (l.size() != r.size()) return false;
        for (int i = 0; i < l.size(); i++) {
            Object x = l.get(i), y = r.get(i);
            if (x != y && !eq(x, y)) return false;
        }
        return true;
    }

    /**
     * Test membership, as {@code item in container} does.
     *
     * @param container The container.
     * @param item      The item.
     * @return Whether the container contains the item.
     */
    public static boolean contains(@Nullable Object container, @Nullable Object item) {
        if (container instanceof String) {
            if (!(item instanceof String)) {
                throw new ScriptException(ScriptType.TYPE_ERROR,
                        "'in <string>' requires string as left operand, not " + typeName(item));
            }
            return ((String) container).contains((String) item);
        }
        if (container instanceof Map) {
            checkHashable(item);
            return ((Map<?, ?>) container).containsKey(item);
        }
        if (container instanceof Set) {
            checkHashable(item);
            return ((Set<?>) container).contains(item);
        }
        if (container instanceof Range && isInt(item)) {
            return ((Range) container).contains(asLong(item));
        }
        Iterator<Object> it = iter(container);
        while (it.hasNext()) {
            Object next = it.next();
            if (next == item || eq(next, item)) return true;
        }
        return false;
    }

    // endregion

    // region Iteration and conversion

    /**
     * Get an iterator over a value, as {@code iter()} does.
     *
     * @param v The iterable.
     * @return The iterator.
     * @throws ScriptException A {@code TypeError} if the value is not iterable.
     */
    public static Iterator<Object> iter(@Nullable Object v) {
        if (v instanceof String) {
            String s = (String) v;
            List<Object> chars = new ArrayList<>(s.length());
            s.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars.iterator();
        }
        if (v instanceof List) {
            List<Object> list = castList(v);
            return new Iterator<Object>() {
                private int index = 0;

                @Override
                public boolean hasNext() {
                    return index < list.size();
                }

                @Override
                public Object next() {
                    if (!hasNext()) throw new NoSuchElementException();
                    return list.get(index++);
                }
            };
        }
        if (v instanceof Map) return new ArrayList<Object>(((Map<?, ?>) v).keySet()).iterator();
        if (v instanceof Set) return new ArrayList<Object>((Set<?>) v).iterator();
        if (v instanceof Iterator) {
            @SuppressWarnings("unchecked")
            Iterator<Object> it = (Iterator<Object>) v;
            return it;
        }
        if (v instanceof Iterable) {
            @SuppressWarnings("unchecked")
            Iterator<Object> it = ((Iterable<Object>) v).iterator();
            return it;
        }
        throw new ScriptException(ScriptType.TYPE_ERROR, "'" + typeName(v) + "' object is not iterable");
    }

    /**
     * Get whether iterating a value consumes it, so that it may be iterated only once.
     *
     * @param v The value.
     * @return Whether it is its own iterator.
     */
    public static boolean isSelfIterator(@Nullable Object v) {
        return v instanceof Iterator;
    }

    public static List<Object> toList(@Nullable Object iterable) {
        List<Object> out = new ArrayList<>();
        Iterator<Object> it = iter(iterable);
        while (it.hasNext()) out.add(it.next());
        return out;
    }

    public static Set<Object> toSet(@Nullable Object iterable) {
        Set<Object> out = new LinkedHashSet<>();
        Iterator<Object> it = iter(iterable);
        while (it.hasNext()) {
            Object next = it.next();
            checkHashable(next);
            out.add(next);
        }
        return out;
    }

    /**
     * Build a dict, as {@code dict(source, **kwargs)} does.
     *
     * @param source A mapping, or an iterable of key-value pairs.
     * @param kwargs Additional entries.
     * @return The new dict.
     */
    public static Map<Object, Object> toDict(@Nullable Object source, Map<String, Object> kwargs) {
        Map<Object, Object> out = new LinkedHashMap<>();
        if (source instanceof Map) {
            out.putAll((Map<?, ?>) source);
        } else {
            Iterator<Object> it = iter(source);
            int i = 0;
            while (it.hasNext()) {
                List<Object> pair = toList(it.next());
                if (pair.size() != 2) {
                    throw new ScriptException(ScriptType.VALUE_ERROR, "dictionary update sequence element #" + i
                            + " has length " + pair.size() + "; 2 is required");
                }
                checkHashable(pair.get(0));
                out.put(pair.get(0), pair.get(1));
                i++;
            }
        }
        out.putAll(kwargs);
        return out;
    }

    public static long toIndex(@Nullable Object v) {
        if (isInt(v)) return asLong(v);
        throw new ScriptException(ScriptType.TYPE_ERROR,
                "'" + typeName(v) + "' object cannot be interpreted as an integer");
    }

    /**
     * Convert a value to an int, as {@code int()} does.
     *
     * @param v The value.
     * @return The int.
     */
    public static long toInt(@Nullable Object v) {
        if (isInt(v)) return asLong(v);
        if (v instanceof Double) {
            double d = (Double) v;
            if (Double.isNaN(d)) throw new ScriptException(ScriptType.VALUE_ERROR, "cannot convert float NaN to integer");
            if (Double.isInfinite(d)) {
                throw new ScriptException(ScriptType.OVERFLOW_ERROR, "cannot convert float infinity to integer");
            }
            if (d >= 0x1p63 || d < -0x1p63) throw intOverflow();
            return (long) d;
        }
        if (v instanceof String) {
            String s = ((String) v).trim();
            try {
                if (s.startsWith("_") || s.endsWith("_") || s.contains("__")) throw new NumberFormatException();
                return Long.parseLong(s.replace("_", ""));
            } catch (NumberFormatException e) {
                throw new ScriptException(ScriptType.VALUE_ERROR,
                        "invalid literal for int() with base 10: " + repr(v));
            }
        }
        throw new ScriptException(ScriptType.TYPE_ERROR,
                "int() argument must be a string, a bytes-like object or a real number, not '" + typeName(v) + "'");
    }

    /**
     * Convert a value to a float, as {@code float()} does.
     *
     * @param v The value.
     * @return The float.
     */
    public static double toFloat(@Nullable Object v) {
        if (isNumber(v)) return asDouble(v);
        if (v instanceof String) {
            String s = ((String) v).trim().toLowerCase(Locale.ROOT);
            String unsigned = s.startsWith("-") || s.startsWith("+") ? s.substring(1) : s;
            boolean negative = s.startsWith("-");
            if (unsigned.equals("inf") || unsigned.equals("infinity")) {
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            }
            if (unsigned.equals("nan")) return Double.NaN;
            if (!unsigned.isEmpty() && (Character.isDigit(unsigned.charAt(0)) || unsigned.charAt(0) == '.')
                    && unsigned.chars().allMatch(c -> Character.isDigit(c) || c == '.' || c == 'e' || c == '-' || c == '+')) {
                try {
                    return Double.parseDouble(s);
                } catch (NumberFormatException ignored) {
                    // reported below
                }
            }
            throw new ScriptException(ScriptType.VALUE_ERROR, "could not convert string to float: " + repr(v));
        }
        throw new ScriptException(ScriptType.TYPE_ERROR,
                "float() argument must be a string or a real number, not '" + typeName(v) + "'");
    }

    // endregion

    // region Attributes, items and calls

    public static Object getAttribute(@Nullable Object obj, String name) {
        if (obj instanceof HasAttributes) return ((HasAttributes) obj).getAttribute(name);
        ScriptCallable method = Methods.lookup(obj, name);
        if (method != null) return new BoundMethod(obj, method);
        throw new ScriptException(ScriptType.ATTRIBUTE_ERROR,
                "'" + typeName(obj) + "' object has no attribute '" + name + "'");
    }

    public static void setAttribute(@Nullable Object obj, String name, @Nullable Object value) {
        if (obj instanceof HasAttributes) {
            ((HasAttributes) obj).setAttribute(name, value);
            return;
        }
        throw new ScriptException(ScriptType.ATTRIBUTE_ERROR,
                "'" + typeName(obj) + "' object has no attribute '" + name + "'");
    }

    /**
     * Subscript a value, as {@code obj[key]} does.
     *
     * @param obj The value.
     * @param key The key, index or {@link Slice}.
     * @return The item.
     */
    public static Object getItem(@Nullable Object obj, @Nullable Object key) {
        if (obj instanceof Map) {
            checkHashable(key);
            Map<?, ?> map = (Map<?, ?>) obj;
            Object value = map.get(key);
            if (value == null && !map.containsKey(key)) {
                throw new ScriptException(new ExceptionValue(ScriptType.KEY_ERROR, Tuple.of(key)));
            }
            return value;
        }
        if (obj instanceof Range) {
            Range range = (Range) obj;
            if (key instanceof Slice) {
                long[] ix = ((Slice) key).indices(range.length());
                return new Range(range.start + ix[0] * range.step, range.start + ix[1] * range.step,
                        range.step * ix[2]);
            }
            return range.get(indexFor(obj, key));
        }
        if (obj instanceof String || obj instanceof List || obj instanceof Tuple) {
            List<Object> items = obj instanceof String ? toList(obj) : obj instanceof Tuple ? ((Tuple) obj).asList() : castList(obj);
            if (key instanceof Slice) {
                long[] ix = ((Slice) key).indices(items.size());
                List<Object> out = new ArrayList<>();
                for (long i = ix[0]; ix[2] > 0 ? i < ix[1] : i > ix[1]; i += ix[2]) {
                    out.add(items.get((int) i));
                }
                if (obj instanceof String) {
                    StringBuilder sb = new StringBuilder();
                    for (Object c : out) sb.append((String) c);
                    return sb.toString();
                }
                return obj instanceof Tuple ? Tuple.copyOf(out) : out;
            }
            long index = indexFor(obj, key);
            if (index < 0) index += items.size();
            if (index < 0 || index >= items.size()) {
                throw new ScriptException(ScriptType.INDEX_ERROR, typeName(obj) + " index out of range");
            }
            return items.get((int) index);
        }
        throw new ScriptException(ScriptType.TYPE_ERROR, "'" + typeName(obj) + "' object is not subscriptable");
    }

    private static long indexFor(Object obj, @Nullable Object key) {
        if (isInt(key)) return asLong(key);
        throw new ScriptException(ScriptType.TYPE_ERROR,
                typeName(obj) + " indices must be integers or slices, not " + typeName(key));
    }

    /**
     * Assign to a subscript, as {@code obj[key] = value} does.
     *
     * @param obj   The container.
     * @param key   The key, index or {@link Slice}.
     * @param value The new value.
     */
    public static void setItem(@Nullable Object obj, @Nullable Object key, @Nullable Object value) {
        if (obj instanceof Map) {
            checkHashable(key);
            @SuppressWarnings("unchecked")
            Map<Object, Object> map = (Map<Object, Object>) obj;
            map.put(key, value);
            return;
        }
        if (obj instanceof List) {
            List<Object> list = castList(obj);
            if (key instanceof Slice) {
                long[] ix = ((Slice) key).indices(list.size());
                if (ix[2] != 1) {
                    throw new ScriptException(ScriptType.VALUE_ERROR, "extended slice assignment is not supported");
                }
                List<Object> replacement = toList(value);
                int start = (int) ix[0];
                int stop = (int) Math.max(ix[0], ix[1]);
                list.subList(start, stop).clear();
                list.addAll(start, replacement);
                return;
            }
            long index = indexFor(obj, key);
            if (index < 0) index += list.size();
            if (index < 0 || index >= list.size()) {
                throw new ScriptException(ScriptType.INDEX_ERROR, "list assignment index out of range");
            }
            list.set((int) index, value);
            return;
        }
        throw new ScriptException(ScriptType.TYPE_ERROR,
                "'" + typeName(obj) + "' object does not support item assignment");
    }

    public static Object call(@Nullable Object fn, List<Object> args, Map<String, Object> kwargs) {
        if (fn instanceof ScriptCallable) return ((ScriptCallable) fn).call(args, kwargs);
        throw new ScriptException(ScriptType.TYPE_ERROR, "'" + typeName(fn) + "' object is not callable");
    }

    public static long len(@Nullable Object v) {
        if (v instanceof String) return ((String) v).codePointCount(0, ((String) v).length());
        if (v instanceof Collection) return ((Collection<?>) v).size();
        if (v instanceof Map) return ((Map<?, ?>) v).size();
        if (v instanceof Tuple) return ((Tuple) v).size();
        if (v instanceof Range) return ((Range) v).length();
        throw new ScriptException(ScriptType.TYPE_ERROR, "object of type '" + typeName(v) + "' has no len()");
    }

    // endregion

    // region Hashing

    /**
     * Check that a value may be used as a dict key or set element.
     *
     * @param v The value.
     * @throws ScriptException A {@code TypeError} if it is mutable.
     */
    public static void checkHashable(@Nullable Object v) {
        if (v instanceof List || v instanceof Map || v instanceof Set) {
            throw new ScriptException(ScriptType.TYPE_ERROR, "unhashable type: '" + typeName(v) + "'");
        }
        if (v instanceof Tuple) {
            for (Object o : (Tuple) v) checkHashable(o);
        }
    }

    public static long hash(@Nullable Object v) {
        checkHashable(v);
        if (v == null) return 0;
        if (isInt(v)) {
            long l = asLong(v);
            return l == -1 ? -2 : l;
        }
        if (v instanceof Double) {
            double d = (Double) v;
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 0x1p63) return hash((long) d);
            return Double.hashCode(d);
        }
        return v.hashCode();
    }

    // endregion

    // region Strings

    public static String typeName(@Nullable Object v) {
        return ScriptType.of(v).name;
    }

    /**
     * Convert a value to a string, as {@code str()} does.
     *
     * @param v The value.
     * @return The string.
     */
    public static String str(@Nullable Object v) {
        if (v instanceof String) return (String) v;
        if (v instanceof ExceptionValue) return ((ExceptionValue) v).getMessage();
        return repr(v);
    }

    /**
     * Convert a value to its source-like representation, as {@code repr()} does.
     *
     * @param v The value.
     * @return The representation.
     */
    public static String repr(@Nullable Object v) {
        if (v == null) return "None";
        if (v instanceof Boolean) return (Boolean) v ? "True" : "False";
        if (v instanceof Long) return v.toString();
        if (v instanceof Double) return TreePrinter.doubleRepr((Double) v);
        if (v instanceof String) return TreePrinter.stringRepr((String) v);
        if (v instanceof List) return joinRepr("[", castList(v), "]");
        if (v instanceof Tuple) {
            Tuple t = (Tuple) v;
            if (t.size() == 1) return "(" + repr(t.get(0)) + ",)";
            return joinRepr("(", t.asList(), ")");
        }
        if (v instanceof Set) {
            if (((Set<?>) v).isEmpty()) return "set()";
            return joinRepr("{", new ArrayList<Object>((Set<?>) v), "}");
        }
        if (v instanceof Map) {
            StringJoiner sj = new StringJoiner(", ", "{", "}");
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) v).entrySet()) {
                sj.add(repr(entry.getKey()) + ": " + repr(entry.getValue()));
            }
            return sj.toString();
        }
        if (v instanceof Range) {
            Range r = (Range) v;
            return "range(" + r.start + ", " + r.stop + (r.step == 1 ? "" : ", " + r.step) + ")";
        }
        if (v instanceof Slice) {
            Slice s = (Slice) v;
            return "slice(" + repr(s.lower) + ", " + repr(s.upper) + ", " + repr(s.step) + ")";
        }
        if (v instanceof GeneratorValue) return "<generator object>";
        if (v instanceof ExceptionValue) {
            ExceptionValue e = (ExceptionValue) v;
            return e.type.name + (e.args.size() == 1 ? "(" + repr(e.args.get(0)) + ")" : repr(e.args));
        }
        if (v instanceof ScriptType) return v.toString();
        if (v instanceof BuiltinFunction) return "<built-in function " + ((BuiltinFunction) v).getName() + ">";
        if (v instanceof BoundMethod) return "<bound method " + ((BoundMethod) v).getName() + ">";
        if (v instanceof ScriptCallable) return "<function " + ((ScriptCallable) v).getName() + ">";
        return v.toString();
    }

    private static String joinRepr(String open, List<Object> items, String close) {
        StringJoiner sj = new StringJoiner(", ", open, close);
        for (Object item : items) sj.add(repr(item));
        return sj.toString();
    }

    // endregion

    @SuppressWarnings("unchecked")
    static List<Object> castList(Object v) {
        return (List<Object>) v;
    }
}
