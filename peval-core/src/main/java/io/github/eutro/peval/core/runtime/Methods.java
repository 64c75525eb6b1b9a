package io.github.eutro.peval.core.runtime;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The methods of the builtin types.
 * <p>
 * Every method is a {@link BuiltinFunction} taking its receiver as the first argument,
 * which {@link Operators#getAttribute(Object, String)} binds into a {@link BoundMethod}.
 * Methods that only read their receiver are pure; methods that mutate it are not.
 */
final class Methods {
    private static final Map<ScriptType, Map<String, BuiltinFunction>> TABLES = new HashMap<>();

    private Methods() {
    }

    @Nullable
    static ScriptCallable lookup(@Nullable Object receiver, String name) {
        for (ScriptType type = ScriptType.of(receiver); type != null; type = type.base) {
            Map<String, BuiltinFunction> table = TABLES.get(type);
            if (table != null) {
                BuiltinFunction method = table.get(name);
                if (method != null) return method;
            }
        }
        return null;
    }

    private static void method(ScriptType type, String name, Signature signature, boolean pure, BuiltinFunction.Body body) {
        TABLES.computeIfAbsent(type, unused -> new HashMap<>())
                .put(name, new BuiltinFunction(type.name + "." + name, signature, pure, body));
    }

    private static Object arg(List<Object> args, int i, @Nullable Object otherwise) {
        return i < args.size() ? args.get(i) : otherwise;
    }

    private static String string(Object v) {
        if (v instanceof String) return (String) v;
        throw new ScriptException(ScriptType.TYPE_ERROR, "expected str, got " + Operators.typeName(v));
    }

    private static List<Object> list(Object v) {
        return Operators.castList(v);
    }

    @SuppressWarnings("unchecked")
    private static Map<Object, Object> dict(Object v) {
        return (Map<Object, Object>) v;
    }

    @SuppressWarnings("unchecked")
    private static Set<Object> set(Object v) {
        return (Set<Object>) v;
    }

    static {
        strMethods();
        listMethods();
        dictMethods();
        setMethods();
    }

    private static void strMethods() {
        ScriptType t = ScriptType.STR;
        method(t, "upper", Signature.exactly(1), true, (a, k) -> string(a.get(0)).toUpperCase(Locale.ROOT));
        method(t, "lower", Signature.exactly(1), true, (a, k) -> string(a.get(0)).toLowerCase(Locale.ROOT));
        method(t, "strip", Signature.positional(1, 2), true,
                (a, k) -> strip(string(a.get(0)), arg(a, 1, null), true, true));
        method(t, "lstrip", Signature.positional(1, 2), true,
                (a, k) -> strip(string(a.get(0)), arg(a, 1, null), true, false));
        method(t, "rstrip", Signature.positional(1, 2), true,
                (a, k) -> strip(string(a.get(0)), arg(a, 1, null), false, true));
        method(t, "split", Signature.positional(1, 2), true, (a, k) -> split(string(a.get(0)), arg(a, 1, null)));
        method(t, "join", Signature.exactly(2), true, (a, k) -> {
            StringJoiner sj = new StringJoiner(string(a.get(0)));
            for (Object o : Operators.toList(a.get(1))) {
                if (!(o instanceof String)) {
                    throw new ScriptException(ScriptType.TYPE_ERROR,
                            "sequence item: expected str instance, " + Operators.typeName(o) + " found");
                }
                sj.add((String) o);
            }
            return sj.toString();
        });
        method(t, "replace", Signature.exactly(3), true,
                (a, k) -> string(a.get(0)).replace(string(a.get(1)), string(a.get(2))));
        method(t, "startswith", Signature.exactly(2), true, (a, k) -> string(a.get(0)).startsWith(string(a.get(1))));
        method(t, "endswith", Signature.exactly(2), true, (a, k) -> string(a.get(0)).endsWith(string(a.get(1))));
        method(t, "find", Signature.exactly(2), true, (a, k) -> (long) string(a.get(0)).indexOf(string(a.get(1))));
        method(t, "count", Signature.exactly(2), true, (a, k) -> {
            String s = string(a.get(0)), sub = string(a.get(1));
            if (sub.isEmpty()) return Operators.len(s) + 1;
            long count = 0;
            for (int i = s.indexOf(sub); i >= 0; i = s.indexOf(sub, i + sub.length())) count++;
            return count;
        });
        method(t, "isdigit", Signature.exactly(1), true, (a, k) -> {
            String s = string(a.get(0));
            return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
        });
        method(t, "isalpha", Signature.exactly(1), true, (a, k) -> {
            String s = string(a.get(0));
            return !s.isEmpty() && s.chars().allMatch(Character::isLetter);
        });
    }

    private static String strip(String s, @Nullable Object chars, boolean left, boolean right) {
        String set = chars == null ? null : string(chars);
        int start = 0, end = s.length();
        while (left && start < end && stripped(s.charAt(start), set)) start++;
        while (right && end > start && stripped(s.charAt(end - 1), set)) end--;
        return s.substring(start, end);
    }

    private static boolean stripped(char c, @Nullable String set) {
        return set == null ? Character.isWhitespace(c) : set.indexOf(c) >= 0;
    }

    private static List<Object> split(String s, @Nullable Object sep) {
        List<Object> out = new ArrayList<>();
        if (sep == null) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) return out;
            out.addAll(Arrays.asList(trimmed.split("\\s+")));
            return out;
        }
        String separator = string(sep);
        if (separator.isEmpty()) throw new ScriptException(ScriptType.VALUE_ERROR, "empty separator");
        int from = 0;
        for (int i = s.indexOf(separator); i >= 0; i = s.indexOf(separator, from)) {
            out.add(s.substring(from, i));
            from = i + separator.length();
        }
        out.add(s.substring(from));
        return out;
    }

    private static void listMethods() {
        ScriptType t = ScriptType.LIST;
        method(t, "append", Signature.exactly(2), false, (a, k) -> {
            list(a.get(0)).add(a.get(1));
            return null;
        });
        method(t, "extend", Signature.exactly(2), false, (a, k) -> {
            list(a.get(0)).addAll(Operators.toList(a.get(1)));
            return null;
        });
        method(t, "insert", Signature.exactly(3), false, (a, k) -> {
            List<Object> list = list(a.get(0));
            long index = Operators.toIndex(a.get(1));
            if (index < 0) index = Math.max(0, index + list.size());
            list.add((int) Math.min(index, list.size()), a.get(2));
            return null;
        });
        method(t, "pop", Signature.positional(1, 2), false, (a, k) -> {
            List<Object> list = list(a.get(0));
            if (list.isEmpty()) throw new ScriptException(ScriptType.INDEX_ERROR, "pop from empty list");
            long index = Operators.toIndex(arg(a, 1, -1L));
            if (index < 0) index += list.size();
            if (index < 0 || index >= list.size()) {
                throw new ScriptException(ScriptType.INDEX_ERROR, "pop index out of range");
            }
            return list.remove((int) index);
        });
        method(t, "remove", Signature.exactly(2), false, (a, k) -> {
            List<Object> list = list(a.get(0));
            int index = indexOf(list, a.get(1));
            if (index < 0) throw new ScriptException(ScriptType.VALUE_ERROR, "list.remove(x): x not in list");
            list.remove(index);
            return null;
        });
        method(t, "clear", Signature.exactly(1), false, (a, k) -> {
            list(a.get(0)).clear();
            return null;
        });
        method(t, "reverse", Signature.exactly(1), false, (a, k) -> {
            Collections.reverse(list(a.get(0)));
            return null;
        });
        method(t, "sort", Signature.positional(1, 1, "reverse"), false, (a, k) -> {
            List<Object> list = list(a.get(0));
            list.sort(Operators::order);
            if (Operators.truth(k.get("reverse"))) Collections.reverse(list);
            return null;
        });
        method(t, "index", Signature.exactly(2), true, (a, k) -> {
            int index = indexOf(list(a.get(0)), a.get(1));
            if (index < 0) {
                throw new ScriptException(ScriptType.VALUE_ERROR, Operators.repr(a.get(1)) + " is not in list");
            }
            return (long) index;
        });
        method(t, "count", Signature.exactly(2), true, (a, k) -> {
            long count = 0;
            for (Object o : list(a.get(0))) {
                if (Operators.eq(o, a.get(1))) count++;
            }
            return count;
        });
        method(t, "copy", Signature.exactly(1), true, (a, k) -> new ArrayList<>(list(a.get(0))));
    }

    private static int indexOf(List<Object> list, Object item) {
        for (int i = 0; i < list.size(); i++) {
            if (Operators.eq(list.get(i), item)) return i;
        }
        return -1;
    }

    private static void dictMethods() {
        ScriptType t = ScriptType.DICT;
        method(t, "get", Signature.positional(2, 3), true, (a, k) -> {
            Operators.checkHashable(a.get(1));
            Map<Object, Object> dict = dict(a.get(0));
            return dict.containsKey(a.get(1)) ? dict.get(a.get(1)) : arg(a, 2, null);
        });
        method(t, "keys", Signature.exactly(1), true, (a, k) -> new ArrayList<>(dict(a.get(0)).keySet()));
        method(t, "values", Signature.exactly(1), true, (a, k) -> new ArrayList<>(dict(a.get(0)).values()));
        method(t, "items", Signature.exactly(1), true, (a, k) -> {
            List<Object> items = new ArrayList<>();
            for (Map.Entry<Object, Object> entry : dict(a.get(0)).entrySet()) {
                items.add(Tuple.of(entry.getKey(), entry.getValue()));
            }
            return items;
        });
        method(t, "copy", Signature.exactly(1), true, (a, k) -> new LinkedHashMap<>(dict(a.get(0))));
        method(t, "pop", Signature.positional(2, 3), false, (a, k) -> {
            Map<Object, Object> dict = dict(a.get(0));
            Operators.checkHashable(a.get(1));
            if (dict.containsKey(a.get(1))) return dict.remove(a.get(1));
            if (a.size() == 3) return a.get(2);
            throw new ScriptException(new ExceptionValue(ScriptType.KEY_ERROR, Tuple.of(a.get(1))));
        });
        method(t, "setdefault", Signature.positional(2, 3), false, (a, k) -> {
            Map<Object, Object> dict = dict(a.get(0));
            Operators.checkHashable(a.get(1));
            if (!dict.containsKey(a.get(1))) dict.put(a.get(1), arg(a, 2, null));
            return dict.get(a.get(1));
        });
        method(t, "update", Signature.positional(1, 2).withVarKeywords(), false, (a, k) -> {
            dict(a.get(0)).putAll(Operators.toDict(arg(a, 1, Collections.emptyMap()), k));
            return null;
        });
    }

    private static void setMethods() {
        ScriptType t = ScriptType.SET;
        method(t, "add", Signature.exactly(2), false, (a, k) -> {
            Operators.checkHashable(a.get(1));
            set(a.get(0)).add(a.get(1));
            return null;
        });
        method(t, "discard", Signature.exactly(2), false, (a, k) -> {
            Operators.checkHashable(a.get(1));
            set(a.get(0)).remove(a.get(1));
            return null;
        });
        method(t, "remove", Signature.exactly(2), false, (a, k) -> {
            Operators.checkHashable(a.get(1));
            if (!set(a.get(0)).remove(a.get(1))) {
                throw new ScriptException(new ExceptionValue(ScriptType.KEY_ERROR, Tuple.of(a.get(1))));
            }
            return null;
        });
        method(t, "union", Signature.exactly(2), true, (a, k) -> {
            Set<Object> out = new LinkedHashSet<>(set(a.get(0)));
            out.addAll(Operators.toSet(a.get(1)));
            return out;
        });
        method(t, "intersection", Signature.exactly(2), true, (a, k) -> {
            Set<Object> out = new LinkedHashSet<>(set(a.get(0)));
            out.retainAll(Operators.toSet(a.get(1)));
            return out;
        });
        method(t, "copy", Signature.exactly(1), true, (a, k) -> new LinkedHashSet<>(set(a.get(0))));
    }
}
