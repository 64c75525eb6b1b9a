package io.github.eutro.peval.core.value;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An immutable mapping from names to {@link AbstractValue}s.
 */
public final class Environment {
    public static final Environment EMPTY = new Environment(Collections.emptyMap());

    private final Map<String, AbstractValue> values;

    private Environment(Map<String, AbstractValue> values) {
        this.values = values;
    }

    /**
     * Create an environment in which every binding is known.
     *
     * @param bindings The bindings.
     * @return The environment.
     */
    public static Environment from(Map<String, ?> bindings) {
        Map<String, AbstractValue> values = new HashMap<>();
        for (Map.Entry<String, ?> entry : bindings.entrySet()) {
            values.put(entry.getKey(), AbstractValue.known(entry.getValue()));
        }
        return new Environment(values);
    }

    public AbstractValue get(String name) {
        return values.getOrDefault(name, AbstractValue.UNKNOWN);
    }

    /**
     * Get this environment with a name rebound.
     *
     * @param name  The name.
     * @param value The new value.
     * @return The new environment.
     */
    public Environment with(String name, AbstractValue value) {
        Map<String, AbstractValue> newValues = new HashMap<>(values);
        newValues.put(name, value);
        return new Environment(newValues);
    }

    /**
     * Get the names whose values are known, with their values.
     *
     * @return The known values.
     */
    public Map<String, Object> knownValues() {
        Map<String, Object> known = new LinkedHashMap<>();
        for (Map.Entry<String, AbstractValue> entry : values.entrySet()) {
            if (entry.getValue().isKnown()) known.put(entry.getKey(), entry.getValue().getValue());
        }
        return known;
    }

    /**
     * Combine the environments arriving at a point from two predecessors.
     * <p>
     * Names bound on both sides are {@link AbstractValue#meet(AbstractValue, AbstractValue) met};
     * names bound on one side only keep their value.
     *
     * @param a The first environment.
     * @param b The second environment.
     * @return The combined environment.
     */
    public static Environment meet(Environment a, Environment b) {
        Map<String, AbstractValue> out = new HashMap<>(a.values);
        for (Map.Entry<String, AbstractValue> entry : b.values.entrySet()) {
            AbstractValue left = a.values.get(entry.getKey());
            out.put(entry.getKey(), left == null
                    ? entry.getValue()
                    : AbstractValue.meet(left, entry.getValue()));
        }
        return new Environment(out);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new HashSet<>(values.keySet()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Environment)) return false;
        return values.equals(((Environment) o).values);
    }

    @Override
    public int hashCode() {
        return values.keySet().hashCode();
    }

    @Override
    public String toString() {
        return "Environment" + values;
    }
}
