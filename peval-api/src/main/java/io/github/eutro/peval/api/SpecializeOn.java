package io.github.eutro.peval.api;

import io.github.eutro.peval.core.runtime.Operators;
import io.github.eutro.peval.core.runtime.ScriptCallable;
import io.github.eutro.peval.core.runtime.ScriptException;
import io.github.eutro.peval.core.runtime.ScriptType;
import io.github.eutro.peval.core.runtime.Signature;
import io.github.eutro.peval.core.runtime.UserFunction;
import io.github.eutro.peval.core.tree.Arguments;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A function that, when called, specializes a wrapped function on the values of some of its
 * parameters, and calls the specialization with the rest.
 * <p>
 * Specializations are cached by the values of those parameters, the least recently used being
 * dropped first. Only the parameters actually passed in a call are specialized on, so
 * a parameter left to its default is specialized as an ordinary parameter.
 */
public class SpecializeOn implements ScriptCallable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpecializeOn.class);

    private final PartialEvaluator evaluator;
    private final UserFunction fn;
    private final Set<String> names;
    private final Map<Map<String, Object>, UserFunction> cache;

    SpecializeOn(PartialEvaluator evaluator, UserFunction fn, Collection<String> names, int maxSize) {
        if (maxSize < 1) throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        Set<String> missing = new LinkedHashSet<>(names);
        missing.removeAll(fn.def.args.names());
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("The provided function does not have parameters: "
                    + String.join(", ", missing));
        }
        this.evaluator = evaluator;
        this.fn = fn;
        this.names = new LinkedHashSet<>(names);
        this.cache = new LinkedHashMap<Map<String, Object>, UserFunction>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Map<String, Object>, UserFunction> eldest) {
                return size() > maxSize;
            }
        };
    }

    /**
     * Get the number of specializations currently cached.
     *
     * @return The number.
     */
    public int cacheSize() {
        synchronized (cache) {
            return cache.size();
        }
    }

    @Override
    public Object call(List<Object> args, Map<String, Object> kwargs) {
        Arguments params = fn.def.args;
        Map<String, Object> key = new LinkedHashMap<>();
        List<Object> restArgs = new ArrayList<>();
        Map<String, Object> restKwargs = new LinkedHashMap<>();

        int positional = Math.min(args.size(), params.params.size());
        boolean extraPositional = args.size() > positional;
        for (int i = 0; i < positional; i++) {
            String name = params.params.get(i).name;
            if (names.contains(name)) {
                key.put(name, args.get(i));
            } else if (extraPositional) {
                restArgs.add(args.get(i));
            } else {
                restKwargs.put(name, args.get(i));
            }
        }
        restArgs.addAll(args.subList(positional, args.size()));
        for (Map.Entry<String, Object> entry : kwargs.entrySet()) {
            if (names.contains(entry.getKey())) {
                if (key.containsKey(entry.getKey())) {
                    throw new ScriptException(ScriptType.TYPE_ERROR,
                            getName() + "() got multiple values for argument '" + entry.getKey() + "'");
                }
                key.put(entry.getKey(), entry.getValue());
            } else {
                restKwargs.put(entry.getKey(), entry.getValue());
            }
        }
        for (Object value : key.values()) {
            Operators.checkHashable(value);
        }

        return specialization(key).call(restArgs, restKwargs);
    }

    @NotNull
    private UserFunction specialization(Map<String, Object> key) {
        synchronized (cache) {
            UserFunction cached = cache.get(key);
            if (cached != null) return cached;
        }
        LOGGER.debug("specializing {} on {}", fn.getName(), key.keySet());
        UserFunction specialized = evaluator.partialApply(fn, Collections.emptyList(), key);
        synchronized (cache) {
            cache.put(key, specialized);
        }
        return specialized;
    }

    @Override
    public String getName() {
        return fn.getName();
    }

    @Override
    public Signature getSignature() {
        return fn.getSignature();
    }

    @Override
    public String toString() {
        return "<specialized " + fn.getName() + " on " + names + ">";
    }
}
