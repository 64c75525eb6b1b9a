package io.github.eutro.peval.core.analysis;

import io.github.eutro.peval.core.tree.Node;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * An immutable generator of fresh names.
 * <p>
 * Names are of the form {@code __peval_<tag>_<n>}, with a separate counter per tag, and never
 * collide with the names the generator was seeded with. Generating a name returns a new generator,
 * so the same generator always produces the same name.
 */
public final class GenSym {
    private static final String PREFIX = "__peval_";

    /**
     * A freshly generated name, and the generator to use after it.
     */
    public static final class Fresh {
        public final String name;
        public final GenSym genSym;

        Fresh(String name, GenSym genSym) {
            this.name = name;
            this.genSym = genSym;
        }
    }

    private final Set<String> taken;
    private final Map<String, Integer> counters;

    private GenSym(Set<String> taken, Map<String, Integer> counters) {
        this.taken = taken;
        this.counters = counters;
    }

    public static GenSym empty() {
        return new GenSym(Collections.emptySet(), Collections.emptyMap());
    }

    /**
     * Create a generator that avoids the given names.
     *
     * @param taken The names in use.
     * @return The generator.
     */
    public static GenSym avoiding(Set<String> taken) {
        return new GenSym(Collections.unmodifiableSet(new HashSet<>(taken)), Collections.emptyMap());
    }

    /**
     * Create a generator that avoids every name bound or read in a tree.
     *
     * @param tree The tree.
     * @return The generator.
     */
    public static GenSym forTree(Node tree) {
        return avoiding(Scope.analyze(tree).allNames());
    }

    /**
     * Generate a fresh name.
     *
     * @param tag The tag, which becomes part of the name.
     * @return The name, and the generator to use afterwards.
     */
    public Fresh next(String tag) {
        int counter = counters.getOrDefault(tag, 1);
        String name;
        do {
            name = PREFIX + tag + "_" + counter++;
        } while (taken.contains(name));
        Map<String, Integer> newCounters = new HashMap<>(counters);
        newCounters.put(tag, counter);
        return new Fresh(name, new GenSym(taken, newCounters));
    }

    @Override
    public String toString() {
        return "GenSym" + counters;
    }
}
