package io.github.eutro.peval.core.runtime;

import io.github.eutro.peval.core.tree.Arguments;
import io.github.eutro.peval.core.tree.Param;

import java.util.*;

/**
 * The shape of the arguments a callable accepts: how many positional arguments,
 * and which keyword arguments.
 */
public final class Signature {
    private final int minPositional;
    private final int maxPositional;
    private final List<String> names;
    private final Set<String> keywordOnly;
    private final boolean varKeywords;

    private Signature(int minPositional, int maxPositional, List<String> names, Set<String> keywordOnly, boolean varKeywords) {
        this.minPositional = minPositional;
        this.maxPositional = maxPositional;
        this.names = names;
        this.keywordOnly = keywordOnly;
        this.varKeywords = varKeywords;
    }

    /**
     * A signature of positional-only parameters, with optional keyword-only parameters.
     *
     * @param min      The minimum number of positional arguments.
     * @param max      The maximum number of positional arguments, or -1 for no limit.
     * @param keywords The names of keyword-only parameters.
     * @return The signature.
     */
    public static Signature positional(int min, int max, String... keywords) {
        return new Signature(min, max, Collections.emptyList(),
                new HashSet<>(Arrays.asList(keywords)), false);
    }

    /**
     * Get a copy of this signature that also accepts arbitrary keyword arguments.
     *
     * @return The new signature.
     */
    public Signature withVarKeywords() {
        return new Signature(minPositional, maxPositional, names, keywordOnly, true);
    }

    public static Signature exactly(int n) {
        return positional(n, n);
    }

    /**
     * Get the signature of a function with the given parameters.
     *
     * @param args The parameters.
     * @return The signature.
     */
    public static Signature of(Arguments args) {
        int required = 0;
        List<String> names = new ArrayList<>();
        for (Param param : args.params) {
            if (param.defaultValue == null) required++;
            names.add(param.name);
        }
        return new Signature(required, args.vararg == null ? names.size() : -1,
                names, Collections.emptySet(), args.kwarg != null);
    }

    /**
     * Check whether a call with the given arguments would bind successfully.
     *
     * @param positional The number of positional arguments.
     * @param keywords   The names of keyword arguments.
     * @return Whether the arguments are accepted.
     */
    public boolean accepts(int positional, Collection<String> keywords) {
        if (maxPositional >= 0 && positional > maxPositional) return false;
        boolean[] filled = new boolean[Math.max(minPositional, names.size())];
        for (int i = 0; i < Math.min(positional, filled.length); i++) {
            filled[i] = true;
        }
        for (String keyword : keywords) {
            int index = names.indexOf(keyword);
            if (index >= 0) {
                if (filled[index]) return false;
                filled[index] = true;
            } else if (!keywordOnly.contains(keyword) && !varKeywords) {
                return false;
            }
        }
        for (int i = 0; i < minPositional; i++) {
            if (!filled[i]) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "Signature[" + minPositional + ".." + (maxPositional < 0 ? "" : maxPositional)
                + ", names=" + names + ", keywords=" + keywordOnly + (varKeywords ? ", **" : "") + "]";
    }
}
