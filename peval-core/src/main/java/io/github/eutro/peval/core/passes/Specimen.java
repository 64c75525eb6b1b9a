package io.github.eutro.peval.core.passes;

import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.Trees;
import io.github.eutro.peval.core.value.AbstractValue;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the partial evaluation passes work on: the definition of a function, and the values of
 * the names it reads from outside.
 */
public final class Specimen {
    @NotNull
    public final Stmt.FunctionDef tree;
    @NotNull
    public final Map<String, Object> bindings;

    public Specimen(@NotNull Stmt.FunctionDef tree, @NotNull Map<String, ?> bindings) {
        this.tree = tree;
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public Specimen withTree(Stmt.FunctionDef tree) {
        return new Specimen(tree, bindings);
    }

    /**
     * Get a specimen with the same tree and more bindings.
     *
     * @param extra The bindings to add, replacing any existing bindings with the same names.
     * @return The new specimen.
     */
    public Specimen withBindings(Map<String, ?> extra) {
        if (extra.isEmpty()) return this;
        Map<String, Object> merged = new LinkedHashMap<>(bindings);
        merged.putAll(extra);
        return new Specimen(tree, merged);
    }

    /**
     * Get whether this specimen is the same as another: the trees are structurally equal,
     * and the bindings have the same names with identical or equal values.
     *
     * @param other The other specimen.
     * @return Whether they are the same.
     */
    public boolean sameAs(Specimen other) {
        if (this == other) return true;
        if (!Trees.equal(tree, other.tree)) return false;
        if (!bindings.keySet().equals(other.bindings.keySet())) return false;
        for (Map.Entry<String, Object> entry : bindings.entrySet()) {
            if (!AbstractValue.known(entry.getValue()).equals(AbstractValue.known(other.bindings.get(entry.getKey())))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Specimen{" + tree.name + ", " + bindings.keySet() + "}";
    }
}
