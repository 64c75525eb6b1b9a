package io.github.eutro.peval.core.eval;

import io.github.eutro.peval.core.analysis.GenSym;
import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.value.KnownValue;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;

/**
 * Turns known values back into syntax.
 */
public final class Reifier {
    private Reifier() {
    }

    /**
     * The syntax for a value, and the binding it needs, if any.
     */
    public static final class Reified {
        public final Expr node;
        public final GenSym genSym;
        /**
         * The binding the node refers to, empty for literals.
         */
        public final Map<String, Object> bindings;

        Reified(Expr node, GenSym genSym, Map<String, Object> bindings) {
            this.node = node;
            this.genSym = genSym;
            this.bindings = bindings;
        }
    }

    /**
     * Reify a value.
     * <p>
     * Values with a literal syntax become {@link Expr.Constant}s. Anything else becomes a {@link Expr.Name},
     * which must be bound to the value: its preferred name, or a fresh temporary if it has none or
     * {@code forceFresh} is set.
     *
     * @param value      The value.
     * @param genSym     The fresh name generator.
     * @param forceFresh Whether to always use a fresh name for non-literal values.
     * @return The syntax.
     */
    public static Reified reify(KnownValue value, GenSym genSym, boolean forceFresh) {
        if (Expr.Constant.isLiteral(value.value)) {
            return new Reified(new Expr.Constant(value.value), genSym, Collections.emptyMap());
        }
        String name = value.preferredName;
        if (name == null || forceFresh) {
            GenSym.Fresh fresh = genSym.next("temp");
            name = fresh.name;
            genSym = fresh.genSym;
        }
        return new Reified(new Expr.Name(name), genSym, Collections.singletonMap(name, value.value));
    }

    public static Reified reify(@Nullable Object value, GenSym genSym) {
        return reify(new KnownValue(value), genSym, false);
    }
}
