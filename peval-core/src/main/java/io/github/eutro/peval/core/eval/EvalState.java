package io.github.eutro.peval.core.eval;

import io.github.eutro.peval.core.analysis.GenSym;
import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.value.KnownValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The state threaded through expression evaluation: the fresh name generator, and the bindings
 * created for values that had to be referenced by name.
 */
public final class EvalState {
    public final GenSym genSym;
    public final Map<String, Object> tempBindings;

    public EvalState(GenSym genSym, Map<String, Object> tempBindings) {
        this.genSym = genSym;
        this.tempBindings = Collections.unmodifiableMap(new LinkedHashMap<>(tempBindings));
    }

    public static EvalState of(GenSym genSym) {
        return new EvalState(genSym, Collections.emptyMap());
    }

    /**
     * Reify a value, recording any binding it needs.
     *
     * @param value      The value.
     * @param forceFresh Whether to use a fresh name for non-literal values.
     * @return The syntax for the value, with the new state.
     */
    public Evaluation reify(KnownValue value, boolean forceFresh) {
        Reifier.Reified reified = Reifier.reify(value, genSym, forceFresh);
        if (reified.bindings.isEmpty()) return new Evaluation(this, value, reified.node);
        Map<String, Object> bindings = new LinkedHashMap<>(tempBindings);
        bindings.putAll(reified.bindings);
        return new Evaluation(new EvalState(reified.genSym, bindings), value, reified.node);
    }

    @Override
    public String toString() {
        return "EvalState{" + genSym + ", " + tempBindings.keySet() + "}";
    }
}
