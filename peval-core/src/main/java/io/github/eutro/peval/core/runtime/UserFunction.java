package io.github.eutro.peval.core.runtime;

import io.github.eutro.peval.core.ext.TagHolder;
import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.TreeScanner;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A function defined in script code: its definition, plus the environment it was defined in.
 */
public final class UserFunction extends TagHolder implements ScriptCallable {
    public final Stmt.FunctionDef def;
    /**
     * The module globals the function was defined in, shared with the module.
     */
    public final Map<String, Object> globals;
    /**
     * The frame of the enclosing function, or null if the function was defined at module level.
     */
    @Nullable
    public final Frame closure;
    /**
     * The values of the defaults of the trailing parameters that have them.
     */
    public final List<Object> defaults;
    private final boolean generator;

    public UserFunction(Stmt.FunctionDef def, Map<String, Object> globals, @Nullable Frame closure, List<Object> defaults) {
        int withDefaults = 0;
        for (int i = 0; i < def.args.params.size(); i++) {
            if (def.args.params.get(i).defaultValue != null) withDefaults++;
        }
        if (withDefaults != defaults.size()) {
            throw new IllegalArgumentException("expected " + withDefaults + " defaults, got " + defaults.size());
        }
        this.def = def;
        this.globals = globals;
        this.closure = closure;
        this.defaults = Collections.unmodifiableList(new ArrayList<>(defaults));
        this.generator = containsYield(def.body);
    }

    private static boolean containsYield(List<Stmt> body) {
        boolean[] found = {false};
        TreeScanner scanner = new TreeScanner() {
            @Override
            public void visitExpr(Expr expr) {
                if (expr instanceof Expr.Yield) found[0] = true;
                if (!(expr instanceof Expr.Lambda)) scanChildren(expr);
            }

            @Override
            public void visitStmt(Stmt stmt) {
                if (!(stmt instanceof Stmt.FunctionDef)) scanChildren(stmt);
            }
        };
        scanner.scan(body);
        return found[0];
    }

    /**
     * Get whether this is a generator function, one whose body yields.
     *
     * @return Whether it is.
     */
    public boolean isGenerator() {
        return generator;
    }

    public boolean isAsync() {
        return def.isAsync;
    }

    /**
     * Get the default value of a parameter.
     *
     * @param index The index of the parameter in {@link io.github.eutro.peval.core.tree.Arguments#params}.
     * @return The default value.
     * @throws IllegalArgumentException If the parameter has no default.
     */
    public Object getDefault(int index) {
        int first = def.args.params.size() - defaults.size();
        if (index < first) throw new IllegalArgumentException("parameter " + index + " has no default");
        return defaults.get(index - first);
    }

    @Override
    public Object call(List<Object> args, Map<String, Object> kwargs) {
        if (def.isAsync) {
            throw new ScriptException(ScriptType.TYPE_ERROR, "cannot call async function '" + def.name + "'");
        }
        if (generator) {
            throw new ScriptException(ScriptType.TYPE_ERROR, "cannot call generator function '" + def.name + "'");
        }
        return Interpreter.callFunction(this, args, kwargs);
    }

    @Override
    public String getName() {
        return def.name;
    }

    @Override
    public Signature getSignature() {
        return Signature.of(def.args);
    }

    @Override
    public String toString() {
        return Operators.repr(this);
    }
}
