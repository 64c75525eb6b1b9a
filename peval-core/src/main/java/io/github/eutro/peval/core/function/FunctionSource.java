package io.github.eutro.peval.core.function;

import io.github.eutro.peval.core.analysis.GenSym;
import io.github.eutro.peval.core.analysis.Scope;
import io.github.eutro.peval.core.eval.Reifier;
import io.github.eutro.peval.core.runtime.Builtins;
import io.github.eutro.peval.core.runtime.Frame;
import io.github.eutro.peval.core.runtime.Interpreter;
import io.github.eutro.peval.core.runtime.Tuple;
import io.github.eutro.peval.core.runtime.UserFunction;
import io.github.eutro.peval.core.tree.Arguments;
import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.tree.Param;
import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.TreeScanner;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The syntax tree of a function, together with the values of the names it reads from outside.
 * <p>
 * This is how functions go in and out of the partial evaluator: {@link #of(UserFunction)} takes apart
 * a function, the passes rewrite the {@link #tree} and extend the {@link #bindings}, and {@link #toFunction()}
 * puts a callable function back together.
 */
public final class FunctionSource {
    /**
     * The definition of the function, without decorators.
     */
    public final Stmt.FunctionDef tree;
    /**
     * The values of the free names of the tree, and any bindings added since.
     */
    public final Map<String, Object> bindings;
    /**
     * The free names that were taken from enclosing function frames.
     */
    public final Set<String> closureNames;
    private final Map<String, Object> moduleGlobals;
    @Nullable
    private final Frame closure;

    private FunctionSource(Stmt.FunctionDef tree,
                           Map<String, Object> bindings,
                           Set<String> closureNames,
                           Map<String, Object> moduleGlobals,
                           @Nullable Frame closure) {
        this.tree = tree;
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.closureNames = Collections.unmodifiableSet(closureNames);
        this.moduleGlobals = moduleGlobals;
        this.closure = closure;
    }

    /**
     * Take apart a function.
     * <p>
     * Free names are resolved, in order: the name of the function itself, which maps to the function;
     * variables of enclosing function frames; module globals; builtins.
     *
     * @param fn The function.
     * @return The source of the function.
     * @throws IllegalArgumentException If a free name of the function is not bound anywhere.
     */
    public static FunctionSource of(UserFunction fn) {
        Stmt.FunctionDef tree = fn.def.withDecorators(Collections.emptyList());
        Map<String, Object> bindings = new LinkedHashMap<>();
        Set<String> closureNames = new LinkedHashSet<>();
        for (String name : Scope.analyze(tree).free) {
            if (name.equals(tree.name)) {
                bindings.put(name, fn);
            } else if (fn.closure != null && fn.closure.hasCell(name)) {
                bindings.put(name, fn.closure.cell(name));
                closureNames.add(name);
            } else if (fn.globals.containsKey(name)) {
                bindings.put(name, fn.globals.get(name));
            } else if (Builtins.has(name)) {
                bindings.put(name, Builtins.get(name));
            } else {
                throw new IllegalArgumentException("name '" + name + "' is not defined");
            }
        }
        return new FunctionSource(tree, bindings, closureNames, fn.globals, fn.closure);
    }

    /**
     * Bind some of the parameters of the function to values.
     * <p>
     * The bound parameters are removed from the signature, and assignments of their values are
     * prepended to the body.
     *
     * @param args   The leading positional arguments.
     * @param kwargs The keyword arguments.
     * @return The new source.
     * @throws IllegalArgumentException If the arguments do not fit the signature.
     */
    public FunctionSource bindPartial(List<?> args, Map<String, ?> kwargs) {
        Arguments params = tree.args;
        Map<String, Object> bound = new LinkedHashMap<>();
        Object[] values = new Object[params.params.size()];
        boolean[] filled = new boolean[values.length];
        for (int i = 0; i < Math.min(args.size(), values.length); i++) {
            values[i] = args.get(i);
            filled[i] = true;
        }
        Object varargs = null;
        if (args.size() > values.length) {
            if (params.vararg == null) {
                throw new IllegalArgumentException(tree.name + "() takes " + values.length
                        + " positional arguments but " + args.size() + " were given");
            }
            varargs = Tuple.copyOf(args.subList(values.length, args.size()));
        }
        Map<Object, Object> varkwargs = null;
        for (Map.Entry<String, ?> entry : kwargs.entrySet()) {
            int index = params.indexOf(entry.getKey());
            if (index >= 0) {
                if (filled[index]) {
                    throw new IllegalArgumentException("multiple values for argument '" + entry.getKey() + "'");
                }
                values[index] = entry.getValue();
                filled[index] = true;
            } else if (params.kwarg != null) {
                if (varkwargs == null) varkwargs = new LinkedHashMap<>();
                varkwargs.put(entry.getKey(), entry.getValue());
            } else {
                throw new IllegalArgumentException(tree.name + "() got an unexpected keyword argument '"
                        + entry.getKey() + "'");
            }
        }

        List<Param> remaining = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            Param param = params.params.get(i);
            if (filled[i]) {
                bound.put(param.name, values[i]);
            } else {
                remaining.add(param);
            }
        }
        Param vararg = params.vararg;
        if (varargs != null) {
            bound.put(vararg.name, varargs);
            vararg = null;
        }
        Param kwarg = params.kwarg;
        if (varkwargs != null) {
            bound.put(kwarg.name, varkwargs);
            kwarg = null;
        }

        Stmt.FunctionDef newTree = tree.withArgs(new Arguments(remaining, vararg, kwarg));
        GenSym genSym = GenSym.forTree(newTree);
        Map<String, Object> newBindings = new LinkedHashMap<>(bindings);
        List<Stmt> body = new ArrayList<>();
        for (Map.Entry<String, Object> entry : bound.entrySet()) {
            Reifier.Reified reified = Reifier.reify(entry.getValue(), genSym);
            genSym = reified.genSym;
            newBindings.putAll(reified.bindings);
            body.add(new Stmt.Assign(entry.getKey(), reified.node));
        }
        body.addAll(newTree.body);
        return new FunctionSource(newTree.withBody(body), newBindings, closureNames, moduleGlobals, closure);
    }

    /**
     * Replace the tree and bindings of this source.
     *
     * @param tree     The new tree.
     * @param bindings The new bindings.
     * @return The new source.
     */
    public FunctionSource replace(Stmt.FunctionDef tree, Map<String, Object> bindings) {
        return new FunctionSource(tree, bindings, closureNames, moduleGlobals, closure);
    }

    /**
     * Create a callable function from this source.
     * <p>
     * The function sees a copy of the module globals it was taken from, extended with the bindings.
     * Variables of enclosing function frames are still read from those frames.
     *
     * @return The function.
     */
    public UserFunction toFunction() {
        Map<String, Object> globals = new HashMap<>(moduleGlobals);
        for (Map.Entry<String, Object> entry : bindings.entrySet()) {
            if (!closureNames.contains(entry.getKey())) globals.put(entry.getKey(), entry.getValue());
        }
        return Interpreter.createFunction(tree, globals, closure);
    }

    /**
     * Get whether the body of the function defines other functions or lambdas.
     *
     * @return Whether it does.
     */
    public boolean hasNestedDefinitions() {
        return contains(tree.body, Stmt.FunctionDef.class, Expr.Lambda.class);
    }

    public boolean isGenerator() {
        return contains(tree.body, Expr.Yield.class);
    }

    public boolean isAsync() {
        return tree.isAsync;
    }

    private static boolean contains(List<Stmt> body, Class<?>... kinds) {
        boolean[] found = {false};
        new TreeScanner() {
            @Override
            public void visitExpr(Expr expr) {
                if (isAny(expr, kinds)) found[0] = true;
                super.visitExpr(expr);
            }

            @Override
            public void visitStmt(Stmt stmt) {
                if (isAny(stmt, kinds)) found[0] = true;
                super.visitStmt(stmt);
            }
        }.scan(body);
        return found[0];
    }

    private static boolean isAny(Object node, Class<?>[] kinds) {
        for (Class<?> kind : kinds) {
            if (kind.isInstance(node)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "FunctionSource[" + tree.name + ", " + bindings.keySet() + "]";
    }
}
