package io.github.eutro.peval.core.analysis;

import io.github.eutro.peval.core.tree.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A walk over a tree that reports every name binding and every name reference, in source order.
 * <p>
 * Whether the walk descends into nested scopes (function bodies, lambdas and comprehensions)
 * is decided by {@link #enterNestedScope(Node)}; the name a nested function is defined under, and the
 * defaults, annotations and decorators of its parameters, always belong to the enclosing scope.
 */
public abstract class NameWalker extends TreeScanner {
    /**
     * Called when a name is bound: assigned, a parameter, a loop or comprehension target,
     * an exception or {@code with} target, or the name of a function definition.
     *
     * @param name The name.
     */
    protected abstract void onStore(String name);

    /**
     * Called when a name is read.
     *
     * @param name The name.
     */
    protected abstract void onLoad(String name);

    /**
     * Decide whether to walk the inside of a nested scope.
     *
     * @param scope The {@link Stmt.FunctionDef}, {@link Expr.Lambda} or {@link Expr.Comprehension}.
     * @return Whether to walk it.
     */
    protected boolean enterNestedScope(Node scope) {
        return true;
    }

    /**
     * Walk a function definition as the root scope: its parameter defaults and annotations,
     * its parameters and its body, but not its own name or decorators.
     *
     * @param def The definition.
     */
    public void walkRoot(Stmt.FunctionDef def) {
        walkParamDefaults(def.args);
        scan(def.returns);
        walkFunction(def);
    }

    private void walkFunction(Stmt.FunctionDef def) {
        walkParams(def.args);
        scan(def.body);
    }

    private void walkParamDefaults(Arguments args) {
        for (Param param : allParams(args)) {
            scan(param.defaultValue);
            scan(param.annotation);
        }
    }

    private static List<Param> allParams(Arguments args) {
        List<Param> params = new ArrayList<>(args.params);
        if (args.vararg != null) params.add(args.vararg);
        if (args.kwarg != null) params.add(args.kwarg);
        return params;
    }

    private void walkParams(Arguments args) {
        for (String name : args.names()) {
            onStore(name);
        }
    }

    /**
     * Walk an assignment target, reporting the names it binds.
     *
     * @param target The target.
     */
    public void walkTarget(Expr target) {
        if (target instanceof Expr.Name) {
            onStore(((Expr.Name) target).id);
        } else if (target instanceof Expr.TupleExpr) {
            for (Expr elt : ((Expr.TupleExpr) target).elts) walkTarget(elt);
        } else if (target instanceof Expr.ListExpr) {
            for (Expr elt : ((Expr.ListExpr) target).elts) walkTarget(elt);
        } else if (target instanceof Expr.Starred) {
            walkTarget(((Expr.Starred) target).value);
        } else {
            scan(target);
        }
    }

    @Override
    public void visitExpr(Expr expr) {
        if (expr instanceof Expr.Name) {
            onLoad(((Expr.Name) expr).id);
        } else if (expr instanceof Expr.Lambda) {
            Expr.Lambda lambda = (Expr.Lambda) expr;
            walkParamDefaults(lambda.args);
            if (enterNestedScope(lambda)) {
                walkParams(lambda.args);
                scan(lambda.body);
            }
        } else if (expr instanceof Expr.Comprehension) {
            Expr.Comprehension comp = (Expr.Comprehension) expr;
            scan(comp.generators.get(0).iter);
            if (enterNestedScope(comp)) {
                for (int i = 0; i < comp.generators.size(); i++) {
                    ForClause clause = comp.generators.get(i);
                    if (i != 0) scan(clause.iter);
                    walkTarget(clause.target);
                    scan(clause.ifs);
                }
                scan(comp.elt);
                scan(comp.value);
            }
        } else {
            scanChildren(expr);
        }
    }

    @Override
    public void visitStmt(Stmt stmt) {
        if (stmt instanceof Stmt.Assign) {
            Stmt.Assign assign = (Stmt.Assign) stmt;
            scan(assign.value);
            for (Expr target : assign.targets) walkTarget(target);
        } else if (stmt instanceof Stmt.AugAssign) {
            Stmt.AugAssign assign = (Stmt.AugAssign) stmt;
            scan(assign.target);
            scan(assign.value);
            walkTarget(assign.target);
        } else if (stmt instanceof Stmt.AnnAssign) {
            Stmt.AnnAssign assign = (Stmt.AnnAssign) stmt;
            scan(assign.annotation);
            scan(assign.value);
            walkTarget(assign.target);
        } else if (stmt instanceof Stmt.For) {
            Stmt.For loop = (Stmt.For) stmt;
            scan(loop.iter);
            walkTarget(loop.target);
            scan(loop.body);
            scan(loop.orelse);
        } else if (stmt instanceof Stmt.With) {
            Stmt.With with = (Stmt.With) stmt;
            for (WithItem item : with.items) {
                scan(item.contextExpr);
                if (item.optionalVars != null) walkTarget(item.optionalVars);
            }
            scan(with.body);
        } else if (stmt instanceof Stmt.FunctionDef) {
            Stmt.FunctionDef def = (Stmt.FunctionDef) stmt;
            scan(def.decorators);
            walkParamDefaults(def.args);
            scan(def.returns);
            onStore(def.name);
            if (enterNestedScope(def)) walkFunction(def);
        } else {
            scanChildren(stmt);
        }
    }

    @Override
    public void visitOther(Node node) {
        if (node instanceof ExceptHandler) {
            ExceptHandler handler = (ExceptHandler) node;
            scan(handler.type);
            if (handler.name != null) onStore(handler.name);
            scan(handler.body);
        } else {
            scanChildren(node);
        }
    }
}
