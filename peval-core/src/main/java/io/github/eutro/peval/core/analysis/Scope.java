package io.github.eutro.peval.core.analysis;

import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.tree.ForClause;
import io.github.eutro.peval.core.tree.Node;
import io.github.eutro.peval.core.tree.Stmt;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The names a tree binds and reads.
 * <p>
 * {@link #analyze(Node)} is deliberately coarse: a name bound anywhere in the tree, including in
 * nested functions, lambdas and comprehensions, counts as local. It is what renaming and fresh-name
 * generation need. {@link #frameLocals(Stmt.FunctionDef)} is the precise set of names a call frame holds.
 */
public final class Scope {
    /**
     * Names bound anywhere in the tree, parameters first, in order of first binding.
     */
    public final Set<String> locals;
    /**
     * Names that are both bound and read.
     */
    public final Set<String> localsUsed;
    /**
     * Names read but never bound, which must come from outside the tree.
     */
    public final Set<String> free;

    private Scope(Set<String> locals, Set<String> localsUsed, Set<String> free) {
        this.locals = Collections.unmodifiableSet(locals);
        this.localsUsed = Collections.unmodifiableSet(localsUsed);
        this.free = Collections.unmodifiableSet(free);
    }

    /**
     * Analyze a tree. If it is a function definition, its own name is not counted.
     *
     * @param node The tree.
     * @return The scope.
     */
    public static Scope analyze(Node node) {
        return analyzeField(node);
    }

    /**
     * Analyze a block of statements.
     *
     * @param block The block.
     * @return The scope.
     */
    public static Scope analyze(List<? extends Stmt> block) {
        return analyzeField(block);
    }

    private static Scope analyzeField(Object field) {
        Set<String> stores = new LinkedHashSet<>();
        Set<String> loads = new LinkedHashSet<>();
        NameWalker walker = new NameWalker() {
            @Override
            protected void onStore(String name) {
                stores.add(name);
            }

            @Override
            protected void onLoad(String name) {
                loads.add(name);
            }
        };
        if (field instanceof Stmt.FunctionDef) {
            walker.walkRoot((Stmt.FunctionDef) field);
        } else {
            walker.scan(field);
        }
        Set<String> used = new LinkedHashSet<>();
        Set<String> free = new LinkedHashSet<>();
        for (String name : loads) {
            (stores.contains(name) ? used : free).add(name);
        }
        return new Scope(stores, used, free);
    }

    /**
     * Get every name in the tree, bound or free.
     *
     * @return The names.
     */
    public Set<String> allNames() {
        Set<String> all = new LinkedHashSet<>(locals);
        all.addAll(free);
        return all;
    }

    /**
     * Get the names local to a call of a function: its parameters and the names its body binds,
     * excluding the insides of nested functions, lambdas and comprehensions.
     *
     * @param def The function.
     * @return The local names.
     */
    public static Set<String> frameLocals(Stmt.FunctionDef def) {
        Set<String> locals = new LinkedHashSet<>();
        NameWalker walker = new NameWalker() {
            @Override
            protected void onStore(String name) {
                locals.add(name);
            }

            @Override
            protected void onLoad(String name) {
            }

            @Override
            protected boolean enterNestedScope(Node scope) {
                return false;
            }
        };
        walker.walkRoot(def);
        return locals;
    }

    /**
     * Get the names bound by the {@code for} clauses of a comprehension.
     *
     * @param comp The comprehension.
     * @return The names.
     */
    public static Set<String> comprehensionLocals(Expr.Comprehension comp) {
        Set<String> locals = new LinkedHashSet<>();
        NameWalker walker = new NameWalker() {
            @Override
            protected void onStore(String name) {
                locals.add(name);
            }

            @Override
            protected void onLoad(String name) {
            }

            @Override
            protected boolean enterNestedScope(Node scope) {
                return false;
            }
        };
        for (ForClause clause : comp.generators) {
            walker.walkTarget(clause.target);
        }
        return locals;
    }

    /**
     * Get the names an assignment target binds.
     *
     * @param target The target.
     * @return The names.
     */
    public static Set<String> targetNames(Expr target) {
        Set<String> names = new LinkedHashSet<>();
        new NameWalker() {
            @Override
            protected void onStore(String name) {
                names.add(name);
            }

            @Override
            protected void onLoad(String name) {
            }
        }.walkTarget(target);
        return names;
    }
}
