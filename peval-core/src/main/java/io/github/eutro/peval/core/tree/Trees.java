package io.github.eutro.peval.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Utilities for working with syntax trees.
 */
public final class Trees {
    private Trees() {
    }

    /**
     * Compare two trees structurally.
     * <p>
     * Constants are equal only if their values have the same type, so {@code 1}, {@code 1.0} and {@code True}
     * are all different.
     *
     * @param a The first tree.
     * @param b The second tree.
     * @return Whether the trees are structurally equal.
     */
    public static boolean equal(@Nullable Node a, @Nullable Node b) {
        return fieldsEqual(a, b);
    }

    public static boolean equal(List<? extends Node> a, List<? extends Node> b) {
        return fieldsEqual(a, b);
    }

    private static boolean fieldsEqual(@Nullable Object a, @Nullable Object b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (a instanceof Node) {
            if (a.getClass() != b.getClass()) return false;
            return fieldsEqual(((Node) a).fields(), ((Node) b).fields());
        }
        if (a instanceof List) {
            if (!(b instanceof List)) return false;
            List<?> la = (List<?>) a;
            List<?> lb = (List<?>) b;
            if (la.size() != lb.size()) return false;
            for (int i = 0; i < la.size(); i++) {
                if (!fieldsEqual(la.get(i), lb.get(i))) return false;
            }
            return true;
        }
        return a.getClass() == b.getClass() && Objects.equals(a, b);
    }

    /**
     * Get whether a statement unconditionally leaves the block it is in.
     *
     * @param stmt The statement.
     * @return Whether it is a {@code return}, {@code break}, {@code continue} or {@code raise}.
     */
    public static boolean isJump(Stmt stmt) {
        return stmt instanceof Stmt.Return
                || stmt instanceof Stmt.Break
                || stmt instanceof Stmt.Continue
                || stmt instanceof Stmt.Raise;
    }

    /**
     * Get whether an expression may be dropped without changing the behaviour of the program,
     * other than perhaps failing to raise a {@code NameError}.
     *
     * @param expr The expression.
     * @return Whether evaluating it is known to have no side effects.
     */
    public static boolean isSideEffectFree(Expr expr) {
        if (expr instanceof Expr.Name || expr instanceof Expr.Constant || expr instanceof Expr.Lambda) {
            return true;
        }
        if (expr instanceof Expr.TupleExpr) {
            for (Expr elt : ((Expr.TupleExpr) expr).elts) {
                if (!isSideEffectFree(elt)) return false;
            }
            return true;
        }
        if (expr instanceof Expr.ListExpr) {
            for (Expr elt : ((Expr.ListExpr) expr).elts) {
                if (!isSideEffectFree(elt)) return false;
            }
            return true;
        }
        return false;
    }
}
