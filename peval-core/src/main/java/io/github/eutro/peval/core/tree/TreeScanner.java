package io.github.eutro.peval.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A read-only walk over a syntax tree, in source order.
 * <p>
 * Override {@link #visitExpr(Expr)}, {@link #visitStmt(Stmt)} or {@link #visitOther(Node)} to observe nodes,
 * calling {@link #scanChildren(Node)} to continue into the children, or not calling it to skip the subtree.
 */
public class TreeScanner {
    /**
     * Scan a field of a node: a node, a list of nodes, or anything else (which is ignored).
     *
     * @param field The field.
     */
    public void scan(@Nullable Object field) {
        if (field instanceof Expr) {
            visitExpr((Expr) field);
        } else if (field instanceof Stmt) {
            visitStmt((Stmt) field);
        } else if (field instanceof Node) {
            visitOther((Node) field);
        } else if (field instanceof List) {
            for (Object element : (List<?>) field) {
                scan(element);
            }
        }
    }

    public void visitExpr(Expr expr) {
        scanChildren(expr);
    }

    public void visitStmt(Stmt stmt) {
        scanChildren(stmt);
    }

    /**
     * Visit a node that is neither an expression nor a statement, such as a {@link Keyword} or {@link ExceptHandler}.
     *
     * @param node The node.
     */
    public void visitOther(Node node) {
        scanChildren(node);
    }

    public void scanChildren(Node node) {
        for (Object field : node.fields()) {
            scan(field);
        }
    }
}
