package io.github.eutro.peval.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * A rewriting walk over a syntax tree, in source order.
 * <p>
 * Every visit method returns the replacement for the node it was given. By default, a node is rebuilt
 * only if one of its children was replaced, so a transformer that replaces nothing returns its
 * input by reference.
 * <p>
 * Statements are visited as part of a block, so a statement may be replaced by any number of statements,
 * and expressions may {@link #prepend(List) prepend} statements before the statement that contains them.
 * A block that was not empty is never made empty; a {@link Stmt.Pass} is left instead.
 */
public class TreeTransformer {
    private final Deque<List<Stmt>> prepends = new ArrayDeque<>();

    public Expr visitExpr(Expr expr) {
        return transformChildren(expr);
    }

    public List<Stmt> visitStmt(Stmt stmt) {
        return Collections.singletonList(transformChildren(stmt));
    }

    /**
     * Visit a node that is neither an expression nor a statement, such as a {@link Keyword} or {@link ExceptHandler}.
     *
     * @param node The node.
     * @return The replacement node, of the same kind.
     */
    public Node visitOther(Node node) {
        return transformChildren(node);
    }

    public List<Stmt> visitBlock(List<Stmt> block) {
        List<Stmt> out = new ArrayList<>(block.size());
        boolean changed = false;
        for (Stmt stmt : block) {
            List<Stmt> pending = new ArrayList<>();
            prepends.push(pending);
            List<Stmt> replaced;
            try {
                replaced = visitStmt(stmt);
            } finally {
                prepends.pop();
            }
            if (!pending.isEmpty()) {
                changed = true;
                out.addAll(pending);
            }
            if (replaced.size() != 1 || replaced.get(0) != stmt) changed = true;
            out.addAll(replaced);
        }
        if (!changed) return block;
        if (out.isEmpty() && !block.isEmpty()) out.add(new Stmt.Pass());
        return out;
    }

    /**
     * Insert statements before the statement currently being visited, in the innermost enclosing block.
     *
     * @param stmts The statements to insert.
     */
    protected void prepend(List<? extends Stmt> stmts) {
        List<Stmt> pending = prepends.peek();
        if (pending == null) throw new IllegalStateException("no enclosing statement to prepend to");
        pending.addAll(stmts);
    }

    /**
     * Transform the children of a node, rebuilding it if any changed.
     *
     * @param node The node.
     * @param <N>  The type of the node.
     * @return The node, or a new node with the transformed children.
     */
    @SuppressWarnings("unchecked")
    public <N extends Node> N transformChildren(N node) {
        List<Object> fields = node.fields();
        List<Object> newFields = null;
        for (int i = 0; i < fields.size(); i++) {
            Object field = fields.get(i);
            Object newField = transformField(field);
            if (newField != field) {
                if (newFields == null) newFields = new ArrayList<>(fields);
                newFields.set(i, newField);
            }
        }
        return newFields == null ? node : (N) node.withFields(newFields);
    }

    @SuppressWarnings("unchecked")
    protected Object transformField(@Nullable Object field) {
        if (field instanceof Expr) {
            return visitExpr((Expr) field);
        } else if (field instanceof Node) {
            return visitOther((Node) field);
        } else if (field instanceof List) {
            List<?> list = (List<?>) field;
            if (list.isEmpty()) return list;
            if (list.get(0) instanceof Stmt) {
                return visitBlock((List<Stmt>) list);
            }
            List<Object> newList = null;
            for (int i = 0; i < list.size(); i++) {
                Object element = list.get(i);
                Object newElement = transformField(element);
                if (newElement != element) {
                    if (newList == null) newList = new ArrayList<>(list);
                    newList.set(i, newElement);
                }
            }
            return newList == null ? list : newList;
        }
        return field;
    }
}
