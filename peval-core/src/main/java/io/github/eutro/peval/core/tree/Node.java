package io.github.eutro.peval.core.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node in the syntax tree.
 * <p>
 * Nodes are immutable. Every node exposes its children as an ordered list of {@link #fields() fields},
 * in source order, which generic traversals such as {@link TreeScanner}, {@link TreeTransformer}
 * and {@link Trees#equal(Node, Node)} operate on. A field is one of:
 * <ul>
 *     <li>another {@link Node}, or {@code null} for an absent optional child,</li>
 *     <li>a {@link List} of nodes,</li>
 *     <li>a plain value: a {@link String} identifier, an operator enum, a {@link Boolean} flag,
 *     or a constant value.</li>
 * </ul>
 * Nodes do not override {@link Object#equals(Object)}; two nodes are the same node only if they are identical.
 */
public abstract class Node {
    Node() {
    }

    /**
     * Get the fields of this node, in source order.
     *
     * @return The fields.
     */
    public abstract List<Object> fields();

    /**
     * Construct a node of the same kind as this one, with the given fields.
     *
     * @param fields The new fields, in the same order and of the same types as {@link #fields()}.
     * @return The new node.
     */
    public abstract Node withFields(List<Object> fields);

    static <T> List<T> copy(List<? extends T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    @SuppressWarnings("unchecked")
    static <T> List<T> listField(Object field) {
        return (List<T>) field;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + fields();
    }
}
