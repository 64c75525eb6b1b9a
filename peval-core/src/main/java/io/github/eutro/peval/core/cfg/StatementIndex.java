package io.github.eutro.peval.core.cfg;

import io.github.eutro.peval.core.tree.ExceptHandler;
import io.github.eutro.peval.core.tree.Node;
import io.github.eutro.peval.core.tree.Stmt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Stable integer handles for the statements of a block, assigned in source pre-order.
 * <p>
 * Every statement, and every {@link ExceptHandler}, gets a handle. The handle of a node's first child
 * is one more than its own, and the handle of its next sibling is its own plus its {@link #size(Node) size},
 * so handles can be computed while walking the tree without looking them up.
 * The bodies of nested function definitions are not indexed.
 */
public final class StatementIndex {
    private final List<Node> nodes = new ArrayList<>();

    private StatementIndex() {
    }

    /**
     * Index a block.
     *
     * @param block The block, whose first statement gets handle 0.
     * @return The index.
     */
    public static StatementIndex of(List<? extends Node> block) {
        StatementIndex index = new StatementIndex();
        index.add(block);
        return index;
    }

    private void add(List<? extends Node> block) {
        for (Node node : block) {
            nodes.add(node);
            for (List<? extends Node> child : childBlocks(node)) {
                add(child);
            }
        }
    }

    /**
     * Get the node with a handle.
     *
     * @param handle The handle.
     * @return The statement or exception handler.
     */
    public Node get(int handle) {
        return nodes.get(handle);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Get the blocks directly nested in a node, in source order.
     * <p>
     * The handlers of a {@code try} form a block of their own, between its body and its else clause.
     *
     * @param node The statement or exception handler.
     * @return The nested blocks.
     */
    public static List<List<? extends Node>> childBlocks(Node node) {
        if (node instanceof Stmt.If) {
            Stmt.If stmt = (Stmt.If) node;
            return Arrays.<List<? extends Node>>asList(stmt.body, stmt.orelse);
        } else if (node instanceof Stmt.While) {
            Stmt.While stmt = (Stmt.While) node;
            return Arrays.<List<? extends Node>>asList(stmt.body, stmt.orelse);
        } else if (node instanceof Stmt.For) {
            Stmt.For stmt = (Stmt.For) node;
            return Arrays.<List<? extends Node>>asList(stmt.body, stmt.orelse);
        } else if (node instanceof Stmt.With) {
            return Collections.<List<? extends Node>>singletonList(((Stmt.With) node).body);
        } else if (node instanceof Stmt.Try) {
            Stmt.Try stmt = (Stmt.Try) node;
            return Arrays.<List<? extends Node>>asList(stmt.body, stmt.handlers, stmt.orelse, stmt.finalbody);
        } else if (node instanceof ExceptHandler) {
            return Collections.<List<? extends Node>>singletonList(((ExceptHandler) node).body);
        }
        return Collections.emptyList();
    }

    /**
     * Rebuild a node with new nested blocks.
     *
     * @param node   The node.
     * @param blocks The new blocks, in the order of {@link #childBlocks(Node)}.
     * @return The new node.
     */
    @SuppressWarnings("unchecked")
    public static Node withChildBlocks(Node node, List<List<? extends Node>> blocks) {
        if (node instanceof Stmt.If) {
            Stmt.If stmt = (Stmt.If) node;
            return new Stmt.If(stmt.test, (List<Stmt>) blocks.get(0), (List<Stmt>) blocks.get(1));
        } else if (node instanceof Stmt.While) {
            Stmt.While stmt = (Stmt.While) node;
            return new Stmt.While(stmt.test, (List<Stmt>) blocks.get(0), (List<Stmt>) blocks.get(1));
        } else if (node instanceof Stmt.For) {
            Stmt.For stmt = (Stmt.For) node;
            return new Stmt.For(stmt.target, stmt.iter, (List<Stmt>) blocks.get(0), (List<Stmt>) blocks.get(1));
        } else if (node instanceof Stmt.With) {
            return new Stmt.With(((Stmt.With) node).items, (List<Stmt>) blocks.get(0));
        } else if (node instanceof Stmt.Try) {
            return new Stmt.Try(
                    (List<Stmt>) blocks.get(0),
                    (List<ExceptHandler>) blocks.get(1),
                    (List<Stmt>) blocks.get(2),
                    (List<Stmt>) blocks.get(3));
        } else if (node instanceof ExceptHandler) {
            ExceptHandler handler = (ExceptHandler) node;
            return new ExceptHandler(handler.type, handler.name, (List<Stmt>) blocks.get(0));
        }
        if (!blocks.isEmpty()) throw new IllegalArgumentException("node has no blocks: " + node);
        return node;
    }

    /**
     * Get the number of handles a node and everything nested in it take up.
     *
     * @param node The node.
     * @return The size.
     */
    public static int size(Node node) {
        int size = 1;
        for (List<? extends Node> block : childBlocks(node)) {
            size += blockSize(block);
        }
        return size;
    }

    public static int blockSize(List<? extends Node> block) {
        int size = 0;
        for (Node node : block) {
            size += size(node);
        }
        return size;
    }
}
