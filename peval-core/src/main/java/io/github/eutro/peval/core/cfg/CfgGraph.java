package io.github.eutro.peval.core.cfg;

import io.github.eutro.peval.core.tree.Node;
import io.github.eutro.peval.core.tree.Stmt;

import java.util.*;

/**
 * A directed graph of statements, keyed by {@link StatementIndex statement handle}.
 */
public final class CfgGraph {
    /**
     * A node of the graph: a statement or exception handler, and its edges.
     */
    public static final class CfgNode {
        public final int handle;
        public final Node node;
        final SortedSet<Integer> parents = new TreeSet<>();
        final SortedSet<Integer> children = new TreeSet<>();

        CfgNode(int handle, Node node) {
            this.handle = handle;
            this.node = node;
        }

        @Override
        public String toString() {
            return handle + ": " + node.getClass().getSimpleName();
        }
    }

    private final SortedMap<Integer, CfgNode> nodes = new TreeMap<>();

    /**
     * Add a node.
     *
     * @param handle The handle of the node.
     * @param node   The statement or exception handler.
     * @return The handle.
     * @throws IllegalStateException If the handle is already in the graph.
     */
    public int addNode(int handle, Node node) {
        if (nodes.containsKey(handle)) throw new IllegalStateException("duplicate node " + handle);
        nodes.put(handle, new CfgNode(handle, node));
        return handle;
    }

    public void addEdge(int src, int dest) {
        node(src).children.add(dest);
        node(dest).parents.add(src);
    }

    /**
     * Add all the nodes and edges of another graph, which must not share any nodes with this one.
     *
     * @param other The other graph.
     */
    public void update(CfgGraph other) {
        for (Integer handle : other.nodes.keySet()) {
            if (nodes.containsKey(handle)) throw new IllegalStateException("duplicate node " + handle);
        }
        nodes.putAll(other.nodes);
    }

    public CfgNode node(int handle) {
        CfgNode node = nodes.get(handle);
        if (node == null) throw new NoSuchElementException("no node " + handle);
        return node;
    }

    /**
     * Get the children of a node, in ascending order.
     *
     * @param handle The node.
     * @return The children.
     */
    public SortedSet<Integer> childrenOf(int handle) {
        return Collections.unmodifiableSortedSet(node(handle).children);
    }

    public SortedSet<Integer> parentsOf(int handle) {
        return Collections.unmodifiableSortedSet(node(handle).parents);
    }

    /**
     * Get every handle in the graph, in ascending order.
     *
     * @return The handles.
     */
    public Set<Integer> handles() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /**
     * Get the nodes reachable from a node, in depth-first pre-order.
     * <p>
     * A node discovered along several paths is visited when it is last discovered, not first.
     *
     * @param root The node to start from.
     * @return The reachable nodes, starting with the root.
     */
    public List<Integer> reachableFrom(int root) {
        List<Integer> order = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            int top = stack.pop();
            if (!seen.add(top)) continue;
            order.add(top);
            for (int child : node(top).children) {
                stack.push(child);
            }
        }
        return order;
    }

    public boolean contains(int handle) {
        return nodes.containsKey(handle);
    }

    /**
     * Get the nodes that may raise an exception: all but {@code break}, {@code continue},
     * {@code pass} and {@code try} itself.
     *
     * @return The handles, in ascending order.
     */
    public List<Integer> nontrivialNodes() {
        List<Integer> out = new ArrayList<>();
        for (CfgNode node : nodes.values()) {
            if (!(node.node instanceof Stmt.Break
                    || node.node instanceof Stmt.Continue
                    || node.node instanceof Stmt.Pass
                    || node.node instanceof Stmt.Try)) {
                out.add(node.handle);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (CfgNode node : nodes.values()) {
            sb.append(node).append(" -> ").append(node.children).append('\n');
        }
        return sb.toString();
    }
}
