package io.github.eutro.peval.core.passes.prune;

import io.github.eutro.peval.core.analysis.NameWalker;
import io.github.eutro.peval.core.cfg.CfgGraph;
import io.github.eutro.peval.core.cfg.ControlFlowGraph;
import io.github.eutro.peval.core.cfg.StatementIndex;
import io.github.eutro.peval.core.tree.*;

import java.util.*;

/**
 * Computes which local variables are live after each statement of a function body.
 * <p>
 * A statement inside a protected region of a {@code try} may raise before it has assigned anything,
 * so it does not kill the variables live after it.
 */
final class Liveness {
    private final ControlFlowGraph cfg;
    private final Map<Integer, Set<String>> liveIn = new HashMap<>();
    private final Map<Integer, Set<String>> liveOut = new HashMap<>();
    private final Map<Integer, Set<String>> defs = new HashMap<>();

    private Liveness(ControlFlowGraph cfg) {
        this.cfg = cfg;
    }

    /**
     * Analyze a function body.
     *
     * @param body The body.
     * @param cfg  The graph of the body.
     * @return The variables live after each node, by handle.
     */
    static Map<Integer, Set<String>> liveOut(List<Stmt> body, ControlFlowGraph cfg) {
        Liveness liveness = new Liveness(cfg);
        liveness.solve(protectedHandles(body));
        return liveness.liveOut;
    }

    private void solve(Set<Integer> protectedHandles) {
        CfgGraph graph = cfg.graph;
        for (int handle : graph.handles()) {
            Node node = graph.node(handle).node;
            liveIn.put(handle, uses(node));
            liveOut.put(handle, new HashSet<>());
            defs.put(handle, protectedHandles.contains(handle) ? Collections.emptySet() : defs(node));
        }

        Set<Integer> workQueue = new LinkedHashSet<>();
        List<Integer> handles = new ArrayList<>(graph.handles());
        Collections.reverse(handles);
        workQueue.addAll(handles);
        while (!workQueue.isEmpty()) {
            Iterator<Integer> iterator = workQueue.iterator();
            int handle = iterator.next();
            iterator.remove();
            Set<String> out = liveOut.get(handle);
            Set<String> in = liveIn.get(handle);
            boolean changed = false;
            for (int child : graph.childrenOf(handle)) {
                for (String name : liveIn.get(child)) {
                    if (out.add(name) && !defs.get(handle).contains(name)) {
                        changed |= in.add(name);
                    }
                }
            }
            if (changed) {
                workQueue.addAll(graph.parentsOf(handle));
            }
        }
    }

    private static Set<Integer> protectedHandles(List<Stmt> body) {
        Set<Integer> handles = new HashSet<>();
        StatementIndex index = StatementIndex.of(body);
        for (int handle = 0; handle < index.size(); handle++) {
            Node node = index.get(handle);
            if (!(node instanceof Stmt.Try)) continue;
            Stmt.Try stmt = (Stmt.Try) node;
            int size = StatementIndex.blockSize(stmt.body);
            if (!stmt.finalbody.isEmpty()) {
                size += StatementIndex.blockSize(stmt.handlers) + StatementIndex.blockSize(stmt.orelse);
            }
            for (int i = handle + 1; i <= handle + size; i++) {
                handles.add(i);
            }
        }
        return handles;
    }

    /**
     * Get the names a node reads, not counting the blocks nested in it.
     * Names read in nested scopes are included.
     */
    static Set<String> uses(Node node) {
        Set<String> names = new HashSet<>();
        NameWalker walker = new NameWalker() {
            @Override
            protected void onStore(String name) {
            }

            @Override
            protected void onLoad(String name) {
                names.add(name);
            }
        };
        if (node instanceof Stmt.If) {
            walker.scan(((Stmt.If) node).test);
        } else if (node instanceof Stmt.While) {
            walker.scan(((Stmt.While) node).test);
        } else if (node instanceof Stmt.For) {
            Stmt.For loop = (Stmt.For) node;
            walker.scan(loop.iter);
            walker.walkTarget(loop.target);
        } else if (node instanceof Stmt.With) {
            for (WithItem item : ((Stmt.With) node).items) {
                walker.scan(item.contextExpr);
                if (item.optionalVars != null) walker.walkTarget(item.optionalVars);
            }
        } else if (node instanceof ExceptHandler) {
            walker.scan(((ExceptHandler) node).type);
        } else if (!(node instanceof Stmt.Try)) {
            walker.scan(node);
        }
        return names;
    }

    /**
     * Get the names a node assigns, not counting the blocks or nested scopes in it.
     */
    static Set<String> defs(Node node) {
        Set<String> names = new HashSet<>();
        NameWalker walker = new NameWalker() {
            @Override
            protected void onStore(String name) {
                names.add(name);
            }

            @Override
            protected void onLoad(String name) {
            }

            @Override
            protected boolean enterNestedScope(Node scope) {
                return false;
            }
        };
        if (node instanceof Stmt.For) {
            walker.walkTarget(((Stmt.For) node).target);
        } else if (node instanceof Stmt.With) {
            for (WithItem item : ((Stmt.With) node).items) {
                if (item.optionalVars != null) walker.walkTarget(item.optionalVars);
            }
        } else if (node instanceof ExceptHandler) {
            ExceptHandler handler = (ExceptHandler) node;
            if (handler.name != null) names.add(handler.name);
        } else if (StatementIndex.childBlocks(node).isEmpty()) {
            walker.scan(node);
        }
        return names;
    }
}
