package io.github.eutro.peval.core.cfg;

import io.github.eutro.peval.core.tree.ExceptHandler;
import io.github.eutro.peval.core.tree.Node;
import io.github.eutro.peval.core.tree.Stmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the {@link ControlFlowGraph} of a statement sequence.
 * <p>
 * The nodes of the graph are the statements and exception handlers of the sequence,
 * identified by their {@link StatementIndex} handles. Handlers of {@code try} statements
 * are assumed to catch everything, and every statement in a protected body other than
 * {@code break}, {@code continue}, {@code pass} and {@code try} is assumed to be able to raise.
 */
public final class CfgBuilder {
    private CfgBuilder() {
    }

    /**
     * Build the graph of a statement sequence, such as a function body.
     *
     * @param statements The statements, which must not be empty.
     * @return The graph.
     * @throws IllegalStateException If a {@code break} or {@code continue} escapes the sequence.
     */
    public static ControlFlowGraph build(List<? extends Stmt> statements) {
        Subgraph cfg = buildBlock(statements, 0);
        if (!cfg.jumps.breaks.isEmpty()) {
            throw new IllegalStateException("'break' outside loop at " + cfg.jumps.breaks);
        }
        if (!cfg.jumps.continues.isEmpty()) {
            throw new IllegalStateException("'continue' outside loop at " + cfg.jumps.continues);
        }
        List<Integer> exits = new ArrayList<>(cfg.exits);
        exits.addAll(cfg.jumps.returns);
        return new ControlFlowGraph(cfg.graph, cfg.enter, exits, cfg.jumps.raises);
    }

    private static Subgraph buildBlock(List<? extends Node> statements, int start) {
        if (statements.isEmpty()) throw new IllegalArgumentException("empty block");
        CfgGraph graph = new CfgGraph();
        List<Integer> exits = Collections.singletonList(start);
        Jumps jumps = Jumps.NONE;
        int handle = start;
        for (Node node : statements) {
            Subgraph cfg = buildNode(node, handle);
            graph.update(cfg.graph);
            if (handle != start) {
                for (int exit : exits) {
                    graph.addEdge(exit, cfg.enter);
                }
            }
            exits = cfg.exits;
            jumps = jumps.join(cfg.jumps);
            if (node instanceof Stmt.Break
                    || node instanceof Stmt.Continue
                    || node instanceof Stmt.Return) {
                break;
            }
            handle += StatementIndex.size(node);
        }
        return new Subgraph(graph, start, exits, jumps);
    }

    private static Subgraph buildNode(Node node, int handle) {
        if (node instanceof Stmt.If) {
            Stmt.If stmt = (Stmt.If) node;
            return buildIf(handle, stmt, stmt.body, stmt.orelse);
        } else if (node instanceof Stmt.While) {
            Stmt.While stmt = (Stmt.While) node;
            return buildLoop(handle, stmt, stmt.body, stmt.orelse);
        } else if (node instanceof Stmt.For) {
            Stmt.For stmt = (Stmt.For) node;
            return buildLoop(handle, stmt, stmt.body, stmt.orelse);
        } else if (node instanceof Stmt.With) {
            return buildWith(handle, (Stmt.With) node);
        } else if (node instanceof Stmt.Try) {
            return buildTry(handle, (Stmt.Try) node);
        } else if (node instanceof ExceptHandler) {
            return buildHandler(handle, (ExceptHandler) node);
        }

        CfgGraph graph = new CfgGraph();
        graph.addNode(handle, node);
        if (node instanceof Stmt.Break) {
            return new Subgraph(graph, handle, Collections.emptyList(), Jumps.breaks(handle));
        } else if (node instanceof Stmt.Continue) {
            return new Subgraph(graph, handle, Collections.emptyList(), Jumps.continues(handle));
        } else if (node instanceof Stmt.Return) {
            return new Subgraph(graph, handle, Collections.emptyList(), Jumps.returns(handle));
        }
        return new Subgraph(graph, handle, Collections.singletonList(handle), Jumps.NONE);
    }

    private static Subgraph buildIf(int handle, Stmt stmt, List<Stmt> body, List<Stmt> orelse) {
        Subgraph then = buildBlock(body, handle + 1);
        CfgGraph graph = then.graph;
        graph.addNode(handle, stmt);
        graph.addEdge(handle, then.enter);
        List<Integer> exits = new ArrayList<>(then.exits);
        Jumps jumps = then.jumps;
        if (!orelse.isEmpty()) {
            Subgraph otherwise = buildBlock(orelse, handle + 1 + StatementIndex.blockSize(body));
            graph.update(otherwise.graph);
            graph.addEdge(handle, otherwise.enter);
            exits.addAll(otherwise.exits);
            jumps = jumps.join(otherwise.jumps);
        } else {
            exits.add(handle);
        }
        return new Subgraph(graph, handle, exits, jumps);
    }

    private static Subgraph buildLoop(int handle, Stmt stmt, List<Stmt> body, List<Stmt> orelse) {
        Subgraph loop = buildBlock(body, handle + 1);
        CfgGraph graph = loop.graph;
        graph.addNode(handle, stmt);
        graph.addEdge(handle, loop.enter);
        for (int cont : loop.jumps.continues) {
            graph.addEdge(cont, handle);
        }
        for (int exit : loop.exits) {
            graph.addEdge(exit, handle);
        }

        // the loop may also finish without running its body at all
        List<Integer> finished = new ArrayList<>(loop.exits);
        finished.add(handle);

        List<Integer> exits = new ArrayList<>(loop.jumps.breaks);
        Jumps jumps = Jumps.raises(loop.jumps.raises);
        if (orelse.isEmpty()) {
            exits.addAll(finished);
        } else {
            Subgraph otherwise = buildBlock(orelse, handle + 1 + StatementIndex.blockSize(body));
            graph.update(otherwise.graph);
            exits.addAll(otherwise.exits);
            jumps = jumps.join(Jumps.raises(otherwise.jumps.raises));
            for (int exit : finished) {
                graph.addEdge(exit, otherwise.enter);
            }
        }
        return new Subgraph(graph, handle, exits, jumps);
    }

    private static Subgraph buildWith(int handle, Stmt.With stmt) {
        Subgraph body = buildBlock(stmt.body, handle + 1);
        CfgGraph graph = body.graph;
        graph.addNode(handle, stmt);
        graph.addEdge(handle, body.enter);
        return new Subgraph(graph, handle, body.exits, body.jumps);
    }

    private static Subgraph buildHandler(int handle, ExceptHandler handler) {
        CfgGraph graph = new CfgGraph();
        graph.addNode(handle, handler);
        Subgraph body = buildBlock(handler.body, handle + 1);
        graph.update(body.graph);
        graph.addEdge(handle, body.enter);
        return new Subgraph(graph, handle, body.exits, body.jumps);
    }

    private static Subgraph buildTry(int handle, Stmt.Try stmt) {
        int handlersStart = handle + 1 + StatementIndex.blockSize(stmt.body);
        int orelseStart = handlersStart + StatementIndex.blockSize(stmt.handlers);
        int finalStart = orelseStart + StatementIndex.blockSize(stmt.orelse);

        CfgGraph graph = new CfgGraph();
        graph.addNode(handle, stmt);

        Subgraph body = buildBlock(stmt.body, handle + 1);
        // raises from the body go to the handlers, or are collected below
        Jumps jumps = body.jumps.withRaises(Collections.emptyList());
        graph.update(body.graph);
        graph.addEdge(handle, body.enter);

        List<Subgraph> handlers = new ArrayList<>();
        int handlerHandle = handlersStart;
        for (ExceptHandler handler : stmt.handlers) {
            Subgraph handlerCfg = buildHandler(handlerHandle, handler);
            handlers.add(handlerCfg);
            graph.update(handlerCfg.graph);
            jumps = jumps.join(handlerCfg.jumps);
            handlerHandle += StatementIndex.size(handler);
        }

        List<Integer> bodyNodes = body.graph.nontrivialNodes();
        if (handlers.isEmpty()) {
            jumps = jumps.join(Jumps.raises(bodyNodes));
        } else {
            for (int node : bodyNodes) {
                for (Subgraph handler : handlers) {
                    graph.addEdge(node, handler.enter);
                }
            }
        }

        List<Integer> exits = new ArrayList<>(body.exits);
        if (!stmt.orelse.isEmpty() && !body.exits.isEmpty()) {
            Subgraph orelse = buildBlock(stmt.orelse, orelseStart);
            graph.update(orelse.graph);
            jumps = jumps.join(orelse.jumps);
            for (int exit : exits) {
                graph.addEdge(exit, orelse.enter);
            }
            exits = new ArrayList<>(orelse.exits);
        }
        for (Subgraph handler : handlers) {
            exits.addAll(handler.exits);
        }

        if (stmt.finalbody.isEmpty()) {
            return new Subgraph(graph, handle, exits, jumps);
        }

        Subgraph fin = buildBlock(stmt.finalbody, finalStart);
        graph.update(fin.graph);
        for (int exit : exits) {
            graph.addEdge(exit, fin.enter);
        }
        return new Subgraph(graph, handle, fin.exits, new Jumps(
                passThrough(graph, jumps.returns, fin),
                passThrough(graph, jumps.breaks, fin),
                passThrough(graph, jumps.continues, fin),
                passThrough(graph, jumps.raises, fin)));
    }

    private static List<Integer> passThrough(CfgGraph graph, List<Integer> jumps, Subgraph fin) {
        if (jumps.isEmpty()) return Collections.emptyList();
        for (int jump : jumps) {
            graph.addEdge(jump, fin.enter);
        }
        return fin.exits;
    }
}
