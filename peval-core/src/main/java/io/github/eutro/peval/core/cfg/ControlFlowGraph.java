package io.github.eutro.peval.core.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The control flow graph of a complete statement sequence, such as a function body.
 */
public final class ControlFlowGraph {
    public final CfgGraph graph;
    /**
     * The handle of the first statement.
     */
    public final int enter;
    /**
     * The nodes control leaves the sequence from normally, including by {@code return}.
     */
    public final List<Integer> exits;
    /**
     * The nodes an exception may leave the sequence from.
     */
    public final List<Integer> raises;

    public ControlFlowGraph(CfgGraph graph, int enter, List<Integer> exits, List<Integer> raises) {
        this.graph = graph;
        this.enter = enter;
        this.exits = Collections.unmodifiableList(new ArrayList<>(exits));
        this.raises = Collections.unmodifiableList(new ArrayList<>(raises));
    }
}
