package io.github.eutro.peval.core.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The control flow graph of part of a block, while it is being built.
 */
final class Subgraph {
    final CfgGraph graph;
    final int enter;
    /**
     * The nodes that fall through to whatever follows the subgraph.
     */
    final List<Integer> exits;
    final Jumps jumps;

    Subgraph(CfgGraph graph, int enter, List<Integer> exits, Jumps jumps) {
        this.graph = graph;
        this.enter = enter;
        this.exits = Collections.unmodifiableList(new ArrayList<>(exits));
        this.jumps = jumps;
    }
}
