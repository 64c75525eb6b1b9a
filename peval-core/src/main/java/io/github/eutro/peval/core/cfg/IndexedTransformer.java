package io.github.eutro.peval.core.cfg;

import io.github.eutro.peval.core.tree.ExceptHandler;
import io.github.eutro.peval.core.tree.Node;
import io.github.eutro.peval.core.tree.Stmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rewriting walk over the statements of a block that knows the {@link StatementIndex} handle of
 * each statement it visits, so that results computed on a {@link ControlFlowGraph} can be applied to the tree.
 * <p>
 * Handles always refer to the tree as it was before the walk.
 */
public abstract class IndexedTransformer {
    /**
     * Transform a block.
     *
     * @param block The block.
     * @param start The handle of its first statement.
     * @return The new block, which is not empty if the old one was not.
     */
    public List<Stmt> transformBlock(List<Stmt> block, int start) {
        List<Stmt> out = new ArrayList<>(block.size());
        int handle = start;
        for (Stmt stmt : block) {
            out.addAll(transformStmt(stmt, handle));
            handle += StatementIndex.size(stmt);
        }
        if (out.isEmpty() && !block.isEmpty()) out.add(new Stmt.Pass());
        return out;
    }

    /**
     * Transform a statement. By default, only the blocks nested in it are transformed.
     *
     * @param stmt   The statement.
     * @param handle Its handle.
     * @return The statements to replace it with.
     */
    protected List<Stmt> transformStmt(Stmt stmt, int handle) {
        return Collections.singletonList(transformChildBlocks(stmt, handle));
    }

    protected ExceptHandler transformHandler(ExceptHandler handler, int handle) {
        return transformChildBlocks(handler, handle);
    }

    /**
     * Transform the blocks nested in a node, rebuilding it if it has any.
     *
     * @param node   The node.
     * @param handle Its handle.
     * @param <N>    The type of the node.
     * @return The rebuilt node.
     */
    @SuppressWarnings("unchecked")
    protected <N extends Node> N transformChildBlocks(N node, int handle) {
        List<List<? extends Node>> blocks = StatementIndex.childBlocks(node);
        if (blocks.isEmpty()) return node;
        List<List<? extends Node>> newBlocks = new ArrayList<>(blocks.size());
        int child = handle + 1;
        for (List<? extends Node> block : blocks) {
            if (!block.isEmpty() && block.get(0) instanceof ExceptHandler) {
                List<ExceptHandler> handlers = new ArrayList<>(block.size());
                int h = child;
                for (Node element : block) {
                    handlers.add(transformHandler((ExceptHandler) element, h));
                    h += StatementIndex.size(element);
                }
                newBlocks.add(handlers);
            } else {
                newBlocks.add(transformBlock((List<Stmt>) block, child));
            }
            child += StatementIndex.blockSize(block);
        }
        return (N) StatementIndex.withChildBlocks(node, newBlocks);
    }
}
