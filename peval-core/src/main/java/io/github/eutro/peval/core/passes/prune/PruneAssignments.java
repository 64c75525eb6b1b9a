package io.github.eutro.peval.core.passes.prune;

import io.github.eutro.peval.core.analysis.Scope;
import io.github.eutro.peval.core.cfg.CfgBuilder;
import io.github.eutro.peval.core.cfg.ControlFlowGraph;
import io.github.eutro.peval.core.cfg.IndexedTransformer;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.TreePass;
import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.TreeTransformer;
import io.github.eutro.peval.core.tree.Trees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Removes assignments whose values are never read.
 * <p>
 * First, an assignment to variables none of which is live afterwards is removed, keeping its value as an
 * expression statement if evaluating it may have side effects. Then, copies {@code x = y} among the top level
 * statements of the body are propagated into the statements after them, if neither variable is assigned again.
 */
public class PruneAssignments implements TreePass<Specimen, Specimen> {
    private static final Logger LOGGER = LoggerFactory.getLogger(PruneAssignments.class);

    /**
     * An instance of this pass.
     */
    public static final PruneAssignments INSTANCE = new PruneAssignments();

    @Override
    public Specimen run(Specimen specimen) {
        Stmt.FunctionDef tree = specimen.tree;
        ControlFlowGraph cfg = CfgBuilder.build(tree.body);
        Map<Integer, Set<String>> liveOut = Liveness.liveOut(tree.body, cfg);
        List<Stmt> body = new DeadStores(liveOut).transformBlock(tree.body, 0);
        body = removeCopies(body);
        if (Trees.equal(body, tree.body)) return specimen;
        return specimen.withTree(tree.withBody(body));
    }

    private static final class DeadStores extends IndexedTransformer {
        private final Map<Integer, Set<String>> liveOut;

        DeadStores(Map<Integer, Set<String>> liveOut) {
            this.liveOut = liveOut;
        }

        @Override
        protected List<Stmt> transformStmt(Stmt stmt, int handle) {
            Set<String> live = liveOut.get(handle);
            // unreachable statements are left for the CFG pruner
            if (!(stmt instanceof Stmt.Assign) || live == null) return super.transformStmt(stmt, handle);
            Stmt.Assign assign = (Stmt.Assign) stmt;
            for (Expr target : assign.targets) {
                if (!(target instanceof Expr.Name) || live.contains(((Expr.Name) target).id)) {
                    return Collections.singletonList(stmt);
                }
            }
            LOGGER.debug("removing dead store to {}", assign.targets);
            if (Trees.isSideEffectFree(assign.value)) return Collections.emptyList();
            return Collections.singletonList(new Stmt.ExprStmt(assign.value));
        }
    }

    /**
     * Propagate copies among the top level statements of a block.
     *
     * @param block The block.
     * @return The new block.
     */
    static List<Stmt> removeCopies(List<Stmt> block) {
        Deque<Stmt> remaining = new ArrayDeque<>(block);
        List<Stmt> out = new ArrayList<>();
        while (!remaining.isEmpty()) {
            Stmt stmt = remaining.removeFirst();
            if (isRemovableCopy(stmt, remaining)) {
                Stmt.Assign assign = (Stmt.Assign) stmt;
                String dest = ((Expr.Name) assign.targets.get(0)).id;
                String src = ((Expr.Name) assign.value).id;
                LOGGER.debug("propagating copy {} = {}", dest, src);
                List<Stmt> renamed = new Renamer(dest, src).visitBlock(new ArrayList<>(remaining));
                remaining = new ArrayDeque<>(renamed);
            } else {
                out.add(stmt);
            }
        }
        if (out.isEmpty()) out.add(new Stmt.Pass());
        return out;
    }

    private static boolean isRemovableCopy(Stmt stmt, Collection<Stmt> after) {
        if (!(stmt instanceof Stmt.Assign)) return false;
        Stmt.Assign assign = (Stmt.Assign) stmt;
        if (assign.targets.size() != 1
                || !(assign.targets.get(0) instanceof Expr.Name)
                || !(assign.value instanceof Expr.Name)) {
            return false;
        }
        if (after.isEmpty()) return false;
        Set<String> stored = Scope.analyze(new ArrayList<>(after)).locals;
        return !stored.contains(((Expr.Name) assign.targets.get(0)).id)
                && !stored.contains(((Expr.Name) assign.value).id);
    }

    private static final class Renamer extends TreeTransformer {
        private final String from;
        private final String to;

        Renamer(String from, String to) {
            this.from = from;
            this.to = to;
        }

        @Override
        public Expr visitExpr(Expr expr) {
            if (expr instanceof Expr.Name && ((Expr.Name) expr).id.equals(from)) {
                return new Expr.Name(to);
            }
            return super.visitExpr(expr);
        }
    }
}
