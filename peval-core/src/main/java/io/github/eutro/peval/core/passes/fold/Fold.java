package io.github.eutro.peval.core.passes.fold;

import io.github.eutro.peval.core.analysis.GenSym;
import io.github.eutro.peval.core.analysis.Scope;
import io.github.eutro.peval.core.cfg.CfgBuilder;
import io.github.eutro.peval.core.cfg.ControlFlowGraph;
import io.github.eutro.peval.core.cfg.IndexedTransformer;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.TreePass;
import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.WithItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Constant folding and propagation.
 * <p>
 * Runs the {@link FixedPointSolver} over the function body, and replaces the expressions of every statement
 * with their partially evaluated forms. Values that cannot be written as literals are added to the bindings.
 */
public class Fold implements TreePass<Specimen, Specimen> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Fold.class);

    /**
     * An instance of this pass.
     */
    public static final Fold INSTANCE = new Fold();

    @Override
    public Specimen run(Specimen specimen) {
        Stmt.FunctionDef tree = specimen.tree;
        Map<String, Object> visible = new HashMap<>(specimen.bindings);
        // parameters and locals start out unknown, even where a binding shares their name
        visible.keySet().removeAll(Scope.analyze(tree).locals);
        ControlFlowGraph cfg = CfgBuilder.build(tree.body);
        FixedPointSolver.Result result = FixedPointSolver.solve(GenSym.forTree(tree), cfg, visible);
        List<Stmt> body = new Splicer(result.exprs).transformBlock(tree.body, 0);
        LOGGER.debug("folded {}, adding bindings {}", tree.name, result.tempBindings.keySet());
        return specimen.withTree(tree.withBody(body)).withBindings(result.tempBindings);
    }

    /**
     * Puts the rewritten expressions back into the tree, by statement handle.
     */
    private static final class Splicer extends IndexedTransformer {
        private final Map<Integer, Map<String, Expr>> exprs;

        Splicer(Map<Integer, Map<String, Expr>> exprs) {
            this.exprs = exprs;
        }

        @Override
        protected List<Stmt> transformStmt(Stmt stmt, int handle) {
            Map<String, Expr> slots = exprs.getOrDefault(handle, Collections.emptyMap());
            Stmt node = transformChildBlocks(stmt, handle);
            return Collections.singletonList(slots.isEmpty() ? node : splice(node, slots));
        }

        private static Expr get(Map<String, Expr> slots, String slot, Expr original) {
            Expr expr = slots.get(slot);
            return expr == null ? original : expr;
        }

        private static Stmt splice(Stmt node, Map<String, Expr> slots) {
            if (node instanceof Stmt.Assign) {
                Stmt.Assign stmt = (Stmt.Assign) node;
                return new Stmt.Assign(stmt.targets, get(slots, FixedPointSolver.VALUE, stmt.value));
            } else if (node instanceof Stmt.AugAssign) {
                Stmt.AugAssign stmt = (Stmt.AugAssign) node;
                return new Stmt.AugAssign(stmt.target, stmt.op, get(slots, FixedPointSolver.VALUE, stmt.value));
            } else if (node instanceof Stmt.AnnAssign) {
                Stmt.AnnAssign stmt = (Stmt.AnnAssign) node;
                return new Stmt.AnnAssign(stmt.target,
                        get(slots, FixedPointSolver.ANNOTATION, stmt.annotation),
                        stmt.value == null ? null : get(slots, FixedPointSolver.VALUE, stmt.value));
            } else if (node instanceof Stmt.ExprStmt) {
                Stmt.ExprStmt stmt = (Stmt.ExprStmt) node;
                return new Stmt.ExprStmt(get(slots, FixedPointSolver.VALUE, stmt.value));
            } else if (node instanceof Stmt.Return) {
                Stmt.Return stmt = (Stmt.Return) node;
                return stmt.value == null ? stmt : new Stmt.Return(get(slots, FixedPointSolver.VALUE, stmt.value));
            } else if (node instanceof Stmt.Raise) {
                Stmt.Raise stmt = (Stmt.Raise) node;
                return stmt.exc == null ? stmt : new Stmt.Raise(get(slots, FixedPointSolver.EXC, stmt.exc));
            } else if (node instanceof Stmt.Assert) {
                Stmt.Assert stmt = (Stmt.Assert) node;
                return new Stmt.Assert(get(slots, FixedPointSolver.TEST, stmt.test), stmt.msg);
            } else if (node instanceof Stmt.If) {
                Stmt.If stmt = (Stmt.If) node;
                return new Stmt.If(get(slots, FixedPointSolver.TEST, stmt.test), stmt.body, stmt.orelse);
            } else if (node instanceof Stmt.While) {
                Stmt.While stmt = (Stmt.While) node;
                return new Stmt.While(get(slots, FixedPointSolver.TEST, stmt.test), stmt.body, stmt.orelse);
            } else if (node instanceof Stmt.For) {
                Stmt.For stmt = (Stmt.For) node;
                return new Stmt.For(stmt.target, get(slots, FixedPointSolver.ITER, stmt.iter), stmt.body, stmt.orelse);
            } else if (node instanceof Stmt.With) {
                Stmt.With stmt = (Stmt.With) node;
                List<WithItem> items = new ArrayList<>(stmt.items.size());
                for (int i = 0; i < stmt.items.size(); i++) {
                    WithItem item = stmt.items.get(i);
                    items.add(new WithItem(get(slots, FixedPointSolver.CONTEXT + i, item.contextExpr), item.optionalVars));
                }
                return new Stmt.With(items, stmt.body);
            }
            return node;
        }
    }
}
