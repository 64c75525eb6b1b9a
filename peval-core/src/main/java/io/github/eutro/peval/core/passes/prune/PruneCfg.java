package io.github.eutro.peval.core.passes.prune;

import io.github.eutro.peval.core.analysis.Scope;
import io.github.eutro.peval.core.eval.ExpressionEvaluator;
import io.github.eutro.peval.core.eval.SpeculativeCall;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.TreePass;
import io.github.eutro.peval.core.tree.*;
import io.github.eutro.peval.core.value.KnownValue;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Removes code that can never run, and simplifies control flow that is known statically.
 * <p>
 * Repeats, until nothing changes:
 * <ul>
 *     <li>removing {@code pass}, and anything after a {@code return}, {@code break}, {@code continue}
 *     or {@code raise} in the same block;</li>
 *     <li>turning a {@code while} loop that can only run once into an {@code if}, and one whose test is
 *     known to be false into its {@code else} block;</li>
 *     <li>replacing an {@code if} whose test is known with the branch that is taken.</li>
 * </ul>
 */
public class PruneCfg implements TreePass<Specimen, Specimen> {
    private static final Logger LOGGER = LoggerFactory.getLogger(PruneCfg.class);

    /**
     * An instance of this pass.
     */
    public static final PruneCfg INSTANCE = new PruneCfg();

    @Override
    public Specimen run(Specimen specimen) {
        Stmt.FunctionDef tree = specimen.tree;
        Map<String, Object> visible = new HashMap<>(specimen.bindings);
        // a local variable shadows a binding of the same name
        visible.keySet().removeAll(Scope.analyze(tree).locals);

        List<Stmt> body = tree.body;
        while (true) {
            List<Stmt> newBody = new RemoveUnreachable().visitBlock(body);
            newBody = new SimplifyLoops(visible).visitBlock(newBody);
            newBody = new RemoveUnreachableBranches(visible).visitBlock(newBody);
            if (Trees.equal(newBody, body)) break;
            body = newBody;
        }
        if (body == tree.body) return specimen;
        return specimen.withTree(tree.withBody(body));
    }

    /**
     * Get the truth value of a test, if it is known.
     *
     * @param test     The test.
     * @param bindings The known bindings.
     * @return The truth value, or null if it is not known.
     */
    @Nullable
    static Boolean staticTruth(Expr test, Map<String, ?> bindings) {
        KnownValue value = ExpressionEvaluator.tryEvaluate(test, bindings);
        return value == null ? null : SpeculativeCall.truth(value.value);
    }

    /**
     * Remove no-op statements from a block, and everything after an unconditional jump.
     * A block of one statement is left as is.
     *
     * @param block The block.
     * @return The block, or the same block if nothing was removed.
     */
    static List<Stmt> filterBlock(List<Stmt> block) {
        if (block.size() <= 1) return block;
        List<Stmt> out = new ArrayList<>();
        for (Stmt stmt : block) {
            if (stmt instanceof Stmt.Pass) continue;
            out.add(stmt);
            if (Trees.isJump(stmt)) break;
        }
        if (out.size() == block.size()) return block;
        if (out.isEmpty()) out.add(new Stmt.Pass());
        return out;
    }

    private static final class RemoveUnreachable extends TreeTransformer {
        @Override
        public List<Stmt> visitBlock(List<Stmt> block) {
            return super.visitBlock(filterBlock(block));
        }

        @Override
        public List<Stmt> visitStmt(Stmt stmt) {
            if (stmt instanceof Stmt.FunctionDef) return Collections.singletonList(stmt);
            return super.visitStmt(stmt);
        }
    }

    /**
     * Count the jumps in a loop body that could leave or restart the loop. Nested function bodies are skipped.
     */
    private static int countJumps(List<Stmt> body) {
        int[] count = {0};
        new TreeScanner() {
            @Override
            public void visitStmt(Stmt stmt) {
                if (stmt instanceof Stmt.FunctionDef) return;
                if (Trees.isJump(stmt)) count[0]++;
                super.visitStmt(stmt);
            }

            @Override
            public void visitExpr(Expr expr) {
            }
        }.scan(body);
        return count[0];
    }

    private static final class SimplifyLoops extends TreeTransformer {
        private final Map<String, ?> bindings;

        SimplifyLoops(Map<String, ?> bindings) {
            this.bindings = bindings;
        }

        @Override
        public List<Stmt> visitStmt(Stmt stmt) {
            if (stmt instanceof Stmt.FunctionDef) return Collections.singletonList(stmt);
            if (!(stmt instanceof Stmt.While)) return super.visitStmt(stmt);
            Stmt.While loop = (Stmt.While) stmt;
            Boolean truth = staticTruth(loop.test, bindings);
            if (truth != null && !truth) {
                LOGGER.debug("removing loop that never runs");
                return visitBlock(loop.orelse);
            }
            Stmt last = loop.body.get(loop.body.size() - 1);
            boolean exits = last instanceof Stmt.Break
                    || last instanceof Stmt.Return
                    || last instanceof Stmt.Raise;
            if (exits && countJumps(loop.body) == 1) {
                LOGGER.debug("turning loop that runs at most once into a conditional");
                List<Stmt> body = last instanceof Stmt.Break
                        ? new ArrayList<>(loop.body.subList(0, loop.body.size() - 1))
                        : loop.body;
                if (body.isEmpty()) body = Collections.singletonList(new Stmt.Pass());
                return Collections.singletonList(new Stmt.If(loop.test, visitBlock(body), visitBlock(loop.orelse)));
            }
            return super.visitStmt(stmt);
        }
    }

    private static final class RemoveUnreachableBranches extends TreeTransformer {
        private final Map<String, ?> bindings;

        RemoveUnreachableBranches(Map<String, ?> bindings) {
            this.bindings = bindings;
        }

        @Override
        public List<Stmt> visitStmt(Stmt stmt) {
            if (stmt instanceof Stmt.FunctionDef) return Collections.singletonList(stmt);
            if (!(stmt instanceof Stmt.If)) return super.visitStmt(stmt);
            Stmt.If branch = (Stmt.If) stmt;
            Boolean truth = staticTruth(branch.test, bindings);
            if (truth == null) return super.visitStmt(stmt);
            List<Stmt> taken = truth ? branch.body : branch.orelse;
            LOGGER.debug("taking {} branch of conditional", truth ? "true" : "false");
            if (taken.isEmpty()) return Collections.singletonList(new Stmt.Pass());
            return visitBlock(taken);
        }
    }
}
