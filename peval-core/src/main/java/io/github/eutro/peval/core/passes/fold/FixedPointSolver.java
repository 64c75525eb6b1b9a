package io.github.eutro.peval.core.passes.fold;

import io.github.eutro.peval.core.analysis.GenSym;
import io.github.eutro.peval.core.analysis.Scope;
import io.github.eutro.peval.core.cfg.CfgGraph;
import io.github.eutro.peval.core.cfg.ControlFlowGraph;
import io.github.eutro.peval.core.eval.EvalState;
import io.github.eutro.peval.core.eval.Evaluation;
import io.github.eutro.peval.core.eval.ExpressionEvaluator;
import io.github.eutro.peval.core.eval.SpeculativeCall;
import io.github.eutro.peval.core.runtime.Interpreter;
import io.github.eutro.peval.core.runtime.Operators;
import io.github.eutro.peval.core.tree.ExceptHandler;
import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.tree.Node;
import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.WithItem;
import io.github.eutro.peval.core.value.AbstractValue;
import io.github.eutro.peval.core.value.Environment;
import io.github.eutro.peval.core.value.KnownValue;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Forward dataflow analysis of the values of variables over a {@link ControlFlowGraph}.
 * <p>
 * Every node starts out with all the external bindings known. Nodes are then visited from a worklist,
 * seeded with a depth-first pre-order of the graph, each one getting the {@link Environment#meet(Environment, Environment)
 * meet} of its parents' outgoing environments, until no outgoing environment changes. Each visit also
 * evaluates the expressions of the statement in its incoming environment, and the result of the last visit
 * is what is kept.
 * <p>
 * The analysis is branch-insensitive: the test of an {@code if} or {@code while} does not narrow
 * the environment of either branch.
 */
public final class FixedPointSolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(FixedPointSolver.class);

    public static final String VALUE = "value";
    public static final String TEST = "test";
    public static final String ITER = "iter";
    public static final String EXC = "exc";
    public static final String ANNOTATION = "annotation";
    public static final String CONTEXT = "context";

    private FixedPointSolver() {
    }

    /**
     * The outcome of the analysis.
     */
    public static final class Result {
        /**
         * For each node handle, the rewritten expressions of the statement, keyed by slot.
         * <p>
         * Slots are {@link #VALUE}, {@link #TEST}, {@link #ITER}, {@link #EXC}, {@link #ANNOTATION},
         * and {@link #CONTEXT} followed by the index of a {@code with} item.
         */
        public final Map<Integer, Map<String, Expr>> exprs;
        /**
         * The bindings needed by the rewritten expressions.
         */
        public final Map<String, Object> tempBindings;
        public final GenSym genSym;

        Result(Map<Integer, Map<String, Expr>> exprs, Map<String, Object> tempBindings, GenSym genSym) {
            this.exprs = Collections.unmodifiableMap(exprs);
            this.tempBindings = Collections.unmodifiableMap(tempBindings);
            this.genSym = genSym;
        }
    }

    private static final class NodeState {
        Environment outEnv;
        Map<String, Expr> exprs = Collections.emptyMap();
        Map<String, Object> tempBindings = Collections.emptyMap();

        NodeState(Environment outEnv) {
            this.outEnv = outEnv;
        }
    }

    private static final class Transfer {
        final Environment outEnv;
        final Map<String, Expr> exprs = new LinkedHashMap<>();
        EvalState state;

        Transfer(Environment inEnv, EvalState state) {
            this.outEnv = inEnv;
            this.state = state;
        }

        Transfer(Environment outEnv, Transfer from) {
            this.outEnv = outEnv;
            this.exprs.putAll(from.exprs);
            this.state = from.state;
        }

        @Nullable
        KnownValue eval(String slot, @Nullable Expr expr, Map<String, Object> known, boolean forceFresh) {
            if (expr == null) return null;
            Evaluation evaluation = ExpressionEvaluator.evaluate(state, expr, known, forceFresh);
            state = evaluation.state;
            exprs.put(slot, evaluation.node);
            return evaluation.value;
        }
    }

    /**
     * Run the analysis.
     *
     * @param genSym   The fresh name generator, which must avoid every name in the tree.
     * @param cfg      The graph of the statements.
     * @param bindings The values of external names.
     * @return The result.
     */
    public static Result solve(GenSym genSym, ControlFlowGraph cfg, Map<String, ?> bindings) {
        CfgGraph graph = cfg.graph;
        Environment enterEnv = Environment.from(bindings);
        Map<Integer, NodeState> states = new TreeMap<>();
        for (int handle : graph.handles()) {
            states.put(handle, new NodeState(enterEnv));
        }

        Set<Integer> workQueue = new LinkedHashSet<>(graph.reachableFrom(cfg.enter));
        int visits = 0;
        while (!workQueue.isEmpty()) {
            Iterator<Integer> iterator = workQueue.iterator();
            int handle = iterator.next();
            iterator.remove();
            visits++;

            Environment inEnv = inEnv(graph, states, cfg.enter, enterEnv, handle);
            Transfer transfer = transfer(EvalState.of(genSym), inEnv, graph.node(handle).node);
            genSym = transfer.state.genSym;

            NodeState state = states.get(handle);
            state.exprs = transfer.exprs;
            state.tempBindings = transfer.state.tempBindings;
            if (!transfer.outEnv.equals(state.outEnv)) {
                state.outEnv = transfer.outEnv;
                LOGGER.trace("node {} changed, enqueueing {}", handle, graph.childrenOf(handle));
                workQueue.addAll(graph.childrenOf(handle));
            }
        }
        LOGGER.trace("converged after {} visits of {} nodes", visits, states.size());

        // annotations are only evaluated once the environments are settled, so that their temporaries are stable
        for (Map.Entry<Integer, NodeState> entry : states.entrySet()) {
            Node node = graph.node(entry.getKey()).node;
            if (!(node instanceof Stmt.AnnAssign)) continue;
            Environment inEnv = inEnv(graph, states, cfg.enter, enterEnv, entry.getKey());
            Transfer transfer = new Transfer(inEnv, EvalState.of(genSym));
            transfer.eval(ANNOTATION, ((Stmt.AnnAssign) node).annotation, inEnv.knownValues(), true);
            genSym = transfer.state.genSym;
            NodeState state = entry.getValue();
            Map<String, Expr> exprs = new LinkedHashMap<>(state.exprs);
            exprs.putAll(transfer.exprs);
            state.exprs = exprs;
            Map<String, Object> tempBindings = new LinkedHashMap<>(state.tempBindings);
            tempBindings.putAll(transfer.state.tempBindings);
            state.tempBindings = tempBindings;
        }

        Map<Integer, Map<String, Expr>> exprs = new TreeMap<>();
        Map<String, Object> tempBindings = new LinkedHashMap<>();
        for (Map.Entry<Integer, NodeState> entry : states.entrySet()) {
            exprs.put(entry.getKey(), entry.getValue().exprs);
            tempBindings.putAll(entry.getValue().tempBindings);
        }
        return new Result(exprs, tempBindings, genSym);
    }

    private static Environment inEnv(CfgGraph graph,
                                     Map<Integer, NodeState> states,
                                     int enter,
                                     Environment enterEnv,
                                     int handle) {
        if (handle == enter) return enterEnv;
        Environment env = null;
        for (int parent : graph.parentsOf(handle)) {
            Environment parentEnv = states.get(parent).outEnv;
            env = env == null ? parentEnv : Environment.meet(env, parentEnv);
        }
        return env == null ? enterEnv : env;
    }

    /**
     * Evaluate the expressions of a statement, and compute the environment after it.
     */
    private static Transfer transfer(EvalState state, Environment inEnv, Node node) {
        Transfer transfer = new Transfer(inEnv, state);
        Map<String, Object> known = inEnv.knownValues();
        if (node instanceof Stmt.Assign) {
            Stmt.Assign stmt = (Stmt.Assign) node;
            KnownValue value = transfer.eval(VALUE, stmt.value, known, false);
            Environment env = inEnv;
            for (Expr target : stmt.targets) {
                env = assign(env, target, value);
            }
            return new Transfer(env, transfer);
        } else if (node instanceof Stmt.AugAssign) {
            Stmt.AugAssign stmt = (Stmt.AugAssign) node;
            transfer.eval(VALUE, stmt.value, known, false);
            return new Transfer(assign(inEnv, stmt.target, null), transfer);
        } else if (node instanceof Stmt.AnnAssign) {
            Stmt.AnnAssign stmt = (Stmt.AnnAssign) node;
            if (stmt.value == null) return transfer;
            KnownValue value = transfer.eval(VALUE, stmt.value, known, false);
            return new Transfer(assign(inEnv, stmt.target, value), transfer);
        } else if (node instanceof Stmt.ExprStmt) {
            transfer.eval(VALUE, ((Stmt.ExprStmt) node).value, known, false);
        } else if (node instanceof Stmt.Return) {
            transfer.eval(VALUE, ((Stmt.Return) node).value, known, false);
        } else if (node instanceof Stmt.Raise) {
            transfer.eval(EXC, ((Stmt.Raise) node).exc, known, false);
        } else if (node instanceof Stmt.Assert) {
            transfer.eval(TEST, ((Stmt.Assert) node).test, known, false);
        } else if (node instanceof Stmt.If) {
            transfer.eval(TEST, ((Stmt.If) node).test, known, false);
        } else if (node instanceof Stmt.While) {
            transfer.eval(TEST, ((Stmt.While) node).test, known, false);
        } else if (node instanceof Stmt.For) {
            Stmt.For stmt = (Stmt.For) node;
            transfer.eval(ITER, stmt.iter, known, false);
            return new Transfer(forget(inEnv, Scope.targetNames(stmt.target)), transfer);
        } else if (node instanceof Stmt.With) {
            Stmt.With stmt = (Stmt.With) node;
            Set<String> bound = new LinkedHashSet<>();
            for (int i = 0; i < stmt.items.size(); i++) {
                WithItem item = stmt.items.get(i);
                transfer.eval(CONTEXT + i, item.contextExpr, known, false);
                if (item.optionalVars != null) bound.addAll(Scope.targetNames(item.optionalVars));
            }
            return new Transfer(forget(inEnv, bound), transfer);
        } else if (node instanceof ExceptHandler) {
            ExceptHandler handler = (ExceptHandler) node;
            if (handler.name != null) {
                return new Transfer(inEnv.with(handler.name, AbstractValue.UNKNOWN), transfer);
            }
        } else if (node instanceof Stmt.FunctionDef) {
            return new Transfer(inEnv.with(((Stmt.FunctionDef) node).name, AbstractValue.UNKNOWN), transfer);
        }
        return transfer;
    }

    private static Environment forget(Environment env, Collection<String> names) {
        for (String name : names) {
            env = env.with(name, AbstractValue.UNKNOWN);
        }
        return env;
    }

    /**
     * Compute the environment after assigning a value to a target.
     *
     * @param env    The environment before.
     * @param target The target.
     * @param value  The value, or null if it is not known.
     * @return The environment after.
     */
    private static Environment assign(Environment env, Expr target, @Nullable KnownValue value) {
        if (target instanceof Expr.Name) {
            return env.with(((Expr.Name) target).id, value == null
                    ? AbstractValue.UNKNOWN
                    : AbstractValue.known(value.value));
        }
        if (target instanceof Expr.TupleExpr || target instanceof Expr.ListExpr) {
            List<Expr> elts = target instanceof Expr.TupleExpr
                    ? ((Expr.TupleExpr) target).elts
                    : ((Expr.ListExpr) target).elts;
            List<?> items = value == null ? null : unpack(value.value, elts.size());
            for (int i = 0; i < elts.size(); i++) {
                env = assign(env, elts.get(i), items == null ? null : new KnownValue(items.get(i)));
            }
            return env;
        }
        if (target instanceof Expr.Attribute || target instanceof Expr.Subscript) {
            return env;
        }
        throw new IllegalStateException("unsupported assignment target: " + target.getClass().getSimpleName());
    }

    @Nullable
    private static List<?> unpack(@Nullable Object value, int count) {
        // unpacking a one-shot iterator would consume it
        if (Operators.isSelfIterator(value)) return null;
        KnownValue items = SpeculativeCall.attempt("unpacking", () -> Interpreter.unpack(value, count));
        return items == null ? null : (List<?>) items.value;
    }
}
