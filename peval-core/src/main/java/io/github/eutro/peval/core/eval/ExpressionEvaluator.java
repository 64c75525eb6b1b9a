package io.github.eutro.peval.core.eval;

import io.github.eutro.peval.core.analysis.GenSym;
import io.github.eutro.peval.core.analysis.Scope;
import io.github.eutro.peval.core.runtime.Interpreter;
import io.github.eutro.peval.core.runtime.Operators;
import io.github.eutro.peval.core.runtime.Slice;
import io.github.eutro.peval.core.runtime.Tuple;
import io.github.eutro.peval.core.tree.*;
import io.github.eutro.peval.core.value.KnownValue;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Evaluates expressions as far as the known bindings allow.
 * <p>
 * Every sub-expression is either fully evaluated to a {@link KnownValue}, or simplified to a residual
 * expression in which known sub-expressions have been {@link Reifier reified}. Concrete operations are only
 * attempted when all of their inputs are known, and calls only when the callee is pure; any failure leaves
 * the expression residual. Operands that are never evaluated at run time (after a deciding {@code and}/{@code or}
 * operand, or in the untaken branch of a known conditional) are never evaluated here either.
 */
public final class ExpressionEvaluator {
    private EvalState state;

    private ExpressionEvaluator(EvalState state) {
        this.state = state;
    }

    /**
     * Evaluate an expression, reifying the result if it is known.
     *
     * @param state      The state.
     * @param expr       The expression.
     * @param bindings   The known values of names.
     * @param forceFresh Whether to reify a known non-literal result into a fresh temporary,
     *                   rather than the name it was read from.
     * @return The evaluation.
     */
    public static Evaluation evaluate(EvalState state, Expr expr, Map<String, ?> bindings, boolean forceFresh) {
        ExpressionEvaluator evaluator = new ExpressionEvaluator(state);
        EvalResult result = evaluator.eval(expr, bindings);
        if (result.isKnown()) {
            return evaluator.state.reify(result.known(), forceFresh);
        }
        return new Evaluation(evaluator.state, null, result.residual());
    }

    public static Evaluation evaluate(EvalState state, Expr expr, Map<String, ?> bindings) {
        return evaluate(state, expr, bindings, false);
    }

    /**
     * Evaluate an expression with nothing known, and get its value if it is constant.
     *
     * @param expr     The expression.
     * @param bindings The known values of names.
     * @return The value, or null if it could not be evaluated.
     */
    @Nullable
    public static KnownValue tryEvaluate(Expr expr, Map<String, ?> bindings) {
        EvalResult result = new ExpressionEvaluator(EvalState.of(GenSym.empty()))
                .eval(expr, bindings);
        return result.isKnown() ? result.known() : null;
    }

    private EvalResult eval(Expr expr, Map<String, ?> bindings) {
        return expr.accept(new Visitor(bindings));
    }

    private Expr reify(EvalResult result) {
        if (!result.isKnown()) return result.residual();
        Evaluation reified = state.reify(result.known(), false);
        state = reified.state;
        return reified.node;
    }

    @Nullable
    private Expr reifyNullable(@Nullable EvalResult result) {
        return result == null ? null : reify(result);
    }

    private List<Expr> reifyAll(List<EvalResult> results) {
        List<Expr> out = new ArrayList<>(results.size());
        for (EvalResult result : results) out.add(reify(result));
        return out;
    }

    private static boolean allKnown(Collection<EvalResult> results) {
        for (EvalResult result : results) {
            if (result != null && !result.isKnown()) return false;
        }
        return true;
    }

    @Nullable
    private static Object value(@Nullable EvalResult result) {
        return result == null ? null : result.known().value;
    }

    private static List<Object> values(List<EvalResult> results) {
        List<Object> out = new ArrayList<>(results.size());
        for (EvalResult result : results) out.add(result.known().value);
        return out;
    }

    private static EvalResult known(@Nullable KnownValue value) {
        return EvalResult.evaluated(value);
    }

    private static Map<String, Object> masked(Map<String, ?> bindings, Collection<String> names) {
        Map<String, Object> out = new HashMap<>(bindings);
        out.keySet().removeAll(names);
        return out;
    }

    /**
     * Thrown to abandon concrete evaluation of a comprehension.
     */
    private static final class CannotEvaluate extends Exception {
        CannotEvaluate() {
            super(null, null, false, false);
        }
    }

    private final class Visitor implements Expr.Visitor<EvalResult> {
        private final Map<String, ?> bindings;

        Visitor(Map<String, ?> bindings) {
            this.bindings = bindings;
        }

        private EvalResult eval(Expr expr) {
            return expr.accept(this);
        }

        @Nullable
        private EvalResult evalNullable(@Nullable Expr expr) {
            return expr == null ? null : eval(expr);
        }

        private List<EvalResult> evalAll(List<Expr> exprs) {
            List<EvalResult> out = new ArrayList<>(exprs.size());
            for (Expr expr : exprs) out.add(eval(expr));
            return out;
        }

        @Override
        public EvalResult visitName(Expr.Name expr) {
            if (bindings.containsKey(expr.id)) {
                return known(new KnownValue(bindings.get(expr.id), expr.id));
            }
            return EvalResult.residual(expr);
        }

        @Override
        public EvalResult visitConstant(Expr.Constant expr) {
            return known(new KnownValue(expr.value));
        }

        @Override
        public EvalResult visitBoolOp(Expr.BoolOp expr) {
            List<EvalResult> kept = new ArrayList<>();
            for (int i = 0; i < expr.values.size(); i++) {
                EvalResult result = eval(expr.values.get(i));
                boolean last = i == expr.values.size() - 1;
                if (result.isKnown()) {
                    Boolean truth = SpeculativeCall.truth(result.known().value);
                    if (truth != null && expr.op.shortCircuitsOn(truth)) {
                        if (kept.isEmpty()) return result;
                        kept.add(result);
                        break;
                    }
                    // an operand that does not decide the result can be dropped, unless it is the result
                    if (truth != null && !last) continue;
                }
                kept.add(result);
            }
            if (kept.size() == 1) return kept.get(0);
            return EvalResult.residual(new Expr.BoolOp(expr.op, reifyAll(kept)));
        }

        @Override
        public EvalResult visitBinOp(Expr.BinOp expr) {
            EvalResult left = eval(expr.left);
            EvalResult right = eval(expr.right);
            if (left.isKnown() && right.isKnown()) {
                Object l = left.known().value;
                Object r = right.known().value;
                KnownValue result = SpeculativeCall.attempt(expr.op.symbol,
                        () -> Operators.binary(expr.op, l, r));
                if (result != null) return known(result);
            }
            return EvalResult.residual(new Expr.BinOp(reify(left), expr.op, reify(right)));
        }

        @Override
        public EvalResult visitUnaryOp(Expr.UnaryOp expr) {
            EvalResult operand = eval(expr.operand);
            if (operand.isKnown()) {
                Object v = operand.known().value;
                KnownValue result = SpeculativeCall.attempt(expr.op.symbol, () -> Operators.unary(expr.op, v));
                if (result != null) return known(result);
            }
            return EvalResult.residual(new Expr.UnaryOp(expr.op, reify(operand)));
        }

        @Override
        public EvalResult visitCompare(Expr.Compare expr) {
            List<Expr> operands = new ArrayList<>();
            operands.add(expr.left);
            operands.addAll(expr.comparators);

            List<EvalResult> results = new ArrayList<>();
            Map<Integer, Expr> reified = new HashMap<>();
            results.add(eval(operands.get(0)));

            // residual pairs, as (index of the left operand, node)
            SortedMap<Integer, EvalResult> kept = new TreeMap<>();
            EvalResult lastKnown = null;
            for (int i = 0; i < expr.ops.size(); i++) {
                CmpOperator op = expr.ops.get(i);
                results.add(eval(operands.get(i + 1)));
                EvalResult left = results.get(i);
                EvalResult right = results.get(i + 1);
                EvalResult pair = null;
                if (left.isKnown() && right.isKnown()) {
                    Object l = left.known().value;
                    Object r = right.known().value;
                    KnownValue result = SpeculativeCall.attempt(op.symbol, () -> Operators.compare(op, l, r));
                    if (result != null) pair = known(result);
                }
                if (pair == null) {
                    kept.put(i, EvalResult.residual(new Expr.Compare(
                            reifyOperand(reified, results, i), op, reifyOperand(reified, results, i + 1))));
                    continue;
                }
                Boolean truth = SpeculativeCall.truth(pair.known().value);
                if (truth == null || !truth) {
                    if (kept.isEmpty()) return pair;
                    kept.put(i, pair);
                    break;
                }
                lastKnown = pair;
            }
            if (kept.isEmpty()) return lastKnown;

            // glue adjacent residual comparisons that share an operand back into a chain
            List<Expr> nodes = new ArrayList<>();
            int previous = -2;
            for (Map.Entry<Integer, EvalResult> pair : kept.entrySet()) {
                Expr node = reify(pair.getValue());
                if (!nodes.isEmpty() && pair.getKey() == previous + 1
                        && node instanceof Expr.Compare
                        && nodes.get(nodes.size() - 1) instanceof Expr.Compare) {
                    Expr.Compare last = (Expr.Compare) nodes.get(nodes.size() - 1);
                    Expr.Compare next = (Expr.Compare) node;
                    if (Trees.equal(last.comparators.get(last.comparators.size() - 1), next.left)) {
                        List<CmpOperator> ops = new ArrayList<>(last.ops);
                        ops.addAll(next.ops);
                        List<Expr> comparators = new ArrayList<>(last.comparators);
                        comparators.addAll(next.comparators);
                        nodes.set(nodes.size() - 1, new Expr.Compare(last.left, ops, comparators));
                        previous = pair.getKey();
                        continue;
                    }
                }
                nodes.add(node);
                previous = pair.getKey();
            }
            if (nodes.size() == 1) return EvalResult.residual(nodes.get(0));
            return EvalResult.residual(new Expr.BoolOp(BoolOperator.AND, nodes));
        }

        private Expr reifyOperand(Map<Integer, Expr> reified, List<EvalResult> results, int index) {
            Expr node = reified.get(index);
            if (node == null) {
                node = reify(results.get(index));
                reified.put(index, node);
            }
            return node;
        }

        @Override
        public EvalResult visitCall(Expr.Call expr) {
            EvalResult func = eval(expr.func);
            List<EvalResult> args = evalAll(expr.args);
            List<EvalResult> keywords = new ArrayList<>();
            for (Keyword keyword : expr.keywords) keywords.add(eval(keyword.value));

            if (!expr.isVariadic() && func.isKnown() && allKnown(args) && allKnown(keywords)) {
                Map<String, Object> kwargs = new LinkedHashMap<>();
                for (int i = 0; i < keywords.size(); i++) {
                    kwargs.put(expr.keywords.get(i).arg, keywords.get(i).known().value);
                }
                KnownValue result = SpeculativeCall.call(func.known().value, values(args), kwargs);
                if (result != null) return known(result);
            }

            Expr newFunc = reify(func);
            List<Expr> newArgs = reifyAll(args);
            List<Keyword> newKeywords = new ArrayList<>();
            for (int i = 0; i < keywords.size(); i++) {
                newKeywords.add(new Keyword(expr.keywords.get(i).arg, reify(keywords.get(i))));
            }
            return EvalResult.residual(new Expr.Call(newFunc, newArgs, newKeywords));
        }

        @Override
        public EvalResult visitAttribute(Expr.Attribute expr) {
            EvalResult value = eval(expr.value);
            if (value.isKnown()) {
                Object v = value.known().value;
                KnownValue result = SpeculativeCall.attempt("." + expr.attr,
                        () -> Operators.getAttribute(v, expr.attr));
                if (result != null) return known(result);
            }
            return EvalResult.residual(new Expr.Attribute(reify(value), expr.attr));
        }

        @Override
        public EvalResult visitSubscript(Expr.Subscript expr) {
            EvalResult value = eval(expr.value);
            if (expr.slice instanceof Expr.Slice) {
                // keep slice syntax in residual subscripts, rather than a reified slice object
                Expr.Slice slice = (Expr.Slice) expr.slice;
                EvalResult lower = evalNullable(slice.lower);
                EvalResult upper = evalNullable(slice.upper);
                EvalResult step = evalNullable(slice.step);
                if (value.isKnown() && allKnown(Arrays.asList(lower, upper, step))) {
                    Object v = value.known().value;
                    Slice s = new Slice(value(lower), value(upper), value(step));
                    KnownValue result = SpeculativeCall.attempt("subscript", () -> Operators.getItem(v, s));
                    if (result != null) return known(result);
                }
                Expr newValue = reify(value);
                return EvalResult.residual(new Expr.Subscript(newValue, new Expr.Slice(
                        reifyNullable(lower), reifyNullable(upper), reifyNullable(step))));
            }
            EvalResult index = eval(expr.slice);
            if (value.isKnown() && index.isKnown()) {
                Object v = value.known().value;
                Object i = index.known().value;
                KnownValue result = SpeculativeCall.attempt("subscript", () -> Operators.getItem(v, i));
                if (result != null) return known(result);
            }
            Expr newValue = reify(value);
            return EvalResult.residual(new Expr.Subscript(newValue, reify(index)));
        }

        @Override
        public EvalResult visitSlice(Expr.Slice expr) {
            EvalResult lower = evalNullable(expr.lower);
            EvalResult upper = evalNullable(expr.upper);
            EvalResult step = evalNullable(expr.step);
            if (allKnown(Arrays.asList(lower, upper, step))) {
                return known(new KnownValue(new Slice(value(lower), value(upper), value(step))));
            }
            return EvalResult.residual(new Expr.Slice(reifyNullable(lower), reifyNullable(upper), reifyNullable(step)));
        }

        @Override
        public EvalResult visitIfExp(Expr.IfExp expr) {
            EvalResult test = eval(expr.test);
            if (test.isKnown()) {
                Boolean truth = SpeculativeCall.truth(test.known().value);
                if (truth != null) return eval(truth ? expr.body : expr.orelse);
            }
            EvalResult body = eval(expr.body);
            EvalResult orelse = eval(expr.orelse);
            Expr newTest = reify(test);
            Expr newBody = reify(body);
            return EvalResult.residual(new Expr.IfExp(newTest, newBody, reify(orelse)));
        }

        @Override
        public EvalResult visitList(Expr.ListExpr expr) {
            List<EvalResult> elts = evalAll(expr.elts);
            if (allKnown(elts)) return known(new KnownValue(values(elts)));
            return EvalResult.residual(new Expr.ListExpr(reifyAll(elts)));
        }

        @Override
        public EvalResult visitTuple(Expr.TupleExpr expr) {
            List<EvalResult> elts = evalAll(expr.elts);
            if (allKnown(elts)) return known(new KnownValue(Tuple.copyOf(values(elts))));
            return EvalResult.residual(new Expr.TupleExpr(reifyAll(elts)));
        }

        @Override
        public EvalResult visitSet(Expr.SetExpr expr) {
            List<EvalResult> elts = evalAll(expr.elts);
            if (allKnown(elts)) {
                List<Object> items = values(elts);
                KnownValue result = SpeculativeCall.attempt("set display", () -> {
                    Set<Object> set = new LinkedHashSet<>();
                    for (Object item : items) {
                        Operators.checkHashable(item);
                        set.add(item);
                    }
                    return set;
                });
                if (result != null) return known(result);
            }
            return EvalResult.residual(new Expr.SetExpr(reifyAll(elts)));
        }

        @Override
        public EvalResult visitDict(Expr.DictExpr expr) {
            List<EvalResult> keys = evalAll(expr.keys);
            List<EvalResult> values = evalAll(expr.values);
            if (allKnown(keys) && allKnown(values)) {
                List<Object> k = values(keys);
                List<Object> v = values(values);
                KnownValue result = SpeculativeCall.attempt("dict display", () -> {
                    Map<Object, Object> dict = new LinkedHashMap<>();
                    for (int i = 0; i < k.size(); i++) {
                        Operators.checkHashable(k.get(i));
                        dict.put(k.get(i), v.get(i));
                    }
                    return dict;
                });
                if (result != null) return known(result);
            }
            List<Expr> newKeys = reifyAll(keys);
            return EvalResult.residual(new Expr.DictExpr(newKeys, reifyAll(values)));
        }

        @Override
        public EvalResult visitComprehension(Expr.Comprehension expr) {
            if (expr.kind != Expr.Comprehension.Kind.GENERATOR) {
                EvalState saved = state;
                Object container = expr.kind == Expr.Comprehension.Kind.LIST ? new ArrayList<>()
                        : expr.kind == Expr.Comprehension.Kind.SET ? new LinkedHashSet<>()
                        : new LinkedHashMap<>();
                Map<String, Object> outer = new HashMap<>(bindings);
                outer.putAll(state.tempBindings);
                try {
                    iterate(expr, 0, outer, container);
                    return known(new KnownValue(container));
                } catch (CannotEvaluate e) {
                    state = saved;
                }
            }
            return EvalResult.residual(residualComprehension(expr));
        }

        private void iterate(Expr.Comprehension expr, int index, Map<String, Object> scope, Object container)
                throws CannotEvaluate {
            ForClause clause = expr.generators.get(index);
            EvalResult iterable = ExpressionEvaluator.this.eval(clause.iter, scope);
            if (!iterable.isKnown()) throw new CannotEvaluate();
            Object source = iterable.known().value;
            if (Operators.isSelfIterator(source)) throw new CannotEvaluate();
            KnownValue items = SpeculativeCall.attempt("iteration", () -> Operators.toList(source));
            if (items == null) throw new CannotEvaluate();

            for (Object item : (List<?>) items.value) {
                Map<String, Object> inner = new HashMap<>(scope);
                inner.putAll(unpack(clause.target, item));
                if (!passes(clause.ifs, inner)) continue;
                if (index + 1 < expr.generators.size()) {
                    iterate(expr, index + 1, inner, container);
                } else {
                    accumulate(expr, inner, container);
                }
            }
        }

        private Map<String, Object> unpack(Expr target, @Nullable Object item) throws CannotEvaluate {
            if (target instanceof Expr.Name) {
                return Collections.singletonMap(((Expr.Name) target).id, item);
            }
            List<Expr> elts;
            if (target instanceof Expr.TupleExpr) {
                elts = ((Expr.TupleExpr) target).elts;
            } else if (target instanceof Expr.ListExpr) {
                elts = ((Expr.ListExpr) target).elts;
            } else {
                throw new CannotEvaluate();
            }
            for (Expr elt : elts) {
                if (!(elt instanceof Expr.Name)) throw new CannotEvaluate();
            }
            if (Operators.isSelfIterator(item)) throw new CannotEvaluate();
            KnownValue unpacked = SpeculativeCall.attempt("unpacking", () -> Interpreter.unpack(item, elts.size()));
            if (unpacked == null) throw new CannotEvaluate();
            Map<String, Object> out = new HashMap<>();
            List<?> values = (List<?>) unpacked.value;
            for (int i = 0; i < elts.size(); i++) {
                out.put(((Expr.Name) elts.get(i)).id, values.get(i));
            }
            return out;
        }

        private boolean passes(List<Expr> ifs, Map<String, Object> scope) throws CannotEvaluate {
            for (Expr test : ifs) {
                EvalResult result = ExpressionEvaluator.this.eval(test, scope);
                if (!result.isKnown()) throw new CannotEvaluate();
                Boolean truth = SpeculativeCall.truth(result.known().value);
                if (truth == null) throw new CannotEvaluate();
                if (!truth) return false;
            }
            return true;
        }

        @SuppressWarnings("unchecked")
        private void accumulate(Expr.Comprehension expr, Map<String, Object> scope, Object container)
                throws CannotEvaluate {
            EvalResult elt = ExpressionEvaluator.this.eval(expr.elt, scope);
            if (!elt.isKnown()) throw new CannotEvaluate();
            Object key = elt.known().value;
            if (expr.kind == Expr.Comprehension.Kind.LIST) {
                ((List<Object>) container).add(key);
                return;
            }
            KnownValue hashable = SpeculativeCall.attempt("hash", () -> {
                Operators.checkHashable(key);
                return key;
            });
            if (hashable == null) throw new CannotEvaluate();
            if (expr.kind == Expr.Comprehension.Kind.SET) {
                ((Set<Object>) container).add(key);
                return;
            }
            EvalResult value = ExpressionEvaluator.this.eval(Objects.requireNonNull(expr.value), scope);
            if (!value.isKnown()) throw new CannotEvaluate();
            ((Map<Object, Object>) container).put(key, value.known().value);
        }

        private Expr.Comprehension residualComprehension(Expr.Comprehension expr) {
            Set<String> bound = new HashSet<>();
            List<ForClause> clauses = new ArrayList<>();
            for (ForClause clause : expr.generators) {
                Expr iter = reify(ExpressionEvaluator.this.eval(clause.iter, masked(bindings, bound)));
                bound.addAll(Scope.targetNames(clause.target));
                Map<String, Object> inner = masked(bindings, bound);
                List<Expr> ifs = new ArrayList<>();
                for (Expr test : clause.ifs) {
                    EvalResult result = ExpressionEvaluator.this.eval(test, inner);
                    if (result.isKnown()) {
                        Boolean truth = SpeculativeCall.truth(result.known().value);
                        // a condition that always holds can be dropped
                        if (truth != null && truth) continue;
                    }
                    ifs.add(reify(result));
                }
                clauses.add(new ForClause(clause.target, iter, ifs));
            }
            Map<String, Object> inner = masked(bindings, bound);
            Expr elt = reify(ExpressionEvaluator.this.eval(expr.elt, inner));
            Expr value = expr.value == null ? null : reify(ExpressionEvaluator.this.eval(expr.value, inner));
            return new Expr.Comprehension(expr.kind, elt, value, clauses);
        }

        @Override
        public EvalResult visitLambda(Expr.Lambda expr) {
            return EvalResult.residual(expr);
        }

        @Override
        public EvalResult visitYield(Expr.Yield expr) {
            if (expr.value == null) return EvalResult.residual(expr);
            return EvalResult.residual(new Expr.Yield(reify(eval(expr.value))));
        }

        @Override
        public EvalResult visitStarred(Expr.Starred expr) {
            return EvalResult.residual(new Expr.Starred(reify(eval(expr.value))));
        }
    }
}
