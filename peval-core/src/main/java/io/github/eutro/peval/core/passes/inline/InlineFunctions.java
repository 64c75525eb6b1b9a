package io.github.eutro.peval.core.passes.inline;

import io.github.eutro.peval.core.analysis.GenSym;
import io.github.eutro.peval.core.analysis.Mangler;
import io.github.eutro.peval.core.analysis.Scope;
import io.github.eutro.peval.core.eval.ExpressionEvaluator;
import io.github.eutro.peval.core.eval.Reifier;
import io.github.eutro.peval.core.ext.Tag;
import io.github.eutro.peval.core.function.FunctionSource;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.TreePass;
import io.github.eutro.peval.core.runtime.UserFunction;
import io.github.eutro.peval.core.tree.*;
import io.github.eutro.peval.core.value.AbstractValue;
import io.github.eutro.peval.core.value.KnownValue;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Inlines calls to functions marked with {@link Tag#INLINE}.
 * <p>
 * The body of the callee, with its locals renamed and its returns {@link ReturnFlattener flattened},
 * is inserted before the statement containing the call, preceded by an assignment for each parameter,
 * and the call is replaced by the variable holding the result.
 * <p>
 * Calls that are not always evaluated when the statement containing them runs are not inlined,
 * since the inserted statements would run unconditionally.
 */
public class InlineFunctions implements TreePass<Specimen, Specimen> {
    private static final Logger LOGGER = LoggerFactory.getLogger(InlineFunctions.class);

    /**
     * An instance of this pass.
     */
    public static final InlineFunctions INSTANCE = new InlineFunctions();

    @Override
    public Specimen run(Specimen specimen) {
        Inliner inliner = new Inliner(specimen);
        Stmt.FunctionDef tree = specimen.tree;
        List<Stmt> body = inliner.visitBlock(tree.body);
        if (body == tree.body) return specimen;
        return specimen.withTree(tree.withBody(body)).withBindings(inliner.newBindings);
    }

    private static final class Inliner extends TreeTransformer {
        private final Map<String, Object> bindings;
        private final Map<String, Object> visible;
        private final Set<String> callerNames;
        private final Map<String, Object> newBindings = new LinkedHashMap<>();
        private GenSym genSym;

        Inliner(Specimen specimen) {
            bindings = specimen.bindings;
            Scope scope = Scope.analyze(specimen.tree);
            callerNames = scope.allNames();
            // a local variable shadows a binding of the same name
            visible = new HashMap<>(bindings);
            visible.keySet().removeAll(scope.locals);
            genSym = GenSym.forTree(specimen.tree);
        }

        @Override
        public List<Stmt> visitStmt(Stmt stmt) {
            if (stmt instanceof Stmt.While) {
                Stmt.While loop = (Stmt.While) stmt;
                List<Stmt> body = visitBlock(loop.body);
                List<Stmt> orelse = visitBlock(loop.orelse);
                if (body == loop.body && orelse == loop.orelse) return Collections.singletonList(stmt);
                return Collections.singletonList(new Stmt.While(loop.test, body, orelse));
            } else if (stmt instanceof Stmt.Assert) {
                Stmt.Assert assertion = (Stmt.Assert) stmt;
                Expr test = visitExpr(assertion.test);
                if (test == assertion.test) return Collections.singletonList(stmt);
                return Collections.singletonList(new Stmt.Assert(test, assertion.msg));
            } else if (stmt instanceof Stmt.FunctionDef) {
                return Collections.singletonList(stmt);
            }
            return super.visitStmt(stmt);
        }

        @Override
        public Node visitOther(Node node) {
            if (node instanceof ExceptHandler) {
                ExceptHandler handler = (ExceptHandler) node;
                List<Stmt> body = visitBlock(handler.body);
                if (body == handler.body) return handler;
                return new ExceptHandler(handler.type, handler.name, body);
            }
            return super.visitOther(node);
        }

        @Override
        public Expr visitExpr(Expr expr) {
            if (expr instanceof Expr.BoolOp) {
                Expr.BoolOp boolOp = (Expr.BoolOp) expr;
                Expr first = visitExpr(boolOp.values.get(0));
                if (first == boolOp.values.get(0)) return expr;
                List<Expr> values = new ArrayList<>(boolOp.values);
                values.set(0, first);
                return new Expr.BoolOp(boolOp.op, values);
            } else if (expr instanceof Expr.IfExp) {
                Expr.IfExp ifExp = (Expr.IfExp) expr;
                Expr test = visitExpr(ifExp.test);
                if (test == ifExp.test) return expr;
                return new Expr.IfExp(test, ifExp.body, ifExp.orelse);
            } else if (expr instanceof Expr.Comprehension) {
                Expr.Comprehension comp = (Expr.Comprehension) expr;
                ForClause first = comp.generators.get(0);
                Expr iter = visitExpr(first.iter);
                if (iter == first.iter) return expr;
                List<ForClause> generators = new ArrayList<>(comp.generators);
                generators.set(0, new ForClause(first.target, iter, first.ifs));
                return new Expr.Comprehension(comp.kind, comp.elt, comp.value, generators);
            } else if (expr instanceof Expr.Lambda) {
                return expr;
            } else if (expr instanceof Expr.Call) {
                // arguments are inlined first, so their statements come first
                Expr.Call call = transformChildren((Expr.Call) expr);
                Expr inlined = tryInline(call);
                return inlined == null ? call : inlined;
            }
            return super.visitExpr(expr);
        }

        @Nullable
        private Expr tryInline(Expr.Call call) {
            KnownValue callee = ExpressionEvaluator.tryEvaluate(call.func, visible);
            if (callee == null || !(callee.value instanceof UserFunction)) return null;
            UserFunction fn = (UserFunction) callee.value;
            if (!fn.hasTag(Tag.INLINE)) return null;
            for (Expr arg : call.args) {
                if (arg instanceof Expr.Starred) {
                    throw new IllegalStateException("cannot inline a call to " + fn.getName() + " with *args");
                }
            }
            for (Keyword keyword : call.keywords) {
                if (keyword.arg == null) {
                    throw new IllegalStateException("cannot inline a call to " + fn.getName() + " with **kwargs");
                }
            }

            FunctionSource source = FunctionSource.of(fn);
            Arguments params = source.tree.args;
            if (params.vararg != null || params.kwarg != null) return null;
            Expr[] args = bindArguments(call, params);
            if (args == null) {
                LOGGER.debug("not inlining call to {}: arguments do not fit", fn.getName());
                return null;
            }

            Mangler.Mangled mangled = Mangler.mangle(genSym, source.tree);
            genSym = mangled.genSym;
            Stmt.FunctionDef def = mangled.tree;
            def = importFreeNames(def, source.bindings);

            // arguments are assigned in the order they are evaluated, then defaults
            List<Integer> order = new ArrayList<>();
            for (int i = 0; i < call.args.size(); i++) order.add(i);
            for (Keyword keyword : call.keywords) order.add(params.indexOf(keyword.arg));
            for (int i = 0; i < args.length; i++) {
                if (args[i] == null) order.add(i);
            }
            List<Stmt> stmts = new ArrayList<>();
            for (int i : order) {
                Expr value = args[i];
                if (value == null) {
                    Reifier.Reified reified = Reifier.reify(fn.getDefault(i), genSym);
                    genSym = reified.genSym;
                    newBindings.putAll(reified.bindings);
                    value = reified.node;
                }
                stmts.add(new Stmt.Assign(def.args.params.get(i).name, value));
            }
            GenSym.Fresh result = genSym.next("return");
            GenSym.Fresh flag = result.genSym.next("return_flag");
            genSym = flag.genSym;
            stmts.addAll(ReturnFlattener.flatten(def.body, result.name, flag.name));
            prepend(stmts);
            LOGGER.debug("inlined call to {} as {}", fn.getName(), result.name);
            return new Expr.Name(result.name);
        }

        /**
         * Match the arguments of a call to parameters.
         *
         * @return The argument for each parameter, null where the default should be used,
         * or null if the call does not fit.
         */
        @Nullable
        private Expr[] bindArguments(Expr.Call call, Arguments params) {
            int count = params.params.size();
            if (call.args.size() > count) return null;
            Expr[] args = new Expr[count];
            for (int i = 0; i < call.args.size(); i++) {
                args[i] = call.args.get(i);
            }
            for (Keyword keyword : call.keywords) {
                int index = params.indexOf(keyword.arg);
                if (index < 0 || args[index] != null) return null;
                args[index] = keyword.value;
            }
            for (int i = 0; i < count; i++) {
                if (args[i] == null && params.params.get(i).defaultValue == null) return null;
            }
            return args;
        }

        /**
         * Make the free names of an inlined function refer to the right values in the caller.
         * <p>
         * A free name that the caller binds to the same value, or does not use at all, is shared.
         * Any other is renamed to a fresh name bound to the callee's value.
         */
        private Stmt.FunctionDef importFreeNames(Stmt.FunctionDef def, Map<String, Object> calleeBindings) {
            Map<String, String> renames = new HashMap<>();
            for (Map.Entry<String, Object> entry : calleeBindings.entrySet()) {
                String name = entry.getKey();
                Object value = entry.getValue();
                boolean shared;
                if (newBindings.containsKey(name)) {
                    shared = AbstractValue.known(newBindings.get(name)).equals(AbstractValue.known(value));
                } else if (bindings.containsKey(name)) {
                    shared = visible.containsKey(name)
                            && AbstractValue.known(bindings.get(name)).equals(AbstractValue.known(value));
                } else {
                    shared = !callerNames.contains(name);
                }
                if (shared) {
                    if (!bindings.containsKey(name)) newBindings.put(name, value);
                } else {
                    GenSym.Fresh fresh = genSym.next(name);
                    genSym = fresh.genSym;
                    renames.put(name, fresh.name);
                    newBindings.put(fresh.name, value);
                }
            }
            if (renames.isEmpty()) return def;
            return new TreeTransformer() {
                @Override
                public Expr visitExpr(Expr expr) {
                    if (expr instanceof Expr.Name) {
                        String renamed = renames.get(((Expr.Name) expr).id);
                        if (renamed != null) return new Expr.Name(renamed);
                    }
                    return super.visitExpr(expr);
                }
            }.transformChildren(def);
        }
    }
}
