package io.github.eutro.peval.core.runtime;

import io.github.eutro.peval.core.analysis.Scope;
import io.github.eutro.peval.core.tree.*;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A tree-walking interpreter.
 * <p>
 * It runs modules, to define the functions that are then partially evaluated, and calls
 * {@link UserFunction}s, both from scripts and speculatively from the partial evaluator.
 */
public final class Interpreter implements Stmt.Visitor<Interpreter.Completion>, Expr.Visitor<Object> {
    /**
     * The deepest nesting of user function calls before a {@code RecursionError} is raised.
     */
    public static final int RECURSION_LIMIT = 200;
    private static final ThreadLocal<int[]> DEPTH = ThreadLocal.withInitial(() -> new int[1]);

    /**
     * How a statement finished. The value of a {@code return} is held by the frame.
     */
    enum Completion {
        NORMAL, BREAK, CONTINUE, RETURN
    }

    private final Frame frame;

    private Interpreter(Frame frame) {
        this.frame = frame;
    }

    /**
     * Run a module.
     *
     * @param module  The module.
     * @param globals The globals to run it in, which receive its definitions.
     * @throws ScriptException If the module raised an exception.
     */
    public static void runModule(ModuleNode module, Map<String, Object> globals) {
        new Interpreter(Frame.module(globals)).execBlock(module.body);
    }

    /**
     * Evaluate an expression.
     *
     * @param expr  The expression.
     * @param frame The frame to evaluate it in.
     * @return Its value.
     * @throws ScriptException If evaluating it raised an exception.
     */
    public static Object evaluate(Expr expr, Frame frame) {
        return new Interpreter(frame).eval(expr);
    }

    /**
     * Call a user function.
     *
     * @param fn     The function.
     * @param args   The positional arguments.
     * @param kwargs The keyword arguments.
     * @return The return value.
     * @throws ScriptException If the call raised an exception.
     */
    static Object callFunction(UserFunction fn, List<Object> args, Map<String, Object> kwargs) {
        int[] depth = DEPTH.get();
        if (depth[0] >= RECURSION_LIMIT) {
            throw new ScriptException(ScriptType.RECURSION_ERROR, "maximum recursion depth exceeded");
        }
        depth[0]++;
        try {
            Frame callFrame = Frame.nested(fn.globals, Scope.frameLocals(fn.def), fn.closure);
            bindArguments(fn, callFrame, args, kwargs);
            Interpreter interpreter = new Interpreter(callFrame);
            Completion completion = interpreter.execBlock(fn.def.body);
            return completion == Completion.RETURN ? callFrame.returnValue : null;
        } catch (StackOverflowError e) {
            throw new ScriptException(ScriptType.RECURSION_ERROR, "maximum recursion depth exceeded");
        } finally {
            depth[0]--;
        }
    }

    private static void bindArguments(UserFunction fn, Frame callFrame, List<Object> args, Map<String, Object> kwargs) {
        Arguments params = fn.def.args;
        String name = fn.def.name;
        int n = params.params.size();
        Object[] bound = new Object[n];
        boolean[] filled = new boolean[n];
        for (int i = 0; i < Math.min(n, args.size()); i++) {
            bound[i] = args.get(i);
            filled[i] = true;
        }
        if (args.size() > n) {
            if (params.vararg == null) {
                throw new ScriptException(ScriptType.TYPE_ERROR, name + "() takes " + n
                        + " positional argument" + (n == 1 ? "" : "s") + " but " + args.size() + " were given");
            }
            callFrame.store(params.vararg.name, Tuple.copyOf(args.subList(n, args.size())));
        } else if (params.vararg != null) {
            callFrame.store(params.vararg.name, Tuple.EMPTY);
        }
        Map<Object, Object> extraKwargs = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : kwargs.entrySet()) {
            int index = params.indexOf(entry.getKey());
            if (index >= 0) {
                if (filled[index]) {
                    throw new ScriptException(ScriptType.TYPE_ERROR,
                            name + "() got multiple values for argument '" + entry.getKey() + "'");
                }
                bound[index] = entry.getValue();
                filled[index] = true;
            } else if (params.kwarg != null) {
                extraKwargs.put(entry.getKey(), entry.getValue());
            } else {
                throw new ScriptException(ScriptType.TYPE_ERROR,
                        name + "() got an unexpected keyword argument '" + entry.getKey() + "'");
            }
        }
        if (params.kwarg != null) callFrame.store(params.kwarg.name, extraKwargs);
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (!filled[i]) {
                if (params.params.get(i).defaultValue != null) {
                    bound[i] = fn.getDefault(i);
                } else {
                    missing.add("'" + params.params.get(i).name + "'");
                    continue;
                }
            }
            callFrame.store(params.params.get(i).name, bound[i]);
        }
        if (!missing.isEmpty()) {
            throw new ScriptException(ScriptType.TYPE_ERROR, name + "() missing " + missing.size()
                    + " required positional argument" + (missing.size() == 1 ? "" : "s") + ": "
                    + String.join(", ", missing));
        }
    }

    /**
     * Create the function a definition defines in a frame, evaluating its defaults and applying its decorators.
     *
     * @param def   The definition.
     * @param frame The frame it is defined in.
     * @return The function, after decoration.
     */
    public static Object define(Stmt.FunctionDef def, Frame frame) {
        return new Interpreter(frame).defineFunction(def);
    }

    /**
     * Create a function from a definition, without applying its decorators.
     * <p>
     * Parameter defaults are evaluated against the given environment.
     *
     * @param def     The definition.
     * @param globals The module globals of the function.
     * @param closure The frame of the enclosing function, or null.
     * @return The function.
     */
    public static UserFunction createFunction(Stmt.FunctionDef def, Map<String, Object> globals, @Nullable Frame closure) {
        Interpreter interpreter = new Interpreter(Frame.nested(globals, Collections.emptySet(), closure));
        List<Object> defaults = new ArrayList<>();
        for (Param param : def.args.params) {
            if (param.defaultValue != null) defaults.add(interpreter.eval(param.defaultValue));
        }
        return new UserFunction(def, globals, closure, defaults);
    }

    private Object defineFunction(Stmt.FunctionDef def) {
        List<Object> defaults = new ArrayList<>();
        for (Param param : def.args.params) {
            if (param.defaultValue != null) defaults.add(eval(param.defaultValue));
        }
        Object fn = new UserFunction(def, frame.globals, frame.isModule() ? null : frame, defaults);
        List<Expr> decorators = def.decorators;
        List<Object> decoratorValues = new ArrayList<>();
        for (Expr decorator : decorators) decoratorValues.add(eval(decorator));
        for (int i = decoratorValues.size() - 1; i >= 0; i--) {
            fn = Operators.call(decoratorValues.get(i), Collections.singletonList(fn), Collections.emptyMap());
        }
        return fn;
    }

    // region Statements

    private Completion execBlock(List<Stmt> block) {
        for (Stmt stmt : block) {
            Completion completion = stmt.accept(this);
            if (completion != Completion.NORMAL) return completion;
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitFunctionDef(Stmt.FunctionDef stmt) {
        frame.store(stmt.name, defineFunction(stmt));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitAssign(Stmt.Assign stmt) {
        Object value = eval(stmt.value);
        for (Expr target : stmt.targets) assign(target, value);
        return Completion.NORMAL;
    }

    private void assign(Expr target, @Nullable Object value) {
        if (target instanceof Expr.Name) {
            frame.store(((Expr.Name) target).id, value);
        } else if (target instanceof Expr.TupleExpr || target instanceof Expr.ListExpr) {
            List<Expr> elts = target instanceof Expr.TupleExpr
                    ? ((Expr.TupleExpr) target).elts
                    : ((Expr.ListExpr) target).elts;
            List<Object> values = unpack(value, elts.size());
            for (int i = 0; i < elts.size(); i++) assign(elts.get(i), values.get(i));
        } else if (target instanceof Expr.Attribute) {
            Expr.Attribute attr = (Expr.Attribute) target;
            Operators.setAttribute(eval(attr.value), attr.attr, value);
        } else if (target instanceof Expr.Subscript) {
            Expr.Subscript sub = (Expr.Subscript) target;
            Object container = eval(sub.value);
            Operators.setItem(container, eval(sub.slice), value);
        } else {
            throw new IllegalStateException("cannot assign to " + target.getClass().getSimpleName());
        }
    }

    /**
     * Unpack an iterable into exactly the given number of values.
     *
     * @param value The iterable.
     * @param count The number of values expected.
     * @return The values.
     * @throws ScriptException A {@code ValueError} if the number of values is wrong.
     */
    public static List<Object> unpack(@Nullable Object value, int count) {
        List<Object> values = new ArrayList<>();
        Iterator<Object> it = Operators.iter(value);
        while (it.hasNext()) {
            values.add(it.next());
            if (values.size() > count) {
                throw new ScriptException(ScriptType.VALUE_ERROR, "too many values to unpack (expected " + count + ")");
            }
        }
        if (values.size() < count) {
            throw new ScriptException(ScriptType.VALUE_ERROR,
                    "not enough values to unpack (expected " + count + ", got " + values.size() + ")");
        }
        return values;
    }

    @Override
    public Completion visitAugAssign(Stmt.AugAssign stmt) {
        if (stmt.target instanceof Expr.Name) {
            String name = ((Expr.Name) stmt.target).id;
            frame.store(name, Operators.inPlace(stmt.op, frame.lookup(name), eval(stmt.value)));
        } else if (stmt.target instanceof Expr.Attribute) {
            Expr.Attribute attr = (Expr.Attribute) stmt.target;
            Object obj = eval(attr.value);
            Object current = Operators.getAttribute(obj, attr.attr);
            Operators.setAttribute(obj, attr.attr, Operators.inPlace(stmt.op, current, eval(stmt.value)));
        } else if (stmt.target instanceof Expr.Subscript) {
            Expr.Subscript sub = (Expr.Subscript) stmt.target;
            Object obj = eval(sub.value);
            Object key = eval(sub.slice);
            Object current = Operators.getItem(obj, key);
            Operators.setItem(obj, key, Operators.inPlace(stmt.op, current, eval(stmt.value)));
        } else {
            throw new IllegalStateException("cannot augment-assign to " + stmt.target.getClass().getSimpleName());
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitAnnAssign(Stmt.AnnAssign stmt) {
        if (stmt.value != null) {
            assign(stmt.target, eval(stmt.value));
        } else if (!(stmt.target instanceof Expr.Name)) {
            eval(stmt.target);
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitExprStmt(Stmt.ExprStmt stmt) {
        eval(stmt.value);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitReturn(Stmt.Return stmt) {
        frame.returnValue = stmt.value == null ? null : eval(stmt.value);
        return Completion.RETURN;
    }

    @Override
    public Completion visitIf(Stmt.If stmt) {
        if (Operators.truth(eval(stmt.test))) return execBlock(stmt.body);
        return execBlock(stmt.orelse);
    }

    @Override
    public Completion visitWhile(Stmt.While stmt) {
        while (Operators.truth(eval(stmt.test))) {
            Completion completion = execBlock(stmt.body);
            if (completion == Completion.BREAK) return Completion.NORMAL;
            if (completion == Completion.RETURN) return completion;
        }
        return execBlock(stmt.orelse);
    }

    @Override
    public Completion visitFor(Stmt.For stmt) {
        Iterator<Object> it = Operators.iter(eval(stmt.iter));
        while (it.hasNext()) {
            assign(stmt.target, it.next());
            Completion completion = execBlock(stmt.body);
            if (completion == Completion.BREAK) return Completion.NORMAL;
            if (completion == Completion.RETURN) return completion;
        }
        return execBlock(stmt.orelse);
    }

    @Override
    public Completion visitBreak(Stmt.Break stmt) {
        return Completion.BREAK;
    }

    @Override
    public Completion visitContinue(Stmt.Continue stmt) {
        return Completion.CONTINUE;
    }

    @Override
    public Completion visitPass(Stmt.Pass stmt) {
        return Completion.NORMAL;
    }

    @Override
    public Completion visitRaise(Stmt.Raise stmt) {
        if (stmt.exc == null) {
            ScriptException current = frame.handling.peek();
            if (current == null) throw new ScriptException(ScriptType.RUNTIME_ERROR, "No active exception to reraise");
            throw current;
        }
        Object exc = eval(stmt.exc);
        if (exc instanceof ScriptType && ((ScriptType) exc).isSubtypeOf(ScriptType.BASE_EXCEPTION)) {
            exc = ((ScriptType) exc).call(Collections.emptyList(), Collections.emptyMap());
        }
        if (exc instanceof ExceptionValue) throw new ScriptException((ExceptionValue) exc);
        throw new ScriptException(ScriptType.TYPE_ERROR, "exceptions must derive from BaseException");
    }

    @Override
    public Completion visitAssert(Stmt.Assert stmt) {
        if (!Operators.truth(eval(stmt.test))) {
            Tuple args = stmt.msg == null ? Tuple.EMPTY : Tuple.of(eval(stmt.msg));
            throw new ScriptException(new ExceptionValue(ScriptType.ASSERTION_ERROR, args));
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitTry(Stmt.Try stmt) {
        Completion completion = Completion.NORMAL;
        ScriptException pending = null;
        boolean bodyCompleted = false;
        try {
            completion = execBlock(stmt.body);
            bodyCompleted = true;
        } catch (ScriptException e) {
            ExceptHandler handler = findHandler(stmt.handlers, e);
            if (handler == null) {
                pending = e;
            } else {
                if (handler.name != null) frame.store(handler.name, e.value);
                frame.handling.push(e);
                try {
                    completion = execBlock(handler.body);
                } catch (ScriptException e2) {
                    pending = e2;
                } finally {
                    frame.handling.pop();
                }
            }
        }
        if (bodyCompleted && completion == Completion.NORMAL) {
            try {
                completion = execBlock(stmt.orelse);
            } catch (ScriptException e) {
                pending = e;
            }
        }
        if (!stmt.finalbody.isEmpty()) {
            Object returnValue = frame.returnValue;
            Completion finalCompletion = execBlock(stmt.finalbody);
            if (finalCompletion != Completion.NORMAL) return finalCompletion;
            frame.returnValue = returnValue;
        }
        if (pending != null) throw pending;
        return completion;
    }

    @Nullable
    private ExceptHandler findHandler(List<ExceptHandler> handlers, ScriptException e) {
        for (ExceptHandler handler : handlers) {
            if (handler.type == null) return handler;
            Object type = eval(handler.type);
            if (type instanceof Tuple) {
                for (Object t : (Tuple) type) {
                    if (exceptionType(t).isInstance(e.value)) return handler;
                }
            } else if (exceptionType(type).isInstance(e.value)) {
                return handler;
            }
        }
        return null;
    }

    private static ScriptType exceptionType(Object type) {
        if (type instanceof ScriptType && ((ScriptType) type).isSubtypeOf(ScriptType.BASE_EXCEPTION)) {
            return (ScriptType) type;
        }
        throw new ScriptException(ScriptType.TYPE_ERROR,
                "catching classes that do not inherit from BaseException is not allowed");
    }

    @Override
    public Completion visitWith(Stmt.With stmt) {
        return execWith(stmt.items, 0, stmt.body);
    }

    private Completion execWith(List<WithItem> items, int index, List<Stmt> body) {
        if (index == items.size()) return execBlock(body);
        WithItem item = items.get(index);
        Object value = eval(item.contextExpr);
        if (!(value instanceof ContextManager)) {
            throw new ScriptException(ScriptType.TYPE_ERROR,
                    "'" + Operators.typeName(value) + "' object does not support the context manager protocol");
        }
        ContextManager manager = (ContextManager) value;
        Object entered = manager.enter();
        Completion completion;
        try {
            if (item.optionalVars != null) assign(item.optionalVars, entered);
            completion = execWith(items, index + 1, body);
        } catch (ScriptException e) {
            if (manager.exit(e)) return Completion.NORMAL;
            throw e;
        }
        manager.exit(null);
        return completion;
    }

    // endregion

    // region Expressions

    private Object eval(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public Object visitName(Expr.Name expr) {
        return frame.lookup(expr.id);
    }

    @Override
    public Object visitConstant(Expr.Constant expr) {
        return expr.value;
    }

    @Override
    public Object visitBoolOp(Expr.BoolOp expr) {
        Object value = null;
        for (Expr operand : expr.values) {
            value = eval(operand);
            if (expr.op.shortCircuitsOn(Operators.truth(value))) return value;
        }
        return value;
    }

    @Override
    public Object visitBinOp(Expr.BinOp expr) {
        Object left = eval(expr.left);
        return Operators.binary(expr.op, left, eval(expr.right));
    }

    @Override
    public Object visitUnaryOp(Expr.UnaryOp expr) {
        return Operators.unary(expr.op, eval(expr.operand));
    }

    @Override
    public Object visitCompare(Expr.Compare expr) {
        Object left = eval(expr.left);
        Object result = true;
        for (int i = 0; i < expr.ops.size(); i++) {
            Object right = eval(expr.comparators.get(i));
            result = Operators.compare(expr.ops.get(i), left, right);
            if (!Operators.truth(result)) return result;
            left = right;
        }
        return result;
    }

    @Override
    public Object visitCall(Expr.Call expr) {
        Object fn = eval(expr.func);
        List<Object> args = new ArrayList<>();
        for (Expr arg : expr.args) {
            if (arg instanceof Expr.Starred) {
                args.addAll(Operators.toList(eval(((Expr.Starred) arg).value)));
            } else {
                args.add(eval(arg));
            }
        }
        Map<String, Object> kwargs = new LinkedHashMap<>();
        for (Keyword keyword : expr.keywords) {
            Object value = eval(keyword.value);
            if (keyword.arg != null) {
                kwargs.put(keyword.arg, value);
                continue;
            }
            if (!(value instanceof Map)) {
                throw new ScriptException(ScriptType.TYPE_ERROR, "argument after ** must be a mapping, not "
                        + Operators.typeName(value));
            }
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new ScriptException(ScriptType.TYPE_ERROR, "keywords must be strings");
                }
                kwargs.put((String) entry.getKey(), entry.getValue());
            }
        }
        return Operators.call(fn, args, kwargs);
    }

    @Override
    public Object visitAttribute(Expr.Attribute expr) {
        return Operators.getAttribute(eval(expr.value), expr.attr);
    }

    @Override
    public Object visitSubscript(Expr.Subscript expr) {
        Object value = eval(expr.value);
        return Operators.getItem(value, eval(expr.slice));
    }

    @Override
    public Object visitSlice(Expr.Slice expr) {
        return new Slice(
                expr.lower == null ? null : eval(expr.lower),
                expr.upper == null ? null : eval(expr.upper),
                expr.step == null ? null : eval(expr.step));
    }

    @Override
    public Object visitIfExp(Expr.IfExp expr) {
        return Operators.truth(eval(expr.test)) ? eval(expr.body) : eval(expr.orelse);
    }

    private List<Object> evalElements(List<Expr> elts) {
        List<Object> values = new ArrayList<>();
        for (Expr elt : elts) {
            if (elt instanceof Expr.Starred) {
                values.addAll(Operators.toList(eval(((Expr.Starred) elt).value)));
            } else {
                values.add(eval(elt));
            }
        }
        return values;
    }

    @Override
    public Object visitList(Expr.ListExpr expr) {
        return evalElements(expr.elts);
    }

    @Override
    public Object visitTuple(Expr.TupleExpr expr) {
        return Tuple.copyOf(evalElements(expr.elts));
    }

    @Override
    public Object visitSet(Expr.SetExpr expr) {
        return Operators.toSet(evalElements(expr.elts));
    }

    @Override
    public Object visitDict(Expr.DictExpr expr) {
        Map<Object, Object> dict = new LinkedHashMap<>();
        for (int i = 0; i < expr.keys.size(); i++) {
            Object key = eval(expr.keys.get(i));
            Operators.checkHashable(key);
            dict.put(key, eval(expr.values.get(i)));
        }
        return dict;
    }

    @Override
    public Object visitComprehension(Expr.Comprehension expr) {
        Object firstIter = eval(expr.generators.get(0).iter);
        Frame compFrame = Frame.nested(frame.globals, Scope.comprehensionLocals(expr), frame);
        List<Object> results = new ArrayList<>();
        new Interpreter(compFrame).runClauses(expr, 0, firstIter, results);
        switch (expr.kind) {
            case LIST:
                return results;
            case SET:
                return Operators.toSet(results);
            case DICT: {
                Map<Object, Object> dict = new LinkedHashMap<>();
                for (Object pair : results) {
                    Tuple kv = (Tuple) pair;
                    Operators.checkHashable(kv.get(0));
                    dict.put(kv.get(0), kv.get(1));
                }
                return dict;
            }
            case GENERATOR:
                return new GeneratorValue(results.iterator());
            default:
                throw new IllegalStateException(expr.kind.toString());
        }
    }

    private void runClauses(Expr.Comprehension expr, int index, Object iterable, List<Object> results) {
        ForClause clause = expr.generators.get(index);
        Iterator<Object> it = Operators.iter(iterable);
        outer:
        while (it.hasNext()) {
            assign(clause.target, it.next());
            for (Expr test : clause.ifs) {
                if (!Operators.truth(eval(test))) continue outer;
            }
            if (index + 1 < expr.generators.size()) {
                runClauses(expr, index + 1, eval(expr.generators.get(index + 1).iter), results);
            } else if (expr.kind == Expr.Comprehension.Kind.DICT) {
                Object key = eval(expr.elt);
                results.add(Tuple.of(key, eval(Objects.requireNonNull(expr.value))));
            } else {
                results.add(eval(expr.elt));
            }
        }
    }

    /**
     * Get the function definition a lambda stands for.
     *
     * @param lambda The lambda.
     * @return A definition named {@code <lambda>} that returns the lambda's body.
     */
    public static Stmt.FunctionDef lambdaDef(Expr.Lambda lambda) {
        return new Stmt.FunctionDef("<lambda>", lambda.args,
                Collections.singletonList(new Stmt.Return(lambda.body)),
                Collections.emptyList(), null, false);
    }

    @Override
    public Object visitLambda(Expr.Lambda expr) {
        return defineFunction(lambdaDef(expr));
    }

    @Override
    public Object visitYield(Expr.Yield expr) {
        throw new ScriptException(ScriptType.RUNTIME_ERROR, "'yield' outside a generator function");
    }

    @Override
    public Object visitStarred(Expr.Starred expr) {
        throw new ScriptException(ScriptType.TYPE_ERROR, "can't use starred expression here");
    }

    // endregion
}
