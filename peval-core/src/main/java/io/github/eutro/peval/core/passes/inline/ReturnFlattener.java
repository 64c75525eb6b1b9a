package io.github.eutro.peval.core.passes.inline;

import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.TreeTransformer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Turns the body of a function into statements that can be spliced into another function,
 * storing the return value in a variable instead of returning it.
 * <p>
 * Each {@code return value} becomes {@code result = value; break}, and the body is wrapped in a
 * {@code while True} loop for the {@code break}s to leave. A {@code return} inside a loop also sets
 * a flag, which is checked after each enclosing loop to break out of it too.
 * If the only {@code return} is the last statement, no loop is needed.
 */
final class ReturnFlattener extends TreeTransformer {
    private final String resultName;
    private final String flagName;
    private int returns;
    private int loopDepth;
    private boolean returnsInLoops;
    private boolean returnInsideLoop;

    private ReturnFlattener(String resultName, String flagName) {
        this.resultName = resultName;
        this.flagName = flagName;
    }

    /**
     * Flatten a function body.
     *
     * @param body       The body.
     * @param resultName The variable to store the result in.
     * @param flagName   The variable to use as the return flag, if one is needed.
     * @return The statements.
     */
    static List<Stmt> flatten(List<Stmt> body, String resultName, String flagName) {
        if (!(body.get(body.size() - 1) instanceof Stmt.Return)) {
            body = new ArrayList<>(body);
            body.add(new Stmt.Return(new Expr.Constant(null)));
        }
        ReturnFlattener flattener = new ReturnFlattener(resultName, flagName);
        List<Stmt> code = flattener.visitBlock(body);
        if (flattener.returns == 1) {
            // the trailing break
            return code.subList(0, code.size() - 1);
        }
        List<Stmt> out = new ArrayList<>();
        if (flattener.returnsInLoops) {
            out.add(new Stmt.Assign(flagName, new Expr.Constant(false)));
        }
        out.add(new Stmt.While(new Expr.Constant(true), code, Collections.emptyList()));
        return out;
    }

    @Override
    public List<Stmt> visitStmt(Stmt stmt) {
        if (stmt instanceof Stmt.Return) {
            Stmt.Return ret = (Stmt.Return) stmt;
            returns++;
            List<Stmt> out = new ArrayList<>();
            out.add(new Stmt.Assign(resultName, ret.value == null ? new Expr.Constant(null) : ret.value));
            if (loopDepth > 0) {
                out.add(new Stmt.Assign(flagName, new Expr.Constant(true)));
                returnsInLoops = true;
                returnInsideLoop = true;
            }
            out.add(new Stmt.Break());
            return out;
        } else if (stmt instanceof Stmt.While) {
            Stmt.While loop = (Stmt.While) stmt;
            List<Stmt> body = loopBody(loop.body);
            return afterLoop(new Stmt.While(loop.test, body, visitBlock(loop.orelse)));
        } else if (stmt instanceof Stmt.For) {
            Stmt.For loop = (Stmt.For) stmt;
            List<Stmt> body = loopBody(loop.body);
            return afterLoop(new Stmt.For(loop.target, loop.iter, body, visitBlock(loop.orelse)));
        } else if (stmt instanceof Stmt.FunctionDef) {
            return Collections.singletonList(stmt);
        }
        return super.visitStmt(stmt);
    }

    private List<Stmt> loopBody(List<Stmt> body) {
        loopDepth++;
        try {
            return visitBlock(body);
        } finally {
            loopDepth--;
        }
    }

    private List<Stmt> afterLoop(Stmt loop) {
        List<Stmt> out;
        if (returnInsideLoop) {
            out = Arrays.asList(loop, new Stmt.If(
                    new Expr.Name(flagName),
                    Collections.singletonList(new Stmt.Break()),
                    Collections.emptyList()));
        } else {
            out = Collections.singletonList(loop);
        }
        if (loopDepth == 0) returnInsideLoop = false;
        return out;
    }
}
