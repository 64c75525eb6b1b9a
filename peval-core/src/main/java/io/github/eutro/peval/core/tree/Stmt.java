package io.github.eutro.peval.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A statement node.
 * <p>
 * Blocks of statements (bodies, else clauses) are never empty; {@link Pass} fills an otherwise empty block.
 */
public abstract class Stmt extends Node {
    Stmt() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    @Override
    public abstract Stmt withFields(List<Object> fields);

    static List<Stmt> block(List<? extends Stmt> stmts, String what) {
        if (stmts.isEmpty()) throw new IllegalArgumentException("empty " + what);
        return copy(stmts);
    }

    public interface Visitor<R> {
        R visitFunctionDef(FunctionDef stmt);

        R visitAssign(Assign stmt);

        R visitAugAssign(AugAssign stmt);

        R visitAnnAssign(AnnAssign stmt);

        R visitExprStmt(ExprStmt stmt);

        R visitReturn(Return stmt);

        R visitIf(If stmt);

        R visitWhile(While stmt);

        R visitFor(For stmt);

        R visitBreak(Break stmt);

        R visitContinue(Continue stmt);

        R visitPass(Pass stmt);

        R visitRaise(Raise stmt);

        R visitAssert(Assert stmt);

        R visitTry(Try stmt);

        R visitWith(With stmt);
    }

    /**
     * A function definition.
     */
    public static final class FunctionDef extends Stmt {
        public final String name;
        public final Arguments args;
        public final List<Stmt> body;
        public final List<Expr> decorators;
        @Nullable
        public final Expr returns;
        public final boolean isAsync;

        public FunctionDef(String name,
                           Arguments args,
                           List<? extends Stmt> body,
                           List<? extends Expr> decorators,
                           @Nullable Expr returns,
                           boolean isAsync) {
            this.name = name;
            this.args = args;
            this.body = block(body, "function body");
            this.decorators = copy(decorators);
            this.returns = returns;
            this.isAsync = isAsync;
        }

        public FunctionDef withName(String name) {
            return new FunctionDef(name, args, body, decorators, returns, isAsync);
        }

        public FunctionDef withArgs(Arguments args) {
            return new FunctionDef(name, args, body, decorators, returns, isAsync);
        }

        public FunctionDef withBody(List<? extends Stmt> body) {
            return new FunctionDef(name, args, body, decorators, returns, isAsync);
        }

        public FunctionDef withDecorators(List<? extends Expr> decorators) {
            return new FunctionDef(name, args, body, decorators, returns, isAsync);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(name, args, body, decorators, returns, isAsync);
        }

        @Override
        public FunctionDef withFields(List<Object> fields) {
            return new FunctionDef(
                    (String) fields.get(0),
                    (Arguments) fields.get(1),
                    listField(fields.get(2)),
                    listField(fields.get(3)),
                    (Expr) fields.get(4),
                    (Boolean) fields.get(5));
        }
    }

    /**
     * An assignment, {@code targets[0] = targets[1] = ... = value}.
     */
    public static final class Assign extends Stmt {
        public final List<Expr> targets;
        public final Expr value;

        public Assign(List<? extends Expr> targets, Expr value) {
            if (targets.isEmpty()) throw new IllegalArgumentException("assignment without a target");
            this.targets = copy(targets);
            this.value = value;
        }

        public Assign(String target, Expr value) {
            this(Collections.singletonList(new Expr.Name(target)), value);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(targets, value);
        }

        @Override
        public Assign withFields(List<Object> fields) {
            return new Assign(listField(fields.get(0)), (Expr) fields.get(1));
        }
    }

    public static final class AugAssign extends Stmt {
        public final Expr target;
        public final BinOperator op;
        public final Expr value;

        public AugAssign(Expr target, BinOperator op, Expr value) {
            this.target = target;
            this.op = op;
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAugAssign(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(target, op, value);
        }

        @Override
        public AugAssign withFields(List<Object> fields) {
            return new AugAssign((Expr) fields.get(0), (BinOperator) fields.get(1), (Expr) fields.get(2));
        }
    }

    /**
     * An annotated assignment, {@code target: annotation} or {@code target: annotation = value}.
     */
    public static final class AnnAssign extends Stmt {
        public final Expr target;
        public final Expr annotation;
        @Nullable
        public final Expr value;

        public AnnAssign(Expr target, Expr annotation, @Nullable Expr value) {
            this.target = target;
            this.annotation = annotation;
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnnAssign(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(target, annotation, value);
        }

        @Override
        public AnnAssign withFields(List<Object> fields) {
            return new AnnAssign((Expr) fields.get(0), (Expr) fields.get(1), (Expr) fields.get(2));
        }
    }

    public static final class ExprStmt extends Stmt {
        public final Expr value;

        public ExprStmt(Expr value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExprStmt(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.singletonList(value);
        }

        @Override
        public ExprStmt withFields(List<Object> fields) {
            return new ExprStmt((Expr) fields.get(0));
        }
    }

    public static final class Return extends Stmt {
        @Nullable
        public final Expr value;

        public Return(@Nullable Expr value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.singletonList(value);
        }

        @Override
        public Return withFields(List<Object> fields) {
            return new Return((Expr) fields.get(0));
        }
    }

    /**
     * A conditional. An empty {@link #orelse} means there is no else clause.
     */
    public static final class If extends Stmt {
        public final Expr test;
        public final List<Stmt> body;
        public final List<Stmt> orelse;

        public If(Expr test, List<? extends Stmt> body, List<? extends Stmt> orelse) {
            this.test = test;
            this.body = block(body, "if body");
            this.orelse = copy(orelse);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(test, body, orelse);
        }

        @Override
        public If withFields(List<Object> fields) {
            return new If((Expr) fields.get(0), listField(fields.get(1)), listField(fields.get(2)));
        }
    }

    public static final class While extends Stmt {
        public final Expr test;
        public final List<Stmt> body;
        public final List<Stmt> orelse;

        public While(Expr test, List<? extends Stmt> body, List<? extends Stmt> orelse) {
            this.test = test;
            this.body = block(body, "while body");
            this.orelse = copy(orelse);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(test, body, orelse);
        }

        @Override
        public While withFields(List<Object> fields) {
            return new While((Expr) fields.get(0), listField(fields.get(1)), listField(fields.get(2)));
        }
    }

    public static final class For extends Stmt {
        public final Expr target;
        public final Expr iter;
        public final List<Stmt> body;
        public final List<Stmt> orelse;

        public For(Expr target, Expr iter, List<? extends Stmt> body, List<? extends Stmt> orelse) {
            this.target = target;
            this.iter = iter;
            this.body = block(body, "for body");
            this.orelse = copy(orelse);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFor(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(target, iter, body, orelse);
        }

        @Override
        public For withFields(List<Object> fields) {
            return new For((Expr) fields.get(0), (Expr) fields.get(1), listField(fields.get(2)), listField(fields.get(3)));
        }
    }

    public static final class Break extends Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.emptyList();
        }

        @Override
        public Break withFields(List<Object> fields) {
            return new Break();
        }
    }

    public static final class Continue extends Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.emptyList();
        }

        @Override
        public Continue withFields(List<Object> fields) {
            return new Continue();
        }
    }

    public static final class Pass extends Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPass(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.emptyList();
        }

        @Override
        public Pass withFields(List<Object> fields) {
            return new Pass();
        }
    }

    /**
     * {@code raise exc}, or a bare {@code raise} re-raising the exception being handled.
     */
    public static final class Raise extends Stmt {
        @Nullable
        public final Expr exc;

        public Raise(@Nullable Expr exc) {
            this.exc = exc;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRaise(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.singletonList(exc);
        }

        @Override
        public Raise withFields(List<Object> fields) {
            return new Raise((Expr) fields.get(0));
        }
    }

    public static final class Assert extends Stmt {
        public final Expr test;
        @Nullable
        public final Expr msg;

        public Assert(Expr test, @Nullable Expr msg) {
            this.test = test;
            this.msg = msg;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssert(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(test, msg);
        }

        @Override
        public Assert withFields(List<Object> fields) {
            return new Assert((Expr) fields.get(0), (Expr) fields.get(1));
        }
    }

    /**
     * {@code try}, with at least one handler or a finally clause.
     */
    public static final class Try extends Stmt {
        public final List<Stmt> body;
        public final List<ExceptHandler> handlers;
        public final List<Stmt> orelse;
        public final List<Stmt> finalbody;

        public Try(List<? extends Stmt> body,
                   List<ExceptHandler> handlers,
                   List<? extends Stmt> orelse,
                   List<? extends Stmt> finalbody) {
            if (handlers.isEmpty() && finalbody.isEmpty()) {
                throw new IllegalArgumentException("try without except or finally");
            }
            if (handlers.isEmpty() && !orelse.isEmpty()) {
                throw new IllegalArgumentException("try with else but without except");
            }
            this.body = block(body, "try body");
            this.handlers = copy(handlers);
            this.orelse = copy(orelse);
            this.finalbody = copy(finalbody);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTry(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(body, handlers, orelse, finalbody);
        }

        @Override
        public Try withFields(List<Object> fields) {
            return new Try(
                    listField(fields.get(0)),
                    listField(fields.get(1)),
                    listField(fields.get(2)),
                    listField(fields.get(3)));
        }
    }

    public static final class With extends Stmt {
        public final List<WithItem> items;
        public final List<Stmt> body;

        public With(List<WithItem> items, List<? extends Stmt> body) {
            if (items.isEmpty()) throw new IllegalArgumentException("with without items");
            this.items = copy(items);
            this.body = block(body, "with body");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWith(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(items, body);
        }

        @Override
        public With withFields(List<Object> fields) {
            return new With(listField(fields.get(0)), listField(fields.get(1)));
        }
    }
}
