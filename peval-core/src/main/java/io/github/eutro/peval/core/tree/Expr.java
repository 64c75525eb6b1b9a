package io.github.eutro.peval.core.tree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An expression node.
 */
public abstract class Expr extends Node {
    Expr() {
    }

    /**
     * Accept a visitor, dispatching on the kind of this expression.
     *
     * @param visitor The visitor.
     * @param <R>     The result type of the visitor.
     * @return The result of the visitor.
     */
    public abstract <R> R accept(Visitor<R> visitor);

    @Override
    public abstract Expr withFields(List<Object> fields);

    /**
     * A visitor over the kinds of expressions.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        R visitName(Name expr);

        R visitConstant(Constant expr);

        R visitBoolOp(BoolOp expr);

        R visitBinOp(BinOp expr);

        R visitUnaryOp(UnaryOp expr);

        R visitCompare(Compare expr);

        R visitCall(Call expr);

        R visitAttribute(Attribute expr);

        R visitSubscript(Subscript expr);

        R visitSlice(Slice expr);

        R visitIfExp(IfExp expr);

        R visitList(ListExpr expr);

        R visitTuple(TupleExpr expr);

        R visitSet(SetExpr expr);

        R visitDict(DictExpr expr);

        R visitComprehension(Comprehension expr);

        R visitLambda(Lambda expr);

        R visitYield(Yield expr);

        R visitStarred(Starred expr);
    }

    /**
     * A reference to a variable.
     */
    public static final class Name extends Expr {
        @NotNull
        public final String id;

        public Name(@NotNull String id) {
            this.id = id;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitName(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.singletonList(id);
        }

        @Override
        public Name withFields(List<Object> fields) {
            return new Name((String) fields.get(0));
        }
    }

    /**
     * A literal: {@code None}, a boolean, an integer, a float or a string.
     * <p>
     * Values are represented as {@code null}, {@link Boolean}, {@link Long}, {@link Double} and {@link String}
     * respectively.
     */
    public static final class Constant extends Expr {
        @Nullable
        public final Object value;

        public Constant(@Nullable Object value) {
            if (!isLiteral(value)) {
                throw new IllegalArgumentException("not a literal value: " + value.getClass().getName());
            }
            this.value = value;
        }

        /**
         * Get whether a value has a literal syntax.
         *
         * @param value The value.
         * @return Whether it can be held in a {@link Constant}.
         */
        public static boolean isLiteral(@Nullable Object value) {
            return value == null
                    || value instanceof Boolean
                    || value instanceof Long
                    || value instanceof String
                    || value instanceof Double && Double.isFinite((Double) value);
        }

        public static Constant none() {
            return new Constant(null);
        }

        public static Constant of(boolean b) {
            return new Constant(b);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.singletonList(value);
        }

        @Override
        public Constant withFields(List<Object> fields) {
            return new Constant(fields.get(0));
        }
    }

    /**
     * A chain of {@code and}s or {@code or}s, with at least two operands.
     */
    public static final class BoolOp extends Expr {
        public final BoolOperator op;
        public final List<Expr> values;

        public BoolOp(BoolOperator op, List<? extends Expr> values) {
            if (values.size() < 2) throw new IllegalArgumentException("BoolOp needs at least two operands");
            this.op = op;
            this.values = copy(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolOp(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(op, values);
        }

        @Override
        public BoolOp withFields(List<Object> fields) {
            return new BoolOp((BoolOperator) fields.get(0), listField(fields.get(1)));
        }
    }

    public static final class BinOp extends Expr {
        public final Expr left;
        public final BinOperator op;
        public final Expr right;

        public BinOp(Expr left, BinOperator op, Expr right) {
            this.left = left;
            this.op = op;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinOp(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(left, op, right);
        }

        @Override
        public BinOp withFields(List<Object> fields) {
            return new BinOp((Expr) fields.get(0), (BinOperator) fields.get(1), (Expr) fields.get(2));
        }
    }

    public static final class UnaryOp extends Expr {
        public final UnOperator op;
        public final Expr operand;

        public UnaryOp(UnOperator op, Expr operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(op, operand);
        }

        @Override
        public UnaryOp withFields(List<Object> fields) {
            return new UnaryOp((UnOperator) fields.get(0), (Expr) fields.get(1));
        }
    }

    /**
     * A possibly chained comparison, {@code left ops[0] comparators[0] ops[1] comparators[1] ...}.
     */
    public static final class Compare extends Expr {
        public final Expr left;
        public final List<CmpOperator> ops;
        public final List<Expr> comparators;

        public Compare(Expr left, List<CmpOperator> ops, List<? extends Expr> comparators) {
            if (ops.isEmpty() || ops.size() != comparators.size()) {
                throw new IllegalArgumentException("mismatched comparison operators and operands");
            }
            this.left = left;
            this.ops = copy(ops);
            this.comparators = copy(comparators);
        }

        public Compare(Expr left, CmpOperator op, Expr right) {
            this(left, Collections.singletonList(op), Collections.singletonList(right));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCompare(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(left, ops, comparators);
        }

        @Override
        public Compare withFields(List<Object> fields) {
            return new Compare((Expr) fields.get(0), listField(fields.get(1)), listField(fields.get(2)));
        }
    }

    /**
     * A call. Positional arguments may include {@link Starred} arguments, and keywords with a null name
     * are {@code **} arguments.
     */
    public static final class Call extends Expr {
        public final Expr func;
        public final List<Expr> args;
        public final List<Keyword> keywords;

        public Call(Expr func, List<? extends Expr> args, List<Keyword> keywords) {
            this.func = func;
            this.args = copy(args);
            this.keywords = copy(keywords);
        }

        public Call(Expr func, Expr... args) {
            this(func, Arrays.asList(args), Collections.emptyList());
        }

        /**
         * Get whether this call has any {@code *} or {@code **} arguments.
         *
         * @return Whether this call is variadic.
         */
        public boolean isVariadic() {
            for (Expr arg : args) {
                if (arg instanceof Starred) return true;
            }
            for (Keyword keyword : keywords) {
                if (keyword.arg == null) return true;
            }
            return false;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(func, args, keywords);
        }

        @Override
        public Call withFields(List<Object> fields) {
            return new Call((Expr) fields.get(0), listField(fields.get(1)), listField(fields.get(2)));
        }
    }

    public static final class Attribute extends Expr {
        public final Expr value;
        public final String attr;

        public Attribute(Expr value, String attr) {
            this.value = value;
            this.attr = attr;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAttribute(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(value, attr);
        }

        @Override
        public Attribute withFields(List<Object> fields) {
            return new Attribute((Expr) fields.get(0), (String) fields.get(1));
        }
    }

    public static final class Subscript extends Expr {
        public final Expr value;
        public final Expr slice;

        public Subscript(Expr value, Expr slice) {
            this.value = value;
            this.slice = slice;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubscript(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(value, slice);
        }

        @Override
        public Subscript withFields(List<Object> fields) {
            return new Subscript((Expr) fields.get(0), (Expr) fields.get(1));
        }
    }

    /**
     * A slice, {@code lower:upper:step}, only valid directly inside a {@link Subscript}.
     */
    public static final class Slice extends Expr {
        @Nullable
        public final Expr lower;
        @Nullable
        public final Expr upper;
        @Nullable
        public final Expr step;

        public Slice(@Nullable Expr lower, @Nullable Expr upper, @Nullable Expr step) {
            this.lower = lower;
            this.upper = upper;
            this.step = step;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSlice(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(lower, upper, step);
        }

        @Override
        public Slice withFields(List<Object> fields) {
            return new Slice((Expr) fields.get(0), (Expr) fields.get(1), (Expr) fields.get(2));
        }
    }

    /**
     * A conditional expression, {@code body if test else orelse}.
     */
    public static final class IfExp extends Expr {
        public final Expr test;
        public final Expr body;
        public final Expr orelse;

        public IfExp(Expr test, Expr body, Expr orelse) {
            this.test = test;
            this.body = body;
            this.orelse = orelse;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfExp(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(test, body, orelse);
        }

        @Override
        public IfExp withFields(List<Object> fields) {
            return new IfExp((Expr) fields.get(0), (Expr) fields.get(1), (Expr) fields.get(2));
        }
    }

    public static final class ListExpr extends Expr {
        public final List<Expr> elts;

        public ListExpr(List<? extends Expr> elts) {
            this.elts = copy(elts);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitList(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.singletonList(elts);
        }

        @Override
        public ListExpr withFields(List<Object> fields) {
            return new ListExpr(listField(fields.get(0)));
        }
    }

    public static final class TupleExpr extends Expr {
        public final List<Expr> elts;

        public TupleExpr(List<? extends Expr> elts) {
            this.elts = copy(elts);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuple(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.singletonList(elts);
        }

        @Override
        public TupleExpr withFields(List<Object> fields) {
            return new TupleExpr(listField(fields.get(0)));
        }
    }

    /**
     * A set display, with at least one element.
     */
    public static final class SetExpr extends Expr {
        public final List<Expr> elts;

        public SetExpr(List<? extends Expr> elts) {
            if (elts.isEmpty()) throw new IllegalArgumentException("set display cannot be empty");
            this.elts = copy(elts);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSet(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.singletonList(elts);
        }

        @Override
        public SetExpr withFields(List<Object> fields) {
            return new SetExpr(listField(fields.get(0)));
        }
    }

    public static final class DictExpr extends Expr {
        public final List<Expr> keys;
        public final List<Expr> values;

        public DictExpr(List<? extends Expr> keys, List<? extends Expr> values) {
            if (keys.size() != values.size()) throw new IllegalArgumentException("mismatched dict keys and values");
            this.keys = copy(keys);
            this.values = copy(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDict(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(keys, values);
        }

        @Override
        public DictExpr withFields(List<Object> fields) {
            return new DictExpr(listField(fields.get(0)), listField(fields.get(1)));
        }
    }

    /**
     * A list, set, dict or generator comprehension.
     * <p>
     * For dict comprehensions, {@link #elt} is the key and {@link #value} is the value;
     * for all other kinds {@link #value} is null.
     */
    public static final class Comprehension extends Expr {
        public enum Kind {
            LIST, SET, DICT, GENERATOR
        }

        public final Kind kind;
        public final Expr elt;
        @Nullable
        public final Expr value;
        public final List<ForClause> generators;

        public Comprehension(Kind kind, Expr elt, @Nullable Expr value, List<ForClause> generators) {
            if ((kind == Kind.DICT) != (value != null)) {
                throw new IllegalArgumentException("only dict comprehensions have a value");
            }
            if (generators.isEmpty()) throw new IllegalArgumentException("comprehension without a for clause");
            this.kind = kind;
            this.elt = elt;
            this.value = value;
            this.generators = copy(generators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComprehension(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(kind, elt, value, generators);
        }

        @Override
        public Comprehension withFields(List<Object> fields) {
            return new Comprehension(
                    (Kind) fields.get(0),
                    (Expr) fields.get(1),
                    (Expr) fields.get(2),
                    listField(fields.get(3)));
        }
    }

    public static final class Lambda extends Expr {
        public final Arguments args;
        public final Expr body;

        public Lambda(Arguments args, Expr body) {
            this.args = args;
            this.body = body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLambda(this);
        }

        @Override
        public List<Object> fields() {
            return Arrays.asList(args, body);
        }

        @Override
        public Lambda withFields(List<Object> fields) {
            return new Lambda((Arguments) fields.get(0), (Expr) fields.get(1));
        }
    }

    public static final class Yield extends Expr {
        @Nullable
        public final Expr value;

        public Yield(@Nullable Expr value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitYield(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.singletonList(value);
        }

        @Override
        public Yield withFields(List<Object> fields) {
            return new Yield((Expr) fields.get(0));
        }
    }

    /**
     * A {@code *value} argument of a {@link Call}.
     */
    public static final class Starred extends Expr {
        public final Expr value;

        public Starred(Expr value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStarred(this);
        }

        @Override
        public List<Object> fields() {
            return Collections.singletonList(value);
        }

        @Override
        public Starred withFields(List<Object> fields) {
            return new Starred((Expr) fields.get(0));
        }
    }
}
