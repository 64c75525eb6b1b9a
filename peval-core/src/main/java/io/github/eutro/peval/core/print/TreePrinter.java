package io.github.eutro.peval.core.print;

import io.github.eutro.peval.core.tree.*;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.List;

/**
 * Renders syntax trees as canonical source text.
 * <p>
 * Output uses four-space indentation and inserts only the parentheses that precedence requires,
 * except around tuples, which are always parenthesized.
 */
public final class TreePrinter {
    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private int depth = 0;

    private TreePrinter() {
    }

    /**
     * Print a node: a module, statement, expression, or any other node that has a source form.
     *
     * @param node The node.
     * @return The source text. Statements end with a newline, expressions do not.
     */
    public static String print(Node node) {
        TreePrinter printer = new TreePrinter();
        if (node instanceof ModuleNode) {
            printer.block(((ModuleNode) node).body);
        } else if (node instanceof Stmt) {
            printer.stmt((Stmt) node);
        } else if (node instanceof Expr) {
            return expr((Expr) node, 0);
        } else if (node instanceof Arguments) {
            return arguments((Arguments) node, true);
        } else {
            throw new IllegalArgumentException("cannot print " + node.getClass().getSimpleName());
        }
        return printer.sb.toString();
    }

    /**
     * Print a sequence of statements.
     *
     * @param stmts The statements.
     * @return The source text.
     */
    public static String print(List<? extends Stmt> stmts) {
        TreePrinter printer = new TreePrinter();
        printer.block(stmts);
        return printer.sb.toString();
    }

    // statements

    private void line(String text) {
        for (int i = 0; i < depth; i++) sb.append(INDENT);
        sb.append(text).append('\n');
    }

    private void block(List<? extends Stmt> stmts) {
        if (stmts.isEmpty()) {
            line("pass");
            return;
        }
        for (Stmt stmt : stmts) {
            stmt(stmt);
        }
    }

    private void indented(String header, List<? extends Stmt> body) {
        line(header + ":");
        depth++;
        block(body);
        depth--;
    }

    private void stmt(Stmt stmt) {
        stmt.accept(new StmtPrinter());
    }

    private class StmtPrinter implements Stmt.Visitor<Void> {
        @Override
        public Void visitFunctionDef(Stmt.FunctionDef stmt) {
            for (Expr decorator : stmt.decorators) {
                line("@" + expr(decorator, Precedence.LAMBDA));
            }
            StringBuilder header = new StringBuilder();
            if (stmt.isAsync) header.append("async ");
            header.append("def ").append(stmt.name).append('(').append(arguments(stmt.args, true)).append(')');
            if (stmt.returns != null) header.append(" -> ").append(expr(stmt.returns, Precedence.LAMBDA));
            indented(header.toString(), stmt.body);
            return null;
        }

        @Override
        public Void visitAssign(Stmt.Assign stmt) {
            StringBuilder text = new StringBuilder();
            for (Expr target : stmt.targets) {
                text.append(expr(target, 0)).append(" = ");
            }
            line(text.append(expr(stmt.value, 0)).toString());
            return null;
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign stmt) {
            line(expr(stmt.target, 0) + " " + stmt.op.symbol + "= " + expr(stmt.value, 0));
            return null;
        }

        @Override
        public Void visitAnnAssign(Stmt.AnnAssign stmt) {
            String text = expr(stmt.target, 0) + ": " + expr(stmt.annotation, Precedence.LAMBDA);
            if (stmt.value != null) text += " = " + expr(stmt.value, 0);
            line(text);
            return null;
        }

        @Override
        public Void visitExprStmt(Stmt.ExprStmt stmt) {
            line(expr(stmt.value, 0));
            return null;
        }

        @Override
        public Void visitReturn(Stmt.Return stmt) {
            line(stmt.value == null ? "return" : "return " + expr(stmt.value, 0));
            return null;
        }

        @Override
        public Void visitIf(Stmt.If stmt) {
            String keyword = "if";
            Stmt.If current = stmt;
            while (true) {
                indented(keyword + " " + expr(current.test, 0), current.body);
                if (current.orelse.size() == 1 && current.orelse.get(0) instanceof Stmt.If) {
                    current = (Stmt.If) current.orelse.get(0);
                    keyword = "elif";
                    continue;
                }
                if (!current.orelse.isEmpty()) indented("else", current.orelse);
                return null;
            }
        }

        @Override
        public Void visitWhile(Stmt.While stmt) {
            indented("while " + expr(stmt.test, 0), stmt.body);
            if (!stmt.orelse.isEmpty()) indented("else", stmt.orelse);
            return null;
        }

        @Override
        public Void visitFor(Stmt.For stmt) {
            indented("for " + expr(stmt.target, 0) + " in " + expr(stmt.iter, 0), stmt.body);
            if (!stmt.orelse.isEmpty()) indented("else", stmt.orelse);
            return null;
        }

        @Override
        public Void visitBreak(Stmt.Break stmt) {
            line("break");
            return null;
        }

        @Override
        public Void visitContinue(Stmt.Continue stmt) {
            line("continue");
            return null;
        }

        @Override
        public Void visitPass(Stmt.Pass stmt) {
            line("pass");
            return null;
        }

        @Override
        public Void visitRaise(Stmt.Raise stmt) {
            line(stmt.exc == null ? "raise" : "raise " + expr(stmt.exc, Precedence.LAMBDA));
            return null;
        }

        @Override
        public Void visitAssert(Stmt.Assert stmt) {
            String text = "assert " + expr(stmt.test, Precedence.LAMBDA);
            if (stmt.msg != null) text += ", " + expr(stmt.msg, Precedence.LAMBDA);
            line(text);
            return null;
        }

        @Override
        public Void visitTry(Stmt.Try stmt) {
            indented("try", stmt.body);
            for (ExceptHandler handler : stmt.handlers) {
                String header = "except";
                if (handler.type != null) {
                    header += " " + expr(handler.type, Precedence.LAMBDA);
                    if (handler.name != null) header += " as " + handler.name;
                }
                indented(header, handler.body);
            }
            if (!stmt.orelse.isEmpty()) indented("else", stmt.orelse);
            if (!stmt.finalbody.isEmpty()) indented("finally", stmt.finalbody);
            return null;
        }

        @Override
        public Void visitWith(Stmt.With stmt) {
            StringBuilder header = new StringBuilder("with ");
            boolean first = true;
            for (WithItem item : stmt.items) {
                if (!first) header.append(", ");
                first = false;
                header.append(expr(item.contextExpr, Precedence.LAMBDA));
                if (item.optionalVars != null) header.append(" as ").append(expr(item.optionalVars, Precedence.BIT_OR));
            }
            indented(header.toString(), stmt.body);
            return null;
        }
    }

    // expressions

    private static String arguments(Arguments args, boolean annotations) {
        StringBuilder text = new StringBuilder();
        boolean first = true;
        for (Param param : args.params) {
            if (!first) text.append(", ");
            first = false;
            param(text, "", param, annotations);
        }
        if (args.vararg != null) {
            if (!first) text.append(", ");
            first = false;
            param(text, "*", args.vararg, annotations);
        }
        if (args.kwarg != null) {
            if (!first) text.append(", ");
            param(text, "**", args.kwarg, annotations);
        }
        return text.toString();
    }

    private static void param(StringBuilder text, String prefix, Param param, boolean annotations) {
        text.append(prefix).append(param.name);
        if (annotations && param.annotation != null) {
            text.append(": ").append(expr(param.annotation, Precedence.LAMBDA));
        }
        if (param.defaultValue != null) {
            text.append('=').append(expr(param.defaultValue, Precedence.LAMBDA));
        }
    }

    private static String expr(@Nullable Expr expr, int minPrecedence) {
        if (expr == null) return "";
        String text = expr.accept(EXPR_PRINTER);
        return precedence(expr) < minPrecedence ? "(" + text + ")" : text;
    }

    private static String exprs(List<? extends Expr> exprs) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < exprs.size(); i++) {
            if (i != 0) text.append(", ");
            text.append(expr(exprs.get(i), Precedence.LAMBDA));
        }
        return text.toString();
    }

    /**
     * Get the precedence of the outermost operator of an expression.
     *
     * @param expr The expression.
     * @return The precedence, from {@link Precedence}, or 0 for a bare {@code yield}.
     */
    public static int precedence(Expr expr) {
        if (expr instanceof Expr.BinOp) return ((Expr.BinOp) expr).op.precedence;
        if (expr instanceof Expr.UnaryOp) return ((Expr.UnaryOp) expr).op.precedence;
        if (expr instanceof Expr.BoolOp) return ((Expr.BoolOp) expr).op.precedence;
        if (expr instanceof Expr.Compare) return Precedence.COMPARE;
        if (expr instanceof Expr.IfExp) return Precedence.IF_EXP;
        if (expr instanceof Expr.Lambda) return Precedence.LAMBDA;
        if (expr instanceof Expr.Yield) return 0;
        if (expr instanceof Expr.Call || expr instanceof Expr.Attribute || expr instanceof Expr.Subscript) {
            return Precedence.PRIMARY;
        }
        if (expr instanceof Expr.Constant) {
            Object value = ((Expr.Constant) expr).value;
            if (value instanceof Long && (Long) value < 0
                    || value instanceof Double && ((Double) value < 0 || isNegativeZero((Double) value))) {
                return Precedence.UNARY;
            }
        }
        return Precedence.ATOM;
    }

    private static boolean isNegativeZero(double d) {
        return d == 0 && Double.doubleToRawLongBits(d) != 0;
    }

    private static final Expr.Visitor<String> EXPR_PRINTER = new Expr.Visitor<String>() {
        @Override
        public String visitName(Expr.Name expr) {
            return expr.id;
        }

        @Override
        public String visitConstant(Expr.Constant expr) {
            return literal(expr.value);
        }

        @Override
        public String visitBoolOp(Expr.BoolOp expr) {
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < expr.values.size(); i++) {
                if (i != 0) text.append(' ').append(expr.op.symbol).append(' ');
                text.append(expr(expr.values.get(i), expr.op.precedence + 1));
            }
            return text.toString();
        }

        @Override
        public String visitBinOp(Expr.BinOp expr) {
            int p = expr.op.precedence;
            if (expr.op == BinOperator.POW) {
                return expr(expr.left, Precedence.AWAIT) + " ** " + expr(expr.right, Precedence.UNARY);
            }
            return expr(expr.left, p) + " " + expr.op.symbol + " " + expr(expr.right, p + 1);
        }

        @Override
        public String visitUnaryOp(Expr.UnaryOp expr) {
            if (expr.op == UnOperator.NOT) {
                return "not " + expr(expr.operand, Precedence.NOT);
            }
            return expr.op.symbol + expr(expr.operand, Precedence.UNARY);
        }

        @Override
        public String visitCompare(Expr.Compare expr) {
            StringBuilder text = new StringBuilder(expr(expr.left, Precedence.COMPARE + 1));
            for (int i = 0; i < expr.ops.size(); i++) {
                text.append(' ').append(expr.ops.get(i).symbol).append(' ')
                        .append(expr(expr.comparators.get(i), Precedence.COMPARE + 1));
            }
            return text.toString();
        }

        @Override
        public String visitCall(Expr.Call expr) {
            StringBuilder text = new StringBuilder(expr(expr.func, Precedence.PRIMARY)).append('(');
            boolean first = true;
            for (Expr arg : expr.args) {
                if (!first) text.append(", ");
                first = false;
                text.append(expr(arg, Precedence.LAMBDA));
            }
            for (Keyword keyword : expr.keywords) {
                if (!first) text.append(", ");
                first = false;
                if (keyword.arg == null) {
                    text.append("**").append(expr(keyword.value, Precedence.BIT_OR));
                } else {
                    text.append(keyword.arg).append('=').append(expr(keyword.value, Precedence.LAMBDA));
                }
            }
            return text.append(')').toString();
        }

        @Override
        public String visitAttribute(Expr.Attribute expr) {
            String value = expr(expr.value, Precedence.PRIMARY);
            if (expr.value instanceof Expr.Constant && ((Expr.Constant) expr.value).value instanceof Long) {
                value = "(" + value + ")";
            }
            return value + "." + expr.attr;
        }

        @Override
        public String visitSubscript(Expr.Subscript expr) {
            String slice = expr.slice instanceof Expr.Slice
                    ? expr.slice.accept(this)
                    : expr(expr.slice, Precedence.LAMBDA);
            return expr(expr.value, Precedence.PRIMARY) + "[" + slice + "]";
        }

        @Override
        public String visitSlice(Expr.Slice expr) {
            String text = expr(expr.lower, Precedence.LAMBDA) + ":" + expr(expr.upper, Precedence.LAMBDA);
            if (expr.step != null) text += ":" + expr(expr.step, Precedence.LAMBDA);
            return text;
        }

        @Override
        public String visitIfExp(Expr.IfExp expr) {
            return expr(expr.body, Precedence.IF_EXP + 1)
                    + " if " + expr(expr.test, Precedence.IF_EXP + 1)
                    + " else " + expr(expr.orelse, Precedence.IF_EXP);
        }

        @Override
        public String visitList(Expr.ListExpr expr) {
            return "[" + exprs(expr.elts) + "]";
        }

        @Override
        public String visitTuple(Expr.TupleExpr expr) {
            if (expr.elts.size() == 1) return "(" + expr(expr.elts.get(0), Precedence.LAMBDA) + ",)";
            return "(" + exprs(expr.elts) + ")";
        }

        @Override
        public String visitSet(Expr.SetExpr expr) {
            return "{" + exprs(expr.elts) + "}";
        }

        @Override
        public String visitDict(Expr.DictExpr expr) {
            StringBuilder text = new StringBuilder("{");
            for (int i = 0; i < expr.keys.size(); i++) {
                if (i != 0) text.append(", ");
                text.append(expr(expr.keys.get(i), Precedence.LAMBDA))
                        .append(": ")
                        .append(expr(expr.values.get(i), Precedence.LAMBDA));
            }
            return text.append('}').toString();
        }

        @Override
        public String visitComprehension(Expr.Comprehension expr) {
            StringBuilder text = new StringBuilder();
            String open;
            String close;
            switch (expr.kind) {
                case LIST:
                    open = "[";
                    close = "]";
                    break;
                case GENERATOR:
                    open = "(";
                    close = ")";
                    break;
                default:
                    open = "{";
                    close = "}";
            }
            text.append(open).append(expr(expr.elt, Precedence.LAMBDA));
            if (expr.kind == Expr.Comprehension.Kind.DICT) {
                text.append(": ").append(expr(expr.value, Precedence.LAMBDA));
            }
            for (ForClause clause : expr.generators) {
                text.append(" for ").append(expr(clause.target, Precedence.BIT_OR))
                        .append(" in ").append(expr(clause.iter, Precedence.OR));
                for (Expr test : clause.ifs) {
                    text.append(" if ").append(expr(test, Precedence.OR));
                }
            }
            return text.append(close).toString();
        }

        @Override
        public String visitLambda(Expr.Lambda expr) {
            String args = arguments(expr.args, false);
            return (args.isEmpty() ? "lambda: " : "lambda " + args + ": ") + expr(expr.body, Precedence.LAMBDA);
        }

        @Override
        public String visitYield(Expr.Yield expr) {
            return expr.value == null ? "yield" : "yield " + expr(expr.value, 0);
        }

        @Override
        public String visitStarred(Expr.Starred expr) {
            return "*" + expr(expr.value, Precedence.BIT_OR);
        }
    };

    // literals

    /**
     * Render a literal value the way it would be written in source.
     *
     * @param value The value, which must satisfy {@link Expr.Constant#isLiteral(Object)}.
     * @return The source text.
     */
    public static String literal(@Nullable Object value) {
        if (value == null) return "None";
        if (value instanceof Boolean) return (Boolean) value ? "True" : "False";
        if (value instanceof Long) return value.toString();
        if (value instanceof Double) return doubleRepr((Double) value);
        if (value instanceof String) return stringRepr((String) value);
        throw new IllegalArgumentException("not a literal: " + value);
    }

    public static String doubleRepr(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0) return isNegativeZero(d) ? "-0.0" : "0.0";
        double abs = Math.abs(d);
        String javaRepr = Double.toString(d);
        if (abs >= 1e-4 && abs < 1e16) {
            String plain = new BigDecimal(javaRepr).toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }
        int e = javaRepr.indexOf('E');
        String mantissa = javaRepr.substring(0, e);
        if (mantissa.endsWith(".0")) mantissa = mantissa.substring(0, mantissa.length() - 2);
        int exponent = Integer.parseInt(javaRepr.substring(e + 1));
        String digits = Integer.toString(Math.abs(exponent));
        if (digits.length() < 2) digits = "0" + digits;
        return mantissa + "e" + (exponent < 0 ? "-" : "+") + digits;
    }

    public static String stringRepr(String s) {
        char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder text = new StringBuilder().append(quote);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\':
                    text.append("\\\\");
                    break;
                case '\n':
                    text.append("\\n");
                    break;
                case '\r':
                    text.append("\\r");
                    break;
                case '\t':
                    text.append("\\t");
                    break;
                default:
                    if (c == quote) {
                        text.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        text.append(String.format("\\x%02x", (int) c));
                    } else {
                        text.append(c);
                    }
            }
        }
        return text.append(quote).toString();
    }
}
