package io.github.eutro.peval.core.parse;

import io.github.eutro.peval.core.tree.*;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A recursive-descent parser from source text to a syntax tree.
 */
public class Parser {
    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield"
    ));
    private static final Set<String> UNSUPPORTED = new HashSet<>(Arrays.asList(
            "class", "del", "from", "global", "import", "nonlocal", "await"
    ));

    private final List<Token> tokens;
    private int pos = 0;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parse a whole source file.
     *
     * @param src The source text.
     * @return The module.
     * @throws ParseException If the source is not valid.
     */
    public static ModuleNode parseModule(String src) {
        Parser parser = new Parser(Lexer.tokenize(src));
        List<Stmt> body = new ArrayList<>();
        while (parser.peek().type != Token.Type.EOF) {
            body.addAll(parser.statement());
        }
        return new ModuleNode(body);
    }

    /**
     * Parse a source file containing exactly one function definition.
     *
     * @param src The source text.
     * @return The function definition.
     * @throws ParseException If the source is not valid, or is not a single function definition.
     */
    public static Stmt.FunctionDef parseFunction(String src) {
        ModuleNode module = parseModule(src);
        if (module.body.size() != 1 || !(module.body.get(0) instanceof Stmt.FunctionDef)) {
            throw new ParseException("expected a single function definition", 1, 1);
        }
        return (Stmt.FunctionDef) module.body.get(0);
    }

    /**
     * Parse a single expression.
     *
     * @param src The source text.
     * @return The expression.
     * @throws ParseException If the source is not a single valid expression.
     */
    public static Expr parseExpression(String src) {
        Parser parser = new Parser(Lexer.tokenize(src));
        Expr expr = parser.testList();
        parser.accept(Token.Type.NEWLINE);
        parser.expect(Token.Type.EOF, "end of input");
        return expr;
    }

    // token handling

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token next() {
        Token token = tokens.get(pos);
        if (token.type != Token.Type.EOF) pos++;
        return token;
    }

    private ParseException error(String message) {
        Token token = peek();
        return new ParseException(message, token.line, token.column);
    }

    private ParseException unexpected() {
        return error("unexpected " + peek());
    }

    private boolean atOp(String op) {
        return peek().isOp(op);
    }

    private boolean atKeyword(String keyword) {
        return peek().is(Token.Type.NAME, keyword);
    }

    private boolean acceptOp(String op) {
        if (atOp(op)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (atKeyword(keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean accept(Token.Type type) {
        if (peek().type == type) {
            next();
            return true;
        }
        return false;
    }

    private void expectOp(String op) {
        if (!acceptOp(op)) throw error("expected '" + op + "' but found " + peek());
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) throw error("expected '" + keyword + "' but found " + peek());
    }

    private Token expect(Token.Type type, String what) {
        if (peek().type != type) throw error("expected " + what + " but found " + peek());
        return next();
    }

    private String identifier() {
        Token token = peek();
        if (token.type != Token.Type.NAME || KEYWORDS.contains(token.text)) {
            throw error("expected identifier but found " + token);
        }
        next();
        return token.text;
    }

    // statements

    private List<Stmt> statement() {
        Token token = peek();
        if (token.type == Token.Type.INDENT) throw error("unexpected indent");
        if (token.type == Token.Type.NAME) {
            switch (token.text) {
                case "if":
                    return Collections.singletonList(ifStatement());
                case "while":
                    return Collections.singletonList(whileStatement());
                case "for":
                    return Collections.singletonList(forStatement());
                case "try":
                    return Collections.singletonList(tryStatement());
                case "with":
                    return Collections.singletonList(withStatement());
                case "def":
                    return Collections.singletonList(functionDef(Collections.emptyList(), false));
                case "async":
                    next();
                    if (!atKeyword("def")) throw error("expected 'def' after 'async'");
                    return Collections.singletonList(functionDef(Collections.emptyList(), true));
                default:
                    if (UNSUPPORTED.contains(token.text)) {
                        throw error("unsupported statement '" + token.text + "'");
                    }
            }
        } else if (token.isOp("@")) {
            return Collections.singletonList(decorated());
        }
        return simpleStatements();
    }

    private List<Stmt> simpleStatements() {
        List<Stmt> stmts = new ArrayList<>();
        stmts.add(simpleStatement());
        while (acceptOp(";")) {
            if (peek().type == Token.Type.NEWLINE) break;
            stmts.add(simpleStatement());
        }
        expect(Token.Type.NEWLINE, "end of line");
        return stmts;
    }

    private Stmt simpleStatement() {
        Token token = peek();
        if (token.type == Token.Type.NAME) {
            switch (token.text) {
                case "pass":
                    next();
                    return new Stmt.Pass();
                case "break":
                    next();
                    return new Stmt.Break();
                case "continue":
                    next();
                    return new Stmt.Continue();
                case "return":
                    next();
                    return new Stmt.Return(atEndOfSimpleStatement() ? null : testList());
                case "raise":
                    next();
                    return new Stmt.Raise(atEndOfSimpleStatement() ? null : test());
                case "assert": {
                    next();
                    Expr test = test();
                    Expr msg = acceptOp(",") ? test() : null;
                    return new Stmt.Assert(test, msg);
                }
                default:
                    if (UNSUPPORTED.contains(token.text)) {
                        throw error("unsupported statement '" + token.text + "'");
                    }
            }
        }
        return expressionStatement();
    }

    private boolean atEndOfSimpleStatement() {
        return peek().type == Token.Type.NEWLINE || atOp(";");
    }

    private Stmt expressionStatement() {
        Expr first = atKeyword("yield") ? yieldExpr() : testList();
        if (atOp("=")) {
            List<Expr> targets = new ArrayList<>();
            Expr value = first;
            while (acceptOp("=")) {
                checkAssignTarget(value, true);
                targets.add(value);
                value = atKeyword("yield") ? yieldExpr() : testList();
            }
            return new Stmt.Assign(targets, value);
        }
        if (atOp(":")) {
            next();
            checkAssignTarget(first, false);
            Expr annotation = test();
            Expr value = acceptOp("=") ? testList() : null;
            return new Stmt.AnnAssign(first, annotation, value);
        }
        Token token = peek();
        if (token.type == Token.Type.OP && token.text.length() >= 2 && token.text.endsWith("=")
                && !token.text.equals("==") && !token.text.equals("<=") && !token.text.equals(">=")
                && !token.text.equals("!=")) {
            BinOperator op = BinOperator.fromSymbol(token.text.substring(0, token.text.length() - 1));
            if (op != null) {
                next();
                checkAssignTarget(first, false);
                Expr value = atKeyword("yield") ? yieldExpr() : testList();
                return new Stmt.AugAssign(first, op, value);
            }
        }
        return new Stmt.ExprStmt(first);
    }

    private void checkAssignTarget(Expr target, boolean allowUnpacking) {
        if (target instanceof Expr.Name || target instanceof Expr.Attribute || target instanceof Expr.Subscript) {
            return;
        }
        if (allowUnpacking && (target instanceof Expr.TupleExpr || target instanceof Expr.ListExpr)) {
            List<Expr> elts = target instanceof Expr.TupleExpr
                    ? ((Expr.TupleExpr) target).elts
                    : ((Expr.ListExpr) target).elts;
            for (Expr elt : elts) {
                checkAssignTarget(elt, true);
            }
            return;
        }
        throw error("cannot assign to " + target.getClass().getSimpleName());
    }

    private List<Stmt> block() {
        expectOp(":");
        if (accept(Token.Type.NEWLINE)) {
            expect(Token.Type.INDENT, "an indented block");
            List<Stmt> body = new ArrayList<>();
            while (!accept(Token.Type.DEDENT)) {
                body.addAll(statement());
            }
            return body;
        }
        return simpleStatements();
    }

    private Stmt ifStatement() {
        next();
        Expr test = namedTest();
        List<Stmt> body = block();
        List<Stmt> orelse;
        if (atKeyword("elif")) {
            orelse = Collections.singletonList(ifStatement());
        } else if (acceptKeyword("else")) {
            orelse = block();
        } else {
            orelse = Collections.emptyList();
        }
        return new Stmt.If(test, body, orelse);
    }

    private Expr namedTest() {
        return test();
    }

    private Stmt whileStatement() {
        next();
        Expr test = namedTest();
        List<Stmt> body = block();
        List<Stmt> orelse = acceptKeyword("else") ? block() : Collections.emptyList();
        return new Stmt.While(test, body, orelse);
    }

    private Stmt forStatement() {
        next();
        Expr target = targetList();
        expectKeyword("in");
        Expr iter = testList();
        List<Stmt> body = block();
        List<Stmt> orelse = acceptKeyword("else") ? block() : Collections.emptyList();
        return new Stmt.For(target, iter, body, orelse);
    }

    private Stmt tryStatement() {
        next();
        List<Stmt> body = block();
        List<ExceptHandler> handlers = new ArrayList<>();
        while (atKeyword("except")) {
            next();
            Expr type = null;
            String name = null;
            if (!atOp(":")) {
                type = test();
                if (acceptKeyword("as")) name = identifier();
            }
            handlers.add(new ExceptHandler(type, name, block()));
        }
        List<Stmt> orelse = Collections.emptyList();
        if (!handlers.isEmpty() && acceptKeyword("else")) {
            orelse = block();
        }
        List<Stmt> finalbody = Collections.emptyList();
        if (acceptKeyword("finally")) {
            finalbody = block();
        }
        if (handlers.isEmpty() && finalbody.isEmpty()) {
            throw error("expected 'except' or 'finally' block");
        }
        return new Stmt.Try(body, handlers, orelse, finalbody);
    }

    private Stmt withStatement() {
        next();
        List<WithItem> items = new ArrayList<>();
        do {
            Expr context = test();
            Expr vars = null;
            if (acceptKeyword("as")) {
                vars = expr();
                checkAssignTarget(vars, true);
            }
            items.add(new WithItem(context, vars));
        } while (acceptOp(","));
        return new Stmt.With(items, block());
    }

    private Stmt decorated() {
        List<Expr> decorators = new ArrayList<>();
        while (acceptOp("@")) {
            decorators.add(test());
            expect(Token.Type.NEWLINE, "end of line");
        }
        boolean isAsync = acceptKeyword("async");
        if (!atKeyword("def")) throw error("expected function definition after decorator");
        return functionDef(decorators, isAsync);
    }

    private Stmt.FunctionDef functionDef(List<Expr> decorators, boolean isAsync) {
        expectKeyword("def");
        String name = identifier();
        expectOp("(");
        Arguments args = parameters(")", true);
        expectOp(")");
        Expr returns = acceptOp("->") ? test() : null;
        List<Stmt> body = block();
        return new Stmt.FunctionDef(name, args, body, decorators, returns, isAsync);
    }

    private Arguments parameters(String terminator, boolean allowAnnotations) {
        List<Param> params = new ArrayList<>();
        Param vararg = null;
        Param kwarg = null;
        Set<String> seen = new HashSet<>();
        while (!atOp(terminator)) {
            if (kwarg != null) throw error("parameter after **" + kwarg.name);
            if (acceptOp("**")) {
                kwarg = new Param(paramName(seen), paramAnnotation(allowAnnotations), null);
            } else if (acceptOp("*")) {
                if (vararg != null) throw error("duplicate *parameter");
                vararg = new Param(paramName(seen), paramAnnotation(allowAnnotations), null);
            } else {
                if (vararg != null) throw error("keyword-only parameters are not supported");
                String name = paramName(seen);
                Expr annotation = paramAnnotation(allowAnnotations);
                Expr defaultValue = acceptOp("=") ? test() : null;
                if (defaultValue == null && !params.isEmpty() && params.get(params.size() - 1).defaultValue != null) {
                    throw error("non-default parameter follows default parameter");
                }
                params.add(new Param(name, annotation, defaultValue));
            }
            if (!acceptOp(",")) break;
        }
        return new Arguments(params, vararg, kwarg);
    }

    private String paramName(Set<String> seen) {
        String name = identifier();
        if (!seen.add(name)) throw error("duplicate parameter '" + name + "'");
        return name;
    }

    private Expr paramAnnotation(boolean allowAnnotations) {
        return allowAnnotations && acceptOp(":") ? test() : null;
    }

    // expressions

    private Expr testList() {
        Expr first = test();
        if (!atOp(",")) return first;
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (!startsExpression()) break;
            elts.add(test());
        }
        return new Expr.TupleExpr(elts);
    }

    private Expr targetList() {
        Expr first = expr();
        if (!atOp(",")) {
            checkAssignTarget(first, true);
            return first;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (atKeyword("in") || atOp("=")) break;
            elts.add(expr());
        }
        Expr target = new Expr.TupleExpr(elts);
        checkAssignTarget(target, true);
        return target;
    }

    private boolean startsExpression() {
        Token token = peek();
        switch (token.type) {
            case NAME:
                return !KEYWORDS.contains(token.text)
                        || token.text.equals("None") || token.text.equals("True") || token.text.equals("False")
                        || token.text.equals("not") || token.text.equals("lambda");
            case NUMBER:
            case STRING:
                return true;
            case OP:
                switch (token.text) {
                    case "(":
                    case "[":
                    case "{":
                    case "-":
                    case "+":
                    case "~":
                        return true;
                }
                return false;
            default:
                return false;
        }
    }

    private Expr yieldExpr() {
        expectKeyword("yield");
        if (atOp(")") || atOp("=") || peek().type == Token.Type.NEWLINE || atOp(";")) {
            return new Expr.Yield(null);
        }
        return new Expr.Yield(testList());
    }

    private Expr test() {
        if (atKeyword("lambda")) return lambda();
        Expr body = orTest();
        if (acceptKeyword("if")) {
            Expr test = orTest();
            expectKeyword("else");
            Expr orelse = test();
            return new Expr.IfExp(test, body, orelse);
        }
        return body;
    }

    private Expr lambda() {
        expectKeyword("lambda");
        Arguments args = parameters(":", false);
        expectOp(":");
        return new Expr.Lambda(args, test());
    }

    private Expr orTest() {
        Expr first = andTest();
        if (!atKeyword("or")) return first;
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("or")) {
            values.add(andTest());
        }
        return new Expr.BoolOp(BoolOperator.OR, values);
    }

    private Expr andTest() {
        Expr first = notTest();
        if (!atKeyword("and")) return first;
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("and")) {
            values.add(notTest());
        }
        return new Expr.BoolOp(BoolOperator.AND, values);
    }

    private Expr notTest() {
        if (acceptKeyword("not")) {
            return new Expr.UnaryOp(UnOperator.NOT, notTest());
        }
        return comparison();
    }

    private Expr comparison() {
        Expr left = expr();
        List<CmpOperator> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        while (true) {
            CmpOperator op = compOp();
            if (op == null) break;
            ops.add(op);
            comparators.add(expr());
        }
        return ops.isEmpty() ? left : new Expr.Compare(left, ops, comparators);
    }

    @Nullable
    private CmpOperator compOp() {
        Token token = peek();
        if (token.type == Token.Type.OP) {
            switch (token.text) {
                case "==":
                    next();
                    return CmpOperator.EQ;
                case "!=":
                    next();
                    return CmpOperator.NOT_EQ;
                case "<":
                    next();
                    return CmpOperator.LT;
                case "<=":
                    next();
                    return CmpOperator.LT_E;
                case ">":
                    next();
                    return CmpOperator.GT;
                case ">=":
                    next();
                    return CmpOperator.GT_E;
            }
        } else if (token.is(Token.Type.NAME, "in")) {
            next();
            return CmpOperator.IN;
        } else if (token.is(Token.Type.NAME, "is")) {
            next();
            return acceptKeyword("not") ? CmpOperator.IS_NOT : CmpOperator.IS;
        } else if (token.is(Token.Type.NAME, "not") && peek(1).is(Token.Type.NAME, "in")) {
            next();
            next();
            return CmpOperator.NOT_IN;
        }
        return null;
    }

    private Expr expr() {
        return binary(0);
    }

    private static final String[][] BINARY_LEVELS = {
            {"|"},
            {"^"},
            {"&"},
            {"<<", ">>"},
            {"+", "-"},
            {"*", "/", "//", "%"},
    };

    private Expr binary(int level) {
        if (level == BINARY_LEVELS.length) return factor();
        Expr left = binary(level + 1);
        outer:
        while (true) {
            for (String symbol : BINARY_LEVELS[level]) {
                if (atOp(symbol)) {
                    next();
                    Expr right = binary(level + 1);
                    left = new Expr.BinOp(left, BinOperator.fromSymbol(symbol), right);
                    continue outer;
                }
            }
            return left;
        }
    }

    private Expr factor() {
        if (acceptOp("-")) return new Expr.UnaryOp(UnOperator.NEG, factor());
        if (acceptOp("+")) return new Expr.UnaryOp(UnOperator.POS, factor());
        if (acceptOp("~")) return new Expr.UnaryOp(UnOperator.INVERT, factor());
        return power();
    }

    private Expr power() {
        Expr base = atomExpr();
        if (acceptOp("**")) {
            return new Expr.BinOp(base, BinOperator.POW, factor());
        }
        return base;
    }

    private Expr atomExpr() {
        Expr expr = atom();
        while (true) {
            if (acceptOp("(")) {
                expr = callArguments(expr);
            } else if (acceptOp("[")) {
                Expr slice = subscriptList();
                expectOp("]");
                expr = new Expr.Subscript(expr, slice);
            } else if (acceptOp(".")) {
                expr = new Expr.Attribute(expr, identifier());
            } else {
                return expr;
            }
        }
    }

    private Expr callArguments(Expr func) {
        List<Expr> args = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        while (!atOp(")")) {
            if (acceptOp("**")) {
                keywords.add(new Keyword(null, test()));
            } else if (acceptOp("*")) {
                if (!keywords.isEmpty()) throw error("iterable argument unpacking follows keyword argument");
                args.add(new Expr.Starred(test()));
            } else if (peek().type == Token.Type.NAME && peek(1).isOp("=")) {
                String name = identifier();
                next();
                for (Keyword keyword : keywords) {
                    if (name.equals(keyword.arg)) throw error("keyword argument repeated: " + name);
                }
                keywords.add(new Keyword(name, test()));
            } else {
                if (!keywords.isEmpty()) throw error("positional argument follows keyword argument");
                Expr arg = test();
                if (atKeyword("for")) {
                    arg = new Expr.Comprehension(Expr.Comprehension.Kind.GENERATOR, arg, null, forClauses());
                }
                args.add(arg);
            }
            if (!acceptOp(",")) break;
        }
        expectOp(")");
        return new Expr.Call(func, args, keywords);
    }

    private Expr subscriptList() {
        Expr first = subscript();
        if (!atOp(",")) return first;
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (atOp("]")) break;
            elts.add(subscript());
        }
        return new Expr.TupleExpr(elts);
    }

    private Expr subscript() {
        Expr lower = null;
        if (!atOp(":")) {
            lower = test();
            if (!atOp(":")) return lower;
        }
        expectOp(":");
        Expr upper = atOp(":") || atOp("]") || atOp(",") ? null : test();
        Expr step = null;
        if (acceptOp(":")) {
            step = atOp("]") || atOp(",") ? null : test();
        }
        return new Expr.Slice(lower, upper, step);
    }

    private Expr atom() {
        Token token = peek();
        switch (token.type) {
            case NUMBER:
                next();
                return new Expr.Constant(token.value);
            case STRING: {
                StringBuilder sb = new StringBuilder();
                while (peek().type == Token.Type.STRING) {
                    sb.append((String) next().value);
                }
                return new Expr.Constant(sb.toString());
            }
            case NAME:
                switch (token.text) {
                    case "None":
                        next();
                        return Expr.Constant.none();
                    case "True":
                        next();
                        return Expr.Constant.of(true);
                    case "False":
                        next();
                        return Expr.Constant.of(false);
                }
                return new Expr.Name(identifier());
            case OP:
                switch (token.text) {
                    case "(":
                        next();
                        return parenthesized();
                    case "[":
                        next();
                        return listDisplay();
                    case "{":
                        next();
                        return braceDisplay();
                }
                break;
        }
        throw unexpected();
    }

    private Expr parenthesized() {
        if (acceptOp(")")) return new Expr.TupleExpr(Collections.emptyList());
        if (atKeyword("yield")) {
            Expr yield = yieldExpr();
            expectOp(")");
            return yield;
        }
        Expr first = test();
        if (atKeyword("for")) {
            Expr gen = new Expr.Comprehension(Expr.Comprehension.Kind.GENERATOR, first, null, forClauses());
            expectOp(")");
            return gen;
        }
        if (acceptOp(")")) return first;
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (atOp(")")) break;
            elts.add(test());
        }
        expectOp(")");
        return new Expr.TupleExpr(elts);
    }

    private Expr listDisplay() {
        if (acceptOp("]")) return new Expr.ListExpr(Collections.emptyList());
        Expr first = test();
        if (atKeyword("for")) {
            Expr comp = new Expr.Comprehension(Expr.Comprehension.Kind.LIST, first, null, forClauses());
            expectOp("]");
            return comp;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (atOp("]")) break;
            elts.add(test());
        }
        expectOp("]");
        return new Expr.ListExpr(elts);
    }

    private Expr braceDisplay() {
        if (acceptOp("}")) return new Expr.DictExpr(Collections.emptyList(), Collections.emptyList());
        Expr first = test();
        if (acceptOp(":")) {
            Expr firstValue = test();
            if (atKeyword("for")) {
                Expr comp = new Expr.Comprehension(Expr.Comprehension.Kind.DICT, first, firstValue, forClauses());
                expectOp("}");
                return comp;
            }
            List<Expr> keys = new ArrayList<>();
            List<Expr> values = new ArrayList<>();
            keys.add(first);
            values.add(firstValue);
            while (acceptOp(",")) {
                if (atOp("}")) break;
                keys.add(test());
                expectOp(":");
                values.add(test());
            }
            expectOp("}");
            return new Expr.DictExpr(keys, values);
        }
        if (atKeyword("for")) {
            Expr comp = new Expr.Comprehension(Expr.Comprehension.Kind.SET, first, null, forClauses());
            expectOp("}");
            return comp;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (atOp("}")) break;
            elts.add(test());
        }
        expectOp("}");
        return new Expr.SetExpr(elts);
    }

    private List<ForClause> forClauses() {
        List<ForClause> clauses = new ArrayList<>();
        while (acceptKeyword("for")) {
            Expr target = targetList();
            expectKeyword("in");
            Expr iter = orTest();
            List<Expr> ifs = new ArrayList<>();
            while (acceptKeyword("if")) {
                ifs.add(orTest());
            }
            clauses.add(new ForClause(target, iter, ifs));
        }
        return clauses;
    }
}
