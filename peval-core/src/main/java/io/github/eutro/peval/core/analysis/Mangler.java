package io.github.eutro.peval.core.analysis;

import io.github.eutro.peval.core.tree.ExceptHandler;
import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.tree.Node;
import io.github.eutro.peval.core.tree.Param;
import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.TreeTransformer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Renames the local variables and parameters of a function to fresh names.
 * <p>
 * Names are assigned in order of first occurrence, so parameters come first. Free names,
 * and the name of the function itself, are left alone.
 */
public final class Mangler extends TreeTransformer {
    private final Set<String> locals;
    private final Map<String, String> mangled = new LinkedHashMap<>();
    private GenSym genSym;

    private Mangler(Set<String> locals, GenSym genSym) {
        this.locals = locals;
        this.genSym = genSym;
    }

    /**
     * A mangled function, and the generator to use after it.
     */
    public static final class Mangled {
        public final Stmt.FunctionDef tree;
        public final GenSym genSym;

        Mangled(Stmt.FunctionDef tree, GenSym genSym) {
            this.tree = tree;
            this.genSym = genSym;
        }
    }

    /**
     * Mangle a function.
     *
     * @param genSym The fresh name generator.
     * @param def    The function.
     * @return The mangled function, and the generator to use afterwards.
     */
    public static Mangled mangle(GenSym genSym, Stmt.FunctionDef def) {
        Mangler mangler = new Mangler(Scope.analyze(def).locals, genSym);
        Stmt.FunctionDef out = mangler.transformChildren(def);
        return new Mangled(out, mangler.genSym);
    }

    private String rename(String name) {
        if (!locals.contains(name)) return name;
        String newName = mangled.get(name);
        if (newName == null) {
            GenSym.Fresh fresh = genSym.next("mangled");
            newName = fresh.name;
            genSym = fresh.genSym;
            mangled.put(name, newName);
        }
        return newName;
    }

    @Override
    public Expr visitExpr(Expr expr) {
        if (expr instanceof Expr.Name) {
            String id = ((Expr.Name) expr).id;
            String newId = rename(id);
            return newId.equals(id) ? expr : new Expr.Name(newId);
        }
        return super.visitExpr(expr);
    }

    @Override
    public Node visitOther(Node node) {
        if (node instanceof Param) {
            Param param = (Param) node;
            String newName = rename(param.name);
            return transformChildren(newName.equals(param.name) ? param : param.withName(newName));
        } else if (node instanceof ExceptHandler) {
            ExceptHandler handler = (ExceptHandler) node;
            if (handler.name == null) return transformChildren(handler);
            Expr type = handler.type == null ? null : visitExpr(handler.type);
            String newName = rename(handler.name);
            return new ExceptHandler(type, newName, visitBlock(handler.body));
        }
        return super.visitOther(node);
    }
}
