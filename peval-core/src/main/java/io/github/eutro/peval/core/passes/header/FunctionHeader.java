package io.github.eutro.peval.core.passes.header;

import io.github.eutro.peval.core.analysis.GenSym;
import io.github.eutro.peval.core.eval.EvalState;
import io.github.eutro.peval.core.eval.Evaluation;
import io.github.eutro.peval.core.eval.ExpressionEvaluator;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.TreePass;
import io.github.eutro.peval.core.tree.Arguments;
import io.github.eutro.peval.core.tree.Expr;
import io.github.eutro.peval.core.tree.Param;
import io.github.eutro.peval.core.tree.Stmt;
import io.github.eutro.peval.core.tree.Trees;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Folds the annotations of the parameters and the return type of a function.
 * <p>
 * Annotations are evaluated once, when the function is defined, so this only needs to run before the
 * body is optimized. A known annotation read from a name keeps that name; any other is bound to a fresh one.
 */
public class FunctionHeader implements TreePass<Specimen, Specimen> {
    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionHeader.class);

    /**
     * An instance of this pass.
     */
    public static final FunctionHeader INSTANCE = new FunctionHeader();

    @Override
    public Specimen run(Specimen specimen) {
        Stmt.FunctionDef tree = specimen.tree;
        Folder folder = new Folder(GenSym.forTree(tree), specimen.bindings);
        List<Param> params = new ArrayList<>(tree.args.params.size());
        for (Param param : tree.args.params) {
            params.add(folder.fold(param));
        }
        Arguments args = new Arguments(params, folder.fold(tree.args.vararg), folder.fold(tree.args.kwarg));
        Expr returns = folder.fold(tree.returns);
        Stmt.FunctionDef newTree = new Stmt.FunctionDef(tree.name, args, tree.body, tree.decorators, returns, tree.isAsync);
        if (Trees.equal(newTree, tree)) return specimen;
        LOGGER.debug("folded header of {}, adding bindings {}", tree.name, folder.state.tempBindings.keySet());
        return specimen.withTree(newTree).withBindings(folder.state.tempBindings);
    }

    private static final class Folder {
        private final Map<String, ?> bindings;
        private EvalState state;

        Folder(GenSym genSym, Map<String, ?> bindings) {
            this.bindings = bindings;
            this.state = EvalState.of(genSym);
        }

        @Nullable
        Expr fold(@Nullable Expr expr) {
            if (expr == null) return null;
            Evaluation evaluation = ExpressionEvaluator.evaluate(state, expr, bindings);
            state = evaluation.state;
            return evaluation.node;
        }

        @Nullable
        Param fold(@Nullable Param param) {
            if (param == null || param.annotation == null) return param;
            return new Param(param.name, fold(param.annotation), param.defaultValue);
        }
    }
}
