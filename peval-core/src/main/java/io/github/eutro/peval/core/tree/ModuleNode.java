package io.github.eutro.peval.core.tree;

import java.util.Collections;
import java.util.List;

/**
 * A parsed source file: a sequence of top-level statements.
 */
public final class ModuleNode extends Node {
    public final List<Stmt> body;

    public ModuleNode(List<? extends Stmt> body) {
        this.body = copy(body);
    }

    @Override
    public List<Object> fields() {
        return Collections.singletonList(body);
    }

    @Override
    public ModuleNode withFields(List<Object> fields) {
        return new ModuleNode(listField(fields.get(0)));
    }
}
