package io.github.eutro.peval.core.passes.misc;

import io.github.eutro.peval.core.passes.TreePass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;

/**
 * Two passes, run one after the other.
 *
 * @param <A> The input type of the first pass.
 * @param <B> The result type of the first pass, and input type of the second.
 * @param <C> The result type of the second pass.
 */
public class ChainedPass<A, B, C> implements TreePass<A, C> {
    private final TreePass<A, B> firstPass;
    private final TreePass<B, C> nextPass;

    public ChainedPass(TreePass<A, B> firstPass, TreePass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    /**
     * Get the passes of this chain, flattened, in the order they are run.
     *
     * @return The passes.
     */
    @SuppressWarnings("unchecked")
    public List<TreePass<Object, Object>> listPasses() {
        List<TreePass<?, ?>> passes = new ArrayList<>();
        TreePass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> cPass = (ChainedPass<?, ?, ?>) pass;
            passes.add(cPass.nextPass);
            pass = cPass.firstPass;
        }
        passes.add(pass);
        Collections.reverse(passes);
        return (List<TreePass<Object, Object>>) (Object) passes;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        ListIterator<TreePass<Object, Object>> li = listPasses().listIterator();
        Object acc = a;
        while (li.hasNext()) {
            try {
                acc = li.next().run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("running pass " + li.previousIndex() + " in chain"));
                throw e;
            }
        }
        return (C) acc;
    }
}
