package io.github.eutro.peval.core.passes.misc;

import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.TreePass;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A pass that runs another pass repeatedly, until it stops changing the {@link Specimen}.
 * <p>
 * The number of runs is bounded; if the limit is reached, the last result is returned as is.
 */
public class FixpointPass implements TreePass<Specimen, Specimen> {
    private static final Logger LOGGER = LoggerFactory.getLogger(FixpointPass.class);

    /**
     * The default maximum number of runs.
     */
    public static final int DEFAULT_MAX_ITERATIONS = 64;

    private final TreePass<Specimen, Specimen> pass;
    private final int maxIterations;
    @Nullable
    private final Listener listener;

    /**
     * Notified after each run of the pass.
     */
    @FunctionalInterface
    public interface Listener {
        /**
         * Called after a run of the pass.
         *
         * @param iteration The number of the run, from 0.
         * @param result    The result of the run.
         * @param changed   Whether the run changed anything.
         */
        void onIteration(int iteration, Specimen result, boolean changed);
    }

    public FixpointPass(TreePass<Specimen, Specimen> pass, int maxIterations, @Nullable Listener listener) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        this.pass = pass;
        this.maxIterations = maxIterations;
        this.listener = listener;
    }

    public FixpointPass(TreePass<Specimen, Specimen> pass) {
        this(pass, DEFAULT_MAX_ITERATIONS, null);
    }

    @Override
    public Specimen run(Specimen specimen) {
        Specimen current = specimen;
        for (int i = 0; i < maxIterations; i++) {
            Specimen next = pass.run(current);
            boolean changed = !next.sameAs(current);
            LOGGER.debug("iteration {} of {}: {}", i, current.tree.name, changed ? "changed" : "unchanged");
            if (listener != null) listener.onIteration(i, next, changed);
            if (!changed) return next;
            current = next;
        }
        LOGGER.warn("{} did not converge after {} iterations", specimen.tree.name, maxIterations);
        return current;
    }
}
