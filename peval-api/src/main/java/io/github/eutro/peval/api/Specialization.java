package io.github.eutro.peval.api;

import io.github.eutro.peval.api.events.*;
import io.github.eutro.peval.core.function.FunctionSource;
import io.github.eutro.peval.core.passes.Passes;
import io.github.eutro.peval.core.passes.Specimen;
import io.github.eutro.peval.core.passes.TreePass;
import io.github.eutro.peval.core.passes.header.FunctionHeader;
import io.github.eutro.peval.core.passes.misc.FixpointPass;
import io.github.eutro.peval.core.runtime.UserFunction;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The specialization of a single function.
 * <p>
 * Specialization, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunSpecializationEvent} is fired on the {@link PartialEvaluator evaluator}.</li>
 *     <li>{@link ModifyPassesEvent} is fired.</li>
 *     <li>The annotations of the function are {@link FunctionHeader folded}.</li>
 *     <li>The round of passes is run repeatedly, firing {@link IterationEvent} after each run,
 *     until the function and its bindings stop changing.</li>
 *     <li>{@link SpecializedEvent} is fired.</li>
 *     <li>The function is put back together, with the new bindings as globals.</li>
 * </ol>
 */
public class Specialization extends EventSupplier<SpecializationEvent> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Specialization.class);

    private final PartialEvaluator evaluator;

    /**
     * The function being specialized.
     */
    @NotNull
    public FunctionSource source;

    Specialization(PartialEvaluator evaluator, @NotNull FunctionSource source) {
        this.evaluator = evaluator;
        this.source = source;
    }

    /**
     * Run the specialization.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The specialized function.
     */
    public UserFunction run() {
        evaluator.dispatch(RunSpecializationEvent.class, new RunSpecializationEvent(this));
        ModifyPassesEvent passesEvent = dispatch(ModifyPassesEvent.class,
                new ModifyPassesEvent(Passes.STANDARD, evaluator.getMaxIterations()));

        FixpointPass.Listener listener = null;
        if (hasListeners(IterationEvent.class)) {
            listener = (iteration, result, changed) ->
                    dispatch(IterationEvent.class, new IterationEvent(iteration, result, changed));
        }
        TreePass<Specimen, Specimen> pipeline = Passes.pipeline(
                passesEvent.passes,
                passesEvent.maxIterations,
                listener);
        LOGGER.debug("specializing {}", source.tree.name);
        Specimen specimen = pipeline.run(new Specimen(source.tree, source.bindings));
        specimen = dispatch(SpecializedEvent.class, new SpecializedEvent(specimen)).specimen;

        return source.replace(specimen.tree, specimen.bindings).toFunction();
    }
}
