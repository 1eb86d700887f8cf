package io.github.eutro.relift.embed;

import io.github.eutro.relift.core.frontend.DecodedInstruction;
import io.github.eutro.relift.core.frontend.Lifter;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.ir.PcodeListing;
import io.github.eutro.relift.core.passes.IRPass;
import io.github.eutro.relift.core.passes.convert.BuildCfg;
import io.github.eutro.relift.core.passes.form.SSAify;
import io.github.eutro.relift.core.passes.meta.ComputeDoms;
import io.github.eutro.relift.core.passes.meta.ComputePostDoms;
import io.github.eutro.relift.core.passes.meta.InferTypes;
import io.github.eutro.relift.core.passes.meta.RecoverStructure;
import io.github.eutro.relift.core.render.PseudocodeRenderer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the decompilation pipeline: translate, build the control flow graph, rename into SSA form,
 * infer types, recover structure, and render.
 * <p>
 * Each function is decompiled with its own translator and its own IR, so a decompiler can be used
 * from several threads at once.
 */
public class Decompiler {
    private static final Logger logger = LogManager.getLogger(Decompiler.class);

    private final DecompilerOptions options;
    private final IRPass<PcodeListing, Function> cfg;
    private final IRPass<Function, Function> ssa;
    private final IRPass<Function, Function> structure;

    public Decompiler() {
        this(DecompilerOptions.defaults());
    }

    public Decompiler(DecompilerOptions options) {
        this.options = options;
        cfg = new BuildCfg(options.getMemoryImage(), options.getMaxTableEntries())
                .then(ComputeDoms.INSTANCE)
                .then(ComputePostDoms.INSTANCE);
        ssa = new SSAify(options.isVerifySsa());
        structure = new RecoverStructure(options.getMinSwitchCases(), options.getStructureStepBudget());
    }

    public DecompilerOptions getOptions() {
        return options;
    }

    /**
     * Decompile one function, up to the configured {@link DecompilerOptions#getStopStage() stop stage}.
     *
     * @param stream The decoded instructions, in address order.
     * @param start  The entry address of the function.
     * @return The outputs.
     * @throws FunctionRefusedException If the function could not be decompiled.
     */
    public Decompilation decompile(List<DecodedInstruction> stream, long start) {
        Decompilation result = new Decompilation(start);
        try {
            run(stream, start, result);
        } catch (FunctionRefusedException e) {
            throw e;
        } catch (RuntimeException | StackOverflowError e) {
            throw new FunctionRefusedException(start, e);
        }
        return result;
    }

    /**
     * Decompile many functions in parallel. A function that fails does not affect the others; its
     * result carries the {@link Decompilation#getFailure() failure} and whatever completed before it.
     *
     * @param functions The instructions of each function, by entry address.
     * @return The outputs, by entry address.
     */
    public Map<Long, Decompilation> decompileAll(Map<Long, List<DecodedInstruction>> functions) {
        Map<Long, Decompilation> results = new TreeMap<>();
        if (functions.isEmpty()) return results;

        int threads = Math.max(1, Math.min(options.getParallelism(), functions.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            Map<Long, Future<Decompilation>> futures = new TreeMap<>();
            for (Map.Entry<Long, List<DecodedInstruction>> entry : functions.entrySet()) {
                long start = entry.getKey();
                List<DecodedInstruction> stream = entry.getValue();
                futures.put(start, executor.submit(() -> decompileIsolated(stream, start)));
            }
            for (Map.Entry<Long, Future<Decompilation>> entry : futures.entrySet()) {
                try {
                    results.put(entry.getKey(), entry.getValue().get());
                } catch (ExecutionException e) {
                    throw new IllegalStateException(String.format("decompiling 0x%x escaped isolation", entry.getKey()),
                            e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while decompiling", e);
        } finally {
            executor.shutdownNow();
        }
        logger.debug("decompiled {} functions on {} threads", results.size(), threads);
        return results;
    }

    private Decompilation decompileIsolated(List<DecodedInstruction> stream, long start) {
        Decompilation result = new Decompilation(start);
        try {
            run(stream, start, result);
        } catch (FunctionRefusedException e) {
            result.failure = e;
        } catch (RuntimeException | StackOverflowError e) {
            result.failure = new FunctionRefusedException(start, e);
        }
        if (result.failure != null) {
            logger.error("failed to decompile function at 0x{}", Long.toHexString(start), result.failure);
        }
        return result;
    }

    private void run(List<DecodedInstruction> stream, long start, Decompilation result) {
        Stage last = options.getStopStage();

        Lifter lifter = new Lifter(options.getIsa().newTranslator(), options.getUnsupportedPolicy(), options.getMaxInstructions());
        PcodeListing listing = lifter.lift(stream, start);
        result.listing = listing;
        result.completed = Stage.TRANSLATE;
        logger.debug("0x{}: translated {} instructions ({})",
                Long.toHexString(start), listing.getInstructions().size(), listing.getStopReason());
        if (!Stage.CFG.isIncludedIn(last)) return;

        Function func = cfg.run(listing);
        result.function = func;
        result.completed = Stage.CFG;
        if (!Stage.SSA.isIncludedIn(last)) return;

        ssa.run(func);
        result.completed = Stage.SSA;
        if (!Stage.TYPES.isIncludedIn(last)) return;

        InferTypes.INSTANCE.run(func);
        result.completed = Stage.TYPES;
        if (!Stage.STRUCTURE.isIncludedIn(last)) return;

        structure.run(func);
        result.completed = Stage.STRUCTURE;
        if (!Stage.RENDER.isIncludedIn(last)) return;

        result.pseudocode = PseudocodeRenderer.INSTANCE.run(func);
        result.completed = Stage.RENDER;
        logger.debug("{}: done with {} diagnostics", func.getName(), func.getDiagnostics().size());
    }
}
