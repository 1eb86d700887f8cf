package io.github.eutro.relift.core.ext;

import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.passes.IRPass;
import io.github.eutro.relift.core.passes.form.SSAify;
import io.github.eutro.relift.core.passes.meta.*;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which derived facts about a {@link Function} are currently up to date,
 * such as its dominator tree or whether it is in SSA form.
 */
public class MetadataState {
    /**
     * A kind of derived fact.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of derived fact that knows which in-place passes recompute it.
     *
     * @param <T> The IR the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) {
                    throw new IllegalArgumentException(String.format("%s computes %s but is not in-place", pass, name));
                }
                pass.run(t);
            }
        }
    }

    public static final ComputableMetaKind<Function>
            PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE),
            DOMS = new ComputableMetaKind<>("DOMS", ComputeDoms.INSTANCE),
            DOM_FRONTIER = new ComputableMetaKind<>("DOM_FRONTIER", ComputeDomFrontier.INSTANCE),
            POST_DOMS = new ComputableMetaKind<>("POST_DOMS", ComputePostDoms.INSTANCE),
            LIVE_DATA = new ComputableMetaKind<>("LIVE_DATA", ComputeLiveVars.INSTANCE),
            SSA_FORM = new ComputableMetaKind<>("SSA_FORM", SSAify.INSTANCE),
            USES = new ComputableMetaKind<>("USES", ComputeUses.INSTANCE),
            TYPES_INFERRED = new ComputableMetaKind<>("TYPES_INFERRED", InferTypes.INSTANCE),
            LOOPS = new ComputableMetaKind<>("LOOPS", FindLoops.INSTANCE);

    private final BitSet validSet = new BitSet();

    /**
     * Check whether a fact is up to date.
     *
     * @param kind The fact.
     * @return Whether it is valid.
     */
    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Recompute each of the given facts that is not up to date, in order.
     *
     * @param t     The IR.
     * @param first The first fact.
     * @param kinds The rest.
     * @param <T>   The type of IR.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    /**
     * Mark facts as up to date.
     *
     * @param kinds The facts.
     */
    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id);
        }
    }

    /**
     * Mark facts as stale.
     *
     * @param kinds The facts.
     */
    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.clear(kind.id);
        }
    }

    /**
     * Invalidate everything derived from the shape of the control flow graph.
     */
    public void graphChanged() {
        invalidate(PREDS, DOMS, DOM_FRONTIER, POST_DOMS, LOOPS);
        varsChanged();
    }

    /**
     * Invalidate everything derived from which values are defined and used where.
     */
    public void varsChanged() {
        invalidate(LIVE_DATA, USES, TYPES_INFERRED);
    }
}
