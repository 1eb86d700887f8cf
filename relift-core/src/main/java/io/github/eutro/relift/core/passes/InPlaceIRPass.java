package io.github.eutro.relift.core.passes;

/**
 * A pass that mutates or annotates its input and hands the same object on.
 * <p>
 * Every analysis over a {@link io.github.eutro.relift.core.ir.Function}, from
 * {@link io.github.eutro.relift.core.passes.meta.ComputePreds} to
 * {@link io.github.eutro.relift.core.passes.meta.RecoverStructure}, is one of these, so they chain
 * freely after {@link io.github.eutro.relift.core.passes.convert.BuildCfg}.
 *
 * @param <T> The IR type.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Update {@code t}, attaching results as exts where there are any.
     *
     * @param t The IR.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
