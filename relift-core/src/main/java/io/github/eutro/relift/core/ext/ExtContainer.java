package io.github.eutro.relift.core.ext;

import io.github.eutro.relift.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something that {@link Ext}s can be attached to. See the {@link io.github.eutro.relift.core.ext package documentation}.
 */
public interface ExtContainer {
    /**
     * Attach {@code value} to this container under {@code ext}, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the value.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value attached under {@code ext}, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the value.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value attached under {@code ext}, or null.
     *
     * @param ext The ext.
     * @param <T> The type of the value.
     * @return The value, or null if absent.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value attached under {@code ext}, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the value.
     * @return The value.
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value attached under {@code ext}.
     *
     * @param ext The ext.
     * @param <T> The type of the value.
     * @return The value.
     * @throws IllegalStateException If nothing is attached.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException(String.format("ext %s not present on %s", ext.getName(), this));
        }
        return value;
    }

    /**
     * Get the value attached under {@code ext}, running {@code pass} on {@code o} first if it is absent.
     *
     * @param ext  The ext.
     * @param o    The IR the pass computes the ext on.
     * @param pass The pass.
     * @param <T>  The type of the value.
     * @param <O>  The type of IR the pass runs on.
     * @return The value.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T value = getNullable(ext);
        if (value != null) return value;
        pass.run(o);
        return getExtOrThrow(ext);
    }
}
