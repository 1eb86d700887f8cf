package io.github.eutro.relift.core.frontend;

import io.github.eutro.relift.core.ir.Varnode;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The registers of an architecture, as {@link io.github.eutro.relift.core.ir.Space#REGISTER register space} varnodes.
 * <p>
 * A sub-register is a view of part of its container: it has the container's offset plus its byte position,
 * and its own size.
 */
public interface RegisterModel {
    /**
     * Look up a register by name.
     *
     * @param name The name, in lower case.
     * @return The register, or null if there is no register by that name.
     */
    @Nullable Varnode resolve(String name);

    /**
     * Find the full register that a view is part of.
     *
     * @param view A register varnode.
     * @return The largest register containing it, or the view itself if no register contains it.
     */
    Varnode container(Varnode view);

    /**
     * Name a location, ignoring its version.
     *
     * @param vn The location.
     * @return A name usable as an identifier.
     */
    String nameOf(Varnode vn);

    /**
     * @return The size of a pointer, in bytes.
     */
    int pointerSize();

    Varnode stackPointer();

    /**
     * @return The registers arguments are passed in, in order.
     */
    List<Varnode> argumentRegisters();

    /**
     * @return The register values are returned in, or null if the convention has none.
     */
    @Nullable Varnode returnRegister();

    /**
     * Check whether a location is a condition flag.
     *
     * @param vn The location.
     * @return Whether it is a flag.
     */
    boolean isFlag(Varnode vn);
}
