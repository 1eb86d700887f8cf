package io.github.eutro.relift.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An immutable reference to {@code size} bytes at {@code offset} in a {@link Space}.
 * <p>
 * Once a function is in SSA form, references also carry a generation, the {@link #version}.
 * Version 0 is the value a location holds on entry to the function, and every reference is
 * version 0 before renaming. Two varnodes are equal iff space, offset, size and version all match,
 * so a 4-byte and an 8-byte view of one register are distinct references.
 */
public final class Varnode implements Comparable<Varnode> {
    public final Space space;
    public final long offset;
    public final int size;
    public final int version;

    private Varnode(Space space, long offset, int size, int version) {
        if (size <= 0) {
            throw new IllegalArgumentException(String.format("varnode size must be positive, got %d", size));
        }
        this.space = Objects.requireNonNull(space);
        this.offset = offset;
        this.size = size;
        this.version = version;
    }

    public static Varnode of(Space space, long offset, int size) {
        return new Varnode(space, space == Space.CONST ? mask(offset, size) : offset, size, 0);
    }

    public static Varnode register(long offset, int size) {
        return of(Space.REGISTER, offset, size);
    }

    public static Varnode ram(long offset, int size) {
        return of(Space.RAM, offset, size);
    }

    public static Varnode constant(long value, int size) {
        return of(Space.CONST, value, size);
    }

    public static Varnode unique(long offset, int size) {
        return of(Space.UNIQUE, offset, size);
    }

    public static Varnode stack(long offset, int size) {
        return of(Space.STACK, offset, size);
    }

    /**
     * Truncate {@code value} to its low {@code size} bytes.
     *
     * @param value The value.
     * @param size  The size in bytes.
     * @return The masked value.
     */
    public static long mask(long value, int size) {
        return size >= 8 ? value : value & ((1L << (size * 8)) - 1);
    }

    public boolean isConstant() {
        return space == Space.CONST;
    }

    /**
     * The constant value, sign-extended from {@link #size} bytes.
     *
     * @return The signed value.
     */
    public long signedValue() {
        if (!isConstant()) {
            throw new IllegalStateException(String.format("%s is not a constant", this));
        }
        if (size >= 8) return offset;
        int shift = 64 - size * 8;
        return (offset << shift) >> shift;
    }

    public Varnode withVersion(int version) {
        if (version == this.version) return this;
        if (isConstant()) {
            throw new IllegalArgumentException(String.format("constant %s cannot be versioned", this));
        }
        return new Varnode(space, offset, size, version);
    }

    /**
     * The location this refers to, without an SSA generation.
     *
     * @return The version 0 varnode at the same location.
     */
    public Varnode unversioned() {
        return version == 0 ? this : new Varnode(space, offset, size, 0);
    }

    /**
     * Check whether this and {@code other} share at least one byte of storage.
     *
     * @param other The other varnode.
     * @return Whether they overlap.
     */
    public boolean overlaps(Varnode other) {
        if (space != other.space || isConstant()) return false;
        return offset < other.offset + other.size && other.offset < offset + size;
    }

    /**
     * Check whether every byte of {@code other} lies within this.
     *
     * @param other The other varnode.
     * @return Whether this contains it.
     */
    public boolean contains(Varnode other) {
        if (space != other.space || isConstant()) return false;
        return offset <= other.offset && other.offset + other.size <= offset + size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Varnode)) return false;
        Varnode varnode = (Varnode) o;
        return offset == varnode.offset
                && size == varnode.size
                && version == varnode.version
                && space == varnode.space;
    }

    @Override
    public int hashCode() {
        int result = space.hashCode();
        result = 31 * result + Long.hashCode(offset);
        result = 31 * result + size;
        result = 31 * result + version;
        return result;
    }

    @Override
    public int compareTo(@NotNull Varnode o) {
        int c = space.compareTo(o.space);
        if (c != 0) return c;
        c = Long.compareUnsigned(offset, o.offset);
        if (c != 0) return c;
        c = Integer.compare(size, o.size);
        if (c != 0) return c;
        return Integer.compare(version, o.version);
    }

    @Override
    public String toString() {
        String base = String.format("%s:0x%x:%d", space.getShortName(), offset, size);
        return version == 0 ? base : base + "#" + version;
    }
}
