package io.github.eutro.relift.core.types;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Lattice operations over {@link Type}s.
 */
public final class Types {
    private Types() {
    }

    /**
     * Combine two constraints on one value into the most specific type consistent with both.
     * <ul>
     *     <li>{@link Type#UNKNOWN} constrains nothing.</li>
     *     <li>An integer of unspecified signedness takes the signedness of the other; signed and unsigned
     *     integers of one width become of unspecified signedness.</li>
     *     <li>A pointer refines an integer of the same width, and a bool refines an 8-bit integer.</li>
     *     <li>Pointers refine their targets; pointers whose targets clash point to unknown.</li>
     *     <li>Any other disagreement of kind or width is a conflict.</li>
     * </ul>
     *
     * @param a One type.
     * @param b The other.
     * @return The refined type, or null if the two conflict.
     */
    public static @Nullable Type refine(Type a, Type b) {
        if (a.isUnknown() || a.equals(b)) return b;
        if (b.isUnknown()) return a;
        Type.Kind ka = a.getKind();
        Type.Kind kb = b.getKind();
        if (ka == Type.Kind.INT && kb == Type.Kind.INT) {
            if (a.getBits() != b.getBits()) return null;
            if (a.getSignedness() == Type.Signedness.UNSPECIFIED) return b;
            if (b.getSignedness() == Type.Signedness.UNSPECIFIED) return a;
            return Type.genericInt(a.getBits());
        }
        if (ka == Type.Kind.INT && kb != Type.Kind.INT) return refineWithInt(b, a);
        if (kb == Type.Kind.INT) return refineWithInt(a, b);
        if (ka != kb) return null;
        switch (ka) {
            case POINTER: {
                Type target = refine(Objects.requireNonNull(a.getInner()), Objects.requireNonNull(b.getInner()));
                return Type.pointerTo(target == null ? Type.UNKNOWN : target);
            }
            case ARRAY: {
                if (a.getCount() != b.getCount()) return null;
                Type elem = refine(Objects.requireNonNull(a.getInner()), Objects.requireNonNull(b.getInner()));
                return elem == null ? null : Type.arrayOf(elem, a.getCount());
            }
            case FLOAT:
            case BOOL:
            case VOID:
            case STRUCT:
            case FUNCTION:
            default:
                // equal ones were handled above
                return null;
        }
    }

    private static @Nullable Type refineWithInt(Type other, Type integer) {
        switch (other.getKind()) {
            case POINTER:
                return integer.getBits() == other.getBits() ? other : null;
            case BOOL:
                return integer.getBits() == 8 ? other : null;
            default:
                return null;
        }
    }

    /**
     * Check whether two types conflict.
     *
     * @param a One type.
     * @param b The other.
     * @return Whether {@link #refine(Type, Type)} fails.
     */
    public static boolean conflicts(Type a, Type b) {
        return refine(a, b) == null;
    }

    /**
     * Check whether {@code a} says at least as much as {@code b}.
     *
     * @param a The refined type.
     * @param b The original type.
     * @return Whether refining {@code a} by {@code b} gives back {@code a}.
     */
    public static boolean isRefinementOf(Type a, Type b) {
        return a.equals(refine(a, b));
    }

    /**
     * Join the types of the values merged by a phi. Unknown inputs are ignored.
     *
     * @param types The input types.
     * @return Their refinement, or {@link Type#UNKNOWN} if they conflict.
     */
    public static Type join(List<Type> types) {
        Type acc = Type.UNKNOWN;
        for (Type type : types) {
            if (type.isUnknown()) continue;
            Type next = refine(acc, type);
            if (next == null) return Type.UNKNOWN;
            acc = next;
        }
        return acc;
    }
}
