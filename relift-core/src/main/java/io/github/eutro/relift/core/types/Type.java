package io.github.eutro.relift.core.types;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An inferred value type. Immutable.
 * <p>
 * {@link Kind#UNKNOWN} is the bottom of the lattice {@link Types#refine(Type, Type)} works over:
 * it says nothing about a value.
 */
public final class Type {
    /**
     * The deepest pointer nesting represented; pointers to deeper types are absorbed.
     */
    public static final int MAX_POINTER_DEPTH = 3;
    /**
     * The width of a pointer, in bytes.
     */
    public static final int POINTER_SIZE = 8;

    public enum Kind {
        UNKNOWN,
        VOID,
        BOOL,
        INT,
        FLOAT,
        POINTER,
        ARRAY,
        STRUCT,
        FUNCTION,
    }

    public enum Signedness {
        SIGNED,
        UNSIGNED,
        UNSPECIFIED,
    }

    /**
     * A named member of a {@link Kind#STRUCT}.
     */
    public static final class Field {
        public final String name;
        public final Type type;

        public Field(String name, Type type) {
            this.name = name;
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Field)) return false;
            Field field = (Field) o;
            return name.equals(field.name) && type.equals(field.type);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + type.hashCode();
        }
    }

    public static final Type UNKNOWN = new Type(Kind.UNKNOWN, 0, Signedness.UNSPECIFIED, null, 0,
            Collections.emptyList(), Collections.emptyList());
    public static final Type VOID = new Type(Kind.VOID, 0, Signedness.UNSPECIFIED, null, 0,
            Collections.emptyList(), Collections.emptyList());
    public static final Type BOOL = new Type(Kind.BOOL, 8, Signedness.UNSPECIFIED, null, 0,
            Collections.emptyList(), Collections.emptyList());

    private final Kind kind;
    private final int bits;
    private final Signedness signedness;
    private final @Nullable Type inner;
    private final int count;
    private final List<Field> fields;
    private final List<Type> params;

    private Type(Kind kind,
                 int bits,
                 Signedness signedness,
                 @Nullable Type inner,
                 int count,
                 List<Field> fields,
                 List<Type> params) {
        this.kind = kind;
        this.bits = bits;
        this.signedness = signedness;
        this.inner = inner;
        this.count = count;
        this.fields = fields;
        this.params = params;
    }

    public static Type intOf(int bits, Signedness signedness) {
        return new Type(Kind.INT, bits, signedness, null, 0, Collections.emptyList(), Collections.emptyList());
    }

    public static Type signed(int bits) {
        return intOf(bits, Signedness.SIGNED);
    }

    public static Type unsigned(int bits) {
        return intOf(bits, Signedness.UNSIGNED);
    }

    /**
     * @param bits The width.
     * @return An integer of unspecified signedness.
     */
    public static Type genericInt(int bits) {
        return intOf(bits, Signedness.UNSPECIFIED);
    }

    public static Type floatOf(int bits) {
        return new Type(Kind.FLOAT, bits, Signedness.SIGNED, null, 0, Collections.emptyList(), Collections.emptyList());
    }

    /**
     * A pointer to {@code target}. If {@code target} is already nested {@link #MAX_POINTER_DEPTH} deep,
     * it is returned unchanged.
     *
     * @param target The pointee.
     * @return The pointer type.
     */
    public static Type pointerTo(Type target) {
        if (target.pointerDepth() >= MAX_POINTER_DEPTH) return target;
        return new Type(Kind.POINTER, POINTER_SIZE * 8, Signedness.UNSIGNED, target, 0,
                Collections.emptyList(), Collections.emptyList());
    }

    public static Type arrayOf(Type element, int count) {
        return new Type(Kind.ARRAY, 0, Signedness.UNSPECIFIED, element, count,
                Collections.emptyList(), Collections.emptyList());
    }

    public static Type struct(List<Field> fields) {
        return new Type(Kind.STRUCT, 0, Signedness.UNSPECIFIED, null, 0,
                Collections.unmodifiableList(new ArrayList<>(fields)), Collections.emptyList());
    }

    public static Type function(Type returnType, List<Type> params) {
        return new Type(Kind.FUNCTION, 0, Signedness.UNSPECIFIED, returnType, 0,
                Collections.emptyList(), Collections.unmodifiableList(new ArrayList<>(params)));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    /**
     * @return The width of an int, float or pointer, in bits.
     */
    public int getBits() {
        return bits;
    }

    public Signedness getSignedness() {
        return signedness;
    }

    /**
     * @return The pointee of a pointer, the element of an array, or the return type of a function.
     */
    public @Nullable Type getInner() {
        return inner;
    }

    public int getCount() {
        return count;
    }

    public List<Field> getFields() {
        return fields;
    }

    public List<Type> getParams() {
        return params;
    }

    public int pointerDepth() {
        return kind == Kind.POINTER ? 1 + Objects.requireNonNull(inner).pointerDepth() : 0;
    }

    /**
     * @return The size of a value of this type in bytes, or 0 if it has none.
     */
    public int sizeInBytes() {
        switch (kind) {
            case BOOL:
                return 1;
            case INT:
            case FLOAT:
            case POINTER:
                return bits / 8;
            case ARRAY:
                return Objects.requireNonNull(inner).sizeInBytes() * count;
            case STRUCT: {
                int size = 0;
                for (Field field : fields) {
                    size += field.type.sizeInBytes();
                }
                return size;
            }
            case FUNCTION:
                return POINTER_SIZE;
            case UNKNOWN:
            case VOID:
            default:
                return 0;
        }
    }

    /**
     * Render this type as a C type name.
     *
     * @return The name.
     */
    public String toCString() {
        switch (kind) {
            case UNKNOWN:
                return "unknown";
            case VOID:
                return "void";
            case BOOL:
                return "bool";
            case INT:
                return String.format(signedness == Signedness.UNSIGNED ? "uint%d_t" : "int%d_t", bits);
            case FLOAT:
                return bits == 32 ? "float" : bits == 64 ? "double" : String.format("float%d", bits);
            case POINTER: {
                Type target = Objects.requireNonNull(inner);
                String t = target.isUnknown() ? "void" : target.toCString();
                return t.endsWith("*") ? t + "*" : t + " *";
            }
            case ARRAY:
                return String.format("%s[%d]", Objects.requireNonNull(inner).toCString(), count);
            case STRUCT: {
                StringBuilder sb = new StringBuilder("struct {");
                for (Field field : fields) {
                    sb.append(' ').append(field.type.toCString()).append(' ').append(field.name).append(';');
                }
                return sb.append(" }").toString();
            }
            case FUNCTION:
            default: {
                StringBuilder sb = new StringBuilder(Objects.requireNonNull(inner).toCString()).append(" (*)(");
                for (int i = 0; i < params.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(params.get(i).toCString());
                }
                return sb.append(')').toString();
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Type)) return false;
        Type type = (Type) o;
        return bits == type.bits
                && count == type.count
                && kind == type.kind
                && signedness == type.signedness
                && Objects.equals(inner, type.inner)
                && fields.equals(type.fields)
                && params.equals(type.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bits, signedness, inner, count, fields, params);
    }

    @Override
    public String toString() {
        return toCString();
    }
}
