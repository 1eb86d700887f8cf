package io.github.eutro.relift.core.frontend;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * An operand of a {@link DecodedInstruction}.
 */
public abstract class Operand {
    /**
     * The kind of an operand.
     */
    public enum Kind {
        REGISTER,
        IMMEDIATE,
        MEMORY,
    }

    private Operand() {
    }

    public abstract Kind getKind();

    /**
     * A register operand, by name.
     */
    public static final class Register extends Operand {
        public final String name;

        public Register(String name) {
            this.name = name.toLowerCase();
        }

        @Override
        public Kind getKind() {
            return Kind.REGISTER;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Register && name.equals(((Register) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * An immediate integer operand.
     */
    public static final class Immediate extends Operand {
        public final long value;

        public Immediate(long value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.IMMEDIATE;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Immediate && value == ((Immediate) o).value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return value < 0 ? "-0x" + Long.toHexString(-value) : "0x" + Long.toHexString(value);
        }
    }

    /**
     * A memory operand, {@code [base + index*scale + disp]}.
     */
    public static final class Memory extends Operand {
        public final @Nullable String base;
        public final @Nullable String index;
        public final int scale;
        public final long disp;
        /**
         * The access size in bytes, or 0 if the instruction implies it.
         */
        public final int size;

        public Memory(@Nullable String base, @Nullable String index, int scale, long disp, int size) {
            this.base = base == null ? null : base.toLowerCase();
            this.index = index == null ? null : index.toLowerCase();
            this.scale = scale;
            this.disp = disp;
            this.size = size;
        }

        @Override
        public Kind getKind() {
            return Kind.MEMORY;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Memory)) return false;
            Memory memory = (Memory) o;
            return scale == memory.scale
                    && disp == memory.disp
                    && size == memory.size
                    && Objects.equals(base, memory.base)
                    && Objects.equals(index, memory.index);
        }

        @Override
        public int hashCode() {
            return Objects.hash(base, index, scale, disp, size);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            switch (size) {
                case 1:
                    sb.append("byte ptr ");
                    break;
                case 2:
                    sb.append("word ptr ");
                    break;
                case 4:
                    sb.append("dword ptr ");
                    break;
                case 8:
                    sb.append("qword ptr ");
                    break;
            }
            sb.append('[');
            boolean any = false;
            if (base != null) {
                sb.append(base);
                any = true;
            }
            if (index != null) {
                if (any) sb.append(" + ");
                sb.append(index).append('*').append(scale);
                any = true;
            }
            if (disp != 0 || !any) {
                if (any) sb.append(disp < 0 ? " - " : " + ");
                sb.append("0x").append(Long.toHexString(any && disp < 0 ? -disp : disp));
            }
            return sb.append(']').toString();
        }
    }
}
