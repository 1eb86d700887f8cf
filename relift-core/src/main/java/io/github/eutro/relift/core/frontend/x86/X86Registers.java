package io.github.eutro.relift.core.frontend.x86;

import io.github.eutro.relift.core.frontend.RegisterModel;
import io.github.eutro.relift.core.frontend.TableRegisterModel;
import io.github.eutro.relift.core.ir.Varnode;

/**
 * The x86-64 register file, laid out in register space.
 * <p>
 * The sixteen general purpose registers are 8 bytes each from offset 0, in encoding order.
 * Flags are single bytes at {@link #FLAGS_BASE} plus their bit position in {@code rflags}.
 */
public final class X86Registers {
    private X86Registers() {
    }

    public static final long RIP_OFFSET = 0x80;
    public static final long XMM_BASE = 0x90;
    public static final long FLAGS_BASE = 0x200;

    public static final Varnode CF = Varnode.register(FLAGS_BASE, 1);
    public static final Varnode PF = Varnode.register(FLAGS_BASE + 2, 1);
    public static final Varnode AF = Varnode.register(FLAGS_BASE + 4, 1);
    public static final Varnode ZF = Varnode.register(FLAGS_BASE + 6, 1);
    public static final Varnode SF = Varnode.register(FLAGS_BASE + 7, 1);
    public static final Varnode OF = Varnode.register(FLAGS_BASE + 11, 1);

    private static final String[] LEGACY = {"a", "c", "d", "b"};
    private static final String[] POINTER = {"sp", "bp", "si", "di"};

    public static final RegisterModel MODEL = build();

    private static RegisterModel build() {
        TableRegisterModel.Builder b = TableRegisterModel.builder(8);
        for (int i = 0; i < LEGACY.length; i++) {
            String x = LEGACY[i];
            long off = i * 8L;
            b.register("r" + x + "x", off, 8)
                    .register("e" + x + "x", off, 4)
                    .register(x + "x", off, 2)
                    .register(x + "l", off, 1)
                    .register(x + "h", off + 1, 1);
        }
        for (int i = 0; i < POINTER.length; i++) {
            String x = POINTER[i];
            long off = (i + 4) * 8L;
            b.register("r" + x, off, 8)
                    .register("e" + x, off, 4)
                    .register(x, off, 2)
                    .register(x + "l", off, 1);
        }
        for (int i = 8; i < 16; i++) {
            long off = i * 8L;
            b.register("r" + i, off, 8)
                    .register("r" + i + "d", off, 4)
                    .register("r" + i + "w", off, 2)
                    .register("r" + i + "b", off, 1);
        }
        b.register("rip", RIP_OFFSET, 8);
        for (int i = 0; i < 16; i++) {
            b.register("xmm" + i, XMM_BASE + i * 16L, 16);
        }
        b.flag("cf", CF.offset)
                .flag("pf", PF.offset)
                .flag("af", AF.offset)
                .flag("zf", ZF.offset)
                .flag("sf", SF.offset)
                .flag("of", OF.offset);
        return b.stackPointer("rsp")
                .arguments("rdi", "rsi", "rdx", "rcx", "r8", "r9")
                .returnRegister("rax")
                .build();
    }
}
