package io.github.eutro.relift.core.frontend.x86;

import io.github.eutro.relift.core.frontend.AbstractTranslator;
import io.github.eutro.relift.core.frontend.DecodedInstruction;
import io.github.eutro.relift.core.frontend.Operand;
import io.github.eutro.relift.core.frontend.UnsupportedInstructionException;
import io.github.eutro.relift.core.ir.IRBuilder;
import io.github.eutro.relift.core.ir.OpCode;
import io.github.eutro.relift.core.ir.Varnode;
import org.jetbrains.annotations.Nullable;

import static io.github.eutro.relift.core.frontend.x86.X86Registers.*;

/**
 * The x86-64 front end, for Intel-syntax instructions.
 * <p>
 * Sub-registers are read by taking a {@link OpCode#SUBPIECE} of the full register, and written following
 * the hardware rules: a 4-byte write zero-extends into the full register, while 1- and 2-byte writes
 * merge into it. Flag effects are explicit writes of {@link X86Registers#ZF}, {@link X86Registers#SF}
 * and the rest; flags an instruction leaves undefined are not written.
 * <p>
 * Calls are modelled from the caller's side: the return address push and the callee's pop cancel out,
 * so {@code call} leaves the stack pointer unchanged.
 */
public class X86Translator extends AbstractTranslator {
    private static final String[][] CONDITIONS = {
            {"o"}, {"no"},
            {"b", "c", "nae"}, {"ae", "nb", "nc"},
            {"e", "z"}, {"ne", "nz"},
            {"be", "na"}, {"a", "nbe"},
            {"s"}, {"ns"},
            {"p", "pe"}, {"np", "po"},
            {"l", "nge"}, {"ge", "nl"},
            {"le", "ng"}, {"g", "nle"},
    };

    private enum FlagEffect {
        ADD,
        SUB,
        LOGIC,
    }

    public X86Translator() {
        super(X86Registers.MODEL);

        rule((insn, ib) -> {
            expectOperands(insn, 2, 2);
            int size = operandSize(insn, insn.getOperand(0), insn.getOperand(1));
            Loc dst = loc(insn, insn.getOperand(0), size, ib);
            set(dst, get(loc(insn, insn.getOperand(1), size, ib), ib), ib);
        }, "mov");
        rule((insn, ib) -> extend(insn, ib, OpCode.INT_ZEXT), "movzx");
        rule((insn, ib) -> extend(insn, ib, OpCode.INT_SEXT), "movsx", "movsxd");
        rule((insn, ib) -> {
            expectOperands(insn, 2, 2);
            Varnode dst = register(insn, insn.getOperand(0));
            if (insn.getOperand(1).getKind() != Operand.Kind.MEMORY) throw badOperands(insn);
            Varnode addr = address(insn, (Operand.Memory) insn.getOperand(1), ib);
            if (dst.size < addr.size) {
                addr = ib.op(OpCode.SUBPIECE, dst.size, addr, Varnode.constant(0, 4));
            }
            writeReg(dst, addr, ib);
        }, "lea");
        rule((insn, ib) -> {
            expectOperands(insn, 2, 2);
            int size = operandSize(insn, insn.getOperand(0), insn.getOperand(1));
            Loc a = loc(insn, insn.getOperand(0), size, ib);
            Loc b = loc(insn, insn.getOperand(1), size, ib);
            Varnode va = ib.op(OpCode.COPY, size, get(a, ib));
            Varnode vb = ib.op(OpCode.COPY, size, get(b, ib));
            set(a, vb, ib);
            set(b, va, ib);
        }, "xchg");

        arith(OpCode.INT_ADD, FlagEffect.ADD, true, "add");
        arith(OpCode.INT_SUB, FlagEffect.SUB, true, "sub");
        arith(OpCode.INT_SUB, FlagEffect.SUB, false, "cmp");
        arith(OpCode.INT_AND, FlagEffect.LOGIC, true, "and");
        arith(OpCode.INT_OR, FlagEffect.LOGIC, true, "or");
        arith(OpCode.INT_XOR, FlagEffect.LOGIC, true, "xor");
        arith(OpCode.INT_AND, FlagEffect.LOGIC, false, "test");

        rule((insn, ib) -> incDec(insn, ib, OpCode.INT_ADD, OpCode.INT_SCARRY), "inc");
        rule((insn, ib) -> incDec(insn, ib, OpCode.INT_SUB, OpCode.INT_SBORROW), "dec");
        rule((insn, ib) -> {
            expectOperands(insn, 1, 1);
            Loc dst = loc(insn, insn.getOperand(0), operandSize(insn, insn.getOperand(0), null), ib);
            Varnode a = get(dst, ib);
            Varnode zero = Varnode.constant(0, a.size);
            Varnode r = ib.op(OpCode.INT_2COMP, a.size, a);
            ib.emit(OpCode.INT_NOTEQUAL, CF, a, zero);
            ib.emit(OpCode.INT_SBORROW, OF, zero, a);
            resultFlags(r, ib);
            set(dst, r, ib);
        }, "neg");
        rule((insn, ib) -> {
            expectOperands(insn, 1, 1);
            Loc dst = loc(insn, insn.getOperand(0), operandSize(insn, insn.getOperand(0), null), ib);
            Varnode a = get(dst, ib);
            set(dst, ib.op(OpCode.INT_NEGATE, a.size, a), ib);
        }, "not");
        rule((insn, ib) -> {
            expectOperands(insn, 2, 3);
            int size = operandSize(insn, insn.getOperand(0), insn.getOperand(1));
            Loc dst = loc(insn, insn.getOperand(0), size, ib);
            if (dst.addr != null) throw badOperands(insn);
            Varnode a, b;
            if (insn.numOperands() == 3) {
                a = get(loc(insn, insn.getOperand(1), size, ib), ib);
                b = get(loc(insn, insn.getOperand(2), size, ib), ib);
            } else {
                a = get(dst, ib);
                b = get(loc(insn, insn.getOperand(1), size, ib), ib);
            }
            set(dst, ib.op(OpCode.INT_MULT, size, a, b), ib);
        }, "imul");
        shift(OpCode.INT_LEFT, "shl", "sal");
        shift(OpCode.INT_RIGHT, "shr");
        shift(OpCode.INT_SRIGHT, "sar");

        rule((insn, ib) -> {
            expectOperands(insn, 1, 1);
            Varnode sp = registers.stackPointer();
            Varnode v = get(loc(insn, insn.getOperand(0), 8, ib), ib);
            if (v.equals(sp)) v = ib.op(OpCode.COPY, 8, v);
            ib.emit(OpCode.INT_SUB, sp, sp, Varnode.constant(8, 8));
            ib.store(sp, v);
        }, "push");
        rule((insn, ib) -> {
            expectOperands(insn, 1, 1);
            Varnode sp = registers.stackPointer();
            Loc dst = loc(insn, insn.getOperand(0), 8, ib);
            Varnode v = ib.load(8, sp);
            ib.emit(OpCode.INT_ADD, sp, sp, Varnode.constant(8, 8));
            set(dst, v, ib);
        }, "pop");
        rule((insn, ib) -> {
            expectOperands(insn, 0, 0);
            Varnode sp = registers.stackPointer();
            Varnode bp = registers.resolve("rbp");
            ib.copy(sp, bp);
            ib.load(bp, sp);
            ib.emit(OpCode.INT_ADD, sp, sp, Varnode.constant(8, 8));
        }, "leave");

        rule((insn, ib) -> {
            expectOperands(insn, 1, 1);
            Operand op = insn.getOperand(0);
            if (op.getKind() == Operand.Kind.IMMEDIATE) {
                ib.branch(target(insn, op));
            } else {
                ib.branchInd(get(loc(insn, op, 8, ib), ib));
            }
        }, "jmp");
        rule((insn, ib) -> {
            expectOperands(insn, 1, 1);
            Operand op = insn.getOperand(0);
            if (op.getKind() == Operand.Kind.IMMEDIATE) {
                ib.call(target(insn, op));
            } else {
                ib.callInd(get(loc(insn, op, 8, ib), ib));
            }
        }, "call");
        rule((insn, ib) -> {
            expectOperands(insn, 0, 1);
            Varnode sp = registers.stackPointer();
            Varnode ret = ib.load(8, sp);
            long pop = 8;
            if (insn.numOperands() == 1) pop += target(insn, insn.getOperand(0));
            ib.emit(OpCode.INT_ADD, sp, sp, Varnode.constant(pop, 8));
            ib.ret(ret);
        }, "ret");

        for (String[] names : CONDITIONS) {
            String cc = names[0];
            String[] jumps = new String[names.length];
            String[] sets = new String[names.length];
            for (int i = 0; i < names.length; i++) {
                jumps[i] = "j" + names[i];
                sets[i] = "set" + names[i];
            }
            rule((insn, ib) -> {
                expectOperands(insn, 1, 1);
                long target = target(insn, insn.getOperand(0));
                ib.cbranch(target, condition(cc, ib));
            }, jumps);
            rule((insn, ib) -> {
                expectOperands(insn, 1, 1);
                Loc dst = loc(insn, insn.getOperand(0), 1, ib);
                set(dst, condition(cc, ib), ib);
            }, sets);
        }

        rule((insn, ib) -> {
            expectOperands(insn, 0, 0);
            Varnode eax = readReg(registers.resolve("eax"), ib);
            writeReg(registers.resolve("edx"), ib.op(OpCode.INT_SRIGHT, 4, eax, Varnode.constant(31, 4)), ib);
        }, "cdq");
        rule((insn, ib) -> {
            expectOperands(insn, 0, 0);
            Varnode rax = registers.resolve("rax");
            ib.emit(OpCode.INT_SRIGHT, registers.resolve("rdx"), rax, Varnode.constant(63, 8));
        }, "cqo");
        rule((insn, ib) -> {
            expectOperands(insn, 0, 0);
            ib.emit(OpCode.INT_SEXT, registers.resolve("rax"), readReg(registers.resolve("eax"), ib));
        }, "cdqe");
        rule((insn, ib) -> {
            expectOperands(insn, 0, 0);
            Varnode ax = readReg(registers.resolve("ax"), ib);
            writeReg(registers.resolve("eax"), ib.op(OpCode.INT_SEXT, 4, ax), ib);
        }, "cwde");
        rule((insn, ib) -> {
        }, "nop", "endbr64");
    }

    /**
     * Where an operand lives: a register view, a memory address, or an immediate.
     */
    private static final class Loc {
        final @Nullable Varnode reg;
        final @Nullable Varnode addr;
        final @Nullable Varnode imm;
        final int size;

        Loc(@Nullable Varnode reg, @Nullable Varnode addr, @Nullable Varnode imm, int size) {
            this.reg = reg;
            this.addr = addr;
            this.imm = imm;
            this.size = size;
        }
    }

    private Loc loc(DecodedInstruction insn, Operand op, int size, IRBuilder ib) {
        switch (op.getKind()) {
            case REGISTER: {
                Varnode reg = register(insn, op);
                if (reg.size != size) throw badOperands(insn);
                return new Loc(reg, null, null, size);
            }
            case IMMEDIATE:
                return new Loc(null, null, Varnode.constant(((Operand.Immediate) op).value, size), size);
            case MEMORY:
            default: {
                Operand.Memory mem = (Operand.Memory) op;
                if (mem.size != 0 && mem.size != size) throw badOperands(insn);
                return new Loc(null, address(insn, mem, ib), null, size);
            }
        }
    }

    private Varnode get(Loc loc, IRBuilder ib) {
        if (loc.reg != null) return readReg(loc.reg, ib);
        if (loc.imm != null) return loc.imm;
        return ib.load(loc.size, loc.addr);
    }

    private void set(Loc loc, Varnode value, IRBuilder ib) {
        if (loc.reg != null) {
            writeReg(loc.reg, value, ib);
        } else if (loc.addr != null) {
            ib.store(loc.addr, value);
        } else {
            throw new UnsupportedInstructionException("immediate destination", ib.getAddress(), "unsupported operands in");
        }
    }

    private int sizeOf(DecodedInstruction insn, @Nullable Operand op) {
        if (op == null) return 0;
        switch (op.getKind()) {
            case REGISTER:
                return register(insn, op).size;
            case MEMORY:
                return ((Operand.Memory) op).size;
            case IMMEDIATE:
            default:
                return 0;
        }
    }

    private int operandSize(DecodedInstruction insn, Operand dst, @Nullable Operand src) {
        int size = sizeOf(insn, dst);
        if (size == 0) size = sizeOf(insn, src);
        if (size == 0) throw badOperands(insn);
        return size;
    }

    /**
     * Read a register, through a {@link OpCode#SUBPIECE} of its container if it is a view.
     *
     * @param view The register.
     * @param ib   The builder.
     * @return The value.
     */
    private Varnode readReg(Varnode view, IRBuilder ib) {
        Varnode full = registers.container(view);
        if (full.equals(view)) return view;
        return ib.op(OpCode.SUBPIECE, view.size, full, Varnode.constant(view.offset - full.offset, 4));
    }

    private void writeReg(Varnode view, Varnode value, IRBuilder ib) {
        Varnode full = registers.container(view);
        if (full.equals(view)) {
            ib.copy(view, value);
            return;
        }
        int pos = (int) (view.offset - full.offset);
        if (pos == 0 && view.size == 4) {
            ib.emit(OpCode.INT_ZEXT, full, value);
            return;
        }
        Varnode wide = ib.op(OpCode.INT_ZEXT, full.size, value);
        if (pos != 0) {
            wide = ib.op(OpCode.INT_LEFT, full.size, wide, Varnode.constant(pos * 8L, 4));
        }
        long keep = ~(((1L << (view.size * 8)) - 1) << (pos * 8));
        Varnode kept = ib.op(OpCode.INT_AND, full.size, full, Varnode.constant(keep, full.size));
        ib.emit(OpCode.INT_OR, full, kept, wide);
    }

    private Varnode address(DecodedInstruction insn, Operand.Memory mem, IRBuilder ib) {
        Varnode addr = null;
        long disp = mem.disp;
        if (mem.base != null) {
            if (mem.base.equals("rip")) {
                disp += insn.getNextAddress();
            } else {
                addr = addressRegister(insn, mem.base, ib);
            }
        }
        if (mem.index != null) {
            Varnode index = addressRegister(insn, mem.index, ib);
            if (mem.scale != 1) {
                index = ib.op(OpCode.INT_MULT, 8, index, Varnode.constant(mem.scale, 8));
            }
            addr = addr == null ? index : ib.op(OpCode.INT_ADD, 8, addr, index);
        }
        if (addr == null) return Varnode.constant(disp, 8);
        if (disp != 0) addr = ib.op(OpCode.INT_ADD, 8, addr, Varnode.constant(disp, 8));
        return addr;
    }

    private Varnode addressRegister(DecodedInstruction insn, String name, IRBuilder ib) {
        Varnode reg = register(insn, new Operand.Register(name));
        if (reg.size == 8) return reg;
        if (reg.size != 4) throw badOperands(insn);
        return ib.op(OpCode.INT_ZEXT, 8, readReg(reg, ib));
    }

    private void resultFlags(Varnode r, IRBuilder ib) {
        Varnode zero = Varnode.constant(0, r.size);
        ib.emit(OpCode.INT_EQUAL, ZF, r, zero);
        ib.emit(OpCode.INT_SLESS, SF, r, zero);
        Varnode low = r.size == 1 ? r : ib.op(OpCode.SUBPIECE, 1, r, Varnode.constant(0, 4));
        Varnode bits = ib.op(OpCode.POPCOUNT, 1, low);
        Varnode odd = ib.op(OpCode.INT_AND, 1, bits, Varnode.constant(1, 1));
        ib.emit(OpCode.INT_EQUAL, PF, odd, Varnode.constant(0, 1));
    }

    private void arith(OpCode opcode, FlagEffect effect, boolean writeBack, String mnemonic) {
        rule((insn, ib) -> {
            expectOperands(insn, 2, 2);
            int size = operandSize(insn, insn.getOperand(0), insn.getOperand(1));
            Loc dst = loc(insn, insn.getOperand(0), size, ib);
            Varnode a = get(dst, ib);
            Varnode b = get(loc(insn, insn.getOperand(1), size, ib), ib);
            Varnode r = ib.op(opcode, size, a, b);
            switch (effect) {
                case ADD:
                    ib.emit(OpCode.INT_CARRY, CF, a, b);
                    ib.emit(OpCode.INT_SCARRY, OF, a, b);
                    break;
                case SUB:
                    ib.emit(OpCode.INT_LESS, CF, a, b);
                    ib.emit(OpCode.INT_SBORROW, OF, a, b);
                    break;
                case LOGIC:
                    ib.copy(CF, Varnode.constant(0, 1));
                    ib.copy(OF, Varnode.constant(0, 1));
                    break;
            }
            resultFlags(r, ib);
            if (writeBack) set(dst, r, ib);
        }, mnemonic);
    }

    private void incDec(DecodedInstruction insn, IRBuilder ib, OpCode opcode, OpCode overflow) {
        expectOperands(insn, 1, 1);
        Loc dst = loc(insn, insn.getOperand(0), operandSize(insn, insn.getOperand(0), null), ib);
        Varnode a = get(dst, ib);
        Varnode one = Varnode.constant(1, a.size);
        Varnode r = ib.op(opcode, a.size, a, one);
        ib.emit(overflow, OF, a, one);
        resultFlags(r, ib);
        set(dst, r, ib);
    }

    private void shift(OpCode opcode, String... mnemonics) {
        rule((insn, ib) -> {
            expectOperands(insn, 1, 2);
            Loc dst = loc(insn, insn.getOperand(0), operandSize(insn, insn.getOperand(0), null), ib);
            Varnode count = insn.numOperands() == 2
                    ? get(loc(insn, insn.getOperand(1), 1, ib), ib)
                    : Varnode.constant(1, 1);
            Varnode r = ib.op(opcode, dst.size, get(dst, ib), count);
            resultFlags(r, ib);
            set(dst, r, ib);
        }, mnemonics);
    }

    private void extend(DecodedInstruction insn, IRBuilder ib, OpCode opcode) {
        expectOperands(insn, 2, 2);
        Varnode dst = register(insn, insn.getOperand(0));
        int srcSize = sizeOf(insn, insn.getOperand(1));
        if (srcSize == 0 || srcSize > dst.size) throw badOperands(insn);
        Varnode v = get(loc(insn, insn.getOperand(1), srcSize, ib), ib);
        if (srcSize < dst.size) v = ib.op(opcode, dst.size, v);
        writeReg(dst, v, ib);
    }

    private Varnode condition(String cc, IRBuilder ib) {
        switch (cc) {
            case "o":
                return OF;
            case "no":
                return ib.op(OpCode.BOOL_NEGATE, 1, OF);
            case "b":
                return CF;
            case "ae":
                return ib.op(OpCode.BOOL_NEGATE, 1, CF);
            case "e":
                return ZF;
            case "ne":
                return ib.op(OpCode.BOOL_NEGATE, 1, ZF);
            case "be":
                return ib.op(OpCode.BOOL_OR, 1, CF, ZF);
            case "a":
                return ib.op(OpCode.BOOL_AND, 1,
                        ib.op(OpCode.BOOL_NEGATE, 1, CF),
                        ib.op(OpCode.BOOL_NEGATE, 1, ZF));
            case "s":
                return SF;
            case "ns":
                return ib.op(OpCode.BOOL_NEGATE, 1, SF);
            case "p":
                return PF;
            case "np":
                return ib.op(OpCode.BOOL_NEGATE, 1, PF);
            case "l":
                return ib.op(OpCode.INT_NOTEQUAL, 1, SF, OF);
            case "ge":
                return ib.op(OpCode.INT_EQUAL, 1, SF, OF);
            case "le":
                return ib.op(OpCode.BOOL_OR, 1, ZF, ib.op(OpCode.INT_NOTEQUAL, 1, SF, OF));
            case "g":
                return ib.op(OpCode.BOOL_AND, 1,
                        ib.op(OpCode.BOOL_NEGATE, 1, ZF),
                        ib.op(OpCode.INT_EQUAL, 1, SF, OF));
            default:
                throw new IllegalArgumentException(cc);
        }
    }
}
