package io.github.eutro.relift.core.frontend.ref;

import io.github.eutro.relift.core.frontend.AbstractTranslator;
import io.github.eutro.relift.core.frontend.DecodedInstruction;
import io.github.eutro.relift.core.frontend.Operand;
import io.github.eutro.relift.core.frontend.RegisterModel;
import io.github.eutro.relift.core.frontend.TableRegisterModel;
import io.github.eutro.relift.core.ir.IRBuilder;
import io.github.eutro.relift.core.ir.OpCode;
import io.github.eutro.relift.core.ir.Varnode;

/**
 * The front end of a generic three-address reference ISA.
 * <p>
 * There are sixteen 8-byte registers {@code r0}..{@code r15} ({@code r15} is also {@code sp}) and no flags.
 * {@code r0} holds return values and {@code r1}..{@code r6} hold arguments. Conditional branches
 * compare two operands themselves, e.g. {@code beq r1, r2, 0x1010}.
 * <p>
 * Binary operations take {@code op rd, ra, rb} or {@code op rd, rb}, the latter meaning {@code rd = rd op rb};
 * {@code rb} may be an immediate. Memory is accessed with {@code ld rd, [rs + off]} and {@code st [rd + off], rs},
 * where the access may be narrowed with a size prefix such as {@code dword ptr}.
 */
public class RefTranslator extends AbstractTranslator {
    public static final RegisterModel REGISTERS = buildRegisters();

    private static RegisterModel buildRegisters() {
        TableRegisterModel.Builder builder = TableRegisterModel.builder(8);
        for (int i = 0; i < 15; i++) {
            builder.register("r" + i, i * 8L, 8);
        }
        builder.register("sp", 15 * 8L, 8)
                .register("r15", 15 * 8L, 8);
        return builder.stackPointer("sp")
                .arguments("r1", "r2", "r3", "r4", "r5", "r6")
                .returnRegister("r0")
                .build();
    }

    public RefTranslator() {
        super(REGISTERS);
        rule((insn, ib) -> {
            expectOperands(insn, 2, 2);
            ib.copy(register(insn, insn.getOperand(0)), value(insn, insn.getOperand(1)));
        }, "mov");

        binary(OpCode.INT_ADD, "add");
        binary(OpCode.INT_SUB, "sub");
        binary(OpCode.INT_MULT, "mul");
        binary(OpCode.INT_DIV, "div");
        binary(OpCode.INT_SDIV, "sdiv");
        binary(OpCode.INT_REM, "rem");
        binary(OpCode.INT_SREM, "srem");
        binary(OpCode.INT_AND, "and");
        binary(OpCode.INT_OR, "or");
        binary(OpCode.INT_XOR, "xor");
        binary(OpCode.INT_LEFT, "shl");
        binary(OpCode.INT_RIGHT, "shr");
        binary(OpCode.INT_SRIGHT, "sar");
        unary(OpCode.INT_NEGATE, "not");
        unary(OpCode.INT_2COMP, "neg");
        extend(OpCode.INT_ZEXT, "zext");
        extend(OpCode.INT_SEXT, "sext");

        rule((insn, ib) -> {
            expectOperands(insn, 2, 2);
            Varnode rd = register(insn, insn.getOperand(0));
            Operand.Memory mem = memory(insn, insn.getOperand(1));
            int size = accessSize(mem);
            Varnode addr = address(insn, mem, ib);
            if (size == rd.size) {
                ib.load(rd, addr);
            } else {
                ib.emit(OpCode.INT_ZEXT, rd, ib.load(size, addr));
            }
        }, "ld");
        rule((insn, ib) -> {
            expectOperands(insn, 2, 2);
            Operand.Memory mem = memory(insn, insn.getOperand(0));
            Varnode value = value(insn, insn.getOperand(1));
            int size = accessSize(mem);
            Varnode addr = address(insn, mem, ib);
            if (size != value.size) {
                value = ib.op(OpCode.SUBPIECE, size, value, Varnode.constant(0, 4));
            }
            ib.store(addr, value);
        }, "st");

        compareBranch(OpCode.INT_EQUAL, false, "beq");
        compareBranch(OpCode.INT_NOTEQUAL, false, "bne");
        compareBranch(OpCode.INT_SLESS, false, "blt");
        compareBranch(OpCode.INT_SLESSEQUAL, false, "ble");
        compareBranch(OpCode.INT_SLESS, true, "bgt");
        compareBranch(OpCode.INT_SLESSEQUAL, true, "bge");
        compareBranch(OpCode.INT_LESS, false, "bltu");
        compareBranch(OpCode.INT_LESSEQUAL, true, "bgeu");

        rule((insn, ib) -> {
            expectOperands(insn, 1, 1);
            ib.branch(target(insn, insn.getOperand(0)));
        }, "b", "jmp");
        rule((insn, ib) -> {
            expectOperands(insn, 1, 1);
            ib.branchInd(register(insn, insn.getOperand(0)));
        }, "br");
        rule((insn, ib) -> {
            expectOperands(insn, 1, 1);
            ib.call(target(insn, insn.getOperand(0)));
        }, "call");
        rule((insn, ib) -> {
            expectOperands(insn, 1, 1);
            ib.callInd(register(insn, insn.getOperand(0)));
        }, "callr");
        rule((insn, ib) -> {
            expectOperands(insn, 0, 0);
            ib.ret();
        }, "ret", "return");
        rule((insn, ib) -> expectOperands(insn, 0, 0), "nop");
    }

    private void binary(OpCode opcode, String mnemonic) {
        rule((insn, ib) -> {
            expectOperands(insn, 2, 3);
            Varnode rd = register(insn, insn.getOperand(0));
            Varnode a, b;
            if (insn.numOperands() == 3) {
                a = value(insn, insn.getOperand(1));
                b = value(insn, insn.getOperand(2));
            } else {
                a = rd;
                b = value(insn, insn.getOperand(1));
            }
            ib.emit(opcode, rd, a, b);
        }, mnemonic);
    }

    private void unary(OpCode opcode, String mnemonic) {
        rule((insn, ib) -> {
            expectOperands(insn, 1, 2);
            Varnode rd = register(insn, insn.getOperand(0));
            Varnode a = insn.numOperands() == 2 ? register(insn, insn.getOperand(1)) : rd;
            ib.emit(opcode, rd, a);
        }, mnemonic);
    }

    // zext rd, rs[, bytes]: extend the low bytes of rs, 4 by default
    private void extend(OpCode opcode, String mnemonic) {
        rule((insn, ib) -> {
            expectOperands(insn, 2, 3);
            Varnode rd = register(insn, insn.getOperand(0));
            Varnode rs = register(insn, insn.getOperand(1));
            int width = insn.numOperands() == 3 ? (int) target(insn, insn.getOperand(2)) : 4;
            if (width != 1 && width != 2 && width != 4) throw badOperands(insn);
            Varnode low = ib.op(OpCode.SUBPIECE, width, rs, Varnode.constant(0, 4));
            ib.emit(opcode, rd, low);
        }, mnemonic);
    }

    private void compareBranch(OpCode compare, boolean swap, String mnemonic) {
        rule((insn, ib) -> {
            expectOperands(insn, 3, 3);
            Varnode a = value(insn, insn.getOperand(0));
            Varnode b = value(insn, insn.getOperand(1));
            long target = target(insn, insn.getOperand(2));
            Varnode cond = swap ? ib.op(compare, 1, b, a) : ib.op(compare, 1, a, b);
            ib.cbranch(target, cond);
        }, mnemonic);
    }

    private Varnode value(DecodedInstruction insn, Operand op) {
        switch (op.getKind()) {
            case REGISTER:
                return register(insn, op);
            case IMMEDIATE:
                return Varnode.constant(((Operand.Immediate) op).value, 8);
            default:
                throw badOperands(insn);
        }
    }

    private static Operand.Memory memory(DecodedInstruction insn, Operand op) {
        if (op.getKind() != Operand.Kind.MEMORY) throw badOperands(insn);
        Operand.Memory mem = (Operand.Memory) op;
        if (mem.index != null || mem.base == null) throw badOperands(insn);
        return mem;
    }

    private static int accessSize(Operand.Memory mem) {
        return mem.size == 0 ? 8 : mem.size;
    }

    private Varnode address(DecodedInstruction insn, Operand.Memory mem, IRBuilder ib) {
        Varnode base = register(insn, new Operand.Register(mem.base));
        if (mem.disp == 0) return base;
        return ib.op(OpCode.INT_ADD, 8, base, Varnode.constant(mem.disp, 8));
    }
}
