package io.github.eutro.relift.test;

import io.github.eutro.relift.core.frontend.RegisterModel;
import io.github.eutro.relift.core.frontend.x86.X86Registers;
import io.github.eutro.relift.core.ir.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.relift.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class X86TranslatorTest {
    private static final RegisterModel REGS = X86Registers.MODEL;

    private static Varnode r(String name) {
        Varnode vn = REGS.resolve(name);
        assertNotNull(vn, name);
        return vn;
    }

    @Test
    void testRegisterAliasing() {
        assertEquals(r("rax").offset, r("eax").offset);
        assertEquals(r("rax").offset, r("al").offset);
        assertEquals(r("rax").offset + 1, r("ah").offset);
        assertEquals(4, r("eax").size);
        assertEquals(r("rax"), REGS.container(r("ah")));
        assertTrue(r("rax").contains(r("ax")));
        assertTrue(r("eax").overlaps(r("ah")));
        assertFalse(r("rax").overlaps(r("rcx")));
        assertEquals(r("rsp"), REGS.stackPointer());
        assertEquals(r("rdi"), REGS.argumentRegisters().get(0));
    }

    @Test
    void testDwordWriteZeroExtends() {
        List<PcodeOp> ops = liftX86("mov eax, 1", "ret").getOps();
        PcodeOp write = ops.get(0);
        assertEquals(OpCode.INT_ZEXT, write.opcode);
        assertEquals(r("rax"), write.getOutput());
        assertEquals(Varnode.constant(1, 4), write.getInput(0));
    }

    @Test
    void testByteWriteMerges() {
        List<PcodeOp> ops = liftX86("mov al, 1", "ret").getOps();
        PcodeOp last = null;
        for (PcodeOp op : ops) {
            if (r("rax").equals(op.getOutput())) last = op;
        }
        assertNotNull(last);
        assertEquals(OpCode.INT_OR, last.opcode);
        boolean masked = false;
        for (PcodeOp op : ops) {
            if (op.opcode == OpCode.INT_AND && op.getInput(0).equals(r("rax"))) {
                assertEquals(~0xFFL, op.getInput(1).offset);
                masked = true;
            }
        }
        assertTrue(masked);
    }

    @Test
    void testSubRegisterReadIsSubpiece() {
        List<PcodeOp> ops = liftX86("mov ebx, eax", "ret").getOps();
        assertEquals(OpCode.SUBPIECE, ops.get(0).opcode);
        assertEquals(r("rax"), ops.get(0).getInput(0));
        assertEquals(0, ops.get(0).getInput(1).offset);
        assertEquals(OpCode.INT_ZEXT, ops.get(1).opcode);
        assertEquals(r("rbx"), ops.get(1).getOutput());
    }

    @Test
    void testCompareAndJump() {
        PcodeListing listing = liftX86(
                "cmp rdi, rsi",
                "je 0x100c",
                "mov eax, 1",
                "ret"
        );
        List<PcodeOp> ops = listing.getOps();
        boolean zf = false;
        PcodeOp branch = null;
        for (PcodeOp op : ops) {
            if (X86Registers.ZF.equals(op.getOutput())) {
                assertEquals(OpCode.INT_EQUAL, op.opcode);
                zf = true;
            }
            if (op.opcode == OpCode.CBRANCH) branch = op;
        }
        assertTrue(zf);
        assertNotNull(branch);
        assertEquals(0x100c, branch.getTargetAddress());
        assertEquals(X86Registers.ZF, branch.getInput(1));
        assertTrue(REGS.isFlag(X86Registers.ZF));
    }

    @Test
    void testPushPop() {
        List<PcodeOp> ops = liftX86("push rbp", "pop rbx", "ret").getOps();
        assertEquals(OpCode.INT_SUB, ops.get(0).opcode);
        assertEquals(r("rsp"), ops.get(0).getOutput());
        assertEquals(8, ops.get(0).getInput(1).offset);
        assertEquals(OpCode.STORE, ops.get(1).opcode);
        assertEquals(r("rsp"), ops.get(1).getInput(0));
        assertEquals(r("rbp"), ops.get(1).getInput(1));

        assertEquals(OpCode.LOAD, ops.get(2).opcode);
        assertEquals(OpCode.INT_ADD, ops.get(3).opcode);
        assertEquals(r("rsp"), ops.get(3).getOutput());
        assertEquals(OpCode.COPY, ops.get(4).opcode);
        assertEquals(r("rbx"), ops.get(4).getOutput());
    }

    @Test
    void testRetPopsReturnAddress() {
        List<PcodeOp> ops = liftX86("ret").getOps();
        assertEquals(OpCode.LOAD, ops.get(0).opcode);
        assertEquals(OpCode.INT_ADD, ops.get(1).opcode);
        assertEquals(OpCode.RETURN, ops.get(2).opcode);
    }

    @Test
    void testScaledIndexAddress() {
        List<PcodeOp> ops = liftX86("mov rax, qword ptr [rbx + rcx*8 + 0x10]", "ret").getOps();
        assertEquals(OpCode.INT_MULT, ops.get(0).opcode);
        assertEquals(r("rcx"), ops.get(0).getInput(0));
        assertEquals(OpCode.INT_ADD, ops.get(1).opcode);
        assertEquals(OpCode.INT_ADD, ops.get(2).opcode);
        assertEquals(0x10, ops.get(2).getInput(1).offset);
        assertEquals(OpCode.LOAD, ops.get(3).opcode);
        assertEquals(OpCode.COPY, ops.get(4).opcode);
    }

    @Test
    void testCallDoesNotTouchStack() {
        List<PcodeOp> ops = liftX86("call 0x2000", "ret").getOps();
        assertEquals(OpCode.CALL, ops.get(0).opcode);
        assertEquals(0x2000, ops.get(0).getTargetAddress());
        assertEquals(OpCode.LOAD, ops.get(1).opcode);
    }
}
