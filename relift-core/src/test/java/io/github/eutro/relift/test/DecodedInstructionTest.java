package io.github.eutro.relift.test;

import io.github.eutro.relift.core.frontend.DecodedInstruction;
import io.github.eutro.relift.core.frontend.Operand;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DecodedInstructionTest {
    @Test
    void testParseOperands() {
        DecodedInstruction insn = DecodedInstruction.parse(0x1000, 4, "add r1, r2, 0x10");
        assertEquals("add", insn.getMnemonic());
        assertEquals(3, insn.numOperands());
        assertEquals(new Operand.Register("r1"), insn.getOperand(0));
        assertEquals(new Operand.Register("r2"), insn.getOperand(1));
        assertEquals(new Operand.Immediate(0x10), insn.getOperand(2));
        assertEquals(0x1004, insn.getNextAddress());
    }

    @Test
    void testParseMemory() {
        DecodedInstruction insn = DecodedInstruction.parse(0x1000, 7, "mov eax, dword ptr [rbx + rcx*4 - 0x8]");
        assertEquals(new Operand.Memory("rbx", "rcx", 4, -8, 4), insn.getOperand(1));

        DecodedInstruction noBase = DecodedInstruction.parse(0x1000, 7, "jmp qword ptr [rax*8 + 0x2000]");
        assertEquals(new Operand.Memory(null, "rax", 8, 0x2000, 8), noBase.getOperand(0));
    }

    @Test
    void testNoOperands() {
        DecodedInstruction insn = DecodedInstruction.parse(0x1000, 1, "  ret ");
        assertEquals("ret", insn.getMnemonic());
        assertTrue(insn.getOperands().isEmpty());
    }

    @Test
    void testParseAllLaysOutBackToBack() {
        List<DecodedInstruction> insns = DecodedInstruction.parseAll(0x2000, 4, "nop", "nop", "ret");
        assertEquals(3, insns.size());
        assertEquals(0x2000, insns.get(0).getAddress());
        assertEquals(0x2008, insns.get(2).getAddress());
    }

    @Test
    void testMalformed() {
        assertThrows(IllegalArgumentException.class, () -> DecodedInstruction.parse(0x1000, 4, ""));
        assertThrows(IllegalArgumentException.class, () -> DecodedInstruction.parse(0x1000, 4, "ld r1, [r2"));
        assertThrows(IllegalArgumentException.class, () -> DecodedInstruction.parse(0x1000, 4, "ld r1, tbyte ptr [r2]"));
        assertThrows(IllegalArgumentException.class, () -> DecodedInstruction.parse(0x1000, 4, "ld r1, [r2 - r3]"));
    }
}
