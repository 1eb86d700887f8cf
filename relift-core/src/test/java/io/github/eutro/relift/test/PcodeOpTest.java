package io.github.eutro.relift.test;

import io.github.eutro.relift.core.ir.MalformedOperationException;
import io.github.eutro.relift.core.ir.OpCode;
import io.github.eutro.relift.core.ir.PcodeOp;
import io.github.eutro.relift.core.ir.Varnode;
import org.junit.jupiter.api.Test;

import static io.github.eutro.relift.test.Utils.reg;
import static org.junit.jupiter.api.Assertions.*;

public class PcodeOpTest {
    private static final Varnode BYTE = Varnode.unique(0x10, 1);

    @Test
    void testWellFormed() {
        PcodeOp add = new PcodeOp(OpCode.INT_ADD, 0x1000, reg(0, 0), reg(1, 0), Varnode.constant(4, 8));
        assertEquals("reg:0x0:8 = INT_ADD reg:0x8:8, const:0x4:8", add.toString());
        assertTrue(add.isValueInput(0));
        assertFalse(add.isValueInput(1));

        PcodeOp branch = new PcodeOp(OpCode.CBRANCH, 0x1004, null, Varnode.ram(0x2000, 8), BYTE);
        assertEquals(0x2000, branch.getTargetAddress());
        assertTrue(branch.isAddressInput(0));
        assertFalse(branch.isValueInput(0));
        assertTrue(branch.isValueInput(1));
    }

    @Test
    void testArity() {
        MalformedOperationException e = assertThrows(MalformedOperationException.class,
                () -> new PcodeOp(OpCode.INT_ADD, 0x1000, reg(0, 0), reg(1, 0)));
        assertEquals(OpCode.INT_ADD, e.getOpcode());
        assertEquals(0x1000, e.getAddress());
        assertThrows(MalformedOperationException.class, () -> new PcodeOp(OpCode.MULTIEQUAL, 0, reg(0, 1)));
    }

    @Test
    void testOutputPresence() {
        assertThrows(MalformedOperationException.class, () -> new PcodeOp(OpCode.COPY, 0, null, reg(1, 0)));
        assertThrows(MalformedOperationException.class,
                () -> new PcodeOp(OpCode.BRANCH, 0, reg(0, 0), Varnode.ram(0x1000, 8)));
        assertThrows(MalformedOperationException.class,
                () -> new PcodeOp(OpCode.COPY, 0, Varnode.constant(1, 8), reg(1, 0)));
    }

    @Test
    void testSizes() {
        assertThrows(MalformedOperationException.class,
                () -> new PcodeOp(OpCode.INT_ADD, 0, reg(0, 0), reg(1, 0), Varnode.constant(1, 4)));
        assertThrows(MalformedOperationException.class,
                () -> new PcodeOp(OpCode.INT_EQUAL, 0, reg(0, 0), reg(1, 0), reg(2, 0)));
        assertThrows(MalformedOperationException.class,
                () -> new PcodeOp(OpCode.CBRANCH, 0, null, Varnode.ram(0x1000, 8), reg(1, 0)));
        assertThrows(MalformedOperationException.class,
                () -> new PcodeOp(OpCode.INT_ZEXT, 0, Varnode.unique(0, 4), reg(1, 0)));
        assertThrows(MalformedOperationException.class,
                () -> new PcodeOp(OpCode.SUBPIECE, 0, Varnode.unique(0, 4), reg(1, 0), Varnode.constant(6, 4)));
        assertThrows(MalformedOperationException.class,
                () -> new PcodeOp(OpCode.SUBPIECE, 0, Varnode.unique(0, 4), reg(1, 0), reg(2, 0)));
        new PcodeOp(OpCode.SUBPIECE, 0, Varnode.unique(0, 4), reg(1, 0), Varnode.constant(4, 4));
        new PcodeOp(OpCode.INT_EQUAL, 0, BYTE, reg(1, 0), reg(2, 0));
    }

    @Test
    void testReplaceKeepsLocation() {
        PcodeOp copy = new PcodeOp(OpCode.COPY, 0, reg(0, 0), reg(1, 0));
        copy.setInput(0, reg(1, 3));
        copy.setOutput(reg(0, 2));
        assertEquals(reg(1, 3), copy.getInput(0));
        assertEquals(reg(0, 2), copy.getOutput());
        assertThrows(MalformedOperationException.class, () -> copy.setOutput(reg(2, 1)));

        PcodeOp ret = new PcodeOp(OpCode.RETURN, 0, null, reg(0, 0));
        assertThrows(IllegalStateException.class, () -> ret.setOutput(reg(0, 1)));
        assertThrows(IllegalStateException.class, ret::getTargetAddress);
    }

    @Test
    void testVarnodes() {
        assertEquals("reg:0x8:8#1", reg(1, 1).toString());
        Varnode r1 = reg(1, 0);
        assertSame(r1, r1.unversioned());
        assertEquals(reg(1, 0), reg(1, 7).unversioned());
        assertEquals(-1, Varnode.constant(0xFF, 1).signedValue());
        assertEquals(0xFF, Varnode.mask(-1, 1));
        assertThrows(IllegalArgumentException.class, () -> Varnode.constant(1, 8).withVersion(1));
        assertThrows(IllegalArgumentException.class, () -> Varnode.register(0, 0));
        assertTrue(Varnode.register(0, 8).contains(Varnode.register(4, 4)));
        assertTrue(Varnode.register(0, 8).overlaps(Varnode.register(7, 2)));
        assertFalse(Varnode.register(0, 8).overlaps(Varnode.register(8, 8)));
    }

    @Test
    void testCatalogNumbering() {
        for (OpCode op : OpCode.values()) {
            assertSame(op, OpCode.byNumber(op.getNumber()));
        }
        assertEquals(OpCode.COPY, OpCode.byNumber(1));
        assertEquals(OpCode.INT_ADD, OpCode.byNumber(19));
        assertEquals(OpCode.MULTIEQUAL, OpCode.byNumber(60));
        assertThrows(IllegalArgumentException.class, () -> OpCode.byNumber(-1));
        assertThrows(IllegalArgumentException.class, () -> OpCode.byNumber(1000));
    }
}
