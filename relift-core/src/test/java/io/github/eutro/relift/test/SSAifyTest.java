package io.github.eutro.relift.test;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.*;
import io.github.eutro.relift.core.passes.form.SSAify;
import io.github.eutro.relift.core.passes.meta.VerifySsa;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.github.eutro.relift.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class SSAifyTest {
    @Test
    void testStraightLine() {
        Function func = ssa("mov r1, 0", "mov r2, 10", "add r1, r1, r2", "return");
        List<PcodeOp> ops = func.entry().getOps();
        assertEquals(reg(1, 1), ops.get(0).getOutput());
        assertEquals(reg(2, 1), ops.get(1).getOutput());
        assertEquals(reg(1, 2), ops.get(2).getOutput());
        assertEquals(reg(1, 1), ops.get(2).getInput(0));
        assertEquals(reg(2, 1), ops.get(2).getInput(1));

        Map<Varnode, Varnode> reaching = ops.get(3).getExtOrThrow(CommonExts.REACHING_AT_RETURN);
        assertEquals(reg(1, 2), reaching.get(reg(1, 0)));
        assertEquals(reg(2, 1), reaching.get(reg(2, 0)));
        assertFalse(reaching.containsKey(reg(0, 0)));
        assertTrue(metadata(func).isValid(MetadataState.SSA_FORM));
    }

    @Test
    void testPhiAtJoin() {
        Function func = ssa(BuildCfgTest.IF_ELSE);
        BasicBlock join = func.block(3);
        PcodeOp phi = join.getOps().get(0);
        assertTrue(phi.isPhi());
        assertEquals(2, phi.numInputs());
        assertEquals(func.block(1).getOps().get(0).getOutput(), phi.getInput(0));
        assertEquals(func.block(2).getOps().get(0).getOutput(), phi.getInput(1));

        PcodeOp copy = join.getOps().get(1);
        assertEquals(OpCode.COPY, copy.opcode);
        assertEquals(phi.getOutput(), copy.getInput(0));
        assertEquals(1, join.getOps().stream().filter(PcodeOp::isPhi).count());

        // r1 is only read, so it keeps its entry value
        PcodeOp branch = func.entry().getOps().get(0);
        assertEquals(reg(1, 0), branch.getInput(0));
    }

    @Test
    void testLoopPhi() {
        Function func = ssa(StructureTest.WHILE);
        BasicBlock header = func.block(1);
        PcodeOp phi = header.getOps().get(0);
        assertTrue(phi.isPhi());
        assertEquals(reg(1, 0).unversioned(), phi.getOutput().unversioned());
        assertEquals(func.block(0).getOps().get(0).getOutput(), phi.getInput(0));
        assertEquals(func.block(2).getOps().get(0).getOutput(), phi.getInput(1));
        assertEquals(phi.getOutput(), func.block(2).getOps().get(0).getInput(0));
    }

    @Test
    void testEntryPhiHasEntrySlot() {
        Function func = ssa(
                "add r1, r1, 1",
                "blt r1, 10, 0x1000",
                "mov r0, r1",
                "return"
        );
        BasicBlock entry = func.entry();
        PcodeOp phi = entry.getOps().get(0);
        assertTrue(phi.isPhi());
        assertEquals(entry.predecessors.size() + 1, phi.numInputs());
        assertEquals(reg(1, 0), phi.getInput(phi.numInputs() - 1));
        assertEquals(phi.getOutput(), entry.getOps().get(1).getInput(0));
    }

    @Test
    void testDeadLocationsGetNoPhi() {
        Function func = ssa(
                "beq r1, 0, 0x100c",
                "mov r3, 1",
                "b 0x1010",
                "mov r3, 2",
                "mov r0, 0",
                "return"
        );
        assertFalse(func.block(3).getOps().get(0).isPhi());
    }

    @Test
    void testVerifyRejectsUndefinedUse() {
        Function func = ssa("mov r1, 0", "mov r2, 10", "add r1, r1, r2", "return");
        PcodeOp add = func.entry().getOps().get(2);
        add.setInput(1, reg(2, 5));
        assertThrows(IllegalStateException.class, () -> VerifySsa.INSTANCE.run(func));
    }

    @Test
    void testVerifyRejectsUseBeforeDef() {
        Function func = ssa("mov r1, 0", "mov r2, r1", "mov r1, 3", "return");
        PcodeOp second = func.entry().getOps().get(1);
        second.setInput(0, reg(1, 2));
        assertThrows(IllegalStateException.class, () -> VerifySsa.INSTANCE.run(func));
    }

    @Test
    void testSetInputRejectsOtherLocation() {
        Function func = ssa("mov r1, 0", "mov r2, r1", "return");
        PcodeOp copy = func.entry().getOps().get(1);
        assertThrows(MalformedOperationException.class, () -> copy.setInput(0, reg(3, 1)));
    }

    @Test
    void testIdempotent() {
        Function func = ssa(BuildCfgTest.IF_ELSE);
        int before = ops(func).size();
        new SSAify(true).run(func);
        assertEquals(before, ops(func).size());
    }
}
