package io.github.eutro.relift.test;

import io.github.eutro.relift.core.diag.Diagnostic;
import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.frontend.Lifter;
import io.github.eutro.relift.core.frontend.MemoryImage;
import io.github.eutro.relift.core.frontend.ref.RefTranslator;
import io.github.eutro.relift.core.ir.*;
import io.github.eutro.relift.core.passes.IRPass;
import io.github.eutro.relift.core.passes.convert.BuildCfg;
import io.github.eutro.relift.core.passes.meta.ComputeDoms;
import io.github.eutro.relift.core.passes.meta.ComputePostDoms;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.relift.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class BuildCfgTest {
    static final String[] IF_ELSE = {
            "beq r1, 0, 0x100c",
            "mov r2, 1",
            "b 0x1010",
            "mov r2, 2",
            "mov r0, r2",
            "return",
    };

    static final String[] JUMP_TABLE = {
            "shl r2, r1, 3",
            "add r2, r2, 0x2000",
            "ld r3, [r2]",
            "br r3",
            "mov r0, 1",
            "b 0x1028",
            "mov r0, 2",
            "b 0x1028",
            "mov r0, 3",
            "b 0x1028",
            "return",
    };

    static MemoryImage table(long... entries) {
        ByteBuffer buf = ByteBuffer.allocate(entries.length * 8).order(ByteOrder.LITTLE_ENDIAN);
        for (long entry : entries) {
            buf.putLong(entry);
        }
        return MemoryImage.ofBytes(0x2000, buf.array());
    }

    @Test
    void testStraightLine() {
        Function func = cfg("mov r1, 0", "mov r2, 10", "add r1, r1, r2", "return");
        assertEquals(1, func.size());
        assertTrue(func.entry().successors.isEmpty());
        assertEquals(4, func.entry().getOps().size());
        assertEquals("func_1000", func.getName());
    }

    @Test
    void testIfElse() {
        Function func = cfg(IF_ELSE);
        assertEquals(4, func.size());
        assertEquals(Arrays.asList(2, 1), func.block(0).successors);
        assertTrue(func.block(0).isConditional());
        assertEquals(0x1004, func.block(1).getStartAddress());
        assertEquals(0x1008, func.block(1).getEndAddress());
        assertEquals(Collections.singletonList(3), func.block(1).successors);
        assertEquals(Collections.singletonList(3), func.block(2).successors);
        assertTrue(func.block(3).successors.isEmpty());
        assertTrue(func.getDiagnostics().isEmpty());
    }

    @Test
    void testCallSplitsBlock() {
        Function func = cfg("mov r1, 1", "call 0x5000", "mov r0, r1", "return");
        assertEquals(2, func.size());
        assertEquals(Collections.singletonList(1), func.block(0).successors);
        assertNull(func.block(0).getTerminator());
        assertEquals(OpCode.CALL, func.block(0).getOps().get(1).opcode);
    }

    @Test
    void testBranchOutsideWindow() {
        Function func = cfg("beq r1, 0, 0x9000", "return");
        assertEquals(Collections.singletonList(1), func.block(0).successors);
        assertTrue(func.getDiagnostics().has(Diagnostic.Kind.UNRESOLVED_CONTROL_FLOW));
    }

    @Test
    void testUnresolvedIndirectBranch() {
        Function func = cfg("mov r1, 0", "br r3", "mov r0, 1", "return");
        BasicBlock entry = func.entry();
        assertTrue(entry.hasUnknownSuccessor());
        assertTrue(entry.successors.isEmpty());
        assertEquals(Collections.singletonList(1), func.flowSuccessors(entry));
        assertEquals(1, func.getDiagnostics().ofKind(Diagnostic.Kind.UNRESOLVED_CONTROL_FLOW).size());
    }

    @Test
    void testJumpTable() {
        PcodeListing listing = liftRef(JUMP_TABLE);
        Function func = new BuildCfg(table(0x1010, 0x1018, 0x1020), 16).run(listing);

        assertEquals(5, func.size());
        BasicBlock entry = func.entry();
        assertFalse(entry.hasUnknownSuccessor());
        assertEquals(Arrays.asList(1, 2, 3), entry.successors);

        JumpTable table = entry.getExtOrThrow(CommonExts.JUMP_TABLE);
        assertEquals(0x2000, table.getTableAddress());
        assertEquals(8, table.getEntrySize());
        assertEquals(reg(1, 0), table.getIndex());
        assertEquals(Arrays.asList(0x1010L, 0x1018L, 0x1020L), table.getTargets());
        assertTrue(func.getDiagnostics().isEmpty());
    }

    @Test
    void testJumpTableStopsAtForeignEntry() {
        PcodeListing listing = liftRef(JUMP_TABLE);
        Function func = new BuildCfg(table(0x1010, 0x1018, 0x7777, 0x1020), 16).run(listing);
        assertEquals(Arrays.asList(1, 2), func.entry().successors);
    }

    @Test
    void testJumpTableWithoutImage() {
        Function func = BuildCfg.INSTANCE.run(liftRef(JUMP_TABLE));
        assertTrue(func.entry().hasUnknownSuccessor());
        assertNull(func.entry().getNullable(CommonExts.JUMP_TABLE));
    }

    @Test
    void testEmptyListing() {
        PcodeListing listing = new Lifter(new RefTranslator(), Lifter.UnsupportedPolicy.ABORT)
                .lift(ref("return"), 0x4000);
        assertThrows(IllegalArgumentException.class, () -> BuildCfg.INSTANCE.run(listing));
    }

    @Test
    void testChainReportsFailingPass() {
        PcodeListing listing = new Lifter(new RefTranslator(), Lifter.UnsupportedPolicy.ABORT)
                .lift(ref("return"), 0x4000);
        IRPass<PcodeListing, Function> chain = BuildCfg.INSTANCE
                .then(ComputeDoms.INSTANCE)
                .then(ComputePostDoms.INSTANCE);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> chain.run(listing));
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().contains("pass 0 (BuildCfg)"), e.getSuppressed()[0].getMessage());
    }

    @Test
    void testChainRunsInOrder() {
        Function func = BuildCfg.INSTANCE
                .then(ComputeDoms.INSTANCE)
                .then(ComputePostDoms.INSTANCE)
                .run(liftRef(IF_ELSE));
        assertTrue(metadata(func).isValid(MetadataState.DOMS));
        assertTrue(metadata(func).isValid(MetadataState.POST_DOMS));
        assertEquals(3, func.getExtOrThrow(CommonExts.POST_DOM_TREE).idom(0));
        assertFalse(BuildCfg.INSTANCE.then(ComputeDoms.INSTANCE).isInPlace());
        assertTrue(ComputeDoms.INSTANCE.then(ComputePostDoms.INSTANCE).isInPlace());
    }
}
