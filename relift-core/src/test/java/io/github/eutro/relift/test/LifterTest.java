package io.github.eutro.relift.test;

import io.github.eutro.relift.core.diag.Diagnostic;
import io.github.eutro.relift.core.frontend.DecodedInstruction;
import io.github.eutro.relift.core.frontend.Lifter;
import io.github.eutro.relift.core.frontend.UnsupportedInstructionException;
import io.github.eutro.relift.core.frontend.ref.RefTranslator;
import io.github.eutro.relift.core.ir.OpCode;
import io.github.eutro.relift.core.ir.PcodeListing;
import io.github.eutro.relift.core.ir.PcodeOp;
import io.github.eutro.relift.core.ir.Varnode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.relift.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class LifterTest {
    @Test
    void testStraightLine() {
        PcodeListing listing = liftRef(
                "mov r1, 0",
                "mov r2, 10",
                "add r1, r1, r2",
                "return"
        );
        List<PcodeOp> ops = listing.getOps();
        assertEquals(4, ops.size());
        assertEquals(OpCode.COPY, ops.get(0).opcode);
        assertEquals(OpCode.COPY, ops.get(1).opcode);
        assertEquals(OpCode.INT_ADD, ops.get(2).opcode);
        assertEquals(OpCode.RETURN, ops.get(3).opcode);

        Varnode r1 = RefTranslator.REGISTERS.resolve("r1");
        assertEquals(r1, ops.get(0).getOutput());
        assertEquals(Varnode.constant(0, 8), ops.get(0).getInput(0));
        assertEquals(r1, ops.get(2).getOutput());
        assertEquals(RefTranslator.REGISTERS.resolve("r2"), ops.get(2).getInput(1));

        assertEquals(0x1008, ops.get(2).address);
        assertEquals(4, listing.getInstructions().size());
        assertEquals(PcodeListing.StopReason.END_OF_FUNCTION, listing.getStopReason());
        assertTrue(listing.getDiagnostics().isEmpty());
    }

    @Test
    void testContinuesPastReturnToPendingTarget() {
        PcodeListing listing = liftRef(
                "beq r1, 0, 0x100c",
                "mov r0, 1",
                "return",
                "mov r0, 2",
                "return",
                "mov r0, 3"
        );
        assertEquals(5, listing.getInstructions().size());
        assertFalse(listing.containsInstruction(0x1014));
        assertEquals(PcodeListing.StopReason.END_OF_FUNCTION, listing.getStopReason());
    }

    @Test
    void testStopsAtEndOfStream() {
        PcodeListing listing = liftRef("mov r1, 0", "add r1, r1, 1");
        assertEquals(PcodeListing.StopReason.END_OF_STREAM, listing.getStopReason());
        assertEquals(2, listing.getInstructions().size());
    }

    @Test
    void testCountLimit() {
        Lifter lifter = new Lifter(new RefTranslator(), Lifter.UnsupportedPolicy.ABORT, 2);
        PcodeListing listing = lifter.lift(ref("mov r1, 0", "mov r2, 0", "mov r3, 0", "return"), START);
        assertEquals(PcodeListing.StopReason.COUNT_LIMIT, listing.getStopReason());
        assertEquals(2, listing.getInstructions().size());
    }

    @Test
    void testAbortOnUnsupported() {
        Lifter lifter = new Lifter(new RefTranslator(), Lifter.UnsupportedPolicy.ABORT);
        UnsupportedInstructionException e = assertThrows(UnsupportedInstructionException.class,
                () -> lifter.lift(ref("mov r1, 0", "frobnicate r1", "return"), START));
        assertEquals("frobnicate", e.getMnemonic());
        assertEquals(0x1004, e.getAddress());
    }

    @Test
    void testPlaceholderForUnsupported() {
        Lifter lifter = new Lifter(new RefTranslator(), Lifter.UnsupportedPolicy.PLACEHOLDER);
        PcodeListing listing = lifter.lift(ref("frobnicate r1", "frobnicate r2", "wibble", "return"), START);

        List<PcodeOp> ops = listing.getOps();
        assertEquals(4, ops.size());
        assertEquals(OpCode.CALLOTHER, ops.get(0).opcode);
        assertEquals(0, ops.get(0).getInput(0).offset);
        assertEquals(0, ops.get(1).getInput(0).offset);
        assertEquals(1, ops.get(2).getInput(0).offset);
        assertEquals(2, listing.getUserOps().size());
        assertEquals("frobnicate", listing.getUserOps().get(0));
        assertEquals("wibble", listing.getUserOps().get(1));

        List<Diagnostic> diags = listing.getDiagnostics().ofKind(Diagnostic.Kind.UNSUPPORTED_INSTRUCTION);
        assertEquals(3, diags.size());
        assertEquals(0x1008, diags.get(2).getAddress());
    }

    @Test
    void testDuplicateAddresses() {
        Lifter lifter = new Lifter(new RefTranslator(), Lifter.UnsupportedPolicy.ABORT);
        List<DecodedInstruction> stream = ref("nop", "return");
        stream.addAll(ref("nop"));
        assertThrows(IllegalArgumentException.class, () -> lifter.lift(stream, START));
    }

    @Test
    void testIndirectBranchDoesNotEndWindow() {
        PcodeListing listing = liftRef(
                "br r3",
                "mov r0, 1",
                "return"
        );
        assertEquals(3, listing.getInstructions().size());
        assertEquals(PcodeListing.StopReason.END_OF_FUNCTION, listing.getStopReason());
    }
}
