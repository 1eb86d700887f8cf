package io.github.eutro.relift.embed.test;

import io.github.eutro.relift.core.diag.Diagnostic;
import io.github.eutro.relift.core.frontend.DecodedInstruction;
import io.github.eutro.relift.core.frontend.Lifter;
import io.github.eutro.relift.core.ir.OpCode;
import io.github.eutro.relift.core.structure.StructNode;
import io.github.eutro.relift.embed.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

public class DecompilerTest {
    private static final String[] LOOP = {
            "mov r1, 0",
            "bge r1, r2, 0x1010",
            "add r1, r1, 1",
            "b 0x1004",
            "mov r0, r1",
            "return",
    };

    static List<DecodedInstruction> ref(long start, String... lines) {
        return DecodedInstruction.parseAll(start, 4, lines);
    }

    @Test
    void testFullPipeline() {
        Decompilation result = new Decompiler().decompile(ref(0x1000, LOOP), 0x1000);
        assertTrue(result.isSuccessful());
        assertEquals(Stage.RENDER, result.getCompletedStage());
        assertEquals(0x1000, result.getAddress());
        assertFalse(result.getOps().isEmpty());
        assertNotNull(result.getDominators());
        assertNotNull(result.getPostDominators());
        assertNotNull(result.getTypes());
        StructNode structure = result.getStructure();
        assertNotNull(structure);
        assertEquals(StructNode.Kind.WHILE, structure.getChild(1).getKind());
        String text = result.getPseudocode();
        assertNotNull(text);
        assertTrue(text.startsWith("int64_t func_1000(int64_t r1, int64_t r2)"), text);
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void testStopAfterStage() {
        Decompiler decompiler = new Decompiler(DecompilerOptions.builder().stopAfter(Stage.SSA).build());
        Decompilation result = decompiler.decompile(ref(0x1000, LOOP), 0x1000);
        assertEquals(Stage.SSA, result.getCompletedStage());
        assertNotNull(result.getFunction());
        assertTrue(result.getFunction().block(1).getOps().get(0).isPhi());
        assertNull(result.getTypes());
        assertNull(result.getStructure());
        assertNull(result.getPseudocode());

        Decompilation translated = new Decompiler(DecompilerOptions.builder().stopAfter(Stage.TRANSLATE).build())
                .decompile(ref(0x1000, LOOP), 0x1000);
        assertNull(translated.getFunction());
        assertEquals(OpCode.COPY, translated.getOps().get(0).opcode);
    }

    @Test
    void testPlaceholderKeepsGoing() {
        Decompilation result = new Decompiler().decompile(ref(0x1000, "frobnicate r1", "mov r0, r1", "return"), 0x1000);
        assertTrue(result.isSuccessful());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals(Diagnostic.Kind.UNSUPPORTED_INSTRUCTION, result.getDiagnostics().get(0).getKind());
        assertTrue(result.getPseudocode().contains("frobnicate("), result.getPseudocode());
    }

    @Test
    void testAbortRefuses() {
        Decompiler decompiler = new Decompiler(DecompilerOptions.builder()
                .unsupportedPolicy(Lifter.UnsupportedPolicy.ABORT)
                .build());
        FunctionRefusedException e = assertThrows(FunctionRefusedException.class,
                () -> decompiler.decompile(ref(0x1000, "mov r1, 0", "frobnicate r1", "return"), 0x1000));
        assertEquals(0x1000, e.getAddress());
        assertNotNull(e.getCause());
    }

    @Test
    void testFailuresAreIsolated() {
        Decompiler decompiler = new Decompiler(DecompilerOptions.builder()
                .unsupportedPolicy(Lifter.UnsupportedPolicy.ABORT)
                .parallelism(2)
                .build());
        Map<Long, List<DecodedInstruction>> functions = new TreeMap<>();
        functions.put(0x1000L, ref(0x1000, LOOP));
        functions.put(0x2000L, ref(0x2000, "frobnicate r1", "return"));
        functions.put(0x3000L, ref(0x3000, "mov r0, 7", "return"));
        // entry outside the stream translates to nothing
        functions.put(0x4000L, ref(0x5000, "return"));

        Map<Long, Decompilation> results = decompiler.decompileAll(functions);
        assertEquals(4, results.size());
        assertTrue(results.get(0x1000L).isSuccessful());
        assertTrue(results.get(0x3000L).isSuccessful());
        assertTrue(results.get(0x3000L).getPseudocode().contains("r0_1 = 7;"));

        Decompilation aborted = results.get(0x2000L);
        assertFalse(aborted.isSuccessful());
        assertNull(aborted.getCompletedStage());
        assertEquals(0x2000, aborted.getFailure().getAddress());

        Decompilation empty = results.get(0x4000L);
        assertFalse(empty.isSuccessful());
        assertEquals(Stage.TRANSLATE, empty.getCompletedStage());
        assertNotNull(empty.getListing());
        assertNull(empty.getFunction());
    }

    @Test
    void testX86() {
        Decompiler decompiler = new Decompiler(DecompilerOptions.builder().isa(Isa.X86_64).build());
        Decompilation result = decompiler.decompile(ref(0x1000,
                "mov eax, edi",
                "add eax, esi",
                "ret"
        ), 0x1000);
        assertTrue(result.isSuccessful(), String.valueOf(result.getFailure()));
        assertTrue(result.getPseudocode().contains("func_1000(int64_t rdi, int64_t rsi)"), result.getPseudocode());
    }

    @Test
    void testOptions() {
        DecompilerOptions options = DecompilerOptions.builder()
                .maxInstructions(10)
                .minSwitchCases(5)
                .parallelism(3)
                .verifySsa(false)
                .build();
        assertEquals(10, options.getMaxInstructions());
        assertEquals(5, options.getMinSwitchCases());
        assertEquals(3, options.getParallelism());
        assertFalse(options.isVerifySsa());
        assertEquals(Isa.REF, options.getIsa());
        assertEquals(Stage.RENDER, options.getStopStage());
        assertThrows(IllegalArgumentException.class, () -> DecompilerOptions.builder().maxInstructions(-1));
        assertThrows(IllegalArgumentException.class, () -> DecompilerOptions.builder().parallelism(0));
        assertThrows(IllegalArgumentException.class,
                () -> new Decompiler(DecompilerOptions.builder().minSwitchCases(1).build()));

        assertTrue(Stage.CFG.isIncludedIn(Stage.SSA));
        assertFalse(Stage.RENDER.isIncludedIn(Stage.TYPES));
    }

    @Test
    void testCountLimit() {
        Decompilation result = new Decompiler(DecompilerOptions.builder().maxInstructions(2).build())
                .decompile(ref(0x1000, LOOP), 0x1000);
        assertTrue(result.isSuccessful());
        assertEquals(2, result.getListing().getInstructions().size());
    }
}
