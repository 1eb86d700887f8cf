package io.github.eutro.relift.test;

import io.github.eutro.relift.core.diag.Diagnostic;
import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.passes.convert.BuildCfg;
import io.github.eutro.relift.core.passes.form.SSAify;
import io.github.eutro.relift.core.passes.meta.RecoverStructure;
import io.github.eutro.relift.core.structure.Loop;
import io.github.eutro.relift.core.structure.StructNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static io.github.eutro.relift.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class StructureTest {
    static final String[] WHILE = {
            "mov r1, 0",
            "bge r1, r2, 0x1010",
            "add r1, r1, 1",
            "b 0x1004",
            "mov r0, r1",
            "return",
    };

    static final String[] DO_WHILE = {
            "mov r1, 0",
            "add r1, r1, 1",
            "blt r1, r2, 0x1004",
            "mov r0, r1",
            "return",
    };

    static final String[] INFINITE = {
            "mov r1, 0",
            "add r1, r1, 1",
            "b 0x1004",
    };

    static final String[] BREAK = {
            "mov r1, 0",
            "bge r1, r2, 0x1014",
            "beq r1, 7, 0x1014",
            "add r1, r1, 1",
            "b 0x1004",
            "mov r0, r1",
            "return",
    };

    static final String[] SWITCH_CHAIN = {
            "beq r1, 1, 0x1014",
            "beq r1, 2, 0x101c",
            "beq r1, 3, 0x1024",
            "mov r0, 0",
            "b 0x102c",
            "mov r0, 10",
            "b 0x102c",
            "mov r0, 20",
            "b 0x102c",
            "mov r0, 30",
            "b 0x102c",
            "return",
    };

    // two entries into the cycle 1 -> 2 -> 3 -> 1
    static final String[] IRREDUCIBLE = {
            "beq r1, 0, 0x1010",
            "add r2, r2, 1",
            "bge r2, 10, 0x101c",
            "sub r2, r2, 3",
            "add r2, r2, 2",
            "blt r2, 7, 0x1004",
            "mov r0, r2",
            "return",
    };

    static List<Loop> loops(Function func) {
        metadata(func).ensureValid(func, MetadataState.LOOPS);
        return func.getExtOrThrow(CommonExts.LOOPS);
    }

    static void assertPlacedOnce(Function func, StructNode root) {
        int[] counts = placements(func, root);
        for (int i = 0; i < counts.length; i++) {
            assertEquals(1, counts[i], "bb" + i + " in " + root);
        }
    }

    @Test
    void testStraightLine() {
        Function func = ssa("mov r1, 0", "mov r2, 10", "add r1, r1, r2", "return");
        assertTrue(loops(func).isEmpty());
        assertEquals("sequence(block(0))", structure(func).toString());
    }

    @Test
    void testIfElse() {
        Function func = ssa(BuildCfgTest.IF_ELSE);
        StructNode root = structure(func);
        assertEquals("sequence(if-then-else(!0, sequence(block(1)), sequence(block(2))), block(3))", root.toString());
        assertPlacedOnce(func, root);
        assertFalse(func.getDiagnostics().has(Diagnostic.Kind.UNSTRUCTURED_REGION));
    }

    @Test
    void testIfThen() {
        Function func = ssa(
                "beq r1, 0, 0x1008",
                "mov r1, 5",
                "mov r0, r1",
                "return"
        );
        assertEquals("sequence(if-then(!0, sequence(block(1))), block(2))", structure(func).toString());
    }

    @Test
    void testWhileLoop() {
        Function func = ssa(WHILE);
        List<Loop> loops = loops(func);
        assertEquals(1, loops.size());
        Loop loop = loops.get(0);
        assertEquals(1, loop.getHeader());
        assertEquals(Collections.singletonList(2), loop.getLatches());
        assertEquals(Loop.Kind.WHILE, loop.getKind());
        assertEquals(3, loop.getFollow());
        assertTrue(loop.contains(2));
        assertFalse(loop.contains(3));

        StructNode root = structure(func);
        assertEquals("sequence(block(0), while(!1, sequence(block(2))), block(3))", root.toString());
        assertPlacedOnce(func, root);
    }

    @Test
    void testDoWhileLoop() {
        Function func = ssa(DO_WHILE);
        Loop loop = loops(func).get(0);
        assertEquals(1, loop.getHeader());
        assertEquals(Loop.Kind.DO_WHILE, loop.getKind());
        assertEquals(2, loop.getFollow());

        StructNode root = structure(func);
        assertEquals("sequence(block(0), do-while(1, sequence()), block(2))", root.toString());
        assertPlacedOnce(func, root);
    }

    @Test
    void testInfiniteLoop() {
        Function func = ssa(INFINITE);
        Loop loop = loops(func).get(0);
        assertEquals(Loop.Kind.INFINITE_LOOP, loop.getKind());
        assertEquals(-1, loop.getFollow());

        StructNode root = structure(func);
        assertEquals("sequence(block(0), infinite-loop(1, sequence(block(1))))", root.toString());
        assertPlacedOnce(func, root);
    }

    @Test
    void testBreak() {
        Function func = ssa(BREAK);
        Loop loop = loops(func).get(0);
        assertEquals(Loop.Kind.WHILE, loop.getKind());
        assertEquals(new HashSet<>(Arrays.asList(1, 2, 3)), loop.getBody());
        assertEquals(4, loop.getFollow());

        StructNode root = structure(func);
        assertEquals("sequence(block(0), while(!1, sequence(if-then(2, sequence(break)), block(3))), block(4))",
                root.toString());
        assertPlacedOnce(func, root);
        assertFalse(func.getDiagnostics().has(Diagnostic.Kind.UNSTRUCTURED_REGION));
    }

    @Test
    void testLoopsAreExhaustive() {
        Function func = ssa(
                "mov r1, 0",
                "mov r3, 0",
                "add r3, r3, 1",
                "blt r3, 4, 0x1008",
                "add r1, r1, 1",
                "blt r1, r2, 0x1004",
                "mov r0, r1",
                "return"
        );
        List<Loop> loops = loops(func);
        assertEquals(2, loops.size());
        Loop outer = loops.get(0);
        Loop inner = loops.get(1);
        assertTrue(outer.getBody().containsAll(inner.getBody()));
        assertTrue(outer.getBody().size() > inner.getBody().size());
        for (Loop loop : loops) {
            for (int latch : loop.getLatches()) {
                assertTrue(func.block(latch).successors.contains(loop.getHeader()));
            }
        }
        assertPlacedOnce(func, structure(func));
    }

    @Test
    void testSwitchFromCompareChain() {
        Function func = ssa(SWITCH_CHAIN);
        StructNode root = structure(func);
        List<StructNode> switches = ofKind(root, StructNode.Kind.SWITCH);
        assertEquals(1, switches.size());
        StructNode sw = switches.get(0);
        assertEquals(0, sw.getBlock());
        assertEquals(reg(1, 0), sw.getSwitchValue());

        List<StructNode.Case> cases = sw.getCases();
        assertEquals(4, cases.size());
        assertEquals(Collections.singletonList(1L), cases.get(0).getValues());
        assertEquals("sequence(block(4))", cases.get(0).getBody().toString());
        assertEquals(Collections.singletonList(3L), cases.get(2).getValues());
        assertTrue(cases.get(3).isDefault());
        assertEquals("sequence(block(3))", cases.get(3).getBody().toString());

        assertEquals(StructNode.Kind.BLOCK, root.getChild(1).getKind());
        assertEquals(7, root.getChild(1).getBlock());
    }

    @Test
    void testShortChainStaysIf() {
        Function func = ssa(SWITCH_CHAIN);
        new RecoverStructure(4, RecoverStructure.DEFAULT_STEP_BUDGET).run(func);
        StructNode root = func.getExtOrThrow(CommonExts.STRUCTURE);
        assertTrue(ofKind(root, StructNode.Kind.SWITCH).isEmpty());
        assertEquals(StructNode.Kind.IF_THEN_ELSE, root.getChild(0).getKind());
    }

    @Test
    void testSwitchFromJumpTable() {
        Function func = new BuildCfg(BuildCfgTest.table(0x1010, 0x1018, 0x1010), 16)
                .then(new SSAify(true))
                .run(liftRef(BuildCfgTest.JUMP_TABLE));
        StructNode root = structure(func);
        StructNode sw = ofKind(root, StructNode.Kind.SWITCH).get(0);
        assertEquals(0, sw.getBlock());
        assertEquals(reg(1, 0), sw.getSwitchValue());
        assertEquals(2, sw.getCases().size());
        assertEquals(Arrays.asList(0L, 2L), sw.getCases().get(0).getValues());
        assertEquals(Collections.singletonList(1L), sw.getCases().get(1).getValues());
    }

    @Test
    void testIrreducibleFallsBackToGoto() {
        Function func = ssa(IRREDUCIBLE);
        assertTrue(loops(func).isEmpty());
        StructNode root = structure(func);
        assertFalse(ofKind(root, StructNode.Kind.GOTO).isEmpty());
        assertTrue(func.getDiagnostics().has(Diagnostic.Kind.UNSTRUCTURED_REGION));
        assertPlacedOnce(func, root);
    }

    @Test
    void testStepBudget() {
        Function func = ssa(IRREDUCIBLE);
        new RecoverStructure(RecoverStructure.DEFAULT_MIN_SWITCH_CASES, 0).run(func);
        StructNode root = func.getExtOrThrow(CommonExts.STRUCTURE);
        assertFalse(ofKind(root, StructNode.Kind.GOTO).isEmpty());
        for (int i = 0; i < func.size(); i++) {
            assertTrue(placements(func, root)[i] >= 1, "bb" + i);
        }
    }

    @Test
    void testRejectsTinySwitches() {
        assertThrows(IllegalArgumentException.class, () -> new RecoverStructure(1, 10));
    }
}
