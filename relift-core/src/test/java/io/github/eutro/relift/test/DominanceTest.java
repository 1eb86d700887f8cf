package io.github.eutro.relift.test;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.DominatorTree;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.passes.meta.ComputeDomFrontier;
import io.github.eutro.relift.core.passes.meta.ComputeDoms;
import io.github.eutro.relift.core.passes.meta.ComputePostDoms;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.relift.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class DominanceTest {
    @Test
    void testIfElse() {
        Function func = cfg(BuildCfgTest.IF_ELSE);
        metadata(func).ensureValid(func, MetadataState.DOM_FRONTIER, MetadataState.POST_DOMS);
        DominatorTree doms = func.getExtOrThrow(CommonExts.DOM_TREE);

        assertEquals(-1, doms.idom(0));
        assertEquals(0, doms.idom(1));
        assertEquals(0, doms.idom(2));
        assertEquals(0, doms.idom(3));
        assertTrue(doms.dominates(0, 3));
        assertFalse(doms.dominates(1, 3));
        assertTrue(doms.dominates(2, 2));
        assertFalse(doms.strictlyDominates(2, 2));
        assertEquals(0, doms.intersect(1, 2));
        assertEquals(Collections.singleton(3), doms.frontier(1));
        assertEquals(Collections.singleton(3), doms.frontier(2));
        assertTrue(doms.frontier(0).isEmpty());
        assertEquals(0, (int) doms.reversePostOrder().get(0));

        DominatorTree postDoms = func.getExtOrThrow(CommonExts.POST_DOM_TREE);
        int exit = func.size();
        assertEquals(exit, postDoms.getRoot());
        assertEquals(3, postDoms.idom(0));
        assertEquals(3, postDoms.idom(1));
        assertEquals(exit, postDoms.idom(3));
    }

    @Test
    void testLoopFrontier() {
        Function func = cfg(StructureTest.WHILE);
        metadata(func).ensureValid(func, MetadataState.DOM_FRONTIER);
        DominatorTree doms = func.getExtOrThrow(CommonExts.DOM_TREE);

        assertEquals(1, doms.idom(2));
        assertEquals(1, doms.idom(3));
        assertEquals(Collections.singleton(1), doms.frontier(2));
        assertEquals(Collections.singleton(1), doms.frontier(1));
        assertEquals(Arrays.asList(0, 2), func.block(1).predecessors);
    }

    @Test
    void testUnreachableBlock() {
        Function func = cfg("b 0x1008", "mov r1, 1", "return");
        assertEquals(3, func.size());
        metadata(func).ensureValid(func, MetadataState.DOMS);
        DominatorTree doms = func.getExtOrThrow(CommonExts.DOM_TREE);

        assertFalse(doms.isReachable(1));
        assertEquals(-1, doms.idom(1));
        assertEquals(0, doms.idom(2));
        assertFalse(doms.dominates(1, 2));
        assertFalse(doms.dominates(0, 1));
    }

    @Test
    void testUnknownSuccessorReachesEverything() {
        Function func = cfg("beq r1, 0, 0x100c", "br r2", "mov r0, 1", "return");
        metadata(func).ensureValid(func, MetadataState.DOMS);
        DominatorTree doms = func.getExtOrThrow(CommonExts.DOM_TREE);
        for (int i = 0; i < func.size(); i++) {
            assertTrue(doms.isReachable(i), "bb" + i);
        }
    }

    @Test
    void testIdempotent() {
        Function func = cfg(StructureTest.SWITCH_CHAIN);
        ComputeDoms.INSTANCE.run(func);
        ComputePostDoms.INSTANCE.run(func);
        DominatorTree doms = func.getExtOrThrow(CommonExts.DOM_TREE);
        DominatorTree postDoms = func.getExtOrThrow(CommonExts.POST_DOM_TREE);

        ComputeDoms.INSTANCE.then(ComputePostDoms.INSTANCE).then(ComputeDomFrontier.INSTANCE).run(func);
        assertEquals(doms, func.getExtOrThrow(CommonExts.DOM_TREE));
        assertEquals(postDoms, func.getExtOrThrow(CommonExts.POST_DOM_TREE));
        assertTrue(metadata(func).isValid(MetadataState.DOMS));
    }

    @Test
    void testGraphChangeInvalidates() {
        Function func = cfg(BuildCfgTest.IF_ELSE);
        MetadataState ms = metadata(func);
        ms.ensureValid(func, MetadataState.DOMS);
        assertTrue(ms.isValid(MetadataState.PREDS));
        ms.graphChanged();
        assertFalse(ms.isValid(MetadataState.DOMS));
        assertFalse(ms.isValid(MetadataState.PREDS));
    }
}
