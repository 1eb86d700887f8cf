package io.github.eutro.relift.core.passes.meta;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.BasicBlock;
import io.github.eutro.relift.core.ir.DominatorTree;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.passes.InPlaceIRPass;
import io.github.eutro.relift.core.structure.Loop;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Finds the natural loops of a function and attaches them as {@link CommonExts#LOOPS}, ordered by the
 * reverse postorder of their headers.
 * <p>
 * An edge {@code A -> H} is a back edge if {@code H} dominates {@code A}. The body of the loop is everything
 * that reaches a latch backwards without passing through the header. Only resolved successors count as edges;
 * the implicit edges of blocks with unknown successors are not loops.
 */
public class FindLoops implements InPlaceIRPass<Function> {
    private static final Logger logger = LogManager.getLogger(FindLoops.class);

    /**
     * A singleton instance of this pass.
     */
    public static final FindLoops INSTANCE = new FindLoops();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.DOMS);
        DominatorTree doms = func.getExtOrThrow(CommonExts.DOM_TREE);

        List<List<Integer>> preds = new ArrayList<>();
        for (int i = 0; i < func.size(); i++) {
            preds.add(new ArrayList<>());
        }
        Map<Integer, Set<Integer>> latches = new HashMap<>();
        for (BasicBlock block : func.blocks) {
            for (int succ : block.successors) {
                preds.get(succ).add(block.id);
                if (doms.dominates(succ, block.id)) {
                    latches.computeIfAbsent(succ, $ -> new TreeSet<>()).add(block.id);
                }
            }
        }

        List<Loop> loops = new ArrayList<>();
        for (int header : doms.reversePostOrder()) {
            Set<Integer> headerLatches = latches.get(header);
            if (headerLatches == null) continue;

            Set<Integer> body = new TreeSet<>();
            body.add(header);
            Deque<Integer> stack = new ArrayDeque<>(headerLatches);
            while (!stack.isEmpty()) {
                int node = stack.pop();
                if (!body.add(node)) continue;
                for (int pred : preds.get(node)) {
                    if (doms.dominates(header, pred) && !body.contains(pred)) {
                        stack.push(pred);
                    }
                }
            }

            Loop loop = classify(func, doms, header, headerLatches, body);
            logger.debug("{}: found {}", func.getName(), loop);
            loops.add(loop);
        }

        func.attachExt(CommonExts.LOOPS, Collections.unmodifiableList(loops));
        ms.validate(MetadataState.LOOPS);
    }

    private static Loop classify(Function func,
                                 DominatorTree doms,
                                 int header,
                                 Set<Integer> latches,
                                 Set<Integer> body) {
        BasicBlock head = func.block(header);
        if (!latches.contains(header) && head.isConditional()) {
            int exit = soleExit(head, body);
            if (exit != -1) {
                return new Loop(header, latches, body, Loop.Kind.WHILE, exit);
            }
        }
        if (latches.size() == 1) {
            BasicBlock latch = func.block(latches.iterator().next());
            if (latch.isConditional() && latch.successors.contains(header)) {
                int exit = soleExit(latch, body);
                if (exit != -1) {
                    return new Loop(header, latches, body, Loop.Kind.DO_WHILE, exit);
                }
            }
        }

        int follow = -1;
        for (int node : body) {
            for (int succ : func.block(node).successors) {
                if (body.contains(succ)) continue;
                if (follow == -1 || doms.rpoNumber(succ) < doms.rpoNumber(follow)) {
                    follow = succ;
                }
            }
        }
        return new Loop(header, latches, body, Loop.Kind.INFINITE_LOOP, follow);
    }

    // the successor outside the loop, if exactly one of the two is
    private static int soleExit(BasicBlock block, Set<Integer> body) {
        int taken = block.successors.get(0);
        int fallthrough = block.successors.get(1);
        boolean takenIn = body.contains(taken);
        boolean fallthroughIn = body.contains(fallthrough);
        if (takenIn == fallthroughIn) return -1;
        return takenIn ? fallthrough : taken;
    }
}
