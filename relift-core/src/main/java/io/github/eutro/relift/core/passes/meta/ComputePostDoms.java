package io.github.eutro.relift.core.passes.meta;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.BasicBlock;
import io.github.eutro.relift.core.ir.DominatorTree;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the {@link CommonExts#POST_DOM_TREE} of a function.
 * <p>
 * This is the dominator tree of the reversed graph of resolved edges, rooted at a virtual exit node,
 * numbered {@link Function#size()}, which every block without successors flows to.
 * Blocks that cannot reach an exit, such as those in infinite loops, are unreachable in it.
 */
public class ComputePostDoms implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePostDoms INSTANCE = new ComputePostDoms();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);

        int exit = func.size();
        List<List<Integer>> reverseSuccs = new ArrayList<>();
        List<List<Integer>> reversePreds = new ArrayList<>();
        for (int i = 0; i <= exit; i++) {
            reverseSuccs.add(new ArrayList<>());
            reversePreds.add(new ArrayList<>());
        }
        for (BasicBlock block : func.blocks) {
            if (block.successors.isEmpty()) {
                reverseSuccs.get(exit).add(block.id);
                reversePreds.get(block.id).add(exit);
            }
            for (int succ : block.successors) {
                reverseSuccs.get(succ).add(block.id);
                reversePreds.get(block.id).add(succ);
            }
        }

        DominatorTree tree = ComputeDoms.solve(exit, exit + 1, reverseSuccs::get, reversePreds::get);
        func.attachExt(CommonExts.POST_DOM_TREE, tree);

        ms.validate(MetadataState.POST_DOMS);
    }
}
