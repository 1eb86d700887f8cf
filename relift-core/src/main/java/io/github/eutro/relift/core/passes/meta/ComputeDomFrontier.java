package io.github.eutro.relift.core.passes.meta;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.BasicBlock;
import io.github.eutro.relift.core.ir.DominatorTree;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.passes.InPlaceIRPass;

/**
 * Computes the {@link DominatorTree#frontier(int) dominance frontier} of each block.
 */
public class ComputeDomFrontier implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDomFrontier INSTANCE = new ComputeDomFrontier();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.DOMS, MetadataState.PREDS);
        DominatorTree tree = func.getExtOrThrow(CommonExts.DOM_TREE);

        // Cooper, Keith D.; Harvey, Timothy J.; Kennedy, Ken (2001). "A Simple, Fast Dominance Algorithm"
        for (BasicBlock block : func.blocks) {
            tree.frontier(block.id).clear();
        }
        for (BasicBlock block : func.blocks) {
            // the entry is also reached from outside the function
            int edges = block.predecessors.size() + (block.id == 0 ? 1 : 0);
            if (!tree.isReachable(block.id) || edges < 2) continue;
            for (int pred : block.predecessors) {
                if (!tree.isReachable(pred)) continue;
                int runner = pred;
                while (runner != -1 && runner != tree.idom(block.id)) {
                    tree.frontier(runner).add(block.id);
                    runner = tree.idom(runner);
                }
            }
        }

        ms.validate(MetadataState.DOM_FRONTIER);
    }
}
