package io.github.eutro.relift.core.passes.meta;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.BasicBlock;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.passes.InPlaceIRPass;

/**
 * Computes {@link BasicBlock#predecessors} for each block, from {@link Function#flowSuccessors(BasicBlock)}.
 * <p>
 * A block appears once per edge, so a conditional branch whose two edges meet lists its block twice.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);

        for (BasicBlock block : func.blocks) {
            block.predecessors.clear();
        }
        for (BasicBlock block : func.blocks) {
            for (int target : func.flowSuccessors(block)) {
                func.block(target).predecessors.add(block.id);
            }
        }

        ms.validate(MetadataState.PREDS);
    }
}
