package io.github.eutro.relift.core.passes.meta;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.CommonExts.LiveData;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.BasicBlock;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.ir.PcodeOp;
import io.github.eutro.relift.core.ir.Varnode;
import io.github.eutro.relift.core.passes.InPlaceIRPass;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.ListIterator;
import java.util.Set;

/**
 * Computes the {@link CommonExts#LIVE_DATA} for each block, over unversioned locations.
 */
public class ComputeLiveVars implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLiveVars INSTANCE = new ComputeLiveVars();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS);

        for (BasicBlock block : func.blocks) {
            LiveData data = new LiveData();
            block.attachExt(CommonExts.LIVE_DATA, data);
            Set<Varnode> used = data.gen;
            Set<Varnode> assigned = data.kill;

            for (PcodeOp op : block.getOps()) {
                if (!op.isPhi()) {
                    for (int i = 0; i < op.numInputs(); i++) {
                        if (!op.isValueInput(i)) continue;
                        Varnode arg = op.getInput(i).unversioned();
                        if (!assigned.contains(arg)) used.add(arg);
                    }
                }
                Varnode out = op.getOutput();
                if (out != null) assigned.add(out.unversioned());
            }

            data.liveIn.addAll(data.gen);
        }

        Set<BasicBlock> workQueue = new LinkedHashSet<>();
        for (ListIterator<BasicBlock> li = func.blocks.listIterator(func.blocks.size()); li.hasPrevious(); ) {
            workQueue.add(li.previous());
        }
        while (!workQueue.isEmpty()) {
            Iterator<BasicBlock> iterator = workQueue.iterator();
            BasicBlock next = iterator.next();
            iterator.remove();
            LiveData data = next.getExtOrThrow(CommonExts.LIVE_DATA);
            boolean changed = false;
            for (int succ : func.flowSuccessors(next)) {
                LiveData succData = func.block(succ).getExtOrThrow(CommonExts.LIVE_DATA);
                for (Varnode varIn : succData.liveIn) {
                    if (data.liveOut.add(varIn)) {
                        if (!data.kill.contains(varIn)) {
                            changed = true;
                            data.liveIn.add(varIn);
                        }
                    }
                }
            }
            if (changed) {
                for (int pred : next.predecessors) {
                    workQueue.add(func.block(pred));
                }
            }
        }

        ms.validate(MetadataState.LIVE_DATA);
    }
}
