package io.github.eutro.relift.core.passes.meta;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.*;
import io.github.eutro.relift.core.passes.InPlaceIRPass;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that a function is in valid SSA form: every version other than 0 has exactly one definition,
 * and that definition dominates each of its uses. A phi input is a use at the end of its predecessor.
 * <p>
 * Blocks unreachable from the entry are not checked.
 *
 * @throws IllegalStateException If the function is not in SSA form.
 */
public class VerifySsa implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final VerifySsa INSTANCE = new VerifySsa();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS, MetadataState.DOMS);
        DominatorTree tree = func.getExtOrThrow(CommonExts.DOM_TREE);

        Map<Varnode, int[]> defs = new HashMap<>(); // {block, index}
        for (BasicBlock block : func.blocks) {
            if (!tree.isReachable(block.id)) continue;
            List<PcodeOp> ops = block.getOps();
            for (int i = 0; i < ops.size(); i++) {
                Varnode out = ops.get(i).getOutput();
                if (out == null) continue;
                if (out.version == 0) {
                    throw new IllegalStateException(String.format("%s: unrenamed definition in %s",
                            ops.get(i), block.toTargetString()));
                }
                if (defs.put(out, new int[]{block.id, i}) != null) {
                    throw new IllegalStateException(String.format("%s is defined more than once", out));
                }
            }
        }

        for (BasicBlock block : func.blocks) {
            if (!tree.isReachable(block.id)) continue;
            List<PcodeOp> ops = block.getOps();
            for (int i = 0; i < ops.size(); i++) {
                PcodeOp op = ops.get(i);
                for (int j = 0; j < op.numInputs(); j++) {
                    if (!op.isValueInput(j)) continue;
                    Varnode use = op.getInput(j);
                    if (use.version == 0) continue;
                    int[] def = defs.get(use);
                    if (def == null) {
                        throw new IllegalStateException(String.format("%s: %s has no definition", op, use));
                    }
                    boolean ok;
                    if (op.isPhi()) {
                        if (j >= block.predecessors.size()) {
                            throw new IllegalStateException(String.format("%s: entry slot %d is not the entry value", op, j));
                        }
                        int pred = block.predecessors.get(j);
                        ok = !tree.isReachable(pred) || tree.dominates(def[0], pred);
                    } else if (def[0] == block.id) {
                        ok = def[1] < i;
                    } else {
                        ok = tree.dominates(def[0], block.id);
                    }
                    if (!ok) {
                        throw new IllegalStateException(String.format("%s: definition of %s in bb%d does not dominate its use in %s",
                                op, use, def[0], block.toTargetString()));
                    }
                }
            }
        }
    }
}
