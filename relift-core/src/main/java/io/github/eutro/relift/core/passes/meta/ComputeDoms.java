package io.github.eutro.relift.core.passes.meta;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.DominatorTree;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.passes.InPlaceIRPass;
import io.github.eutro.relift.core.util.F;
import io.github.eutro.relift.core.util.GraphWalker;

import java.util.Arrays;
import java.util.List;

/**
 * Computes the {@link CommonExts#DOM_TREE} of a function.
 */
public class ComputeDoms implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS);

        DominatorTree tree = solve(0, func.size(),
                $ -> func.flowSuccessors(func.block($)),
                $ -> func.block($).predecessors);
        func.attachExt(CommonExts.DOM_TREE, tree);

        ms.validate(MetadataState.DOMS);
    }

    /**
     * Solve for the immediate dominators of a graph.
     * <p>
     * Cooper, Keith D.; Harvey, Timothy J.; Kennedy, Ken (2001). "A Simple, Fast Dominance Algorithm".
     * Each reachable node's idom is recomputed, in reverse postorder, as the intersection of its
     * already-processed predecessors, until a whole pass changes nothing.
     *
     * @param root  The root node.
     * @param size  The number of nodes, which are {@code 0..size-1}.
     * @param succs The successor function.
     * @param preds The predecessor function.
     * @return The dominator tree.
     */
    static DominatorTree solve(int root,
                               int size,
                               F<Integer, ? extends Iterable<Integer>> succs,
                               F<Integer, ? extends Iterable<Integer>> preds) {
        List<Integer> rpo = new GraphWalker<>(root, succs).reversePostOrder();
        int[] rpoNumber = new int[size];
        Arrays.fill(rpoNumber, -1);
        for (int i = 0; i < rpo.size(); i++) {
            rpoNumber[rpo.get(i)] = i;
        }

        int[] idom = new int[size];
        Arrays.fill(idom, -1);
        idom[root] = root;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int node : rpo) {
                if (node == root) continue;
                int newIdom = -1;
                for (int pred : preds.apply(node)) {
                    if (idom[pred] == -1) continue;
                    newIdom = newIdom == -1 ? pred : intersect(idom, rpoNumber, pred, newIdom);
                }
                if (idom[node] != newIdom) {
                    idom[node] = newIdom;
                    changed = true;
                }
            }
        }
        idom[root] = -1;
        return new DominatorTree(root, idom, rpo);
    }

    private static int intersect(int[] idom, int[] rpoNumber, int a, int b) {
        int f1 = a, f2 = b;
        while (f1 != f2) {
            while (rpoNumber[f1] > rpoNumber[f2]) f1 = idom[f1];
            while (rpoNumber[f2] > rpoNumber[f1]) f2 = idom[f2];
        }
        return f1;
    }
}
