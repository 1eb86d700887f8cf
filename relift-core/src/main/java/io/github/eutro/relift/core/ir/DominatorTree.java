package io.github.eutro.relift.core.ir;

import java.util.*;

/**
 * Immediate dominators over a graph of integer nodes, with the derived tree and, once computed,
 * dominance frontiers.
 * <p>
 * Used for both dominators over a function's blocks and post-dominators over the reversed graph.
 */
public final class DominatorTree {
    private final int root;
    private final int[] idom;
    private final int[] rpoNumber;
    private final List<Integer> rpo;
    private final List<List<Integer>> children;
    private final List<Set<Integer>> frontiers;

    /**
     * Construct a tree from solved immediate dominators.
     *
     * @param root The root node.
     * @param idom The immediate dominator of each node; -1 for the root and for unreachable nodes.
     * @param rpo  The reachable nodes in reverse postorder.
     */
    public DominatorTree(int root, int[] idom, List<Integer> rpo) {
        this.root = root;
        this.idom = idom.clone();
        this.rpo = Collections.unmodifiableList(new ArrayList<>(rpo));
        rpoNumber = new int[idom.length];
        Arrays.fill(rpoNumber, -1);
        for (int i = 0; i < rpo.size(); i++) {
            rpoNumber[rpo.get(i)] = i;
        }
        children = new ArrayList<>(idom.length);
        frontiers = new ArrayList<>(idom.length);
        for (int i = 0; i < idom.length; i++) {
            children.add(new ArrayList<>());
            frontiers.add(new TreeSet<>());
        }
        for (int node : rpo) {
            if (idom[node] >= 0) {
                children.get(idom[node]).add(node);
            }
        }
    }

    public int getRoot() {
        return root;
    }

    public int size() {
        return idom.length;
    }

    /**
     * @param node The node.
     * @return Its immediate dominator, or -1 for the root and unreachable nodes.
     */
    public int idom(int node) {
        return idom[node];
    }

    /**
     * @param node The node.
     * @return The nodes it immediately dominates, in reverse postorder.
     */
    public List<Integer> children(int node) {
        return Collections.unmodifiableList(children.get(node));
    }

    public boolean isReachable(int node) {
        return rpoNumber[node] >= 0;
    }

    /**
     * @return The reachable nodes in reverse postorder, starting at the root.
     */
    public List<Integer> reversePostOrder() {
        return rpo;
    }

    public int rpoNumber(int node) {
        return rpoNumber[node];
    }

    /**
     * Check whether every path from the root to {@code b} goes through {@code a}.
     * A node dominates itself. Nothing dominates, or is dominated by, an unreachable node.
     *
     * @param a The candidate dominator.
     * @param b The node.
     * @return Whether {@code a} dominates {@code b}.
     */
    public boolean dominates(int a, int b) {
        if (!isReachable(a) || !isReachable(b)) return false;
        int runner = b;
        while (runner != -1) {
            if (runner == a) return true;
            if (rpoNumber[runner] < rpoNumber[a]) return false;
            runner = idom[runner];
        }
        return false;
    }

    public boolean strictlyDominates(int a, int b) {
        return a != b && dominates(a, b);
    }

    /**
     * Find the closest node that dominates both {@code a} and {@code b}.
     *
     * @param a A reachable node.
     * @param b Another reachable node.
     * @return The nearest common dominator.
     */
    public int intersect(int a, int b) {
        int f1 = a, f2 = b;
        while (f1 != f2) {
            while (rpoNumber[f1] > rpoNumber[f2]) f1 = idom[f1];
            while (rpoNumber[f2] > rpoNumber[f1]) f2 = idom[f2];
        }
        return f1;
    }

    /**
     * @param node The node.
     * @return Its dominance frontier, filled in by {@link io.github.eutro.relift.core.passes.meta.ComputeDomFrontier}.
     */
    public Set<Integer> frontier(int node) {
        return frontiers.get(node);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DominatorTree)) return false;
        DominatorTree that = (DominatorTree) o;
        return root == that.root && Arrays.equals(idom, that.idom);
    }

    @Override
    public int hashCode() {
        return 31 * root + Arrays.hashCode(idom);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int node : rpo) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(node).append(" <- ").append(idom[node]);
        }
        return sb.append('}').toString();
    }
}
