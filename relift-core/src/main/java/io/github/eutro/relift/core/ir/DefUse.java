package io.github.eutro.relift.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Def-use chains of a function in SSA form. Constants and code addresses are not tracked.
 */
public final class DefUse {
    private final Map<Varnode, PcodeOp> defs = new HashMap<>();
    private final Map<Varnode, List<PcodeOp>> uses = new HashMap<>();

    void addDef(Varnode vn, PcodeOp op) {
        defs.put(vn, op);
    }

    void addUse(Varnode vn, PcodeOp op) {
        uses.computeIfAbsent(vn, $ -> new ArrayList<>()).add(op);
    }

    /**
     * Build the chains for every op of a function.
     *
     * @param func The function.
     * @return The chains.
     */
    public static DefUse compute(Function func) {
        DefUse du = new DefUse();
        for (BasicBlock block : func.blocks) {
            for (PcodeOp op : block.getOps()) {
                for (int i = 0; i < op.numInputs(); i++) {
                    if (op.isValueInput(i)) du.addUse(op.getInput(i), op);
                }
                Varnode out = op.getOutput();
                if (out != null) du.addDef(out, op);
            }
        }
        return du;
    }

    /**
     * @param vn The value.
     * @return The op defining it, or null for entry values and values defined nowhere.
     */
    public @Nullable PcodeOp defOf(Varnode vn) {
        return defs.get(vn);
    }

    /**
     * @param vn The value.
     * @return The ops reading it, once per occurrence as an input.
     */
    public List<PcodeOp> usesOf(Varnode vn) {
        return Collections.unmodifiableList(uses.getOrDefault(vn, Collections.emptyList()));
    }

    public int useCount(Varnode vn) {
        List<PcodeOp> ops = uses.get(vn);
        return ops == null ? 0 : ops.size();
    }

    public boolean isUnused(Varnode vn) {
        return useCount(vn) == 0;
    }

    /**
     * @return Every value that is read or written.
     */
    public Set<Varnode> values() {
        Set<Varnode> ret = new TreeSet<>(defs.keySet());
        ret.addAll(uses.keySet());
        return ret;
    }
}
