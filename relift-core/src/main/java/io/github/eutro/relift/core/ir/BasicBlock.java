package io.github.eutro.relift.core.ir;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.Ext;
import io.github.eutro.relift.core.ext.ExtHolder;
import io.github.eutro.relift.core.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block: a straight-line run of {@link PcodeOp}s where control only leaves at the last op.
 * <p>
 * Blocks live in the arena of their {@link Function} and refer to each other by {@link #id}.
 * Successors of a conditional block are ordered {@code [taken, fallthrough]}.
 */
public final class BasicBlock extends ExtHolder {
    /**
     * The index of this block in {@link Function#blocks}.
     */
    public final int id;
    private final long startAddress;
    private long endAddress;
    private final List<PcodeOp> ops = new TrackedList<PcodeOp>(new ArrayList<>()) {
        @Override
        protected void onAdded(PcodeOp elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(PcodeOp elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };
    /**
     * Resolved successor block ids.
     */
    public final List<Integer> successors = new ArrayList<>();
    /**
     * Predecessor block ids, computed by {@link io.github.eutro.relift.core.passes.meta.ComputePreds}.
     */
    public final List<Integer> predecessors = new ArrayList<>();
    private boolean unknownSuccessor;

    BasicBlock(int id, long startAddress) {
        this.id = id;
        this.startAddress = startAddress;
        this.endAddress = startAddress;
    }

    public long getStartAddress() {
        return startAddress;
    }

    /**
     * @return The address of the last instruction in the block.
     */
    public long getEndAddress() {
        return endAddress;
    }

    public void setEndAddress(long endAddress) {
        this.endAddress = endAddress;
    }

    public List<PcodeOp> getOps() {
        return ops;
    }

    /**
     * Get the last op of the block if it transfers control.
     *
     * @return The terminator, or null if the block falls through or ends in a call.
     */
    public @Nullable PcodeOp getTerminator() {
        if (ops.isEmpty()) return null;
        PcodeOp last = ops.get(ops.size() - 1);
        return last.opcode.isTerminator() ? last : null;
    }

    /**
     * Whether this block ends in a conditional branch with both edges resolved.
     *
     * @return Whether the block is a two-way branch.
     */
    public boolean isConditional() {
        PcodeOp term = getTerminator();
        return term != null && term.opcode == OpCode.CBRANCH && successors.size() == 2;
    }

    /**
     * Whether control may leave this block for targets that could not be resolved statically.
     *
     * @return Whether the block has an unknown successor.
     */
    public boolean hasUnknownSuccessor() {
        return unknownSuccessor;
    }

    public void setUnknownSuccessor(boolean unknownSuccessor) {
        this.unknownSuccessor = unknownSuccessor;
    }

    /**
     * Format this block as a jump target.
     *
     * @return The target string.
     */
    public String toTargetString() {
        return String.format("bb%d@%x", id, startAddress);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append(" -> ").append(successors);
        if (unknownSuccessor) sb.append(" + ?");
        sb.append("\n{\n");
        for (PcodeOp op : ops) {
            sb.append(String.format(" %08x: %s%n", op.address, op));
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private Function owner;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
