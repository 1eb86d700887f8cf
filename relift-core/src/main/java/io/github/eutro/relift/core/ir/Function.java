package io.github.eutro.relift.core.ir;

import io.github.eutro.relift.core.diag.Diagnostics;
import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.Ext;
import io.github.eutro.relift.core.ext.ExtHolder;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A function: the arena of its {@link BasicBlock basic blocks}.
 * <p>
 * A block's {@link BasicBlock#id} is its index in {@link #blocks}; blocks are never removed
 * once created, so ids stay stable. Block 0 is the entry.
 */
public final class Function extends ExtHolder {
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            throw new UnsupportedOperationException("blocks cannot be removed from a function");
        }
    }; // [0] is entry

    private final long entryAddress;

    public Function(long entryAddress) {
        this.entryAddress = entryAddress;
    }

    public long getEntryAddress() {
        return entryAddress;
    }

    public String getName() {
        return String.format("func_%x", entryAddress);
    }

    /**
     * Create a new basic block at the end of the arena.
     *
     * @param startAddress The address of the first instruction in the block.
     * @return The new block.
     */
    public BasicBlock newBb(long startAddress) {
        BasicBlock bb = new BasicBlock(blocks.size(), startAddress);
        blocks.add(bb);
        return bb;
    }

    public BasicBlock block(int id) {
        return blocks.get(id);
    }

    public BasicBlock entry() {
        return blocks.get(0);
    }

    public int size() {
        return blocks.size();
    }

    /**
     * Get the blocks control may flow to from {@code block}, for data-flow and dominance purposes.
     * <p>
     * This is the resolved successors, plus every non-entry block if the block has an unknown successor.
     *
     * @param block The block.
     * @return The successor ids, without duplicates for the implicit edges.
     */
    public List<Integer> flowSuccessors(BasicBlock block) {
        if (!block.hasUnknownSuccessor()) {
            return block.successors;
        }
        Set<Integer> succs = new LinkedHashSet<>(block.successors);
        for (int i = 1; i < blocks.size(); i++) {
            succs.add(i);
        }
        return new ArrayList<>(succs);
    }

    /**
     * Get the diagnostics of this function, attaching an empty collection first if needed.
     *
     * @return The diagnostics.
     */
    public Diagnostics getDiagnostics() {
        Diagnostics diags = getNullable(CommonExts.DIAGNOSTICS);
        if (diags == null) {
            diags = new Diagnostics();
            attachExt(CommonExts.DIAGNOSTICS, diags);
        }
        return diags;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getName()).append(" {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
