package io.github.eutro.relift.core.passes.convert;

import io.github.eutro.relift.core.frontend.MemoryImage;
import io.github.eutro.relift.core.ir.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Recovers the targets of an indirect branch through a table of absolute addresses,
 * {@code BRANCHIND(LOAD(base + index * scale))}, by scanning backwards for the defining ops.
 */
public class JumpTableResolver {
    private static final int SCAN_LIMIT = 32;

    private final MemoryImage image;
    private final int maxEntries;

    /**
     * @param image      The memory to read tables from.
     * @param maxEntries The most entries to read from any one table.
     */
    public JumpTableResolver(MemoryImage image, int maxEntries) {
        this.image = image;
        this.maxEntries = maxEntries;
    }

    /**
     * Try to resolve the indirect branch at {@code ops.get(branch)}.
     * <p>
     * Entries are read in order until one is unmapped, points outside the listing, or the limit is reached.
     *
     * @param listing The listing the branch is in, which defines the window of valid targets.
     * @param branch  The index of the {@link OpCode#BRANCHIND} in the listing's ops.
     * @return The table, or null if the pattern does not match or no entry is a valid target.
     */
    public @Nullable JumpTable resolve(PcodeListing listing, int branch) {
        List<PcodeOp> ops = listing.getOps();
        PcodeOp bi = ops.get(branch);
        if (bi.opcode != OpCode.BRANCHIND) return null;

        int loadAt = defBefore(ops, branch, bi.getInput(0));
        while (loadAt >= 0 && ops.get(loadAt).opcode == OpCode.COPY) {
            loadAt = defBefore(ops, loadAt, ops.get(loadAt).getInput(0));
        }
        if (loadAt < 0 || ops.get(loadAt).opcode != OpCode.LOAD) return null;
        PcodeOp load = ops.get(loadAt);
        int entrySize = load.getOutput().size;

        int addAt = defBefore(ops, loadAt, load.getInput(0));
        if (addAt < 0 || ops.get(addAt).opcode != OpCode.INT_ADD) return null;
        PcodeOp add = ops.get(addAt);
        Varnode base, scaled;
        if (add.getInput(0).isConstant()) {
            base = add.getInput(0);
            scaled = add.getInput(1);
        } else if (add.getInput(1).isConstant()) {
            base = add.getInput(1);
            scaled = add.getInput(0);
        } else {
            return null;
        }

        Varnode index;
        long scale;
        int mulAt = defBefore(ops, addAt, scaled);
        PcodeOp mul = mulAt < 0 ? null : ops.get(mulAt);
        if (mul != null && mul.opcode == OpCode.INT_MULT && mul.getInput(1).isConstant()) {
            index = mul.getInput(0);
            scale = mul.getInput(1).offset;
        } else if (mul != null && mul.opcode == OpCode.INT_MULT && mul.getInput(0).isConstant()) {
            index = mul.getInput(1);
            scale = mul.getInput(0).offset;
        } else if (mul != null && mul.opcode == OpCode.INT_LEFT && mul.getInput(1).isConstant()) {
            index = mul.getInput(0);
            scale = 1L << mul.getInput(1).offset;
        } else {
            return null;
        }
        if (scale <= 0) return null;

        List<Long> targets = new ArrayList<>();
        for (int i = 0; i < maxEntries; i++) {
            long entry = base.offset + i * scale;
            if (!image.contains(entry, entrySize)) break;
            long target = image.read(entry, entrySize);
            if (!listing.containsInstruction(target)) break;
            targets.add(target);
        }
        if (targets.isEmpty()) return null;
        return new JumpTable(base.offset, entrySize, index, targets);
    }

    /**
     * Find the op that last wrote {@code vn} before {@code at}, without crossing control flow.
     *
     * @return Its index, or -1 if there is none or the value is only partially written.
     */
    private static int defBefore(List<PcodeOp> ops, int at, Varnode vn) {
        if (vn.isConstant()) return -1;
        for (int k = at - 1; k >= 0 && k >= at - SCAN_LIMIT; k--) {
            PcodeOp op = ops.get(k);
            if (op.opcode.getCategory() == OpCode.Category.CONTROL) return -1;
            Varnode out = op.getOutput();
            if (out == null) continue;
            if (out.equals(vn)) return k;
            if (out.overlaps(vn)) return -1;
        }
        return -1;
    }
}
