package io.github.eutro.relift.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * A table of code addresses read by an indirect branch, as {@code target = table[index]}.
 */
public final class JumpTable {
    private final long tableAddress;
    private final int entrySize;
    private final Varnode index;
    private final List<Long> targets;

    public JumpTable(long tableAddress, int entrySize, Varnode index, List<Long> targets) {
        this.tableAddress = tableAddress;
        this.entrySize = entrySize;
        this.index = index;
        this.targets = Collections.unmodifiableList(targets);
    }

    public long getTableAddress() {
        return tableAddress;
    }

    public int getEntrySize() {
        return entrySize;
    }

    /**
     * @return The location the table is indexed by.
     */
    public Varnode getIndex() {
        return index;
    }

    /**
     * @return The target of each entry, in table order.
     */
    public List<Long> getTargets() {
        return targets;
    }

    @Override
    public String toString() {
        return String.format("table@0x%x[%s x%d] -> %s", tableAddress, index, entrySize, targets);
    }
}
