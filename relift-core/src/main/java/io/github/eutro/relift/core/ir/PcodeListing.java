package io.github.eutro.relift.core.ir;

import io.github.eutro.relift.core.diag.Diagnostics;
import io.github.eutro.relift.core.frontend.RegisterModel;

import java.util.*;

/**
 * The translated ops of one function, in address order, before any control flow is recovered.
 */
public final class PcodeListing {
    /**
     * Why translation stopped.
     */
    public enum StopReason {
        /**
         * A direct branch or return was reached with no pending branch target beyond it.
         */
        END_OF_FUNCTION,
        /**
         * The instruction count limit was reached.
         */
        COUNT_LIMIT,
        /**
         * The instruction stream ran out, or had a gap.
         */
        END_OF_STREAM,
    }

    private final long entryAddress;
    private final List<PcodeOp> ops;
    private final NavigableMap<Long, Integer> instructions;
    private final List<String> userOps;
    private final RegisterModel registers;
    private final Diagnostics diagnostics;
    private final StopReason stopReason;

    /**
     * @param entryAddress The function entry.
     * @param ops          The ops, in address order.
     * @param instructions The length of each translated instruction, by address.
     * @param userOps      The names of {@link OpCode#CALLOTHER} operations.
     * @param registers    The register model of the front end.
     * @param diagnostics  Problems found during translation.
     * @param stopReason   Why translation stopped.
     */
    public PcodeListing(long entryAddress,
                        List<PcodeOp> ops,
                        NavigableMap<Long, Integer> instructions,
                        List<String> userOps,
                        RegisterModel registers,
                        Diagnostics diagnostics,
                        StopReason stopReason) {
        this.entryAddress = entryAddress;
        this.ops = Collections.unmodifiableList(new ArrayList<>(ops));
        this.instructions = Collections.unmodifiableNavigableMap(new TreeMap<>(instructions));
        this.userOps = Collections.unmodifiableList(new ArrayList<>(userOps));
        this.registers = registers;
        this.diagnostics = diagnostics;
        this.stopReason = stopReason;
    }

    public long getEntryAddress() {
        return entryAddress;
    }

    public List<PcodeOp> getOps() {
        return ops;
    }

    /**
     * @return The length of every translated instruction, keyed by address.
     */
    public NavigableMap<Long, Integer> getInstructions() {
        return instructions;
    }

    public boolean containsInstruction(long address) {
        return instructions.containsKey(address);
    }

    public List<String> getUserOps() {
        return userOps;
    }

    public RegisterModel getRegisters() {
        return registers;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        long last = -1;
        for (PcodeOp op : ops) {
            sb.append(op.address == last ? "          " : String.format("%08x: ", op.address));
            sb.append(op).append('\n');
            last = op.address;
        }
        return sb.toString();
    }
}
