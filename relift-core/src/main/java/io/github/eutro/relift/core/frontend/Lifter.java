package io.github.eutro.relift.core.frontend;

import io.github.eutro.relift.core.diag.Diagnostic;
import io.github.eutro.relift.core.diag.Diagnostics;
import io.github.eutro.relift.core.ir.IRBuilder;
import io.github.eutro.relift.core.ir.OpCode;
import io.github.eutro.relift.core.ir.PcodeListing;
import io.github.eutro.relift.core.ir.PcodeOp;
import io.github.eutro.relift.core.ir.Varnode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Drives a {@link Translator} over a stream of decoded instructions, producing the {@link PcodeListing}
 * of the function starting at a given address.
 * <p>
 * Translation sweeps linearly from the start. It stops after an unconditional transfer of control
 * if no branch seen so far targets a later address, when the next address has no instruction,
 * or when the instruction limit is reached.
 */
public class Lifter {
    private static final Logger logger = LogManager.getLogger(Lifter.class);

    /**
     * What to do with an instruction the translator does not support.
     */
    public enum UnsupportedPolicy {
        /**
         * Rethrow the {@link UnsupportedInstructionException}.
         */
        ABORT,
        /**
         * Emit a {@link OpCode#CALLOTHER} named after the instruction, and record a diagnostic.
         */
        PLACEHOLDER,
    }

    private final Translator translator;
    private final UnsupportedPolicy policy;
    private final int maxInstructions;

    /**
     * Construct a lifter.
     *
     * @param translator      The translator, which should not be shared with other lifters.
     * @param policy          The policy for unsupported instructions.
     * @param maxInstructions The maximum number of instructions to translate, or 0 for no limit.
     */
    public Lifter(Translator translator, UnsupportedPolicy policy, int maxInstructions) {
        this.translator = translator;
        this.policy = policy;
        this.maxInstructions = maxInstructions;
    }

    public Lifter(Translator translator, UnsupportedPolicy policy) {
        this(translator, policy, 0);
    }

    public Translator getTranslator() {
        return translator;
    }

    /**
     * Translate the function at {@code start}.
     *
     * @param stream The decoded instructions, in any order. Duplicate addresses are not allowed.
     * @param start  The entry address.
     * @return The listing.
     * @throws UnsupportedInstructionException If the policy is {@link UnsupportedPolicy#ABORT} and an instruction is unsupported.
     */
    public PcodeListing lift(List<DecodedInstruction> stream, long start) {
        NavigableMap<Long, DecodedInstruction> byAddress = new TreeMap<>();
        for (DecodedInstruction insn : stream) {
            if (byAddress.put(insn.getAddress(), insn) != null) {
                throw new IllegalArgumentException(String.format("duplicate instruction at 0x%x", insn.getAddress()));
            }
        }

        RegisterModel registers = translator.getRegisters();
        IRBuilder ib = new IRBuilder(registers.pointerSize());
        Diagnostics diags = new Diagnostics();
        List<PcodeOp> ops = new ArrayList<>();
        NavigableMap<Long, Integer> lengths = new TreeMap<>();
        List<String> userOps = new ArrayList<>();
        long furthestTarget = start;
        long address = start;
        PcodeListing.StopReason reason;
        while (true) {
            if (maxInstructions > 0 && lengths.size() >= maxInstructions) {
                reason = PcodeListing.StopReason.COUNT_LIMIT;
                break;
            }
            DecodedInstruction insn = byAddress.get(address);
            if (insn == null) {
                reason = PcodeListing.StopReason.END_OF_STREAM;
                break;
            }
            ib.setAddress(address);
            List<PcodeOp> insnOps;
            try {
                translator.translate(insn, ib);
                insnOps = ib.drain();
            } catch (UnsupportedInstructionException e) {
                if (policy == UnsupportedPolicy.ABORT) throw e;
                ib.drain();
                int idx = userOps.indexOf(insn.getMnemonic());
                if (idx < 0) {
                    idx = userOps.size();
                    userOps.add(insn.getMnemonic());
                }
                ib.emit(OpCode.CALLOTHER, null, Varnode.constant(idx, 4));
                insnOps = ib.drain();
                diags.report(Diagnostic.Kind.UNSUPPORTED_INSTRUCTION, address, "%s", e.getMessage());
            }
            ops.addAll(insnOps);
            lengths.put(address, insn.getLength());

            boolean unconditional = false;
            for (PcodeOp op : insnOps) {
                switch (op.opcode) {
                    case BRANCH:
                    case CBRANCH: {
                        long target = op.getTargetAddress();
                        if (Long.compareUnsigned(target, furthestTarget) > 0) furthestTarget = target;
                        unconditional |= op.opcode == OpCode.BRANCH;
                        break;
                    }
                    case RETURN:
                        unconditional = true;
                        break;
                    default:
                        break;
                }
            }
            if (unconditional && Long.compareUnsigned(furthestTarget, address) <= 0) {
                reason = PcodeListing.StopReason.END_OF_FUNCTION;
                break;
            }
            address = insn.getNextAddress();
        }

        logger.debug("lifted {} instructions ({} ops) at 0x{}, stopped: {}",
                lengths.size(), ops.size(), Long.toHexString(start), reason);
        return new PcodeListing(start, ops, lengths, userOps, registers, diags, reason);
    }
}
