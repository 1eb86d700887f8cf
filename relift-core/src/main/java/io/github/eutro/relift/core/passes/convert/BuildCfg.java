package io.github.eutro.relift.core.passes.convert;

import io.github.eutro.relift.core.diag.Diagnostic;
import io.github.eutro.relift.core.diag.Diagnostics;
import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.frontend.MemoryImage;
import io.github.eutro.relift.core.ir.*;
import io.github.eutro.relift.core.passes.IRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Partitions a {@link PcodeListing} into the {@link BasicBlock}s of a {@link Function}, and links them.
 * <p>
 * Blocks start at the entry, at every branch target inside the listing, and after every instruction
 * that branches, returns or calls. Successors come from the last op of each block:
 * <ul>
 *     <li>{@link OpCode#CBRANCH}: {@code [taken, fallthrough]};</li>
 *     <li>{@link OpCode#BRANCH}: the target;</li>
 *     <li>{@link OpCode#BRANCHIND}: the targets of a recovered {@link JumpTable}, or none and an unknown successor;</li>
 *     <li>{@link OpCode#RETURN}: none;</li>
 *     <li>anything else: the fallthrough.</li>
 * </ul>
 * Targets outside the listing get no edge, and are reported as {@link Diagnostic.Kind#UNRESOLVED_CONTROL_FLOW}.
 */
public class BuildCfg implements IRPass<PcodeListing, Function> {
    private static final Logger logger = LogManager.getLogger(BuildCfg.class);

    /**
     * An instance that does not recover jump tables.
     */
    public static final BuildCfg INSTANCE = new BuildCfg(null, 0);

    private final @Nullable JumpTableResolver jumpTables;

    /**
     * @param image           Memory to read jump tables from, or null to leave every indirect branch unresolved.
     * @param maxTableEntries The most entries to read from a jump table.
     */
    public BuildCfg(@Nullable MemoryImage image, int maxTableEntries) {
        jumpTables = image == null ? null : new JumpTableResolver(image, maxTableEntries);
    }

    @Override
    public Function run(PcodeListing listing) {
        if (listing.getInstructions().isEmpty()) {
            throw new IllegalArgumentException(String.format("no instructions at 0x%x", listing.getEntryAddress()));
        }
        Function func = new Function(listing.getEntryAddress());
        Diagnostics diags = func.getDiagnostics();
        diags.addAll(listing.getDiagnostics());
        func.attachExt(CommonExts.REGISTER_MODEL, listing.getRegisters());
        func.attachExt(CommonExts.USER_OPS, listing.getUserOps());

        NavigableMap<Long, Integer> insns = listing.getInstructions();
        Map<Long, List<PcodeOp>> opsAt = new HashMap<>();
        Map<PcodeOp, JumpTable> tables = new HashMap<>();
        SortedSet<Long> leaders = new TreeSet<>();
        leaders.add(listing.getEntryAddress());

        List<PcodeOp> ops = listing.getOps();
        for (int i = 0; i < ops.size(); i++) {
            PcodeOp op = ops.get(i);
            opsAt.computeIfAbsent(op.address, $ -> new ArrayList<>()).add(op);
            long next = op.address + insns.get(op.address);
            switch (op.opcode) {
                case BRANCH:
                case CBRANCH: {
                    long target = op.getTargetAddress();
                    if (listing.containsInstruction(target)) {
                        leaders.add(target);
                    } else {
                        diags.report(Diagnostic.Kind.UNRESOLVED_CONTROL_FLOW, op.address,
                                "branch target 0x%x is outside the function", target);
                    }
                    leaders.add(next);
                    break;
                }
                case BRANCHIND: {
                    JumpTable table = jumpTables == null ? null : jumpTables.resolve(listing, i);
                    if (table != null) {
                        tables.put(op, table);
                        leaders.addAll(table.getTargets());
                    } else {
                        diags.report(Diagnostic.Kind.UNRESOLVED_CONTROL_FLOW, op.address,
                                "indirect branch through %s", op.getInput(0));
                    }
                    leaders.add(next);
                    break;
                }
                case RETURN:
                case CALL:
                case CALLIND:
                    leaders.add(next);
                    break;
                default:
                    break;
            }
        }

        Map<Long, BasicBlock> blockAt = new HashMap<>();
        BasicBlock current = null;
        for (Map.Entry<Long, Integer> insn : insns.entrySet()) {
            long address = insn.getKey();
            if (current == null || leaders.contains(address)) {
                current = func.newBb(address);
                blockAt.put(address, current);
            }
            current.setEndAddress(address);
            current.getOps().addAll(opsAt.getOrDefault(address, Collections.emptyList()));
        }

        for (BasicBlock block : func.blocks) {
            long end = block.getEndAddress();
            BasicBlock fallthrough = blockAt.get(end + insns.get(end));
            List<PcodeOp> blockOps = block.getOps();
            PcodeOp last = blockOps.isEmpty() ? null : blockOps.get(blockOps.size() - 1);
            if (last == null) {
                if (fallthrough != null) block.successors.add(fallthrough.id);
                continue;
            }
            switch (last.opcode) {
                case CBRANCH: {
                    BasicBlock taken = blockAt.get(last.getTargetAddress());
                    if (taken != null) block.successors.add(taken.id);
                    if (fallthrough != null) block.successors.add(fallthrough.id);
                    break;
                }
                case BRANCH: {
                    BasicBlock taken = blockAt.get(last.getTargetAddress());
                    if (taken != null) block.successors.add(taken.id);
                    break;
                }
                case BRANCHIND: {
                    JumpTable table = tables.get(last);
                    if (table == null) {
                        block.setUnknownSuccessor(true);
                        break;
                    }
                    block.attachExt(CommonExts.JUMP_TABLE, table);
                    Set<Integer> targets = new LinkedHashSet<>();
                    for (long target : table.getTargets()) {
                        targets.add(blockAt.get(target).id);
                    }
                    block.successors.addAll(targets);
                    break;
                }
                case RETURN:
                    break;
                default:
                    if (fallthrough != null) block.successors.add(fallthrough.id);
                    break;
            }
        }

        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.graphChanged();
        logger.debug("built {} blocks for {}", func.size(), func.getName());
        return func;
    }
}
