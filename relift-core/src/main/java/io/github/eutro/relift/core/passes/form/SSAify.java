package io.github.eutro.relift.core.passes.form;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.CommonExts.LiveData;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.*;
import io.github.eutro.relift.core.passes.InPlaceIRPass;
import io.github.eutro.relift.core.passes.meta.VerifySsa;

import java.util.*;

/**
 * Converts a function to pruned SSA form.
 * <p>
 * Phis are placed at the iterated dominance frontier of each location's definitions, counting an implicit
 * definition of every location on entry, but only where the location is live. A phi has one input per
 * predecessor edge, in {@link BasicBlock#predecessors} order; a phi in the entry block has one more,
 * last, for the value on entry.
 * <p>
 * Renaming gives each definition a fresh {@link Varnode#version}. Uses with no reaching definition keep
 * version 0, the value on entry. Each {@link OpCode#RETURN} gets the {@link CommonExts#REACHING_AT_RETURN}
 * versions of every location defined on the way to it.
 */
public class SSAify implements InPlaceIRPass<Function> {
    public static final SSAify INSTANCE = new SSAify();

    private static final boolean VERIFY = System.getenv("RELIFT_NO_VERIFY_SSA") == null;

    private final boolean verify;

    public SSAify() {
        this(VERIFY);
    }

    /**
     * @param verify Whether to run {@link VerifySsa} afterwards.
     */
    public SSAify(boolean verify) {
        this.verify = verify;
    }

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        if (ms.isValid(MetadataState.SSA_FORM)) return;
        ms.ensureValid(func, MetadataState.PREDS, MetadataState.DOMS, MetadataState.DOM_FRONTIER, MetadataState.LIVE_DATA);
        DominatorTree tree = func.getExtOrThrow(CommonExts.DOM_TREE);

        Map<Varnode, Set<Integer>> defSites = new TreeMap<>();
        for (BasicBlock block : func.blocks) {
            LiveData data = block.getExtOrThrow(CommonExts.LIVE_DATA);
            for (Varnode killed : data.kill) {
                Set<Integer> sites = defSites.computeIfAbsent(killed, $ -> new LinkedHashSet<>());
                sites.add(0);
                sites.add(block.id);
            }
        }

        List<Map<Varnode, PcodeOp>> phis = new ArrayList<>();
        for (int i = 0; i < func.size(); i++) {
            phis.add(new TreeMap<>());
        }
        for (Map.Entry<Varnode, Set<Integer>> entry : defSites.entrySet()) {
            Varnode loc = entry.getKey();
            List<Integer> workList = new ArrayList<>(entry.getValue());
            while (!workList.isEmpty()) {
                int next = workList.remove(workList.size() - 1);
                if (!tree.isReachable(next)) continue;
                for (int f : tree.frontier(next)) {
                    BasicBlock fBlock = func.block(f);
                    if (!fBlock.getExtOrThrow(CommonExts.LIVE_DATA).liveIn.contains(loc)) continue;
                    Map<Varnode, PcodeOp> fPhis = phis.get(f);
                    if (!fPhis.containsKey(loc)) {
                        int slots = fBlock.predecessors.size() + (f == 0 ? 1 : 0);
                        fPhis.put(loc, new PcodeOp(OpCode.MULTIEQUAL, fBlock.getStartAddress(), loc,
                                Collections.nCopies(slots, loc)));
                        workList.add(f);
                    }
                }
            }
        }
        for (BasicBlock block : func.blocks) {
            block.getOps().addAll(0, phis.get(block.id).values());
        }

        class Renamer {
            final Map<Varnode, List<Varnode>> stacks = new HashMap<>();
            final Map<Varnode, Integer> counters = new HashMap<>();

            Varnode top(Varnode loc) {
                List<Varnode> stack = stacks.get(loc);
                if (stack != null && !stack.isEmpty()) {
                    return stack.get(stack.size() - 1);
                }
                return loc;
            }

            void dfs(BasicBlock block) {
                Map<Varnode, Integer> replaced = new HashMap<>();
                for (PcodeOp op : block.getOps()) {
                    if (!op.isPhi()) {
                        for (int i = 0; i < op.numInputs(); i++) {
                            if (op.isValueInput(i)) op.setInput(i, top(op.getInput(i)));
                        }
                    }
                    if (op.opcode == OpCode.RETURN) {
                        Map<Varnode, Varnode> reaching = new TreeMap<>();
                        for (Map.Entry<Varnode, List<Varnode>> entry : stacks.entrySet()) {
                            if (!entry.getValue().isEmpty()) reaching.put(entry.getKey(), top(entry.getKey()));
                        }
                        op.attachExt(CommonExts.REACHING_AT_RETURN, reaching);
                    }
                    Varnode out = op.getOutput();
                    if (out != null) {
                        int version = counters.merge(out, 1, Integer::sum);
                        Varnode newVar = out.withVersion(version);
                        List<Varnode> stack = stacks.computeIfAbsent(out, $ -> new ArrayList<>());
                        replaced.putIfAbsent(out, stack.size());
                        stack.add(newVar);
                        op.setOutput(newVar);
                    }
                }

                for (int succ : new LinkedHashSet<>(func.flowSuccessors(block))) {
                    BasicBlock succBlock = func.block(succ);
                    List<Integer> preds = succBlock.predecessors;
                    for (PcodeOp phi : phis.get(succ).values()) {
                        Varnode value = top(phi.getOutput().unversioned());
                        for (int j = 0; j < preds.size(); j++) {
                            if (preds.get(j) == block.id) phi.setInput(j, value);
                        }
                    }
                }

                for (int next : tree.children(block.id)) {
                    dfs(func.block(next));
                }
                for (Map.Entry<Varnode, Integer> entry : replaced.entrySet()) {
                    List<Varnode> stack = stacks.get(entry.getKey());
                    stack.subList(entry.getValue(), stack.size()).clear();
                }
            }
        }
        new Renamer().dfs(func.entry());

        for (BasicBlock block : func.blocks) {
            // renamed, so none of it is valid anymore
            block.removeExt(CommonExts.LIVE_DATA);
        }

        ms.varsChanged();
        ms.validate(MetadataState.SSA_FORM);
        if (verify) {
            VerifySsa.INSTANCE.runInPlace(func);
        }
    }
}
