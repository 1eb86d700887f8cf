package io.github.eutro.relift.core.passes.meta;

import io.github.eutro.relift.core.diag.Diagnostic;
import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.frontend.RegisterModel;
import io.github.eutro.relift.core.ir.*;
import io.github.eutro.relift.core.passes.InPlaceIRPass;
import io.github.eutro.relift.core.structure.Loop;
import io.github.eutro.relift.core.structure.StructNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Recovers the {@link CommonExts#STRUCTURE} of a function from its control flow graph.
 * <p>
 * The graph is decomposed top-down from the entry. At each block the first of these that applies is used:
 * <ol>
 *     <li>a loop headed by the block;</li>
 *     <li>a switch, either on a recovered jump table or on a chain of at least {@code minSwitchCases}
 *     blocks comparing one value against constants;</li>
 *     <li>an if-then-else whose arms rejoin at the immediate post-dominator of the block;</li>
 *     <li>an if-then, where one arm is the join point, returns, or leaves the enclosing loop;</li>
 *     <li>a goto.</li>
 * </ol>
 * Inside a loop, reaching the header is a {@code continue} and reaching the follow is a {@code break}.
 * Reaching a block that has already been placed, or running out of steps, produces a goto and an
 * {@link Diagnostic.Kind#UNSTRUCTURED_REGION} diagnostic. Blocks not placed by the walk from the entry
 * are appended at the end, so every block is placed exactly once.
 */
public class RecoverStructure implements InPlaceIRPass<Function> {
    private static final Logger logger = LogManager.getLogger(RecoverStructure.class);

    public static final int DEFAULT_MIN_SWITCH_CASES = 3;
    public static final int DEFAULT_STEP_BUDGET = 10_000;

    /**
     * An instance with the default switch threshold and step budget.
     */
    public static final RecoverStructure INSTANCE = new RecoverStructure(DEFAULT_MIN_SWITCH_CASES, DEFAULT_STEP_BUDGET);

    private final int minSwitchCases;
    private final int stepBudget;

    /**
     * @param minSwitchCases The fewest comparisons a compare chain needs to become a switch.
     * @param stepBudget     The number of blocks to structure before falling back to gotos.
     */
    public RecoverStructure(int minSwitchCases, int stepBudget) {
        if (minSwitchCases < 2) {
            throw new IllegalArgumentException(String.format("a switch needs at least 2 cases, got %d", minSwitchCases));
        }
        this.minSwitchCases = minSwitchCases;
        this.stepBudget = stepBudget;
    }

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.DOMS, MetadataState.POST_DOMS, MetadataState.LOOPS);

        Structurer structurer = new Structurer(func);
        StructNode root = structurer.run();
        logger.debug("{}: structured in {} steps", func.getName(), structurer.steps);
        func.attachExt(CommonExts.STRUCTURE, root);
    }

    private static final class Comparison {
        final Varnode value;
        final long constant;
        final int caseTarget;
        final int next;

        Comparison(Varnode value, long constant, int caseTarget, int next) {
            this.value = value;
            this.constant = constant;
            this.caseTarget = caseTarget;
            this.next = next;
        }
    }

    private class Structurer {
        final Function func;
        final DominatorTree doms;
        final DominatorTree postDoms;
        final Map<Integer, Loop> loops = new HashMap<>();
        final Map<Long, Integer> blockAt = new HashMap<>();
        final @Nullable RegisterModel registers;
        final boolean[] emitted;
        final Deque<Loop> loopStack = new ArrayDeque<>();
        int steps;

        Structurer(Function func) {
            this.func = func;
            doms = func.getExtOrThrow(CommonExts.DOM_TREE);
            postDoms = func.getExtOrThrow(CommonExts.POST_DOM_TREE);
            registers = func.getNullable(CommonExts.REGISTER_MODEL);
            for (Loop loop : func.getExtOrThrow(CommonExts.LOOPS)) {
                loops.put(loop.getHeader(), loop);
            }
            for (BasicBlock block : func.blocks) {
                blockAt.put(block.getStartAddress(), block.id);
            }
            emitted = new boolean[func.size()];
        }

        StructNode run() {
            List<StructNode> seq = new ArrayList<>();
            region(0, -1, seq, false);
            for (int i = 0; i < func.size(); i++) {
                if (emitted[i]) continue;
                if (steps < stepBudget) {
                    region(i, -1, seq, false);
                } else {
                    flat(i, seq);
                }
            }
            return StructNode.sequence(seq);
        }

        void region(int start, int stop, List<StructNode> out, boolean entering) {
            int cur = start;
            boolean first = entering;
            while (cur != -1 && cur != stop) {
                if (!first) {
                    Loop ctx = loopStack.peek();
                    if (ctx != null) {
                        if (cur == ctx.getHeader()) {
                            out.add(StructNode.continueNode());
                            return;
                        }
                        if (cur == ctx.getFollow()) {
                            out.add(StructNode.breakNode());
                            return;
                        }
                        if (!ctx.contains(cur)) {
                            unstructured(cur, out, "jumps out of loop");
                            return;
                        }
                    }
                    if (emitted[cur]) {
                        unstructured(cur, out, "reached again");
                        return;
                    }
                    if (++steps > stepBudget) {
                        unstructured(cur, out, "step budget exhausted before");
                        return;
                    }
                    Loop loop = loops.get(cur);
                    if (loop != null) {
                        cur = structureLoop(loop, out);
                        continue;
                    }
                }
                first = false;
                emitted[cur] = true;
                cur = structureBlock(func.block(cur), out);
            }
        }

        StructNode arm(int start, int stop) {
            List<StructNode> seq = new ArrayList<>();
            region(start, stop, seq, false);
            return StructNode.sequence(seq);
        }

        void unstructured(int target, List<StructNode> out, String why) {
            out.add(StructNode.gotoNode(target));
            BasicBlock block = func.block(target);
            func.getDiagnostics().report(Diagnostic.Kind.UNSTRUCTURED_REGION, block.getStartAddress(),
                    "goto %s: %s", block.toTargetString(), why);
        }

        void flat(int id, List<StructNode> out) {
            emitted[id] = true;
            BasicBlock block = func.block(id);
            if (block.isConditional()) {
                out.add(StructNode.ifThen(id, false,
                        StructNode.sequence(Collections.singletonList(StructNode.gotoNode(block.successors.get(0))))));
                out.add(StructNode.gotoNode(block.successors.get(1)));
                return;
            }
            out.add(StructNode.block(id));
            if (block.successors.size() == 1) {
                out.add(StructNode.gotoNode(block.successors.get(0)));
            }
        }

        int structureLoop(Loop loop, List<StructNode> out) {
            int header = loop.getHeader();
            emitted[header] = true;
            loopStack.push(loop);
            List<StructNode> body = new ArrayList<>();
            StructNode node;
            switch (loop.getKind()) {
                case WHILE: {
                    BasicBlock head = func.block(header);
                    boolean takenInside = loop.contains(head.successors.get(0));
                    region(head.successors.get(takenInside ? 0 : 1), header, body, false);
                    stripContinue(body);
                    node = StructNode.loop(Loop.Kind.WHILE, header, !takenInside, StructNode.sequence(body));
                    break;
                }
                case DO_WHILE: {
                    int latch = loop.getLatches().get(0);
                    boolean takenBack = func.block(latch).successors.get(0) == header;
                    if (latch != header) {
                        region(header, latch, body, true);
                        emitted[latch] = true;
                    }
                    node = StructNode.loop(Loop.Kind.DO_WHILE, latch, !takenBack, StructNode.sequence(body));
                    break;
                }
                case INFINITE_LOOP:
                    region(header, -1, body, true);
                    stripContinue(body);
                    node = StructNode.loop(Loop.Kind.INFINITE_LOOP, header, false, StructNode.sequence(body));
                    break;
                default:
                    throw new IllegalStateException(String.format("unknown loop kind %s", loop.getKind()));
            }
            loopStack.pop();
            out.add(node);
            return loop.getFollow();
        }

        void stripContinue(List<StructNode> body) {
            if (!body.isEmpty() && body.get(body.size() - 1).getKind() == StructNode.Kind.CONTINUE) {
                body.remove(body.size() - 1);
            }
        }

        int structureBlock(BasicBlock block, List<StructNode> out) {
            JumpTable table = block.getNullable(CommonExts.JUMP_TABLE);
            if (table != null && !block.successors.isEmpty()) {
                return structureJumpTable(block, table, out);
            }
            if (block.isConditional()) {
                int next = structureChain(block, out);
                if (next != -2) return next;
                return structureIf(block, out);
            }
            out.add(StructNode.block(block.id));
            if (block.hasUnknownSuccessor() || block.successors.size() != 1) return -1;
            return block.successors.get(0);
        }

        int mergePoint(int id) {
            int merge = postDoms.idom(id);
            if (merge < 0 || merge >= func.size()) return -1;
            Loop ctx = loopStack.peek();
            if (ctx != null && !ctx.contains(merge)) return -1;
            return merge;
        }

        boolean leaves(int target) {
            if (emitted[target]) return true;
            Loop ctx = loopStack.peek();
            return ctx != null
                    && (target == ctx.getHeader() || target == ctx.getFollow() || !ctx.contains(target));
        }

        // whether everything reachable from the arm is only reachable through it, and stays in the loop
        boolean isPrivate(int arm) {
            if (emitted[arm] || func.block(arm).predecessors.size() != 1) return false;
            Loop ctx = loopStack.peek();
            Set<Integer> seen = new HashSet<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(arm);
            while (!stack.isEmpty()) {
                int node = stack.pop();
                if (!seen.add(node)) continue;
                if (ctx != null && (node == ctx.getHeader() || !ctx.contains(node))) return false;
                if (!doms.dominates(arm, node)) return false;
                BasicBlock block = func.block(node);
                if (block.hasUnknownSuccessor()) return false;
                for (int succ : block.successors) {
                    stack.push(succ);
                }
            }
            return true;
        }

        int structureIf(BasicBlock block, List<StructNode> out) {
            int id = block.id;
            int taken = block.successors.get(0);
            int fallthrough = block.successors.get(1);
            if (taken == fallthrough) {
                out.add(StructNode.block(id));
                return taken;
            }

            int merge = mergePoint(id);
            if (merge == fallthrough) {
                out.add(StructNode.ifThen(id, false, arm(taken, merge)));
                return merge;
            }
            if (merge == taken) {
                out.add(StructNode.ifThen(id, true, arm(fallthrough, merge)));
                return merge;
            }
            if (merge != -1) {
                out.add(StructNode.ifThenElse(id, true, arm(fallthrough, merge), arm(taken, merge)));
                return merge;
            }

            if (leaves(taken)) {
                out.add(StructNode.ifThen(id, false, arm(taken, -1)));
                return fallthrough;
            }
            if (leaves(fallthrough)) {
                out.add(StructNode.ifThen(id, true, arm(fallthrough, -1)));
                return taken;
            }
            boolean takenPrivate = isPrivate(taken);
            boolean fallthroughPrivate = isPrivate(fallthrough);
            if (takenPrivate && fallthroughPrivate) {
                out.add(StructNode.ifThenElse(id, true, arm(fallthrough, -1), arm(taken, -1)));
                return -1;
            }
            if (fallthroughPrivate) {
                out.add(StructNode.ifThen(id, true, arm(fallthrough, -1)));
                return taken;
            }
            if (takenPrivate) {
                out.add(StructNode.ifThen(id, false, arm(taken, -1)));
                return fallthrough;
            }

            List<StructNode> jump = new ArrayList<>();
            unstructured(taken, jump, "no join point");
            out.add(StructNode.ifThen(id, false, StructNode.sequence(jump)));
            return fallthrough;
        }

        int structureJumpTable(BasicBlock block, JumpTable table, List<StructNode> out) {
            Map<Integer, List<Long>> byTarget = new LinkedHashMap<>();
            List<Long> targets = table.getTargets();
            for (int i = 0; i < targets.size(); i++) {
                Integer target = blockAt.get(targets.get(i));
                if (target == null) continue;
                byTarget.computeIfAbsent(target, $ -> new ArrayList<>()).add((long) i);
            }
            int merge = mergePoint(block.id);
            List<StructNode.Case> cases = new ArrayList<>();
            for (Map.Entry<Integer, List<Long>> entry : byTarget.entrySet()) {
                cases.add(new StructNode.Case(entry.getValue(), arm(entry.getKey(), merge)));
            }

            Varnode index = table.getIndex();
            Varnode value = index;
            for (PcodeOp op : block.getOps()) {
                for (Varnode input : op.getInputs()) {
                    if (input.unversioned().equals(index.unversioned())) value = input;
                }
            }
            out.add(StructNode.switchOf(block.id, value, cases));
            return merge;
        }

        // -2 if the block does not start a compare chain
        int structureChain(BasicBlock first, List<StructNode> out) {
            List<Integer> chain = new ArrayList<>();
            Map<Integer, List<Long>> byTarget = new LinkedHashMap<>();
            Varnode value = null;
            int next = -1;
            BasicBlock block = first;
            while (block != null) {
                Comparison cmp = comparison(block);
                if (cmp == null || (value != null && !value.equals(cmp.value))) break;
                if (block != first && !continuesChain(block)) break;
                value = cmp.value;
                chain.add(block.id);
                byTarget.computeIfAbsent(cmp.caseTarget, $ -> new ArrayList<>()).add(cmp.constant);
                next = cmp.next;
                block = chain.contains(next) || byTarget.containsKey(next) ? null : func.block(next);
            }
            if (chain.size() < minSwitchCases || value == null) return -2;

            for (int id : chain) {
                emitted[id] = true;
            }
            int merge = mergePoint(first.id);
            List<StructNode.Case> cases = new ArrayList<>();
            for (Map.Entry<Integer, List<Long>> entry : byTarget.entrySet()) {
                cases.add(new StructNode.Case(entry.getValue(), arm(entry.getKey(), merge)));
            }
            if (next != merge) {
                cases.add(new StructNode.Case(Collections.emptyList(), arm(next, merge)));
            }
            out.add(StructNode.switchOf(first.id, value, cases));
            return merge;
        }

        boolean continuesChain(BasicBlock block) {
            if (emitted[block.id] || block.predecessors.size() != 1 || loops.containsKey(block.id)) return false;
            Loop ctx = loopStack.peek();
            if (ctx != null && !ctx.contains(block.id)) return false;
            for (PcodeOp op : block.getOps()) {
                if (op.opcode == OpCode.CBRANCH) continue;
                if (!op.opcode.isPure()) return false;
                Varnode out = op.getOutput();
                if (out == null) return false;
                if (out.space != Space.UNIQUE && (registers == null || !registers.isFlag(out))) return false;
            }
            return true;
        }

        @Nullable Comparison comparison(BasicBlock block) {
            if (!block.isConditional()) return null;
            List<PcodeOp> ops = block.getOps();
            int at = ops.size() - 1;
            boolean equalTaken = true;
            PcodeOp def = defBefore(ops, at, ops.get(at).getInput(1));
            while (def != null && def.opcode == OpCode.BOOL_NEGATE) {
                equalTaken = !equalTaken;
                def = defBefore(ops, ops.indexOf(def), def.getInput(0));
            }
            if (def == null) return null;
            if (def.opcode == OpCode.INT_NOTEQUAL) {
                equalTaken = !equalTaken;
            } else if (def.opcode != OpCode.INT_EQUAL) {
                return null;
            }
            int defAt = ops.indexOf(def);
            Varnode value = def.getInput(0);
            Varnode constant = def.getInput(1);
            if (value.isConstant()) {
                Varnode tmp = value;
                value = constant;
                constant = tmp;
            }
            if (value.isConstant() || !constant.isConstant()) return null;
            long caseValue = constant.signedValue();

            // x == c computed as (x - c) == 0
            PcodeOp sub = defBefore(ops, defAt, value);
            if (caseValue == 0 && sub != null && sub.opcode == OpCode.INT_SUB && sub.getInput(1).isConstant()) {
                caseValue = sub.getInput(1).signedValue();
                value = sub.getInput(0);
                defAt = ops.indexOf(sub);
            }
            PcodeOp copy = defBefore(ops, defAt, value);
            while (copy != null && (copy.opcode == OpCode.COPY
                    || (copy.opcode == OpCode.SUBPIECE && copy.getInput(1).offset == 0))) {
                value = copy.getInput(0);
                copy = defBefore(ops, ops.indexOf(copy), value);
            }
            if (value.isConstant()) return null;

            int taken = block.successors.get(0);
            int fallthrough = block.successors.get(1);
            return equalTaken
                    ? new Comparison(value, caseValue, taken, fallthrough)
                    : new Comparison(value, caseValue, fallthrough, taken);
        }

        @Nullable PcodeOp defBefore(List<PcodeOp> ops, int before, Varnode vn) {
            for (int i = before - 1; i >= 0; i--) {
                PcodeOp op = ops.get(i);
                if (vn.equals(op.getOutput())) return op;
            }
            return null;
        }
    }
}
