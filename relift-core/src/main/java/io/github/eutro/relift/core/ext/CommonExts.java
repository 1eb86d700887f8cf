package io.github.eutro.relift.core.ext;

import io.github.eutro.relift.core.diag.Diagnostics;
import io.github.eutro.relift.core.frontend.RegisterModel;
import io.github.eutro.relift.core.ir.*;
import io.github.eutro.relift.core.passes.form.SSAify;
import io.github.eutro.relift.core.passes.meta.*;
import io.github.eutro.relift.core.structure.Loop;
import io.github.eutro.relift.core.structure.StructNode;
import io.github.eutro.relift.core.types.TypeMap;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The {@link Ext}s shared between passes.
 */
public class CommonExts {
    /**
     * Attached to a {@link Function}. Which derived facts are current.
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}. The function whose arena holds the block.
     */
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    /**
     * Attached to a {@link PcodeOp}. The block the op is in.
     */
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");

    /**
     * Attached to a {@link Function}, computed by {@link ComputeDoms}.
     */
    public static final Ext<DominatorTree> DOM_TREE = Ext.create(DominatorTree.class, "DOM_TREE");
    /**
     * Attached to a {@link Function}, computed by {@link ComputePostDoms}.
     * Node {@link Function#size()} is the virtual exit.
     */
    public static final Ext<DominatorTree> POST_DOM_TREE = Ext.create(DominatorTree.class, "POST_DOM_TREE");

    /**
     * Attached to a {@link BasicBlock}, computed by {@link ComputeLiveVars}.
     */
    public static final Ext<LiveData> LIVE_DATA = Ext.create(LiveData.class, "LIVE_DATA");

    /**
     * Attached to a {@link Function}, computed by {@link ComputeUses}.
     */
    public static final Ext<DefUse> DEF_USE = Ext.create(DefUse.class, "DEF_USE");

    /**
     * Attached to a {@link Function}, computed by {@link InferTypes}.
     */
    public static final Ext<TypeMap> TYPE_MAP = Ext.create(TypeMap.class, "TYPE_MAP");

    /**
     * Attached to a {@link Function}, computed by {@link FindLoops}. Ordered by header RPO number.
     */
    public static final Ext<List<Loop>> LOOPS = Ext.create(List.class, "LOOPS");

    /**
     * Attached to a {@link Function}, computed by {@link RecoverStructure}.
     */
    public static final Ext<StructNode> STRUCTURE = Ext.create(StructNode.class, "STRUCTURE");

    /**
     * Attached to a {@link Function}. Recoverable problems found by any stage.
     */
    public static final Ext<Diagnostics> DIAGNOSTICS = Ext.create(Diagnostics.class, "DIAGNOSTICS");

    /**
     * Attached to a {@link Function}. The register model of the front end it was lifted with.
     */
    public static final Ext<RegisterModel> REGISTER_MODEL = Ext.create(RegisterModel.class, "REGISTER_MODEL");

    /**
     * Attached to a {@link Function}. Names of the {@link OpCode#CALLOTHER} operations,
     * indexed by the constant first input.
     */
    public static final Ext<List<String>> USER_OPS = Ext.create(List.class, "USER_OPS");

    /**
     * Attached to a {@link BasicBlock} ending in a recovered {@link OpCode#BRANCHIND}.
     */
    public static final Ext<JumpTable> JUMP_TABLE = Ext.create(JumpTable.class, "JUMP_TABLE");

    /**
     * Attached to a {@link OpCode#RETURN} op by {@link SSAify}.
     * Maps each unversioned location to the version live at the return.
     */
    public static final Ext<Map<Varnode, Varnode>> REACHING_AT_RETURN = Ext.create(Map.class, "REACHING_AT_RETURN");

    /**
     * The live locations of a basic block. Locations are unversioned.
     */
    public static class LiveData {
        /**
         * Locations read in the block before any write in it.
         */
        public final Set<Varnode> gen = new LinkedHashSet<>();
        /**
         * Locations written in the block.
         */
        public final Set<Varnode> kill = new LinkedHashSet<>();
        /**
         * Locations live on entry.
         */
        public final Set<Varnode> liveIn = new TreeSet<>();
        /**
         * Locations live on exit.
         */
        public final Set<Varnode> liveOut = new TreeSet<>();
    }
}
