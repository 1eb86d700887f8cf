package io.github.eutro.relift.test;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.frontend.DecodedInstruction;
import io.github.eutro.relift.core.frontend.Lifter;
import io.github.eutro.relift.core.frontend.ref.RefTranslator;
import io.github.eutro.relift.core.frontend.x86.X86Translator;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.ir.PcodeListing;
import io.github.eutro.relift.core.ir.PcodeOp;
import io.github.eutro.relift.core.ir.Varnode;
import io.github.eutro.relift.core.passes.convert.BuildCfg;
import io.github.eutro.relift.core.passes.form.SSAify;
import io.github.eutro.relift.core.passes.meta.InferTypes;
import io.github.eutro.relift.core.passes.meta.RecoverStructure;
import io.github.eutro.relift.core.render.PseudocodeRenderer;
import io.github.eutro.relift.core.structure.StructNode;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

public class Utils {
    public static final long START = 0x1000;

    @NotNull
    public static List<DecodedInstruction> ref(String... lines) {
        return DecodedInstruction.parseAll(START, 4, lines);
    }

    @NotNull
    public static PcodeListing liftRef(String... lines) {
        return new Lifter(new RefTranslator(), Lifter.UnsupportedPolicy.ABORT).lift(ref(lines), START);
    }

    @NotNull
    public static PcodeListing liftX86(String... lines) {
        return new Lifter(new X86Translator(), Lifter.UnsupportedPolicy.ABORT).lift(ref(lines), START);
    }

    @NotNull
    public static Function cfg(String... lines) {
        return BuildCfg.INSTANCE.run(liftRef(lines));
    }

    @NotNull
    public static Function ssa(String... lines) {
        return new SSAify(true).run(cfg(lines));
    }

    @NotNull
    public static Function typed(String... lines) {
        return InferTypes.INSTANCE.run(ssa(lines));
    }

    @NotNull
    public static StructNode structure(Function func) {
        return func.getExtOrRun(CommonExts.STRUCTURE, func, RecoverStructure.INSTANCE);
    }

    @NotNull
    public static String render(String... lines) {
        return PseudocodeRenderer.INSTANCE.run(typed(lines));
    }

    @NotNull
    public static Function typedX86(String... lines) {
        return InferTypes.INSTANCE.run(new SSAify(true).run(BuildCfg.INSTANCE.run(liftX86(lines))));
    }

    @NotNull
    public static String renderX86(String... lines) {
        return PseudocodeRenderer.INSTANCE.run(typedX86(lines));
    }

    public static MetadataState metadata(Function func) {
        return func.getExtOrThrow(CommonExts.METADATA_STATE);
    }

    public static Varnode reg(int n, int version) {
        return Varnode.register(n * 8L, 8).withVersion(version);
    }

    public static List<StructNode> ofKind(StructNode root, StructNode.Kind kind) {
        List<StructNode> ret = new ArrayList<>();
        for (StructNode node : root.flatten()) {
            if (node.getKind() == kind) ret.add(node);
        }
        return ret;
    }

    /**
     * Count the nodes that place each block, i.e. everything but jumps and the header
     * of an infinite loop, which is placed again inside its body.
     */
    public static int[] placements(Function func, StructNode root) {
        int[] counts = new int[func.size()];
        for (StructNode node : root.flatten()) {
            switch (node.getKind()) {
                case SEQUENCE:
                case BREAK:
                case CONTINUE:
                case GOTO:
                case INFINITE_LOOP:
                    break;
                default:
                    counts[node.getBlock()]++;
                    break;
            }
        }
        return counts;
    }

    public static List<PcodeOp> ops(Function func) {
        List<PcodeOp> ret = new ArrayList<>();
        func.blocks.forEach(block -> ret.addAll(block.getOps()));
        return ret;
    }
}
