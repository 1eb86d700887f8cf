package io.github.eutro.relift.embed;

import io.github.eutro.relift.core.diag.Diagnostic;
import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ir.DominatorTree;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.ir.PcodeListing;
import io.github.eutro.relift.core.ir.PcodeOp;
import io.github.eutro.relift.core.structure.StructNode;
import io.github.eutro.relift.core.types.TypeMap;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outputs of decompiling one function.
 * <p>
 * Each output is available once the stage producing it has run, and is null before that.
 * A failed decompilation keeps the outputs of the stages that completed.
 */
public final class Decompilation {
    private final long address;
    @Nullable
    Stage completed;
    @Nullable
    PcodeListing listing;
    @Nullable
    Function function;
    @Nullable
    String pseudocode;
    @Nullable
    FunctionRefusedException failure;

    Decompilation(long address) {
        this.address = address;
    }

    /**
     * @return The entry address of the function.
     */
    public long getAddress() {
        return address;
    }

    /**
     * @return The last stage that completed, or null if translation failed.
     */
    public @Nullable Stage getCompletedStage() {
        return completed;
    }

    public @Nullable PcodeListing getListing() {
        return listing;
    }

    /**
     * @return The translated ops in address order, as they were before SSA renaming.
     */
    public List<PcodeOp> getOps() {
        return listing == null ? Collections.emptyList() : listing.getOps();
    }

    /**
     * @return The function and its control flow graph, in SSA form once {@link Stage#SSA} has run.
     */
    public @Nullable Function getFunction() {
        return function;
    }

    public @Nullable DominatorTree getDominators() {
        return function == null ? null : function.getNullable(CommonExts.DOM_TREE);
    }

    public @Nullable DominatorTree getPostDominators() {
        return function == null ? null : function.getNullable(CommonExts.POST_DOM_TREE);
    }

    public @Nullable TypeMap getTypes() {
        return function == null ? null : function.getNullable(CommonExts.TYPE_MAP);
    }

    public @Nullable StructNode getStructure() {
        return function == null ? null : function.getNullable(CommonExts.STRUCTURE);
    }

    public @Nullable String getPseudocode() {
        return pseudocode;
    }

    /**
     * @return Every diagnostic reported so far, in the order reported.
     */
    public List<Diagnostic> getDiagnostics() {
        if (function != null) return function.getDiagnostics().asList();
        if (listing != null) return listing.getDiagnostics().asList();
        return new ArrayList<>();
    }

    public @Nullable FunctionRefusedException getFailure() {
        return failure;
    }

    public boolean isSuccessful() {
        return failure == null;
    }

    @Override
    public String toString() {
        return String.format("Decompilation(0x%x, %s)", address, failure == null ? completed : failure.getMessage());
    }
}
