package io.github.eutro.relift.core.passes.meta;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.ir.DefUse;
import io.github.eutro.relift.core.ir.Function;
import io.github.eutro.relift.core.passes.InPlaceIRPass;

/**
 * Compute the {@link CommonExts#DEF_USE def-use chains} of a function.
 */
public class ComputeUses implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeUses INSTANCE = new ComputeUses();

    @Override
    public void runInPlace(Function func) {
        func.attachExt(CommonExts.DEF_USE, DefUse.compute(func));

        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.validate(MetadataState.USES);
    }
}
