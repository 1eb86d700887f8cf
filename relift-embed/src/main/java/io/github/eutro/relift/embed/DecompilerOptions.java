package io.github.eutro.relift.embed;

import io.github.eutro.relift.core.frontend.Lifter;
import io.github.eutro.relift.core.frontend.MemoryImage;
import io.github.eutro.relift.core.passes.meta.RecoverStructure;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Options for a {@link Decompiler}, created with {@link #builder()}.
 * <p>
 * Some defaults can be set from the environment:
 * <ul>
 *     <li>{@code RELIFT_MAX_INSNS}: the instruction limit, 0 for none;</li>
 *     <li>{@code RELIFT_NO_VERIFY_SSA}: if set, SSA form is not verified after renaming;</li>
 *     <li>{@code RELIFT_PARALLELISM}: the number of threads {@link Decompiler#decompileAll} uses.</li>
 * </ul>
 */
public final class DecompilerOptions {
    private static final Logger logger = LogManager.getLogger(DecompilerOptions.class);

    private static final int DEFAULT_MAX_INSNS = intFromEnv("RELIFT_MAX_INSNS", 0);
    private static final boolean DEFAULT_VERIFY_SSA = System.getenv("RELIFT_NO_VERIFY_SSA") == null;
    private static final int DEFAULT_PARALLELISM = intFromEnv("RELIFT_PARALLELISM", Runtime.getRuntime().availableProcessors());
    private static final int DEFAULT_MAX_TABLE_ENTRIES = 256;

    private final Isa isa;
    private final int maxInstructions;
    private final Lifter.UnsupportedPolicy unsupportedPolicy;
    private final Stage stopStage;
    private final int minSwitchCases;
    private final int structureStepBudget;
    @Nullable
    private final MemoryImage memoryImage;
    private final int maxTableEntries;
    private final int parallelism;
    private final boolean verifySsa;

    private DecompilerOptions(Builder builder) {
        isa = builder.isa;
        maxInstructions = builder.maxInstructions;
        unsupportedPolicy = builder.unsupportedPolicy;
        stopStage = builder.stopStage;
        minSwitchCases = builder.minSwitchCases;
        structureStepBudget = builder.structureStepBudget;
        memoryImage = builder.memoryImage;
        maxTableEntries = builder.maxTableEntries;
        parallelism = builder.parallelism;
        verifySsa = builder.verifySsa;
    }

    private static int intFromEnv(String name, int fallback) {
        String value = System.getenv(name);
        if (value == null) return fallback;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("ignoring {}={}: not an integer", name, value);
            return fallback;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The default options.
     */
    public static DecompilerOptions defaults() {
        return builder().build();
    }

    public Isa getIsa() {
        return isa;
    }

    public int getMaxInstructions() {
        return maxInstructions;
    }

    public Lifter.UnsupportedPolicy getUnsupportedPolicy() {
        return unsupportedPolicy;
    }

    public Stage getStopStage() {
        return stopStage;
    }

    public int getMinSwitchCases() {
        return minSwitchCases;
    }

    public int getStructureStepBudget() {
        return structureStepBudget;
    }

    public @Nullable MemoryImage getMemoryImage() {
        return memoryImage;
    }

    public int getMaxTableEntries() {
        return maxTableEntries;
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isVerifySsa() {
        return verifySsa;
    }

    public static final class Builder {
        private Isa isa = Isa.REF;
        private int maxInstructions = DEFAULT_MAX_INSNS;
        private Lifter.UnsupportedPolicy unsupportedPolicy = Lifter.UnsupportedPolicy.PLACEHOLDER;
        private Stage stopStage = Stage.RENDER;
        private int minSwitchCases = RecoverStructure.DEFAULT_MIN_SWITCH_CASES;
        private int structureStepBudget = RecoverStructure.DEFAULT_STEP_BUDGET;
        @Nullable
        private MemoryImage memoryImage;
        private int maxTableEntries = DEFAULT_MAX_TABLE_ENTRIES;
        private int parallelism = DEFAULT_PARALLELISM;
        private boolean verifySsa = DEFAULT_VERIFY_SSA;

        private Builder() {
        }

        public Builder isa(Isa isa) {
            this.isa = isa;
            return this;
        }

        /**
         * @param maxInstructions The most instructions to lift per function, 0 for no limit.
         * @return This builder.
         */
        public Builder maxInstructions(int maxInstructions) {
            if (maxInstructions < 0) {
                throw new IllegalArgumentException(String.format("negative instruction limit %d", maxInstructions));
            }
            this.maxInstructions = maxInstructions;
            return this;
        }

        public Builder unsupportedPolicy(Lifter.UnsupportedPolicy unsupportedPolicy) {
            this.unsupportedPolicy = unsupportedPolicy;
            return this;
        }

        /**
         * @param stopStage The last stage to run.
         * @return This builder.
         */
        public Builder stopAfter(Stage stopStage) {
            this.stopStage = stopStage;
            return this;
        }

        public Builder minSwitchCases(int minSwitchCases) {
            this.minSwitchCases = minSwitchCases;
            return this;
        }

        public Builder structureStepBudget(int structureStepBudget) {
            this.structureStepBudget = structureStepBudget;
            return this;
        }

        /**
         * @param memoryImage Memory to read jump tables from, or null to leave indirect branches unresolved.
         * @return This builder.
         */
        public Builder memoryImage(@Nullable MemoryImage memoryImage) {
            this.memoryImage = memoryImage;
            return this;
        }

        public Builder maxTableEntries(int maxTableEntries) {
            this.maxTableEntries = maxTableEntries;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException(String.format("parallelism must be positive, got %d", parallelism));
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder verifySsa(boolean verifySsa) {
            this.verifySsa = verifySsa;
            return this;
        }

        public DecompilerOptions build() {
            return new DecompilerOptions(this);
        }
    }
}
