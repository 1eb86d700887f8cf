package io.github.eutro.relift.embed;

/**
 * The stages of decompilation, in the order they run.
 */
public enum Stage {
    TRANSLATE,
    CFG,
    SSA,
    TYPES,
    STRUCTURE,
    RENDER,
    ;

    /**
     * Whether this stage runs when decompiling up to {@code last}.
     *
     * @param last The last stage to run.
     * @return Whether this stage is at or before it.
     */
    public boolean isIncludedIn(Stage last) {
        return compareTo(last) <= 0;
    }
}
