package io.github.eutro.relift.core.ir;

/**
 * The address spaces a {@link Varnode} can live in.
 */
public enum Space {
    /**
     * Processor registers, addressed by the register model's offsets.
     */
    REGISTER("reg"),
    /**
     * Addressable memory.
     */
    RAM("ram"),
    /**
     * Literal constants; the offset is the value.
     */
    CONST("const"),
    /**
     * Temporaries introduced by translation.
     */
    UNIQUE("uniq"),
    /**
     * Stack-relative storage.
     */
    STACK("stack");

    private final String shortName;

    Space(String shortName) {
        this.shortName = shortName;
    }

    public String getShortName() {
        return shortName;
    }
}
