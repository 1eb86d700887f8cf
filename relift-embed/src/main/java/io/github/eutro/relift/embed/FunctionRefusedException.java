package io.github.eutro.relift.embed;

/**
 * Thrown when a function cannot be decompiled at all, because of a malformed operation, an unsupported
 * instruction under {@link io.github.eutro.relift.core.frontend.Lifter.UnsupportedPolicy#ABORT}, or a broken
 * internal invariant.
 */
public class FunctionRefusedException extends RuntimeException {
    private final long address;

    public FunctionRefusedException(long address, Throwable cause) {
        super(String.format("refused to decompile function at 0x%x: %s", address, cause.getMessage()), cause);
        this.address = address;
    }

    /**
     * @return The entry address of the function.
     */
    public long getAddress() {
        return address;
    }
}
