package io.github.eutro.relift.core.frontend;

/**
 * Thrown when a {@link Translator} has no semantics for an instruction.
 * <p>
 * This is recoverable: the {@link Lifter} either rethrows it or substitutes a placeholder,
 * depending on its {@link Lifter.UnsupportedPolicy}.
 */
public class UnsupportedInstructionException extends RuntimeException {
    private final String mnemonic;
    private final long address;

    public UnsupportedInstructionException(String mnemonic, long address) {
        this(mnemonic, address, "unsupported instruction");
    }

    public UnsupportedInstructionException(String mnemonic, long address, String reason) {
        super(String.format("%s '%s' at 0x%x", reason, mnemonic, address));
        this.mnemonic = mnemonic;
        this.address = address;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    public long getAddress() {
        return address;
    }
}
