package io.github.eutro.relift.core.ir;

/**
 * Thrown when an operation is built with the wrong number of inputs or with sizes its
 * {@link OpCode} does not allow.
 * <p>
 * This always indicates a bug in whatever produced the operation, and aborts analysis of the function.
 */
public class MalformedOperationException extends RuntimeException {
    private final OpCode opcode;
    private final long address;

    public MalformedOperationException(OpCode opcode, long address, String message) {
        super(String.format("malformed %s at 0x%x: %s", opcode, address, message));
        this.opcode = opcode;
        this.address = address;
    }

    public OpCode getOpcode() {
        return opcode;
    }

    public long getAddress() {
        return address;
    }
}
