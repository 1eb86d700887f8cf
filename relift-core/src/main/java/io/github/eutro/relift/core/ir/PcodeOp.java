package io.github.eutro.relift.core.ir;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.Ext;
import io.github.eutro.relift.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One operation: an {@link OpCode} applied to ordered inputs, optionally writing an output.
 * <p>
 * The shape is validated on construction. Renaming may later replace inputs and the output
 * with other versions of the same locations, which keeps the shape valid.
 */
public final class PcodeOp extends ExtHolder {
    public final OpCode opcode;
    /**
     * The address of the machine instruction this op was translated from.
     */
    public final long address;
    @Nullable
    private Varnode output;
    private final List<Varnode> inputs;

    /**
     * Construct an operation.
     *
     * @param opcode  The operator.
     * @param address The source address.
     * @param output  The output, if any.
     * @param inputs  The inputs.
     * @throws MalformedOperationException If the operator does not accept this shape.
     */
    public PcodeOp(OpCode opcode, long address, @Nullable Varnode output, List<Varnode> inputs) {
        opcode.check(output, inputs, address);
        this.opcode = opcode;
        this.address = address;
        this.output = output;
        this.inputs = new ArrayList<>(inputs);
    }

    public PcodeOp(OpCode opcode, long address, @Nullable Varnode output, Varnode... inputs) {
        this(opcode, address, output, Arrays.asList(inputs));
    }

    public @Nullable Varnode getOutput() {
        return output;
    }

    public List<Varnode> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    public Varnode getInput(int i) {
        return inputs.get(i);
    }

    public int numInputs() {
        return inputs.size();
    }

    /**
     * Replace an input with another version of the same location.
     *
     * @param i  The input index.
     * @param vn The new input.
     */
    public void setInput(int i, Varnode vn) {
        checkSameLocation(inputs.get(i), vn);
        inputs.set(i, vn);
    }

    /**
     * Replace the output with another version of the same location.
     *
     * @param vn The new output.
     */
    public void setOutput(Varnode vn) {
        if (output == null) {
            throw new IllegalStateException(String.format("%s has no output to replace", this));
        }
        checkSameLocation(output, vn);
        output = vn;
    }

    private void checkSameLocation(Varnode old, Varnode vn) {
        if (!old.unversioned().equals(vn.unversioned())) {
            throw new MalformedOperationException(opcode, address, String.format("cannot replace %s with %s", old, vn));
        }
    }

    /**
     * The address a {@link OpCode#BRANCH} or {@link OpCode#CBRANCH} jumps to, or that a {@link OpCode#CALL} calls.
     *
     * @return The target address.
     */
    public long getTargetAddress() {
        switch (opcode) {
            case BRANCH:
            case CBRANCH:
            case CALL:
                return inputs.get(0).offset;
            default:
                throw new IllegalStateException(String.format("%s has no direct target", opcode));
        }
    }

    /**
     * Whether input {@code i} is a code address rather than a value, as the target of a direct branch or call is.
     *
     * @param i The input index.
     * @return Whether the input is a code address.
     */
    public boolean isAddressInput(int i) {
        if (i != 0) return false;
        switch (opcode) {
            case BRANCH:
            case CBRANCH:
            case CALL:
                return true;
            default:
                return false;
        }
    }

    /**
     * Whether input {@code i} reads a value that data flow should track.
     *
     * @param i The input index.
     * @return Whether the input is neither a constant nor a code address.
     */
    public boolean isValueInput(int i) {
        return !inputs.get(i).isConstant() && !isAddressInput(i);
    }

    /**
     * Whether this op is a phi.
     *
     * @return If the opcode is {@link OpCode#MULTIEQUAL}.
     */
    public boolean isPhi() {
        return opcode == OpCode.MULTIEQUAL;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (output != null) {
            sb.append(output).append(" = ");
        }
        sb.append(opcode);
        for (int i = 0; i < inputs.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append(inputs.get(i));
        }
        return sb.toString();
    }

    // exts
    private BasicBlock owner;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
