package io.github.eutro.relift.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * An op builder, which encapsulates the instruction currently being translated
 * and allocates temporaries in the {@link Space#UNIQUE} space.
 */
public class IRBuilder {
    /**
     * Where temporaries start, above anything a register model uses.
     */
    public static final long UNIQUE_BASE = 0x10000;

    private final int pointerSize;
    private final List<PcodeOp> ops = new ArrayList<>();
    private long address;
    private long nextUnique = UNIQUE_BASE;

    /**
     * Construct a builder.
     *
     * @param pointerSize The size of a code or data address, in bytes.
     */
    public IRBuilder(int pointerSize) {
        this.pointerSize = pointerSize;
    }

    public int getPointerSize() {
        return pointerSize;
    }

    public long getAddress() {
        return address;
    }

    /**
     * Set the address subsequent ops are attributed to.
     *
     * @param address The address of the instruction being translated.
     */
    public void setAddress(long address) {
        this.address = address;
    }

    /**
     * Take every op emitted since the last call.
     *
     * @return The ops.
     */
    public List<PcodeOp> drain() {
        List<PcodeOp> ret = new ArrayList<>(ops);
        ops.clear();
        return ret;
    }

    /**
     * Allocate a fresh temporary.
     *
     * @param size The size in bytes.
     * @return The temporary.
     */
    public Varnode temp(int size) {
        Varnode vn = Varnode.unique(nextUnique, size);
        nextUnique += Math.max(size, 8);
        return vn;
    }

    public Varnode constant(long value, int size) {
        return Varnode.constant(value, size);
    }

    /**
     * A reference to the code at {@code target}, as used by branches and calls.
     *
     * @param target The address.
     * @return The ram varnode.
     */
    public Varnode codeAddress(long target) {
        return Varnode.ram(target, pointerSize);
    }

    /**
     * Emit an op.
     *
     * @param opcode The operator.
     * @param out    The output, if any.
     * @param inputs The inputs.
     * @return The op.
     */
    public PcodeOp emit(OpCode opcode, @Nullable Varnode out, Varnode... inputs) {
        PcodeOp op = new PcodeOp(opcode, address, out, inputs);
        ops.add(op);
        return op;
    }

    /**
     * Emit an op writing a fresh temporary.
     *
     * @param opcode The operator.
     * @param size   The size of the result.
     * @param inputs The inputs.
     * @return The temporary holding the result.
     */
    public Varnode op(OpCode opcode, int size, Varnode... inputs) {
        Varnode out = temp(size);
        emit(opcode, out, inputs);
        return out;
    }

    public void copy(Varnode out, Varnode in) {
        emit(OpCode.COPY, out, in);
    }

    public Varnode load(int size, Varnode addr) {
        return op(OpCode.LOAD, size, addr);
    }

    public void load(Varnode out, Varnode addr) {
        emit(OpCode.LOAD, out, addr);
    }

    public void store(Varnode addr, Varnode value) {
        emit(OpCode.STORE, null, addr, value);
    }

    public void branch(long target) {
        emit(OpCode.BRANCH, null, codeAddress(target));
    }

    public void cbranch(long target, Varnode cond) {
        emit(OpCode.CBRANCH, null, codeAddress(target), cond);
    }

    public void branchInd(Varnode target) {
        emit(OpCode.BRANCHIND, null, target);
    }

    public void call(long target) {
        emit(OpCode.CALL, null, codeAddress(target));
    }

    public void callInd(Varnode target) {
        emit(OpCode.CALLIND, null, target);
    }

    public void ret(Varnode... inputs) {
        emit(OpCode.RETURN, null, inputs);
    }
}
