package io.github.eutro.relift.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The architecture-neutral operator catalog.
 * <p>
 * Each operator documents its arity, whether it produces an output, and how the output size relates
 * to the input sizes. {@link #check(Varnode, List, long)} enforces all three.
 */
public enum OpCode {
    COPY(1, Category.DATA, 1, 1, Output.REQUIRED, SizeRule.SAME),
    /**
     * {@code out = *in0}.
     */
    LOAD(2, Category.DATA, 1, 1, Output.REQUIRED, SizeRule.FREE),
    /**
     * {@code *in0 = in1}.
     */
    STORE(3, Category.DATA, 2, 2, Output.NONE, SizeRule.FREE),

    /**
     * Jump to the address of the ram varnode {@code in0}.
     */
    BRANCH(4, Category.CONTROL, 1, 1, Output.NONE, SizeRule.FREE),
    /**
     * Jump to {@code in0} if the boolean {@code in1} is true, otherwise fall through.
     */
    CBRANCH(5, Category.CONTROL, 2, 2, Output.NONE, SizeRule.CONDITION),
    /**
     * Jump to the address computed into {@code in0}.
     */
    BRANCHIND(6, Category.CONTROL, 1, 1, Output.NONE, SizeRule.FREE),
    CALL(7, Category.CONTROL, 1, -1, Output.OPTIONAL, SizeRule.FREE),
    CALLIND(8, Category.CONTROL, 1, -1, Output.OPTIONAL, SizeRule.FREE),
    /**
     * A named operation with no modelled semantics. {@code in0} is a constant naming it.
     */
    CALLOTHER(9, Category.CONTROL, 1, -1, Output.OPTIONAL, SizeRule.FREE),
    RETURN(10, Category.CONTROL, 0, -1, Output.NONE, SizeRule.FREE),

    INT_EQUAL(11, Category.INT_COMPARE, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    INT_NOTEQUAL(12, Category.INT_COMPARE, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    INT_SLESS(13, Category.INT_COMPARE, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    INT_SLESSEQUAL(14, Category.INT_COMPARE, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    INT_LESS(15, Category.INT_COMPARE, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    INT_LESSEQUAL(16, Category.INT_COMPARE, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    INT_ZEXT(17, Category.EXTENSION, 1, 1, Output.REQUIRED, SizeRule.EXTEND),
    INT_SEXT(18, Category.EXTENSION, 1, 1, Output.REQUIRED, SizeRule.EXTEND),
    INT_ADD(19, Category.INT_ARITH, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    INT_SUB(20, Category.INT_ARITH, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    INT_CARRY(21, Category.CARRY, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    INT_SCARRY(22, Category.CARRY, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    INT_SBORROW(23, Category.CARRY, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    /**
     * Two's complement negation.
     */
    INT_2COMP(24, Category.INT_ARITH, 1, 1, Output.REQUIRED, SizeRule.SAME),
    /**
     * Bitwise not.
     */
    INT_NEGATE(25, Category.BITWISE, 1, 1, Output.REQUIRED, SizeRule.SAME),
    INT_XOR(26, Category.BITWISE, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    INT_AND(27, Category.BITWISE, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    INT_OR(28, Category.BITWISE, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    INT_LEFT(29, Category.BITWISE, 2, 2, Output.REQUIRED, SizeRule.SHIFT),
    INT_RIGHT(30, Category.BITWISE, 2, 2, Output.REQUIRED, SizeRule.SHIFT),
    INT_SRIGHT(31, Category.BITWISE, 2, 2, Output.REQUIRED, SizeRule.SHIFT),
    INT_MULT(32, Category.INT_ARITH, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    INT_DIV(33, Category.INT_ARITH, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    INT_SDIV(34, Category.INT_ARITH, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    INT_REM(35, Category.INT_ARITH, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    INT_SREM(36, Category.INT_ARITH, 2, 2, Output.REQUIRED, SizeRule.BINARY),

    BOOL_NEGATE(37, Category.BOOL, 1, 1, Output.REQUIRED, SizeRule.BOOL),
    BOOL_XOR(38, Category.BOOL, 2, 2, Output.REQUIRED, SizeRule.BOOL),
    BOOL_AND(39, Category.BOOL, 2, 2, Output.REQUIRED, SizeRule.BOOL),
    BOOL_OR(40, Category.BOOL, 2, 2, Output.REQUIRED, SizeRule.BOOL),

    FLOAT_EQUAL(41, Category.FLOAT_COMPARE, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    FLOAT_NOTEQUAL(42, Category.FLOAT_COMPARE, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    FLOAT_LESS(43, Category.FLOAT_COMPARE, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    FLOAT_LESSEQUAL(44, Category.FLOAT_COMPARE, 2, 2, Output.REQUIRED, SizeRule.COMPARE),
    FLOAT_NAN(46, Category.FLOAT_COMPARE, 1, 1, Output.REQUIRED, SizeRule.PREDICATE),
    FLOAT_ADD(47, Category.FLOAT_ARITH, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    FLOAT_DIV(48, Category.FLOAT_ARITH, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    FLOAT_MULT(49, Category.FLOAT_ARITH, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    FLOAT_SUB(50, Category.FLOAT_ARITH, 2, 2, Output.REQUIRED, SizeRule.BINARY),
    FLOAT_NEG(51, Category.FLOAT_ARITH, 1, 1, Output.REQUIRED, SizeRule.SAME),
    FLOAT_ABS(52, Category.FLOAT_ARITH, 1, 1, Output.REQUIRED, SizeRule.SAME),
    FLOAT_SQRT(53, Category.FLOAT_ARITH, 1, 1, Output.REQUIRED, SizeRule.SAME),
    FLOAT_INT2FLOAT(54, Category.FLOAT_CONVERT, 1, 1, Output.REQUIRED, SizeRule.FREE),
    FLOAT_FLOAT2FLOAT(55, Category.FLOAT_CONVERT, 1, 1, Output.REQUIRED, SizeRule.FREE),
    FLOAT_TRUNC(56, Category.FLOAT_CONVERT, 1, 1, Output.REQUIRED, SizeRule.FREE),
    FLOAT_CEIL(57, Category.FLOAT_ARITH, 1, 1, Output.REQUIRED, SizeRule.SAME),
    FLOAT_FLOOR(58, Category.FLOAT_ARITH, 1, 1, Output.REQUIRED, SizeRule.SAME),
    FLOAT_ROUND(59, Category.FLOAT_ARITH, 1, 1, Output.REQUIRED, SizeRule.SAME),

    /**
     * A phi: one input per predecessor edge, in predecessor order.
     */
    MULTIEQUAL(60, Category.SSA, 1, -1, Output.REQUIRED, SizeRule.MERGE),
    /**
     * Marks that {@code in0} may be changed indirectly by the op at address {@code in1}.
     */
    INDIRECT(61, Category.SSA, 2, 2, Output.REQUIRED, SizeRule.SAME),

    /**
     * {@code out = in0 << (8 * in1.size) | in1}.
     */
    PIECE(62, Category.BIT_MANIP, 2, 2, Output.REQUIRED, SizeRule.PIECE),
    /**
     * {@code out = in0 >> (8 * in1)}, truncated; {@code in1} is a constant byte offset.
     */
    SUBPIECE(63, Category.BIT_MANIP, 2, 2, Output.REQUIRED, SizeRule.SUBPIECE),
    CAST(64, Category.BIT_MANIP, 1, 1, Output.REQUIRED, SizeRule.SAME),
    /**
     * Array indexing: {@code out = in0 + in1 * in2}, {@code in2} the constant element size.
     */
    PTRADD(65, Category.BIT_MANIP, 3, 3, Output.REQUIRED, SizeRule.PTRADD),
    /**
     * Field access: {@code out = &in0->field_at(in1)}.
     */
    PTRSUB(66, Category.BIT_MANIP, 2, 2, Output.REQUIRED, SizeRule.SHIFT),
    SEGMENTOP(67, Category.BIT_MANIP, 1, -1, Output.REQUIRED, SizeRule.FREE),
    CPOOLREF(68, Category.BIT_MANIP, 1, -1, Output.REQUIRED, SizeRule.FREE),
    NEW(69, Category.BIT_MANIP, 1, -1, Output.REQUIRED, SizeRule.FREE),
    /**
     * {@code out = in0} with bits {@code [in2, in2 + in3)} replaced by {@code in1}.
     */
    INSERT(70, Category.BIT_MANIP, 4, 4, Output.REQUIRED, SizeRule.SHIFT),
    /**
     * {@code out} = bits {@code [in1, in1 + in2)} of {@code in0}.
     */
    EXTRACT(71, Category.BIT_MANIP, 3, 3, Output.REQUIRED, SizeRule.FREE),
    POPCOUNT(72, Category.BIT_MANIP, 1, 1, Output.REQUIRED, SizeRule.FREE),
    LZCOUNT(73, Category.BIT_MANIP, 1, 1, Output.REQUIRED, SizeRule.FREE);

    /**
     * Groups of operators by semantics class.
     */
    public enum Category {
        DATA,
        CONTROL,
        INT_COMPARE,
        INT_ARITH,
        BITWISE,
        EXTENSION,
        CARRY,
        BOOL,
        FLOAT_COMPARE,
        FLOAT_ARITH,
        FLOAT_CONVERT,
        SSA,
        BIT_MANIP,
    }

    /**
     * Whether an operator writes an output.
     */
    public enum Output {
        REQUIRED,
        OPTIONAL,
        NONE,
    }

    /**
     * How output and input sizes relate.
     */
    public enum SizeRule {
        /**
         * No relation is enforced.
         */
        FREE,
        /**
         * {@code out.size == in0.size}.
         */
        SAME,
        /**
         * {@code out.size == in0.size == in1.size}.
         */
        BINARY,
        /**
         * {@code out.size == in0.size}; the other inputs are unconstrained.
         */
        SHIFT,
        /**
         * {@code out.size == 1} and {@code in0.size == in1.size}.
         */
        COMPARE,
        /**
         * Every varnode is 1 byte.
         */
        BOOL,
        /**
         * {@code out.size == 1}.
         */
        PREDICATE,
        /**
         * {@code out.size > in0.size}.
         */
        EXTEND,
        /**
         * Every input has the size of the output.
         */
        MERGE,
        /**
         * {@code out.size == in0.size + in1.size}.
         */
        PIECE,
        /**
         * {@code in1} is constant and {@code in1 + out.size <= in0.size}.
         */
        SUBPIECE,
        /**
         * {@code in1.size == 1}.
         */
        CONDITION,
        /**
         * {@code out.size == in0.size} and {@code in2} is constant.
         */
        PTRADD,
    }

    private static final OpCode[] BY_NUMBER = new OpCode[74];

    static {
        for (OpCode value : values()) {
            BY_NUMBER[value.number] = value;
        }
    }

    private final int number;
    private final Category category;
    private final int minInputs;
    private final int maxInputs;
    private final Output output;
    private final SizeRule sizeRule;

    OpCode(int number, Category category, int minInputs, int maxInputs, Output output, SizeRule sizeRule) {
        this.number = number;
        this.category = category;
        this.minInputs = minInputs;
        this.maxInputs = maxInputs;
        this.output = output;
        this.sizeRule = sizeRule;
    }

    /**
     * Look up an operator by its catalog number.
     *
     * @param number The number.
     * @return The operator.
     */
    public static OpCode byNumber(int number) {
        OpCode op = number >= 0 && number < BY_NUMBER.length ? BY_NUMBER[number] : null;
        if (op == null) {
            throw new IllegalArgumentException(String.format("no operator numbered %d", number));
        }
        return op;
    }

    public int getNumber() {
        return number;
    }

    public Category getCategory() {
        return category;
    }

    public int getMinInputs() {
        return minInputs;
    }

    /**
     * @return The maximum number of inputs, or -1 if variadic.
     */
    public int getMaxInputs() {
        return maxInputs;
    }

    public Output getOutput() {
        return output;
    }

    public SizeRule getSizeRule() {
        return sizeRule;
    }

    /**
     * Whether this ends a basic block without falling through to the next instruction.
     *
     * @return Whether this is a block terminator with no fallthrough.
     */
    public boolean isTerminator() {
        switch (this) {
            case BRANCH:
            case CBRANCH:
            case BRANCHIND:
            case RETURN:
                return true;
            default:
                return false;
        }
    }

    public boolean isCall() {
        return this == CALL || this == CALLIND || this == CALLOTHER;
    }

    /**
     * Whether the operator has no effect beyond writing its output.
     *
     * @return Whether the op is pure.
     */
    public boolean isPure() {
        switch (category) {
            case CONTROL:
                return false;
            case DATA:
                return this == COPY;
            default:
                return this != NEW;
        }
    }

    /**
     * Validate the shape of an operation using this operator.
     *
     * @param out     The output, if any.
     * @param inputs  The inputs.
     * @param address The address of the originating instruction, for the error message.
     * @throws MalformedOperationException If the arity, output presence or sizes are wrong.
     */
    public void check(@Nullable Varnode out, List<Varnode> inputs, long address) {
        int n = inputs.size();
        if (n < minInputs || (maxInputs >= 0 && n > maxInputs)) {
            throw new MalformedOperationException(this, address, maxInputs < 0
                    ? String.format("expected at least %d inputs, got %d", minInputs, n)
                    : String.format("expected %d to %d inputs, got %d", minInputs, maxInputs, n));
        }
        if (out == null && output == Output.REQUIRED) {
            throw new MalformedOperationException(this, address, "missing output");
        }
        if (out != null && output == Output.NONE) {
            throw new MalformedOperationException(this, address, "unexpected output " + out);
        }
        if (out != null && out.isConstant()) {
            throw new MalformedOperationException(this, address, "output is a constant");
        }
        switch (sizeRule) {
            case FREE:
                break;
            case SAME:
            case SHIFT:
                expectSize(out, inputs.get(0).size, address);
                break;
            case BINARY:
                expectSize(out, inputs.get(0).size, address);
                expectSize(inputs.get(1), inputs.get(0).size, address);
                break;
            case COMPARE:
                expectSize(out, 1, address);
                expectSize(inputs.get(1), inputs.get(0).size, address);
                break;
            case BOOL:
                expectSize(out, 1, address);
                for (Varnode input : inputs) {
                    expectSize(input, 1, address);
                }
                break;
            case PREDICATE:
                expectSize(out, 1, address);
                break;
            case EXTEND:
                if (out != null && out.size <= inputs.get(0).size) {
                    throw new MalformedOperationException(this, address, String.format(
                            "extension must grow, %d -> %d", inputs.get(0).size, out.size));
                }
                break;
            case MERGE:
                for (Varnode input : inputs) {
                    expectSize(input, out == null ? input.size : out.size, address);
                }
                break;
            case PIECE:
                expectSize(out, inputs.get(0).size + inputs.get(1).size, address);
                break;
            case SUBPIECE: {
                Varnode shift = inputs.get(1);
                if (!shift.isConstant()) {
                    throw new MalformedOperationException(this, address, "byte offset must be constant");
                }
                if (out != null && shift.offset + out.size > inputs.get(0).size) {
                    throw new MalformedOperationException(this, address, String.format(
                            "%d bytes at offset %d exceed %d byte input", out.size, shift.offset, inputs.get(0).size));
                }
                break;
            }
            case CONDITION:
                expectSize(inputs.get(1), 1, address);
                break;
            case PTRADD:
                expectSize(out, inputs.get(0).size, address);
                if (!inputs.get(2).isConstant()) {
                    throw new MalformedOperationException(this, address, "element size must be constant");
                }
                break;
        }
    }

    private void expectSize(@Nullable Varnode vn, int size, long address) {
        if (vn != null && vn.size != size) {
            throw new MalformedOperationException(this, address, String.format(
                    "%s should be %d bytes", vn, size));
        }
    }
}
