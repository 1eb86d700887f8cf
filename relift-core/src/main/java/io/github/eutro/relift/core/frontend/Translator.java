package io.github.eutro.relift.core.frontend;

import io.github.eutro.relift.core.ir.IRBuilder;

/**
 * Translates machine instructions of one ISA family into ops.
 * <p>
 * Translators may keep per-function state, so each function being lifted should get its own.
 */
public interface Translator {
    /**
     * @return The registers of the ISA.
     */
    RegisterModel getRegisters();

    /**
     * Check whether there are semantics for a mnemonic.
     *
     * @param mnemonic The mnemonic, in lower case.
     * @return Whether {@link #translate(DecodedInstruction, IRBuilder)} accepts it.
     */
    boolean supports(String mnemonic);

    /**
     * Emit the ops of one instruction into a builder, whose address has been set to the instruction's.
     *
     * @param insn The instruction.
     * @param ib   The builder.
     * @throws UnsupportedInstructionException If the mnemonic, or its operands, are not supported.
     */
    void translate(DecodedInstruction insn, IRBuilder ib);
}
