package io.github.eutro.relift.core.frontend;

import io.github.eutro.relift.core.ir.IRBuilder;
import io.github.eutro.relift.core.ir.Varnode;

import java.util.HashMap;
import java.util.Map;

/**
 * A {@link Translator} that dispatches on the mnemonic through a table of {@link Rule}s.
 */
public abstract class AbstractTranslator implements Translator {
    private final Map<String, Rule> rules = new HashMap<>();
    protected final RegisterModel registers;

    protected AbstractTranslator(RegisterModel registers) {
        this.registers = registers;
    }

    /**
     * The semantics of one or more mnemonics.
     */
    @FunctionalInterface
    protected interface Rule {
        void translate(DecodedInstruction insn, IRBuilder ib);
    }

    /**
     * Register a rule for some mnemonics.
     *
     * @param rule      The rule.
     * @param mnemonics The mnemonics it translates.
     */
    protected void rule(Rule rule, String... mnemonics) {
        for (String mnemonic : mnemonics) {
            if (rules.put(mnemonic, rule) != null) {
                throw new IllegalStateException(String.format("duplicate rule for %s", mnemonic));
            }
        }
    }

    @Override
    public RegisterModel getRegisters() {
        return registers;
    }

    @Override
    public boolean supports(String mnemonic) {
        return rules.containsKey(mnemonic);
    }

    @Override
    public void translate(DecodedInstruction insn, IRBuilder ib) {
        Rule rule = rules.get(insn.getMnemonic());
        if (rule == null) {
            throw new UnsupportedInstructionException(insn.getMnemonic(), insn.getAddress());
        }
        rule.translate(insn, ib);
    }

    protected static UnsupportedInstructionException badOperands(DecodedInstruction insn) {
        return new UnsupportedInstructionException(insn.toString(), insn.getAddress(), "unsupported operands in");
    }

    protected static void expectOperands(DecodedInstruction insn, int min, int max) {
        int n = insn.numOperands();
        if (n < min || n > max) throw badOperands(insn);
    }

    /**
     * Resolve a register operand.
     *
     * @param insn The instruction, for errors.
     * @param op   The operand.
     * @return The register varnode, possibly a view of a larger register.
     */
    protected Varnode register(DecodedInstruction insn, Operand op) {
        if (op.getKind() != Operand.Kind.REGISTER) throw badOperands(insn);
        Varnode vn = registers.resolve(((Operand.Register) op).name);
        if (vn == null) {
            throw new UnsupportedInstructionException(insn.toString(), insn.getAddress(), "unknown register in");
        }
        return vn;
    }

    /**
     * Get the target of a direct branch or call.
     *
     * @param insn The instruction, for errors.
     * @param op   The operand.
     * @return The target address.
     */
    protected static long target(DecodedInstruction insn, Operand op) {
        if (op.getKind() != Operand.Kind.IMMEDIATE) throw badOperands(insn);
        return ((Operand.Immediate) op).value;
    }
}
