package io.github.eutro.relift.core.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * One machine instruction as produced by a disassembler: where it is, how long it is,
 * its mnemonic and its operands.
 * <p>
 * {@link #parse(long, int, String)} builds one from assembly-like text, such as
 * {@code "mov qword ptr [rbp - 0x8], rax"} or {@code "beq r1, r2, 0x1010"}.
 */
public final class DecodedInstruction {
    private final long address;
    private final int length;
    private final String mnemonic;
    private final List<Operand> operands;

    public DecodedInstruction(long address, int length, String mnemonic, List<Operand> operands) {
        if (length <= 0) {
            throw new IllegalArgumentException(String.format("instruction at 0x%x has length %d", address, length));
        }
        this.address = address;
        this.length = length;
        this.mnemonic = mnemonic.toLowerCase(Locale.ROOT);
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    public long getAddress() {
        return address;
    }

    public int getLength() {
        return length;
    }

    /**
     * @return The address of the instruction that follows this one.
     */
    public long getNextAddress() {
        return address + length;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    public List<Operand> getOperands() {
        return operands;
    }

    public Operand getOperand(int i) {
        return operands.get(i);
    }

    public int numOperands() {
        return operands.size();
    }

    /**
     * Parse an instruction from text.
     *
     * @param address The address of the instruction.
     * @param length  The length of the instruction in bytes.
     * @param text    The text, a mnemonic followed by comma-separated operands.
     * @return The instruction.
     * @throws IllegalArgumentException If the text cannot be parsed.
     */
    public static DecodedInstruction parse(long address, int length, String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("empty instruction at 0x%x", address));
        }
        int space = 0;
        while (space < trimmed.length() && !Character.isWhitespace(trimmed.charAt(space))) space++;
        String mnemonic = trimmed.substring(0, space);
        List<Operand> operands = new ArrayList<>();
        String rest = trimmed.substring(space).trim();
        if (!rest.isEmpty()) {
            for (String part : splitOperands(rest)) {
                operands.add(parseOperand(part.trim(), text));
            }
        }
        return new DecodedInstruction(address, length, mnemonic, operands);
    }

    /**
     * Parse a run of instructions of equal length, laid out back to back from {@code start}.
     *
     * @param start  The address of the first instruction.
     * @param length The length of each instruction.
     * @param lines  The instructions' text.
     * @return The instructions.
     */
    public static List<DecodedInstruction> parseAll(long start, int length, String... lines) {
        List<DecodedInstruction> ret = new ArrayList<>();
        long address = start;
        for (String line : lines) {
            ret.add(parse(address, length, line));
            address += length;
        }
        return ret;
    }

    private static List<String> splitOperands(String s) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int last = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '[') depth++;
            else if (c == ']') depth--;
            else if (c == ',' && depth == 0) {
                parts.add(s.substring(last, i));
                last = i + 1;
            }
        }
        parts.add(s.substring(last));
        return parts;
    }

    private static Operand parseOperand(String s, String text) {
        String lower = s.toLowerCase(Locale.ROOT);
        int open = lower.indexOf('[');
        if (open >= 0) {
            int close = lower.lastIndexOf(']');
            if (close < open) {
                throw new IllegalArgumentException(String.format("unbalanced brackets in '%s'", text));
            }
            return parseMemory(sizePrefix(lower.substring(0, open).trim(), text), lower.substring(open + 1, close), text);
        }
        Long imm = parseNumber(lower);
        if (imm != null) return new Operand.Immediate(imm);
        if (!lower.matches("[a-z_][a-z0-9_]*")) {
            throw new IllegalArgumentException(String.format("bad operand '%s' in '%s'", s, text));
        }
        return new Operand.Register(lower);
    }

    private static int sizePrefix(String prefix, String text) {
        if (prefix.endsWith("ptr")) prefix = prefix.substring(0, prefix.length() - 3).trim();
        switch (prefix) {
            case "":
                return 0;
            case "byte":
                return 1;
            case "word":
                return 2;
            case "dword":
                return 4;
            case "qword":
                return 8;
            default:
                throw new IllegalArgumentException(String.format("bad size '%s' in '%s'", prefix, text));
        }
    }

    private static Operand.Memory parseMemory(int size, String inner, String text) {
        String base = null;
        String index = null;
        int scale = 1;
        long disp = 0;
        int i = 0;
        boolean negate = false;
        inner = inner.replace(" ", "");
        while (i < inner.length()) {
            int j = i;
            while (j < inner.length() && inner.charAt(j) != '+' && inner.charAt(j) != '-') j++;
            String term = inner.substring(i, j);
            if (!term.isEmpty()) {
                int star = term.indexOf('*');
                Long num;
                if (star >= 0) {
                    String a = term.substring(0, star);
                    String b = term.substring(star + 1);
                    Long sb = parseNumber(b);
                    if (sb == null) {
                        sb = parseNumber(a);
                        a = b;
                    }
                    if (sb == null || index != null || negate) {
                        throw new IllegalArgumentException(String.format("bad index in '%s'", text));
                    }
                    index = a;
                    scale = sb.intValue();
                } else if ((num = parseNumber(term)) != null) {
                    disp += negate ? -num : num;
                } else if (negate) {
                    throw new IllegalArgumentException(String.format("cannot subtract register in '%s'", text));
                } else if (base == null) {
                    base = term;
                } else if (index == null) {
                    index = term;
                } else {
                    throw new IllegalArgumentException(String.format("too many registers in '%s'", text));
                }
            }
            if (j < inner.length()) negate = inner.charAt(j) == '-';
            i = j + 1;
        }
        return new Operand.Memory(base, index, scale, disp, size);
    }

    private static Long parseNumber(String s) {
        boolean neg = s.startsWith("-");
        String digits = neg ? s.substring(1) : s;
        try {
            long value;
            if (digits.startsWith("0x")) {
                value = Long.parseUnsignedLong(digits.substring(2), 16);
            } else if (!digits.isEmpty() && Character.isDigit(digits.charAt(0))) {
                value = Long.parseLong(digits);
            } else {
                return null;
            }
            return neg ? -value : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(mnemonic);
        for (int i = 0; i < operands.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append(operands.get(i));
        }
        return sb.toString();
    }
}
