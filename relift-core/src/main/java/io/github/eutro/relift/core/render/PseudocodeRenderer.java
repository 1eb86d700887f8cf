package io.github.eutro.relift.core.render;

import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.frontend.RegisterModel;
import io.github.eutro.relift.core.ir.*;
import io.github.eutro.relift.core.passes.IRPass;
import io.github.eutro.relift.core.passes.meta.RecoverStructure;
import io.github.eutro.relift.core.structure.Loop;
import io.github.eutro.relift.core.structure.StructNode;
import io.github.eutro.relift.core.types.Type;
import io.github.eutro.relift.core.types.TypeMap;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Renders a function in SSA form as C-like pseudocode, following its {@link CommonExts#STRUCTURE}.
 * <p>
 * Temporaries read once, cheap conversions, and flags are folded into the expressions that read them,
 * and temporaries and flags nothing reads are left out. Phis are shown as comments. Values are named by the
 * function's {@link RegisterModel}, with the SSA version as a suffix, and declared with their inferred types.
 */
public class PseudocodeRenderer implements IRPass<Function, String> {
    /**
     * A singleton instance of this pass.
     */
    public static final PseudocodeRenderer INSTANCE = new PseudocodeRenderer();

    private static final String INDENT = "    ";
    private static final int SWITCH_MARKER = Integer.MIN_VALUE;

    @Override
    public String run(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.TYPES_INFERRED, MetadataState.LOOPS);
        StructNode root = func.getExtOrRun(CommonExts.STRUCTURE, func, RecoverStructure.INSTANCE);
        return new Printer(func, root).print();
    }

    private static class Printer {
        final Function func;
        final StructNode root;
        final TypeMap types;
        final DefUse du;
        final @Nullable RegisterModel registers;
        final List<String> userOps;
        final Map<Integer, Loop> loopsByHeader = new HashMap<>();
        final Map<Integer, Loop> loopsByLatch = new HashMap<>();
        final Set<Integer> labelled = new HashSet<>();
        final Set<Varnode> inlined = new HashSet<>();
        final Set<Varnode> params;

        // first pass: which temporaries are read by what
        boolean collecting;
        final Set<Varnode> rootRefs = new HashSet<>();
        final Map<Varnode, Set<Varnode>> tempRefs = new HashMap<>();
        final Set<Varnode> neededTemps = new HashSet<>();
        Set<Varnode> collector = rootRefs;

        final Set<Varnode> declared = new TreeSet<>();
        final Deque<Integer> breakables = new ArrayDeque<>();
        StringBuilder sb = new StringBuilder();
        int depth;

        Printer(Function func, StructNode root) {
            this.func = func;
            this.root = root;
            types = func.getExtOrThrow(CommonExts.TYPE_MAP);
            du = func.getExtOrThrow(CommonExts.DEF_USE);
            registers = func.getNullable(CommonExts.REGISTER_MODEL);
            List<String> ops = func.getNullable(CommonExts.USER_OPS);
            userOps = ops == null ? Collections.emptyList() : ops;
            params = new LinkedHashSet<>(types.getParameters());
            for (Loop loop : func.getExtOrThrow(CommonExts.LOOPS)) {
                loopsByHeader.put(loop.getHeader(), loop);
                for (int latch : loop.getLatches()) {
                    loopsByLatch.put(latch, loop);
                }
            }
            for (StructNode node : root.flatten()) {
                if (node.getKind() == StructNode.Kind.GOTO) labelled.add(node.getBlock());
            }
            for (BasicBlock block : func.blocks) {
                for (PcodeOp op : block.getOps()) {
                    Varnode out = op.getOutput();
                    if (out != null && shouldInline(op, out)) inlined.add(out);
                }
            }
        }

        boolean isFlag(Varnode vn) {
            return registers != null && registers.isFlag(vn);
        }

        boolean shouldInline(PcodeOp def, Varnode out) {
            if (def.isPhi() || def.opcode == OpCode.INDIRECT) return false;
            boolean temp = out.space == Space.UNIQUE;
            if (!temp && !isFlag(out)) return false;
            if (def.opcode == OpCode.LOAD) {
                return temp && du.useCount(out) == 1 && noEffectsBetween(def, du.usesOf(out).get(0));
            }
            if (!def.opcode.isPure()) return false;
            if (!temp || du.useCount(out) <= 1) return true;
            switch (def.opcode) {
                case COPY:
                case CAST:
                case SUBPIECE:
                case INT_ZEXT:
                case INT_SEXT:
                    return true;
                default:
                    return false;
            }
        }

        boolean noEffectsBetween(PcodeOp def, PcodeOp use) {
            BasicBlock block = def.getNullable(CommonExts.OWNING_BLOCK);
            if (block == null || block != use.getNullable(CommonExts.OWNING_BLOCK)) return false;
            List<PcodeOp> ops = block.getOps();
            for (int i = ops.indexOf(def) + 1; i < ops.indexOf(use); i++) {
                PcodeOp op = ops.get(i);
                if (op.opcode == OpCode.STORE || op.opcode.isCall()) return false;
            }
            return true;
        }

        String print() {
            collecting = true;
            body();
            Deque<Varnode> work = new ArrayDeque<>(rootRefs);
            while (!work.isEmpty()) {
                Varnode vn = work.pop();
                if (vn.space != Space.UNIQUE || !neededTemps.add(vn)) continue;
                work.addAll(tempRefs.getOrDefault(vn, Collections.emptySet()));
            }

            collecting = false;
            declared.clear();
            String body = body();

            StringBuilder out = new StringBuilder();
            out.append(typeName(types.getReturnType(), 0)).append(' ').append(func.getName()).append('(');
            if (params.isEmpty()) {
                out.append("void");
            } else {
                boolean first = true;
                for (Varnode param : params) {
                    if (!first) out.append(", ");
                    first = false;
                    out.append(typeOf(param)).append(' ').append(name(param));
                }
            }
            out.append(")\n{\n");
            boolean any = false;
            for (Varnode vn : declared) {
                // entry values are inputs rather than locals
                if (params.contains(vn) || vn.version == 0) continue;
                out.append(INDENT).append(typeOf(vn)).append(' ').append(name(vn)).append(";\n");
                any = true;
            }
            if (any) out.append('\n');
            out.append(body);
            out.append("}\n");
            return out.toString();
        }

        String body() {
            sb = new StringBuilder();
            depth = 1;
            breakables.clear();
            node(root);
            return sb.toString();
        }

        void line(String text) {
            for (int i = 0; i < depth; i++) {
                sb.append(INDENT);
            }
            sb.append(text).append('\n');
        }

        String labelOf(int block) {
            return String.format("LAB_%08x", func.block(block).getStartAddress());
        }

        void label(int block) {
            if (labelled.contains(block)) {
                sb.append(labelOf(block)).append(":\n");
            }
        }

        void node(StructNode node) {
            int block = node.getBlock();
            switch (node.getKind()) {
                case SEQUENCE:
                    for (StructNode child : node.getChildren()) {
                        node(child);
                    }
                    break;
                case BLOCK:
                    label(block);
                    statements(block, false);
                    break;
                case IF_THEN:
                case IF_THEN_ELSE:
                    label(block);
                    statements(block, false);
                    line("if (" + condition(block, node.isNegated()) + ") {");
                    nested(node.getChild(0));
                    if (node.getKind() == StructNode.Kind.IF_THEN_ELSE) {
                        line("} else {");
                        nested(node.getChild(1));
                    }
                    line("}");
                    break;
                case WHILE: {
                    label(block);
                    breakables.push(followOf(loopsByHeader.get(block)));
                    int mark = sb.length();
                    if (statements(block, false)) {
                        sb.setLength(mark);
                        line("while (true) {");
                        depth++;
                        statements(block, false);
                        line("if (" + condition(block, !node.isNegated()) + ") break;");
                        depth--;
                    } else {
                        line("while (" + condition(block, node.isNegated()) + ") {");
                    }
                    nested(node.getChild(0));
                    line("}");
                    breakables.pop();
                    break;
                }
                case DO_WHILE:
                    breakables.push(followOf(loopsByLatch.get(block)));
                    line("do {");
                    nested(node.getChild(0));
                    depth++;
                    label(block);
                    statements(block, false);
                    depth--;
                    line("} while (" + condition(block, node.isNegated()) + ");");
                    breakables.pop();
                    break;
                case INFINITE_LOOP:
                    breakables.push(followOf(loopsByHeader.get(block)));
                    line("while (true) {");
                    nested(node.getChild(0));
                    line("}");
                    breakables.pop();
                    break;
                case SWITCH:
                    label(block);
                    statements(block, true);
                    line("switch (" + expr(Objects.requireNonNull(node.getSwitchValue())) + ") {");
                    breakables.push(SWITCH_MARKER);
                    for (StructNode.Case c : node.getCases()) {
                        if (c.isDefault()) {
                            line("default:");
                        } else {
                            for (long value : c.getValues()) {
                                line("case " + literal(value) + ":");
                            }
                        }
                        nested(c.getBody());
                        List<StructNode> children = c.getBody().getChildren();
                        StructNode.Kind last = children.isEmpty() ? null : children.get(children.size() - 1).getKind();
                        if (last != StructNode.Kind.GOTO && last != StructNode.Kind.BREAK && last != StructNode.Kind.CONTINUE) {
                            depth++;
                            line("break;");
                            depth--;
                        }
                    }
                    breakables.pop();
                    line("}");
                    break;
                case BREAK:
                    breakStatement();
                    break;
                case CONTINUE:
                    line("continue;");
                    break;
                case GOTO:
                    line("goto " + labelOf(block) + ";");
                    break;
                default:
                    throw new IllegalStateException(String.format("unknown structure kind %s", node.getKind()));
            }
        }

        void nested(StructNode node) {
            depth++;
            node(node);
            depth--;
        }

        int followOf(@Nullable Loop loop) {
            return loop == null ? -1 : loop.getFollow();
        }

        void breakStatement() {
            if (breakables.isEmpty() || breakables.peek() != SWITCH_MARKER) {
                line("break;");
                return;
            }
            // a break inside a switch would leave the switch, not the loop
            for (int follow : breakables) {
                if (follow == SWITCH_MARKER) continue;
                if (follow >= 0) {
                    labelled.add(follow);
                    line("goto " + labelOf(follow) + ";");
                    return;
                }
                break;
            }
            line("break;");
        }

        boolean statements(int id, boolean switchOwner) {
            boolean any = false;
            for (PcodeOp op : func.block(id).getOps()) {
                Varnode out = op.getOutput();
                if (collecting) {
                    collector = out != null && out.space == Space.UNIQUE
                            ? tempRefs.computeIfAbsent(out, $ -> new HashSet<>())
                            : rootRefs;
                }
                String text = statement(op, switchOwner);
                collector = rootRefs;
                if (text != null) {
                    line(text);
                    any |= !op.isPhi();
                }
            }
            return any;
        }

        boolean isVisible(Varnode out) {
            if (inlined.contains(out)) return false;
            if (out.space == Space.UNIQUE) {
                return du.useCount(out) != 0 && (collecting || neededTemps.contains(out));
            }
            return !isFlag(out) || du.useCount(out) != 0;
        }

        @Nullable String statement(PcodeOp op, boolean switchOwner) {
            Varnode out = op.getOutput();
            switch (op.opcode) {
                case MULTIEQUAL: {
                    StringJoiner inputs = new StringJoiner(", ", "phi(", ")");
                    for (Varnode input : op.getInputs()) {
                        inputs.add(name(input));
                    }
                    return "// " + assign(out) + inputs + ";";
                }
                case INDIRECT:
                case BRANCH:
                case CBRANCH:
                    return null;
                case BRANCHIND:
                    return switchOwner ? null : "goto *" + atom(op.getInput(0)) + ";";
                case RETURN:
                    return returnStatement(op);
                case STORE: {
                    Varnode value = op.getInput(1);
                    return "*(" + typeOf(value) + " *)" + atom(op.getInput(0)) + " = " + expr(value) + ";";
                }
                case CALL:
                    return assign(out) + String.format("func_%x()", op.getTargetAddress()) + ";";
                case CALLIND:
                    return assign(out) + "(*" + atom(op.getInput(0)) + ")();";
                case CALLOTHER: {
                    int index = (int) op.getInput(0).offset;
                    String name = index < userOps.size() ? userOps.get(index) : "callother_" + index;
                    StringJoiner args = new StringJoiner(", ", name + "(", ")");
                    for (int i = 1; i < op.numInputs(); i++) {
                        args.add(expr(op.getInput(i)));
                    }
                    return assign(out) + args + ";";
                }
                default:
                    if (out == null || !isVisible(out)) return null;
                    return assign(out) + opExpr(op) + ";";
            }
        }

        // declares the output, so only for statements that are printed
        String assign(@Nullable Varnode out) {
            return out == null ? "" : name(out) + " = ";
        }

        String returnStatement(PcodeOp op) {
            Varnode ret = types.getReturnRegister();
            if (ret == null || types.getReturnType().getKind() == Type.Kind.VOID) return "return;";
            Map<Varnode, Varnode> reaching = op.getNullable(CommonExts.REACHING_AT_RETURN);
            Varnode value = reaching == null ? null : reaching.get(ret.unversioned());
            return "return " + expr(value == null ? ret.unversioned() : value) + ";";
        }

        String name(Varnode vn) {
            if (vn.isConstant()) return literal(vn.signedValue());
            if (collecting) {
                collector.add(vn);
            } else if (vn.space != Space.RAM) {
                declared.add(vn);
            }
            String base = registers == null ? vn.unversioned().toString() : registers.nameOf(vn);
            return vn.version == 0 ? base : base + "_" + vn.version;
        }

        String literal(long value) {
            if (value > -10 && value < 10) return Long.toString(value);
            if (value < 0 && value != Long.MIN_VALUE) return String.format("-0x%x", -value);
            return String.format("0x%x", value);
        }

        String typeName(Type type, int size) {
            if (type.isUnknown()) return "undefined" + size;
            return type.toCString();
        }

        String typeOf(Varnode vn) {
            Type type = vn.isConstant() ? Type.genericInt(vn.size * 8) : types.get(vn);
            return typeName(type, vn.size);
        }

        @Nullable PcodeOp inlinedDef(Varnode vn) {
            return inlined.contains(vn) ? du.defOf(vn) : null;
        }

        String expr(Varnode vn) {
            PcodeOp def = inlinedDef(vn);
            return def == null ? name(vn) : opExpr(def);
        }

        String atom(Varnode vn) {
            PcodeOp def = inlinedDef(vn);
            if (def == null) return name(vn);
            String text = opExpr(def);
            return infix(def) == null && compare(def, false) == null ? text : "(" + text + ")";
        }

        String condition(int block, boolean negated) {
            PcodeOp branch = Objects.requireNonNull(func.block(block).getTerminator());
            return condExpr(branch.getInput(1), negated);
        }

        String condExpr(Varnode vn, boolean negated) {
            if (!negated) return expr(vn);
            PcodeOp def = inlinedDef(vn);
            if (def != null) {
                String cmp = compare(def, true);
                if (cmp != null) return cmp;
                if (def.opcode == OpCode.BOOL_NEGATE) return expr(def.getInput(0));
            }
            return "!" + atom(vn);
        }

        @Nullable PcodeOp defOf(Varnode vn) {
            return vn.isConstant() ? null : du.defOf(vn);
        }

        // x == y and x < y as computed from the flags of x - y
        @Nullable String compare(PcodeOp op, boolean negated) {
            String operator;
            switch (op.opcode) {
                case INT_EQUAL:
                case FLOAT_EQUAL:
                    operator = negated ? "!=" : "==";
                    break;
                case INT_NOTEQUAL:
                case FLOAT_NOTEQUAL:
                    operator = negated ? "==" : "!=";
                    break;
                case INT_LESS:
                case INT_SLESS:
                case FLOAT_LESS:
                    operator = negated ? ">=" : "<";
                    break;
                case INT_LESSEQUAL:
                case INT_SLESSEQUAL:
                case FLOAT_LESSEQUAL:
                    operator = negated ? ">" : "<=";
                    break;
                default:
                    return null;
            }
            Varnode a = op.getInput(0);
            Varnode b = op.getInput(1);
            if (op.opcode == OpCode.INT_EQUAL || op.opcode == OpCode.INT_NOTEQUAL) {
                PcodeOp sub = defOf(a);
                if (b.isConstant() && b.offset == 0 && a.space == Space.UNIQUE
                        && sub != null && sub.opcode == OpCode.INT_SUB) {
                    return atom(sub.getInput(0)) + " " + operator + " " + atom(sub.getInput(1));
                }
                Varnode[] operands = signedLess(a, b);
                if (operands != null) {
                    boolean less = op.opcode == OpCode.INT_NOTEQUAL ^ negated;
                    return atom(operands[0]) + (less ? " < " : " >= ") + atom(operands[1]);
                }
            }
            return atom(a) + " " + operator + " " + atom(b);
        }

        // SF != OF after a - b is a < b
        @Nullable Varnode[] signedLess(Varnode x, Varnode y) {
            PcodeOp sf = defOf(x);
            PcodeOp of = defOf(y);
            if (sf == null || of == null) return null;
            if (sf.opcode == OpCode.INT_SBORROW) {
                PcodeOp tmp = sf;
                sf = of;
                of = tmp;
            }
            if (sf.opcode != OpCode.INT_SLESS || of.opcode != OpCode.INT_SBORROW) return null;
            Varnode zero = sf.getInput(1);
            if (!zero.isConstant() || zero.offset != 0) return null;
            PcodeOp sub = defOf(sf.getInput(0));
            if (sub == null || sub.opcode != OpCode.INT_SUB
                    || !sub.getInput(0).equals(of.getInput(0))
                    || !sub.getInput(1).equals(of.getInput(1))) {
                return null;
            }
            return new Varnode[]{of.getInput(0), of.getInput(1)};
        }

        @Nullable String infix(PcodeOp op) {
            switch (op.opcode) {
                case INT_ADD:
                case FLOAT_ADD:
                case PTRSUB:
                    return "+";
                case INT_SUB:
                case FLOAT_SUB:
                    return "-";
                case INT_MULT:
                case FLOAT_MULT:
                    return "*";
                case INT_DIV:
                case INT_SDIV:
                case FLOAT_DIV:
                    return "/";
                case INT_REM:
                case INT_SREM:
                    return "%";
                case INT_AND:
                    return "&";
                case INT_OR:
                    return "|";
                case INT_XOR:
                case BOOL_XOR:
                    return "^";
                case INT_LEFT:
                    return "<<";
                case INT_RIGHT:
                case INT_SRIGHT:
                    return ">>";
                case BOOL_AND:
                    return "&&";
                case BOOL_OR:
                    return "||";
                default:
                    return null;
            }
        }

        String opExpr(PcodeOp op) {
            String cmp = compare(op, false);
            if (cmp != null) return cmp;
            String operator = infix(op);
            if (operator != null) {
                Varnode b = op.getInput(1);
                if (op.opcode == OpCode.INT_ADD && b.isConstant() && b.signedValue() < 0 && b.signedValue() != Long.MIN_VALUE) {
                    return atom(op.getInput(0)) + " - " + literal(-b.signedValue());
                }
                return atom(op.getInput(0)) + " " + operator + " " + atom(b);
            }
            Varnode out = op.getOutput();
            switch (op.opcode) {
                case COPY:
                    return expr(op.getInput(0));
                case LOAD: {
                    Varnode addr = op.getInput(0);
                    Type pointer = types.get(addr);
                    Type target = types.get(Objects.requireNonNull(out));
                    if (pointer.getKind() == Type.Kind.POINTER && target.equals(pointer.getInner())) {
                        return "*" + atom(addr);
                    }
                    return "*(" + typeOf(out) + " *)" + atom(addr);
                }
                case INT_2COMP:
                case FLOAT_NEG:
                    return "-" + atom(op.getInput(0));
                case INT_NEGATE:
                    return "~" + atom(op.getInput(0));
                case BOOL_NEGATE:
                    return condExpr(op.getInput(0), true);
                case INT_ZEXT:
                case INT_SEXT:
                case CAST:
                case FLOAT_INT2FLOAT:
                case FLOAT_FLOAT2FLOAT:
                case FLOAT_TRUNC:
                    return "(" + typeOf(Objects.requireNonNull(out)) + ")" + atom(op.getInput(0));
                case SUBPIECE: {
                    long shift = op.getInput(1).offset * 8;
                    String cast = "(" + typeOf(Objects.requireNonNull(out)) + ")";
                    return shift == 0
                            ? cast + atom(op.getInput(0))
                            : cast + "(" + atom(op.getInput(0)) + " >> " + shift + ")";
                }
                case PTRADD:
                    return atom(op.getInput(0)) + " + " + atom(op.getInput(1)) + " * " + atom(op.getInput(2));
                default: {
                    StringJoiner args = new StringJoiner(", ", op.opcode.name() + "(", ")");
                    for (Varnode input : op.getInputs()) {
                        args.add(expr(input));
                    }
                    return args.toString();
                }
            }
        }
    }
}
