package io.github.eutro.relift.core.passes.meta;

import io.github.eutro.relift.core.diag.Diagnostic;
import io.github.eutro.relift.core.ext.CommonExts;
import io.github.eutro.relift.core.ext.MetadataState;
import io.github.eutro.relift.core.frontend.RegisterModel;
import io.github.eutro.relift.core.ir.*;
import io.github.eutro.relift.core.passes.InPlaceIRPass;
import io.github.eutro.relift.core.types.Type;
import io.github.eutro.relift.core.types.TypeConstraint;
import io.github.eutro.relift.core.types.TypeMap;
import io.github.eutro.relift.core.types.Types;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Infers the {@link CommonExts#TYPE_MAP} of a function in SSA form.
 * <p>
 * Each op constrains the types of its operands. The constraints on each value are
 * {@link Types#refine(Type, Type) refined} together, then types are propagated along copies, memory accesses,
 * pointer arithmetic and phis until nothing changes. A value whose constraints conflict is typed
 * {@link Type#UNKNOWN} and reported as {@link Diagnostic.Kind#TYPE_CONFLICT}; a value nothing constrains is
 * a generic integer of its width. Constants are not typed.
 * <p>
 * An instance may be given the types of an earlier run to start from. Seeded types are only ever refined,
 * except that a seeded signedness gives way to unspecified when the value is also used with the opposite one,
 * and a seeded type is kept rather than replaced by unknown on a conflict.
 */
public class InferTypes implements InPlaceIRPass<Function> {
    private static final Logger logger = LogManager.getLogger(InferTypes.class);

    /**
     * An instance with no seed and no extra constraints.
     */
    public static final InferTypes INSTANCE = new InferTypes(null, Collections.emptyList());

    private static final int MAX_ITERATIONS = 32;

    private final @Nullable TypeMap seed;
    private final List<TypeConstraint> extra;

    /**
     * @param seed  Types to start from, or null.
     * @param extra Constraints to impose in addition to those of the ops.
     */
    public InferTypes(@Nullable TypeMap seed, List<TypeConstraint> extra) {
        this.seed = seed;
        this.extra = new ArrayList<>(extra);
    }

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.SSA_FORM, MetadataState.USES);
        DefUse du = func.getExtOrThrow(CommonExts.DEF_USE);

        Solver solver = new Solver();
        if (seed != null) {
            for (Map.Entry<Varnode, Type> entry : seed.asMap().entrySet()) {
                solver.constrain(entry.getKey(), entry.getValue());
            }
        }
        for (BasicBlock block : func.blocks) {
            for (PcodeOp op : block.getOps()) {
                solver.collect(op);
            }
        }
        for (TypeConstraint constraint : extra) {
            solver.constrain(constraint.getValue(), constraint.getType());
        }

        int iterations = 0;
        boolean changed = true;
        while (changed && iterations < MAX_ITERATIONS) {
            iterations++;
            solver.changed = false;
            for (BasicBlock block : func.blocks) {
                for (PcodeOp op : block.getOps()) {
                    solver.propagate(op);
                }
            }
            changed = solver.changed;
        }
        if (changed) {
            logger.debug("type propagation in {} stopped after {} iterations", func.getName(), iterations);
        }

        TypeMap map = new TypeMap();
        for (Varnode value : du.values()) {
            Type type = solver.types.get(value);
            if (solver.conflicts.contains(value)) {
                PcodeOp at = du.defOf(value);
                if (at == null) at = du.usesOf(value).get(0);
                func.getDiagnostics().report(Diagnostic.Kind.TYPE_CONFLICT, at.address,
                        "conflicting types for %s", value);
                Type seeded = seed == null ? null : seed.get(value);
                type = seeded == null || seeded.isUnknown() ? Type.UNKNOWN : seeded;
            } else if (type == null || type.isUnknown()) {
                type = Type.genericInt(value.size * 8);
            }
            map.put(value, type);
        }
        computeSignature(func, du, map);

        func.attachExt(CommonExts.TYPE_MAP, map);
        ms.validate(MetadataState.TYPES_INFERRED);
    }

    private static void computeSignature(Function func, DefUse du, TypeMap map) {
        RegisterModel registers = func.getNullable(CommonExts.REGISTER_MODEL);
        if (registers == null) return;

        // arguments are passed in order, so reading one implies those before it
        List<Varnode> args = registers.argumentRegisters();
        int used = 0;
        for (int i = 0; i < args.size(); i++) {
            if (!du.isUnused(args.get(i))) used = i + 1;
        }
        List<Varnode> params = args.subList(0, used);
        for (Varnode param : params) {
            // an unread parameter before a read one is still passed
            if (!map.contains(param)) map.put(param, Type.genericInt(param.size * 8));
        }
        map.setParameters(params);

        Varnode ret = registers.returnRegister();
        if (ret == null) return;
        List<Type> returned = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            for (PcodeOp op : block.getOps()) {
                Map<Varnode, Varnode> reaching = op.getNullable(CommonExts.REACHING_AT_RETURN);
                if (reaching == null) continue;
                Varnode value = reaching.get(ret);
                if (value != null) returned.add(map.get(value));
            }
        }
        if (!returned.isEmpty()) {
            Type joined = Types.join(returned);
            map.setReturn(ret, joined.isUnknown() ? Type.genericInt(ret.size * 8) : joined);
        }
    }

    private static class Solver {
        final Map<Varnode, Type> types = new HashMap<>();
        final Set<Varnode> conflicts = new HashSet<>();
        // used both as signed and as unsigned, so later constraints cannot pick a side
        final Set<Varnode> mixedSign = new HashSet<>();
        boolean changed;

        Type typeOf(Varnode vn) {
            return types.getOrDefault(vn, Type.UNKNOWN);
        }

        void constrain(Varnode vn, Type type) {
            if (vn.isConstant() || conflicts.contains(vn)) return;
            Type old = typeOf(vn);
            Type refined = Types.refine(old, type);
            if (refined == null) {
                conflicts.add(vn);
                changed = true;
                return;
            }
            if (refined.getKind() == Type.Kind.INT && (mixedSign.contains(vn) || signsClash(old, type))) {
                mixedSign.add(vn);
                refined = Type.genericInt(refined.getBits());
            }
            if (!refined.equals(old)) {
                types.put(vn, refined);
                changed = true;
            }
        }

        static boolean signsClash(Type a, Type b) {
            return a.getKind() == Type.Kind.INT && b.getKind() == Type.Kind.INT
                    && a.getSignedness() != Type.Signedness.UNSPECIFIED
                    && b.getSignedness() != Type.Signedness.UNSPECIFIED
                    && a.getSignedness() != b.getSignedness();
        }

        void integer(Varnode vn, Type.Signedness signedness) {
            constrain(vn, Type.intOf(vn.size * 8, signedness));
        }

        void pointer(Varnode vn, Type target) {
            if (vn.size == Type.POINTER_SIZE) constrain(vn, Type.pointerTo(target));
        }

        void collect(PcodeOp op) {
            Varnode out = op.getOutput();
            List<Varnode> in = op.getInputs();
            switch (op.opcode) {
                case INT_ADD:
                case INT_SUB:
                case INT_MULT:
                case INT_2COMP:
                case INT_NEGATE:
                case INT_AND:
                case INT_OR:
                case INT_XOR:
                case INT_LEFT:
                case PIECE:
                case SUBPIECE:
                case POPCOUNT:
                case LZCOUNT:
                case INSERT:
                case EXTRACT:
                    integer(Objects.requireNonNull(out), Type.Signedness.UNSPECIFIED);
                    for (Varnode input : in) integer(input, Type.Signedness.UNSPECIFIED);
                    break;
                case INT_DIV:
                case INT_REM:
                case INT_RIGHT:
                    integer(Objects.requireNonNull(out), Type.Signedness.UNSIGNED);
                    integer(in.get(0), Type.Signedness.UNSIGNED);
                    break;
                case INT_SDIV:
                case INT_SREM:
                case INT_SRIGHT:
                    integer(Objects.requireNonNull(out), Type.Signedness.SIGNED);
                    integer(in.get(0), Type.Signedness.SIGNED);
                    break;
                case INT_EQUAL:
                case INT_NOTEQUAL:
                    constrain(Objects.requireNonNull(out), Type.BOOL);
                    break;
                case INT_LESS:
                case INT_LESSEQUAL:
                case INT_CARRY:
                    constrain(Objects.requireNonNull(out), Type.BOOL);
                    for (Varnode input : in) integer(input, Type.Signedness.UNSIGNED);
                    break;
                case INT_SLESS:
                case INT_SLESSEQUAL:
                case INT_SCARRY:
                case INT_SBORROW:
                    constrain(Objects.requireNonNull(out), Type.BOOL);
                    for (Varnode input : in) integer(input, Type.Signedness.SIGNED);
                    break;
                case INT_ZEXT:
                    integer(Objects.requireNonNull(out), Type.Signedness.UNSIGNED);
                    integer(in.get(0), Type.Signedness.UNSIGNED);
                    break;
                case INT_SEXT:
                    integer(Objects.requireNonNull(out), Type.Signedness.SIGNED);
                    integer(in.get(0), Type.Signedness.SIGNED);
                    break;
                case BOOL_NEGATE:
                case BOOL_AND:
                case BOOL_OR:
                case BOOL_XOR:
                    constrain(Objects.requireNonNull(out), Type.BOOL);
                    for (Varnode input : in) constrain(input, Type.BOOL);
                    break;
                case FLOAT_ADD:
                case FLOAT_SUB:
                case FLOAT_MULT:
                case FLOAT_DIV:
                case FLOAT_NEG:
                case FLOAT_ABS:
                case FLOAT_SQRT:
                case FLOAT_CEIL:
                case FLOAT_FLOOR:
                case FLOAT_ROUND:
                case FLOAT_FLOAT2FLOAT:
                    constrain(Objects.requireNonNull(out), Type.floatOf(out.size * 8));
                    for (Varnode input : in) constrain(input, Type.floatOf(input.size * 8));
                    break;
                case FLOAT_EQUAL:
                case FLOAT_NOTEQUAL:
                case FLOAT_LESS:
                case FLOAT_LESSEQUAL:
                case FLOAT_NAN:
                    constrain(Objects.requireNonNull(out), Type.BOOL);
                    for (Varnode input : in) constrain(input, Type.floatOf(input.size * 8));
                    break;
                case FLOAT_INT2FLOAT:
                    constrain(Objects.requireNonNull(out), Type.floatOf(out.size * 8));
                    integer(in.get(0), Type.Signedness.SIGNED);
                    break;
                case FLOAT_TRUNC:
                    integer(Objects.requireNonNull(out), Type.Signedness.SIGNED);
                    constrain(in.get(0), Type.floatOf(in.get(0).size * 8));
                    break;
                case LOAD:
                case STORE:
                    pointer(in.get(0), Type.UNKNOWN);
                    break;
                case CBRANCH:
                    constrain(in.get(1), Type.BOOL);
                    break;
                case BRANCHIND:
                case CALLIND:
                    pointer(in.get(0), Type.VOID);
                    break;
                default:
                    break;
            }
        }

        void unify(Varnode a, Varnode b) {
            if (a.isConstant() || b.isConstant()) return;
            Type ta = typeOf(a);
            Type tb = typeOf(b);
            if (ta.equals(tb)) return;
            constrain(a, tb);
            constrain(b, ta);
        }

        void propagate(PcodeOp op) {
            Varnode out = op.getOutput();
            switch (op.opcode) {
                case COPY:
                case CAST:
                case INDIRECT:
                    unify(Objects.requireNonNull(out), op.getInput(0));
                    break;
                case MULTIEQUAL: {
                    List<Type> inputs = new ArrayList<>();
                    for (Varnode input : op.getInputs()) {
                        inputs.add(typeOf(input));
                    }
                    Type joined = Types.join(inputs);
                    if (!joined.isUnknown()) constrain(Objects.requireNonNull(out), joined);
                    break;
                }
                case LOAD:
                    memory(op.getInput(0), Objects.requireNonNull(out));
                    break;
                case STORE:
                    memory(op.getInput(0), op.getInput(1));
                    break;
                case INT_ADD:
                case INT_SUB: {
                    Varnode a = op.getInput(0);
                    Varnode b = op.getInput(1);
                    if (typeOf(a).getKind() == Type.Kind.POINTER
                            || (op.opcode == OpCode.INT_ADD && typeOf(b).getKind() == Type.Kind.POINTER)) {
                        pointer(Objects.requireNonNull(out), Type.UNKNOWN);
                    }
                    break;
                }
                default:
                    break;
            }
        }

        void memory(Varnode address, Varnode value) {
            Type ptr = typeOf(address);
            if (ptr.getKind() != Type.Kind.POINTER || value.isConstant()) return;
            Type target = Objects.requireNonNull(ptr.getInner());
            Type valueType = typeOf(value);
            Type refined = Types.refine(target, valueType);
            if (refined == null) return;
            if (!refined.equals(target)) constrain(address, Type.pointerTo(refined));
            if (!refined.equals(valueType)) constrain(value, refined);
        }
    }
}
