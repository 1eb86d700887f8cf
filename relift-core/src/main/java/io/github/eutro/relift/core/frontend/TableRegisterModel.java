package io.github.eutro.relift.core.frontend;

import io.github.eutro.relift.core.ir.Space;
import io.github.eutro.relift.core.ir.Varnode;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A {@link RegisterModel} backed by a table of named registers, built with a {@link Builder}.
 */
public class TableRegisterModel implements RegisterModel {
    private final Map<String, Varnode> byName;
    private final Map<Varnode, String> names;
    private final List<Varnode> containers;
    private final Set<Varnode> flags;
    private final int pointerSize;
    private final Varnode stackPointer;
    private final List<Varnode> argumentRegisters;
    private final @Nullable Varnode returnRegister;

    private TableRegisterModel(Builder builder) {
        byName = new HashMap<>(builder.byName);
        names = new HashMap<>();
        for (Map.Entry<String, Varnode> entry : builder.byName.entrySet()) {
            names.putIfAbsent(entry.getValue(), entry.getKey());
        }
        containers = new ArrayList<>();
        for (Varnode vn : byName.values()) {
            boolean contained = false;
            for (Varnode other : byName.values()) {
                if (other.size > vn.size && other.contains(vn)) {
                    contained = true;
                    break;
                }
            }
            if (!contained && !containers.contains(vn)) containers.add(vn);
        }
        flags = new HashSet<>(builder.flags);
        pointerSize = builder.pointerSize;
        stackPointer = Objects.requireNonNull(builder.stackPointer, "stack pointer");
        argumentRegisters = Collections.unmodifiableList(new ArrayList<>(builder.argumentRegisters));
        returnRegister = builder.returnRegister;
    }

    public static Builder builder(int pointerSize) {
        return new Builder(pointerSize);
    }

    @Override
    public @Nullable Varnode resolve(String name) {
        return byName.get(name);
    }

    @Override
    public Varnode container(Varnode view) {
        Varnode vn = view.unversioned();
        for (Varnode c : containers) {
            if (c.contains(vn)) return c;
        }
        return vn;
    }

    @Override
    public String nameOf(Varnode vn) {
        Varnode loc = vn.unversioned();
        String name = names.get(loc);
        if (name != null) return name;
        switch (loc.space) {
            case REGISTER: {
                Varnode c = container(loc);
                String cName = names.get(c);
                if (cName != null) {
                    return String.format("%s_%d_%d", cName, loc.offset - c.offset, loc.size);
                }
                return String.format("reg_%x_%d", loc.offset, loc.size);
            }
            case UNIQUE:
                return String.format("tmp_%x", loc.offset);
            case STACK:
                return loc.offset < 0
                        ? String.format("local_%x", -loc.offset)
                        : String.format("param_%x", loc.offset);
            case RAM:
                return String.format("DAT_%08x", loc.offset);
            case CONST:
            default:
                return String.format("0x%x", loc.offset);
        }
    }

    @Override
    public int pointerSize() {
        return pointerSize;
    }

    @Override
    public Varnode stackPointer() {
        return stackPointer;
    }

    @Override
    public List<Varnode> argumentRegisters() {
        return argumentRegisters;
    }

    @Override
    public @Nullable Varnode returnRegister() {
        return returnRegister;
    }

    @Override
    public boolean isFlag(Varnode vn) {
        return vn.space == Space.REGISTER && flags.contains(vn.unversioned());
    }

    /**
     * A builder of {@link TableRegisterModel}s. Registers added first win when naming aliases.
     */
    public static class Builder {
        private final int pointerSize;
        private final Map<String, Varnode> byName = new LinkedHashMap<>();
        private final Set<Varnode> flags = new LinkedHashSet<>();
        private Varnode stackPointer;
        private final List<Varnode> argumentRegisters = new ArrayList<>();
        private @Nullable Varnode returnRegister;

        Builder(int pointerSize) {
            this.pointerSize = pointerSize;
        }

        public Builder register(String name, long offset, int size) {
            byName.put(name, Varnode.register(offset, size));
            return this;
        }

        public Builder flag(String name, long offset) {
            register(name, offset, 1);
            flags.add(Varnode.register(offset, 1));
            return this;
        }

        private Varnode named(String name) {
            Varnode vn = byName.get(name);
            if (vn == null) {
                throw new IllegalArgumentException(String.format("no register named %s", name));
            }
            return vn;
        }

        public Builder stackPointer(String name) {
            stackPointer = named(name);
            return this;
        }

        public Builder arguments(String... names) {
            for (String name : names) {
                argumentRegisters.add(named(name));
            }
            return this;
        }

        public Builder returnRegister(String name) {
            returnRegister = named(name);
            return this;
        }

        public TableRegisterModel build() {
            return new TableRegisterModel(this);
        }
    }
}
