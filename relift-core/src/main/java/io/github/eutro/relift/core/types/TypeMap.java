package io.github.eutro.relift.core.types;

import io.github.eutro.relift.core.ir.Varnode;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The inferred type of every SSA value of a function, and its signature.
 */
public final class TypeMap {
    private final Map<Varnode, Type> types = new TreeMap<>();
    private final List<Varnode> parameters = new ArrayList<>();
    private @Nullable Varnode returnRegister;
    private Type returnType = Type.VOID;

    /**
     * Get the type of a value.
     *
     * @param value The value.
     * @return Its type, or {@link Type#UNKNOWN} if it has none.
     */
    public Type get(Varnode value) {
        return types.getOrDefault(value, Type.UNKNOWN);
    }

    public boolean contains(Varnode value) {
        return types.containsKey(value);
    }

    public void put(Varnode value, Type type) {
        types.put(value, type);
    }

    /**
     * @return Every typed value, in order.
     */
    public Map<Varnode, Type> asMap() {
        return Collections.unmodifiableMap(types);
    }

    /**
     * @return The entry values of the argument registers the function reads, in convention order.
     */
    public List<Varnode> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public void setParameters(List<Varnode> parameters) {
        this.parameters.clear();
        this.parameters.addAll(parameters);
    }

    /**
     * @return The location of the return value, or null if the function returns nothing.
     */
    public @Nullable Varnode getReturnRegister() {
        return returnRegister;
    }

    public Type getReturnType() {
        return returnType;
    }

    public void setReturn(@Nullable Varnode returnRegister, Type returnType) {
        this.returnRegister = returnRegister;
        this.returnType = returnType;
    }

    /**
     * @return The signature as a {@link Type.Kind#FUNCTION} type.
     */
    public Type getSignature() {
        List<Type> params = new ArrayList<>();
        for (Varnode parameter : parameters) {
            params.add(get(parameter));
        }
        return Type.function(returnType, params);
    }

    public TypeMap copy() {
        TypeMap copy = new TypeMap();
        copy.types.putAll(types);
        copy.parameters.addAll(parameters);
        copy.returnRegister = returnRegister;
        copy.returnType = returnType;
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getSignature()).append('\n');
        for (Map.Entry<Varnode, Type> entry : types.entrySet()) {
            sb.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }
}
