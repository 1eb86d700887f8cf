package io.github.eutro.relift.core.types;

import io.github.eutro.relift.core.ir.Varnode;

/**
 * A requirement that a value has some type, with the reason it was imposed.
 */
public final class TypeConstraint {
    private final Varnode value;
    private final Type type;
    private final String reason;

    public TypeConstraint(Varnode value, Type type, String reason) {
        this.value = value;
        this.type = type;
        this.reason = reason;
    }

    public Varnode getValue() {
        return value;
    }

    public Type getType() {
        return type;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return String.format("%s: %s (%s)", value, type, reason);
    }
}
