package io.github.eutro.relift.core.diag;

import java.util.Objects;

/**
 * A recoverable problem found while analysing a function, reported alongside the results.
 */
public final class Diagnostic {
    /**
     * The kinds of recoverable problems.
     */
    public enum Kind {
        /**
         * The front end had no translation for a mnemonic.
         */
        UNSUPPORTED_INSTRUCTION,
        /**
         * A control-flow edge could not be resolved statically, or leaves the analysed window.
         */
        UNRESOLVED_CONTROL_FLOW,
        /**
         * A value was constrained to incompatible types.
         */
        TYPE_CONFLICT,
        /**
         * A region matched no known structure and is emitted with gotos.
         */
        UNSTRUCTURED_REGION,
    }

    private final Kind kind;
    private final long address;
    private final String message;

    public Diagnostic(Kind kind, long address, String message) {
        this.kind = Objects.requireNonNull(kind);
        this.address = address;
        this.message = Objects.requireNonNull(message);
    }

    public Kind getKind() {
        return kind;
    }

    public long getAddress() {
        return address;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return address == that.address && kind == that.kind && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, address, message);
    }

    @Override
    public String toString() {
        return String.format("%s at 0x%x: %s", kind, address, message);
    }
}
