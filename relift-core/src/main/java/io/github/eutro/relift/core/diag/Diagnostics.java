package io.github.eutro.relift.core.diag;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.intellij.lang.annotations.PrintFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered, duplicate-free collection of {@link Diagnostic}s for one function.
 * <p>
 * Not thread-safe; each function owns its own.
 */
public final class Diagnostics implements Iterable<Diagnostic> {
    private static final Logger logger = LogManager.getLogger(Diagnostics.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Record a diagnostic, unless an equal one was already recorded.
     *
     * @param diagnostic The diagnostic.
     */
    public void add(Diagnostic diagnostic) {
        if (!diagnostics.contains(diagnostic)) {
            diagnostics.add(diagnostic);
            logger.warn("{}", diagnostic);
        }
    }

    /**
     * Record a diagnostic with a formatted message.
     *
     * @param kind    The kind.
     * @param address The address it concerns.
     * @param fmt     The message format.
     * @param args    The format arguments.
     */
    public void report(Diagnostic.Kind kind, long address, @PrintFormat String fmt, Object... args) {
        add(new Diagnostic(kind, address, String.format(fmt, args)));
    }

    public void addAll(Iterable<Diagnostic> others) {
        for (Diagnostic other : others) {
            add(other);
        }
    }

    public List<Diagnostic> ofKind(Diagnostic.Kind kind) {
        List<Diagnostic> ret = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getKind() == kind) ret.add(diagnostic);
        }
        return ret;
    }

    public boolean has(Diagnostic.Kind kind) {
        return !ofKind(kind).isEmpty();
    }

    public List<Diagnostic> asList() {
        return Collections.unmodifiableList(diagnostics);
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    @Override
    public Iterator<Diagnostic> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return diagnostics.toString();
    }
}
