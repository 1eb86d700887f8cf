package io.github.eutro.relift.embed;

import io.github.eutro.relift.core.frontend.Translator;
import io.github.eutro.relift.core.frontend.ref.RefTranslator;
import io.github.eutro.relift.core.frontend.x86.X86Translator;

/**
 * The instruction set families a {@link Decompiler} can lift.
 */
public enum Isa {
    /**
     * The small reference instruction set of {@link RefTranslator}.
     */
    REF {
        @Override
        public Translator newTranslator() {
            return new RefTranslator();
        }
    },
    /**
     * The integer subset of x86-64 handled by {@link X86Translator}.
     */
    X86_64 {
        @Override
        public Translator newTranslator() {
            return new X86Translator();
        }
    },
    ;

    /**
     * Create a translator for this instruction set. Translators are not shared between functions.
     *
     * @return The new translator.
     */
    public abstract Translator newTranslator();
}
