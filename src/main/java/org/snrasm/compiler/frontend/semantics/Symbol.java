package org.snrasm.compiler.frontend.semantics;

import org.snrasm.compiler.diagnostics.Span;

/**
 * Represents a single symbol in the symbol table.
 *
 * @param name  The name as written in source. Register aliases keep their {@code $}.
 * @param type  The type of the symbol.
 * @param span  The span of the defining name.
 * @param owner The name of the owning scope.
 */
public record Symbol(String name, Type type, Span span, String owner) {

    /** The owner of symbols defined at file level. */
    public static final String GLOBAL = "<global>";

    /**
     * The type of a symbol.
     */
    public enum Type {
        LABEL,
        FUNCTION,
        SUBROUTINE,
        JUMP_TABLE_ENTRY,
        CONSTANT,
        REGISTER_ALIAS;

        /**
         * @return {@code true} if the symbol names a code address.
         */
        public boolean isCodeAddress() {
            return this == LABEL || this == FUNCTION || this == SUBROUTINE;
        }

        public String describe() {
            return name().toLowerCase().replace('_', ' ');
        }
    }

    /**
     * A key that identifies the symbol across independent analysis runs.
     * Relocations and layout tables use it instead of object identity.
     * @return {@code owner::name}.
     */
    public String qualifiedName() {
        return owner + "::" + name;
    }

    public boolean isGlobal() {
        return GLOBAL.equals(owner);
    }
}
