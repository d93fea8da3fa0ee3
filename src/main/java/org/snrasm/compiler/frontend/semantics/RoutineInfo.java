package org.snrasm.compiler.frontend.semantics;

/**
 * What callers need to know about a function or subroutine.
 *
 * @param symbol         The defining symbol.
 * @param parameterCount The number of parameters; always 0 for subroutines.
 */
public record RoutineInfo(Symbol symbol, int parameterCount) {

    public String name() {
        return symbol.name();
    }

    public boolean isSubroutine() {
        return symbol.type() == Symbol.Type.SUBROUTINE;
    }
}
