package org.snrasm.compiler.frontend.semantics;

import org.snrasm.compiler.isa.Register;

import java.util.List;
import java.util.Map;

/**
 * The local view of one function or subroutine definition.
 *
 * @param symbol     The routine symbol.
 * @param scope      The function-local scope with parameters and labels.
 * @param parameters Parameter alias to argument register.
 * @param preserved  The registers saved on entry, in push order.
 */
public record RoutineScope(Symbol symbol, SymbolTable.Scope scope, Map<String, Register> parameters,
                           List<Register> preserved) {

    public RoutineScope {
        parameters = Map.copyOf(parameters);
        preserved = List.copyOf(preserved);
    }

    public boolean isSubroutine() {
        return symbol.type() == Symbol.Type.SUBROUTINE;
    }
}
