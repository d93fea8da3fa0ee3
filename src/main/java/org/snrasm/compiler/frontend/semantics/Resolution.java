package org.snrasm.compiler.frontend.semantics;

import org.snrasm.compiler.isa.Register;

/**
 * What a name or register reference in an operand stands for.
 */
public sealed interface Resolution permits Resolution.CodeTarget, Resolution.Constant, Resolution.RegisterRef {

    /** A label, function or subroutine address. */
    record CodeTarget(Symbol symbol) implements Resolution {}

    /** A compile-time constant. */
    record Constant(ConstValue value) implements Resolution {}

    /** A builtin register or the register behind an alias. */
    record RegisterRef(Register register) implements Resolution {}
}
