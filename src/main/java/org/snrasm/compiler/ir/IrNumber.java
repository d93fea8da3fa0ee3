package org.snrasm.compiler.ir;

import org.snrasm.compiler.isa.NumberSpec;

/**
 * A NumberSpec operand: a constant or a register read at run time.
 */
public record IrNumber(NumberSpec value) implements IrOperand {
    @Override
    public String toString() {
        return value.toString();
    }
}
