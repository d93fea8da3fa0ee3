package org.snrasm.compiler.ir;

import org.snrasm.compiler.isa.Register;

/**
 * A register written by the instruction.
 */
public record IrReg(Register register) implements IrOperand {
    @Override
    public String toString() {
        return register.toString();
    }
}
