package org.snrasm.compiler.ir;

import org.snrasm.compiler.isa.Register;

import java.util.List;

/**
 * Small typed value system for {@link IrDirective} arguments.
 */
public sealed interface IrValue permits IrValue.Str, IrValue.Int, IrValue.Regs {

    record Str(String value) implements IrValue {}

    record Int(long value) implements IrValue {}

    record Regs(List<Register> registers) implements IrValue {
        public Regs {
            registers = List.copyOf(registers);
        }
    }
}
