package org.snrasm.compiler.ir;

import java.util.List;

/**
 * The elements of a list operand (number lists, register lists, bitmasks, tables, string arrays).
 */
public record IrList(List<IrOperand> elements) implements IrOperand {
    public IrList {
        elements = List.copyOf(elements);
    }
}
