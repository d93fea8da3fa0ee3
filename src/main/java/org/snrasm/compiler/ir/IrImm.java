package org.snrasm.compiler.ir;

/**
 * A raw fixed-width immediate (u8, u16, bool or message id).
 */
public record IrImm(long value) implements IrOperand {
    @Override
    public String toString() {
        return Long.toString(value);
    }
}
