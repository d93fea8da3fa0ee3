package org.snrasm.compiler.ir;

/**
 * An absolute code address read back from a binary block.
 */
public record IrAddress(long address) implements IrOperand {
    @Override
    public String toString() {
        return String.format("0x%04x", address);
    }
}
