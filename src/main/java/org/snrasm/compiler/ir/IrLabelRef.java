package org.snrasm.compiler.ir;

/**
 * Symbolic code address, patched by the linker.
 *
 * @param targetKey   The qualified name of the target symbol.
 * @param displayName The name as written in source.
 */
public record IrLabelRef(String targetKey, String displayName) implements IrOperand {
    @Override
    public String toString() {
        return displayName;
    }
}
