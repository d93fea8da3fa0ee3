package org.snrasm.compiler.ir;

/**
 * A string operand, stored decoded.
 */
public record IrString(String value) implements IrOperand {}
