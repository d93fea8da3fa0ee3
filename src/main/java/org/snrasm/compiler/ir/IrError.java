package org.snrasm.compiler.ir;

/**
 * Placeholder for an operand that failed to resolve or lower. The error has already been
 * reported; the operand encodes as zeros so later stages keep their layout.
 */
public record IrError(String reason) implements IrOperand {}
