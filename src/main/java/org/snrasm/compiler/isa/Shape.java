package org.snrasm.compiler.isa;

/**
 * How the opcode byte is followed by the fields of an instruction.
 */
public enum Shape {
    /** Fields are written in order. */
    PLAIN,
    /** {@code uo}: type byte with bit 7 marking an explicit source, destination, optional source. */
    UNARY,
    /** {@code bo}: type byte with bit 7 marking an explicit left operand, destination, optional left, right. */
    BINARY
}
