package org.snrasm.compiler.isa;

/**
 * One encoded field of an instruction. Positional fields take the next source argument;
 * flag fields are booleans driven by an {@link InstructionFlag}.
 *
 * @param kind         The encoding kind.
 * @param flag         The driving flag, or {@code null} for positional fields.
 * @param inverted     Whether the boolean is written as the negation of the flag.
 * @param defaultValue The value used when the argument is omitted, or {@code null} if required.
 */
public record Field(OperandKind kind, InstructionFlag flag, boolean inverted, Integer defaultValue) {

    public static Field of(OperandKind kind) {
        return new Field(kind, null, false, null);
    }

    public static Field optional(OperandKind kind, int defaultValue) {
        return new Field(kind, null, false, defaultValue);
    }

    public static Field flag(InstructionFlag flag, boolean inverted) {
        return new Field(OperandKind.BOOL, flag, inverted, null);
    }

    public boolean isPositional() {
        return flag == null;
    }
}
