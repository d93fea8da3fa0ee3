package org.snrasm.compiler.isa;

/**
 * A single term of an encoded RPN expression.
 *
 * @param op      The operation.
 * @param operand The pushed value for {@link TermOp#PUSH}, otherwise {@code null}.
 */
public record ExpressionTerm(TermOp op, NumberSpec operand) {

    public static ExpressionTerm push(NumberSpec value) {
        return new ExpressionTerm(TermOp.PUSH, value);
    }

    public static ExpressionTerm of(TermOp op) {
        return new ExpressionTerm(op, null);
    }

    @Override
    public String toString() {
        return op == TermOp.PUSH ? "push " + operand : op.name().toLowerCase();
    }
}
