package org.snrasm.compiler.isa;

import java.util.Optional;

/**
 * Operations of the RPN stack machine used by {@code exp}.
 * Booleans are produced as -1 (true) and 0 (false); reals are fixed point with three decimals.
 */
public enum TermOp {
    PUSH(0x00, 0),
    ADD(0x01, 2),
    SUB(0x02, 2),
    MUL(0x03, 2),
    DIV(0x04, 2),
    MOD(0x05, 2),
    SHL(0x06, 2),
    SHR(0x07, 2),
    BIT_AND(0x08, 2),
    BIT_OR(0x09, 2),
    BIT_XOR(0x0A, 2),
    NEG(0x0B, 1),
    BIT_NOT(0x0C, 1),
    ABS(0x0D, 1),
    CMP_EQ(0x0E, 2),
    CMP_NE(0x0F, 2),
    CMP_GE(0x10, 2),
    CMP_GT(0x11, 2),
    CMP_LE(0x12, 2),
    CMP_LT(0x13, 2),
    CMP_ZERO(0x14, 1),
    CMP_NOT_ZERO(0x15, 1),
    LOGICAL_AND(0x16, 2),
    LOGICAL_OR(0x17, 2),
    /** Pops the condition, then the true value, then the false value. */
    SELECT(0x18, 3),
    MUL_REAL(0x19, 2),
    DIV_REAL(0x1A, 2),
    SIN(0x1B, 1),
    COS(0x1C, 1),
    TAN(0x1D, 1),
    MIN(0x1E, 2),
    MAX(0x1F, 2);

    /** Terminates an encoded expression. */
    public static final int END_MARKER = 0xFF;

    private final int code;
    private final int arity;

    TermOp(int code, int arity) {
        this.code = code;
        this.arity = arity;
    }

    public int code() {
        return code;
    }

    /**
     * @return The number of stack values the operation consumes.
     */
    public int arity() {
        return arity;
    }

    public static Optional<TermOp> fromCode(int code) {
        for (TermOp op : values()) {
            if (op.code == code) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /**
     * Applies the operation to constant operands the way the VM does, except that
     * results outside the 32-bit range are reported instead of wrapping.
     *
     * @param args The operands in push order.
     * @return The result.
     * @throws ArithmeticException On overflow, division by zero or for operations that are never folded.
     */
    public int apply(int... args) {
        int l = args.length > 0 ? args[0] : 0;
        int r = args.length > 1 ? args[1] : 0;
        return switch (this) {
            case ADD -> exact((long) l + r);
            case SUB -> exact((long) l - r);
            case MUL -> exact((long) l * r);
            case DIV -> {
                if (r == 0) throw new ArithmeticException("Division by zero");
                yield exact((long) l / r);
            }
            case MOD -> {
                if (r == 0) throw new ArithmeticException("Modulo by zero");
                yield l - (l / r) * r;
            }
            case SHL -> l << (r % 32);
            case SHR -> l >> (r % 32);
            case BIT_AND -> l & r;
            case BIT_OR -> l | r;
            case BIT_XOR -> l ^ r;
            case NEG -> exact(-(long) l);
            case BIT_NOT -> ~l;
            case ABS -> exact(Math.abs((long) l));
            case CMP_EQ -> unbool(l == r);
            case CMP_NE -> unbool(l != r);
            case CMP_GE -> unbool(l >= r);
            case CMP_GT -> unbool(l > r);
            case CMP_LE -> unbool(l <= r);
            case CMP_LT -> unbool(l < r);
            case CMP_ZERO -> unbool(l == 0);
            case CMP_NOT_ZERO -> unbool(l != 0);
            case LOGICAL_AND -> unbool(l != 0 && r != 0);
            case LOGICAL_OR -> unbool(l != 0 || r != 0);
            case SELECT -> args[2] != 0 ? args[1] : args[0];
            case MUL_REAL -> exact((long) l * r / 1000);
            case DIV_REAL -> {
                if (r == 0) throw new ArithmeticException("Division by zero");
                yield exact((long) l * 1000 / r);
            }
            case MIN -> Math.min(l, r);
            case MAX -> Math.max(l, r);
            case PUSH, SIN, COS, TAN -> throw new ArithmeticException(name() + " is not evaluated at compile time");
        };
    }

    /**
     * Checks whether {@link #apply} can evaluate this operation.
     * @return {@code false} for the trigonometric operations and {@code PUSH}.
     */
    public boolean isFoldable() {
        return this != PUSH && this != SIN && this != COS && this != TAN;
    }

    private static int exact(long value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ArithmeticException("Overflow in constant expression");
        }
        return (int) value;
    }

    private static int unbool(boolean value) {
        return value ? -1 : 0;
    }
}
