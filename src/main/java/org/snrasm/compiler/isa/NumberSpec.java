package org.snrasm.compiler.isa;

/**
 * A run-time number source: either a constant or the contents of a register.
 */
public sealed interface NumberSpec permits NumberSpec.Constant, NumberSpec.RegisterValue {

    /** The smallest constant a NumberSpec can hold (28-bit signed). */
    int MIN_CONSTANT = -0x8000000;
    /** The largest constant a NumberSpec can hold (28-bit signed). */
    int MAX_CONSTANT = 0x7FFFFFF;

    record Constant(int value) implements NumberSpec {
        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    record RegisterValue(Register register) implements NumberSpec {
        @Override
        public String toString() {
            return register.toString();
        }
    }

    static NumberSpec constant(int value) {
        return new Constant(value);
    }

    static NumberSpec of(Register register) {
        return new RegisterValue(register);
    }

    default boolean isZero() {
        return this instanceof Constant c && c.value() == 0;
    }
}
