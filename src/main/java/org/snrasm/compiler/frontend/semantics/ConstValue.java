package org.snrasm.compiler.frontend.semantics;

/**
 * A compile-time constant.
 *
 * @param value The value; for {@link ValueKind#REAL} the fixed point representation.
 * @param kind  The static type.
 */
public record ConstValue(int value, ValueKind kind) {

    public static ConstValue ofInt(int value) {
        return new ConstValue(value, ValueKind.INT);
    }

    @Override
    public String toString() {
        if (kind == ValueKind.INT) {
            return Integer.toString(value);
        }
        String sign = value < 0 ? "-" : "";
        long abs = Math.abs((long) value);
        return String.format("%s%d.%03d", sign, abs / 1000, abs % 1000);
    }
}
