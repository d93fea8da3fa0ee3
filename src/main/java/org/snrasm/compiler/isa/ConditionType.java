package org.snrasm.compiler.isa;

import java.util.Optional;

/**
 * Comparison performed by {@code jc}.
 */
public enum ConditionType {
    EQUAL(0x0, "=="),
    NOT_EQUAL(0x1, "!="),
    GREATER_OR_EQUAL(0x2, ">="),
    GREATER(0x3, ">"),
    LESS_OR_EQUAL(0x4, "<="),
    LESS(0x5, "<"),
    /** {@code L & R != 0} */
    BITWISE_AND_NOT_ZERO(0x6, "&"),
    /** {@code L & (1 << R) != 0} */
    BIT_SET(0x7, "bitset");

    private final int code;
    private final String operator;

    ConditionType(int code, String operator) {
        this.code = code;
        this.operator = operator;
    }

    public int code() {
        return code;
    }

    public String operator() {
        return operator;
    }

    public static Optional<ConditionType> fromCode(int code) {
        for (ConditionType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static Optional<ConditionType> fromOperator(String operator) {
        for (ConditionType type : values()) {
            if (type.operator.equals(operator)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
