package org.snrasm.compiler.isa;

/**
 * The condition byte of {@code jc}: a comparison plus a negation bit (0x80).
 */
public record JumpCondition(ConditionType type, boolean negated) {

    public int encode() {
        return type.code() | (negated ? 0x80 : 0);
    }

    public static JumpCondition decode(int value, int offset) throws DecodingException {
        ConditionType type = ConditionType.fromCode(value & 0x7F)
                .orElseThrow(() -> new DecodingException("Unknown jump condition type: " + (value & 0x7F), offset));
        return new JumpCondition(type, (value & 0x80) != 0);
    }
}
