package org.snrasm.compiler.isa;

/**
 * The encoding kind of an instruction operand. The kind decides how a source argument is
 * resolved, lowered and written.
 */
public enum OperandKind {
    /** A destination register, u16. */
    REGISTER(false),
    /** A {@link NumberSpec}. */
    NUMBER(false),
    /** A raw u8 constant. */
    U8(false),
    /** A raw u16 constant. */
    U16(false),
    /** A u8 boolean, 0 or 1. */
    BOOL(false),
    /** A 24-bit message id. */
    MESSAGE_ID(false),
    /** A length-prefixed, NUL-terminated string. */
    STRING(false),
    /** A {@link #STRING} whose text passes through the message fixup of {@link TextCodec#encodeFixup}. */
    FIXUP_STRING(false),
    /** A size-prefixed sequence of NUL-terminated strings. */
    STRING_ARRAY(true),
    /** A u8 count followed by NumberSpecs. */
    NUMBER_LIST(true),
    /** A u8 count followed by u16 registers. */
    REGISTER_LIST(true),
    /** A presence mask followed by up to eight non-zero NumberSpecs. */
    BITMASK(true),
    /** An absolute u32 code address. */
    CODE_ADDRESS(false),
    /** An RPN expression terminated by 0xFF. */
    EXPRESSION(false),
    /** A jump condition with its two NumberSpec operands. */
    CONDITION(false),
    /** A u16 count followed by NumberSpecs padded to four bytes each. */
    NUMBER_TABLE(true),
    /** A u16 count followed by u32 code addresses, written as a mapping in source. */
    ADDRESS_TABLE(false);

    private final boolean trailingList;

    OperandKind(boolean trailingList) {
        this.trailingList = trailingList;
    }

    /**
     * List kinds are always the last operand and take all remaining source arguments.
     * @return {@code true} for variadic kinds.
     */
    public boolean isTrailingList() {
        return trailingList;
    }

    /**
     * @return The maximum number of elements of a list kind.
     */
    public int maxElements() {
        return switch (this) {
            case NUMBER_LIST, REGISTER_LIST -> 0xFF;
            case BITMASK -> 8;
            case NUMBER_TABLE, ADDRESS_TABLE, STRING_ARRAY -> 0xFFFF;
            default -> 1;
        };
    }
}
