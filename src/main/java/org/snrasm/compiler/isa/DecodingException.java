package org.snrasm.compiler.isa;

/**
 * Thrown when bytes do not form a valid, canonically encoded instruction.
 */
public class DecodingException extends Exception {

    private final int offset;

    /**
     * @param message The reason.
     * @param offset  The byte offset within the block where decoding failed.
     */
    public DecodingException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
