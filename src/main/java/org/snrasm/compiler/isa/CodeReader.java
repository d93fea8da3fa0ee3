package org.snrasm.compiler.isa;

/**
 * Sequential little-endian reader over a code block.
 */
public final class CodeReader {

    private final byte[] code;
    private int position;

    public CodeReader(byte[] code, int position) {
        this.code = code;
        this.position = position;
    }

    public int position() {
        return position;
    }

    public boolean isAtEnd() {
        return position >= code.length;
    }

    public int length() {
        return code.length;
    }

    public int u8() throws DecodingException {
        if (position >= code.length) {
            throw new DecodingException("Unexpected end of code block", position);
        }
        return code[position++] & 0xFF;
    }

    public int peekU8() throws DecodingException {
        if (position >= code.length) {
            throw new DecodingException("Unexpected end of code block", position);
        }
        return code[position] & 0xFF;
    }

    public int u16() throws DecodingException {
        return u8() | (u8() << 8);
    }

    public int u24() throws DecodingException {
        return u16() | (u8() << 16);
    }

    public long u32() throws DecodingException {
        return (u16() | ((long) u16() << 16)) & 0xFFFFFFFFL;
    }

    public void skip(int count) throws DecodingException {
        if (position + count > code.length) {
            throw new DecodingException("Unexpected end of code block", code.length);
        }
        position += count;
    }

    /**
     * Reads bytes up to (excluding) the next NUL and consumes the NUL.
     * @return The bytes before the terminator.
     * @throws DecodingException If no terminator follows.
     */
    public byte[] untilNul() throws DecodingException {
        int start = position;
        int value;
        do {
            value = u8();
        } while (value != 0);
        byte[] result = new byte[position - start - 1];
        System.arraycopy(code, start, result, 0, result.length);
        return result;
    }

    public byte[] bytes(int count) throws DecodingException {
        if (count < 0 || position + count > code.length) {
            throw new DecodingException("Unexpected end of code block", code.length);
        }
        byte[] result = new byte[count];
        System.arraycopy(code, position, result, 0, count);
        position += count;
        return result;
    }
}
