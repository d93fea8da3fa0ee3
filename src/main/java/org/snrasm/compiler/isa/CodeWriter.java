package org.snrasm.compiler.isa;

import java.util.Arrays;

/**
 * A growable little-endian byte buffer for instruction encoding.
 */
public final class CodeWriter {

    private byte[] buffer = new byte[64];
    private int size = 0;

    public int position() {
        return size;
    }

    public void u8(int value) {
        ensure(1);
        buffer[size++] = (byte) value;
    }

    public void u16(int value) {
        u8(value);
        u8(value >>> 8);
    }

    public void u24(int value) {
        u16(value);
        u8(value >>> 16);
    }

    public void u32(long value) {
        u16((int) value);
        u16((int) (value >>> 16));
    }

    public void bytes(byte[] data) {
        ensure(data.length);
        System.arraycopy(data, 0, buffer, size, data.length);
        size += data.length;
    }

    /**
     * Overwrites four bytes at an earlier position.
     * @param position The position of the first byte.
     * @param value    The unsigned 32-bit value.
     */
    public void patchU32(int position, long value) {
        if (position < 0 || position + 4 > size) {
            throw new IndexOutOfBoundsException("Patch position " + position + " outside of " + size + " bytes");
        }
        for (int i = 0; i < 4; i++) {
            buffer[position + i] = (byte) (value >>> (8 * i));
        }
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    private void ensure(int extra) {
        if (size + extra > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, size + extra));
        }
    }
}
