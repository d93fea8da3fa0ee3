package org.snrasm.compiler.isa;

/**
 * Variable-length encoding of {@link NumberSpec} values.
 * <p>
 * The first byte {@code t} decides the form. If bit 7 is clear, the low seven bits are a signed
 * constant. Otherwise {@code t = 1PPPKKKK}:
 * <ul>
 *     <li>P=0: 12-bit constant, K is the sign-extended high nibble, one more byte follows</li>
 *     <li>P=1: 20-bit constant, two more bytes (big-endian)</li>
 *     <li>P=2: 28-bit constant, three more bytes (big-endian)</li>
 *     <li>P=3: regular register K</li>
 *     <li>P=4: regular register (K &lt;&lt; 8 | next byte)</li>
 *     <li>P=5: argument register K</li>
 * </ul>
 * The encoder always picks the shortest form; the decoder rejects anything else.
 */
public final class NumberSpecCodec {

    private NumberSpecCodec() {
    }

    public static void encode(NumberSpec spec, CodeWriter out) throws EncodingException {
        if (spec instanceof NumberSpec.Constant c) {
            encodeConstant(c.value(), out);
        } else if (spec instanceof NumberSpec.RegisterValue r) {
            encodeRegister(r.register(), out);
        }
    }

    /**
     * Returns the number of bytes {@link #encode} writes for the given value.
     * @param spec The value.
     * @return The encoded size, 1 to 4.
     * @throws EncodingException If the value cannot be encoded.
     */
    public static int encodedSize(NumberSpec spec) throws EncodingException {
        CodeWriter w = new CodeWriter();
        encode(spec, w);
        return w.position();
    }

    private static void encodeConstant(int value, CodeWriter out) throws EncodingException {
        if (value >= -0x40 && value <= 0x3F) {
            out.u8(value & 0x7F);
        } else if (value >= -0x800 && value <= 0x7FF) {
            out.u8(t(0, (value >> 8) & 0xF));
            out.u8(value);
        } else if (value >= -0x80000 && value <= 0x7FFFF) {
            out.u8(t(1, (value >> 16) & 0xF));
            out.u8(value >> 8);
            out.u8(value);
        } else if (value >= NumberSpec.MIN_CONSTANT && value <= NumberSpec.MAX_CONSTANT) {
            out.u8(t(2, (value >> 24) & 0xF));
            out.u8(value >> 16);
            out.u8(value >> 8);
            out.u8(value);
        } else {
            throw new EncodingException("NumberSpec constant value out of range: " + value);
        }
    }

    private static void encodeRegister(Register register, CodeWriter out) throws EncodingException {
        int index = register.index();
        if (register.isArgument()) {
            if (index > 15) {
                throw new EncodingException("Argument register " + register + " cannot be used as a number; only $a0..$a15 are addressable");
            }
            out.u8(t(5, index));
        } else if (index <= 15) {
            out.u8(t(3, index));
        } else {
            out.u8(t(4, index >> 8));
            out.u8(index);
        }
    }

    private static int t(int p, int k) {
        return 0x80 | (p << 4) | k;
    }

    /**
     * Reads one NumberSpec and verifies that it uses the shortest form.
     * @param in The reader.
     * @return The decoded value.
     * @throws DecodingException If the bytes are malformed or not canonical.
     */
    public static NumberSpec decode(CodeReader in) throws DecodingException {
        int start = in.position();
        int t = in.u8();
        if ((t & 0x80) == 0) {
            return NumberSpec.constant((t << 25) >> 25);
        }
        int p = (t >> 4) & 0x7;
        int k = t & 0xF;
        int kSigned = (k << 28) >> 28;
        switch (p) {
            case 0: {
                int value = (kSigned << 8) | in.u8();
                requireCanonical(value < -0x40 || value > 0x3F, start);
                return NumberSpec.constant(value);
            }
            case 1: {
                int value = (kSigned << 16) | (in.u8() << 8) | in.u8();
                requireCanonical(value < -0x800 || value > 0x7FF, start);
                return NumberSpec.constant(value);
            }
            case 2: {
                int value = (kSigned << 24) | (in.u8() << 16) | (in.u8() << 8) | in.u8();
                requireCanonical(value < -0x80000 || value > 0x7FFFF, start);
                return NumberSpec.constant(value);
            }
            case 3:
                return NumberSpec.of(Register.regular(k));
            case 4: {
                int index = (k << 8) | in.u8();
                requireCanonical(index > 15, start);
                return NumberSpec.of(Register.regular(index));
            }
            case 5:
                return NumberSpec.of(Register.argument(k));
            default:
                throw new DecodingException(String.format("Unknown NumberSpec type: t=0x%02x, P=%d", t, p), start);
        }
    }

    private static void requireCanonical(boolean canonical, int offset) throws DecodingException {
        if (!canonical) {
            throw new DecodingException("Non-canonical NumberSpec encoding: a shorter form exists", offset);
        }
    }
}
