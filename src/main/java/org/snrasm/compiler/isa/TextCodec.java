package org.snrasm.compiler.isa;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Converts string operands between Java strings and the VM's text encoding.
 * Both directions fail instead of substituting characters.
 * <p>
 * Message text additionally goes through the fixup the engine applies when it shows a
 * message: hiragana and some full-width punctuation are stored as the half-width
 * characters listed at the same position in {@link #FIXUP_ENCODED}.
 */
public final class TextCodec {

    static final String FIXUP_ENCODED =
            "｢｣ｧｨｩｪｫｬｭｮｱｲｳｴｵｶｷｸｹｺｻｼｽｾｿﾀﾁﾂﾃﾄﾅﾆﾇﾈﾉﾊﾋﾌﾍﾎﾏﾐﾑﾒﾓﾔﾕﾖﾗﾘﾙﾚﾛﾜｦﾝｰｯ､ﾟﾞ･?｡";
    static final String FIXUP_DECODED =
            "「」ぁぃぅぇぉゃゅょあいうえおかきくけこさしすせそたちつてとなにぬねのはひふへほまみむめもやゆよらりるれろわをんーっ、？！…\u3000。";

    private static final Map<Character, Character> FIXUP_ENCODE = new HashMap<>();
    private static final Map<Character, Character> FIXUP_DECODE = new HashMap<>();

    static {
        for (int i = 0; i < FIXUP_ENCODED.length(); i++) {
            FIXUP_ENCODE.put(FIXUP_DECODED.charAt(i), FIXUP_ENCODED.charAt(i));
            FIXUP_DECODE.put(FIXUP_ENCODED.charAt(i), FIXUP_DECODED.charAt(i));
        }
    }

    private final Charset charset;

    public TextCodec(Charset charset) {
        this.charset = charset;
    }

    public Charset charset() {
        return charset;
    }

    /**
     * Encodes a string without terminator.
     * @param text The string.
     * @return The encoded bytes.
     * @throws EncodingException If a character has no representation or the string contains NUL.
     */
    public byte[] encode(String text) throws EncodingException {
        if (text.indexOf('\0') >= 0) {
            throw new EncodingException("Strings cannot contain NUL characters");
        }
        CharsetEncoder encoder = newEncoder();
        try {
            ByteBuffer buffer = encoder.encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new EncodingException(unmappable(text));
        }
    }

    /**
     * Decodes bytes and verifies that encoding the result gives the same bytes back.
     * @param bytes  The bytes without terminator.
     * @param offset The block offset of the string, for errors.
     * @return The decoded string.
     * @throws DecodingException If the bytes are malformed or do not re-encode identically.
     */
    public String decode(byte[] bytes, int offset) throws DecodingException {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        String text;
        try {
            text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new DecodingException("String is not valid " + charset.name(), offset);
        }
        try {
            if (!Arrays.equals(encode(text), bytes)) {
                throw new DecodingException("String does not re-encode to the same " + charset.name() + " bytes", offset);
            }
        } catch (EncodingException e) {
            throw new DecodingException(e.getMessage(), offset);
        }
        return text;
    }

    /**
     * Encodes message text, replacing the characters the engine stores in half-width form.
     * @param text The message text as shown.
     * @return The encoded bytes.
     * @throws EncodingException If a character has no representation or the text contains NUL.
     */
    public byte[] encodeFixup(String text) throws EncodingException {
        return encode(translate(text, FIXUP_ENCODE));
    }

    /**
     * Decodes message text and undoes the fixup.
     * Bytes that the fixup would have written differently are rejected.
     * @param bytes  The bytes without terminator.
     * @param offset The block offset of the string, for errors.
     * @return The message text as shown.
     * @throws DecodingException If the bytes are malformed or do not re-encode identically.
     */
    public String decodeFixup(byte[] bytes, int offset) throws DecodingException {
        String text = translate(decode(bytes, offset), FIXUP_DECODE);
        try {
            if (!Arrays.equals(encodeFixup(text), bytes)) {
                throw new DecodingException("Message text is not in its fixed-up form", offset);
            }
        } catch (EncodingException e) {
            throw new DecodingException(e.getMessage(), offset);
        }
        return text;
    }

    private static String translate(String text, Map<Character, Character> table) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(table.getOrDefault(c, c));
        }
        return sb.toString();
    }

    private CharsetEncoder newEncoder() {
        return charset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private String unmappable(String text) {
        CharsetEncoder encoder = newEncoder();
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            String ch = new String(Character.toChars(cp));
            if (!encoder.canEncode(ch)) {
                return "Character `" + ch + "` cannot be encoded in " + charset.name();
            }
            i += Character.charCount(cp);
        }
        return "String cannot be encoded in " + charset.name();
    }
}
