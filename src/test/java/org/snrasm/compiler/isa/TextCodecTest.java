package org.snrasm.compiler.isa;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class TextCodecTest {

    private final TextCodec codec = new TextCodec(Charset.forName("Shift_JIS"));

    private static String hex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes);
    }

    private static byte[] bytes(String hex) {
        return HexFormat.of().parseHex(hex);
    }

    @Test
    void testFixupTablesLineUp() {
        assertThat(TextCodec.FIXUP_ENCODED).hasSameSizeAs(TextCodec.FIXUP_DECODED).hasSize(64);
    }

    /**
     * Hiragana and full-width punctuation are stored as their half-width counterparts.
     */
    @Test
    void testMessageTextIsFixedUp() throws Exception {
        assertThat(hex(codec.encodeFixup("あいう。"))).isEqualTo("b1b2b3a1");
        assertThat(hex(codec.encodeFixup("「？」"))).isEqualTo("a23fa3");
        // kanji and ASCII letters pass unchanged
        assertThat(hex(codec.encodeFixup("漢A"))).isEqualTo(hex(codec.encode("漢A")));
        assertThat(hex(codec.encode("あ"))).isEqualTo("82a0");
    }

    @Test
    void testDecodeUndoesTheFixup() throws Exception {
        assertThat(codec.decodeFixup(bytes("b1b2b3a1"), 0)).isEqualTo("あいう。");
        assertThat(codec.decode(bytes("b1b2b3a1"), 0)).isEqualTo("ｱｲｳ｡");
    }

    @Test
    void testFullWidthFormIsRejectedInMessageText() {
        assertThatThrownBy(() -> codec.decodeFixup(bytes("82a0"), 7))
                .isInstanceOf(DecodingException.class)
                .hasMessage("Message text is not in its fixed-up form")
                .satisfies(e -> assertThat(((DecodingException) e).getOffset()).isEqualTo(7));
    }

    @Test
    void testUnmappableCharacter() {
        assertThatThrownBy(() -> codec.encode("😀"))
                .isInstanceOf(EncodingException.class)
                .hasMessage("Character `😀` cannot be encoded in Shift_JIS");
        assertThatThrownBy(() -> codec.encode("a\0b"))
                .isInstanceOf(EncodingException.class);
    }
}
