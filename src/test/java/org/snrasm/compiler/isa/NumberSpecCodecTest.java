package org.snrasm.compiler.isa;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link NumberSpecCodec}, covering every encoding form and
 * the rejection of encodings that are not the shortest one.
 */
@Tag("unit")
public class NumberSpecCodecTest {

    private static String encode(NumberSpec spec) throws EncodingException {
        CodeWriter out = new CodeWriter();
        NumberSpecCodec.encode(spec, out);
        return HexFormat.of().formatHex(out.toByteArray());
    }

    private static NumberSpec decode(String hex) throws DecodingException {
        return NumberSpecCodec.decode(new CodeReader(HexFormat.of().parseHex(hex), 0));
    }

    @ParameterizedTest
    @CsvSource({
            "5, 05",
            "-1, 7f",
            "-64, 40",
            "63, 3f",
            "64, 8040",
            "-65, 8fbf",
            "2047, 87ff",
            "2048, 900800",
            "524288, a0080000",
            "134217727, a7ffffff",
            "-134217728, a8000000"
    })
    void testConstantUsesShortestForm(int value, String hex) throws Exception {
        assertThat(encode(NumberSpec.constant(value))).isEqualTo(hex);
        assertThat(decode(hex)).isEqualTo(NumberSpec.constant(value));
    }

    @Test
    void testRegisterForms() throws Exception {
        assertThat(encode(NumberSpec.of(Register.regular(1)))).isEqualTo("b1");
        assertThat(encode(NumberSpec.of(Register.regular(16)))).isEqualTo("c010");
        assertThat(encode(NumberSpec.of(Register.regular(0x123)))).isEqualTo("c123");
        assertThat(encode(NumberSpec.of(Register.argument(0)))).isEqualTo("d0");
        assertThat(decode("c123")).isEqualTo(NumberSpec.of(Register.regular(0x123)));
    }

    @Test
    void testOutOfRangeValuesAreRejected() {
        assertThatThrownBy(() -> encode(NumberSpec.constant(NumberSpec.MAX_CONSTANT + 1)))
                .isInstanceOf(EncodingException.class)
                .hasMessage("NumberSpec constant value out of range: 134217728");
        assertThatThrownBy(() -> encode(NumberSpec.of(Register.argument(16))))
                .isInstanceOf(EncodingException.class);
    }

    /**
     * A value that fits a shorter form must not be accepted in a longer one.
     */
    @Test
    void testNonCanonicalEncodingsAreRejected() {
        assertThatThrownBy(() -> decode("8005"))
                .isInstanceOf(DecodingException.class)
                .hasMessageContaining("Non-canonical");
        assertThatThrownBy(() -> decode("900005")).isInstanceOf(DecodingException.class);
        assertThatThrownBy(() -> decode("c005")).isInstanceOf(DecodingException.class);
    }

    @Test
    void testUnknownFormAndTruncation() {
        assertThatThrownBy(() -> decode("e0"))
                .isInstanceOf(DecodingException.class)
                .hasMessageContaining("Unknown NumberSpec type");
        assertThatThrownBy(() -> decode("a0")).isInstanceOf(DecodingException.class);
    }
}
