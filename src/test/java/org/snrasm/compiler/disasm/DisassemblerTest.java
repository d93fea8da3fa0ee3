package org.snrasm.compiler.disasm;

import org.snrasm.compiler.Compiler;
import org.snrasm.compiler.api.AssemblyResult;
import org.snrasm.compiler.api.DisassemblyResult;
import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.isa.ScenarioInstructionSet;
import org.snrasm.compiler.isa.TextCodec;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.Charset;
import java.util.HexFormat;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Disassembler}: canonical listings, strict decoding,
 * and the guarantee that a listing assembles back to the bytes it came from.
 */
public class DisassemblerTest {

    private static Compiler compiler;
    private static Disassembler disassembler;

    @BeforeAll
    static void setUp() {
        compiler = new Compiler();
        disassembler = compiler.disassembler();
    }

    @AfterAll
    static void tearDown() {
        compiler.close();
    }

    private static byte[] bytes(String hex) {
        return HexFormat.of().parseHex(hex);
    }

    private static byte[] assemble(String source) {
        AssemblyResult result = compiler.assemble(source, "test.snr");
        assertThat(result.diagnostics()).describedAs("diagnostics of:%n%s", source).isEmpty();
        return result.code();
    }

    static Stream<String> programs() {
        return Stream.of(
                "MAIN:\n    neg $v0, 42\n    mov $v0, 5\n    add $v1, $v2, $a3\n    EXIT\n",
                "ENTRY:\n    jt $v0, { 0 => A, 2 => B }\n    EXIT 0, 0\nA:\n    EXIT 1\nB:\n    EXIT 2, 7\n",
                "MAIN:\n    MSGSET 1, \"「あいう、ー」？\"\n    SAVEINFO 1, \"ねこ\"\n",
                "MAIN:\n    MSGSET 7503, \"hi\", nowait\n    MSGSET 7504, \"there\"\n    MSGCLOSE nowait\n    WAIT 30, interruptable\n",
                "MAIN:\n    exp $v0, ($v1 + 3) * $v2 - idiv($v3, 4)\n    exp $v1, $v1 * 1.5\n    exp $v2, sin($v1) .* 2.0\n",
                "L:\n    jc $v0 >= 10, L\n    jc !($v1 == $v2), L\n    jc bitset($v0, 3), L\n    jc $v0 & 4, L\n",
                "MAIN:\n    WIPE 1, 2, 3, 4, 0, 5\n    SELECT 1, 2, $v0, 3, \"Q\", \"Yes\", \"No\"\n    gt $v0, $v1, 10, 200, 3000\n",
                "MAIN:\n    rnd $v0, 1, 6\n    push 1, $v0, 0x1000\n    pop $v0, $v1\n    DEBUGOUT \"%d\", $v0\n",
                "function F($a) [ $v2-$v3 ]\n    return\nendfun\n",
                "MAIN:\n    mov $v0, 1\nfunction F\n    jc $v0 > 0, _DONE\n    mov $v0, 2\n_DONE:\nendfun\n",
                "MAIN:\n    call F\n    EXIT\nfunction F\n    return\n    mov $v0, 1\nendfun\n",
                "MAIN:\n    call F, 1, 2\n    gosub S\n    EXIT\nfunction F($x, $y) [ $v2-$v3 ]\n    add $v2, $x, $y\n    jc $v2 < 0, _NEG\n    return\n_NEG:\n    neg $v2, $v2\nendfun\nsubroutine S\n    SEPLAY 1, 2, 3, 4, 5, 6, 7\nendsub\n",
                """
                function GCD($a, $b)
                    jc $b != 0, _RECUR
                    mov $v1, $a
                    return
                _RECUR:
                    exp $a, $a mod $b
                    call GCD, $b, $a
                endfun
                """);
    }

    /**
     * Assembling a listing yields the bytes it was produced from, and the listing of those
     * bytes is stable.
     */
    @ParameterizedTest
    @MethodSource("programs")
    @Tag("unit")
    void testRoundTrip(String source) {
        // Arrange
        byte[] code = assemble(source);

        // Act
        DisassemblyResult listing = disassembler.disassemble(code);
        byte[] reassembled = assemble(listing.text());

        // Assert
        assertThat(listing.diagnostics()).isEmpty();
        assertThat(reassembled).isEqualTo(code);
        assertThat(disassembler.disassemble(reassembled).text()).isEqualTo(listing.text());
    }

    @Test
    @Tag("unit")
    void testCanonicalText() {
        DisassemblyResult result = disassembler.disassemble(bytes("4700000000" + "4100000005" + "408200002a"));

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.text()).isEqualTo(
                "LABEL_0000:\n"
                        + "    j LABEL_0000\n"
                        + "    mov $v0, 5\n"
                        + "    neg $v0, 42\n");
    }

    @Test
    @Tag("unit")
    void testMessageTextIsListedAsShown() {
        DisassemblyResult result = disassembler.disassemble(bytes("8601000001" + "0500" + "b1b2b3a1" + "00"));

        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.text()).isEqualTo("    MSGSET 1, \"あいう。\"\n");
    }

    @Test
    @Tag("unit")
    void testExternalNamesAndLabelPrefix() {
        byte[] code = bytes("4700000000");

        assertThat(disassembler.disassemble(code, Map.of(0L, "ABOBA")).text())
                .isEqualTo("ABOBA:\n    j ABOBA\n");
        Disassembler prefixed = new Disassembler(ScenarioInstructionSet.getInstance(),
                new TextCodec(Charset.forName("Shift_JIS")), 0x80, "L_");
        assertThat(prefixed.disassemble(bytes("4780000000")).text())
                .isEqualTo("L_0080:\n    j L_0080\n");
    }

    /**
     * A constant stored in a longer form than needed is rejected; the instructions decoded
     * before it are still listed.
     */
    @Test
    @Tag("unit")
    void testNonCanonicalNumberStopsDecoding() {
        // Act
        DisassemblyResult result = disassembler.disassemble(bytes("4100000005" + "410000008005" + "50"));

        // Assert
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.message()).contains("Non-canonical");
            assertThat(d.fileName()).isEqualTo("<binary>");
            assertThat(d.span().start()).isEqualTo(5);
        });
        assertThat(result.text()).isEqualTo("    mov $v0, 5\n");
    }

    @Test
    @Tag("unit")
    void testStrictDecodingErrors() {
        assertThat(disassembler.disassemble(bytes("43")).diagnostics())
                .extracting(Diagnostic::type).containsExactly(Diagnostic.Type.ERROR);
        // bool byte of MSGSET must be 0 or 1
        assertThat(disassembler.disassemble(bytes("864f1d00" + "02" + "0300686900")).diagnostics())
                .extracting(Diagnostic::message)
                .singleElement().asString().contains("Boolean byte must be 0 or 1, found 2");
        // message text stored in full-width form
        assertThat(disassembler.disassemble(bytes("8601000001" + "0300" + "82a0" + "00")).diagnostics())
                .extracting(Diagnostic::message)
                .singleElement().asString().contains("Message text is not in its fixed-up form");
        // truncated jump
        assertThat(disassembler.disassemble(bytes("470000")).hasErrors()).isTrue();
        // the assembler would have folded 1 + 2
        assertThat(disassembler.disassemble(bytes("420000" + "0001" + "0002" + "01" + "ff")).diagnostics())
                .extracting(Diagnostic::message)
                .singleElement().asString().contains("constant sub-expression");
    }

    @Test
    @Tag("unit")
    void testJumpIntoInstructionIsReported() {
        DisassemblyResult result = disassembler.disassemble(bytes("4702000000" + "50"));

        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .anySatisfy(m -> assertThat(m).contains("is not at an instruction boundary"));
    }

    /**
     * A function nothing calls is still listed as a function, so its {@code return} reassembles.
     */
    @Test
    @Tag("unit")
    void testUncalledFunctionIsReconstructed() {
        // Arrange
        byte[] code = assemble("function F($a) [ $v2-$v3 ]\n    return\nendfun\n");

        // Act
        DisassemblyResult result = disassembler.disassemble(code);

        // Assert
        assertThat(code).isEqualTo(bytes("4d02b2b3" + "4e0203000200" + "50"));
        assertThat(result.diagnostics()).isEmpty();
        assertThat(result.text()).isEqualTo(
                "function FUN_0000\n"
                        + "    push $v2, $v3\n"
                        + "    pop $v3, $v2\n"
                        + "    return\n"
                        + "endfun\n");
    }

    @Test
    @Tag("unit")
    void testReturnEnteredFromOutsideIsAWarning() {
        // j 0x0005, then a return that only the jump reaches
        DisassemblyResult result = disassembler.disassemble(bytes("4705000000" + "50"));

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.diagnostics()).isNotEmpty()
                .allSatisfy(d -> assertThat(d.message()).endsWith("; the listing will not reassemble"))
                .anySatisfy(d -> assertThat(d.message()).contains("is outside of any function"));
    }
}
