package org.snrasm.compiler;

import org.snrasm.compiler.api.AssemblerOptions;
import org.snrasm.compiler.api.AssemblyResult;
import org.snrasm.compiler.api.CompilationException;
import org.snrasm.compiler.api.DisassemblyResult;
import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.frontend.units.ParsedUnit;
import org.snrasm.compiler.incremental.StageCache;
import org.snrasm.compiler.incremental.UnitArtifact;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

/**
 * End-to-end tests of the assembler pipeline, from source text to the linked code block.
 * Expected bytes are written as hex strings.
 */
public class CompilerTest {

    private Compiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new Compiler();
    }

    @AfterEach
    void tearDown() {
        compiler.close();
    }

    private static String hex(byte[] code) {
        return HexFormat.of().formatHex(code);
    }

    private AssemblyResult assembleClean(String source) {
        AssemblyResult result = compiler.assemble(source, "test.snr");
        assertThat(result.diagnostics()).describedAs("diagnostics").isEmpty();
        return result;
    }

    @Test
    @Tag("unit")
    void testUnaryAndBinaryOperations() {
        AssemblyResult result = assembleClean("MAIN:\n    neg $v0, 42\n    mov $v0, 5\n");

        assertThat(hex(result.code())).isEqualTo("4082" + "0000" + "2a" + "4100" + "0000" + "05");
    }

    @Test
    @Tag("unit")
    void testBaseAddressIsApplied() {
        try (Compiler based = new Compiler(AssemblerOptions.defaults().withBaseAddress(0x80))) {
            AssemblyResult result = based.assemble("ABOBA:\n    j ABOBA\n", "test.snr");

            assertThat(result.hasErrors()).isFalse();
            assertThat(hex(result.code())).isEqualTo("4780000000");
            assertThat(result.symbols()).containsEntry("ABOBA", 0x80L);
        }
    }

    /**
     * Verifies that a recursive function binds its parameters, resolves its local label and
     * calls its own entry address, and that the listing of the result reassembles to the same bytes.
     */
    @Test
    @Tag("unit")
    void testRecursiveFunction() {
        // Arrange
        String source = """
                function GCD($a, $b)
                    jc $b != 0, _RECUR
                    mov $v1, $a
                    return
                _RECUR:
                    exp $a, $a mod $b
                    call GCD, $b, $a
                endfun
                """;

        // Act
        AssemblyResult result = assembleClean(source);
        DisassemblyResult listing = compiler.disassembler().disassemble(result.code());
        AssemblyResult again = compiler.assemble(listing.text(), "listing.snr");

        // Assert
        assertThat(hex(result.code())).isEqualTo(
                "4601d1000e000000"       // jc $a1 != 0, _RECUR
                        + "41000100d0"   // mov $v1, $a0
                        + "50"           // return
                        + "42001000d000d105ff" // exp $a0, $a0 mod $a1
                        + "4f0000000002d1d0"   // call GCD, $a1, $a0
                        + "50");         // implicit return
        assertThat(result.symbols()).containsEntry("GCD", 0L).doesNotContainKey("_RECUR");
        assertThat(listing.diagnostics()).isEmpty();
        assertThat(again.diagnostics()).isEmpty();
        assertThat(again.code()).isEqualTo(result.code());
    }

    /**
     * Verifies that each jump table key resolves to its own entry and that the instruction
     * after {@code jt} is the default.
     */
    @Test
    @Tag("unit")
    void testJumpTableDispatch() {
        // Arrange
        String source = """
                ENTRY:
                    jt $v0, { 0 => SNR_0, 1 => SNR_1 }
                    EXIT 0, 0
                SNR_0:
                    EXIT
                SNR_1:
                    EXIT
                """;

        // Act
        AssemblyResult result = assembleClean(source);

        // Assert
        assertThat(result.symbols())
                .containsEntry("ENTRY", 0L)
                .containsEntry("SNR_0", 15L)
                .containsEntry("SNR_1", 18L);
        assertThat(hex(result.code())).isEqualTo(
                "4ab00200" + "0f000000" + "12000000"
                        + "000000"
                        + "000001"
                        + "000001");
    }

    @Test
    @Tag("unit")
    void testMissingJumpTableKeysFallThroughToDefault() {
        AssemblyResult result = assembleClean("ENTRY:\n    jt $v0, { 1 => B }\n    EXIT 0, 0\nB:\n    EXIT\n");

        // key 0 points at the EXIT right after the table
        assertThat(hex(result.code())).isEqualTo("4ab00200" + "0c000000" + "0f000000" + "000000" + "000001");
    }

    /**
     * Verifies that {@code nowait} is encoded as a flag and that omitting it changes the encoding.
     */
    @Test
    @Tag("unit")
    void testMessageWithTrailingFlag() {
        // Act
        AssemblyResult nowait = assembleClean("MAIN:\n    MSGSET 7503, \"hi\", nowait\n");
        AssemblyResult waiting = assembleClean("MAIN:\n    MSGSET 7503, \"hi\"\n");

        // Assert
        assertThat(hex(nowait.code())).isEqualTo("864f1d00" + "00" + "0300686900");
        assertThat(hex(waiting.code())).isEqualTo("864f1d00" + "01" + "0300686900");
    }

    /**
     * Two entries with the same key give one warning; the first entry is linked and the
     * code is still produced.
     */
    @Test
    @Tag("unit")
    void testDuplicateJumpTableKey() {
        // Arrange
        String source = """
                ENTRY:
                    jt $v0, { 0 => A, 0 => B }
                    EXIT
                A:
                    EXIT
                B:
                    EXIT
                """;

        // Act
        AssemblyResult result = compiler.assemble(source, "test.snr");

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING);
            assertThat(d.fileName()).isEqualTo("test.snr");
            assertThat(d.span().start()).isEqualTo(source.lastIndexOf("0 => B"));
        });
        assertThat(hex(result.code())).startsWith("4ab00100" + "0b000000");
        assertThat(result.symbols()).containsEntry("A", 11L);
    }

    /**
     * An error in one function leaves its sibling intact, and the span points into the file.
     */
    @Test
    @Tag("unit")
    void testUndefinedAliasDoesNotAbortSiblingFunctions() {
        // Arrange
        String source = """
                function F($x)
                    mov $y, 1
                endfun
                function G($y)
                    mov $y, 2
                endfun
                """;

        // Act
        AssemblyResult result = compiler.assemble(source, "test.snr");

        // Assert
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.message()).isEqualTo("Unresolved register alias: `$y`");
            assertThat(d.span().start()).isEqualTo(source.indexOf("$y"));
        });
        assertThat(result.symbols()).containsKeys("F", "G");
        // G: mov $a0, 2 then the implicit return
        assertThat(hex(result.code())).endsWith("410000100250");
    }

    @Test
    @Tag("unit")
    void testPreservedRegistersAreSavedAndRestored() {
        AssemblyResult result = assembleClean("function F [ $v2-$v3 ]\n    mov $v2, 1\nendfun\n");

        assertThat(hex(result.code())).isEqualTo(
                "4d02b2b3"       // push $v2, $v3
                        + "4100020001"
                        + "4e0203000200" // pop $v3, $v2
                        + "50");
    }

    @Test
    @Tag("unit")
    void testConstantsAreFolded() {
        AssemblyResult result = assembleClean("def BASE = 0x40\ndef NEXT = BASE * 2 + 1\nMAIN:\n    mov $v1, NEXT\n");

        // 129 needs the two byte form
        assertThat(hex(result.code())).isEqualTo("41000100" + "8081");
    }

    /**
     * Integer division is true division, and integers meeting reals are scaled to reals.
     */
    @Test
    @Tag("unit")
    void testDivisionAndMixedKindsPromoteToReal() {
        // Act
        AssemblyResult folded = assembleClean("MAIN:\n    mov $v0, 1 / 2\n    mov $v0, 1 + 0.5\n");
        AssemblyResult runtime = assembleClean("MAIN:\n    exp $v0, $v1 / $v2\n    exp $v0, $v1 + 1.5\n");

        // Assert
        assertThat(hex(folded.code())).isEqualTo(
                "41000000" + "81f4"      // 0.5
                        + "41000000" + "85dc"); // 1.5
        assertThat(hex(runtime.code())).isEqualTo(
                "420000" + "00b1" + "00b2" + "1a" + "ff"     // DivReal
                        + "420000" + "00b1" + "0083e8" + "03" // $v1 * 1000
                        + "0085dc" + "01" + "ff");
    }

    @Test
    @Tag("unit")
    void testElementwiseOperatorsRequireSameKinds() {
        AssemblyResult result = compiler.assemble("MAIN:\n    exp $v0, 1.5 .* 2\n", "test.snr");

        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .containsExactly("Operands of `.*` must have the same type, found real and integer");
    }

    @Test
    @Tag("unit")
    void testDivisionByLiteralZero() {
        String source = "MAIN:\n    exp $v0, $v1 / 0\n    mov $v0, 5 mod 0\n    exp $v0, $v1 / $v2\n";

        AssemblyResult result = compiler.assemble(source, "test.snr");

        // a register divisor is left to the VM
        assertThat(result.diagnostics()).extracting(Diagnostic::message)
                .containsExactly("Division by zero", "Modulo by zero");
        assertThat(result.diagnostics().get(0).span().start()).isEqualTo(source.indexOf("$v1 / 0"));
    }

    /**
     * A constant too large for its operand fails that instruction only; the following
     * function is still generated.
     */
    @Test
    @Tag("unit")
    void testOperandOverflowKeepsOtherUnits() {
        // Act
        AssemblyResult result = compiler.assemble(
                "MAIN:\n    mov $v0, 134217728\nfunction G\n    mov $v1, 1\nendfun\n", "test.snr");

        // Assert
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.message()).isEqualTo("NumberSpec constant value out of range: 134217728");
        });
        assertThat(result.symbols()).containsKey("G");
        assertThat(hex(result.code())).endsWith("410001000150");
    }

    @Test
    @Tag("unit")
    void testAssembleOrThrow() {
        assertThatThrownBy(() -> compiler.assembleOrThrow("MAIN:\n    j NOWHERE\n", "test.snr"))
                .isInstanceOf(CompilationException.class)
                .satisfies(e -> assertThat(((CompilationException) e).getDiagnostics())
                        .extracting(Diagnostic::message)
                        .containsExactly("Could not find the definition of `NOWHERE`"));
    }

    @Test
    @Tag("unit")
    void testSyntaxErrorIsReportedWithFileOffset() {
        String source = "A:\n    EXIT\nB:\n    EXIT ,\n";

        AssemblyResult result = compiler.assemble(source, "test.snr");

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.diagnostics()).allSatisfy(d -> {
            assertThat(d.fileName()).isEqualTo("test.snr");
            assertThat(d.span().start()).isGreaterThanOrEqualTo(source.indexOf("B:"));
        });
    }

    /**
     * Assembling an edited file reuses the cached results of the units that did not change.
     */
    @Test
    @Tag("unit")
    void testUnchangedUnitsAreReused() {
        // Arrange
        StageCache<ParsedUnit> parseCache = spy(new StageCache<>("parse", 64));
        StageCache<UnitArtifact> unitCache = spy(new StageCache<>("unit", 64));
        String before = "function F\n    mov $v1, 1\nendfun\nfunction G\n    mov $v2, 2\nendfun\n";
        String after = before.replace("mov $v2, 2", "mov $v2, 3");

        try (Compiler cached = new Compiler(AssemblerOptions.defaults(), parseCache, unitCache)) {
            // Act
            AssemblyResult first = cached.assemble(before, "test.snr");
            AssemblyResult second = cached.assemble(after, "test.snr");

            // Assert
            assertThat(first.hasErrors()).isFalse();
            assertThat(second.hasErrors()).isFalse();
            assertThat(parseCache.misses()).isEqualTo(3);
            assertThat(parseCache.hits()).isEqualTo(1);
            assertThat(unitCache.hits()).isEqualTo(1);
            assertThat(hex(second.code())).endsWith("410002000350");

            cached.invalidateCaches();
            verify(parseCache).invalidateAll();
            verify(unitCache).invalidateAll();
        }
    }

    @Test
    @Tag("unit")
    void testMessageTextIsFixedUp() {
        AssemblyResult result = assembleClean("MAIN:\n    MSGSET 1, \"あいう。\"\n    SAVEINFO 0, \"ね\"\n");

        assertThat(hex(result.code())).isEqualTo(
                "86" + "010000" + "01" + "0500" + "b1b2b3a1" + "00"
                        + "a0" + "00" + "0200" + "c800");
    }

    @Test
    @Tag("unit")
    void testStringsUseConfiguredEncoding() {
        AssemblyResult result = assembleClean("MAIN:\n    DEBUGOUT \"あ\"\n");

        // Shift_JIS: 82 a0, then the NUL and an empty number list
        assertThat(hex(result.code())).isEqualTo("ff" + "0300" + "82a000" + "00");
    }
}
