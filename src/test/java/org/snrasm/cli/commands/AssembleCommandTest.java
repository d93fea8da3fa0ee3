package org.snrasm.cli.commands;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import org.snrasm.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the {@code asm}, {@code disasm} and {@code lex} subcommands end to end through picocli.
 */
@Tag("unit")
public class AssembleCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cmd = CommandLineInterface.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    private Path source(String text) throws Exception {
        Path file = tempDir.resolve("main.snr");
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Assembles a file with a symbol map, then lists the code block with the same map.
     */
    @Test
    void testAssembleThenDisassembleWithSymbols() throws Exception {
        // Arrange
        Path src = source("MAIN:\n    neg $v0, 42\n    j MAIN\n");
        Path code = tempDir.resolve("main.bin");
        Path symbols = tempDir.resolve("main.json");

        // Act
        int asmExit = cmd.execute("asm", src.toString(), "-o", code.toString(), "-s", symbols.toString());

        // Assert
        assertThat(asmExit).isZero();
        assertThat(HexFormat.of().formatHex(Files.readAllBytes(code))).isEqualTo("408200002a" + "4700000000");
        Map<String, Long> byName = new Gson().fromJson(Files.readString(symbols),
                new TypeToken<Map<String, Long>>() { }.getType());
        assertThat(byName).containsEntry("MAIN", 0L);

        CommandLine disasm = CommandLineInterface.createCommandLine();
        StringWriter listing = new StringWriter();
        disasm.setOut(new PrintWriter(listing));
        int disasmExit = disasm.execute("disasm", code.toString(), "-s", symbols.toString());

        assertThat(disasmExit).isZero();
        assertThat(listing.toString()).isEqualTo("MAIN:\n    neg $v0, 42\n    j MAIN\n");
    }

    @Test
    void testDiagnosticsErrorsFailWithoutOutput() throws Exception {
        Path src = source("MAIN:\n    j NOWHERE\n");
        Path code = tempDir.resolve("main.bin");

        int exitCode = cmd.execute("asm", src.toString(), "-o", code.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_DIAGNOSTICS);
        assertThat(err.toString())
                .contains("error: Could not find the definition of `NOWHERE`")
                .contains("main.snr:2:7");
        assertThat(code).doesNotExist();
    }

    @Test
    void testMissingSourceFile() {
        int exitCode = cmd.execute("asm", tempDir.resolve("absent.snr").toString(),
                "-o", tempDir.resolve("out.bin").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_IO);
        assertThat(err.toString()).contains("cannot read");
    }

    @Test
    void testOutputIsRequired() throws Exception {
        Path src = source("MAIN:\n    EXIT\n");

        int exitCode = cmd.execute("asm", src.toString());

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("--output");
    }

    @Test
    void testBaseAddressOption() throws Exception {
        Path src = source("ABOBA:\n    j ABOBA\n");
        Path code = tempDir.resolve("main.bin");

        int exitCode = cmd.execute("asm", src.toString(), "-o", code.toString(), "-b", "128");

        assertThat(exitCode).isZero();
        assertThat(HexFormat.of().formatHex(Files.readAllBytes(code))).isEqualTo("4780000000");
    }

    @Test
    void testDisassembleReportsDecodingErrors() throws Exception {
        Path code = tempDir.resolve("bad.bin");
        Files.write(code, HexFormat.of().parseHex("4100000005" + "43"));

        int exitCode = cmd.execute("disasm", code.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_DIAGNOSTICS);
        assertThat(out.toString()).isEqualTo("    mov $v0, 5\n");
        assertThat(err.toString()).startsWith("error: ").contains("(bytes 5..");
    }

    @Test
    void testDisassembleWithEmptySymbolMap() throws Exception {
        Path code = tempDir.resolve("main.bin");
        Files.write(code, HexFormat.of().parseHex("4100000005"));
        Path symbols = tempDir.resolve("empty.json");
        Files.writeString(symbols, "");

        int exitCode = cmd.execute("disasm", code.toString(), "-s", symbols.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("    mov $v0, 5\n");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void testLexWithoutTrivia() throws Exception {
        Path src = source("mov $v0, 1 // set\n");

        int exitCode = cmd.execute("lex", "--no-trivia", src.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines())
                .startsWith("IDENTIFIER@0 'mov'")
                .noneMatch(line -> line.contains("// set"));
    }

    @Test
    void testLexReportsInvalidCharacters() throws Exception {
        Path src = source("mov ?\n");

        int exitCode = cmd.execute("lex", src.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_DIAGNOSTICS);
        assertThat(err.toString()).contains("Invalid character `?`");
    }
}
