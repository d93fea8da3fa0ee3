package org.snrasm.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("unit")
    public void testCliInitialization() {
        CommandLine cmd = CommandLineInterface.createCommandLine();
        assertThat(cmd.getCommandName()).isEqualTo("snrasm");
        assertThat(cmd.getSubcommands()).containsKeys("asm", "disasm", "lex", "help");
    }

    @Test
    @Tag("unit")
    public void testMissingConfigFileIsAnIoError() throws Exception {
        Path source = tempDir.resolve("main.snr");
        Files.writeString(source, "MAIN:\n    EXIT\n");
        StringWriter err = new StringWriter();
        CommandLine cmd = CommandLineInterface.createCommandLine();
        cmd.setErr(new PrintWriter(err));

        int exitCode = cmd.execute("-c", tempDir.resolve("missing.conf").toString(),
                "asm", source.toString(), "-o", tempDir.resolve("out.bin").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_IO);
        assertThat(err.toString()).contains("invalid configuration").contains("missing.conf");
        assertThat(tempDir.resolve("out.bin")).doesNotExist();
    }

    @Test
    @Tag("unit")
    public void testConfigFileOverridesDefaults() throws Exception {
        Path source = tempDir.resolve("main.snr");
        Files.writeString(source, "ABOBA:\n    j ABOBA\n");
        Path conf = tempDir.resolve("snrasm.conf");
        Files.writeString(conf, "snrasm.base-address = 128\n");
        Path output = tempDir.resolve("out.bin");

        int exitCode = CommandLineInterface.createCommandLine()
                .execute("-c", conf.toString(), "asm", source.toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readAllBytes(output)).containsExactly(0x47, 0x80, 0x00, 0x00, 0x00);
    }
}
