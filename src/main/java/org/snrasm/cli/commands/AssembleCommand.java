package org.snrasm.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snrasm.cli.CommandLineInterface;
import org.snrasm.compiler.Compiler;
import org.snrasm.compiler.api.AssemblerOptions;
import org.snrasm.compiler.api.AssemblyResult;
import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.diagnostics.DiagnosticRenderer;
import org.snrasm.compiler.diagnostics.LineIndex;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "asm", description = "Assembles a source file into a code block.")
public class AssembleCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AssembleCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", description = "The UTF-8 source file.")
    private File file;

    @Option(names = {"-o", "--output"}, required = true, description = "The file the code block is written to.")
    private File output;

    @Option(names = {"-s", "--symbols"}, description = "Writes the global symbol addresses as JSON to this file.")
    private File symbols;

    @Option(names = {"-b", "--base-address"}, description = "Overrides the configured load address.")
    private Long baseAddress;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("error: cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO;
        }

        AssemblerOptions options;
        try {
            options = AssemblerOptions.fromConfig(parent.getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("error: invalid configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_IO;
        }
        if (baseAddress != null) {
            options = options.withBaseAddress(baseAddress);
        }

        AssemblyResult result;
        try (Compiler compiler = new Compiler(options)) {
            result = compiler.assemble(source, file.getPath());
        }
        if (!result.diagnostics().isEmpty()) {
            err.println(new DiagnosticRenderer(new LineIndex(file.getPath(), source)).render(result.diagnostics()));
        }
        if (result.hasErrors()) {
            long errors = result.diagnostics().stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
            LOG.info("Assembly of {} failed with {} error(s)", file, errors);
            return CommandLineInterface.EXIT_DIAGNOSTICS;
        }

        try {
            Files.write(output.toPath(), result.code());
            if (symbols != null) {
                Gson gson = new GsonBuilder().setPrettyPrinting().create();
                Files.writeString(symbols.toPath(), gson.toJson(result.symbols()), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            err.println("error: cannot write output: " + e.getMessage());
            return CommandLineInterface.EXIT_IO;
        }
        LOG.info("Assembled {} into {} ({} bytes, {} symbols)", file, output, result.code().length, result.symbols().size());
        return 0;
    }
}
