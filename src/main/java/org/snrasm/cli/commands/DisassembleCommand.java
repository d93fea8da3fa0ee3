package org.snrasm.cli.commands;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snrasm.cli.CommandLineInterface;
import org.snrasm.compiler.Compiler;
import org.snrasm.compiler.api.AssemblerOptions;
import org.snrasm.compiler.api.DisassemblyResult;
import org.snrasm.compiler.diagnostics.Diagnostic;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "disasm", description = "Prints a code block as re-assemblable source.")
public class DisassembleCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(DisassembleCommand.class);
    private static final Type SYMBOL_MAP = new TypeToken<Map<String, Long>>() { }.getType();

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", description = "The code block.")
    private File file;

    @Option(names = {"-s", "--symbols"}, description = "A JSON symbol map as written by `asm --symbols`.")
    private File symbols;

    @Option(names = {"-o", "--output"}, description = "Writes the listing to this file instead of standard output.")
    private File output;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        byte[] code;
        Map<Long, String> names = new HashMap<>();
        try {
            code = Files.readAllBytes(file.toPath());
            if (symbols != null) {
                Map<String, Long> byName = new Gson().fromJson(Files.readString(symbols.toPath(), StandardCharsets.UTF_8), SYMBOL_MAP);
                // an empty file parses to null
                if (byName != null) {
                    byName.forEach((name, address) -> names.putIfAbsent(address, name));
                }
            }
        } catch (IOException | JsonParseException e) {
            err.println("error: cannot read input: " + e.getMessage());
            return CommandLineInterface.EXIT_IO;
        }

        AssemblerOptions options;
        try {
            options = AssemblerOptions.fromConfig(parent.getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("error: invalid configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_IO;
        }

        DisassemblyResult result;
        try (Compiler compiler = new Compiler(options)) {
            result = compiler.disassembler().disassemble(code, names);
        }
        result.diagnostics().forEach(d -> err.println(d.type().name().toLowerCase() + ": " + d.message()
                + " (bytes " + d.span().start() + ".." + d.span().end() + ")"));

        if (output != null) {
            try {
                Files.writeString(output.toPath(), result.text(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("error: cannot write " + output + ": " + e.getMessage());
                return CommandLineInterface.EXIT_IO;
            }
        } else {
            out.print(result.text());
            out.flush();
        }
        long warnings = result.diagnostics().stream().filter(d -> d.type() == Diagnostic.Type.WARNING).count();
        LOG.info("Disassembled {} ({} bytes, {} warning(s))", file, code.length, warnings);
        return result.hasErrors() ? CommandLineInterface.EXIT_DIAGNOSTICS : 0;
    }
}
