package org.snrasm.compiler.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the scenario assembler.
 */
public interface ICompiler {

    /**
     * Assembles a source file. Errors never abort the run; they are returned as diagnostics
     * next to whatever code could be produced.
     *
     * @param source   The source text.
     * @param fileName The file name attached to diagnostics.
     * @return The code block, the global symbols and all diagnostics.
     */
    AssemblyResult assemble(String source, String fileName);

    /**
     * Assembles a source file and fails on the first run that reports an error.
     *
     * @param source   The source text.
     * @param fileName The file name attached to diagnostics.
     * @return The result of a run without errors; it may still contain warnings.
     * @throws CompilationException if any error was reported.
     */
    default AssemblyResult assembleOrThrow(String source, String fileName) throws CompilationException {
        AssemblyResult result = assemble(source, fileName);
        if (result.hasErrors()) {
            StringBuilder summary = new StringBuilder();
            result.diagnostics().forEach(d -> summary.append(summary.length() > 0 ? "\n" : "").append(d));
            throw new CompilationException(summary.toString(), result.diagnostics());
        }
        return result;
    }

    /**
     * Assembles a UTF-8 source file from disk.
     * @param path The path of the file.
     * @return The assembly result.
     * @throws IOException if the file cannot be read.
     */
    default AssemblyResult assemble(Path path) throws IOException {
        return assemble(Files.readString(path, StandardCharsets.UTF_8), path.toString());
    }
}
