package org.snrasm.cli.commands;

import org.snrasm.cli.CommandLineInterface;
import org.snrasm.compiler.diagnostics.DiagnosticRenderer;
import org.snrasm.compiler.diagnostics.DiagnosticsEngine;
import org.snrasm.compiler.diagnostics.LineIndex;
import org.snrasm.compiler.frontend.lexer.Lexer;
import org.snrasm.compiler.frontend.lexer.Token;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "lex", description = "Prints the tokens of a source file.")
public class LexCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The UTF-8 source file.")
    private File file;

    @Option(names = "--no-trivia", description = "Leaves out whitespace and comments.")
    private boolean noTrivia;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("error: cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO;
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine(file.getPath());
        for (Token token : new Lexer(source, diagnostics).scanTokens()) {
            if (noTrivia && token.type().isTrivia()) {
                continue;
            }
            out.println(token);
        }
        out.flush();
        if (!diagnostics.getDiagnostics().isEmpty()) {
            err.println(new DiagnosticRenderer(new LineIndex(file.getPath(), source)).render(diagnostics.getDiagnostics()));
        }
        return diagnostics.hasErrors() ? CommandLineInterface.EXIT_DIAGNOSTICS : 0;
    }
}
