package org.snrasm.compiler.api;

import org.snrasm.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The outcome of disassembling a code block.
 *
 * @param text        The listing; partial when decoding stopped early.
 * @param diagnostics Decoding errors and reassembly warnings. Spans are byte ranges of the block.
 */
public record DisassemblyResult(String text, List<Diagnostic> diagnostics) {

    public DisassemblyResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }
}
