package org.snrasm.compiler.api;

import org.snrasm.compiler.diagnostics.Diagnostic;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of assembling a source file. The code is produced even when errors exist,
 * with the failing operands or instructions zeroed or left out; callers must check
 * {@link #hasErrors()} before using it.
 *
 * @param code        The code block.
 * @param symbols     The absolute addresses of global labels, functions and subroutines.
 * @param diagnostics Everything reported while assembling, with file spans.
 */
public record AssemblyResult(byte[] code, Map<String, Long> symbols, List<Diagnostic> diagnostics) {

    public AssemblyResult {
        code = code.clone();
        symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
        diagnostics = List.copyOf(diagnostics);
    }

    @Override
    public byte[] code() {
        return code.clone();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AssemblyResult other
                && Arrays.equals(code, other.code)
                && symbols.equals(other.symbols)
                && diagnostics.equals(other.diagnostics);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(code) + symbols.hashCode()) + diagnostics.hashCode();
    }

    @Override
    public String toString() {
        return "AssemblyResult{" + code.length + " bytes, " + symbols.size() + " symbols, "
                + diagnostics.size() + " diagnostics}";
    }
}
