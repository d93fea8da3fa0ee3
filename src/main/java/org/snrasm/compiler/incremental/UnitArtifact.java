package org.snrasm.compiler.incremental;

import org.snrasm.compiler.backend.encode.EncodedUnit;
import org.snrasm.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The cached outcome of analyzing, lowering and encoding one unit.
 *
 * @param code        The encoded unit.
 * @param diagnostics The diagnostics of those stages, with spans relative to the unit.
 */
public record UnitArtifact(EncodedUnit code, List<Diagnostic> diagnostics) {

    public UnitArtifact {
        diagnostics = List.copyOf(diagnostics);
    }
}
