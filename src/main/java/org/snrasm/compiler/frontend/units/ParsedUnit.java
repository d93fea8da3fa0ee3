package org.snrasm.compiler.frontend.units;

import org.snrasm.compiler.diagnostics.Diagnostic;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;

import java.util.List;

/**
 * The syntax tree of one unit. Offsets in the tree and in the diagnostics are relative to
 * the start of the unit, so the result can be reused when the unit moves within the file.
 *
 * @param unit        The unit.
 * @param root        The {@code SOURCE_FILE} node of the unit.
 * @param diagnostics The lexer and parser diagnostics of the unit.
 */
public record ParsedUnit(SourceUnit unit, SyntaxNode root, List<Diagnostic> diagnostics) {

    public ParsedUnit {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @param unit The unit at its current position.
     * @return This parse result attached to the given unit.
     */
    public ParsedUnit relocate(SourceUnit unit) {
        return new ParsedUnit(unit, root, diagnostics);
    }
}
