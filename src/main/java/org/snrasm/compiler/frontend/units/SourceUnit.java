package org.snrasm.compiler.frontend.units;

import org.snrasm.compiler.diagnostics.Span;

/**
 * A slice of a source file that is lexed, parsed and encoded on its own.
 *
 * @param index  The position of the unit in the file.
 * @param offset The character offset of the unit in the file.
 * @param text   The text of the unit.
 */
public record SourceUnit(int index, int offset, String text) {

    public Span span() {
        return new Span(offset, offset + text.length());
    }

    public String name() {
        return "unit#" + index;
    }
}
