package org.snrasm.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName     The file where the code is located.
 * @param lineNumber   The line number, starting at 1.
 * @param columnNumber The column number, starting at 1.
 * @param lineContent  The content of the line, without the line terminator.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber, String lineContent) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
