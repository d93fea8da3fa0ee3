package org.snrasm.compiler.frontend.lexer;

import org.snrasm.compiler.diagnostics.Span;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 * Tokens are lossless: concatenating the text of all tokens of a file yields the file.
 *
 * @param type   The type of the token.
 * @param text   The exact text of the token from the source code.
 * @param offset The character offset where the token begins.
 */
public record Token(TokenType type, String text, int offset) {

    public Span span() {
        return new Span(offset, offset + text.length());
    }

    public int end() {
        return offset + text.length();
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    /**
     * Returns a copy of this token moved by the given delta.
     * @param delta The offset delta.
     * @return The moved token.
     */
    public Token shift(int delta) {
        return delta == 0 ? this : new Token(type, text, offset + delta);
    }

    @Override
    public String toString() {
        return type + "@" + offset + " '" + text.replace("\n", "\\n") + "'";
    }
}
