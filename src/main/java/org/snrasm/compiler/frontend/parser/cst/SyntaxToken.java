package org.snrasm.compiler.frontend.parser.cst;

import org.snrasm.compiler.diagnostics.Span;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.lexer.TokenType;

/**
 * A leaf of the concrete syntax tree.
 */
public record SyntaxToken(Token token) implements SyntaxElement {

    public TokenType type() {
        return token.type();
    }

    @Override
    public Span span() {
        return token.span();
    }

    @Override
    public String text() {
        return token.text();
    }

    @Override
    public SyntaxToken shift(int delta) {
        return delta == 0 ? this : new SyntaxToken(token.shift(delta));
    }
}
