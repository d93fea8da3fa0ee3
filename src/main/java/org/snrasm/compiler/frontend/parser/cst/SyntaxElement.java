package org.snrasm.compiler.frontend.parser.cst;

import org.snrasm.compiler.diagnostics.Span;

/**
 * A child of a {@link SyntaxNode}: either another node or a token.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {

    Span span();

    String text();

    /**
     * Returns a copy of this element with every offset moved by the delta.
     * @param delta The offset delta.
     * @return The moved element.
     */
    SyntaxElement shift(int delta);
}
