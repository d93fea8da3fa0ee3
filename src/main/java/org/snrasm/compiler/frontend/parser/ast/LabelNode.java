package org.snrasm.compiler.frontend.parser.ast;

import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;

/**
 * {@code NAME:}
 */
public record LabelNode(SyntaxNode syntax) implements AstNode {

    public Token name() {
        return syntax.childTokens().get(0);
    }
}
