package org.snrasm.compiler.frontend.parser.ast;

import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.lexer.TokenType;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;

import java.util.Optional;

/**
 * {@code def NAME = expr} or {@code def $name = $reg}.
 */
public record AliasDefNode(SyntaxNode syntax) implements AstNode {

    public Optional<Token> name() {
        return syntax.childTokens().stream()
                .filter(t -> t.type() == TokenType.IDENTIFIER || t.type() == TokenType.REGISTER)
                .findFirst();
    }

    public boolean isRegisterAlias() {
        return name().map(t -> t.type() == TokenType.REGISTER).orElse(false);
    }

    public Optional<SyntaxNode> value() {
        return syntax.childNodes().stream().filter(n -> n.kind().isExpression()).findFirst();
    }
}
