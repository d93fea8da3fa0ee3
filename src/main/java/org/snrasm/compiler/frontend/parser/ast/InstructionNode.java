package org.snrasm.compiler.frontend.parser.ast;

import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;

import java.util.List;

/**
 * A mnemonic with its arguments and trailing flags.
 */
public record InstructionNode(SyntaxNode syntax) implements AstNode {

    public Token mnemonic() {
        return syntax.childTokens().get(0);
    }

    /**
     * @return The argument nodes in order: expressions, {@link SyntaxKind#FLAG} nodes and error nodes.
     */
    public List<SyntaxNode> arguments() {
        return syntax.firstChild(SyntaxKind.ARGUMENT_LIST)
                .map(SyntaxNode::childNodes)
                .orElse(List.of());
    }

    public List<SyntaxNode> operands() {
        return arguments().stream().filter(n -> n.kind() != SyntaxKind.FLAG).toList();
    }

    public List<SyntaxNode> flags() {
        return arguments().stream().filter(n -> n.kind() == SyntaxKind.FLAG).toList();
    }
}
