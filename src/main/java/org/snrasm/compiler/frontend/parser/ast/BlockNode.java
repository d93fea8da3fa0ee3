package org.snrasm.compiler.frontend.parser.ast;

import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * A top-level script block, optionally introduced by a label.
 */
public record BlockNode(SyntaxNode syntax) implements AstNode {

    public Optional<LabelNode> label() {
        return syntax.firstChild(SyntaxKind.LABEL).map(LabelNode::new);
    }

    /**
     * @return The labels and instructions of the block in source order.
     */
    public List<AstNode> statements() {
        return syntax.childNodes().stream()
                .filter(n -> n.kind() == SyntaxKind.LABEL || n.kind() == SyntaxKind.INSTRUCTION)
                .map(AstNode::of)
                .toList();
    }

    public boolean isJumpTableBlock() {
        return syntax.kind() == SyntaxKind.JUMP_TABLE_BLOCK;
    }
}
