package org.snrasm.compiler.frontend.parser.ast;

import org.snrasm.compiler.diagnostics.Span;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;

/**
 * A typed view over a concrete syntax node. Views hold no state of their own;
 * the syntax tree stays the single source of truth.
 */
public interface AstNode {

    SyntaxNode syntax();

    default Span span() {
        return syntax().significantSpan();
    }

    /**
     * Creates the typed view for an item-level node.
     * @param node The node.
     * @return The view, or {@code null} for kinds without one.
     */
    static AstNode of(SyntaxNode node) {
        return switch (node.kind()) {
            case ALIAS_DEF -> new AliasDefNode(node);
            case FUNCTION_DEF, SUBROUTINE_DEF -> new RoutineNode(node);
            case LABEL -> new LabelNode(node);
            case INSTRUCTION -> new InstructionNode(node);
            case SCRIPT_BLOCK, JUMP_TABLE_BLOCK -> new BlockNode(node);
            default -> null;
        };
    }

    static boolean isItem(SyntaxKind kind) {
        return kind == SyntaxKind.ALIAS_DEF || kind == SyntaxKind.FUNCTION_DEF || kind == SyntaxKind.SUBROUTINE_DEF
                || kind == SyntaxKind.SCRIPT_BLOCK || kind == SyntaxKind.JUMP_TABLE_BLOCK;
    }
}
