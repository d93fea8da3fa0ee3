package org.snrasm.compiler.frontend.parser.ast;

import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.lexer.TokenType;
import org.snrasm.compiler.frontend.parser.cst.SyntaxKind;
import org.snrasm.compiler.frontend.parser.cst.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A {@code function} or {@code subroutine} definition.
 */
public record RoutineNode(SyntaxNode syntax) implements AstNode {

    /**
     * A preserved register range; {@code last} is null for a single register.
     */
    public record Range(Token first, Token last) {}

    public boolean isSubroutine() {
        return syntax.kind() == SyntaxKind.SUBROUTINE_DEF;
    }

    public Token keyword() {
        return syntax.childTokens().get(0);
    }

    public Optional<Token> name() {
        List<Token> tokens = syntax.childTokens();
        if (tokens.size() > 1 && tokens.get(1).type() == TokenType.IDENTIFIER) {
            return Optional.of(tokens.get(1));
        }
        return Optional.empty();
    }

    public List<Token> parameters() {
        return syntax.firstChild(SyntaxKind.PARAM_LIST)
                .map(p -> p.childTokens().stream().filter(t -> t.type() == TokenType.REGISTER).toList())
                .orElse(List.of());
    }

    public List<Range> preserved() {
        List<Range> ranges = new ArrayList<>();
        syntax.firstChild(SyntaxKind.PRESERVED_LIST).ifPresent(list -> {
            for (SyntaxNode range : list.childNodes(SyntaxKind.REGISTER_RANGE)) {
                List<Token> regs = range.childTokens().stream().filter(t -> t.type() == TokenType.REGISTER).toList();
                if (!regs.isEmpty()) {
                    ranges.add(new Range(regs.get(0), regs.size() > 1 ? regs.get(1) : null));
                }
            }
        });
        return ranges;
    }

    /**
     * @return The labels and instructions of the body in source order.
     */
    public List<AstNode> statements() {
        return syntax.childNodes().stream()
                .filter(n -> n.kind() == SyntaxKind.LABEL || n.kind() == SyntaxKind.INSTRUCTION)
                .map(AstNode::of)
                .toList();
    }

    /**
     * @return The terminating {@code endfun}/{@code endsub} token, if present.
     */
    public Optional<Token> terminator() {
        String keyword = isSubroutine() ? "endsub" : "endfun";
        return syntax.childTokens().stream().filter(t -> t.isKeyword(keyword)).findFirst();
    }
}
