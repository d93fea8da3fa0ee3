package org.snrasm.compiler.frontend.parser.cst;

import org.snrasm.compiler.diagnostics.Span;
import org.snrasm.compiler.frontend.lexer.Token;
import org.snrasm.compiler.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An inner node of the lossless concrete syntax tree. Children are kept in source order,
 * trivia included, so the text of the root is exactly the parsed input.
 */
public final class SyntaxNode implements SyntaxElement {

    private final SyntaxKind kind;
    private final List<SyntaxElement> children;
    private final int offset;

    /**
     * @param kind     The node kind.
     * @param children The children in source order.
     * @param offset   The start offset, used for the span of empty nodes.
     */
    public SyntaxNode(SyntaxKind kind, List<SyntaxElement> children, int offset) {
        this.kind = kind;
        this.children = List.copyOf(children);
        this.offset = children.isEmpty() ? offset : children.get(0).span().start();
    }

    public SyntaxKind kind() {
        return kind;
    }

    public List<SyntaxElement> children() {
        return children;
    }

    @Override
    public Span span() {
        if (children.isEmpty()) {
            return Span.at(offset);
        }
        return new Span(offset, children.get(children.size() - 1).span().end());
    }

    @Override
    public String text() {
        StringBuilder sb = new StringBuilder();
        appendText(sb);
        return sb.toString();
    }

    private void appendText(StringBuilder sb) {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node) {
                node.appendText(sb);
            } else {
                sb.append(child.text());
            }
        }
    }

    /**
     * Returns the span covering the significant tokens only, without leading or trailing trivia.
     * Diagnostics point at this span.
     * @return The trimmed span.
     */
    public Span significantSpan() {
        List<Token> tokens = significantTokens();
        if (tokens.isEmpty()) {
            return span();
        }
        return new Span(tokens.get(0).offset(), tokens.get(tokens.size() - 1).end());
    }

    /**
     * Returns the source text of the significant tokens, with the trivia between them.
     * @return The trimmed text.
     */
    public String significantText() {
        Span s = significantSpan();
        String text = text();
        int base = span().start();
        return text.substring(s.start() - base, s.end() - base);
    }

    @Override
    public SyntaxNode shift(int delta) {
        if (delta == 0) {
            return this;
        }
        List<SyntaxElement> moved = new ArrayList<>(children.size());
        for (SyntaxElement child : children) {
            moved.add(child.shift(delta));
        }
        return new SyntaxNode(kind, moved, offset + delta);
    }

    public List<SyntaxNode> childNodes() {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    public List<SyntaxNode> childNodes(SyntaxKind kind) {
        return childNodes().stream().filter(n -> n.kind == kind).toList();
    }

    public Optional<SyntaxNode> firstChild(SyntaxKind kind) {
        return childNodes().stream().filter(n -> n.kind == kind).findFirst();
    }

    /**
     * @return The direct child tokens that are not trivia or newlines.
     */
    public List<Token> childTokens() {
        List<Token> tokens = new ArrayList<>();
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxToken t && !t.type().isTrivia() && t.type() != TokenType.NEWLINE) {
                tokens.add(t.token());
            }
        }
        return tokens;
    }

    public Optional<Token> firstToken(TokenType type) {
        return childTokens().stream().filter(t -> t.type() == type).findFirst();
    }

    /**
     * @return All non-trivia tokens in this subtree, newlines excluded.
     */
    public List<Token> significantTokens() {
        List<Token> tokens = new ArrayList<>();
        forEachToken(t -> {
            if (!t.type().isTrivia() && t.type() != TokenType.NEWLINE && t.type() != TokenType.END_OF_FILE) {
                tokens.add(t);
            }
        });
        return tokens;
    }

    /**
     * Visits every token of the subtree in source order, trivia included.
     * @param action The visitor.
     */
    public void forEachToken(Consumer<Token> action) {
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node) {
                node.forEachToken(action);
            } else if (child instanceof SyntaxToken t) {
                action.accept(t.token());
            }
        }
    }

    /**
     * Visits this node and all descendant nodes in pre-order.
     * @param action The visitor.
     */
    public void walk(Consumer<SyntaxNode> action) {
        action.accept(this);
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node) {
                node.walk(action);
            }
        }
    }

    /**
     * Renders the tree structure, one element per line, for debugging and tests.
     * @return The indented dump.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        dump(sb, 0);
        return sb.toString();
    }

    private void dump(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth)).append(kind).append('@').append(span()).append('\n');
        for (SyntaxElement child : children) {
            if (child instanceof SyntaxNode node) {
                node.dump(sb, depth + 1);
            } else if (child instanceof SyntaxToken t) {
                sb.append("  ".repeat(depth + 1)).append(t.token()).append('\n');
            }
        }
    }

    @Override
    public String toString() {
        return kind + "@" + span();
    }
}
