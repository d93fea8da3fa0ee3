package org.snrasm.compiler.frontend.parser.cst;

import org.snrasm.compiler.frontend.lexer.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Incrementally assembles a {@link SyntaxNode} tree from start/token/finish events.
 * Checkpoints allow wrapping already emitted children into a new node, which the
 * expression parser needs for left-associative binary operators.
 */
public final class TreeBuilder {

    private static final class Frame {
        final SyntaxKind kind;
        final List<SyntaxElement> children = new ArrayList<>();
        final int offset;

        Frame(SyntaxKind kind, int offset) {
            this.kind = kind;
            this.offset = offset;
        }
    }

    private final Deque<Frame> stack = new ArrayDeque<>();
    private int lastOffset = 0;

    /**
     * A position among the children of the currently open node.
     *
     * @param depth The nesting depth at which it was taken.
     * @param index The child index.
     */
    public record Checkpoint(int depth, int index) {}

    public void startNode(SyntaxKind kind) {
        stack.push(new Frame(kind, lastOffset));
    }

    public void token(Token token) {
        current().children.add(new SyntaxToken(token));
        lastOffset = token.end();
    }

    public void finishNode() {
        Frame frame = stack.pop();
        SyntaxNode node = new SyntaxNode(frame.kind, frame.children, frame.offset);
        if (stack.isEmpty()) {
            stack.push(rootHolder(node));
        } else {
            current().children.add(node);
        }
    }

    public Checkpoint checkpoint() {
        return new Checkpoint(stack.size(), current().children.size());
    }

    /**
     * Opens a node that adopts every child emitted since the checkpoint.
     * @param checkpoint A checkpoint taken in the currently open node.
     * @param kind       The kind of the new node.
     */
    public void startNodeAt(Checkpoint checkpoint, SyntaxKind kind) {
        if (checkpoint.depth() != stack.size()) {
            throw new IllegalStateException("Checkpoint taken at a different depth");
        }
        Frame parent = current();
        List<SyntaxElement> adopted = parent.children.subList(checkpoint.index(), parent.children.size());
        int offset = adopted.isEmpty() ? lastOffset : adopted.get(0).span().start();
        Frame frame = new Frame(kind, offset);
        frame.children.addAll(adopted);
        adopted.clear();
        stack.push(frame);
    }

    /**
     * Returns the finished root node.
     * @return The root.
     * @throws IllegalStateException If nodes are still open.
     */
    public SyntaxNode finish() {
        if (stack.size() != 1 || stack.peek().kind != null) {
            throw new IllegalStateException("Unbalanced tree builder events");
        }
        return (SyntaxNode) stack.pop().children.get(0);
    }

    private static Frame rootHolder(SyntaxNode root) {
        Frame holder = new Frame(null, root.span().start());
        holder.children.add(root);
        return holder;
    }

    private Frame current() {
        Frame frame = stack.peek();
        if (frame == null || frame.kind == null) {
            throw new IllegalStateException("No open node");
        }
        return frame;
    }
}
