package org.snrasm.compiler.diagnostics;

/**
 * A half-open character range {@code [start, end)} in a source text.
 *
 * @param start The offset of the first character.
 * @param end   The offset after the last character.
 */
public record Span(int start, int end) {

    /** An empty span at offset zero, used where no source position exists. */
    public static final Span NONE = new Span(0, 0);

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * Creates an empty span at the given offset.
     * @param offset The offset.
     * @return The empty span.
     */
    public static Span at(int offset) {
        return new Span(offset, offset);
    }

    public int length() {
        return end - start;
    }

    /**
     * Moves this span by the given delta.
     * @param delta The number of characters to move by, may be negative.
     * @return The moved span.
     */
    public Span shift(int delta) {
        return delta == 0 ? this : new Span(start + delta, end + delta);
    }

    /**
     * Returns the smallest span containing both this span and the other one.
     * @param other The other span.
     * @return The covering span.
     */
    public Span cover(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
