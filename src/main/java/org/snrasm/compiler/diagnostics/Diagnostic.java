package org.snrasm.compiler.diagnostics;

import java.util.List;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs while assembling or disassembling.
 *
 * @param type     The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message  The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param span     The primary source span of the issue. For disassembly this is a byte range.
 * @param labels   Secondary spans with their own messages, e.g. "first defined here".
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        Span span,
        List<Label> labels
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that makes the request fail. */
        ERROR,
        /** A warning that never blocks output. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * A secondary span attached to a diagnostic.
     *
     * @param span    The span.
     * @param message What the span shows.
     */
    public record Label(Span span, String message) {
        public Label shift(int delta) {
            return new Label(span.shift(delta), message);
        }
    }

    public Diagnostic {
        labels = List.copyOf(labels);
    }

    /**
     * Moves the primary span and all labels by the given delta.
     * @param delta The character delta.
     * @return The moved diagnostic.
     */
    public Diagnostic shift(int delta) {
        if (delta == 0) {
            return this;
        }
        return new Diagnostic(type, message, fileName, span.shift(delta),
                labels.stream().map(l -> l.shift(delta)).toList());
    }

    @Override
    public String toString() {
        return String.format("[%s] %s@%s: %s", type, fileName, span, message);
    }
}
