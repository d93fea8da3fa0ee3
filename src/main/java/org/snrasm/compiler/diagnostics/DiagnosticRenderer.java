package org.snrasm.compiler.diagnostics;

import org.snrasm.compiler.api.SourceInfo;

import java.util.List;

/**
 * Renders diagnostics with their source context for terminal output.
 * <pre>
 * error: Could not find the definition of `FOO`
 *   --&gt; main.sal:3:7
 *    |
 *  3 |     j FOO
 *    |       ^^^
 * </pre>
 */
public final class DiagnosticRenderer {

    private final LineIndex lines;

    /**
     * @param lines The line index of the source the diagnostics refer to.
     */
    public DiagnosticRenderer(LineIndex lines) {
        this.lines = lines;
    }

    /**
     * Renders a list of diagnostics separated by blank lines.
     * @param diagnostics The diagnostics.
     * @return The rendered text.
     */
    public String render(List<Diagnostic> diagnostics) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(render(d));
        }
        return sb.toString();
    }

    /**
     * Renders one diagnostic with its primary span and secondary labels.
     * @param diagnostic The diagnostic.
     * @return The rendered text, ending with a newline.
     */
    public String render(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();
        sb.append(diagnostic.type().name().toLowerCase()).append(": ").append(diagnostic.message()).append('\n');
        appendSnippet(sb, diagnostic.span(), null);
        for (Diagnostic.Label label : diagnostic.labels()) {
            appendSnippet(sb, label.span(), label.message());
        }
        return sb.toString();
    }

    private void appendSnippet(StringBuilder sb, Span span, String note) {
        SourceInfo info = lines.sourceInfo(span.start());
        String gutter = " ".repeat(String.valueOf(info.lineNumber()).length());
        sb.append(gutter).append("--> ").append(info).append('\n');
        sb.append(gutter).append(" |\n");
        sb.append(info.lineNumber()).append(" | ").append(info.lineContent()).append('\n');
        int lineRemainder = Math.max(1, info.lineContent().length() - info.columnNumber() + 1);
        int width = Math.max(1, Math.min(span.length(), lineRemainder));
        sb.append(gutter).append(" | ")
                .append(" ".repeat(info.columnNumber() - 1))
                .append("^".repeat(width));
        if (note != null) {
            sb.append(' ').append(note);
        }
        sb.append('\n');
    }
}
