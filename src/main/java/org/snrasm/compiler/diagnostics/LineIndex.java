package org.snrasm.compiler.diagnostics;

import org.snrasm.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets of a source text to line and column numbers.
 */
public final class LineIndex {

    private final String fileName;
    private final String text;
    private final int[] lineStarts;

    /**
     * Indexes the given text.
     * @param fileName The file name reported in {@link SourceInfo}.
     * @param text     The source text.
     */
    public LineIndex(String fileName, String text) {
        this.fileName = fileName;
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Returns the zero-based line index containing the offset.
     * @param offset The character offset.
     * @return The line index.
     */
    public int lineOf(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    /**
     * Resolves an offset into a full source position.
     * @param offset The character offset.
     * @return The position with one-based line and column numbers.
     */
    public SourceInfo sourceInfo(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int line = lineOf(clamped);
        return new SourceInfo(fileName, line + 1, clamped - lineStarts[line] + 1, lineContent(line));
    }

    /**
     * Returns the text of a line without its terminator.
     * @param line The zero-based line index.
     * @return The line text.
     */
    public String lineContent(int line) {
        int start = lineStarts[line];
        int end = line + 1 < lineStarts.length ? lineStarts[line + 1] - 1 : text.length();
        if (end > start && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(start, Math.max(start, end));
    }

    public int lineCount() {
        return lineStarts.length;
    }
}
