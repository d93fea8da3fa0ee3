package org.snrasm.compiler.frontend.units;

import org.snrasm.compiler.frontend.lexer.Lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a source file into independently compilable units without tokenizing it.
 * <p>
 * A new unit starts at every {@code function}/{@code subroutine} header, at the line after
 * {@code endfun}/{@code endsub}, at top-level labels and at the first of a run of
 * {@code def} lines. Block comments (which nest) and line continuations are tracked so
 * that commented-out code and continued lines never cause a split. Units always begin at
 * the start of a line, and concatenating their texts yields the file.
 */
public final class UnitSplitter {

    private enum LineStart { NONE, ROUTINE, ROUTINE_END, DEF, LABEL, OTHER }

    private final String text;
    private int commentDepth = 0;

    public UnitSplitter(String text) {
        this.text = text;
    }

    public static List<SourceUnit> split(String text) {
        return new UnitSplitter(text).split();
    }

    /**
     * @return The units in file order; an empty file yields one empty unit.
     */
    public List<SourceUnit> split() {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        boolean inRoutine = false;
        boolean splitAfterLine = false;
        LineStart previous = LineStart.NONE;

        int lineStart = 0;
        while (lineStart < text.length()) {
            int depthAtStart = commentDepth;
            int lineEnd = logicalLineEnd(lineStart);
            LineStart kind = classify(lineStart, lineEnd, depthAtStart);

            boolean split = false;
            if (splitAfterLine && kind != LineStart.NONE) {
                split = true;
                splitAfterLine = false;
            }
            switch (kind) {
                case ROUTINE -> {
                    split = true;
                    inRoutine = true;
                }
                case ROUTINE_END -> {
                    if (inRoutine) {
                        inRoutine = false;
                        splitAfterLine = true;
                    }
                }
                case DEF -> {
                    if (inRoutine || previous != LineStart.DEF) {
                        split = true;
                    }
                    inRoutine = false;
                }
                case LABEL -> {
                    if (!inRoutine) {
                        split = true;
                    }
                }
                default -> {
                }
            }
            if (split && lineStart > starts.get(starts.size() - 1)) {
                starts.add(lineStart);
            }
            if (kind != LineStart.NONE) {
                previous = kind;
            }
            lineStart = lineEnd;
        }

        List<SourceUnit> units = new ArrayList<>();
        for (int i = 0; i < starts.size(); i++) {
            int start = starts.get(i);
            int end = i + 1 < starts.size() ? starts.get(i + 1) : text.length();
            units.add(new SourceUnit(i, start, text.substring(start, end)));
        }
        return units;
    }

    /**
     * Finds the end of the logical line starting at {@code start}, following continuations
     * and updating the block comment depth.
     * @return The offset after the terminating newline, or the end of the text.
     */
    private int logicalLineEnd(int start) {
        int i = start;
        boolean inString = false;
        while (i < text.length()) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';
            if (commentDepth > 0) {
                if (c == '/' && next == '*') {
                    commentDepth++;
                    i += 2;
                    continue;
                }
                if (c == '*' && next == '/') {
                    commentDepth--;
                    i += 2;
                    continue;
                }
                i++;
                continue;
            }
            if (inString) {
                if (c == '\\' && next != '\n' && next != '\0') {
                    i += 2;
                    continue;
                }
                if (c == '"' || c == '\n') {
                    inString = false;
                    if (c == '\n') {
                        return i + 1;
                    }
                }
                i++;
                continue;
            }
            if (c == '\n') {
                return i + 1;
            }
            if (c == '\\' && (next == '\n' || (next == '\r' && i + 2 < text.length() && text.charAt(i + 2) == '\n'))) {
                i += next == '\n' ? 2 : 3;
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '/' && next == '/') {
                while (i < text.length() && text.charAt(i) != '\n') i++;
                continue;
            } else if (c == '/' && next == '*') {
                commentDepth++;
                i += 2;
                continue;
            }
            i++;
        }
        return text.length();
    }

    /**
     * Classifies a logical line by its first significant word.
     */
    private LineStart classify(int start, int end, int depthAtStart) {
        int i = firstSignificant(start, end, depthAtStart);
        if (i >= end) {
            return LineStart.NONE;
        }
        int wordEnd = i;
        while (wordEnd < end && (text.charAt(wordEnd) == '_' || Character.isLetterOrDigit(text.charAt(wordEnd)))) {
            wordEnd++;
        }
        if (wordEnd == i || Character.isDigit(text.charAt(i))) {
            return LineStart.OTHER;
        }
        String word = text.substring(i, wordEnd);
        if (Lexer.KEYWORDS.contains(word)) {
            return switch (word) {
                case "function", "subroutine" -> LineStart.ROUTINE;
                case "endfun", "endsub" -> LineStart.ROUTINE_END;
                default -> LineStart.DEF;
            };
        }
        int j = wordEnd;
        while (j < end && (text.charAt(j) == ' ' || text.charAt(j) == '\t')) j++;
        if (j < end && text.charAt(j) == ':') {
            return LineStart.LABEL;
        }
        return LineStart.OTHER;
    }

    private int firstSignificant(int start, int end, int depthAtStart) {
        int depth = depthAtStart;
        int i = start;
        int result = end;
        while (i < end) {
            char c = text.charAt(i);
            char next = i + 1 < end ? text.charAt(i + 1) : '\0';
            if (depth > 0) {
                if (c == '/' && next == '*') {
                    depth++;
                    i += 2;
                } else if (c == '*' && next == '/') {
                    depth--;
                    i += 2;
                } else {
                    i++;
                }
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                i++;
            } else if (c == '\\' && (next == '\n' || next == '\r')) {
                i += 2;
            } else if (c == '/' && next == '*') {
                depth++;
                i += 2;
            } else if (c == '/' && next == '/') {
                result = end;
                break;
            } else {
                result = i;
                break;
            }
        }
        return result;
    }
}
