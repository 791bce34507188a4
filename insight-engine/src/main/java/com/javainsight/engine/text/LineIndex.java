package com.javainsight.engine.text;

import java.util.Arrays;

/**
 * Maps char offsets of a source text to 1-based line numbers.
 * Built once per analysis pass; each lookup is a binary search.
 */
public final class LineIndex {

    private final int[] lineStarts;

    private LineIndex(int[] lineStarts) {
        this.lineStarts = lineStarts;
    }

    /**
     * Records offset 0 plus the offset just after every '\n'.
     */
    public static LineIndex build(String source) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineIndex(Arrays.copyOf(starts, count));
    }

    /**
     * Greatest line start at or before {@code offset}, as a 1-based line. Offsets before the
     * first line start clamp to line 1.
     */
    public int offsetToLine(int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        if (index >= 0) {
            return index + 1;
        }
        // insertion point is the 0-based index of the first start past offset
        return Math.max(1, -index - 1);
    }

    /**
     * Offset of the first char of a 1-based line; lines past the end clamp to the last line.
     */
    public int lineStartOffset(int line) {
        int index = Math.max(0, Math.min(line - 1, lineStarts.length - 1));
        return lineStarts[index];
    }

    /**
     * Text of a 1-based line without its line break, or "" when out of range.
     */
    public String lineText(String source, int line) {
        if (line < 1 || line > lineStarts.length) {
            return "";
        }
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] - 1 : source.length();
        if (end > start && source.charAt(end - 1) == '\r') {
            end--;
        }
        return source.substring(start, Math.max(start, end));
    }

    public int lineCount() { return lineStarts.length; }
}
