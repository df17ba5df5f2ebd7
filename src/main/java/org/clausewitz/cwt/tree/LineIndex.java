package org.clausewitz.cwt.tree;

import java.util.Arrays;

/**
 * Maps between char offsets and line/column positions of one source buffer.
 */
public final class LineIndex {
    private final int[] lineStarts;
    private final int length;

    private LineIndex(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineIndex of(String source) {
        var starts = new int[16];
        int count = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineIndex(Arrays.copyOf(starts, count), source.length());
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public SourceLocation locationOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int idx = Arrays.binarySearch(lineStarts, clamped);
        int line = idx >= 0 ? idx : -idx - 2;
        return SourceLocation.at(line + 1, clamped - lineStarts[line] + 1, clamped);
    }

    /**
     * Offset of a 1-based line/column pair, clamped to the buffer.
     */
    public int offsetOf(int line, int column) {
        if (line < 1) {
            return 0;
        }
        if (line > lineStarts.length) {
            return length;
        }
        return Math.min(length, lineStarts[line - 1] + Math.max(0, column - 1));
    }
}
