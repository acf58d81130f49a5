package org.typeweave.compiler.sourcemap;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts character offsets of a text into zero-based line and column numbers.
 */
public final class LineIndex {

    private final int[] lineStarts;
    private final int length;

    public LineIndex(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        this.length = text.length();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * @param offset A character offset, clamped to the text bounds.
     * @return The zero-based line containing the offset.
     */
    public int lineOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= clamped) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    public int columnOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        return clamped - lineStarts[lineOf(clamped)];
    }

    public int lineStart(int line) {
        return lineStarts[line];
    }
}
