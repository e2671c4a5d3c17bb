package com.stcode.core.comments;

import java.util.Arrays;

/**
 * Maps character offsets to 1-based line numbers.
 *
 * <p>Line starts are collected in one pass over the text; each lookup is a binary
 * search. Only {@code \n} ends a line, so {@code \r\n} files count the same as
 * {@code \n} files.
 */
public final class LineIndex {

    private final int[] lineStarts;
    private final int length;

    private LineIndex(int[] lineStarts, int length) {
        this.lineStarts = lineStarts;
        this.length = length;
    }

    public static LineIndex of(String text) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineIndex(Arrays.copyOf(starts, count), text.length());
    }

    /**
     * @param offset character offset, 0 to text length inclusive
     * @return 1-based line containing the offset
     */
    public int lineOf(int offset) {
        if (offset < 0 || offset > length) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside text of length " + length);
        }
        int position = Arrays.binarySearch(lineStarts, offset);
        return position >= 0 ? position + 1 : -position - 1;
    }

    /**
     * @return 0-based column of the offset within its line
     */
    public int columnOf(int offset) {
        return offset - lineStarts[lineOf(offset) - 1];
    }

    public int lineCount() {
        return lineStarts.length;
    }
}
