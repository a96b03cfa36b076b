package io.github.jbellis.mdident.source;

import java.util.Arrays;

/**
 * Converts character offsets in a source text into line/column positions.
 *
 * Columns count UTF-16 code units from the start of the line. Spans built here exclude trailing
 * line terminators, which block parsers tend to include in a block's extent.
 */
public final class LineIndex {
    private final String text;
    private final int[] lineStarts;

    public LineIndex(String text) {
        this.text = text;
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean lineBreak = c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'));
            if (lineBreak) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * @return the 1-based line containing {@code offset}
     */
    public int lineOf(int offset) {
        checkOffset(offset);
        int pos = Arrays.binarySearch(lineStarts, offset);
        int index = pos >= 0 ? pos : -pos - 2;
        return index + 1;
    }

    /**
     * @return the 0-based column of {@code offset} within its line
     */
    public int columnOf(int offset) {
        return offset - lineStarts[lineOf(offset) - 1];
    }

    public SourceSpan spanOf(int startOffset, int endOffset) {
        checkOffset(startOffset);
        checkOffset(endOffset);
        int end = endOffset;
        while (end > startOffset && isLineTerminator(text.charAt(end - 1))) {
            end--;
        }
        int endLine = end > startOffset ? lineOf(end - 1) : lineOf(startOffset);
        int endColumn = end > startOffset ? columnOf(end - 1) + 1 : columnOf(startOffset);
        return new SourceSpan(startOffset, end, lineOf(startOffset), columnOf(startOffset), endLine, endColumn);
    }

    private void checkOffset(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside text of length " + text.length());
        }
    }

    private static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r';
    }
}
