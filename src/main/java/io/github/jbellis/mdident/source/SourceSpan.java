package io.github.jbellis.mdident.source;

/**
 * A region of the original markdown text.
 *
 * Lines are 1-based and columns 0-based. End offset and end column are exclusive, so a heading
 * {@code "# Title"} on the first line spans line 1, columns 0 to 7. Offsets may be
 * {@link #UNKNOWN_OFFSET} when a span was restored from a format that only kept line/column data.
 */
public record SourceSpan(int startOffset, int endOffset, int startLine, int startColumn, int endLine, int endColumn) {
    public static final int UNKNOWN_OFFSET = -1;

    public SourceSpan {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range " + startLine + ".." + endLine);
        }
        if (startColumn < 0 || endColumn < 0 || (startLine == endLine && endColumn < startColumn)) {
            throw new IllegalArgumentException("Invalid column range " + startColumn + ".." + endColumn);
        }
        if (startOffset != UNKNOWN_OFFSET || endOffset != UNKNOWN_OFFSET) {
            if (startOffset < 0 || endOffset < startOffset) {
                throw new IllegalArgumentException("Invalid offset range " + startOffset + ".." + endOffset);
            }
        }
    }

    public static SourceSpan ofLines(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceSpan(UNKNOWN_OFFSET, UNKNOWN_OFFSET, startLine, startColumn, endLine, endColumn);
    }

    public boolean hasOffsets() {
        return startOffset != UNKNOWN_OFFSET;
    }

    /**
     * True if the position lies within the span, both ends included.
     */
    public boolean contains(int line, int column) {
        if (line < startLine || line > endLine) {
            return false;
        }
        if (line == startLine && column < startColumn) {
            return false;
        }
        return line != endLine || column <= endColumn;
    }

    /**
     * True if the spans share at least one position. Spans that touch end-to-start overlap.
     */
    public boolean overlaps(SourceSpan other) {
        return !endsBefore(other) && !other.endsBefore(this);
    }

    private boolean endsBefore(SourceSpan other) {
        return endLine < other.startLine || (endLine == other.startLine && endColumn < other.startColumn);
    }

    /**
     * Number of lines covered, counting both ends.
     */
    public int lineCount() {
        return endLine - startLine + 1;
    }
}
