package io.docxform.core.model;

/**
 * A range in source text from {@code start} (inclusive) to {@code end} (exclusive), both zero-based
 * character offsets.
 */
public record SourceSpan(int start, int end) {

    /** Span used by nodes that were not read from source text. */
    public static final SourceSpan NONE = new SourceSpan(0, 0);

    public SourceSpan {
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative, got: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("end " + end + " precedes start " + start);
        }
    }

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    /** An empty span positioned at {@code offset}. */
    public static SourceSpan at(int offset) {
        return new SourceSpan(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public String extract(String source) {
        return source.substring(start, end);
    }

    /**
     * Renders the start of this span as a 1-based {@code line:column} pair within {@code source}.
     * Offsets beyond the end of {@code source} are clamped.
     */
    public String startLineColumn(String source) {
        int line = 1;
        int column = 1;
        int limit = Math.min(start, source.length());
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return line + ":" + column;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
