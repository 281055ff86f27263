package io.docxform.core.engine;

import java.util.Objects;

/**
 * Read position over the source text of one parse.
 *
 * <p>The offset only moves forward, except that a node parser may {@link #rewind(int) rewind} a
 * failed attempt. Rewinding never goes past the commit mark, which the parser engine moves to the end
 * of each node it closes.
 */
public final class Cursor {

    private final String source;
    private int offset;
    private int commitMark;
    private int lowestOffset;

    public Cursor(String source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    public String source() {
        return source;
    }

    public int offset() {
        return offset;
    }

    /** Offset below which {@link #rewind(int)} is refused. */
    public int commitMark() {
        return commitMark;
    }

    public int length() {
        return source.length();
    }

    public boolean atEnd() {
        return offset >= source.length();
    }

    public int remaining() {
        return source.length() - offset;
    }

    /** The character at the cursor, or {@code -1} at end of input. */
    public int peek() {
        return peek(0);
    }

    /** The character {@code ahead} positions past the cursor, or {@code -1} beyond the input. */
    public int peek(int ahead) {
        int index = offset + ahead;
        return index >= 0 && index < source.length() ? source.charAt(index) : -1;
    }

    public boolean startsWith(String prefix) {
        return source.startsWith(prefix, offset);
    }

    /** Position of the next occurrence of {@code needle} at or after the cursor, or {@code -1}. */
    public int indexOf(String needle) {
        return source.indexOf(needle, offset);
    }

    /** Text between two absolute offsets. */
    public String slice(int start, int end) {
        return source.substring(start, end);
    }

    public void advance() {
        advance(1);
    }

    /**
     * Moves forward by {@code count} characters.
     *
     * @throws IllegalArgumentException if {@code count} is negative or runs past the end
     */
    public void advance(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got: " + count);
        }
        if (count > remaining()) {
            throw new IllegalArgumentException(
                    "cannot advance " + count + " past end of input at offset " + offset);
        }
        offset += count;
    }

    /** Consumes {@code token} if the input continues with it. */
    public boolean consume(String token) {
        if (!startsWith(token)) {
            return false;
        }
        offset += token.length();
        return true;
    }

    /** Moves to {@code target}, which must lie ahead of the cursor. */
    public void advanceTo(int target) {
        advance(target - offset);
    }

    /**
     * Moves back to {@code target}.
     *
     * @throws IllegalStateException if {@code target} precedes the commit mark
     * @throws IllegalArgumentException if {@code target} lies ahead of the cursor
     */
    public void rewind(int target) {
        if (target < commitMark) {
            throw new IllegalStateException(
                    "cannot rewind to " + target + ", past the last closed node at " + commitMark);
        }
        if (target > offset) {
            throw new IllegalArgumentException("rewind target " + target + " lies ahead of offset " + offset);
        }
        offset = target;
        lowestOffset = Math.min(lowestOffset, target);
    }

    void commit() {
        commitMark = offset;
    }

    /** Starts tracking the lowest offset the cursor is rewound to, from the current offset. */
    void markLowest() {
        lowestOffset = offset;
    }

    /** Lowest offset reached since the last {@link #markLowest()}. */
    int lowestOffset() {
        return lowestOffset;
    }

    @Override
    public String toString() {
        return "Cursor[" + offset + "/" + source.length() + "]";
    }
}
