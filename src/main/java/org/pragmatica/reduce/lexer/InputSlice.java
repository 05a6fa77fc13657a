package org.pragmatica.reduce.lexer;

import java.util.Objects;

/**
 * Read-only view of a region of the source text.
 *
 * <p>{@link #subSequence(int, int)} returns another view over the same backing string, so
 * handing remainders back and forth between recognizers and the lexer never copies text.
 */
public final class InputSlice implements CharSequence {
    private final String source;
    private final int start;
    private final int end;

    private InputSlice(String source, int start, int end) {
        this.source = source;
        this.start = start;
        this.end = end;
    }

    public static InputSlice of(String source) {
        return new InputSlice(Objects.requireNonNull(source, "source"), 0, source.length());
    }

    /**
     * Offset of this slice in the backing string.
     */
    public int offset() {
        return start;
    }

    public String source() {
        return source;
    }

    @Override
    public int length() {
        return end - start;
    }

    @Override
    public boolean isEmpty() {
        return start == end;
    }

    @Override
    public char charAt(int index) {
        if (index < 0 || index >= length()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + length());
        }
        return source.charAt(start + index);
    }

    @Override
    public InputSlice subSequence(int from, int to) {
        if (from < 0 || to > length() || from > to) {
            throw new IndexOutOfBoundsException("Range [" + from + ", " + to + ") out of bounds for length " + length());
        }
        return new InputSlice(source, start + from, start + to);
    }

    /**
     * Drop the first {@code count} characters.
     */
    public InputSlice skip(int count) {
        return subSequence(count, length());
    }

    @Override
    public String toString() {
        return source.substring(start, end);
    }
}
