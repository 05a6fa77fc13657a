package org.pragmatica.reduce.tree;

/**
 * Half-open range of source text: {@code start} is the first character covered, {@code end} the
 * first character after it. A span with equal ends marks a position, e.g. the end of input.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        if (end.offset() < start.offset()) {
            throw new IllegalArgumentException("Span end " + end + " precedes start " + start);
        }
        return new SourceSpan(start, end);
    }

    /**
     * Empty span at a single position.
     */
    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    /**
     * Number of characters covered.
     */
    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    /**
     * Text covered by this span in {@code source}, which must be the text the span was taken from.
     */
    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return isEmpty()
               ? start.toString()
               : start + "-" + end;
    }
}
