package org.typeset.lite.syntax;

/**
 * A half-open range of byte offsets into the source text.
 *
 * @param start The first offset covered by the span
 * @param end   The offset just past the span
 */
public record Span(int start, int end) {

    /**
     * Span used for nodes that were not produced from source text.
     */
    public static final Span ZERO = new Span(0, 0);

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span: " + start + ".." + end);
        }
    }

    public static Span at(int offset) {
        return new Span(offset, offset);
    }

    /**
     * Returns the smallest span covering both this span and the other one.
     */
    public Span join(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
