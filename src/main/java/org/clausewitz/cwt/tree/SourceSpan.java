package org.clausewitz.cwt.tree;

/**
 * A range in a source buffer from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static final SourceSpan EMPTY = at(SourceLocation.START);

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    /**
     * Smallest span covering both this span and {@code other}.
     */
    public SourceSpan merge(SourceSpan other) {
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    public boolean encloses(SourceSpan other) {
        return start.offset() <= other.start.offset() && other.end.offset() <= end.offset();
    }

    /**
     * Whether the offset lies inside this span. The end offset counts as inside so that a cursor
     * placed right after a token still belongs to it.
     */
    public boolean containsOffset(int offset) {
        return start.offset() <= offset && offset <= end.offset();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
