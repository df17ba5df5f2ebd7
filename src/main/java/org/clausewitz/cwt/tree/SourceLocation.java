package org.clausewitz.cwt.tree;

/**
 * A position in a source buffer. Line and column are 1-based, offset is the 0-based char index.
 */
public record SourceLocation(int line, int column, int offset) implements Comparable<SourceLocation> {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    public boolean isBefore(SourceLocation other) {
        return offset < other.offset;
    }

    @Override
    public int compareTo(SourceLocation other) {
        return Integer.compare(offset, other.offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
