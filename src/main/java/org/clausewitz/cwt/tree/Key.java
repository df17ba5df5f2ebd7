package org.clausewitz.cwt.tree;

/**
 * Left-hand side of an entry. {@code folded} is the interned lower-case text used for lookups, so
 * key comparison is reference equality.
 */
public record Key(String text, String folded, boolean quoted, SourceSpan span) {

    public static Key of(String text, boolean quoted, SourceSpan span) {
        return new Key(Names.intern(text), Names.folded(text), quoted, span);
    }

    public boolean is(String name) {
        return folded == Names.folded(name);
    }

    @Override
    public String toString() {
        return text;
    }
}
