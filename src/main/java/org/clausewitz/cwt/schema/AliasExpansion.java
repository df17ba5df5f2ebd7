package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

import java.util.List;

/**
 * The members of one alias category as rules, ready for matching against script keys.
 *
 * @param category Folded category name
 * @param literals Members with a literal name, keyed by folded name
 * @param patterns Members whose name is a pattern ({@code <type>}, {@code enum[...]}, ...)
 */
public record AliasExpansion(String category, ImmutableListMultimap<String, SchemaRule> literals,
                             List<SchemaRule> patterns) {
    public AliasExpansion {
        patterns = ImmutableList.copyOf(patterns);
    }

    /**
     * Members named exactly {@code foldedKey}.
     */
    public List<SchemaRule> named(String foldedKey) {
        return literals.get(foldedKey);
    }

    public boolean isEmpty() {
        return literals.isEmpty() && patterns.isEmpty();
    }

    public int size() {
        return literals.size() + patterns.size();
    }
}
