package org.clausewitz.cwt.schema;

import org.clausewitz.cwt.tree.SourceSpan;

import java.util.List;

/**
 * Named predicate over a definition block, declared as {@code subtype[name] = { ... }} inside a
 * type declaration.
 *
 * <p>Each condition rule states a sibling key the definition must carry with a matching value;
 * a condition with cardinality {@code 0..0} requires the key to be absent. Options may further
 * restrict the definition key ({@code starts_with}, {@code type_key_filter}).
 */
public record Subtype(String name, List<SchemaRule> conditions, RuleOptions options, SourceSpan span) {
    public Subtype {
        conditions = List.copyOf(conditions);
    }
}
