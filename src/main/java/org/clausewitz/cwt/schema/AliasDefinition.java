package org.clausewitz.cwt.schema;

import org.clausewitz.cwt.tree.Operator;
import org.clausewitz.cwt.tree.SourceSpan;

/**
 * One member of an alias category: {@code alias[category:name] = value}.
 *
 * @param category Folded category name, e.g. {@code trigger}
 * @param name     Member key: a literal name, or a {@code <type>} / {@code enum[...]} pattern
 * @param value    Shape of the member's value
 */
public record AliasDefinition(
    String category,
    KeySpec name,
    Operator operator,
    ValueSpec value,
    RuleOptions options,
    SourceSpan span,
    String origin
) {
    /**
     * The member as a rule, used when an {@code alias_name[category]} slot matches a script key.
     * Cardinality comes from the slot, not from the member.
     */
    public SchemaRule asRule() {
        return new SchemaRule(name, operator, value, options, span, origin);
    }
}
