package org.clausewitz.cwt.schema;

import org.clausewitz.cwt.tree.Operator;
import org.clausewitz.cwt.tree.SourceSpan;

/**
 * One schema rule: {@code key op value} plus the options declared above it.
 */
public record SchemaRule(
    KeySpec key,
    Operator operator,
    ValueSpec value,
    RuleOptions options,
    SourceSpan span,
    String origin
) {
    /**
     * Declared cardinality, or the default: exactly once for literal keys, any number of times for
     * pattern keys.
     */
    public Cardinality cardinality() {
        return options.cardinality()
                      .orElse(key.isPattern()
                              ? Cardinality.ANY
                              : Cardinality.REQUIRED);
    }

    public boolean isSubtypeGroup() {
        return key instanceof KeySpec.SubtypeGroup;
    }

    /**
     * Where this rule was declared, for diagnostics and alias memo keys.
     */
    public String site() {
        return origin + ":" + span.start();
    }

    @Override
    public String toString() {
        return key.describe() + " " + operator.symbol() + " " + value.describe();
    }
}
