package org.clausewitz.cwt.schema;

import org.clausewitz.cwt.tree.Names;

import java.util.List;
import java.util.Optional;

/**
 * Right-hand side of a schema rule: the shape a script value must have.
 */
public sealed interface ValueSpec {

    String describe();

    /**
     * Built-in scalar kind, with optional numeric bounds.
     */
    record Simple(SimpleType type, Optional<NumericRange> range) implements ValueSpec {
        public static Simple of(SimpleType type) {
            return new Simple(type, Optional.empty());
        }

        @Override
        public String describe() {
            return type.keyword() + range.map(r -> "[" + r + "]")
                                         .orElse("");
        }
    }

    /**
     * Exact text such as {@code yes} or {@code "fixed"}.
     */
    record Literal(String text, String folded) implements ValueSpec {
        public static Literal of(String text) {
            return new Literal(Names.intern(text), Names.folded(text));
        }

        @Override
        public String describe() {
            return "'" + text + "'";
        }
    }

    record EnumRef(String name) implements ValueSpec {
        @Override
        public String describe() {
            return "enum[" + name + "]";
        }
    }

    /**
     * Name of a definition of {@code type}, optionally wrapped in a fixed prefix and suffix.
     */
    record TypeRef(String type, String prefix, String suffix) implements ValueSpec {
        @Override
        public String describe() {
            return prefix + "<" + type + ">" + suffix;
        }
    }

    /**
     * A scope expression that must resolve to {@code scope} ({@code any} accepts every scope).
     */
    record ScopeRef(String scope) implements ValueSpec {
        @Override
        public String describe() {
            return "scope[" + scope + "]";
        }
    }

    /**
     * {@code alias_match_left[category]}: value is validated by the member whose name equals the key.
     */
    record AliasMatchLeft(String category) implements ValueSpec {
        @Override
        public String describe() {
            return "alias_match_left[" + category + "]";
        }
    }

    /**
     * {@code single_alias_right[name]}: value is validated by the named single alias.
     */
    record SingleAliasRef(String name) implements ValueSpec {
        @Override
        public String describe() {
            return "single_alias_right[" + name + "]";
        }
    }

    /**
     * {@code value[name]} reads and {@code value_set[name]} declares a dynamic value.
     */
    record DynamicValue(String name, boolean declares) implements ValueSpec {
        @Override
        public String describe() {
            return (declares
                    ? "value_set["
                    : "value[") + name + "]";
        }
    }

    /**
     * {@code colour[rgb]}, {@code colour[hsv]} or {@code colour_field}.
     */
    record Colour(String format) implements ValueSpec {
        @Override
        public String describe() {
            return "colour[" + format + "]";
        }
    }

    /**
     * Nested block whose entries follow {@code rules} and whose bare values each match one of
     * {@code values}.
     */
    record Block(List<SchemaRule> rules, List<ValueSpec> values) implements ValueSpec {
        public Block {
            rules = List.copyOf(rules);
            values = List.copyOf(values);
        }

        public static Block of(List<SchemaRule> rules) {
            return new Block(rules, List.of());
        }

        @Override
        public String describe() {
            return "block";
        }
    }
}
