package org.clausewitz.cwt.schema;

import org.clausewitz.cwt.tree.Names;

/**
 * Left-hand side of a schema rule: which script keys the rule applies to.
 */
public sealed interface KeySpec {

    String describe();

    /**
     * Whether the key matches by pattern rather than by literal name.
     */
    default boolean isPattern() {
        return !(this instanceof Literal) && !(this instanceof SubtypeGroup);
    }

    /**
     * Exact key name, matched case-insensitively.
     */
    record Literal(String text, String folded) implements KeySpec {
        public static Literal of(String text) {
            return new Literal(Names.intern(text), Names.folded(text));
        }

        @Override
        public String describe() {
            return text;
        }
    }

    /**
     * {@code <type>} or {@code prefix<type>suffix}: key is the name of a definition of the type.
     */
    record TypeRef(String type, String prefix, String suffix) implements KeySpec {
        @Override
        public String describe() {
            return prefix + "<" + type + ">" + suffix;
        }
    }

    /**
     * {@code enum[name]}: key is a member of the enum.
     */
    record EnumRef(String name) implements KeySpec {
        @Override
        public String describe() {
            return "enum[" + name + "]";
        }
    }

    /**
     * {@code scalar}, {@code int}, ...: any key of that shape.
     */
    record Simple(SimpleType type) implements KeySpec {
        @Override
        public String describe() {
            return type.keyword();
        }
    }

    /**
     * {@code scope[name]}: key is a scope link such as {@code owner} or {@code root}.
     */
    record ScopeRef(String scope) implements KeySpec {
        @Override
        public String describe() {
            return "scope[" + scope + "]";
        }
    }

    /**
     * {@code value[name]}: key reads a member of the value set; {@code value_set[name]}: key
     * declares one and matches anything.
     */
    record DynamicValue(String name, boolean declares) implements KeySpec {
        @Override
        public String describe() {
            return (declares
                    ? "value_set["
                    : "value[") + name + "]";
        }
    }

    /**
     * {@code alias_name[category]}: key is the name of a member of the alias category.
     */
    record AliasName(String category) implements KeySpec {
        @Override
        public String describe() {
            return "alias_name[" + category + "]";
        }
    }

    /**
     * {@code subtype[name]} group: the rules inside apply only when the definition has (or, when
     * negated, lacks) the subtype.
     */
    record SubtypeGroup(String subtype, boolean negated) implements KeySpec {
        @Override
        public String describe() {
            return "subtype[" + (negated
                                 ? "!"
                                 : "") + subtype + "]";
        }
    }
}
