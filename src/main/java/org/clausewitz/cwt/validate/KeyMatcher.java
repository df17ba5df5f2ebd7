package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.schema.EnumDefinition;
import org.clausewitz.cwt.schema.KeySpec;
import org.clausewitz.cwt.schema.Schema;
import org.clausewitz.cwt.tree.Key;
import org.clausewitz.cwt.tree.Names;

import java.util.Optional;

/**
 * Matches script keys against pattern key specs.
 */
final class KeyMatcher {
    private KeyMatcher() {}

    /**
     * Whether {@code key} matches {@code spec}. Alias slots and subtype groups never match here;
     * callers expand them first.
     */
    static boolean matches(KeySpec spec, Key key, Schema schema, SymbolLookup symbols) {
        var text = key.text();
        if (spec instanceof KeySpec.Literal literal) {
            return literal.folded()
                          .equals(key.folded());
        }
        if (spec instanceof KeySpec.TypeRef ref) {
            return unwrap(text, ref.prefix(), ref.suffix()).filter(name -> symbols.exists(ref.type(), name))
                                                           .isPresent();
        }
        if (spec instanceof KeySpec.EnumRef ref) {
            return schema.enumDefinition(ref.name())
                         .filter(e -> isMember(e, text, symbols))
                         .isPresent();
        }
        if (spec instanceof KeySpec.DynamicValue dynamic) {
            return dynamic.declares() || symbols.accepts(SymbolLookup.valueSetNamespace(dynamic.name()), text);
        }
        if (spec instanceof KeySpec.Simple simple) {
            return switch (simple.type()) {
                case BOOL -> ValueShapes.isBool(text);
                case INT -> ValueShapes.isInt(text);
                case FLOAT -> ValueShapes.isFloat(text);
                case DATE_FIELD -> ValueShapes.isDate(text);
                case PERCENTAGE_FIELD -> ValueShapes.isPercentage(text);
                default -> true;
            };
        }
        if (spec instanceof KeySpec.ScopeRef) {
            return ScopeContext.isScopePath(text, schema);
        }
        return false;
    }

    /**
     * Whether {@code text} belongs to the enum: a declared member, or for a complex enum one
     * collected from script.
     */
    static boolean isMember(EnumDefinition definition, String text, SymbolLookup symbols) {
        if (definition.contains(text)) {
            return true;
        }
        return definition.isComplex() && symbols.accepts(SymbolLookup.enumNamespace(definition.name()), text);
    }

    /**
     * The part of {@code text} between a folded {@code prefix} and {@code suffix}, if it has both.
     */
    static Optional<String> unwrap(String text, String prefix, String suffix) {
        var folded = Names.folded(text);
        if (folded.length() <= prefix.length() + suffix.length() || !folded.startsWith(prefix) || !folded.endsWith(suffix)) {
            return Optional.empty();
        }
        return Optional.of(text.substring(prefix.length(), text.length() - suffix.length()));
    }
}
