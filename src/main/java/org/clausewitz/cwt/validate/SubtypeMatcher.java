package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.schema.KeySpec;
import org.clausewitz.cwt.schema.SchemaRule;
import org.clausewitz.cwt.schema.SchemaType;
import org.clausewitz.cwt.schema.Subtype;
import org.clausewitz.cwt.schema.ValueSpec;
import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.Entry;
import org.clausewitz.cwt.tree.Names;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which subtypes of a type a definition has.
 *
 * <p>A subtype's conditions look only at the definition block's own entries. Several subtypes may
 * match at once; the result keeps the type's declaration order.
 */
final class SubtypeMatcher {
    private SubtypeMatcher() {}

    static List<String> matching(SchemaType type, Entry definition) {
        if (!(definition.value() instanceof AstNode.Block block)) {
            return List.of();
        }
        var matched = new ArrayList<String>();
        for (var subtype : type.subtypes()) {
            if (matches(subtype, definition, block)) {
                matched.add(subtype.name());
            }
        }
        return matched;
    }

    static boolean matches(Subtype subtype, Entry definition, AstNode.Block block) {
        var key = definition.key()
                            .folded();
        var options = subtype.options();
        if (options.startsWith()
                   .isPresent() && !key.startsWith(Names.folded(options.startsWith()
                                                                       .get()))) {
            return false;
        }
        if (options.typeKeyFilter()
                   .isPresent() && !options.typeKeyFilter()
                                           .get()
                                           .accepts(key)) {
            return false;
        }
        for (var condition : subtype.conditions()) {
            if (!holds(condition, block)) {
                return false;
            }
        }
        return true;
    }

    private static boolean holds(SchemaRule condition, AstNode.Block block) {
        if (!(condition.key() instanceof KeySpec.Literal literal)) {
            return true;
        }
        var entries = block.entries(literal.text());
        var cardinality = condition.options()
                                   .cardinality();
        if (cardinality.isPresent() && cardinality.get()
                                                  .isForbidden()) {
            return entries.isEmpty();
        }
        if (entries.isEmpty()) {
            return cardinality.isPresent() && !cardinality.get()
                                                          .isRequired();
        }
        return entries.stream()
                      .anyMatch(entry -> looselyMatches(entry.value(), condition.value()));
    }

    private static boolean looselyMatches(AstNode value, ValueSpec spec) {
        if (spec instanceof ValueSpec.Literal literal) {
            return value instanceof AstNode.Scalar scalar && scalar.folded()
                                                                   .equals(literal.folded());
        }
        if (spec instanceof ValueSpec.Block) {
            return value instanceof AstNode.Block || value instanceof AstNode.Array;
        }
        if (spec instanceof ValueSpec.Simple simple) {
            if (!(value instanceof AstNode.Scalar scalar)) {
                return false;
            }
            return switch (simple.type()) {
                case BOOL -> ValueShapes.isBool(scalar.text());
                case INT -> ValueShapes.isInt(scalar.text());
                case FLOAT -> ValueShapes.isFloat(scalar.text());
                default -> true;
            };
        }
        return true;
    }
}
