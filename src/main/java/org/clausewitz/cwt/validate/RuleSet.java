package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.schema.Cardinality;
import org.clausewitz.cwt.schema.KeySpec;
import org.clausewitz.cwt.schema.SchemaRule;
import org.clausewitz.cwt.schema.ValueSpec;
import org.clausewitz.cwt.tree.Names;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The rules in force for one block, grouped by key.
 *
 * <p>Rules arrive in layers: the base rules first, then one layer per matched subtype. Rules for
 * the same key inside one layer merge most permissively (widest cardinality, union of value
 * alternatives). Across layers value alternatives still accumulate, but the later layer's
 * cardinality replaces the earlier one.
 */
final class RuleSet {
    private final List<Group> groups;
    private final Map<String, Integer> literalIndex;
    private final List<Integer> patternIndex;

    private RuleSet(List<Group> groups) {
        this.groups = groups;
        this.literalIndex = new HashMap<>();
        this.patternIndex = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            var key = groups.get(i)
                            .key();
            if (key instanceof KeySpec.Literal literal) {
                literalIndex.put(literal.folded(), i);
            } else {
                patternIndex.add(i);
            }
        }
    }

    /**
     * Key-wise group of rules.
     *
     * @param key          Key shared by the rules
     * @param cardinality  Effective occurrence bounds
     * @param alternatives Rules whose value shapes a matching entry may follow
     */
    record Group(KeySpec key, Cardinality cardinality, List<SchemaRule> alternatives) {
        SchemaRule first() {
            return alternatives.get(0);
        }

        boolean isAliasSlot() {
            return key instanceof KeySpec.AliasName;
        }

        /**
         * Type-pattern keys that catch arbitrary names, e.g. {@code <resource> = int}.
         */
        boolean isWildcard() {
            return key.isPattern() && !isAliasSlot();
        }
    }

    static RuleSet merge(List<List<SchemaRule>> layers) {
        var merged = new LinkedHashMap<String, Group>();
        for (var layer : layers) {
            var local = new LinkedHashMap<String, Group>();
            for (var rule : layer) {
                var id = identity(rule.key());
                var existing = local.get(id);
                if (existing == null) {
                    local.put(id, new Group(rule.key(), rule.cardinality(), List.of(rule)));
                } else {
                    local.put(id, new Group(existing.key(),
                                            existing.cardinality()
                                                    .widen(rule.cardinality()),
                                            append(existing.alternatives(), List.of(rule))));
                }
            }
            local.forEach((id, group) -> {
                var existing = merged.get(id);
                merged.put(id,
                           existing == null
                           ? group
                           : new Group(existing.key(),
                                       group.cardinality(),
                                       append(existing.alternatives(), group.alternatives())));
            });
        }
        return new RuleSet(List.copyOf(merged.values()));
    }

    /**
     * Rules in force for a block of a definition with the given subtypes: the plain rules, then
     * the {@code subtype[...]} groups that apply, one layer per subtype in declaration order,
     * then the negated groups whose subtype is absent.
     */
    static RuleSet forBlock(List<SchemaRule> rules, List<String> subtypes) {
        return merge(layers(rules, subtypes));
    }

    private static List<List<SchemaRule>> layers(List<SchemaRule> rules, List<String> subtypes) {
        var layers = new ArrayList<List<SchemaRule>>();
        var base = new ArrayList<SchemaRule>();
        var groups = new ArrayList<SchemaRule>();
        for (var rule : rules) {
            if (rule.isSubtypeGroup()) {
                groups.add(rule);
            } else {
                base.add(rule);
            }
        }
        layers.add(base);
        if (groups.isEmpty()) {
            return layers;
        }
        for (var subtype : subtypes) {
            var layer = new ArrayList<SchemaRule>();
            for (var group : groups) {
                var key = (KeySpec.SubtypeGroup) group.key();
                if (!key.negated() && key.subtype()
                                         .equals(subtype)) {
                    layer.addAll(flatten(group, subtypes));
                }
            }
            if (!layer.isEmpty()) {
                layers.add(layer);
            }
        }
        for (var group : groups) {
            var key = (KeySpec.SubtypeGroup) group.key();
            if (key.negated() && !subtypes.contains(key.subtype())) {
                layers.add(flatten(group, subtypes));
            }
        }
        return layers;
    }

    private static List<SchemaRule> flatten(SchemaRule group, List<String> subtypes) {
        if (!(group.value() instanceof ValueSpec.Block block)) {
            return List.of();
        }
        var rules = new ArrayList<SchemaRule>();
        layers(block.rules(), subtypes).forEach(rules::addAll);
        return rules;
    }

    private static String identity(KeySpec key) {
        if (key instanceof KeySpec.Literal literal) {
            return literal.folded();
        }
        return "\0" + Names.folded(key.describe());
    }

    private static List<SchemaRule> append(List<SchemaRule> head, List<SchemaRule> tail) {
        var all = new ArrayList<SchemaRule>(head.size() + tail.size());
        all.addAll(head);
        all.addAll(tail);
        return List.copyOf(all);
    }

    List<Group> groups() {
        return groups;
    }

    int size() {
        return groups.size();
    }

    Group group(int index) {
        return groups.get(index);
    }

    /**
     * Index of the group for a literal key, or -1.
     */
    int literal(String foldedKey) {
        return literalIndex.getOrDefault(foldedKey, -1);
    }

    /**
     * Indices of pattern groups in declaration order.
     */
    List<Integer> patterns() {
        return patternIndex;
    }

    boolean hasAliasSlot() {
        return groups.stream()
                     .anyMatch(Group::isAliasSlot);
    }

    boolean hasWildcard() {
        return groups.stream()
                     .anyMatch(Group::isWildcard);
    }

    List<String> aliasCategories() {
        return groups.stream()
                     .filter(Group::isAliasSlot)
                     .map(g -> ((KeySpec.AliasName) g.key()).category())
                     .toList();
    }
}
