package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableListMultimap;
import org.clausewitz.cwt.error.SchemaError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rejects alias categories and single aliases that can never finish expanding.
 *
 * <p>A value is productive when some finite script satisfies it. Plain values always are; a block
 * is productive when every required rule is productive and, if it has rules at all, at least one
 * of them is. A category is productive when any member is, a single alias when its value is.
 * Productivity is computed as a least fixpoint; whatever stays unproductive sits on a cycle that
 * never reaches a terminal rule.
 */
final class AliasCycleChecker {
    private final ImmutableListMultimap<String, AliasDefinition> categories;
    private final Map<String, SingleAlias> singleAliases;
    private final Set<String> productiveCategories = new HashSet<>();
    private final Set<String> productiveSingles = new HashSet<>();

    AliasCycleChecker(ImmutableListMultimap<String, AliasDefinition> categories, Map<String, SingleAlias> singleAliases) {
        this.categories = categories;
        this.singleAliases = singleAliases;
    }

    List<SchemaError> check() {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var category : categories.keySet()) {
                if (!productiveCategories.contains(category) && categories.get(category)
                                                                          .stream()
                                                                          .anyMatch(member -> productive(member.value()))) {
                    productiveCategories.add(category);
                    changed = true;
                }
            }
            for (var single : singleAliases.values()) {
                if (!productiveSingles.contains(single.name()) && productive(single.value())) {
                    productiveSingles.add(single.name());
                    changed = true;
                }
            }
        }
        return report();
    }

    private boolean productive(ValueSpec value) {
        if (value instanceof ValueSpec.AliasMatchLeft left) {
            return isProductiveCategory(left.category());
        }
        if (value instanceof ValueSpec.SingleAliasRef ref) {
            return isProductiveSingle(ref.name());
        }
        if (value instanceof ValueSpec.Block block) {
            boolean any = block.rules()
                               .isEmpty() && block.values()
                                                  .isEmpty();
            for (var rule : block.rules()) {
                boolean ok = productive(rule);
                if (!ok && rule.cardinality()
                               .isRequired()) {
                    return false;
                }
                any |= ok;
            }
            for (var element : block.values()) {
                any |= productive(element);
            }
            return any;
        }
        return true;
    }

    private boolean productive(SchemaRule rule) {
        if (rule.key() instanceof KeySpec.AliasName name && !isProductiveCategory(name.category())) {
            return false;
        }
        return productive(rule.value());
    }

    // undefined names are reported separately; they do not make a cycle
    private boolean isProductiveCategory(String category) {
        return productiveCategories.contains(category) || !categories.containsKey(category);
    }

    private boolean isProductiveSingle(String name) {
        return productiveSingles.contains(name) || !singleAliases.containsKey(name);
    }

    private List<SchemaError> report() {
        var errors = new ArrayList<SchemaError>();
        var reported = new HashSet<String>();
        for (var category : categories.keySet()) {
            if (productiveCategories.contains(category) || reported.contains(category)) {
                continue;
            }
            var group = unproductiveReachableFrom(category);
            reported.addAll(group);
            var first = categories.get(category)
                                  .get(0);
            errors.add(new SchemaError.AliasCycle(first.origin(), first.span(), List.copyOf(group)));
        }
        for (var single : singleAliases.values()) {
            if (!productiveSingles.contains(single.name())) {
                errors.add(new SchemaError.AliasCycle(single.origin(),
                                                      single.span(),
                                                      List.of("single_alias[" + single.name() + "]")));
            }
        }
        return errors;
    }

    private LinkedHashSet<String> unproductiveReachableFrom(String start) {
        var seen = new LinkedHashSet<String>();
        var pending = new ArrayDeque<String>();
        pending.add(start);
        while (!pending.isEmpty()) {
            var category = pending.poll();
            if (!seen.add(category)) {
                continue;
            }
            for (var member : categories.get(category)) {
                for (var referenced : referencedCategories(member.value(), new ArrayList<>())) {
                    if (categories.containsKey(referenced) && !productiveCategories.contains(referenced)) {
                        pending.add(referenced);
                    }
                }
            }
        }
        return seen;
    }

    private List<String> referencedCategories(ValueSpec value, List<String> out) {
        if (value instanceof ValueSpec.AliasMatchLeft left) {
            out.add(left.category());
        } else if (value instanceof ValueSpec.Block block) {
            for (var rule : block.rules()) {
                if (rule.key() instanceof KeySpec.AliasName name) {
                    out.add(name.category());
                }
                referencedCategories(rule.value(), out);
            }
        }
        return out;
    }
}
