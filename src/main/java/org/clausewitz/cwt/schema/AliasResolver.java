package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableListMultimap;
import org.clausewitz.cwt.error.EngineDefectException;

import java.util.ArrayList;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Expands {@code alias_name[category]} slots into the category's members.
 *
 * <p>Expansion is lazy: nothing is computed at load time. Each slot is expanded on first use and
 * the result is kept for the lifetime of the schema snapshot. Members take their cardinality from
 * the slot that invokes them, so results are memoised per category and invocation site.
 */
public final class AliasResolver {
    private final ImmutableListMultimap<String, AliasDefinition> members;
    private final ConcurrentHashMap<SiteKey, AliasExpansion> expansions = new ConcurrentHashMap<>();

    AliasResolver(ImmutableListMultimap<String, AliasDefinition> members) {
        this.members = members;
    }

    /**
     * Expansion of {@code category} for the slot declared by {@code slot}.
     *
     * @throws EngineDefectException if the category has no members; loading rejects such schemas
     */
    public AliasExpansion expand(String category, SchemaRule slot) {
        return expansions.computeIfAbsent(new SiteKey(category, slot.site()), key -> build(category, slot));
    }

    /**
     * Expansion of {@code category} with the members' own options, used by {@code alias_match_left}
     * values whose key already picked the member.
     */
    public AliasExpansion expand(String category) {
        return expansions.computeIfAbsent(new SiteKey(category, ""), key -> build(category, null));
    }

    public boolean defines(String category) {
        return members.containsKey(category);
    }

    int memoSize() {
        return expansions.size();
    }

    private AliasExpansion build(String category, SchemaRule slot) {
        var definitions = members.get(category);
        if (definitions.isEmpty()) {
            throw new EngineDefectException("Alias category '" + category + "' has no members");
        }
        var literals = ImmutableListMultimap.<String, SchemaRule>builder();
        var patterns = new ArrayList<SchemaRule>();
        for (var definition : definitions) {
            var rule = definition.asRule();
            if (slot != null) {
                rule = new SchemaRule(rule.key(),
                                      rule.operator(),
                                      rule.value(),
                                      rule.options()
                                          .withCardinality(slot.cardinality()),
                                      rule.span(),
                                      rule.origin());
            }
            if (rule.key() instanceof KeySpec.Literal literal) {
                literals.put(literal.folded(), rule);
            } else {
                patterns.add(rule);
            }
        }
        return new AliasExpansion(category, literals.build(), patterns);
    }

    private record SiteKey(String category, String site) {}
}
