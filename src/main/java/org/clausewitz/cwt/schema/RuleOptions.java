package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.clausewitz.cwt.error.Diagnostic;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Metadata attached to a schema rule by {@code ##} option comments and {@code ###} doc comments.
 *
 * @param cardinality    {@code ## cardinality = a..b}
 * @param scopes         {@code ## scope = x} or {@code ## scope = { x y }}: allowed scopes of {@code this}
 * @param pushScope      {@code ## push_scope = x}: {@code this} inside the value
 * @param replaceScope   {@code ## replace_scope = { this = x root = y }}
 * @param severity       {@code ## severity = warning}
 * @param required       {@code ## required} (localisation requirements)
 * @param primary        {@code ## primary} (localisation requirements)
 * @param displayName    {@code ## display_name = "..."}
 * @param startsWith     {@code ## starts_with = x} (subtypes and types)
 * @param typeKeyFilter  {@code ## type_key_filter = x} or {@code <> x}
 * @param documentation  Text of {@code ###} comments
 */
public record RuleOptions(
    Optional<Cardinality> cardinality,
    List<String> scopes,
    Optional<String> pushScope,
    Map<String, String> replaceScope,
    Optional<Diagnostic.Severity> severity,
    boolean required,
    boolean primary,
    Optional<String> displayName,
    Optional<String> startsWith,
    Optional<TypeKeyFilter> typeKeyFilter,
    Optional<String> documentation
) {
    public static final RuleOptions NONE = new RuleOptions(Optional.empty(),
                                                           List.of(),
                                                           Optional.empty(),
                                                           Map.of(),
                                                           Optional.empty(),
                                                           false,
                                                           false,
                                                           Optional.empty(),
                                                           Optional.empty(),
                                                           Optional.empty(),
                                                           Optional.empty());

    public RuleOptions {
        scopes = ImmutableList.copyOf(scopes);
        replaceScope = ImmutableMap.copyOf(replaceScope);
    }

    public RuleOptions withCardinality(Cardinality value) {
        return new RuleOptions(Optional.of(value),
                               scopes,
                               pushScope,
                               replaceScope,
                               severity,
                               required,
                               primary,
                               displayName,
                               startsWith,
                               typeKeyFilter,
                               documentation);
    }

    public RuleOptions withStartsWith(String prefix) {
        return new RuleOptions(cardinality,
                               scopes,
                               pushScope,
                               replaceScope,
                               severity,
                               required,
                               primary,
                               displayName,
                               Optional.of(prefix),
                               typeKeyFilter,
                               documentation);
    }

    public boolean changesScope() {
        return pushScope.isPresent() || !replaceScope.isEmpty();
    }

    /**
     * Allowed or excluded definition keys, {@code ## type_key_filter = { a b }} / {@code <> a}.
     */
    public record TypeKeyFilter(List<String> keys, boolean negated) {
        public TypeKeyFilter {
            keys = ImmutableList.copyOf(keys);
        }

        public boolean accepts(String foldedKey) {
            return keys.contains(foldedKey) != negated;
        }
    }
}
