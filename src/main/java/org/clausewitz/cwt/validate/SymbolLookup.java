package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.tree.Names;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Answers whether a definition of a type exists somewhere in the workspace.
 *
 * <p>Members collected for a {@code complex_enum[name]} and values declared through
 * {@code value_set[name]} are looked up the same way, under the namespaces
 * {@link #enumNamespace} and {@link #valueSetNamespace}.
 */
@FunctionalInterface
public interface SymbolLookup {
    SymbolLookup EMPTY = (type, name) -> false;

    /**
     * @param type Folded type name
     * @param name Definition name as written in script
     */
    boolean exists(String type, String name);

    /**
     * Known definition names of a type, for completion. Lookups that cannot enumerate return none.
     */
    default Collection<String> names(String type) {
        return List.of();
    }

    /**
     * Whether anything at all is known under {@code type}.
     */
    default boolean hasAny(String type) {
        return !names(type).isEmpty();
    }

    /**
     * Whether {@code name} is a known member of {@code namespace}. A namespace nothing was collected
     * for accepts every name.
     */
    default boolean accepts(String namespace, String name) {
        return exists(namespace, name) || !hasAny(namespace);
    }

    static String enumNamespace(String name) {
        return "enum[" + Names.folded(name) + "]";
    }

    static String valueSetNamespace(String name) {
        return "value[" + Names.folded(name) + "]";
    }

    /**
     * Lookup over fixed name sets per type, compared case-insensitively.
     */
    static SymbolLookup of(Map<String, ? extends Collection<String>> namesByType) {
        Map<String, Set<String>> folded = namesByType.entrySet()
                                                     .stream()
                                                     .collect(Collectors.toUnmodifiableMap(e -> Names.folded(e.getKey()),
                                                                                           e -> e.getValue()
                                                                                                 .stream()
                                                                                                 .map(Names::folded)
                                                                                                 .collect(Collectors.toUnmodifiableSet())));
        return new SymbolLookup() {
            @Override
            public boolean exists(String type, String name) {
                return folded.getOrDefault(Names.folded(type), Set.of())
                             .contains(Names.folded(name));
            }

            @Override
            public Collection<String> names(String type) {
                return namesByType.entrySet()
                                  .stream()
                                  .filter(e -> Names.folded(e.getKey())
                                                    .equals(Names.folded(type)))
                                  .flatMap(e -> e.getValue()
                                                 .stream())
                                  .toList();
            }
        };
    }
}
