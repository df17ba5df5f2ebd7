package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.clausewitz.cwt.tree.Names;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, merged view of a loaded schema set. Produced by {@link SchemaLoader} and published
 * through {@link SchemaRegistry}; readers hold a snapshot for the duration of one validation.
 */
public final class Schema {
    public static final Schema EMPTY = new Schema(0,
                                                  List.of(),
                                                  ImmutableMap.of(),
                                                  Set.of(),
                                                  ImmutableMap.of(),
                                                  ImmutableListMultimap.of(),
                                                  ImmutableMap.of(),
                                                  ImmutableMap.of());

    private static final String HIDDEN_PREFIX = "hidden:";

    private final long generation;
    private final ImmutableList<String> origins;
    private final ImmutableMap<String, SchemaType> types;
    private final ImmutableSet<String> shapedTypes;
    private final ImmutableMap<String, EnumDefinition> enums;
    private final ImmutableListMultimap<String, AliasDefinition> aliases;
    private final ImmutableMap<String, SingleAlias> singleAliases;
    private final ImmutableMap<String, LinkDefinition> links;
    private final AliasResolver resolver;

    Schema(long generation,
           List<String> origins,
           ImmutableMap<String, SchemaType> types,
           Set<String> shapedTypes,
           ImmutableMap<String, EnumDefinition> enums,
           ImmutableListMultimap<String, AliasDefinition> aliases,
           ImmutableMap<String, SingleAlias> singleAliases,
           ImmutableMap<String, LinkDefinition> links) {
        this(generation, origins, types, shapedTypes, enums, aliases, singleAliases, links, new AliasResolver(aliases));
    }

    private Schema(long generation,
                   List<String> origins,
                   ImmutableMap<String, SchemaType> types,
                   Set<String> shapedTypes,
                   ImmutableMap<String, EnumDefinition> enums,
                   ImmutableListMultimap<String, AliasDefinition> aliases,
                   ImmutableMap<String, SingleAlias> singleAliases,
                   ImmutableMap<String, LinkDefinition> links,
                   AliasResolver resolver) {
        this.generation = generation;
        this.origins = ImmutableList.copyOf(origins);
        this.types = types;
        this.shapedTypes = ImmutableSet.copyOf(shapedTypes);
        this.enums = enums;
        this.aliases = aliases;
        this.singleAliases = singleAliases;
        this.links = links;
        this.resolver = resolver;
    }

    /**
     * Same content under a new generation number. The alias memo is shared.
     */
    Schema withGeneration(long newGeneration) {
        return new Schema(newGeneration, origins, types, shapedTypes, enums, aliases, singleAliases, links, resolver);
    }

    public long generation() {
        return generation;
    }

    /**
     * Names of the schema files this snapshot was built from.
     */
    public List<String> origins() {
        return origins;
    }

    public Collection<SchemaType> types() {
        return types.values();
    }

    public Optional<SchemaType> type(String name) {
        return Optional.ofNullable(types.get(Names.folded(name)));
    }

    /**
     * Whether the type has a shape block. Definitions of unshaped types are only checked for
     * localisation.
     */
    public boolean isShaped(String typeName) {
        return shapedTypes.contains(Names.folded(typeName));
    }

    /**
     * Types whose path patterns cover a workspace-relative file path, in declaration order.
     */
    public List<SchemaType> typesForPath(String relativePath) {
        return types.values()
                    .stream()
                    .filter(t -> t.matchesPath(relativePath))
                    .toList();
    }

    public Optional<EnumDefinition> enumDefinition(String name) {
        return Optional.ofNullable(enums.get(Names.folded(name)));
    }

    public Collection<EnumDefinition> enums() {
        return enums.values();
    }

    public List<AliasDefinition> aliasMembers(String category) {
        return aliases.get(Names.folded(category));
    }

    public Set<String> aliasCategories() {
        return aliases.keySet();
    }

    public Optional<SingleAlias> singleAlias(String name) {
        return Optional.ofNullable(singleAliases.get(Names.folded(name)));
    }

    public Collection<LinkDefinition> links() {
        return links.values();
    }

    /**
     * The link a scope path segment names: an exact link name first, then a data link whose prefix
     * the segment starts with. A {@code hidden:} marker in front of the segment is ignored.
     */
    public Optional<LinkDefinition> link(String segment) {
        var folded = Names.folded(segment);
        if (folded.startsWith(HIDDEN_PREFIX)) {
            folded = folded.substring(HIDDEN_PREFIX.length());
        }
        var exact = links.get(folded);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (var link : links.values()) {
            if (link.matches(folded)) {
                return Optional.of(link);
            }
        }
        return Optional.empty();
    }

    public AliasResolver aliases() {
        return resolver;
    }

    public boolean isEmpty() {
        return types.isEmpty() && enums.isEmpty() && aliases.isEmpty() && singleAliases.isEmpty() && links.isEmpty();
    }

    @Override
    public String toString() {
        return "Schema[generation=" + generation + ", types=" + types.size() + ", enums=" + enums.size()
               + ", aliasCategories=" + aliases.keySet()
                                               .size() + ", links=" + links.size() + "]";
    }
}
