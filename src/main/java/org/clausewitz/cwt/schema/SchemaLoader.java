package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import org.clausewitz.cwt.error.SchemaError;
import org.clausewitz.cwt.error.SchemaLoadException;
import org.clausewitz.cwt.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges parsed schema files into one {@link Schema} and checks it as a whole.
 *
 * <p>The merged set must be closed: every alias category, single alias, enum and type a rule
 * names must be defined by some loaded file, every {@code subtype[...]} group must name a subtype
 * of its type, and no alias may expand forever. Any problem fails the whole load.
 */
public final class SchemaLoader {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaLoader.class);

    private final List<SchemaError> errors = new ArrayList<>();
    private final LinkedHashMap<String, SchemaType> types = new LinkedHashMap<>();
    private final LinkedHashMap<String, List<SchemaRule>> shapes = new LinkedHashMap<>();
    private final LinkedHashMap<String, EnumDefinition> enums = new LinkedHashMap<>();
    private final ImmutableListMultimap.Builder<String, AliasDefinition> aliases = ImmutableListMultimap.builder();
    private final LinkedHashMap<String, SingleAlias> singleAliases = new LinkedHashMap<>();
    private final LinkedHashMap<String, LinkDefinition> links = new LinkedHashMap<>();
    private final List<String> origins = new ArrayList<>();

    private SchemaLoader() {}

    public static Schema load(SchemaSource... sources) throws SchemaLoadException {
        return load(List.of(sources));
    }

    public static Schema load(List<SchemaSource> sources) throws SchemaLoadException {
        var files = new ArrayList<SchemaFile>(sources.size());
        for (var source : sources) {
            files.add(SchemaParser.parse(source));
        }
        return merge(files);
    }

    /**
     * Merge already parsed files.
     *
     * @throws SchemaLoadException listing every problem found, in file order
     */
    public static Schema merge(List<SchemaFile> files) throws SchemaLoadException {
        return new SchemaLoader().build(files);
    }

    private Schema build(List<SchemaFile> files) throws SchemaLoadException {
        for (var file : files) {
            add(file);
        }
        var aliasMembers = aliases.build();
        var merged = mergeShapes();
        var checker = new ReferenceChecker(merged, aliasMembers);
        checker.checkAll();
        errors.addAll(new AliasCycleChecker(aliasMembers, singleAliases).check());
        if (!errors.isEmpty()) {
            LOG.warn("Schema load failed with {} errors", errors.size());
            throw new SchemaLoadException(errors);
        }
        var schema = new Schema(0,
                                origins,
                                ImmutableMap.copyOf(merged),
                                shapes.keySet(),
                                ImmutableMap.copyOf(enums),
                                aliasMembers,
                                ImmutableMap.copyOf(singleAliases),
                                ImmutableMap.copyOf(links));
        LOG.debug("Merged {} schema files into {}", files.size(), schema);
        return schema;
    }

    private void add(SchemaFile file) {
        origins.add(file.origin());
        errors.addAll(file.errors());
        for (var type : file.types()) {
            var previous = types.putIfAbsent(type.name(), type);
            if (previous != null) {
                errors.add(new SchemaError.DuplicateType(type.origin(), type.span(), type.name()));
            }
        }
        file.shapes()
            .forEach((name, rules) -> shapes.computeIfAbsent(name, k -> new ArrayList<>())
                                            .addAll(rules));
        for (var definition : file.enums()) {
            var previous = enums.get(definition.name());
            // enums split across files extend each other
            enums.put(definition.name(),
                      previous == null
                      ? definition
                      : previous.merge(definition));
        }
        for (var alias : file.aliases()) {
            aliases.put(alias.category(), alias);
        }
        for (var single : file.singleAliases()) {
            if (singleAliases.putIfAbsent(single.name(), single) != null) {
                errors.add(new SchemaError.InvalidDirective(single.origin(),
                                                            single.span(),
                                                            "single_alias[" + single.name() + "]",
                                                            "declared more than once"));
            }
        }
        for (var link : file.links()) {
            if (links.putIfAbsent(link.name(), link) != null) {
                errors.add(new SchemaError.InvalidDirective(link.origin(),
                                                            link.span(),
                                                            "link " + link.name(),
                                                            "declared more than once"));
            }
        }
    }

    private LinkedHashMap<String, SchemaType> mergeShapes() {
        var merged = new LinkedHashMap<String, SchemaType>();
        types.forEach((name, type) -> {
            var shape = shapes.get(name);
            if (shape == null) {
                LOG.debug("Type '{}' has no shape; only localisation is checked", name);
                merged.put(name, type);
            } else {
                merged.put(name, type.withRules(shape));
            }
        });
        return merged;
    }

    /**
     * Walks every rule of the merged set looking for names nothing defines.
     */
    private final class ReferenceChecker {
        private final Map<String, SchemaType> mergedTypes;
        private final ImmutableListMultimap<String, AliasDefinition> aliasMembers;
        private final Set<String> reported = new HashSet<>();

        ReferenceChecker(Map<String, SchemaType> mergedTypes, ImmutableListMultimap<String, AliasDefinition> aliasMembers) {
            this.mergedTypes = mergedTypes;
            this.aliasMembers = aliasMembers;
        }

        void checkAll() {
            for (var type : mergedTypes.values()) {
                checkRules(type.rules(), type);
                for (var subtype : type.subtypes()) {
                    checkRules(subtype.conditions(), type);
                }
            }
            for (var alias : aliasMembers.values()) {
                checkKey(alias.name(), null, alias.origin(), alias.span());
                checkValue(alias.value(), null, alias.origin(), alias.span());
            }
            for (var single : singleAliases.values()) {
                checkValue(single.value(), null, single.origin(), single.span());
            }
            for (var definition : enums.values()) {
                definition.source()
                          .ifPresent(source -> checkValue(source.nameStructure(),
                                                          null,
                                                          definition.origin(),
                                                          definition.span()));
            }
        }

        private void checkRules(List<SchemaRule> rules, SchemaType owner) {
            for (var rule : rules) {
                checkKey(rule.key(), owner, rule.origin(), rule.span());
                checkValue(rule.value(), owner, rule.origin(), rule.span());
            }
        }

        private void checkKey(KeySpec key, SchemaType owner, String origin, SourceSpan span) {
            if (key instanceof KeySpec.AliasName name) {
                require(aliasMembers.containsKey(name.category()), "alias category", name.category(), origin, span);
            } else if (key instanceof KeySpec.EnumRef ref) {
                require(enums.containsKey(ref.name()), "enum", ref.name(), origin, span);
            } else if (key instanceof KeySpec.TypeRef ref) {
                require(mergedTypes.containsKey(ref.type()), "type", ref.type(), origin, span);
            } else if (key instanceof KeySpec.SubtypeGroup group && owner != null) {
                require(owner.subtype(group.subtype())
                             .isPresent(), "subtype of " + owner.name(), group.subtype(), origin, span);
            }
        }

        private void checkValue(ValueSpec value, SchemaType owner, String origin, SourceSpan span) {
            if (value instanceof ValueSpec.AliasMatchLeft left) {
                require(aliasMembers.containsKey(left.category()), "alias category", left.category(), origin, span);
            } else if (value instanceof ValueSpec.SingleAliasRef ref) {
                require(singleAliases.containsKey(ref.name()), "single alias", ref.name(), origin, span);
            } else if (value instanceof ValueSpec.EnumRef ref) {
                require(enums.containsKey(ref.name()), "enum", ref.name(), origin, span);
            } else if (value instanceof ValueSpec.TypeRef ref) {
                require(mergedTypes.containsKey(ref.type()), "type", ref.type(), origin, span);
            } else if (value instanceof ValueSpec.Block block) {
                checkRules(block.rules(), owner);
                for (var element : block.values()) {
                    checkValue(element, owner, origin, span);
                }
            }
        }

        private void require(boolean defined, String kind, String name, String origin, SourceSpan span) {
            // one error per undefined name and site
            if (!defined && reported.add(kind + "/" + name + "@" + origin + ":" + span.start())) {
                errors.add(new SchemaError.UndefinedName(origin, span, kind, name));
            }
        }
    }
}
