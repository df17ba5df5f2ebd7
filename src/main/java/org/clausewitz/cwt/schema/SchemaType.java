package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableList;
import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.Entry;
import org.clausewitz.cwt.tree.Names;
import org.clausewitz.cwt.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A definition type declared as {@code type[name] = { ... }} in a {@code types} block, together
 * with its shape (the top-level {@code name = { ... }} block of the schema).
 *
 * @param name          Folded type name
 * @param paths         Workspace directories holding definitions of this type ({@code game/} stripped)
 * @param pathFile      Restricts to one file name
 * @param pathExtension Restricts to one file extension, including the dot
 * @param pathStrict    Files must sit directly in one of {@code paths}, not in subdirectories
 * @param nameField     Key whose value names a definition; otherwise the entry key is the name
 * @param unique        Names must not repeat across the workspace
 * @param skipRootKey   Wrapper keys that enclose the definitions in each file
 * @param options       Type options ({@code starts_with}, {@code type_key_filter}, ...)
 * @param subtypes      Subtype predicates in declaration order
 * @param localisation  Localisation requirements
 * @param rules         The shape of a definition block
 */
public record SchemaType(
    String name,
    List<String> paths,
    Optional<String> pathFile,
    Optional<String> pathExtension,
    boolean pathStrict,
    Optional<String> nameField,
    boolean unique,
    List<String> skipRootKey,
    RuleOptions options,
    List<Subtype> subtypes,
    List<LocalisationRequirement> localisation,
    List<SchemaRule> rules,
    SourceSpan span,
    String origin
) {
    private static final String GAME_PREFIX = "game/";

    public SchemaType {
        paths = paths.stream()
                     .map(SchemaType::normalizePath)
                     .collect(ImmutableList.toImmutableList());
        skipRootKey = ImmutableList.copyOf(skipRootKey);
        subtypes = ImmutableList.copyOf(subtypes);
        localisation = ImmutableList.copyOf(localisation);
        rules = ImmutableList.copyOf(rules);
    }

    public SchemaType withRules(List<SchemaRule> shape) {
        return new SchemaType(name,
                              paths,
                              pathFile,
                              pathExtension,
                              pathStrict,
                              nameField,
                              unique,
                              skipRootKey,
                              options,
                              subtypes,
                              localisation,
                              shape,
                              span,
                              origin);
    }

    public Optional<Subtype> subtype(String subtypeName) {
        var folded = Names.folded(subtypeName);
        return subtypes.stream()
                       .filter(s -> s.name()
                                     .equals(folded))
                       .findFirst();
    }

    /**
     * Whether a workspace-relative file path holds definitions of this type.
     */
    public boolean matchesPath(String relativePath) {
        var path = normalizePath(relativePath);
        int slash = path.lastIndexOf('/');
        var directory = slash < 0
                        ? ""
                        : path.substring(0, slash);
        var fileName = path.substring(slash + 1);
        if (pathFile.isPresent() && !pathFile.get()
                                             .equalsIgnoreCase(fileName)) {
            return false;
        }
        if (pathExtension.isPresent() && !fileName.endsWith(pathExtension.get()
                                                                         .toLowerCase(Locale.ROOT))) {
            return false;
        }
        for (var candidate : paths) {
            if (pathStrict
                ? directory.equals(candidate)
                : directory.equals(candidate) || directory.startsWith(candidate + "/")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether a top-level entry of a matching file is a definition of this type.
     */
    public boolean acceptsKey(Entry entry) {
        if (!(entry.value() instanceof AstNode.Block)) {
            return false;
        }
        var key = entry.key()
                       .folded();
        if (options.startsWith()
                   .isPresent() && !key.startsWith(Names.folded(options.startsWith()
                                                                       .get()))) {
            return false;
        }
        return options.typeKeyFilter()
                      .map(filter -> filter.accepts(key))
                      .orElse(true);
    }

    /**
     * Definition entries of this type in a file root, after descending through {@code skip_root_key}
     * wrappers ({@code any} matches every wrapper key).
     */
    public List<Entry> definitions(AstNode.Block root) {
        List<AstNode.Block> level = List.of(root);
        for (var wrapper : skipRootKey) {
            var next = new ArrayList<AstNode.Block>();
            for (var block : level) {
                for (var entry : block.entries()) {
                    if (entry.value() instanceof AstNode.Block inner && (wrapper.equals("any") || entry.key()
                                                                                                       .is(wrapper))) {
                        next.add(inner);
                    }
                }
            }
            level = next;
        }
        var result = new ArrayList<Entry>();
        for (var block : level) {
            for (var entry : block.entries()) {
                if (acceptsKey(entry)) {
                    result.add(entry);
                }
            }
        }
        return result;
    }

    /**
     * Name of the definition held by {@code entry}: the entry key, or the {@code name_field} value.
     */
    public Optional<String> definitionName(Entry entry) {
        if (nameField.isEmpty()) {
            return Optional.of(entry.key()
                                    .text());
        }
        if (entry.value() instanceof AstNode.Block block) {
            return block.first(nameField.get())
                        .map(Entry::scalarText)
                        .filter(text -> !text.isEmpty());
        }
        return Optional.empty();
    }

    static String normalizePath(String path) {
        var normalized = path.replace('\\', '/')
                             .toLowerCase(Locale.ROOT);
        if (normalized.startsWith(GAME_PREFIX)) {
            normalized = normalized.substring(GAME_PREFIX.length());
        }
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
