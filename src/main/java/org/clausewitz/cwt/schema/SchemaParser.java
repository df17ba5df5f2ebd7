package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableList;
import org.clausewitz.cwt.error.SchemaError;
import org.clausewitz.cwt.lexer.Token;
import org.clausewitz.cwt.lexer.TokenKind;
import org.clausewitz.cwt.parser.ParserConfig;
import org.clausewitz.cwt.parser.ScriptParser;
import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.Entry;
import org.clausewitz.cwt.tree.Names;
import org.clausewitz.cwt.tree.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Parser for CWT schema text.
 *
 * <p>Schema files are Clausewitz script, so the text goes through {@link ScriptParser} with
 * comments kept. {@code ##} option comments and {@code ###} doc comments between two sibling
 * entries belong to the second one. The top level holds:
 * <pre>
 * types = { type[name] = { path = "game/..." subtype[s] = { ... } localisation = { ... } } }
 * enums = { enum[name] = { a b c } complex_enum[name] = { path = "..." name = { ... } } }
 * links = { owner = { input_scopes = { planet } output_scope = country } }
 * alias[category:name] = value
 * single_alias[name] = value
 * name = { ... }                    # shape of definitions of type 'name'
 * </pre>
 */
public final class SchemaParser {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaParser.class);

    private final String origin;
    private final List<Token> comments;
    private final int[] commentOffsets;
    private final List<SchemaError> errors = new ArrayList<>();
    private final OptionDirectives directives;

    private final List<SchemaType> types = new ArrayList<>();
    private final LinkedHashMap<String, List<SchemaRule>> shapes = new LinkedHashMap<>();
    private final List<EnumDefinition> enums = new ArrayList<>();
    private final List<AliasDefinition> aliases = new ArrayList<>();
    private final List<SingleAlias> singleAliases = new ArrayList<>();
    private final List<LinkDefinition> links = new ArrayList<>();

    private SchemaParser(String origin, List<Token> allComments) {
        this.origin = origin;
        this.comments = allComments.stream()
                                   .filter(c -> c.kind() == TokenKind.OPTION_COMMENT || c.kind() == TokenKind.DOC_COMMENT)
                                   .toList();
        this.commentOffsets = comments.stream()
                                      .mapToInt(c -> c.span()
                                                      .start()
                                                      .offset())
                                      .toArray();
        this.directives = new OptionDirectives(origin, errors);
    }

    public static SchemaFile parse(SchemaSource source) {
        return parse(source.text(), source.origin());
    }

    public static SchemaFile parse(String text, String origin) {
        var parsed = ScriptParser.parse(text, ParserConfig.SCHEMA);
        var parser = new SchemaParser(origin, parsed.comments());
        for (var diagnostic : parsed.diagnostics()) {
            parser.errors.add(new SchemaError.Syntax(origin, diagnostic.span(), diagnostic.message()));
        }
        parser.readTopLevel(parsed.root());
        var file = parser.toFile();
        LOG.debug("Parsed schema {}: {} types, {} shapes, {} enums, {} aliases, {} errors",
                  origin,
                  file.types()
                      .size(),
                  file.shapes()
                      .size(),
                  file.enums()
                      .size(),
                  file.aliases()
                      .size(),
                  file.errors()
                      .size());
        return file;
    }

    private SchemaFile toFile() {
        var frozenShapes = new LinkedHashMap<String, List<SchemaRule>>();
        shapes.forEach((name, rules) -> frozenShapes.put(name, ImmutableList.copyOf(rules)));
        return new SchemaFile(origin, types, frozenShapes, enums, aliases, singleAliases, links, errors);
    }

    private void readTopLevel(AstNode.Block root) {
        var cursor = new CommentCursor(root);
        for (var entry : root.entries()) {
            var options = cursor.optionsFor(entry);
            var key = entry.key()
                           .text();
            var alias = TypeExpressions.aliasKey(key);
            var singleAlias = TypeExpressions.argumentOf(key, "single_alias");
            if (entry.key()
                     .is("types")) {
                readTypes(entry);
            } else if (entry.key()
                            .is("enums")) {
                readEnums(entry);
            } else if (entry.key()
                            .is("links")) {
                readLinks(entry);
            } else if (alias.isPresent()) {
                aliases.add(new AliasDefinition(alias.get()
                                                     .category(),
                                                TypeExpressions.key(alias.get()
                                                                         .name(), false),
                                                entry.operator(),
                                                valueSpec(entry.value()),
                                                options,
                                                entry.span(),
                                                origin));
            } else if (singleAlias.isPresent()) {
                singleAliases.add(new SingleAlias(Names.folded(singleAlias.get()),
                                                  valueSpec(entry.value()),
                                                  options,
                                                  entry.span(),
                                                  origin));
            } else if (entry.value() instanceof AstNode.Block block) {
                shapes.computeIfAbsent(entry.key()
                                            .folded(), k -> new ArrayList<>())
                      .addAll(rules(block));
            } else {
                LOG.debug("{}: ignoring top-level '{}'", origin, key);
            }
        }
    }

    private void readTypes(Entry typesEntry) {
        if (!(typesEntry.value() instanceof AstNode.Block block)) {
            invalid(typesEntry, "types", "expected a block of type[...] declarations");
            return;
        }
        var cursor = new CommentCursor(block);
        for (var entry : block.entries()) {
            var options = cursor.optionsFor(entry);
            var name = TypeExpressions.argumentOf(entry.key()
                                                       .text(), "type");
            if (name.isEmpty() || name.get()
                                      .isBlank()) {
                invalid(entry, entry.key()
                                    .text(), "expected type[name]");
                continue;
            }
            if (!(entry.value() instanceof AstNode.Block body)) {
                invalid(entry, entry.key()
                                    .text(), "expected a block");
                continue;
            }
            types.add(readType(Names.folded(name.get()), body, options, entry));
        }
    }

    private SchemaType readType(String name, AstNode.Block body, RuleOptions typeOptions, Entry declaration) {
        var paths = new ArrayList<String>();
        Optional<String> pathFile = Optional.empty();
        Optional<String> pathExtension = Optional.empty();
        boolean pathStrict = false;
        Optional<String> nameField = Optional.empty();
        boolean unique = false;
        var skipRootKey = new ArrayList<String>();
        var options = typeOptions;
        var subtypes = new ArrayList<Subtype>();
        var localisation = new ArrayList<LocalisationRequirement>();

        var cursor = new CommentCursor(body);
        for (var entry : body.entries()) {
            var entryOptions = cursor.optionsFor(entry);
            var key = entry.key()
                           .folded();
            var subtypeName = TypeExpressions.argumentOf(key, "subtype");
            switch (key) {
                case "path" -> paths.add(entry.scalarText());
                case "path_file" -> pathFile = Optional.of(entry.scalarText());
                case "path_extension" -> pathExtension = Optional.of(entry.scalarText());
                case "path_strict" -> pathStrict = isYes(entry);
                case "name_field" -> nameField = Optional.of(entry.scalarText());
                case "unique" -> unique = isYes(entry);
                case "starts_with" -> options = options.withStartsWith(entry.scalarText());
                case "skip_root_key" -> skipRootKey.addAll(scalars(entry.value()));
                case "localisation" -> readLocalisation(entry, localisation);
                default -> {
                    if (subtypeName.isPresent()) {
                        if (entry.value() instanceof AstNode.Block conditions) {
                            subtypes.add(new Subtype(Names.folded(subtypeName.get()),
                                                     rules(conditions),
                                                     entryOptions,
                                                     entry.span()));
                        } else {
                            invalid(entry, entry.key()
                                                .text(), "expected a block of conditions");
                        }
                    } else {
                        LOG.debug("{}: ignoring '{}' in type[{}]", origin, key, name);
                    }
                }
            }
        }
        if (paths.isEmpty()) {
            invalid(declaration, "type[" + name + "]", "missing 'path'");
        }
        return new SchemaType(name,
                              paths,
                              pathFile,
                              pathExtension,
                              pathStrict,
                              nameField,
                              unique,
                              skipRootKey.stream()
                                         .map(Names::folded)
                                         .toList(),
                              options,
                              subtypes,
                              localisation,
                              List.of(),
                              declaration.span(),
                              origin);
    }

    private void readLocalisation(Entry entry, List<LocalisationRequirement> out) {
        if (!(entry.value() instanceof AstNode.Block block)) {
            invalid(entry, "localisation", "expected a block");
            return;
        }
        readLocalisation(block, Optional.empty(), out);
    }

    private void readLocalisation(AstNode.Block block, Optional<String> subtype, List<LocalisationRequirement> out) {
        var cursor = new CommentCursor(block);
        for (var entry : block.entries()) {
            var options = cursor.optionsFor(entry);
            var subtypeName = TypeExpressions.argumentOf(entry.key()
                                                              .text(), "subtype");
            if (subtypeName.isPresent() && entry.value() instanceof AstNode.Block nested) {
                readLocalisation(nested, Optional.of(Names.folded(subtypeName.get())), out);
            } else if (entry.value() instanceof AstNode.Scalar pattern) {
                out.add(new LocalisationRequirement(entry.key()
                                                         .folded(),
                                                    pattern.text(),
                                                    options.required(),
                                                    options.primary(),
                                                    subtype,
                                                    entry.span()));
            } else {
                invalid(entry, entry.key()
                                    .text(), "expected a localisation key pattern");
            }
        }
    }

    private void readEnums(Entry enumsEntry) {
        if (!(enumsEntry.value() instanceof AstNode.Block block)) {
            invalid(enumsEntry, "enums", "expected a block of enum[...] declarations");
            return;
        }
        for (var entry : block.entries()) {
            var key = entry.key()
                           .text();
            var closed = TypeExpressions.argumentOf(key, "enum");
            var complex = TypeExpressions.argumentOf(key, "complex_enum");
            if (closed.isPresent()) {
                enums.add(EnumDefinition.closed(Names.folded(closed.get()), scalars(entry.value()), entry.span(), origin));
            } else if (complex.isPresent()) {
                readComplexEnum(Names.folded(complex.get()), entry).ifPresent(enums::add);
            } else {
                invalid(entry, key, "expected enum[name] or complex_enum[name]");
            }
        }
    }

    private Optional<EnumDefinition> readComplexEnum(String name, Entry entry) {
        if (!(entry.value() instanceof AstNode.Block body)) {
            invalid(entry, entry.key()
                                .text(), "expected a block with 'path' and 'name'");
            return Optional.empty();
        }
        var paths = new ArrayList<String>();
        boolean startFromRoot = false;
        ValueSpec.Block structure = null;
        for (var field : body.entries()) {
            switch (field.key()
                         .folded()) {
                case "path" -> paths.add(field.scalarText());
                case "start_from_root" -> startFromRoot = isYes(field);
                case "name" -> {
                    if (valueSpec(field.value()) instanceof ValueSpec.Block block) {
                        structure = block;
                    } else {
                        invalid(field, "name", "expected a block describing where members sit");
                    }
                }
                default -> LOG.debug("{}: ignoring '{}' in complex_enum[{}]",
                                     origin,
                                     field.key()
                                          .text(),
                                     name);
            }
        }
        if (paths.isEmpty() || structure == null) {
            invalid(entry, "complex_enum[" + name + "]", "requires 'path' and 'name'");
            return Optional.empty();
        }
        return Optional.of(EnumDefinition.complex(name,
                                                  new ComplexEnumSource(paths, startFromRoot, structure),
                                                  entry.span(),
                                                  origin));
    }

    private void readLinks(Entry linksEntry) {
        if (!(linksEntry.value() instanceof AstNode.Block block)) {
            invalid(linksEntry, "links", "expected a block of link declarations");
            return;
        }
        for (var entry : block.entries()) {
            if (!(entry.value() instanceof AstNode.Block body)) {
                invalid(entry, entry.key()
                                    .text(), "a link must have a block value");
                continue;
            }
            var inputScopes = new ArrayList<String>();
            var outputScope = LinkDefinition.ANY;
            Optional<String> prefix = Optional.empty();
            boolean fromData = false;
            for (var field : body.entries()) {
                switch (field.key()
                             .folded()) {
                    case "input_scopes" -> inputScopes.addAll(scalars(field.value()));
                    case "output_scope" -> outputScope = field.scalarText();
                    case "prefix" -> prefix = Optional.of(field.scalarText());
                    case "from_data" -> fromData = isYes(field);
                    default -> {
                        // desc, type and data_source do not affect scope resolution
                    }
                }
            }
            links.add(new LinkDefinition(entry.key()
                                              .text(),
                                         inputScopes,
                                         outputScope,
                                         prefix,
                                         fromData,
                                         entry.span(),
                                         origin));
        }
    }

    private List<SchemaRule> rules(AstNode.Block block) {
        var rules = new ArrayList<SchemaRule>(block.entries()
                                                   .size());
        var cursor = new CommentCursor(block);
        for (var entry : block.entries()) {
            var options = cursor.optionsFor(entry);
            rules.add(new SchemaRule(TypeExpressions.key(entry.key()
                                                              .text(),
                                                         entry.key()
                                                              .quoted()),
                                     entry.operator(),
                                     valueSpec(entry.value()),
                                     options,
                                     entry.span(),
                                     origin));
        }
        return rules;
    }

    private ValueSpec valueSpec(AstNode node) {
        if (node instanceof AstNode.Scalar scalar) {
            return TypeExpressions.value(scalar.text(), scalar.quoted());
        }
        if (node instanceof AstNode.Block block) {
            return new ValueSpec.Block(rules(block), valueSpecs(block.values()));
        }
        if (node instanceof AstNode.Array array) {
            if (array.tag()
                     .isPresent()) {
                return new ValueSpec.Colour(Names.folded(array.tag()
                                                              .get()));
            }
            return new ValueSpec.Block(List.of(), valueSpecs(array.elements()));
        }
        var reference = (AstNode.Reference) node;
        errors.add(new SchemaError.InvalidDirective(origin,
                                                    reference.span(),
                                                    reference.name(),
                                                    "references are not allowed in schema rules"));
        return ValueSpec.Literal.of(reference.name());
    }

    private List<ValueSpec> valueSpecs(List<AstNode> nodes) {
        var specs = new ArrayList<ValueSpec>(nodes.size());
        for (var node : nodes) {
            specs.add(valueSpec(node));
        }
        return specs;
    }

    private static List<String> scalars(AstNode node) {
        if (node instanceof AstNode.Scalar scalar) {
            return List.of(scalar.text());
        }
        if (node instanceof AstNode.Array array) {
            return array.elements()
                        .stream()
                        .filter(AstNode.Scalar.class::isInstance)
                        .map(e -> ((AstNode.Scalar) e).text())
                        .toList();
        }
        if (node instanceof AstNode.Block block) {
            return block.values()
                        .stream()
                        .filter(AstNode.Scalar.class::isInstance)
                        .map(e -> ((AstNode.Scalar) e).text())
                        .toList();
        }
        return List.of();
    }

    private static boolean isYes(Entry entry) {
        return entry.operator() == Operator.EQUALS && entry.scalarText()
                                                           .equalsIgnoreCase("yes");
    }

    private void invalid(Entry entry, String directive, String reason) {
        errors.add(new SchemaError.InvalidDirective(origin, entry.span(), directive, reason));
    }

    /**
     * Walks the entries of one block and hands each the option comments written since the previous
     * sibling ended. Comments on the previous sibling's last line trail that sibling and are skipped.
     */
    private final class CommentCursor {
        private int fromOffset;
        private int afterLine;

        CommentCursor(AstNode.Block block) {
            this.fromOffset = block.span()
                                   .start()
                                   .offset();
            this.afterLine = 0;
        }

        RuleOptions optionsFor(Entry entry) {
            var before = entry.span()
                              .start()
                              .offset();
            var found = new ArrayList<Token>();
            for (int i = firstAtOrAfter(fromOffset); i < comments.size() && commentOffsets[i] < before; i++) {
                var comment = comments.get(i);
                if (comment.span()
                           .start()
                           .line() > afterLine) {
                    found.add(comment);
                }
            }
            fromOffset = entry.span()
                              .end()
                              .offset();
            afterLine = entry.span()
                             .end()
                             .line();
            return found.isEmpty()
                   ? RuleOptions.NONE
                   : directives.parse(found);
        }

        private int firstAtOrAfter(int offset) {
            int low = 0;
            int high = commentOffsets.length;
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (commentOffsets[mid] < offset) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return low;
        }
    }
}
