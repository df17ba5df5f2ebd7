package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.error.Diagnostic;
import org.clausewitz.cwt.error.Diagnostic.Severity;
import org.clausewitz.cwt.error.DiagnosticCode;
import org.clausewitz.cwt.error.EngineDefectException;
import org.clausewitz.cwt.schema.KeySpec;
import org.clausewitz.cwt.schema.RuleOptions;
import org.clausewitz.cwt.schema.Schema;
import org.clausewitz.cwt.schema.SchemaRule;
import org.clausewitz.cwt.schema.SchemaType;
import org.clausewitz.cwt.schema.SimpleType;
import org.clausewitz.cwt.schema.ValueSpec;
import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.Entry;
import org.clausewitz.cwt.tree.Key;
import org.clausewitz.cwt.tree.Operator;
import org.clausewitz.cwt.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Checks script definitions against a schema snapshot.
 *
 * <p>The traversal walks each definition block depth-first alongside its rules. At every block it
 * merges the base rules with those of the definition's subtypes, matches entries to rules, checks
 * values, and finally checks how often each rule matched. Scope changes declared on a rule apply
 * to that rule's value only.
 *
 * <p>Values declared through {@code value_set[name]} are gathered along the way;
 * {@link #collectValueSets} returns them for the workspace index.
 *
 * <p>The cancellation token is polled at every block boundary. A cancelled pass returns
 * {@link ValidationOutcome.Cancelled} and none of its diagnostics.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class Validator {
    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private static final Set<Operator> RELATIONAL = EnumSet.of(Operator.LESS,
                                                               Operator.LESS_OR_EQUAL,
                                                               Operator.GREATER,
                                                               Operator.GREATER_OR_EQUAL);

    private final Schema schema;
    private final SymbolLookup symbols;
    private final LocalisationOracle localisation;
    private final ValidatorConfig config;

    public Validator(Schema schema, SymbolLookup symbols, LocalisationOracle localisation, ValidatorConfig config) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.localisation = Objects.requireNonNull(localisation, "localisation");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Validator with no known symbols and every localisation key present.
     */
    public static Validator of(Schema schema) {
        return new Validator(schema, SymbolLookup.EMPTY, LocalisationOracle.ACCEPT_ALL, ValidatorConfig.DEFAULT);
    }

    public Schema schema() {
        return schema;
    }

    public ValidatorConfig config() {
        return config;
    }

    public ValidationOutcome validate(AstNode.Block root, SchemaType type, ScopeContext scope) {
        return validate(root, type, scope, CancellationToken.NEVER);
    }

    /**
     * Validate every definition of {@code type} in a file root.
     *
     * @param scope Bindings at the top of each definition
     */
    public ValidationOutcome validate(AstNode.Block root, SchemaType type, ScopeContext scope, CancellationToken token) {
        var run = new Run(token);
        run.validateType(root, type, scope);
        return run.outcome();
    }

    /**
     * Validate a file against every schema type whose path patterns cover it.
     */
    public ValidationOutcome validateFile(AstNode.Block root, String relativePath, CancellationToken token) {
        var run = new Run(token);
        for (var type : schema.typesForPath(relativePath)) {
            run.validateType(root, type, ScopeContext.UNKNOWN);
        }
        return run.outcome();
    }

    /**
     * Values a file declares through {@code value_set[name]}, from the rule alternatives that
     * fit each entry best.
     */
    public List<DeclaredValue> collectValueSets(AstNode.Block root, String relativePath) {
        var run = new Run(CancellationToken.NEVER);
        for (var type : schema.typesForPath(relativePath)) {
            run.validateType(root, type, ScopeContext.UNKNOWN);
        }
        return List.copyOf(run.declared);
    }

    private static ScopeContext enter(ScopeContext scope, RuleOptions options) {
        var result = scope;
        if (options.pushScope()
                   .isPresent()) {
            result = result.push(options.pushScope()
                                        .get());
        }
        return result.replace(options.replaceScope());
    }

    private record Context(SchemaType type, List<String> subtypes, ScopeContext scope) {
        Context withScope(ScopeContext next) {
            return next.equals(scope)
                   ? this
                   : new Context(type, subtypes, next);
        }
    }

    /**
     * State of one validation pass.
     */
    private final class Run {
        private final CancellationToken token;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final List<DeclaredValue> declared = new ArrayList<>();
        private boolean cancelled;

        Run(CancellationToken token) {
            this.token = token;
        }

        ValidationOutcome outcome() {
            if (cancelled) {
                LOG.debug("Validation cancelled after {} diagnostics", diagnostics.size());
                return ValidationOutcome.CANCELLED;
            }
            diagnostics.sort(Comparator.comparing(d -> d.span()
                                                        .start()));
            return new ValidationOutcome.Completed(diagnostics);
        }

        private boolean checkpoint() {
            if (!cancelled && token.isCancelled()) {
                cancelled = true;
            }
            return !cancelled;
        }

        void validateType(AstNode.Block root, SchemaType type, ScopeContext scope) {
            if (!checkpoint()) {
                return;
            }
            for (var definition : type.definitions(root)) {
                if (!checkpoint()) {
                    return;
                }
                validateDefinition(definition, type, scope);
            }
        }

        private void validateDefinition(Entry definition, SchemaType type, ScopeContext scope) {
            var block = (AstNode.Block) definition.value();
            var subtypes = SubtypeMatcher.matching(type, definition);
            var ctx = new Context(type, subtypes, initialScope(type, subtypes, scope));
            if (schema.isShaped(type.name())) {
                checkBlock(block,
                           type.rules(),
                           List.of(),
                           ctx,
                           definition.key()
                                     .span(),
                           diagnostics);
            }
            checkLocalisation(definition, type, subtypes);
        }

        private ScopeContext initialScope(SchemaType type, List<String> subtypes, ScopeContext scope) {
            var result = type.options()
                             .pushScope()
                             .map(ScopeContext::of)
                             .orElse(scope);
            result = result.replace(type.options()
                                        .replaceScope());
            for (var name : subtypes) {
                var options = type.subtype(name)
                                  .orElseThrow()
                                  .options();
                if (options.pushScope()
                           .isPresent()) {
                    result = ScopeContext.of(options.pushScope()
                                                    .get());
                }
                result = result.replace(options.replaceScope());
            }
            return result;
        }

        private void checkLocalisation(Entry definition, SchemaType type, List<String> subtypes) {
            var name = type.definitionName(definition);
            if (name.isEmpty()) {
                return;
            }
            for (var requirement : type.localisation()) {
                if (!requirement.required() || requirement.subtype()
                                                          .filter(s -> !subtypes.contains(s))
                                                          .isPresent()) {
                    continue;
                }
                var key = requirement.resolve(name.get());
                if (!localisation.exists(key)) {
                    diagnostics.add(Diagnostic.of(config.localisationSeverity(),
                                                  DiagnosticCode.MISSING_LOCALISATION_KEY,
                                                  "Missing localisation key '" + key + "' for " + type.name() + " '"
                                                  + name.get() + "'",
                                                  definition.key()
                                                            .span())
                                              .withDetail("key", key)
                                              .withDetail("requirement", requirement.name()));
                }
            }
        }

        private void checkBlock(AstNode.Block block,
                                List<SchemaRule> rules,
                                List<ValueSpec> valueSpecs,
                                Context ctx,
                                SourceSpan anchor,
                                List<Diagnostic> out) {
            if (!checkpoint()) {
                return;
            }
            var ruleSet = RuleSet.forBlock(rules, ctx.subtypes());
            var counts = new int[ruleSet.size()];
            var excess = new Entry[ruleSet.size()];
            checkItems(block, ruleSet, valueSpecs, ctx, counts, excess, out);
            if (!cancelled) {
                checkCardinality(ruleSet, counts, excess, anchor, out);
            }
        }

        /**
         * Match and check the entries and bare values of {@code block}, tallying rule matches into
         * {@code counts}. Conditional sections are checked against the same rules, but their
         * matches are tallied apart and never reach the enclosing block's cardinality.
         */
        private void checkItems(AstNode.Block block,
                                RuleSet ruleSet,
                                List<ValueSpec> valueSpecs,
                                Context ctx,
                                int[] counts,
                                Entry[] excess,
                                List<Diagnostic> out) {
            boolean lenient = config.lenientWildcardBlocks() && ruleSet.hasWildcard();
            for (var entry : block.entries()) {
                if (cancelled) {
                    return;
                }
                int index = ruleSet.literal(entry.key()
                                                 .folded());
                List<SchemaRule> candidates = index >= 0
                                              ? ruleSet.group(index)
                                                       .alternatives()
                                              : List.of();
                if (index < 0) {
                    for (int pattern : ruleSet.patterns()) {
                        candidates = patternCandidates(ruleSet.group(pattern), entry.key());
                        if (!candidates.isEmpty()) {
                            index = pattern;
                            break;
                        }
                    }
                }
                if (index < 0) {
                    reportUnmatched(entry, ruleSet, lenient, out);
                    continue;
                }
                var group = ruleSet.group(index);
                counts[index]++;
                if (counts[index] > group.cardinality()
                                         .max() && excess[index] == null) {
                    excess[index] = entry;
                }
                if (!group.cardinality()
                          .isForbidden()) {
                    checkEntry(entry, candidates, ctx, out);
                }
            }
            checkBareValues(block.values(), valueSpecs, ctx, out);
            for (var conditional : block.conditionals()) {
                if (!checkpoint()) {
                    return;
                }
                checkItems(conditional.body(),
                           ruleSet,
                           valueSpecs,
                           ctx,
                           new int[ruleSet.size()],
                           new Entry[ruleSet.size()],
                           out);
            }
        }

        private List<SchemaRule> patternCandidates(RuleSet.Group group, Key key) {
            if (group.key() instanceof KeySpec.AliasName slot) {
                var expansion = schema.aliases()
                                      .expand(slot.category(), group.first());
                var named = expansion.named(key.folded());
                if (!named.isEmpty()) {
                    return named;
                }
                return expansion.patterns()
                                .stream()
                                .filter(member -> KeyMatcher.matches(member.key(), key, schema, symbols))
                                .toList();
            }
            return KeyMatcher.matches(group.key(), key, schema, symbols)
                   ? group.alternatives()
                   : List.of();
        }

        private void reportUnmatched(Entry entry, RuleSet ruleSet, boolean lenient, List<Diagnostic> out) {
            var key = entry.key();
            if (ruleSet.hasAliasSlot()) {
                var categories = String.join(", ", ruleSet.aliasCategories());
                out.add(Diagnostic.error(DiagnosticCode.UNRESOLVED_ALIAS,
                                         "'" + key.text() + "' is not a known " + categories,
                                         key.span())
                                  .withDetail("key", key.text())
                                  .withDetail("categories", categories));
                return;
            }
            if (lenient || config.unexpectedKeySeverity()
                                 .isEmpty()) {
                return;
            }
            out.add(Diagnostic.of(config.unexpectedKeySeverity()
                                        .get(),
                                  DiagnosticCode.UNEXPECTED_KEY,
                                  "Unexpected key '" + key.text() + "'",
                                  key.span())
                              .withDetail("key", key.text()));
        }

        private void checkEntry(Entry entry, List<SchemaRule> candidates, Context ctx, List<Diagnostic> out) {
            out.addAll(firstFit(candidates, (rule, sink) -> checkRule(entry, rule, ctx, sink)));
        }

        /**
         * Diagnostics of the first option that produces none, else of the option that produces fewest.
         * Only the chosen option's declared values are kept.
         */
        private <T> List<Diagnostic> firstFit(List<T> options, BiConsumer<T, List<Diagnostic>> check) {
            List<Diagnostic> best = null;
            List<DeclaredValue> bestDeclared = List.of();
            int mark = declared.size();
            for (var option : options) {
                var sink = new ArrayList<Diagnostic>();
                check.accept(option, sink);
                if (sink.isEmpty() || cancelled) {
                    return sink;
                }
                var optionDeclared = declaredSince(mark);
                if (best == null || sink.size() < best.size()) {
                    best = sink;
                    bestDeclared = optionDeclared;
                }
            }
            declared.addAll(bestDeclared);
            return best == null
                   ? List.of()
                   : best;
        }

        private List<DeclaredValue> declaredSince(int mark) {
            var tail = declared.subList(mark, declared.size());
            var taken = List.copyOf(tail);
            tail.clear();
            return taken;
        }

        private void checkRule(Entry entry, SchemaRule rule, Context ctx, List<Diagnostic> sink) {
            int start = sink.size();
            var options = rule.options();
            if (!options.scopes()
                        .isEmpty() && !ctx.scope()
                                          .allows(options.scopes())) {
                sink.add(Diagnostic.error(DiagnosticCode.SCOPE_MISMATCH,
                                          "'" + entry.key()
                                                     .text() + "' is not valid in " + ctx.scope()
                                                                                         .current()
                                                                                         .orElse(ScopeContext.ANY)
                                          + " scope, expected " + String.join(" or ", options.scopes()),
                                          entry.key()
                                               .span())
                                   .withDetail("scope",
                                               ctx.scope()
                                                  .current()
                                                  .orElse(ScopeContext.ANY)));
            }
            if (RELATIONAL.contains(entry.operator()) && rule.operator() == Operator.EQUALS) {
                sink.add(Diagnostic.error(DiagnosticCode.TYPE_MISMATCH,
                                          "Operator '" + entry.operator()
                                                              .symbol() + "' is not allowed for '" + entry.key()
                                                                                                         .text() + "'",
                                          entry.span()));
            }
            var scope = ctx.scope();
            if (rule.key() instanceof KeySpec.ScopeRef) {
                scope = enterScopeKey(entry.key(), scope, sink);
            } else if (rule.key() instanceof KeySpec.DynamicValue dynamic && dynamic.declares()) {
                declared.add(new DeclaredValue(dynamic.name(),
                                               entry.key()
                                                    .text(),
                                               entry.key()
                                                    .span()));
            }
            checkValue(entry.value(), rule.value(), entry.key(), ctx.withScope(enter(scope, options)), sink, 0);
            if (options.severity()
                       .isPresent()) {
                var severity = options.severity()
                                      .get();
                for (int i = start; i < sink.size(); i++) {
                    sink.set(i,
                             sink.get(i)
                                 .withSeverity(severity));
                }
            }
        }

        /**
         * Scope inside a block keyed by a scope path such as {@code owner = { ... }}.
         */
        private ScopeContext enterScopeKey(Key key, ScopeContext scope, List<Diagnostic> sink) {
            scope.misusedLink(key.text(), schema)
                 .ifPresent(misuse -> sink.add(linkMisuse(misuse, key.span())));
            return scope.push(scope.resolve(key.text(), schema)
                                   .orElse(ScopeContext.ANY));
        }

        private void checkValue(AstNode value, ValueSpec spec, Key key, Context ctx, List<Diagnostic> sink, int depth) {
            if (value instanceof AstNode.Reference) {
                // variables, inline maths and parameters resolve outside the file
                return;
            }
            if (spec instanceof ValueSpec.Block block) {
                checkBlockValue(value, block, key, ctx, sink);
            } else if (spec instanceof ValueSpec.Colour) {
                checkColour(value, spec, sink);
            } else if (spec instanceof ValueSpec.AliasMatchLeft left) {
                checkAliasValue(value, left, key, ctx, sink, depth);
            } else if (spec instanceof ValueSpec.SingleAliasRef ref) {
                checkSingleAlias(value, ref, key, ctx, sink, depth);
            } else if (value instanceof AstNode.Scalar scalar) {
                checkScalar(scalar, spec, ctx, sink);
            } else {
                sink.add(mismatch(spec, value));
            }
        }

        private void checkBlockValue(AstNode value, ValueSpec.Block spec, Key key, Context ctx, List<Diagnostic> sink) {
            AstNode.Block block;
            if (value instanceof AstNode.Block b) {
                block = b;
            } else if (value instanceof AstNode.Array array && array.tag()
                                                                     .isEmpty()) {
                block = new AstNode.Block(array.span(), List.of(), array.elements());
            } else {
                sink.add(Diagnostic.error(DiagnosticCode.TYPE_MISMATCH,
                                          "Expected a block, found " + ValueShapes.describe(value),
                                          value.span()));
                return;
            }
            checkBlock(block,
                       spec.rules(),
                       spec.values(),
                       ctx,
                       key == null
                       ? value.span()
                       : key.span(),
                       sink);
        }

        private void checkBareValues(List<AstNode> values, List<ValueSpec> specs, Context ctx, List<Diagnostic> out) {
            for (var value : values) {
                if (cancelled) {
                    return;
                }
                if (specs.isEmpty()) {
                    config.unexpectedKeySeverity()
                          .ifPresent(severity -> out.add(Diagnostic.of(severity,
                                                                       DiagnosticCode.UNEXPECTED_KEY,
                                                                       "Unexpected value " + ValueShapes.describe(value),
                                                                       value.span())));
                    continue;
                }
                out.addAll(firstFit(specs, (spec, sink) -> checkValue(value, spec, null, ctx, sink, 0)));
            }
        }

        private void checkColour(AstNode value, ValueSpec spec, List<Diagnostic> sink) {
            if (value instanceof AstNode.Array array) {
                if (array.tag()
                         .isPresent()) {
                    return;
                }
                var elements = array.elements();
                boolean numeric = elements.stream()
                                          .allMatch(e -> e instanceof AstNode.Scalar s && ValueShapes.isFloat(s.text()));
                if (numeric && elements.size() >= 3 && elements.size() <= 4) {
                    return;
                }
            }
            sink.add(mismatch(spec, value));
        }

        private void checkAliasValue(AstNode value,
                                     ValueSpec.AliasMatchLeft left,
                                     Key key,
                                     Context ctx,
                                     List<Diagnostic> sink,
                                     int depth) {
            if (key == null) {
                sink.add(Diagnostic.error(DiagnosticCode.UNRESOLVED_ALIAS,
                                          "A bare value cannot select a member of " + left.category(),
                                          value.span()));
                return;
            }
            var expansion = schema.aliases()
                                  .expand(left.category());
            List<SchemaRule> members = expansion.named(key.folded());
            if (members.isEmpty()) {
                members = expansion.patterns()
                                   .stream()
                                   .filter(member -> KeyMatcher.matches(member.key(), key, schema, symbols))
                                   .toList();
            }
            if (members.isEmpty()) {
                sink.add(Diagnostic.error(DiagnosticCode.UNRESOLVED_ALIAS,
                                          "'" + key.text() + "' is not a known " + left.category(),
                                          key.span())
                                   .withDetail("key", key.text())
                                   .withDetail("categories", left.category()));
                return;
            }
            sink.addAll(firstFit(members,
                                 (member, memberSink) -> checkValue(value,
                                                                    member.value(),
                                                                    key,
                                                                    ctx.withScope(enter(ctx.scope(), member.options())),
                                                                    memberSink,
                                                                    depth + 1)));
        }

        private void checkSingleAlias(AstNode value,
                                      ValueSpec.SingleAliasRef ref,
                                      Key key,
                                      Context ctx,
                                      List<Diagnostic> sink,
                                      int depth) {
            if (depth >= config.maxAliasDepth()) {
                throw new EngineDefectException("Alias expansion deeper than " + config.maxAliasDepth()
                                                + " levels at single_alias[" + ref.name() + "]");
            }
            var single = schema.singleAlias(ref.name())
                               .orElseThrow(() -> new EngineDefectException("single_alias[" + ref.name()
                                                                            + "] missing from a loaded schema"));
            checkValue(value,
                       single.value(),
                       key,
                       ctx.withScope(enter(ctx.scope(), single.options())),
                       sink,
                       depth + 1);
        }

        private void checkScalar(AstNode.Scalar scalar, ValueSpec spec, Context ctx, List<Diagnostic> sink) {
            var text = scalar.text();
            if (spec instanceof ValueSpec.Literal literal) {
                if (!scalar.folded()
                           .equals(literal.folded())) {
                    sink.add(mismatch(spec, scalar));
                }
            } else if (spec instanceof ValueSpec.Simple simple) {
                checkSimple(scalar, simple, sink);
            } else if (spec instanceof ValueSpec.EnumRef ref) {
                var definition = schema.enumDefinition(ref.name());
                if (definition.isPresent() && !KeyMatcher.isMember(definition.get(), text, symbols)) {
                    sink.add(Diagnostic.error(DiagnosticCode.UNKNOWN_ENUM_VALUE,
                                              "'" + text + "' is not a value of enum[" + ref.name() + "]",
                                              scalar.span())
                                       .withDetail("enum", ref.name())
                                       .withDetail("value", text));
                }
            } else if (spec instanceof ValueSpec.TypeRef ref) {
                var name = KeyMatcher.unwrap(text, ref.prefix(), ref.suffix());
                if (name.isEmpty()) {
                    sink.add(mismatch(spec, scalar));
                } else if (!symbols.exists(ref.type(), name.get())) {
                    sink.add(Diagnostic.error(DiagnosticCode.UNDEFINED_REFERENCE,
                                              "Undefined " + ref.type() + " '" + name.get() + "'",
                                              scalar.span())
                                       .withDetail("type", ref.type())
                                       .withDetail("name", name.get()));
                }
            } else if (spec instanceof ValueSpec.ScopeRef ref) {
                checkScope(scalar, ref.scope(), ctx, sink);
            } else if (spec instanceof ValueSpec.DynamicValue dynamic) {
                checkDynamicValue(scalar, dynamic, sink);
            }
        }

        private void checkDynamicValue(AstNode.Scalar scalar, ValueSpec.DynamicValue dynamic, List<Diagnostic> sink) {
            if (dynamic.declares()) {
                declared.add(new DeclaredValue(dynamic.name(), scalar.text(), scalar.span()));
                return;
            }
            if (!symbols.accepts(SymbolLookup.valueSetNamespace(dynamic.name()), scalar.text())) {
                sink.add(Diagnostic.error(DiagnosticCode.UNDEFINED_REFERENCE,
                                          "'" + scalar.text() + "' is never set as a " + dynamic.name(),
                                          scalar.span())
                                   .withDetail("value_set", dynamic.name())
                                   .withDetail("name", scalar.text()));
            }
        }

        private Diagnostic linkMisuse(ScopeContext.LinkMisuse misuse, SourceSpan span) {
            var link = misuse.link();
            return Diagnostic.error(DiagnosticCode.SCOPE_MISMATCH,
                                    "'" + misuse.segment() + "' cannot be used from " + misuse.scope() + " scope",
                                    span)
                             .withDetail("link", link.name())
                             .withDetail("scope", misuse.scope())
                             .withHelp("'" + link.name() + "' is usable from " + String.join(" or ", link.inputScopes()));
        }

        private void checkScope(AstNode.Scalar scalar, String expected, Context ctx, List<Diagnostic> sink) {
            var misuse = ctx.scope()
                            .misusedLink(scalar.text(), schema);
            if (misuse.isPresent()) {
                sink.add(linkMisuse(misuse.get(), scalar.span()));
                return;
            }
            var resolved = ctx.scope()
                              .resolve(scalar.text(), schema);
            if (resolved.isEmpty() || expected.equals(ScopeContext.ANY) || resolved.get()
                                                                                  .equals(ScopeContext.ANY)) {
                return;
            }
            if (!resolved.get()
                         .equals(expected)) {
                sink.add(Diagnostic.error(DiagnosticCode.SCOPE_MISMATCH,
                                          "'" + scalar.text() + "' is a " + resolved.get() + " scope, expected "
                                          + expected,
                                          scalar.span())
                                   .withDetail("expected", expected)
                                   .withDetail("actual", resolved.get()));
            }
        }

        private void checkSimple(AstNode.Scalar scalar, ValueSpec.Simple spec, List<Diagnostic> sink) {
            var text = scalar.text();
            var type = spec.type();
            boolean shapeOk = switch (type) {
                case BOOL -> ValueShapes.isBool(text);
                case INT -> ValueShapes.isInt(text);
                case FLOAT -> ValueShapes.isFloat(text);
                case PERCENTAGE_FIELD -> ValueShapes.isPercentage(text);
                case DATE_FIELD -> ValueShapes.isDate(text);
                case INT_VARIABLE_FIELD, INT_VALUE_FIELD -> !ValueShapes.isFloat(text) || ValueShapes.isInt(text);
                default -> true;
            };
            if (!shapeOk) {
                sink.add(mismatch(spec, scalar));
                return;
            }
            if (type == SimpleType.LOCALISATION || type == SimpleType.LOCALISATION_SYNCED) {
                checkLocalisationValue(scalar, sink);
                return;
            }
            if (spec.range()
                    .isPresent() && type.acceptsRange()) {
                var number = ValueShapes.number(text);
                var range = spec.range()
                                .get();
                if (number.isPresent() && !range.contains(number.getAsDouble())) {
                    sink.add(Diagnostic.error(DiagnosticCode.TYPE_MISMATCH,
                                              "Value " + text + " is outside " + spec.describe(),
                                              scalar.span())
                                       .withDetail("min", range.min())
                                       .withDetail("max", range.max()));
                }
            }
        }

        private void checkLocalisationValue(AstNode.Scalar scalar, List<Diagnostic> sink) {
            var text = scalar.text();
            // quoted text with spaces is inline display text, not a key
            if (scalar.quoted() && text.indexOf(' ') >= 0) {
                return;
            }
            if (!localisation.exists(text)) {
                sink.add(Diagnostic.of(config.localisationSeverity(),
                                       DiagnosticCode.MISSING_LOCALISATION_KEY,
                                       "Missing localisation key '" + text + "'",
                                       scalar.span())
                                   .withDetail("key", text));
            }
        }

        private Diagnostic mismatch(ValueSpec spec, AstNode value) {
            return Diagnostic.error(DiagnosticCode.TYPE_MISMATCH,
                                    "Expected " + spec.describe() + ", found " + ValueShapes.describe(value),
                                    value.span())
                             .withDetail("expected", spec.describe());
        }

        private void checkCardinality(RuleSet ruleSet, int[] counts, Entry[] excess, SourceSpan anchor, List<Diagnostic> out) {
            for (int i = 0; i < ruleSet.size(); i++) {
                var group = ruleSet.group(i);
                var cardinality = group.cardinality();
                int count = counts[i];
                if (cardinality.isSatisfied(count)) {
                    continue;
                }
                var rule = group.first();
                var severity = rule.options()
                                   .severity()
                                   .orElse(cardinality.soft()
                                           ? Severity.WARNING
                                           : Severity.ERROR);
                var name = group.key()
                                .describe();
                Diagnostic diagnostic;
                if (count == 0) {
                    diagnostic = Diagnostic.of(severity,
                                               DiagnosticCode.MISSING_REQUIRED_KEY,
                                               "Missing required key '" + name + "'",
                                               anchor);
                } else if (count < cardinality.min()) {
                    diagnostic = Diagnostic.of(severity,
                                               DiagnosticCode.CARDINALITY_VIOLATION,
                                               "'" + name + "' occurs " + count + " times, at least " + cardinality.min()
                                               + " required",
                                               anchor);
                } else {
                    diagnostic = Diagnostic.of(severity,
                                               DiagnosticCode.CARDINALITY_VIOLATION,
                                               "'" + name + "' occurs " + count + " times, at most "
                                               + cardinality.maxText() + " allowed",
                                               excess[i].span());
                }
                out.add(diagnostic.withDetail("key", name)
                                  .withDetail("count", count)
                                  .withDetail("min", cardinality.min())
                                  .withDetail("max", cardinality.maxText())
                                  .withNote("rule declared at " + rule.site()));
            }
        }
    }
}
