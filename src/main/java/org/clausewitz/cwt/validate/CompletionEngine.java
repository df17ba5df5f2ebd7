package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.schema.KeySpec;
import org.clausewitz.cwt.schema.LinkDefinition;
import org.clausewitz.cwt.schema.Schema;
import org.clausewitz.cwt.schema.SchemaRule;
import org.clausewitz.cwt.schema.SchemaType;
import org.clausewitz.cwt.schema.SimpleType;
import org.clausewitz.cwt.schema.ValueSpec;
import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.Entry;
import org.clausewitz.cwt.tree.Key;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Proposes keys and values at a cursor position inside a definition.
 *
 * <p>The cursor is located by walking down from the definition block through the entries whose
 * braces enclose it, following the matching rules. In key position the proposals are the keys the
 * rules still allow; in value position they are the literal, enum, boolean and reference values
 * the entry's rules accept.
 */
public final class CompletionEngine {
    private static final List<String> SCOPE_KEYWORDS = List.of(ScopeContext.THIS,
                                                               ScopeContext.ROOT,
                                                               ScopeContext.FROM,
                                                               ScopeContext.FROMFROM,
                                                               ScopeContext.PREV,
                                                               ScopeContext.PREVPREV);
    private static final int MAX_ALIAS_HOPS = 16;

    private final Schema schema;
    private final SymbolLookup symbols;

    public CompletionEngine(Schema schema, SymbolLookup symbols) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.symbols = Objects.requireNonNull(symbols, "symbols");
    }

    /**
     * Proposals at {@code offset} of a file, or none when the cursor is outside every definition.
     */
    public List<CompletionCandidate> complete(AstNode.Block root, String relativePath, int offset) {
        for (var type : schema.typesForPath(relativePath)) {
            if (!schema.isShaped(type.name())) {
                continue;
            }
            for (var definition : type.definitions(root)) {
                if (definition.value() instanceof AstNode.Block && strictlyInside(definition.value(), offset)) {
                    return completeIn(type, definition, offset);
                }
            }
        }
        return List.of();
    }

    private List<CompletionCandidate> completeIn(SchemaType type, Entry definition, int offset) {
        var subtypes = SubtypeMatcher.matching(type, definition);
        var block = (AstNode.Block) definition.value();
        List<SchemaRule> rules = type.rules();
        while (true) {
            var section = conditionalAt(block, offset);
            if (section != null) {
                // a conditional section takes the rules of the block around it
                block = section.body();
                continue;
            }
            var ruleSet = RuleSet.forBlock(rules, subtypes);
            var at = entryAt(block, offset);
            if (at == null || offset <= at.key()
                                          .span()
                                          .end()
                                          .offset()) {
                return keyCandidates(ruleSet, block);
            }
            var values = new ArrayList<ValueSpec>();
            for (var rule : rulesFor(ruleSet, at.key())) {
                resolve(rule.value(), at.key(), values, 0);
            }
            var value = at.value();
            if (!(value instanceof AstNode.Block || value instanceof AstNode.Array) || !strictlyInside(value, offset)) {
                return valueCandidates(values);
            }
            var nested = values.stream()
                               .filter(ValueSpec.Block.class::isInstance)
                               .map(ValueSpec.Block.class::cast)
                               .findFirst();
            if (nested.isEmpty()) {
                return List.of();
            }
            if (value instanceof AstNode.Block inner) {
                block = inner;
            } else {
                // a list of bare values proposes the values its rules allow
                return valueCandidates(nested.get()
                                             .values());
            }
            rules = nested.get()
                          .rules();
        }
    }

    private static boolean strictlyInside(AstNode node, int offset) {
        var span = node.span();
        return offset > span.start()
                            .offset() && offset < span.end()
                                                      .offset();
    }

    private static Entry entryAt(AstNode.Block block, int offset) {
        for (var entry : block.entries()) {
            if (entry.span()
                     .containsOffset(offset)) {
                return entry;
            }
        }
        return null;
    }

    private static AstNode.Conditional conditionalAt(AstNode.Block block, int offset) {
        for (var conditional : block.conditionals()) {
            if (strictlyInside(conditional, offset)) {
                return conditional;
            }
        }
        return null;
    }

    private List<SchemaRule> rulesFor(RuleSet ruleSet, Key key) {
        int index = ruleSet.literal(key.folded());
        if (index >= 0) {
            return ruleSet.group(index)
                          .alternatives();
        }
        for (int pattern : ruleSet.patterns()) {
            var group = ruleSet.group(pattern);
            if (group.key() instanceof KeySpec.AliasName slot) {
                var named = schema.aliases()
                                  .expand(slot.category(), group.first())
                                  .named(key.folded());
                if (!named.isEmpty()) {
                    return named;
                }
            } else if (KeyMatcher.matches(group.key(), key, schema, symbols)) {
                return group.alternatives();
            }
        }
        return List.of();
    }

    // single aliases and alias_match_left stand for the values they name
    private void resolve(ValueSpec spec, Key key, List<ValueSpec> out, int hops) {
        if (hops > MAX_ALIAS_HOPS) {
            return;
        }
        if (spec instanceof ValueSpec.SingleAliasRef ref) {
            schema.singleAlias(ref.name())
                  .ifPresent(single -> resolve(single.value(), key, out, hops + 1));
        } else if (spec instanceof ValueSpec.AliasMatchLeft left) {
            for (var member : schema.aliases()
                                    .expand(left.category())
                                    .named(key.folded())) {
                resolve(member.value(), key, out, hops + 1);
            }
        } else {
            out.add(spec);
        }
    }

    private List<CompletionCandidate> keyCandidates(RuleSet ruleSet, AstNode.Block block) {
        var out = new LinkedHashMap<String, CompletionCandidate>();
        for (var group : ruleSet.groups()) {
            var key = group.key();
            var first = group.first();
            if (key instanceof KeySpec.Literal literal) {
                if (block.entries(literal.text())
                         .size() < group.cardinality()
                                        .max()) {
                    out.putIfAbsent(literal.text(),
                                    CompletionCandidate.key(literal.text(),
                                                            first.value()
                                                                 .describe(),
                                                            first.options()
                                                                 .documentation()));
                }
            } else if (key instanceof KeySpec.AliasName slot) {
                for (var member : schema.aliasMembers(slot.category())) {
                    if (member.name() instanceof KeySpec.Literal name) {
                        out.putIfAbsent(name.text(),
                                        CompletionCandidate.key(name.text(),
                                                                slot.category(),
                                                                member.options()
                                                                      .documentation()));
                    }
                }
            } else {
                for (var label : labels(key)) {
                    out.putIfAbsent(label, CompletionCandidate.key(label, key.describe(), first.options()
                                                                                             .documentation()));
                }
            }
        }
        return List.copyOf(out.values());
    }

    private List<String> labels(KeySpec key) {
        if (key instanceof KeySpec.EnumRef ref) {
            return enumValues(ref.name());
        }
        if (key instanceof KeySpec.TypeRef ref) {
            return typeNames(ref.type(), ref.prefix(), ref.suffix());
        }
        if (key instanceof KeySpec.ScopeRef) {
            return scopeLabels();
        }
        if (key instanceof KeySpec.DynamicValue dynamic && !dynamic.declares()) {
            return valueSetMembers(dynamic.name());
        }
        return List.of();
    }

    private List<CompletionCandidate> valueCandidates(List<ValueSpec> specs) {
        var out = new LinkedHashMap<String, CompletionCandidate>();
        for (var spec : specs) {
            for (var label : labels(spec)) {
                out.putIfAbsent(label, CompletionCandidate.value(label, spec.describe()));
            }
        }
        return List.copyOf(out.values());
    }

    private List<String> labels(ValueSpec spec) {
        if (spec instanceof ValueSpec.Literal literal) {
            return List.of(literal.text());
        }
        if (spec instanceof ValueSpec.Simple simple && simple.type() == SimpleType.BOOL) {
            return List.of("yes", "no");
        }
        if (spec instanceof ValueSpec.EnumRef ref) {
            return enumValues(ref.name());
        }
        if (spec instanceof ValueSpec.TypeRef ref) {
            return typeNames(ref.type(), ref.prefix(), ref.suffix());
        }
        if (spec instanceof ValueSpec.ScopeRef) {
            return scopeLabels();
        }
        if (spec instanceof ValueSpec.DynamicValue dynamic && !dynamic.declares()) {
            return valueSetMembers(dynamic.name());
        }
        return List.of();
    }

    private List<String> enumValues(String name) {
        var definition = schema.enumDefinition(name);
        if (definition.isEmpty()) {
            return List.of();
        }
        var values = new LinkedHashSet<>(definition.get()
                                                   .values());
        if (definition.get()
                      .isComplex()) {
            symbols.names(SymbolLookup.enumNamespace(name))
                   .stream()
                   .sorted()
                   .forEach(values::add);
        }
        return List.copyOf(values);
    }

    // keywords first, then the links that take no data
    private List<String> scopeLabels() {
        var labels = new ArrayList<>(SCOPE_KEYWORDS);
        schema.links()
              .stream()
              .filter(link -> !link.fromData())
              .map(LinkDefinition::name)
              .sorted()
              .forEach(labels::add);
        return labels;
    }

    private List<String> valueSetMembers(String name) {
        return symbols.names(SymbolLookup.valueSetNamespace(name))
                      .stream()
                      .distinct()
                      .sorted()
                      .toList();
    }

    private List<String> typeNames(String type, String prefix, String suffix) {
        return symbols.names(type)
                      .stream()
                      .sorted()
                      .map(name -> prefix + name + suffix)
                      .toList();
    }
}
