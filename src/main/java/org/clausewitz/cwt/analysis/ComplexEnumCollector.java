package org.clausewitz.cwt.analysis;

import org.clausewitz.cwt.schema.ComplexEnumSource;
import org.clausewitz.cwt.schema.EnumDefinition;
import org.clausewitz.cwt.schema.KeySpec;
import org.clausewitz.cwt.schema.SchemaRule;
import org.clausewitz.cwt.schema.SimpleType;
import org.clausewitz.cwt.schema.ValueSpec;
import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.Entry;
import org.clausewitz.cwt.tree.Key;
import org.clausewitz.cwt.tree.Names;
import org.clausewitz.cwt.tree.SourceSpan;
import org.clausewitz.cwt.validate.SymbolLookup;

import java.util.List;

/**
 * Gathers the members of a {@code complex_enum} from one script file by following the enum's
 * {@code name} structure down to each {@code enum_name} marker.
 */
final class ComplexEnumCollector {
    private final String namespace;
    private final String path;
    private final List<SymbolLocation> out;

    private ComplexEnumCollector(EnumDefinition definition, String path, List<SymbolLocation> out) {
        this.namespace = SymbolLookup.enumNamespace(definition.name());
        this.path = path;
        this.out = out;
    }

    /**
     * Add the members {@code root} contributes to {@code definition}, if the file lies under one of
     * its source paths.
     */
    static void collect(EnumDefinition definition, String path, AstNode.Block root, List<SymbolLocation> out) {
        if (definition.source()
                      .isEmpty()) {
            return;
        }
        var source = definition.source()
                               .get();
        if (!source.matchesPath(path)) {
            return;
        }
        var collector = new ComplexEnumCollector(definition, path, out);
        if (source.startFromRoot()) {
            collector.walk(root, source.nameStructure());
            return;
        }
        for (var entry : root.entries()) {
            collector.walk(entry.value(), source.nameStructure());
        }
    }

    private void walk(AstNode node, ValueSpec.Block structure) {
        List<Entry> entries;
        List<AstNode> values;
        if (node instanceof AstNode.Block block) {
            entries = block.entries();
            values = block.values();
        } else if (node instanceof AstNode.Array array && array.tag()
                                                               .isEmpty()) {
            entries = List.of();
            values = array.elements();
        } else {
            return;
        }
        for (var spec : structure.values()) {
            if (isEnumName(spec)) {
                for (var value : values) {
                    if (value instanceof AstNode.Scalar scalar) {
                        add(scalar.text(), scalar.span());
                    }
                }
            }
        }
        for (var rule : structure.rules()) {
            if (rule.key() instanceof KeySpec.Literal literal && literal.folded()
                                                                        .equals(ComplexEnumSource.ENUM_NAME)) {
                entries.forEach(entry -> add(entry.key()
                                                  .text(),
                                             entry.key()
                                                  .span()));
                continue;
            }
            for (var entry : entries) {
                if (!matches(rule, entry.key())) {
                    continue;
                }
                if (isEnumName(rule.value()) && entry.value() instanceof AstNode.Scalar scalar) {
                    add(scalar.text(), scalar.span());
                } else if (rule.value() instanceof ValueSpec.Block inner) {
                    walk(entry.value(), inner);
                }
            }
        }
    }

    private static boolean matches(SchemaRule rule, Key key) {
        if (rule.key() instanceof KeySpec.Literal literal) {
            return literal.folded()
                          .equals(key.folded());
        }
        return rule.key() instanceof KeySpec.Simple simple && simple.type() == SimpleType.SCALAR;
    }

    private static boolean isEnumName(ValueSpec spec) {
        return spec instanceof ValueSpec.Literal literal && literal.folded()
                                                                   .equals(ComplexEnumSource.ENUM_NAME);
    }

    private void add(String name, SourceSpan span) {
        out.add(new SymbolLocation(namespace, Names.intern(name), path, span));
    }
}
