package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.clausewitz.cwt.tree.Names;
import org.clausewitz.cwt.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Set of literals declared as {@code enum[name] = { a b c }}.
 *
 * <p>A {@code complex_enum[name]} has its members collected from script files rather than listed
 * in the schema; {@link #source()} says where. Collected members live in the workspace symbol
 * index, so {@link #contains} only answers for the members written in the schema.
 *
 * @param values  Members as written, in declaration order
 * @param members Folded members for membership tests
 */
public record EnumDefinition(
    String name,
    List<String> values,
    Set<String> members,
    Optional<ComplexEnumSource> source,
    SourceSpan span,
    String origin
) {
    public EnumDefinition {
        values = ImmutableList.copyOf(values);
        members = ImmutableSet.copyOf(members);
    }

    public static EnumDefinition closed(String name, List<String> values, SourceSpan span, String origin) {
        return new EnumDefinition(name, values, fold(values), Optional.empty(), span, origin);
    }

    public static EnumDefinition complex(String name, ComplexEnumSource source, SourceSpan span, String origin) {
        return new EnumDefinition(name, List.of(), Set.of(), Optional.of(source), span, origin);
    }

    public boolean isComplex() {
        return source.isPresent();
    }

    public boolean contains(String value) {
        return members.contains(Names.folded(value));
    }

    /**
     * Union of two declarations of the same enum, possibly from different files. The first
     * collection source wins.
     */
    public EnumDefinition merge(EnumDefinition other) {
        var merged = new ArrayList<>(values);
        merged.addAll(other.values);
        return new EnumDefinition(name,
                                  merged,
                                  fold(merged),
                                  source.isPresent()
                                  ? source
                                  : other.source,
                                  span,
                                  origin);
    }

    private static Set<String> fold(List<String> values) {
        return values.stream()
                     .map(Names::folded)
                     .collect(ImmutableSet.toImmutableSet());
    }
}
