package org.clausewitz.cwt.tree;

import java.util.List;
import java.util.Optional;

/**
 * Script syntax tree node. The variant set is closed; consumers dispatch with {@code instanceof}
 * patterns over the records.
 *
 * <p>Values are untyped at this level: numbers, dates, booleans and identifiers are all
 * {@link Scalar}s. Their meaning is decided by the schema during validation.
 */
public sealed interface AstNode {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * Brace block with {@code key op value} entries. Keys may repeat and order is preserved.
     *
     * @param span         Span from the opening to the closing brace (the whole buffer for a file root)
     * @param entries      Assignments in source order
     * @param values       Bare values found in a block that also holds entries
     * @param conditionals {@code [[PARAM] ... ]} sections, whose entries do not belong to this block
     */
    record Block(SourceSpan span, List<Entry> entries, List<AstNode> values, List<Conditional> conditionals)
        implements AstNode {
        public Block {
            entries = List.copyOf(entries);
            values = List.copyOf(values);
            conditionals = List.copyOf(conditionals);
        }

        public Block(SourceSpan span, List<Entry> entries, List<AstNode> values) {
            this(span, entries, values, List.of());
        }

        public static Block empty(SourceSpan span) {
            return new Block(span, List.of(), List.of());
        }

        /**
         * All entries whose key matches case-insensitively, in source order.
         */
        public List<Entry> entries(String key) {
            var folded = Names.folded(key);
            return entries.stream()
                          .filter(e -> e.key()
                                        .folded() == folded)
                          .toList();
        }

        public Optional<Entry> first(String key) {
            var folded = Names.folded(key);
            return entries.stream()
                          .filter(e -> e.key()
                                        .folded() == folded)
                          .findFirst();
        }

        public boolean has(String key) {
            return first(key).isPresent();
        }

        public boolean isEmpty() {
            return entries.isEmpty() && values.isEmpty() && conditionals.isEmpty();
        }
    }

    /**
     * Section of a scripted effect or trigger that only applies when a parameter is passed,
     * {@code [[PARAM] ... ]}, or when it is not, {@code [[!PARAM] ... ]}.
     *
     * @param span      From {@code [[} to the closing {@code ]}
     * @param parameter Parameter name without the {@code !}
     * @param negated   Whether the section applies when the parameter is absent
     * @param body      The section's entries, values and nested sections
     */
    record Conditional(SourceSpan span, String parameter, boolean negated, Block body) implements AstNode {
        public Conditional {
            parameter = Names.intern(parameter);
        }

        /**
         * The header as written, e.g. {@code [[!HAS_Y]}.
         */
        public String header() {
            return "[[" + (negated ? "!" : "") + parameter + "]";
        }
    }

    /**
     * Any single token value: identifier, number, date, boolean or quoted string.
     */
    record Scalar(SourceSpan span, String text, boolean quoted) implements AstNode {
        public Scalar {
            text = Names.intern(text);
        }

        public String folded() {
            return Names.folded(text);
        }
    }

    /**
     * Brace block holding only bare values, e.g. {@code { a b c }} or the colour form
     * {@code rgb { 255 0 0 }} where {@code tag} is {@code rgb}.
     */
    record Array(SourceSpan span, Optional<String> tag, List<AstNode> elements) implements AstNode {
        public Array {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Indirect value resolved outside the file: scripted variables, inline maths and parameters.
     */
    record Reference(SourceSpan span, ReferenceKind kind, String name) implements AstNode {
        public Reference {
            name = Names.intern(name);
        }
    }

    enum ReferenceKind {
        /** {@code @name} */
        VARIABLE,
        /** {@code @[ expression ]} */
        INLINE_MATH,
        /** {@code $NAME$} */
        PARAMETER
    }

    /**
     * Structural equality that ignores spans and whitespace but respects order and operators.
     * Scalar comparison ignores quoting, so {@code "abc"} and {@code abc} are equal.
     */
    static boolean structurallyEqual(AstNode a, AstNode b) {
        if (a instanceof Scalar sa && b instanceof Scalar sb) {
            return sa.text()
                     .equals(sb.text());
        }
        if (a instanceof Reference ra && b instanceof Reference rb) {
            return ra.kind() == rb.kind() && ra.name()
                                               .equals(rb.name());
        }
        if (a instanceof Array aa && b instanceof Array ab) {
            return aa.tag()
                     .equals(ab.tag()) && listsEqual(aa.elements(), ab.elements());
        }
        if (a instanceof Conditional ca && b instanceof Conditional cb) {
            return ca.negated() == cb.negated() && ca.parameter()
                                                     .equals(cb.parameter()) && structurallyEqual(ca.body(), cb.body());
        }
        if (a instanceof Block ba && b instanceof Block bb) {
            if (ba.conditionals()
                  .size() != bb.conditionals()
                               .size()) {
                return false;
            }
            for (int i = 0; i < ba.conditionals()
                                  .size(); i++) {
                if (!structurallyEqual(ba.conditionals()
                                         .get(i),
                                       bb.conditionals()
                                         .get(i))) {
                    return false;
                }
            }
            if (ba.entries()
                  .size() != bb.entries()
                               .size()) {
                return false;
            }
            for (int i = 0; i < ba.entries()
                                  .size(); i++) {
                var ea = ba.entries()
                           .get(i);
                var eb = bb.entries()
                           .get(i);
                if (ea.key()
                      .folded() != eb.key()
                                     .folded() || ea.operator() != eb.operator() || !structurallyEqual(ea.value(),
                                                                                                       eb.value())) {
                    return false;
                }
            }
            return listsEqual(ba.values(), bb.values());
        }
        return false;
    }

    private static boolean listsEqual(List<AstNode> a, List<AstNode> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!structurallyEqual(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }
}
