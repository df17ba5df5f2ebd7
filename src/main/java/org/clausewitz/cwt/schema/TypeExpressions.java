package org.clausewitz.cwt.schema;

import org.clausewitz.cwt.tree.Names;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the CWT type expressions written on either side of a schema rule, e.g. {@code <building>},
 * {@code enum[weekday]}, {@code int[0..10]} or {@code alias_name[trigger]}.
 *
 * <p>Quoted text is always a literal. Unquoted text that matches no expression form is a literal
 * too, so {@code potential} and {@code yes} read as exact names.
 */
final class TypeExpressions {
    private static final Pattern BRACKETED = Pattern.compile("^([a-z_]+)\\[(.*)]$");
    private static final Pattern TYPE_REFERENCE = Pattern.compile("^([^<>]*)<([^<>]+)>([^<>]*)$");

    private TypeExpressions() {}

    static KeySpec key(String text, boolean quoted) {
        if (quoted) {
            return KeySpec.Literal.of(text);
        }
        var bracketed = bracketed(text);
        if (bracketed.isPresent()) {
            var head = bracketed.get()
                                .head();
            var arg = bracketed.get()
                               .argument();
            switch (head) {
                case "subtype" -> {
                    boolean negated = arg.startsWith("!");
                    return new KeySpec.SubtypeGroup(Names.folded(negated
                                                                 ? arg.substring(1)
                                                                 : arg), negated);
                }
                case "alias_name", "alias_keys_field" -> {
                    return new KeySpec.AliasName(Names.folded(arg));
                }
                case "enum" -> {
                    return new KeySpec.EnumRef(Names.folded(arg));
                }
                case "scope", "scope_group" -> {
                    return new KeySpec.ScopeRef(Names.folded(arg));
                }
                case "value" -> {
                    return new KeySpec.DynamicValue(Names.folded(arg), false);
                }
                case "value_set" -> {
                    return new KeySpec.DynamicValue(Names.folded(arg), true);
                }
                case "int", "float" -> {
                    return new KeySpec.Simple(SimpleType.fromKeyword(head)
                                                        .orElseThrow());
                }
                default -> {
                    // not an expression form: fall through to the literal reading
                }
            }
        }
        var typeRef = TYPE_REFERENCE.matcher(text);
        if (typeRef.matches()) {
            return new KeySpec.TypeRef(Names.folded(typeRef.group(2)),
                                       Names.folded(typeRef.group(1)),
                                       Names.folded(typeRef.group(3)));
        }
        return SimpleType.fromKeyword(text)
                         .<KeySpec>map(KeySpec.Simple::new)
                         .orElseGet(() -> KeySpec.Literal.of(text));
    }

    static ValueSpec value(String text, boolean quoted) {
        if (quoted) {
            return ValueSpec.Literal.of(text);
        }
        var bracketed = bracketed(text);
        if (bracketed.isPresent()) {
            var head = bracketed.get()
                                .head();
            var arg = bracketed.get()
                               .argument();
            var simple = SimpleType.fromKeyword(head);
            if (simple.isPresent() && simple.get()
                                            .acceptsRange()) {
                var range = NumericRange.parse(arg);
                if (range.isPresent()) {
                    return new ValueSpec.Simple(simple.get(), range);
                }
            }
            switch (head) {
                case "enum" -> {
                    return new ValueSpec.EnumRef(Names.folded(arg));
                }
                case "scope", "scope_group" -> {
                    return new ValueSpec.ScopeRef(Names.folded(arg));
                }
                case "alias_match_left" -> {
                    return new ValueSpec.AliasMatchLeft(Names.folded(arg));
                }
                case "single_alias_right" -> {
                    return new ValueSpec.SingleAliasRef(Names.folded(arg));
                }
                case "value" -> {
                    return new ValueSpec.DynamicValue(Names.folded(arg), false);
                }
                case "value_set" -> {
                    return new ValueSpec.DynamicValue(Names.folded(arg), true);
                }
                case "colour" -> {
                    return new ValueSpec.Colour(Names.folded(arg));
                }
                case "icon" -> {
                    return ValueSpec.Simple.of(SimpleType.ICON);
                }
                case "filepath" -> {
                    return ValueSpec.Simple.of(SimpleType.FILEPATH);
                }
                case "alias_keys_field", "stellaris_name_format" -> {
                    return ValueSpec.Simple.of(SimpleType.SCALAR);
                }
                default -> {
                    // not an expression form
                }
            }
        }
        if (text.equals("colour_field")) {
            return new ValueSpec.Colour("any");
        }
        var typeRef = TYPE_REFERENCE.matcher(text);
        if (typeRef.matches()) {
            return new ValueSpec.TypeRef(Names.folded(typeRef.group(2)),
                                         Names.folded(typeRef.group(1)),
                                         Names.folded(typeRef.group(3)));
        }
        return SimpleType.fromKeyword(text)
                         .<ValueSpec>map(ValueSpec.Simple::of)
                         .orElseGet(() -> ValueSpec.Literal.of(text));
    }

    /**
     * Splits {@code alias[category:name]} into its category and member name.
     */
    static Optional<AliasKey> aliasKey(String text) {
        var bracketed = bracketed(text);
        if (bracketed.isEmpty() || !bracketed.get()
                                             .head()
                                             .equals("alias")) {
            return Optional.empty();
        }
        var arg = bracketed.get()
                           .argument();
        int colon = arg.indexOf(':');
        if (colon <= 0 || colon == arg.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new AliasKey(Names.folded(arg.substring(0, colon)), arg.substring(colon + 1)));
    }

    /**
     * Argument of {@code head[argument]} when {@code text} has that form with the given head.
     */
    static Optional<String> argumentOf(String text, String head) {
        return bracketed(text).filter(b -> b.head()
                                            .equals(head))
                              .map(Bracketed::argument);
    }

    private static Optional<Bracketed> bracketed(String text) {
        var matcher = BRACKETED.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Bracketed(matcher.group(1), matcher.group(2)));
    }

    record AliasKey(String category, String name) {}

    private record Bracketed(String head, String argument) {}
}
