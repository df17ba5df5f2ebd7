package org.clausewitz.cwt.schema;

import org.clausewitz.cwt.error.Diagnostic;
import org.clausewitz.cwt.error.SchemaError;
import org.clausewitz.cwt.lexer.Lexer;
import org.clausewitz.cwt.lexer.Token;
import org.clausewitz.cwt.lexer.TokenKind;
import org.clausewitz.cwt.tree.Names;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns the {@code ##} and {@code ###} comments preceding a schema rule into {@link RuleOptions}.
 *
 * <p>An option comment holds one or more {@code key}, {@code key = value} or
 * {@code key = { ... }} items, e.g. {@code ## cardinality = 0..1 scope = country}. Unknown keys
 * are ignored; malformed values of known keys are reported.
 */
final class OptionDirectives {
    private final String origin;
    private final List<SchemaError> errors;

    OptionDirectives(String origin, List<SchemaError> errors) {
        this.origin = origin;
        this.errors = errors;
    }

    RuleOptions parse(List<Token> comments) {
        var builder = new Builder();
        var docs = new ArrayList<String>();
        for (var comment : comments) {
            if (comment.kind() == TokenKind.DOC_COMMENT) {
                if (!comment.text()
                            .isEmpty()) {
                    docs.add(comment.text());
                }
            } else if (comment.kind() == TokenKind.OPTION_COMMENT) {
                parseOptionLine(comment, builder);
            }
        }
        if (!docs.isEmpty()) {
            builder.documentation = Optional.of(String.join("\n", docs));
        }
        return builder.build();
    }

    private void parseOptionLine(Token comment, Builder builder) {
        var tokens = Lexer.tokenize(comment.text());
        int i = 0;
        while (i < tokens.size() && tokens.get(i)
                                          .kind() != TokenKind.EOF) {
            var keyToken = tokens.get(i++);
            if (!keyToken.kind()
                         .isAtom()) {
                invalid(comment, keyToken.text(), "expected an option name");
                return;
            }
            var key = keyToken.text()
                              .toLowerCase(Locale.ROOT);
            boolean negated = false;
            List<String> values = List.of();
            var assignments = new LinkedHashMap<String, String>();
            if (i < tokens.size() && tokens.get(i)
                                           .kind() == TokenKind.OPERATOR) {
                var op = tokens.get(i++);
                if (op.isOperator("<") && i < tokens.size() && tokens.get(i)
                                                                     .isOperator(">")) {
                    i++;
                    negated = true;
                } else if (op.isOperator("!=")) {
                    negated = true;
                }
                if (i < tokens.size() && tokens.get(i)
                                               .kind() == TokenKind.LBRACE) {
                    var collected = new ArrayList<String>();
                    i = readBlock(tokens, i + 1, collected, assignments);
                    values = collected;
                } else if (i < tokens.size() && tokens.get(i)
                                                      .kind()
                                                      .isAtom()) {
                    values = List.of(tokens.get(i++)
                                           .text());
                } else {
                    invalid(comment, key, "missing value");
                    return;
                }
            }
            apply(comment, builder, key, negated, values, assignments);
        }
    }

    /**
     * Read {@code { a b }} or {@code { a = b c = d }} items up to the closing brace.
     *
     * @return index after the closing brace
     */
    private static int readBlock(List<Token> tokens, int start, List<String> values,
                                 LinkedHashMap<String, String> assignments) {
        int i = start;
        while (i < tokens.size()) {
            var token = tokens.get(i);
            if (token.kind() == TokenKind.RBRACE || token.kind() == TokenKind.EOF) {
                return token.kind() == TokenKind.RBRACE
                       ? i + 1
                       : i;
            }
            if (token.kind()
                     .isAtom() && i + 2 < tokens.size() && tokens.get(i + 1)
                                                                 .kind() == TokenKind.OPERATOR && tokens.get(i + 2)
                                                                                                        .kind()
                                                                                                        .isAtom()) {
                assignments.put(Names.folded(token.text()),
                                Names.folded(tokens.get(i + 2)
                                                   .text()));
                i += 3;
            } else {
                if (token.kind()
                         .isAtom()) {
                    values.add(token.text());
                }
                i++;
            }
        }
        return i;
    }

    private void apply(Token comment, Builder builder, String key, boolean negated, List<String> values,
                       LinkedHashMap<String, String> assignments) {
        switch (key) {
            case "cardinality" -> {
                var parsed = values.size() == 1
                             ? Cardinality.parse(values.get(0))
                             : Optional.<Cardinality>empty();
                if (parsed.isEmpty()) {
                    invalid(comment, key, "expected 'min..max', found '" + String.join(" ", values) + "'");
                } else {
                    builder.cardinality = parsed;
                }
            }
            case "scope" -> builder.scopes = values.stream()
                                                   .map(Names::folded)
                                                   .toList();
            case "push_scope" -> {
                if (values.size() != 1) {
                    invalid(comment, key, "expected a single scope");
                } else {
                    builder.pushScope = Optional.of(Names.folded(values.get(0)));
                }
            }
            case "replace_scope", "replace_scopes" -> {
                if (assignments.isEmpty()) {
                    invalid(comment, key, "expected '{ name = scope ... }'");
                } else {
                    builder.replaceScope.putAll(assignments);
                }
            }
            case "severity" -> {
                var severity = values.isEmpty()
                               ? Optional.<Diagnostic.Severity>empty()
                               : severity(values.get(0));
                if (severity.isEmpty()) {
                    invalid(comment, key, "expected error, warning, info or hint");
                } else {
                    builder.severity = severity;
                }
            }
            case "required" -> builder.required = true;
            case "primary" -> builder.primary = true;
            case "display_name" -> builder.displayName = values.stream()
                                                                .findFirst();
            case "starts_with" -> builder.startsWith = values.stream()
                                                              .findFirst();
            case "type_key_filter" -> builder.typeKeyFilter = Optional.of(new RuleOptions.TypeKeyFilter(values.stream()
                                                                                                              .map(Names::folded)
                                                                                                              .toList(),
                                                                                                        negated));
            default -> {
                // other directives carry editor metadata the engine does not use
            }
        }
    }

    private static Optional<Diagnostic.Severity> severity(String text) {
        for (var severity : Diagnostic.Severity.values()) {
            if (severity.display()
                        .equalsIgnoreCase(text)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    private void invalid(Token comment, String directive, String reason) {
        errors.add(new SchemaError.InvalidDirective(origin, comment.span(), directive, reason));
    }

    private static final class Builder {
        Optional<Cardinality> cardinality = Optional.empty();
        List<String> scopes = List.of();
        Optional<String> pushScope = Optional.empty();
        final LinkedHashMap<String, String> replaceScope = new LinkedHashMap<>();
        Optional<Diagnostic.Severity> severity = Optional.empty();
        boolean required;
        boolean primary;
        Optional<String> displayName = Optional.empty();
        Optional<String> startsWith = Optional.empty();
        Optional<RuleOptions.TypeKeyFilter> typeKeyFilter = Optional.empty();
        Optional<String> documentation = Optional.empty();

        RuleOptions build() {
            return new RuleOptions(cardinality,
                                   scopes,
                                   pushScope,
                                   replaceScope,
                                   severity,
                                   required,
                                   primary,
                                   displayName,
                                   startsWith,
                                   typeKeyFilter,
                                   documentation);
        }
    }
}
