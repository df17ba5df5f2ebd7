package org.clausewitz.cwt.parser;

import org.clausewitz.cwt.lexer.Token;
import org.clausewitz.cwt.lexer.TokenKind;
import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.Entry;
import org.clausewitz.cwt.tree.Key;
import org.clausewitz.cwt.tree.Operator;
import org.clausewitz.cwt.tree.SourceLocation;
import org.clausewitz.cwt.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parser for Clausewitz script. Produces a root {@link AstNode.Block} for every input.
 *
 * <p>Grammar:
 * <pre>
 * file   := item* EOF
 * item   := atom OPERATOR value | atom '{' ... '}' | cond | value
 * cond   := '[[' '!'? NAME ']' item* ']'
 * value  := atom | COLOUR '{' atom* '}' | '{' item* '}'
 * atom   := IDENTIFIER | NUMBER | STRING
 * </pre>
 *
 * <p>A string missing its closing quote is reported once and kept as a quoted value running to the
 * end of its line.
 *
 * <p>On an unexpected token the parser reports one diagnostic and resynchronizes at the next
 * {@code atom OPERATOR} pair or closing brace, so one malformed line does not hide the rest of
 * the file.
 */
public final class ScriptParser {
    private static final Set<String> COLOUR_TAGS = Set.of("rgb", "hsv", "hsv360", "hex");

    private final ParsingContext ctx;
    private final String source;

    private ScriptParser(String source, ParserConfig config) {
        this.source = source;
        this.ctx = ParsingContext.create(source, config);
    }

    public static ParseResult parse(String source) {
        return parse(source, ParserConfig.DEFAULT);
    }

    public static ParseResult parse(String source, ParserConfig config) {
        return new ScriptParser(source, config).parseFile();
    }

    private ParseResult parseFile() {
        var items = new Items();
        parseItems(items, Optional.empty());
        var end = ctx.peek()
                     .span()
                     .end();
        var span = SourceSpan.of(SourceLocation.START, end.offset() >= source.length()
                                                       ? end
                                                       : endOfSource(end));
        var root = items.toBlock(span);
        return new ParseResult(root, ctx.diagnostics(), ctx.comments(), source);
    }

    private SourceLocation endOfSource(SourceLocation from) {
        // the root span always reaches the end of the buffer, even when parsing stopped early
        int line = from.line();
        int column = from.column();
        for (int i = from.offset(); i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return SourceLocation.at(line, column, source.length());
    }

    /**
     * Parse items until the token closing {@code open} (a brace or a conditional section), or until
     * end of input at file level.
     *
     * @return the closing token, if one was consumed
     */
    private Optional<Token> parseItems(Items items, Optional<Token> open) {
        boolean inConditional = open.map(t -> t.kind() == TokenKind.CONDITIONAL_OPEN)
                                    .orElse(false);
        while (!ctx.isStopped()) {
            var token = ctx.peek();
            switch (token.kind()) {
                case EOF -> {
                    open.ifPresent(this::reportUnclosed);
                    return Optional.empty();
                }
                case RBRACE -> {
                    if (inConditional) {
                        // the enclosing block ends first; leave its brace to it
                        reportUnclosed(open.get());
                        return Optional.empty();
                    }
                    if (open.isPresent()) {
                        return Optional.of(ctx.advance());
                    }
                    ctx.error("Unexpected '}' without matching '{'", token.span());
                    ctx.advance();
                }
                case CONDITIONAL_CLOSE -> {
                    if (inConditional) {
                        return Optional.of(ctx.advance());
                    }
                    ctx.error("Unexpected ']' without matching '[['", token.span());
                    ctx.advance();
                }
                case CONDITIONAL_OPEN -> items.conditionals.add(parseConditional());
                case IDENTIFIER, NUMBER, STRING, UNTERMINATED_STRING -> parseAtomItem(items);
                case LBRACE -> items.values.add(parseBraced(Optional.empty()));
                default -> {
                    ctx.error("Unexpected " + token.describe() + ", expected a key or value", token.span());
                    ctx.resynchronize();
                }
            }
        }
        return Optional.empty();
    }

    private void reportUnclosed(Token open) {
        var what = open.kind() == TokenKind.CONDITIONAL_OPEN
                   ? "'[[" + open.text() + "]'"
                   : "'{'";
        ctx.error("Unclosed " + what + " opened at " + open.span()
                                                          .start(),
                  open.span());
    }

    private AstNode.Conditional parseConditional() {
        var open = ctx.advance();
        var items = new Items();
        var close = parseItems(items, Optional.of(open));
        var end = close.map(t -> t.span()
                                  .end())
                       .orElseGet(() -> ctx.previousSpan()
                                           .end());
        var span = SourceSpan.of(open.span()
                                     .start(), end);
        var name = open.text();
        boolean negated = name.startsWith("!");
        return new AstNode.Conditional(span, negated
                                             ? name.substring(1)
                                             : name, negated, items.toBlock(span));
    }

    private void parseAtomItem(Items items) {
        var next = ctx.peek(1);
        if (next.kind() == TokenKind.OPERATOR) {
            var keyToken = atom();
            var opToken = ctx.advance();
            var operator = Operator.fromSymbol(opToken.text())
                                   .orElse(Operator.EQUALS);
            parseValue(keyToken).ifPresent(value -> items.entries.add(Entry.of(toKey(keyToken), operator, value)));
            return;
        }
        if (next.kind() == TokenKind.LBRACE) {
            var tagOrKey = atom();
            if (isColourTag(tagOrKey)) {
                items.values.add(parseBraced(Optional.of(tagOrKey)));
                return;
            }
            // "key { ... }" with the '=' omitted is accepted by the game
            var value = parseBraced(Optional.empty());
            items.entries.add(Entry.of(toKey(tagOrKey), Operator.EQUALS, value));
            return;
        }
        items.values.add(toValue(atom()));
    }

    private Token atom() {
        var token = ctx.advance();
        if (token.kind() == TokenKind.UNTERMINATED_STRING) {
            ctx.error("Unterminated string", token.span());
        }
        return token;
    }

    private Optional<AstNode> parseValue(Token keyToken) {
        var token = ctx.peek();
        if (token.kind()
                 .isAtom()) {
            var atom = atom();
            if (isColourTag(atom) && ctx.check(TokenKind.LBRACE)) {
                return Optional.of(parseBraced(Optional.of(atom)));
            }
            return Optional.of(toValue(atom));
        }
        if (token.kind() == TokenKind.LBRACE) {
            return Optional.of(parseBraced(Optional.empty()));
        }
        ctx.error("Expected a value after '" + keyToken.text() + "', found " + token.describe(), token.span());
        if (token.kind() != TokenKind.RBRACE && token.kind() != TokenKind.EOF
            && token.kind() != TokenKind.CONDITIONAL_CLOSE) {
            ctx.resynchronize();
        }
        return Optional.empty();
    }

    /**
     * Parse {@code '{' item* '}'}. A block holding only bare values becomes an {@link AstNode.Array};
     * a colour tag always produces an array.
     */
    private AstNode parseBraced(Optional<Token> tag) {
        var open = ctx.advance();
        var items = new Items();
        var close = parseItems(items, Optional.of(open));
        var start = tag.map(t -> t.span()
                                  .start())
                       .orElse(open.span()
                                   .start());
        var end = close.map(t -> t.span()
                                  .end())
                       .orElseGet(() -> ctx.previousSpan()
                                           .end());
        var span = SourceSpan.of(start, end);
        if (tag.isPresent() || (items.entries.isEmpty() && items.conditionals.isEmpty() && !items.values.isEmpty())) {
            return new AstNode.Array(span, tag.map(Token::text), items.values);
        }
        return items.toBlock(span);
    }

    private static boolean isColourTag(Token token) {
        return token.kind() == TokenKind.IDENTIFIER && COLOUR_TAGS.contains(token.text());
    }

    private static Key toKey(Token token) {
        return Key.of(token.text(), token.kind()
                                         .isString(), token.span());
    }

    private static AstNode toValue(Token token) {
        var text = token.text();
        if (token.kind()
                 .isString()) {
            return new AstNode.Scalar(token.span(), text, true);
        }
        if (text.startsWith("@[") && text.endsWith("]")) {
            return new AstNode.Reference(token.span(),
                                         AstNode.ReferenceKind.INLINE_MATH,
                                         text.substring(2, text.length() - 1));
        }
        if (text.length() > 1 && text.charAt(0) == '@') {
            return new AstNode.Reference(token.span(), AstNode.ReferenceKind.VARIABLE, text.substring(1));
        }
        if (text.length() > 2 && text.charAt(0) == '$' && text.charAt(text.length() - 1) == '$') {
            return new AstNode.Reference(token.span(),
                                         AstNode.ReferenceKind.PARAMETER,
                                         text.substring(1, text.length() - 1));
        }
        return new AstNode.Scalar(token.span(), text, false);
    }

    private static final class Items {
        private final List<Entry> entries = new ArrayList<>();
        private final List<AstNode> values = new ArrayList<>();
        private final List<AstNode.Conditional> conditionals = new ArrayList<>();

        AstNode.Block toBlock(SourceSpan span) {
            return new AstNode.Block(span, entries, values, conditionals);
        }
    }
}
